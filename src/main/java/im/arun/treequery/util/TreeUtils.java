package im.arun.treequery.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utility methods for terminal identifiers, grammatical variants and token text.
 */
public class TreeUtils {

    public static final List<String> CASES = List.of("nf", "þf", "þgf", "ef");
    public static final List<String> GENDERS = List.of("kk", "kvk", "hk");
    public static final List<String> NUMBERS = List.of("et", "ft");
    public static final List<String> PERSONS = List.of("p1", "p2", "p3");
    public static final List<String> DEGREES = List.of("mst", "est");
    public static final List<String> DECLENSIONS = List.of("sb", "vb");
    public static final String ARTICLE = "gr";

    private static final Set<String> INFLECTIONAL;

    static {
        Set<String> features = new LinkedHashSet<>();
        features.addAll(CASES);
        features.addAll(GENDERS);
        features.addAll(NUMBERS);
        features.addAll(PERSONS);
        features.addAll(DEGREES);
        features.addAll(DECLENSIONS);
        features.add(ARTICLE);
        INFLECTIONAL = Collections.unmodifiableSet(features);
    }

    private TreeUtils() {}

    /**
     * Category part of a terminal identifier, e.g. "no" for "no_et_nf_kvk".
     */
    public static String categoryOf(String terminalId) {
        if (terminalId == null || terminalId.isEmpty()) {
            throw new IllegalArgumentException("Terminal identifier must not be empty");
        }
        int underscore = terminalId.indexOf('_');
        return underscore < 0 ? terminalId : terminalId.substring(0, underscore);
    }

    /**
     * Variant part of a terminal identifier, e.g. [et, nf, kvk] for "no_et_nf_kvk".
     */
    public static List<String> variantsOf(String terminalId) {
        String[] parts = terminalId.split("_");
        if (parts.length <= 1) {
            return List.of();
        }
        return List.of(Arrays.copyOfRange(parts, 1, parts.length));
    }

    /**
     * Keeps only the features that take part in inflection: case, gender, number,
     * person, degree, declension and the suffixed article.
     */
    public static Set<String> inflectionalFeatures(Collection<String> variants) {
        Set<String> result = new LinkedHashSet<>();
        for (String variant : variants) {
            if (INFLECTIONAL.contains(variant)) {
                result.add(variant);
            }
        }
        return result;
    }

    public static boolean isInflectional(String variant) {
        return INFLECTIONAL.contains(variant);
    }

    /**
     * First variant that belongs to {@code group}, or null if there is none.
     */
    public static String firstOf(Collection<String> variants, List<String> group) {
        for (String variant : variants) {
            if (group.contains(variant)) {
                return variant;
            }
        }
        return null;
    }

    /**
     * Replaces any member of {@code group} in {@code features} with {@code value}.
     * Does nothing if the features carry no member of the group.
     */
    public static void replaceIn(Set<String> features, List<String> group, String value) {
        boolean present = features.removeIf(group::contains);
        if (present) {
            features.add(value);
        }
    }

    /**
     * Gives {@code form} the capitalization of {@code original}: all capitals, initial
     * capital, or as is.
     */
    public static String imitateCase(String original, String form) {
        if (original == null || original.isEmpty() || form == null || form.isEmpty()) {
            return form;
        }
        if (original.length() > 1 && original.equals(original.toUpperCase()) && !original.equals(original.toLowerCase())) {
            return form.toUpperCase();
        }
        if (Character.isUpperCase(original.charAt(0)) && !Character.isUpperCase(form.charAt(0))) {
            return Character.toUpperCase(form.charAt(0)) + form.substring(1);
        }
        return form;
    }

    /**
     * True for tokens made of digits and numeric punctuation, e.g. "200", "3,8", "19.", "11:45".
     */
    public static boolean isNumeric(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        boolean digit = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isDigit(c)) {
                digit = true;
            } else if (".,:-/%".indexOf(c) < 0) {
                return false;
            }
        }
        return digit;
    }

    /**
     * Splits text on whitespace, dropping empty parts.
     */
    public static List<String> splitTokens(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        for (String part : text.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }
}
