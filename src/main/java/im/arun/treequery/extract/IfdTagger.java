package im.arun.treequery.extract;

import im.arun.treequery.model.Node;
import im.arun.treequery.model.TerminalNode;
import im.arun.treequery.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces tags in the style of the Icelandic Frequency Dictionary (IFD), one per raw token.
 * A terminal that covers several tokens, such as a full person name or an amount,
 * yields one tag per whitespace-separated part of its text. Word parts take the
 * terminal's own tag and numeric parts a numeral tag.
 */
public final class IfdTagger {

    private static final Map<String, String> GENDER = Map.of("kk", "k", "kvk", "v", "hk", "h");
    private static final Map<String, String> NUMBER = Map.of("et", "e", "ft", "f");
    private static final Map<String, String> CASE = Map.of("nf", "n", "þf", "o", "þgf", "þ", "ef", "e");
    private static final Map<String, String> PERSON = Map.of("p1", "1", "p2", "2", "p3", "3");

    private static final Set<String> NAME_CATEGORIES = Set.of("person", "entity", "sérnafn");
    private static final Set<String> DEMONSTRATIVES = Set.of("sá", "þessi", "hinn");
    private static final Set<String> POSSESSIVES = Set.of("minn", "þinn", "sinn", "vor");
    private static final Set<String> NUMERAL_CATEGORIES = Set.of("tala", "töl", "raðnr", "ártal", "prósenta");

    private IfdTagger() {}

    public static List<String> ifdTags(Node node) {
        List<String> tags = new ArrayList<>();
        for (TerminalNode leaf : node.leaves()) {
            tags.addAll(tagsFor(leaf));
        }
        return tags;
    }

    /**
     * Tags for the raw tokens of one terminal.
     */
    public static List<String> tagsFor(TerminalNode terminal) {
        List<String> parts = TreeUtils.splitTokens(terminal.getText());
        String tag = tag(terminal);
        List<String> tags = new ArrayList<>();
        if (parts.size() <= 1) {
            tags.add(tag);
            return tags;
        }
        boolean name = NAME_CATEGORIES.contains(terminal.getCategory());
        for (String part : parts) {
            if (name || !TreeUtils.isNumeric(part)) {
                tags.add(tag);
            } else if (lookup(CASE, terminal, null) != null) {
                // "200 krónum": the number agrees with the noun
                tags.add("tf" + gender(terminal) + number(terminal) + grammaticalCase(terminal));
            } else {
                tags.add("ta");
            }
        }
        return tags;
    }

    /**
     * The tag of a single-token terminal.
     */
    public static String tag(TerminalNode t) {
        String category = t.getCategory();
        switch (category) {
            case "no":
                return "n" + gender(t) + number(t) + grammaticalCase(t) + (t.hasVariant("gr") ? "g" : "");
            case "person":
                return "n" + gender(t) + "e" + grammaticalCase(t) + "-m";
            case "entity":
            case "sérnafn":
                return "n" + gender(t) + number(t) + grammaticalCase(t) + "-s";
            case "lo":
                return "l" + gender(t) + number(t) + grammaticalCase(t) + declension(t) + degree(t);
            case "pfn":
            case "abfn":
                return "fp" + personOrGender(t) + number(t) + grammaticalCase(t);
            case "fn":
                return pronounClass(t) + gender(t) + number(t) + grammaticalCase(t);
            case "gr":
                return "g" + gender(t) + number(t) + grammaticalCase(t);
            case "to":
                return "tf" + gender(t) + number(t) + grammaticalCase(t);
            case "so":
                return verb(t);
            case "fs":
                return "a" + grammaticalCase(t);
            case "ao":
            case "eo":
                return "aa";
            case "st":
                return "c";
            case "stt":
                return "ct";
            case "nhm":
                return "cn";
            case "uh":
                return "au";
            case "p":
                return t.getText();
            default:
                if (NUMERAL_CATEGORIES.contains(category)) {
                    return "ta";
                }
                return "x";
        }
    }

    private static String verb(TerminalNode t) {
        String voice = t.hasVariant("mm") ? "m" : "g";
        if (t.hasVariant("nh")) {
            return "sn" + voice;
        }
        if (t.hasVariant("lhþt")) {
            return "sþ" + voice + gender(t) + number(t) + grammaticalCase(t);
        }
        if (t.hasVariant("sagnb")) {
            return "ss" + voice;
        }
        if (t.hasVariant("lh") && t.hasVariant("nt")) {
            return "sl" + voice + "n";
        }
        String mood = t.hasVariant("bh") ? "b" : t.hasVariant("vh") ? "v" : "f";
        String person = lookup(PERSON, t, "3");
        String tense = t.hasVariant("þt") ? "þ" : "n";
        return "s" + mood + voice + person + number(t) + tense;
    }

    private static String pronounClass(TerminalNode t) {
        String lemma = t.getLemma();
        if (DEMONSTRATIVES.contains(lemma)) {
            return "fa";
        }
        if (POSSESSIVES.contains(lemma)) {
            return "fe";
        }
        return "fo";
    }

    private static String personOrGender(TerminalNode t) {
        if (t.hasVariant("p1")) {
            return "1";
        }
        if (t.hasVariant("p2")) {
            return "2";
        }
        return gender(t);
    }

    private static String declension(TerminalNode t) {
        if (t.hasVariant("vb") || t.hasVariant("mst")) {
            return "v";
        }
        return "s";
    }

    private static String degree(TerminalNode t) {
        if (t.hasVariant("mst")) {
            return "m";
        }
        if (t.hasVariant("est")) {
            return "e";
        }
        return "f";
    }

    private static String gender(TerminalNode t) {
        return lookup(GENDER, t, "x");
    }

    private static String number(TerminalNode t) {
        return lookup(NUMBER, t, "e");
    }

    private static String grammaticalCase(TerminalNode t) {
        return lookup(CASE, t, "n");
    }

    private static String lookup(Map<String, String> codes, TerminalNode t, String fallback) {
        for (String variant : t.getAllVariants()) {
            String code = codes.get(variant);
            if (code != null) {
                return code;
            }
        }
        for (String variant : t.getVariants()) {
            String code = codes.get(variant);
            if (code != null) {
                return code;
            }
        }
        return fallback;
    }
}
