package im.arun.treequery.match;

/**
 * Matching of nonterminal tags against identifiers. A tag {@code BASE-SUB1-SUB2} is matched
 * by the identifier {@code BASE}, by {@code BASE-SUB1} and by the full tag, but not by
 * {@code BASE-SUB2} or by anything longer than the tag.
 */
public final class TagMatcher {

    private TagMatcher() {}

    /**
     * True if {@code tag} equals {@code identifier} or starts with {@code identifier}
     * followed by a hyphen.
     */
    public static boolean matches(String tag, String identifier) {
        if (tag == null || identifier == null || identifier.isEmpty()) {
            return false;
        }
        if (tag.equals(identifier)) {
            return true;
        }
        return tag.length() > identifier.length()
            && tag.startsWith(identifier)
            && tag.charAt(identifier.length()) == '-';
    }

    /**
     * Attribute-style matching: underscores count as hyphens, so {@code NP_SUBJ}
     * matches {@code NP-SUBJ}.
     */
    public static boolean matchesName(String tag, String identifier) {
        if (tag == null || identifier == null) {
            return false;
        }
        return matches(tag.replace('_', '-'), identifier.replace('_', '-'));
    }

    /**
     * The tag up to its first hyphen, e.g. "NP" for "NP-OBJ".
     */
    public static String baseOf(String tag) {
        int hyphen = tag.indexOf('-');
        return hyphen <= 0 ? tag : tag.substring(0, hyphen);
    }
}
