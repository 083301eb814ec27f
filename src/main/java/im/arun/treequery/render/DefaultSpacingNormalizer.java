package im.arun.treequery.render;

import java.util.List;

/**
 * Spacing rules for Icelandic text: closing punctuation attaches to the preceding token,
 * opening punctuation to the following one, and a slash binds on both sides.
 */
public class DefaultSpacingNormalizer implements SpacingNormalizer {

    private static final String ATTACH_LEFT = ".,:;)]}!?%‰»”’…";
    private static final String ATTACH_RIGHT = "([{„‚«“‘";
    private static final String ATTACH_BOTH = "/";

    @Override
    public String normalize(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        boolean glueNext = true;
        for (String raw : tokens) {
            if (raw == null) {
                continue;
            }
            String token = raw.trim().replaceAll("\\s+", " ");
            if (token.isEmpty()) {
                continue;
            }
            if (!glueNext && !attachesLeft(token)) {
                sb.append(' ');
            }
            sb.append(token);
            glueNext = attachesRight(token);
        }
        return sb.toString();
    }

    private static boolean attachesLeft(String token) {
        return isPunctuation(token, ATTACH_LEFT) || isPunctuation(token, ATTACH_BOTH);
    }

    private static boolean attachesRight(String token) {
        return isPunctuation(token, ATTACH_RIGHT) || isPunctuation(token, ATTACH_BOTH);
    }

    private static boolean isPunctuation(String token, String set) {
        for (int i = 0; i < token.length(); i++) {
            if (set.indexOf(token.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
