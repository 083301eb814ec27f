package im.arun.treequery.match;

/**
 * Thrown when a pattern string is malformed. Raised at compile time, before any
 * traversal starts.
 */
public class PatternCompileException extends IllegalArgumentException {
    private final String pattern;
    private final int position;

    public PatternCompileException(String message, String pattern, int position) {
        super(String.format("%s at position %d in pattern \"%s\"", message, position, pattern));
        this.pattern = pattern;
        this.position = position;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Zero-based character offset of the offending input.
     */
    public int getPosition() {
        return position;
    }
}
