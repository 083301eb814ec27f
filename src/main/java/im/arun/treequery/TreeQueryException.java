package im.arun.treequery;

/**
 * Exception thrown when parser output or lexicon data cannot be read.
 */
public class TreeQueryException extends RuntimeException {
    public TreeQueryException(String message) {
        super(message);
    }

    public TreeQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
