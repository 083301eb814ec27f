package im.arun.treequery.model;

/**
 * Thrown when a nonterminal without children is asked for its token span.
 * Such a node violates the parser contract.
 */
public class EmptySpanException extends IllegalStateException {
    public EmptySpanException(String message) {
        super(message);
    }
}
