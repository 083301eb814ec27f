package im.arun.treequery.model;

import lombok.Value;

/**
 * Inclusive range of token indices covered by a node.
 */
@Value
public class Span {
    int first;
    int last;

    public int length() {
        return last - first + 1;
    }
}
