package im.arun.treequery.match;

import im.arun.treequery.model.Node;

/**
 * A compiled structural pattern. Obtain instances from {@link PatternCompiler#compile(String)}.
 * Instances are immutable and thread-safe.
 */
public final class Pattern {
    private final String source;
    private final PatternItem root;

    Pattern(String source, PatternItem root) {
        this.source = source;
        this.root = root;
    }

    public String getSource() {
        return source;
    }

    /**
     * True if the pattern accepts {@code node} and, where the pattern says so,
     * its children or descendants.
     */
    public boolean matches(Node node) {
        return root.matches(node);
    }

    @Override
    public String toString() {
        return source;
    }
}
