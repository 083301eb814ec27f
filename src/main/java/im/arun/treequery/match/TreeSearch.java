package im.arun.treequery.match;

import im.arun.treequery.model.Node;
import im.arun.treequery.model.ParseTree;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Pattern searches over a subtree. Both {@link #allMatches} and {@link #topMatches} walk the
 * subtree in pre-order, root included; they differ only in whether the subtree of a match
 * is searched further. Results are lazy and restartable; an abandoned iteration leaves
 * nothing behind.
 */
public final class TreeSearch {

    private TreeSearch() {}

    public static boolean match(Node node, String pattern) {
        return match(node, PatternCompiler.compile(pattern));
    }

    public static boolean match(Node node, Pattern pattern) {
        return pattern.matches(node);
    }

    public static Optional<Node> firstMatch(Node node, String pattern) {
        return firstMatch(node, PatternCompiler.compile(pattern));
    }

    public static Optional<Node> firstMatch(Node node, Pattern pattern) {
        Iterator<Node> matches = search(node, pattern, true).iterator();
        return matches.hasNext() ? Optional.of(matches.next()) : Optional.empty();
    }

    /**
     * Every matching node, nested matches included.
     */
    public static Iterable<Node> allMatches(Node node, String pattern) {
        return allMatches(node, PatternCompiler.compile(pattern));
    }

    public static Iterable<Node> allMatches(Node node, Pattern pattern) {
        return search(node, pattern, false);
    }

    /**
     * Matching nodes that are not inside another match. No returned node is a
     * descendant of another returned node.
     */
    public static Iterable<Node> topMatches(Node node, String pattern) {
        return topMatches(node, PatternCompiler.compile(pattern));
    }

    public static Iterable<Node> topMatches(Node node, Pattern pattern) {
        return search(node, pattern, true);
    }

    private static Iterable<Node> search(Node node, Pattern pattern, boolean prune) {
        return () -> new MatchIterator(node, pattern, prune);
    }

    private static final class MatchIterator implements Iterator<Node> {
        private final ParseTree tree;
        private final Pattern pattern;
        private final boolean prune;
        private final int end;
        private int cursor;
        private Node pending;

        MatchIterator(Node root, Pattern pattern, boolean prune) {
            this.tree = root.getTree();
            this.pattern = pattern;
            this.prune = prune;
            this.cursor = root.getIndex();
            this.end = root.getSubtreeEnd();
        }

        @Override
        public boolean hasNext() {
            while (pending == null && cursor < end) {
                Node candidate = tree.node(cursor);
                if (pattern.matches(candidate)) {
                    pending = candidate;
                    cursor = prune ? candidate.getSubtreeEnd() : cursor + 1;
                } else {
                    cursor++;
                }
            }
            return pending != null;
        }

        @Override
        public Node next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Node result = pending;
            pending = null;
            return result;
        }
    }
}
