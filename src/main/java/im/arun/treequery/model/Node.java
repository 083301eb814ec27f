package im.arun.treequery.model;

import im.arun.treequery.match.TagMatcher;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * A node in a parse tree. A node is either a {@link TerminalNode} bound to a token
 * or a {@link NonterminalNode} tagged with a constituent name.
 *
 * <p>Nodes live in the flat pre-ordered arena of their {@link ParseTree}. A node knows
 * its own arena index, its parent's index and the exclusive end of its subtree, so
 * every descendant of a node has an index in {@code (index, subtreeEnd)}.
 * Nodes are immutable and safe to share between threads.
 */
public abstract class Node {
    private final ParseTree tree;
    private final int index;
    private final int parentIndex;
    private final int[] childIndices;
    private final int subtreeEnd;

    Node(ParseTree tree, int index, int parentIndex, int[] childIndices, int subtreeEnd) {
        this.tree = tree;
        this.index = index;
        this.parentIndex = parentIndex;
        this.childIndices = childIndices;
        this.subtreeEnd = subtreeEnd;
    }

    public abstract boolean isTerminal();

    /**
     * Tag for nonterminals, terminal identifier for terminals.
     */
    public abstract String getLabel();

    public ParseTree getTree() {
        return tree;
    }

    public int getIndex() {
        return index;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    /**
     * Exclusive arena index where this node's subtree ends.
     */
    public int getSubtreeEnd() {
        return subtreeEnd;
    }

    public TerminalNode asTerminal() {
        if (!isTerminal()) {
            throw new IllegalStateException("Not a terminal: " + getLabel());
        }
        return (TerminalNode) this;
    }

    public NonterminalNode asNonterminal() {
        if (isTerminal()) {
            throw new IllegalStateException("Not a nonterminal: " + getLabel());
        }
        return (NonterminalNode) this;
    }

    public Optional<NonterminalNode> getParent() {
        if (parentIndex < 0) {
            return Optional.empty();
        }
        return Optional.of(tree.node(parentIndex).asNonterminal());
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    public Node getRoot() {
        Node current = this;
        while (!current.isRoot()) {
            current = tree.node(current.parentIndex);
        }
        return current;
    }

    /**
     * True if this node lies strictly inside the subtree of {@code ancestor}.
     */
    public boolean isDescendantOf(Node ancestor) {
        return ancestor.tree == tree && index > ancestor.index && index < ancestor.subtreeEnd;
    }

    public int childCount() {
        return childIndices.length;
    }

    /**
     * Immediate children in source order. The list is a read-only view over the arena.
     */
    public List<Node> children() {
        return new AbstractList<Node>() {
            @Override
            public Node get(int i) {
                return child(i);
            }

            @Override
            public int size() {
                return childIndices.length;
            }
        };
    }

    /**
     * Returns the i-th child (0-based).
     *
     * @throws IndexOutOfBoundsException if there is no such child
     */
    public Node child(int i) {
        if (i < 0 || i >= childIndices.length) {
            throw new IndexOutOfBoundsException(String.format(
                "Child index %d out of range for %s with %d children", i, getLabel(), childIndices.length));
        }
        return tree.node(childIndices[i]);
    }

    /**
     * Returns the first child whose tag matches {@code identifier}. Underscores and hyphens
     * are interchangeable, so {@code child("NP_SUBJ")} finds an {@code NP-SUBJ} child.
     *
     * @throws NoSuchChildException if no child matches
     */
    public NonterminalNode child(String identifier) {
        return findChild(identifier)
            .orElseThrow(() -> new NoSuchChildException(identifier, getLabel()));
    }

    public Optional<NonterminalNode> findChild(String identifier) {
        for (int childIndex : childIndices) {
            Node candidate = tree.node(childIndex);
            if (!candidate.isTerminal()
                    && TagMatcher.matchesName(((NonterminalNode) candidate).getTag(), identifier)) {
                return Optional.of((NonterminalNode) candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Follows a chain of tag lookups, e.g. {@code path("S-MAIN", "IP", "NP-SUBJ")}.
     */
    public Node path(String... identifiers) {
        Node current = this;
        for (String identifier : identifiers) {
            current = current.child(identifier);
        }
        return current;
    }

    /**
     * All descendants in pre-order, this node excluded. Each call to
     * {@code iterator()} starts a fresh traversal.
     */
    public Iterable<Node> descendants() {
        return () -> new RangeIterator(index + 1, subtreeEnd);
    }

    /**
     * All terminals of this subtree from left to right. A terminal is its own single leaf.
     */
    public Iterable<TerminalNode> leaves() {
        return () -> new LeafIterator(index, subtreeEnd);
    }

    public int leafCount() {
        int count = 0;
        for (int i = index; i < subtreeEnd; i++) {
            if (tree.node(i).isTerminal()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Lowest and highest token index among the terminals of this subtree.
     *
     * @throws EmptySpanException if this is a nonterminal without children
     */
    public Span span() {
        int first = Integer.MAX_VALUE;
        int last = Integer.MIN_VALUE;
        for (TerminalNode leaf : leaves()) {
            first = Math.min(first, leaf.getTokenIndex());
            last = Math.max(last, leaf.getTokenIndex());
        }
        if (first == Integer.MAX_VALUE) {
            throw new EmptySpanException("Nonterminal " + getLabel() + " at index " + index + " has no children");
        }
        return new Span(first, last);
    }

    @Override
    public String toString() {
        return getLabel();
    }

    private class RangeIterator implements Iterator<Node> {
        private int next;
        private final int end;

        RangeIterator(int start, int end) {
            this.next = start;
            this.end = end;
        }

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        public Node next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return tree.node(next++);
        }
    }

    private class LeafIterator implements Iterator<TerminalNode> {
        private int next;
        private final int end;

        LeafIterator(int start, int end) {
            this.next = start;
            this.end = end;
            advance();
        }

        private void advance() {
            while (next < end && !tree.node(next).isTerminal()) {
                next++;
            }
        }

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        public TerminalNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TerminalNode leaf = (TerminalNode) tree.node(next++);
            advance();
            return leaf;
        }
    }
}
