package im.arun.treequery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable parse tree stored as a flat arena of nodes in pre-order.
 * Parent links are arena indices, never object references.
 */
public final class ParseTree {
    private final List<Node> nodes;

    ParseTree(List<NodeRecord> records) {
        List<Node> built = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            NodeRecord record = records.get(i);
            if (record.isTerminal()) {
                built.add(new TerminalNode(this, i, record.getParent(), record.getEnd(), record));
            } else {
                int[] childIndices = record.getChildren().stream().mapToInt(Integer::intValue).toArray();
                built.add(new NonterminalNode(this, i, record.getParent(), childIndices, record.getEnd(),
                    record.getTag()));
            }
        }
        this.nodes = Collections.unmodifiableList(built);
    }

    public Node getRoot() {
        return nodes.get(0);
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * All nodes in pre-order, root first.
     */
    public Stream<Node> stream() {
        return nodes.stream();
    }

    public List<TerminalNode> terminals() {
        return nodes.stream()
            .filter(Node::isTerminal)
            .map(Node::asTerminal)
            .collect(Collectors.toList());
    }

    /**
     * Copies the subtree rooted at {@code node} into a new tree.
     */
    public ParseTree subtree(Node node) {
        return prune(node, n -> false);
    }

    /**
     * Copies the subtree rooted at {@code node}, leaving out every subtree whose root
     * satisfies {@code detach}. Nonterminals left without children are left out as well.
     * The root itself is never detached.
     *
     * @throws IllegalArgumentException if nothing of the subtree would remain
     */
    public ParseTree prune(Node node, Predicate<Node> detach) {
        checkOwned(node);
        if (!hasContent(node, detach)) {
            throw new IllegalArgumentException("Pruning " + node.getLabel() + " would leave an empty tree");
        }
        ParseTreeBuilder builder = new ParseTreeBuilder();
        copyInto(builder, node, detach);
        return builder.build();
    }

    private void copyInto(ParseTreeBuilder builder, Node node, Predicate<Node> detach) {
        if (node.isTerminal()) {
            TerminalNode t = node.asTerminal();
            builder.terminal(t.getTerminalId(), t.getText(), t.getTokenIndex(), t.getLemmaBase(), t.getAllVariants());
            return;
        }
        builder.nonterminal(node.asNonterminal().getTag());
        for (Node child : node.children()) {
            if (!detach.test(child) && hasContent(child, detach)) {
                copyInto(builder, child, detach);
            }
        }
        builder.end();
    }

    /**
     * Whether pruning {@code node} with {@code detach} leaves at least one terminal.
     */
    public boolean hasContent(Node node, Predicate<Node> detach) {
        if (node.isTerminal()) {
            return true;
        }
        for (Node child : node.children()) {
            if (!detach.test(child) && hasContent(child, detach)) {
                return true;
            }
        }
        return false;
    }

    private void checkOwned(Node node) {
        if (node.getTree() != this) {
            throw new IllegalArgumentException("Node " + node.getLabel() + " belongs to another tree");
        }
    }
}
