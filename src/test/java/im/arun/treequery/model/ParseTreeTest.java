package im.arun.treequery.model;

import im.arun.treequery.TestTrees;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ParseTreeTest {

    private final ParseTree tree = TestTrees.garages();

    @Test
    void storesNodesInPreOrder() {
        for (int i = 0; i < tree.size(); i++) {
            Node node = tree.node(i);
            assertEquals(i, node.getIndex());
            for (Node descendant : node.descendants()) {
                assertTrue(descendant.getIndex() > i && descendant.getIndex() < node.getSubtreeEnd());
            }
        }
    }

    @Test
    void terminalsAreLeavesOfTheRoot() {
        List<String> texts = tree.terminals().stream().map(TerminalNode::getText).collect(Collectors.toList());
        assertEquals(List.of("Bílskúrar", "bróður", "Páls", "eru", "frábærir", "bílskúrar", "."), texts);
    }

    @Test
    void subtreeIsAnIndependentCopy() {
        Node subject = tree.getRoot().path("IP", "NP-SUBJ");
        ParseTree copy = tree.subtree(subject);
        assertEquals("NP-SUBJ", copy.getRoot().getLabel());
        assertTrue(copy.getRoot().isRoot());
        assertEquals(3, copy.getRoot().leafCount());
        assertEquals(new Span(0, 2), copy.getRoot().span());
        assertEquals(tree.size(), TestTrees.garages().size());
    }

    @Test
    void pruneDropsMatchingSubtrees() {
        Node subject = tree.getRoot().path("IP", "NP-SUBJ");
        ParseTree pruned = tree.prune(subject, n -> "NP-POSS".equals(n.getLabel()));
        assertEquals(2, pruned.size());
        assertEquals("Bílskúrar", pruned.getRoot().child(0).asTerminal().getText());
        // The source is untouched
        assertEquals(3, subject.leafCount());
    }

    @Test
    void pruneDropsNonterminalsLeftEmpty() {
        Node predicate = tree.getRoot().path("IP", "VP", "NP-PRD");
        ParseTree pruned = tree.prune(predicate, n -> n.isTerminal() && "lo".equals(n.asTerminal().getCategory()));
        assertEquals(1, pruned.getRoot().childCount());
        assertTrue(pruned.getRoot().child(0).isTerminal());
    }

    @Test
    void pruneRejectsEmptyResultAndForeignNodes() {
        Node subject = tree.getRoot().path("IP", "NP-SUBJ");
        assertThrows(IllegalArgumentException.class, () -> tree.prune(subject, Node::isTerminal));
        Node foreign = TestTrees.asaSawSun().getRoot();
        assertThrows(IllegalArgumentException.class, () -> tree.subtree(foreign));
    }
}
