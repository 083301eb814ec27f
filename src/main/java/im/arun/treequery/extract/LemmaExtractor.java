package im.arun.treequery.extract;

import im.arun.treequery.model.Node;
import im.arun.treequery.model.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lemma and word-class lists derived from a subtree, always in left-to-right token order.
 */
public final class LemmaExtractor {

    public static final String NOUN = "no";
    public static final String VERB = "so";
    public static final String PERSON = "person";
    public static final String ENTITY = "entity";
    public static final String PROPER_NAME = "sérnafn";

    private LemmaExtractor() {}

    /**
     * One lemma per terminal. Compound lemmas keep their hyphens, e.g. "loðfíla-rannsókn".
     */
    public static List<String> lemmas(Node node) {
        List<String> result = new ArrayList<>();
        for (TerminalNode leaf : node.leaves()) {
            result.add(leaf.getLemma());
        }
        return result;
    }

    public static String lemma(Node node) {
        return String.join(" ", lemmas(node));
    }

    /**
     * Like {@link #lemmas(Node)} but with compound boundaries joined, e.g. "loðfílarannsókn".
     * Hyphens that appear in the token text itself are kept.
     */
    public static List<String> plainLemmas(Node node) {
        List<String> result = new ArrayList<>();
        for (TerminalNode leaf : node.leaves()) {
            String lemma = leaf.getLemma();
            if (leaf.getLemmaBase() != null && !leaf.getText().contains("-")) {
                lemma = lemma.replace("-", "");
            }
            result.add(lemma);
        }
        return result;
    }

    public static List<String> nouns(Node node) {
        return lemmasOf(node, NOUN);
    }

    public static List<String> verbs(Node node) {
        return lemmasOf(node, VERB);
    }

    /**
     * Person names in nominative form. A name split over adjacent sibling terminals
     * comes back as one string.
     */
    public static List<String> persons(Node node) {
        return namesOf(node, PERSON);
    }

    public static List<String> entities(Node node) {
        return namesOf(node, ENTITY);
    }

    public static List<String> properNames(Node node) {
        return namesOf(node, PROPER_NAME);
    }

    private static List<String> lemmasOf(Node node, String category) {
        List<String> result = new ArrayList<>();
        for (TerminalNode leaf : node.leaves()) {
            if (category.equals(leaf.getCategory())) {
                result.add(leaf.getLemma());
            }
        }
        return result;
    }

    private static List<String> namesOf(Node node, String category) {
        List<String> result = new ArrayList<>();
        TerminalNode previous = null;
        StringBuilder current = null;
        for (TerminalNode leaf : node.leaves()) {
            if (!category.equals(leaf.getCategory())) {
                previous = null;
                continue;
            }
            String name = nominativeName(leaf);
            if (previous != null && continuesName(previous, leaf)) {
                current.append(' ').append(name);
            } else {
                if (current != null) {
                    result.add(current.toString());
                }
                current = new StringBuilder(name);
            }
            previous = leaf;
        }
        if (current != null) {
            result.add(current.toString());
        }
        return result;
    }

    private static boolean continuesName(TerminalNode previous, TerminalNode leaf) {
        return previous.getParentIndex() == leaf.getParentIndex()
            && leaf.getTokenIndex() == previous.getTokenIndex() + 1
            && leaf.getIndex() == previous.getIndex() + 1;
    }

    // The lemma of a name is its nominative form; without one the text is the best we have
    private static String nominativeName(TerminalNode leaf) {
        if (leaf.getLemmaBase() != null && !leaf.getLemmaBase().isEmpty()) {
            return leaf.getLemmaBase();
        }
        return leaf.getText();
    }
}
