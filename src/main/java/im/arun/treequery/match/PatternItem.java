package im.arun.treequery.match;

import im.arun.treequery.model.Node;
import im.arun.treequery.model.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled pattern element: a predicate over a single node.
 */
abstract class PatternItem {

    abstract boolean matches(Node node);

    /**
     * Upper-case identifiers name nonterminal tags; lower-case identifiers name terminals
     * as {@code category[_variant]*}.
     */
    static final class Name extends PatternItem {
        private final String identifier;
        private final boolean nonterminal;
        private final String category;
        private final List<String> variants;

        Name(String identifier) {
            this.identifier = identifier;
            this.nonterminal = Character.isUpperCase(identifier.charAt(0));
            String[] parts = identifier.split("_");
            this.category = parts[0];
            this.variants = new ArrayList<>();
            for (int i = 1; i < parts.length; i++) {
                if (!parts[i].isEmpty()) {
                    variants.add(parts[i]);
                }
            }
        }

        @Override
        boolean matches(Node node) {
            if (nonterminal) {
                return !node.isTerminal() && TagMatcher.matches(node.asNonterminal().getTag(), identifier);
            }
            if (!node.isTerminal()) {
                return false;
            }
            TerminalNode terminal = node.asTerminal();
            if (!category.equals(terminal.getCategory())) {
                return false;
            }
            for (String variant : variants) {
                if (!terminal.hasVariant(variant)) {
                    return false;
                }
            }
            return true;
        }
    }

    static final class Any extends PatternItem {
        static final Any INSTANCE = new Any();

        @Override
        boolean matches(Node node) {
            return true;
        }
    }

    /**
     * Terminal whose token text equals the literal, ignoring case.
     */
    static final class Text extends PatternItem {
        private final String text;

        Text(String text) {
            this.text = text;
        }

        @Override
        boolean matches(Node node) {
            return node.isTerminal() && node.asTerminal().getText().equalsIgnoreCase(text);
        }
    }

    static final class Lemma extends PatternItem {
        private final String lemma;

        Lemma(String lemma) {
            this.lemma = lemma;
        }

        @Override
        boolean matches(Node node) {
            return node.isTerminal() && lemma.equals(node.asTerminal().getLemma());
        }
    }

    static final class Alternatives extends PatternItem {
        private final List<PatternItem> options;

        Alternatives(List<PatternItem> options) {
            this.options = options;
        }

        @Override
        boolean matches(Node node) {
            for (PatternItem option : options) {
                if (option.matches(node)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * {@code head > context} or {@code head >> context}.
     */
    static final class Nested extends PatternItem {
        private final PatternItem head;
        private final boolean deep;
        private final Context context;

        Nested(PatternItem head, boolean deep, Context context) {
            this.head = head;
            this.deep = deep;
            this.context = context;
        }

        @Override
        boolean matches(Node node) {
            if (!head.matches(node)) {
                return false;
            }
            List<Node> candidates = new ArrayList<>();
            if (deep) {
                node.descendants().forEach(candidates::add);
            } else {
                candidates.addAll(node.children());
            }
            return context.matches(candidates);
        }
    }

    abstract static class Context {
        abstract boolean matches(List<Node> candidates);
    }

    /**
     * {@code { A B }}: every item matches a distinct candidate, in any order.
     */
    static final class Unordered extends Context {
        private final List<PatternItem> items;

        Unordered(List<PatternItem> items) {
            this.items = items;
        }

        @Override
        boolean matches(List<Node> candidates) {
            return assign(0, candidates, new boolean[candidates.size()]);
        }

        private boolean assign(int item, List<Node> candidates, boolean[] used) {
            if (item == items.size()) {
                return true;
            }
            PatternItem current = items.get(item);
            for (int i = 0; i < candidates.size(); i++) {
                if (!used[i] && current.matches(candidates.get(i))) {
                    used[i] = true;
                    if (assign(item + 1, candidates, used)) {
                        return true;
                    }
                    used[i] = false;
                }
            }
            return false;
        }
    }

    /**
     * {@code [ A B* ... C ]}: the elements cover the candidate list completely, in order.
     */
    static final class Sequence extends Context {
        private final List<Element> elements;

        Sequence(List<Element> elements) {
            this.elements = elements;
        }

        @Override
        boolean matches(List<Node> candidates) {
            return matchFrom(0, 0, candidates);
        }

        private boolean matchFrom(int element, int start, List<Node> candidates) {
            if (element == elements.size()) {
                return start == candidates.size();
            }
            Element current = elements.get(element);
            for (int taken = 0; ; taken++) {
                if (taken >= current.min && matchFrom(element + 1, start + taken, candidates)) {
                    return true;
                }
                int next = start + taken;
                if (taken == current.max || next >= candidates.size()
                        || !current.item.matches(candidates.get(next))) {
                    return false;
                }
            }
        }
    }

    static final class Element {
        final PatternItem item;
        final int min;
        final int max;

        Element(PatternItem item, int min, int max) {
            this.item = item;
            this.min = min;
            this.max = max;
        }
    }
}
