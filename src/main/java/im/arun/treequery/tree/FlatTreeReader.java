package im.arun.treequery.tree;

import im.arun.treequery.model.ParseTree;
import im.arun.treequery.model.ParseTreeBuilder;
import im.arun.treequery.util.TreeUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Reads the bracketed form written by {@code TreeRenderer.flat()}, e.g.
 * {@code S0 NP-SUBJ no_et_nf_kvk /NP-SUBJ VP so_et_p3 /VP p /S0}, back into a tree.
 * Items starting with an upper-case letter open a nonterminal, {@code /TAG} closes it,
 * and anything else is a terminal bound to the next token text.
 */
public final class FlatTreeReader {

    private FlatTreeReader() {}

    public static ParseTree read(String flat, List<String> tokens) {
        List<String> items = TreeUtils.splitTokens(flat);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Empty flat tree");
        }
        ParseTreeBuilder builder = new ParseTreeBuilder();
        Deque<String> open = new ArrayDeque<>();
        int terminals = 0;
        for (int i = 0; i < items.size(); i++) {
            String item = items.get(i);
            if (i > 0 && open.isEmpty()) {
                throw new IllegalArgumentException("Content after the root is closed: " + item);
            }
            if (item.startsWith("/")) {
                String tag = item.substring(1);
                if (open.isEmpty()) {
                    throw new IllegalArgumentException("Unbalanced closing tag " + item);
                }
                if (!open.peek().equals(tag)) {
                    throw new IllegalArgumentException("Closing tag " + item + " does not match " + open.peek());
                }
                open.pop();
                builder.end();
            } else if (Character.isUpperCase(item.codePointAt(0))) {
                open.push(item);
                builder.nonterminal(item);
            } else {
                if (terminals >= tokens.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Terminal %s has no token; only %d given", item, tokens.size()));
                }
                builder.terminal(item, tokens.get(terminals), terminals, null);
                terminals++;
            }
        }
        if (!open.isEmpty()) {
            throw new IllegalArgumentException("Unclosed nonterminal " + open.peek());
        }
        if (terminals != tokens.size()) {
            throw new IllegalArgumentException(String.format(
                "Tree has %d terminals but %d tokens were given", terminals, tokens.size()));
        }
        return builder.build();
    }
}
