package im.arun.treequery.model;

import im.arun.treequery.match.TagMatcher;

/**
 * Internal node for a grammatical constituent, tagged {@code BASE[-SUB]*}, e.g. {@code NP-OBJ}.
 */
public final class NonterminalNode extends Node {
    private final String tag;
    private final String baseTag;

    NonterminalNode(ParseTree tree, int index, int parentIndex, int[] childIndices, int subtreeEnd, String tag) {
        super(tree, index, parentIndex, childIndices, subtreeEnd);
        this.tag = tag;
        this.baseTag = TagMatcher.baseOf(tag);
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public String getLabel() {
        return tag;
    }

    public String getTag() {
        return tag;
    }

    public String getBaseTag() {
        return baseTag;
    }

    public boolean matches(String identifier) {
        return TagMatcher.matches(tag, identifier);
    }
}
