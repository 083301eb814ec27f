package im.arun.treequery.model;

import java.util.List;

/**
 * Leaf bound to one token. The terminal identifier has the form
 * {@code category[_variant]*}, e.g. {@code no_et_nf_kvk}.
 */
public final class TerminalNode extends Node {
    private final String terminalId;
    private final String category;
    private final List<String> variants;
    private final List<String> allVariants;
    private final int tokenIndex;
    private final String text;
    private final String lemmaBase;

    TerminalNode(ParseTree tree, int index, int parentIndex, int subtreeEnd, NodeRecord record) {
        super(tree, index, parentIndex, new int[0], subtreeEnd);
        this.terminalId = record.getTerminalId();
        this.category = record.getCategory();
        this.variants = record.getVariants();
        this.allVariants = record.getAllVariants();
        this.tokenIndex = record.getTokenIndex();
        this.text = record.getText();
        this.lemmaBase = record.getLemmaBase();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String getLabel() {
        return terminalId;
    }

    public String getTerminalId() {
        return terminalId;
    }

    public String getCategory() {
        return category;
    }

    /**
     * Variants used by the grammar rule, in terminal identifier order.
     */
    public List<String> getVariants() {
        return variants;
    }

    /**
     * Complete feature set of the matched word form, a superset of {@link #getVariants()}.
     */
    public List<String> getAllVariants() {
        return allVariants;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    public String getText() {
        return text;
    }

    public String getLemmaBase() {
        return lemmaBase;
    }

    /**
     * The lemma, falling back to the token text for non-word tokens.
     */
    public String getLemma() {
        return lemmaBase != null ? lemmaBase : text;
    }

    public boolean hasVariant(String variant) {
        return allVariants.contains(variant) || variants.contains(variant);
    }
}
