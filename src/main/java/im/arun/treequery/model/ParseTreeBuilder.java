package im.arun.treequery.model;

import im.arun.treequery.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles a {@link ParseTree} in one pre-order pass. Nonterminal scopes are opened with
 * {@link #nonterminal(String)} and closed with {@link #end()}; terminals are added in
 * between. Parent indices are assigned as children are attached.
 *
 * <pre>
 * ParseTree tree = new ParseTreeBuilder()
 *     .nonterminal("NP-SUBJ")
 *         .terminal("no_et_nf_kvk", "Ása", 0, "Ása")
 *     .end()
 *     .build();
 * </pre>
 */
public class ParseTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ParseTreeBuilder.class);

    private final List<NodeRecord> records = new ArrayList<>();
    private final Deque<Integer> open = new ArrayDeque<>();
    private int lastTokenIndex = Integer.MIN_VALUE;
    private boolean built;

    public ParseTreeBuilder nonterminal(String tag) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Nonterminal tag must not be empty");
        }
        NodeRecord record = new NodeRecord();
        record.setTerminal(false);
        record.setTag(tag);
        open.push(attach(record));
        return this;
    }

    /**
     * Adds a terminal whose complete feature set is just its grammar variants.
     */
    public ParseTreeBuilder terminal(String terminalId, String text, int tokenIndex, String lemmaBase) {
        return terminal(terminalId, text, tokenIndex, lemmaBase, null);
    }

    /**
     * Adds a terminal.
     *
     * @param terminalId  {@code category[_variant]*}
     * @param text        surface text of the token
     * @param tokenIndex  index into the sentence's token sequence
     * @param lemmaBase   dictionary lemma, or null for non-word tokens
     * @param allVariants complete feature set of the word form; null means the terminal's own variants
     */
    public ParseTreeBuilder terminal(String terminalId, String text, int tokenIndex, String lemmaBase,
                                     List<String> allVariants) {
        if (tokenIndex <= lastTokenIndex) {
            throw new IllegalArgumentException(String.format(
                "Token index %d of terminal %s does not follow %d", tokenIndex, terminalId, lastTokenIndex));
        }
        lastTokenIndex = tokenIndex;

        NodeRecord record = new NodeRecord();
        record.setTerminal(true);
        record.setTerminalId(terminalId);
        record.setCategory(TreeUtils.categoryOf(terminalId));
        record.setVariants(TreeUtils.variantsOf(terminalId));
        record.setAllVariants(allVariants == null ? record.getVariants() : List.copyOf(allVariants));
        record.setTokenIndex(tokenIndex);
        record.setText(text == null ? "" : text);
        record.setLemmaBase(lemmaBase);
        int index = attach(record);
        record.setEnd(index + 1);
        return this;
    }

    /**
     * Closes the innermost open nonterminal.
     */
    public ParseTreeBuilder end() {
        if (open.isEmpty()) {
            throw new IllegalStateException("end() without an open nonterminal");
        }
        int index = open.pop();
        NodeRecord record = records.get(index);
        if (record.getChildren().isEmpty()) {
            logger.warn("Nonterminal {} at index {} has no children", record.getTag(), index);
        }
        record.setEnd(records.size());
        return this;
    }

    public ParseTree build() {
        if (built) {
            throw new IllegalStateException("Tree already built");
        }
        if (records.isEmpty()) {
            throw new IllegalStateException("No nodes added");
        }
        if (!open.isEmpty()) {
            throw new IllegalStateException(open.size() + " nonterminal(s) not closed, innermost: "
                + records.get(open.peek()).getTag());
        }
        built = true;
        return new ParseTree(records);
    }

    private int attach(NodeRecord record) {
        if (built) {
            throw new IllegalStateException("Tree already built");
        }
        int index = records.size();
        if (open.isEmpty()) {
            if (!records.isEmpty()) {
                NodeRecord root = records.get(0);
                throw new IllegalStateException("A tree has exactly one root; "
                    + (root.isTerminal() ? root.getTerminalId() : root.getTag()) + " is already complete");
            }
        } else {
            int parent = open.peek();
            record.setParent(parent);
            records.get(parent).getChildren().add(index);
        }
        records.add(record);
        return index;
    }
}
