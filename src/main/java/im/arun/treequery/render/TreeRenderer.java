package im.arun.treequery.render;

import im.arun.treequery.config.TreeQueryConfig;
import im.arun.treequery.model.Node;
import im.arun.treequery.model.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Text representations of a subtree: the indented view, the flat bracketed forms and
 * the plain or tidy sentence text.
 */
public class TreeRenderer {
    private final int indent;
    private final String branchMarker;
    private final SpacingNormalizer spacing;

    public TreeRenderer() {
        this(new TreeQueryConfig(), new DefaultSpacingNormalizer());
    }

    public TreeRenderer(TreeQueryConfig config, SpacingNormalizer spacing) {
        this.indent = config.getViewIndent();
        this.branchMarker = config.getBranchMarker();
        this.spacing = spacing;
    }

    /**
     * One node per line, e.g.
     * <pre>
     * S0
     * +-NP-SUBJ
     *   +-no_et_nf_kvk: 'Ása'
     * </pre>
     */
    public String view(Node node) {
        StringBuilder sb = new StringBuilder();
        appendView(sb, node, 0);
        return sb.toString();
    }

    private void appendView(StringBuilder sb, Node node, int depth) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        if (depth > 0) {
            sb.append(" ".repeat(indent * (depth - 1))).append(branchMarker);
        }
        if (node.isTerminal()) {
            TerminalNode terminal = node.asTerminal();
            sb.append(terminal.getTerminalId()).append(": '").append(terminal.getText()).append('\'');
        } else {
            sb.append(node.getLabel());
            for (Node child : node.children()) {
                appendView(sb, child, depth + 1);
            }
        }
    }

    /**
     * Bracketed form with grammar variants only, e.g.
     * {@code S0 NP-SUBJ no_et_nf_kvk /NP-SUBJ p /S0}.
     */
    public String flat(Node node) {
        List<String> parts = new ArrayList<>();
        appendFlat(parts, node, false);
        return String.join(" ", parts);
    }

    /**
     * Bracketed form where terminals carry their complete feature set.
     */
    public String flatWithAllVariants(Node node) {
        List<String> parts = new ArrayList<>();
        appendFlat(parts, node, true);
        return String.join(" ", parts);
    }

    private void appendFlat(List<String> parts, Node node, boolean allVariants) {
        if (node.isTerminal()) {
            TerminalNode terminal = node.asTerminal();
            if (allVariants) {
                List<String> segments = new ArrayList<>();
                segments.add(terminal.getCategory());
                segments.addAll(terminal.getAllVariants());
                parts.add(String.join("_", segments));
            } else {
                parts.add(terminal.getTerminalId());
            }
            return;
        }
        String tag = node.getLabel();
        parts.add(tag);
        for (Node child : node.children()) {
            appendFlat(parts, child, allVariants);
        }
        parts.add("/" + tag);
    }

    /**
     * Leaf texts separated by single spaces.
     */
    public String text(Node node) {
        return String.join(" ", tokenTexts(node));
    }

    /**
     * Leaf texts joined by the spacing normalizer, so punctuation attaches correctly.
     */
    public String tidyText(Node node) {
        return spacing.normalize(tokenTexts(node));
    }

    public SpacingNormalizer getSpacing() {
        return spacing;
    }

    private List<String> tokenTexts(Node node) {
        List<String> texts = new ArrayList<>();
        for (TerminalNode leaf : node.leaves()) {
            texts.add(leaf.getText());
        }
        return texts;
    }
}
