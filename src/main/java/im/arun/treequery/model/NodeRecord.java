package im.arun.treequery.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable arena slot used while a tree is being assembled.
 */
@Data
class NodeRecord {
    private boolean terminal;
    private String tag;
    private String terminalId;
    private String category;
    private List<String> variants;
    private List<String> allVariants;
    private int tokenIndex = -1;
    private String text;
    private String lemmaBase;
    private int parent = -1;
    private List<Integer> children = new ArrayList<>();
    private int end = -1;
}
