package im.arun.treequery.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One node of a parse tree as the parser writes it to JSON. Nonterminals carry a tag
 * and children; all other kinds are terminals bound to a token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimpleTreeNode {
    public static final String NONTERMINAL = "NONTERMINAL";

    @JsonProperty("k")
    private String kind;

    @JsonProperty("n")
    private String tag;

    @JsonProperty("x")
    private String text;

    @JsonProperty("t")
    private String terminal;

    @JsonProperty("a")
    private String augmentedTerminal;

    @JsonProperty("s")
    private String lemma;

    @JsonProperty("ix")
    private Integer tokenIndex;

    @JsonProperty("p")
    private List<SimpleTreeNode> children;

    @JsonIgnore
    public boolean isNonterminal() {
        return NONTERMINAL.equals(kind);
    }
}
