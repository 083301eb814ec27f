package im.arun.treequery.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A sentence as the parser writes it: raw tokens plus the best tree, or the index of
 * the offending token when parsing failed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedSentence {

    @JsonProperty("tokens")
    private List<String> tokens;

    @JsonProperty("tree")
    private SimpleTreeNode tree;

    @JsonProperty("score")
    private Integer score;

    @JsonProperty("combinations")
    private Long combinations;

    @JsonProperty("err_index")
    private Integer errIndex;
}
