package im.arun.treequery.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeQueryConfig {
    @JsonProperty("view_indent")
    private int viewIndent = 2;

    @JsonProperty("branch_marker")
    private String branchMarker = "+-";

    @JsonProperty("agreeing_phrases")
    private List<String> agreeingPhrases = new ArrayList<>(List.of("NP", "ADJP"));

    @JsonProperty("detachable_phrases")
    private List<String> detachablePhrases = new ArrayList<>(List.of("NP-POSS", "CP-REL"));

    @JsonProperty("declinable_categories")
    private List<String> declinableCategories = new ArrayList<>(List.of(
        "no", "lo", "fn", "gr", "to", "pfn", "abfn", "person", "entity", "sérnafn"));

    @JsonProperty("demonstrative_lemmas")
    private List<String> demonstrativeLemmas = new ArrayList<>(List.of("sá", "þessi", "hinn"));

    @JsonProperty("lexicon_path")
    private String lexiconPath;

    @JsonProperty("worker_threads")
    private int workerThreads = 0;
}
