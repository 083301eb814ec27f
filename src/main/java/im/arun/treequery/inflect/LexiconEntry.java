package im.arun.treequery.inflect;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a lexicon file: {@code lemma;category;form;variants}, where variants are
 * underscore-separated, e.g. {@code bílskúr;no;bílskúrunum;kk_þgf_ft_gr}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"lemma", "category", "form", "variants"})
public class LexiconEntry {
    private String lemma;
    private String category;
    private String form;
    private String variants;
}
