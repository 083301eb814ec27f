package im.arun.treequery.inflect;

import java.util.Optional;
import java.util.Set;

/**
 * Source of inflected word forms.
 */
public interface MorphologyLookup {

    /**
     * Finds the form of a word with exactly the requested features.
     *
     * @param lemma    dictionary form, hyphenated at compound boundaries
     * @param category terminal category, e.g. "no" or "lo"
     * @param features inflectional features of the wanted form, e.g. [kk, þgf, ft, gr]
     * @return the form, or empty if the word has no such form
     */
    Optional<String> lookup(String lemma, String category, Set<String> features);
}
