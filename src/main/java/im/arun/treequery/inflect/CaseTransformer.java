package im.arun.treequery.inflect;

import im.arun.treequery.config.TreeQueryConfig;
import im.arun.treequery.match.TagMatcher;
import im.arun.treequery.model.Node;
import im.arun.treequery.model.NonterminalNode;
import im.arun.treequery.model.TerminalNode;
import im.arun.treequery.render.TreeRenderer;
import im.arun.treequery.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites noun phrases into another case, number or definiteness.
 *
 * <p>Within a noun phrase, the terminals that agree with the phrase are those reached
 * through agreeing sub-phrases (by default plain {@code NP} and {@code ADJP}). The head
 * noun of each noun phrase takes the requested features; its modifiers take the same
 * case and number and the head's gender. Terminals under any other sub-phrase, such as
 * a possessive {@code NP-POSS} or a relative clause, keep their original form.
 *
 * <p>Word forms come from a {@link MorphologyLookup}. A word with no form for the
 * requested features keeps its original text.
 */
public class CaseTransformer {
    private static final Logger logger = LoggerFactory.getLogger(CaseTransformer.class);

    private static final String NOUN_PHRASE = "NP";
    private static final Set<String> HEAD_CATEGORIES = Set.of("no", "person", "entity", "sérnafn", "pfn", "abfn");
    private static final Set<String> NAME_CATEGORIES = Set.of("person", "entity", "sérnafn");
    private static final String NUMBER_WORD = "to";

    private final MorphologyLookup morphology;
    private final TreeRenderer renderer;
    private final List<String> agreeingPhrases;
    private final List<String> detachablePhrases;
    private final Set<String> declinableCategories;
    private final Set<String> demonstrativeLemmas;

    public CaseTransformer(TreeQueryConfig config, MorphologyLookup morphology, TreeRenderer renderer) {
        this.morphology = morphology;
        this.renderer = renderer;
        this.agreeingPhrases = List.copyOf(config.getAgreeingPhrases());
        this.detachablePhrases = List.copyOf(config.getDetachablePhrases());
        this.declinableCategories = Set.copyOf(config.getDeclinableCategories());
        this.demonstrativeLemmas = Set.copyOf(config.getDemonstrativeLemmas());
    }

    /**
     * Text of {@code node} in the requested form. Terminals are inflected on their own,
     * noun phrases as a whole; other nonterminals come back as their plain text.
     */
    public String inflect(Node node, InflectionProfile profile) {
        if (node.isTerminal()) {
            return inflectTerminal(node.asTerminal(), profile, null, true, false);
        }
        NonterminalNode nonterminal = node.asNonterminal();
        if (!NOUN_PHRASE.equals(nonterminal.getBaseTag())) {
            return renderer.text(node);
        }
        return inflectPhrase(nonterminal, profile);
    }

    public String inflect(Node node, GrammaticalCase grammaticalCase, GrammaticalNumber number,
                          Definiteness definiteness) {
        return inflect(node, InflectionProfile.of(grammaticalCase, number, definiteness));
    }

    public String nominativeNp(Node node) {
        return inflect(node, InflectionProfile.NOMINATIVE);
    }

    public String accusativeNp(Node node) {
        return inflect(node, InflectionProfile.ACCUSATIVE);
    }

    public String dativeNp(Node node) {
        return inflect(node, InflectionProfile.DATIVE);
    }

    public String genitiveNp(Node node) {
        return inflect(node, InflectionProfile.GENITIVE);
    }

    /**
     * Nominative without the definite article.
     */
    public String indefiniteNp(Node node) {
        return inflect(node, InflectionProfile.INDEFINITE);
    }

    /**
     * Nominative singular indefinite, reduced to the head and its agreeing modifiers.
     */
    public String canonicalNp(Node node) {
        return inflect(node, InflectionProfile.CANONICAL);
    }

    public String nominative(TerminalNode terminal) {
        return inflect(terminal, InflectionProfile.NOMINATIVE);
    }

    public String indefinite(TerminalNode terminal) {
        return inflect(terminal, InflectionProfile.INDEFINITE);
    }

    public String canonical(TerminalNode terminal) {
        return inflect(terminal, InflectionProfile.CANONICAL);
    }

    private String inflectPhrase(NonterminalNode phrase, InflectionProfile profile) {
        if (profile.isCanonical() && !phrase.getTree().hasContent(phrase, this::isDetachable)) {
            logger.debug("Nothing left of {} once detachable phrases are removed", phrase.getLabel());
            return "";
        }
        Node root = profile.isCanonical()
            ? phrase.getTree().prune(phrase, this::isDetachable).getRoot()
            : phrase;

        Map<Integer, Agreement> agreement = new HashMap<>();
        assignAgreement(root, null, agreement);
        boolean hasFreeArticle = agreement.keySet().stream()
            .map(index -> root.getTree().node(index).asTerminal())
            .anyMatch(t -> TreeUtils.ARTICLE.equals(t.getCategory()));

        TerminalNode dropped = profile.isIndefinite() ? leadingDeterminer(root, agreement) : null;

        List<String> words = new ArrayList<>();
        for (TerminalNode leaf : root.leaves()) {
            if (leaf == dropped) {
                continue;
            }
            Agreement role = agreement.get(leaf.getIndex());
            if (role == null) {
                words.add(leaf.getText());
            } else if (profile.isCanonical() && !role.head && NUMBER_WORD.equals(leaf.getCategory())) {
                // "þrír" has no singular
                continue;
            } else {
                words.add(inflectTerminal(leaf, profile, role.gender, role.head, hasFreeArticle));
            }
        }
        return renderer.getSpacing().normalize(words);
    }

    /**
     * Walks agreeing sub-phrases below {@code phrase}, recording for each reachable terminal
     * whether it heads its noun phrase and which gender it must agree with.
     */
    private void assignAgreement(Node phrase, String inheritedGender, Map<Integer, Agreement> agreement) {
        String gender = inheritedGender;
        TerminalNode head = null;
        if (NOUN_PHRASE.equals(phrase.asNonterminal().getBaseTag())) {
            head = findHead(agreeingTerminals(phrase));
            if (head != null) {
                String headGender = TreeUtils.firstOf(featuresOf(head), TreeUtils.GENDERS);
                if (headGender != null) {
                    gender = headGender;
                }
            }
        }
        for (Node child : phrase.children()) {
            if (child.isTerminal()) {
                agreement.put(child.getIndex(), new Agreement(gender, child == head));
            } else if (isAgreeing(child)) {
                assignAgreement(child, gender, agreement);
            }
        }
    }

    private List<TerminalNode> agreeingTerminals(Node phrase) {
        List<TerminalNode> result = new ArrayList<>();
        for (Node child : phrase.children()) {
            if (child.isTerminal()) {
                result.add(child.asTerminal());
            } else if (isAgreeing(child)) {
                result.addAll(agreeingTerminals(child));
            }
        }
        return result;
    }

    private TerminalNode findHead(List<TerminalNode> terminals) {
        TerminalNode fallback = null;
        for (int i = terminals.size() - 1; i >= 0; i--) {
            TerminalNode candidate = terminals.get(i);
            if (HEAD_CATEGORIES.contains(candidate.getCategory())) {
                return candidate;
            }
            if (fallback == null && declinableCategories.contains(candidate.getCategory())) {
                fallback = candidate;
            }
        }
        return fallback;
    }

    // A bare article or demonstrative opening the phrase, as in "Hið íslenska bókmenntafélag"
    private TerminalNode leadingDeterminer(Node root, Map<Integer, Agreement> agreement) {
        if (root.leafCount() < 2) {
            return null;
        }
        TerminalNode first = root.leaves().iterator().next();
        Agreement role = agreement.get(first.getIndex());
        if (role == null || role.head) {
            return null;
        }
        String category = first.getCategory();
        if (TreeUtils.ARTICLE.equals(category)) {
            return first;
        }
        if ("fn".equals(category) && demonstrativeLemmas.contains(first.getLemma().toLowerCase())) {
            return first;
        }
        return null;
    }

    private String inflectTerminal(TerminalNode terminal, InflectionProfile profile, String agreeGender,
                                   boolean head, boolean hasFreeArticle) {
        String category = terminal.getCategory();
        if (!declinableCategories.contains(category)) {
            return terminal.getText();
        }
        if (NAME_CATEGORIES.contains(category) && profile.getGrammaticalCase() == GrammaticalCase.NOMINATIVE
                && terminal.getLemmaBase() != null) {
            return terminal.getLemmaBase();
        }

        Set<String> features = featuresOf(terminal);
        if (TreeUtils.firstOf(features, TreeUtils.CASES) == null) {
            return terminal.getText();
        }
        TreeUtils.replaceIn(features, TreeUtils.CASES, profile.getGrammaticalCase().getVariant());
        if (profile.getNumber() != null) {
            TreeUtils.replaceIn(features, TreeUtils.NUMBERS, profile.getNumber().getVariant());
        }
        if (agreeGender != null && !head) {
            TreeUtils.replaceIn(features, TreeUtils.GENDERS, agreeGender);
        }
        if (profile.isIndefinite()) {
            features.remove(TreeUtils.ARTICLE);
            TreeUtils.replaceIn(features, TreeUtils.DECLENSIONS, "sb");
        } else if (profile.isDefinite()) {
            if (head && "no".equals(category) && !hasFreeArticle) {
                features.add(TreeUtils.ARTICLE);
            }
            if (!head) {
                TreeUtils.replaceIn(features, TreeUtils.DECLENSIONS, "vb");
            }
        }

        Optional<String> form = morphology.lookup(terminal.getLemma(), category, features);
        if (form.isEmpty()) {
            logger.debug("No form of {} ({}) with {}, keeping '{}'",
                terminal.getLemma(), category, features, terminal.getText());
            return terminal.getText();
        }
        return TreeUtils.imitateCase(terminal.getText(), form.get());
    }

    private Set<String> featuresOf(TerminalNode terminal) {
        Set<String> all = new LinkedHashSet<>(terminal.getAllVariants());
        all.addAll(terminal.getVariants());
        return TreeUtils.inflectionalFeatures(all);
    }

    private boolean isAgreeing(Node node) {
        if (node.isTerminal()) {
            return false;
        }
        String tag = node.asNonterminal().getTag();
        return agreeingPhrases.contains(tag);
    }

    private boolean isDetachable(Node node) {
        if (node.isTerminal()) {
            return false;
        }
        String tag = node.asNonterminal().getTag();
        for (String detachable : detachablePhrases) {
            if (TagMatcher.matches(tag, detachable)) {
                return true;
            }
        }
        return false;
    }

    private static final class Agreement {
        final String gender;
        final boolean head;

        Agreement(String gender, boolean head) {
            this.gender = gender;
            this.head = head;
        }
    }
}
