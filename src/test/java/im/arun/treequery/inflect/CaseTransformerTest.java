package im.arun.treequery.inflect;

import im.arun.treequery.TestTrees;
import im.arun.treequery.config.TreeQueryConfig;
import im.arun.treequery.model.Node;
import im.arun.treequery.model.ParseTree;
import im.arun.treequery.model.ParseTreeBuilder;
import im.arun.treequery.render.TreeRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CaseTransformerTest {

    private CaseTransformer transformer;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("test-lexicon.csv")) {
            assertNotNull(in);
            transformer = new CaseTransformer(new TreeQueryConfig(), LexiconMorphology.load(in), new TreeRenderer());
        }
    }

    @Test
    void definitePluralPhrase() {
        Node np = TestTrees.greatGarages().getRoot();
        assertEquals("Frábæru bílskúrarnir", transformer.nominativeNp(np));
        assertEquals("Frábæru bílskúrana", transformer.accusativeNp(np));
        assertEquals("Frábæru bílskúrunum", transformer.dativeNp(np));
        assertEquals("Frábæru bílskúranna", transformer.genitiveNp(np));
        assertEquals("Frábærir bílskúrar", transformer.indefiniteNp(np));
        assertEquals("Frábær bílskúr", transformer.canonicalNp(np));
    }

    @Test
    void explicitProfile() {
        Node np = TestTrees.greatGarages().getRoot();
        assertEquals("Frábæri bílskúrinn",
            transformer.inflect(np, GrammaticalCase.NOMINATIVE, GrammaticalNumber.SINGULAR, Definiteness.DEFINITE));
        assertEquals("Frábæru bílskúrana",
            transformer.inflect(np, InflectionProfile.of(GrammaticalCase.ACCUSATIVE, GrammaticalNumber.PLURAL, null)));
    }

    @Test
    void freeArticleIsDroppedWhenIndefinite() {
        Node np = TestTrees.literarySociety().getRoot();
        assertEquals("íslenskt bókmenntafélag", transformer.indefiniteNp(np));
        assertEquals("íslenskt bókmenntafélag", transformer.canonicalNp(np));
        assertEquals("Hinu íslenska bókmenntafélagi", transformer.dativeNp(np));
    }

    @Test
    void freeArticleBlocksSuffixedArticle() {
        Node np = TestTrees.literarySociety().getRoot();
        assertEquals("Hið íslenska bókmenntafélag",
            transformer.inflect(np, GrammaticalCase.NOMINATIVE, null, Definiteness.DEFINITE));
    }

    @Test
    void demonstrativeIsDroppedWhenIndefinite() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP")
                .terminal("fn_et_nf_kk", "Þessi", 0, "þessi")
                .terminal("no_et_nf_kk", "bílskúr", 1, "bílskúr")
            .end()
            .build();
        assertEquals("bílskúr", transformer.indefiniteNp(tree.getRoot()));
        assertEquals("Þessi bílskúr", transformer.nominativeNp(tree.getRoot()));
    }

    @Test
    void possessivesKeepTheirCaseAndCanonicalDropsThem() {
        Node subject = TestTrees.garages().getRoot().path("IP", "NP-SUBJ");
        assertEquals("Bílskúrar bróður Páls", transformer.nominativeNp(subject));
        assertEquals("Bílskúr", transformer.canonicalNp(subject));
    }

    @Test
    void canonicalDropsNumberWords() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP-POSS")
                .terminal("to_ft_ef_kk", "þriggja", 0, "þrír")
                .nonterminal("ADJP")
                    .terminal("lo_ef_ft_kk_vb", "góðglöðu", 1, "góðglaður")
                .end()
                .terminal("no_ef_ft_kk_gr", "alþingismannanna", 2, "alþingismaður")
                .nonterminal("CP-REL")
                    .terminal("stt", "sem", 3, "sem")
                    .terminal("so_0_ft_p3_þt", "fóru", 4, "fara")
                    .terminal("ao", "út", 5, "út")
                .end()
            .end()
            .build();
        assertEquals("þrír góðglaðir alþingismenn sem fóru út", transformer.indefiniteNp(tree.getRoot()));
        assertEquals("góðglaður alþingismaður", transformer.canonicalNp(tree.getRoot()));
    }

    @Test
    void canonicalOfOnlyDetachableContentIsEmpty() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP")
                .nonterminal("NP-POSS")
                    .terminal("person_ef_kk", "Páls", 0, "Páll")
                .end()
            .end()
            .build();
        assertEquals("", transformer.canonicalNp(tree.getRoot()));
        assertEquals("Páls", transformer.nominativeNp(tree.getRoot()));
    }

    @Test
    void canonicalIsIdempotent() {
        Node predicate = TestTrees.garages().getRoot().path("IP", "VP", "NP-PRD");
        String canonical = transformer.canonicalNp(predicate);
        assertEquals("frábær bílskúr", canonical);

        ParseTree again = new ParseTreeBuilder()
            .nonterminal("NP")
                .nonterminal("ADJP")
                    .terminal("lo_nf_et_kk_sb", "frábær", 0, "frábær")
                .end()
                .terminal("no_et_nf_kk", "bílskúr", 1, "bílskúr")
            .end()
            .build();
        assertEquals(canonical, transformer.canonicalNp(again.getRoot()));
    }

    @Test
    void otherPhrasesComeBackAsText() {
        Node vp = TestTrees.garages().getRoot().path("IP", "VP");
        assertEquals("eru frábærir bílskúrar", transformer.nominativeNp(vp));
    }

    @Test
    void terminals() {
        ParseTree tree = TestTrees.greatGarages();
        assertEquals("Frábær", transformer.canonical(tree.node(2).asTerminal()));
        assertEquals("bílskúrar", transformer.indefinite(tree.node(3).asTerminal()));
        assertEquals("bílskúrarnir", transformer.nominative(tree.node(3).asTerminal()));

        ParseTree garages = TestTrees.garages();
        assertEquals("Páll", transformer.nominative(garages.terminals().get(2)));
        assertEquals("eru", transformer.canonical(garages.terminals().get(3)));
    }

    @Test
    void namesTakeTheirLemmaInNominative() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP")
                .terminal("person_þgf_kk", "Jóni", 0, "Jón")
            .end()
            .build();
        assertEquals("Jón", transformer.nominativeNp(tree.getRoot()));
        assertEquals("Jóni", transformer.dativeNp(tree.getRoot()));
    }

    @Test
    void unknownWordsKeepTheirForm() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP")
                .terminal("no_et_þgf_kk", "HESTI", 0, "hestur")
            .end()
            .build();
        assertEquals("HESTI", transformer.nominativeNp(tree.getRoot()));

        CaseTransformer noLexicon = new CaseTransformer(new TreeQueryConfig(),
            (lemma, category, features) -> Optional.empty(), new TreeRenderer());
        assertEquals("Frábæru bílskúrarnir", noLexicon.canonicalNp(TestTrees.greatGarages().getRoot()));
    }

    @Test
    void capitalizationFollowsTheOriginal() {
        ParseTree tree = new ParseTreeBuilder()
            .nonterminal("NP")
                .terminal("no_ft_þgf_kk_gr", "BÍLSKÚRUNUM", 0, "bílskúr")
            .end()
            .build();
        assertEquals("BÍLSKÚRARNIR", transformer.nominativeNp(tree.getRoot()));
    }
}
