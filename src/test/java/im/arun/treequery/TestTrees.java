package im.arun.treequery;

import im.arun.treequery.model.ParseTree;
import im.arun.treequery.model.ParseTreeBuilder;

import java.util.List;

/**
 * Hand-built parse trees shared by the tests.
 */
public final class TestTrees {

    private TestTrees() {}

    /**
     * "Ása sá sól."
     */
    public static ParseTree asaSawSun() {
        return new ParseTreeBuilder()
            .nonterminal("S0")
                .nonterminal("S-MAIN")
                    .nonterminal("IP")
                        .nonterminal("NP-SUBJ")
                            .terminal("no_et_nf_kvk", "Ása", 0, "Ása")
                        .end()
                        .nonterminal("VP")
                            .terminal("so_1_þf_et_p3", "sá", 1, "sjá", List.of("1", "þf", "et", "p3", "fh", "gm", "þt"))
                            .nonterminal("NP-OBJ")
                                .terminal("no_et_þf_kvk", "sól", 2, "sól")
                            .end()
                        .end()
                    .end()
                .end()
                .terminal("p", ".", 3, null)
            .end()
            .build();
    }

    /**
     * "Bílskúrar bróður Páls eru frábærir bílskúrar." with nested possessives.
     */
    public static ParseTree garages() {
        return new ParseTreeBuilder()
            .nonterminal("S0")
                .nonterminal("IP")
                    .nonterminal("NP-SUBJ")
                        .terminal("no_ft_nf_kk", "Bílskúrar", 0, "bílskúr")
                        .nonterminal("NP-POSS")
                            .terminal("no_et_ef_kk", "bróður", 1, "bróðir")
                            .nonterminal("NP-POSS")
                                .terminal("person_ef_kk", "Páls", 2, "Páll")
                            .end()
                        .end()
                    .end()
                    .nonterminal("VP")
                        .terminal("so_0_ft_p3", "eru", 3, "vera")
                        .nonterminal("NP-PRD")
                            .nonterminal("ADJP")
                                .terminal("lo_nf_ft_kk_sb", "frábærir", 4, "frábær")
                            .end()
                            .terminal("no_ft_nf_kk", "bílskúrar", 5, "bílskúr")
                        .end()
                    .end()
                .end()
                .terminal("p", ".", 6, null)
            .end()
            .build();
    }

    /**
     * "Frábæru bílskúrarnir"
     */
    public static ParseTree greatGarages() {
        return new ParseTreeBuilder()
            .nonterminal("NP")
                .nonterminal("ADJP")
                    .terminal("lo_nf_ft_kk_vb", "Frábæru", 0, "frábær")
                .end()
                .terminal("no_ft_nf_kk_gr", "bílskúrarnir", 1, "bílskúr")
            .end()
            .build();
    }

    /**
     * "Hið íslenska bókmenntafélag"
     */
    public static ParseTree literarySociety() {
        return new ParseTreeBuilder()
            .nonterminal("NP")
                .terminal("gr_et_nf_hk", "Hið", 0, "hinn")
                .nonterminal("ADJP")
                    .terminal("lo_et_nf_hk_vb", "íslenska", 1, "íslenskur")
                .end()
                .terminal("no_et_nf_hk", "bókmenntafélag", 2, "bókmennta-félag")
            .end()
            .build();
    }
}
