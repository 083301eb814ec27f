package im.arun.treequery.render;

import im.arun.treequery.TestTrees;
import im.arun.treequery.config.TreeQueryConfig;
import im.arun.treequery.model.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeRendererTest {

    private final Node root = TestTrees.asaSawSun().getRoot();
    private final TreeRenderer renderer = new TreeRenderer();

    @Test
    void viewIndentsEachLevel() {
        String expected = String.join("\n",
            "S0",
            "+-S-MAIN",
            "  +-IP",
            "    +-NP-SUBJ",
            "      +-no_et_nf_kvk: 'Ása'",
            "    +-VP",
            "      +-so_1_þf_et_p3: 'sá'",
            "      +-NP-OBJ",
            "        +-no_et_þf_kvk: 'sól'",
            "+-p: '.'");
        assertEquals(expected, renderer.view(root));
    }

    @Test
    void viewFollowsConfiguration() {
        TreeQueryConfig config = new TreeQueryConfig();
        config.setViewIndent(4);
        config.setBranchMarker("|-");
        TreeRenderer custom = new TreeRenderer(config, new DefaultSpacingNormalizer());
        String view = custom.view(root.path("S-MAIN", "IP", "VP"));
        assertEquals(String.join("\n", "VP", "|-so_1_þf_et_p3: 'sá'", "|-NP-OBJ", "    |-no_et_þf_kvk: 'sól'"), view);
    }

    @Test
    void viewOfTerminal() {
        assertEquals("p: '.'", renderer.view(root.child(1)));
    }

    @Test
    void flatForms() {
        assertEquals("S0 S-MAIN IP NP-SUBJ no_et_nf_kvk /NP-SUBJ VP so_1_þf_et_p3 NP-OBJ no_et_þf_kvk /NP-OBJ"
            + " /VP /IP /S-MAIN p /S0", renderer.flat(root));
        String all = renderer.flatWithAllVariants(root);
        assertTrue(all.contains("VP so_1_þf_et_p3_fh_gm_þt NP-OBJ"));
        assertTrue(all.endsWith("p /S0"));
    }

    @Test
    void plainAndTidyText() {
        assertEquals("Ása sá sól .", renderer.text(root));
        assertEquals("Ása sá sól.", renderer.tidyText(root));
        assertEquals("sá sól", renderer.text(root.path("S-MAIN", "IP", "VP")));
    }
}
