package im.arun.treequery.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeUtilsTest {

    @Test
    void terminalIdentifiers() {
        assertEquals("no", TreeUtils.categoryOf("no_et_nf_kvk"));
        assertEquals("p", TreeUtils.categoryOf("p"));
        assertEquals(List.of("et", "nf", "kvk"), TreeUtils.variantsOf("no_et_nf_kvk"));
        assertEquals(List.of(), TreeUtils.variantsOf("p"));
        assertThrows(IllegalArgumentException.class, () -> TreeUtils.categoryOf(""));
    }

    @Test
    void inflectionalFeaturesKeepOrder() {
        Set<String> features = TreeUtils.inflectionalFeatures(List.of("1", "þf", "et", "fh", "p3", "þt", "gr"));
        assertEquals(List.of("þf", "et", "p3", "gr"), List.copyOf(features));
        assertTrue(TreeUtils.isInflectional("vb"));
        assertFalse(TreeUtils.isInflectional("sérn"));
    }

    @Test
    void replaceOnlyWhenPresent() {
        Set<String> features = new LinkedHashSet<>(List.of("kk", "nf", "et"));
        TreeUtils.replaceIn(features, TreeUtils.CASES, "þgf");
        assertEquals(Set.of("kk", "þgf", "et"), features);
        TreeUtils.replaceIn(features, TreeUtils.DECLENSIONS, "sb");
        assertEquals(Set.of("kk", "þgf", "et"), features);
        assertEquals("kk", TreeUtils.firstOf(features, TreeUtils.GENDERS));
        assertNull(TreeUtils.firstOf(features, TreeUtils.DEGREES));
    }

    @Test
    void imitateCase() {
        assertEquals("Bílskúr", TreeUtils.imitateCase("Bílskúrar", "bílskúr"));
        assertEquals("BÍLSKÚR", TreeUtils.imitateCase("BÍLSKÚRAR", "bílskúr"));
        assertEquals("bílskúr", TreeUtils.imitateCase("bílskúrar", "bílskúr"));
        assertEquals("Ísland", TreeUtils.imitateCase("íslands", "Ísland"));
        assertEquals("A", TreeUtils.imitateCase("A", "a"));
    }

    @Test
    void numericTokens() {
        assertTrue(TreeUtils.isNumeric("200"));
        assertTrue(TreeUtils.isNumeric("3,8"));
        assertTrue(TreeUtils.isNumeric("11:45"));
        assertFalse(TreeUtils.isNumeric("3a"));
        assertFalse(TreeUtils.isNumeric(".,"));
        assertFalse(TreeUtils.isNumeric(""));
    }

    @Test
    void splitTokens() {
        assertEquals(List.of("Páll", "Jónsson"), TreeUtils.splitTokens("  Páll \t Jónsson "));
        assertEquals(List.of(), TreeUtils.splitTokens("   "));
        assertEquals(List.of(), TreeUtils.splitTokens(null));
    }
}
