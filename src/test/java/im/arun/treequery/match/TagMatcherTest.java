package im.arun.treequery.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TagMatcherTest {

    @Test
    void exactTagMatches() {
        assertTrue(TagMatcher.matches("NP", "NP"));
        assertTrue(TagMatcher.matches("NP-SUBJ", "NP-SUBJ"));
    }

    @Test
    void prefixMustEndAtHyphen() {
        assertTrue(TagMatcher.matches("NP-SUBJ", "NP"));
        assertTrue(TagMatcher.matches("NP-SUBJ-X", "NP-SUBJ"));
        assertFalse(TagMatcher.matches("NPX", "NP"));
        assertFalse(TagMatcher.matches("NP", "NP-SUBJ"));
        assertFalse(TagMatcher.matches("ADVP", "ADV"));
    }

    @Test
    void everyTagMatchesItsOwnPrefixes() {
        String tag = "S-MAIN-X";
        String[] parts = tag.split("-");
        String prefix = parts[0];
        assertTrue(TagMatcher.matches(tag, prefix));
        for (int i = 1; i < parts.length; i++) {
            prefix = prefix + "-" + parts[i];
            assertTrue(TagMatcher.matches(tag, prefix));
        }
    }

    @Test
    void namesTreatUnderscoreAsHyphen() {
        assertTrue(TagMatcher.matchesName("NP-SUBJ", "NP_SUBJ"));
        assertTrue(TagMatcher.matchesName("S-MAIN", "S_MAIN"));
        assertTrue(TagMatcher.matchesName("NP-SUBJ", "NP"));
        assertFalse(TagMatcher.matchesName("NP-SUBJ", "NP_OBJ"));
    }

    @Test
    void baseTag() {
        assertEquals("NP", TagMatcher.baseOf("NP-SUBJ"));
        assertEquals("S0", TagMatcher.baseOf("S0"));
    }
}
