package im.arun.treequery.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTest {

    @Test
    void compilesValidPatterns() {
        assertEquals("NP", PatternCompiler.compile("NP").getSource());
        assertNotNull(PatternCompiler.compile("( no | lo )"));
        assertNotNull(PatternCompiler.compile("NP > { no_þf }"));
        assertNotNull(PatternCompiler.compile("S0 >> { IP > { VP > { PP } } }"));
        assertNotNull(PatternCompiler.compile("NP > [ lo* no ... ]"));
        assertNotNull(PatternCompiler.compile("VP > [ so . ? \"sól\" + ]"));
        assertNotNull(PatternCompiler.compile("'bílskúr'"));
    }

    @Test
    void cachesCompiledPatterns() {
        assertSame(PatternCompiler.compile("NP-SUBJ > { no }"), PatternCompiler.compile("NP-SUBJ > { no }"));
    }

    @Test
    void cacheIsBounded() {
        Pattern first = PatternCompiler.compile("NP-CACHED > { no }");
        for (int i = 0; i < PatternCompiler.CACHE_SIZE + 10; i++) {
            PatternCompiler.compile("'lemma" + i + "'");
        }
        assertTrue(PatternCompiler.cachedCount() <= PatternCompiler.CACHE_SIZE);
        assertNotSame(first, PatternCompiler.compile("NP-CACHED > { no }"));
    }

    @Test
    void exceptionCarriesThePattern() {
        PatternCompileException e = assertThrows(PatternCompileException.class,
            () -> PatternCompiler.compile("NP > { no"));
        assertEquals("NP > { no", e.getPattern());
        assertTrue(e.getMessage().contains("NP > { no"));
    }

    @Test
    void emptyPattern() {
        PatternCompileException e = assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("  "));
        assertEquals(0, e.getPosition());
    }

    @Test
    void orderedContextNeedsSingleArrow() {
        PatternCompileException e = assertThrows(PatternCompileException.class,
            () -> PatternCompiler.compile("NP >> [ no ]"));
        assertEquals(6, e.getPosition());
    }

    @Test
    void unclosedContexts() {
        PatternCompileException brace = assertThrows(PatternCompileException.class,
            () -> PatternCompiler.compile("NP > { no"));
        assertEquals(9, brace.getPosition());
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("NP > [ no"));
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("( NP | VP"));
    }

    @Test
    void emptyContexts() {
        PatternCompileException e = assertThrows(PatternCompileException.class,
            () -> PatternCompiler.compile("NP > { }"));
        assertEquals(5, e.getPosition());
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("NP > [ ]"));
    }

    @Test
    void strayInput() {
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("NP VP"));
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("NP > no"));
        PatternCompileException e = assertThrows(PatternCompileException.class,
            () -> PatternCompiler.compile("NP & VP"));
        assertEquals(3, e.getPosition());
        assertThrows(PatternCompileException.class, () -> PatternCompiler.compile("\"open"));
    }

    @Test
    void compileErrorsAreIllegalArguments() {
        assertThrows(IllegalArgumentException.class, () -> PatternCompiler.compile(")"));
    }
}
