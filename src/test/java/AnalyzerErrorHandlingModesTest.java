import org.junit.jupiter.api.Test;

import com.expecta.analyzer.ConceptualAnalyzer;
import com.expecta.analyzer.ParseResult;
import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.ErrorKind;
import com.expecta.analyzer.lexicon.DefinitionLexicon;
import com.expecta.analyzer.lexicon.LexiconReader;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerErrorHandlingModesTest {

    private static DefinitionLexicon lexicon() {
        DefinitionLexicon lex = LexiconReader.bundled();
        lex.define("ghost", "((assign concept '(ptrans (actor ?nobody))))");
        lex.define("loop", "((assign a '(x (y ?b)) b '(x (y ?a)) concept '(top (v ?a))))");
        lex.define("broken", "((frobnicate now))");
        lex.define("deep", "((assign inner '(jack) outer '(person (name ?inner)) concept '(ptrans (actor ?outer))))");
        lex.define("peek", "((test (equal neverSet 1)) (assign x 1))");
        return lex;
    }

    @Test
    void noHandler_throwsToHost() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());

        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer.parse("ghost"));
        assertEquals(ErrorKind.UNBOUND_SLOT, ex.kind());
        assertEquals("nobody", ex.subject());
    }

    @Test
    void handler_receivesErrorAndParseReturnsFailure() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        List<String> seen = new ArrayList<>();
        analyzer.setErrorHandler((e, words) -> seen.add(e.kind().tag() + ":" + words));

        ParseResult r = analyzer.parse("jack ghost");

        assertFalse(r.ok());
        assertEquals(ErrorKind.UNBOUND_SLOT, r.errorKind());
        assertTrue(r.errorMessage().contains("nobody"));
        assertTrue(r.concept().isNil());
        assertEquals("failed[unbound_slot]: Unbound slot: nobody", r.toString());
        assertEquals(List.of("unbound_slot:[jack, ghost]"), seen);
    }

    @Test
    void unboundSlotInTest_isFatalToo() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer.parse("peek"));
        assertEquals(ErrorKind.UNBOUND_SLOT, ex.kind());
        assertEquals("neverSet", ex.subject());
    }

    @Test
    void cyclicBinding_reportedWithChain() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer.parse("loop"));
        assertEquals(ErrorKind.CYCLIC_BINDING, ex.kind());
        assertTrue(ex.getMessage().contains("a -> b -> a"), ex.getMessage());
    }

    @Test
    void malformedDefinition_failsOnlyParsesThatReachIt() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        AtomicInteger calls = new AtomicInteger();
        analyzer.setErrorHandler((e, words) -> calls.incrementAndGet());

        ParseResult bad = analyzer.parse("jack broken");
        assertEquals(ErrorKind.MALFORMED_REQUEST, bad.errorKind());
        assertEquals(1, bad.steps().size());

        ParseResult good = analyzer.parse("jack went home");
        assertTrue(good.ok());
        assertEquals(1, calls.get());
    }

    @Test
    void analyzerRecoversAfterFailure() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        assertThrows(AnalysisException.class, () -> analyzer.parse("jack went loop"));

        ParseResult r = analyzer.parse("mary went home");
        assertTrue(r.ok());
        assertTrue(r.concept().toString().startsWith("(ptrans (actor (person (name (mary))))"),
                r.concept().toString());
    }

    @Test
    void throwingHandler_isContained() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        analyzer.setErrorHandler((e, words) -> {
            throw new IllegalStateException("handler blew up");
        });

        ParseResult r = assertDoesNotThrow(() -> analyzer.parse("ghost"));
        assertFalse(r.ok());
        assertEquals(ErrorKind.UNBOUND_SLOT, r.errorKind());
    }

    @Test
    void strictLexicon_unknownWordIsFatal() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        analyzer.setStrictLexicon(true);

        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer.parse("jack went quickly"));
        assertEquals(ErrorKind.UNKNOWN_WORD, ex.kind());
        assertEquals("quickly", ex.subject());

        List<ErrorKind> kinds = new ArrayList<>();
        analyzer.setErrorHandler((e, words) -> kinds.add(e.kind()));
        ParseResult r = analyzer.parse("jack went quickly");
        assertEquals(List.of(ErrorKind.UNKNOWN_WORD), kinds);
        assertEquals(List.of("quickly"), r.unknownWords());
    }

    @Test
    void lowResolutionDepth_turnsDeepConceptIntoCyclicBinding() {
        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon());
        analyzer.setMaxResolutionDepth(1);

        // ?outer -> ?inner needs two levels
        AnalysisException ex = assertThrows(AnalysisException.class, () -> analyzer.parse("deep"));
        assertEquals(ErrorKind.CYCLIC_BINDING, ex.kind());

        analyzer.setMaxResolutionDepth(2);
        assertEquals("(ptrans (actor (person (name (jack)))))", analyzer.parse("deep").concept().toString());
    }
}
