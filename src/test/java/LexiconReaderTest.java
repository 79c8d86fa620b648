import org.junit.jupiter.api.Test;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.ErrorKind;
import com.expecta.analyzer.engine.Packet;
import com.expecta.analyzer.lexicon.Datum;
import com.expecta.analyzer.lexicon.DefinitionLexicon;
import com.expecta.analyzer.lexicon.LexiconReader;
import com.expecta.analyzer.lexicon.Parser;
import com.expecta.analyzer.lexicon.RequestCompiler;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LexiconReaderTest {

    @Test
    void bundledLexicon_definesDemoVocabulary() {
        DefinitionLexicon lex = LexiconReader.bundled();

        assertEquals(17, lex.size());
        for (String w : List.of("jack", "mary", "went", "bought", "gave", "took", "the", "a", "home")) {
            assertTrue(lex.contains(w), w);
            assertTrue(lex.lookup(w).isPresent(), w);
        }
        assertFalse(lex.lookup("quickly").isPresent());
    }

    @Test
    void lookupIgnoresCase() {
        DefinitionLexicon lex = LexiconReader.read("(Store ((assign cdForm '(store))))");
        assertTrue(lex.contains("store"));
        assertTrue(lex.lookup("STORE").isPresent());
        assertSame(lex.lookup("store").get(), lex.lookup("Store").get());
    }

    @Test
    void commentsAndBlankLinesAreSkipped() {
        DefinitionLexicon lex = LexiconReader.read(
                "; nouns\n"
                        + "\n"
                        + "(store ((assign cdForm '(store)))) ; trailing\n"
                        + "(park ((assign cdForm '(park))))\n");

        assertEquals(2, lex.size());
        assertEquals(List.of("store", "park"), List.copyOf(lex.words()));
    }

    @Test
    void malformedTopLevelShape_isRejectedOnRead() {
        AnalysisException ex = assertThrows(AnalysisException.class, () -> LexiconReader.read("store"));
        assertEquals(ErrorKind.MALFORMED_REQUEST, ex.kind());

        ex = assertThrows(AnalysisException.class, () -> LexiconReader.read("((store) ((assign x 1)))"));
        assertEquals(ErrorKind.MALFORMED_REQUEST, ex.kind());

        ex = assertThrows(AnalysisException.class, () -> LexiconReader.read("(store ((assign x 1))"));
        assertTrue(ex.getMessage().contains("Unclosed"), ex.getMessage());

        ex = assertThrows(AnalysisException.class, () -> LexiconReader.read("(store))"));
        assertTrue(ex.getMessage().contains("Unexpected"), ex.getMessage());

        ex = assertThrows(AnalysisException.class, () -> LexiconReader.read("(say ((assign x \"hi\")))"));
        assertEquals(ErrorKind.MALFORMED_REQUEST, ex.kind());
    }

    @Test
    void malformedRequest_failsOnlyWhenItsWordIsLookedUp() {
        DefinitionLexicon lex = LexiconReader.read(
                "(good ((assign cdForm '(ok))))\n"
                        + "(bad ((explode now)))\n");

        assertTrue(lex.lookup("good").isPresent());

        AnalysisException ex = assertThrows(AnalysisException.class, () -> lex.lookup("bad"));
        assertEquals(ErrorKind.MALFORMED_REQUEST, ex.kind());
        assertEquals("bad", ex.subject());
        assertTrue(ex.getMessage().contains("unknown clause 'explode'"), ex.getMessage());
        assertTrue(ex.getMessage().contains("[line 2]"), ex.getMessage());
    }

    @Test
    void requestCompiler_rejectsBadClauses() {
        List<String> broken = List.of(
                "(())",
                "(((test t) (test nil)))",
                "(((test)))",
                "(((assign x)))",
                "(((assign nil 1)))",
                "(((assign (x) 1)))",
                "(((assign x '(ptrans actor))))",
                "(((assign x '(ptrans (actor)))))",
                "(((assign x '(ptrans (actor 'jack)))))",
                "(((assign x '(5 (a b)))))",
                "(((assign x (equal a))))");

        for (String src : broken) {
            AnalysisException ex = assertThrows(AnalysisException.class,
                    () -> RequestCompiler.compilePacket(Parser.parseOne(src), "w"), src);
            assertEquals(ErrorKind.MALFORMED_REQUEST, ex.kind(), src);
        }
    }

    @Test
    void redefinitionReplacesEarlierDefinition() {
        DefinitionLexicon lex = LexiconReader.read(
                "(store ((assign cdForm '(shop))))\n"
                        + "(store ((assign cdForm '(store)) (next-packet ((assign x 1)))))\n");

        assertEquals(1, lex.size());
        Packet p = lex.lookup("store").get();
        assertEquals(1, p.requests().get(0).nextPackets().size());
    }

    @Test
    void defineFromPacketSourceAndAddAll() {
        DefinitionLexicon base = new DefinitionLexicon().define("store", "((assign cdForm '(store)))");
        DefinitionLexicon more = LexiconReader.read("(park ((assign cdForm '(park))))");

        more.addAll(base);
        assertEquals(2, more.size());
        assertTrue(more.lookup("store").isPresent());

        assertThrows(AnalysisException.class, () -> new DefinitionLexicon().define("x", "store"));
    }

    @Test
    void datumReader_numbersVariablesAndSymbols() {
        Datum d = Parser.parseOne("(2nd -3 4.5 ?who 'x + nil)");
        List<Datum> items = d.items();

        assertEquals(Datum.Kind.SYMBOL, items.get(0).kind);
        assertEquals("2nd", items.get(0).name());
        assertEquals(-3.0, items.get(1).number(), 1e-9);
        assertEquals(4.5, items.get(2).number(), 1e-9);
        assertEquals(Datum.Kind.VARIABLE, items.get(3).kind);
        assertEquals("who", items.get(3).name());
        assertEquals(Datum.Kind.QUOTE, items.get(4).kind);
        assertTrue(items.get(5).isSymbol("+"));
        assertEquals("(2nd -3 4.5 ?who 'x + nil)", d.toString());
    }

    @Test
    void wholeNumbersBeyondLongRange_printUnclamped() {
        Datum d = Parser.parseOne("(count (n 99999999999999999999))");
        assertEquals("(count (n 100000000000000000000))", d.toString());

        CdForm form = RequestCompiler.toForm(d, "w");
        assertEquals("(count (n 100000000000000000000))", form.toString());
        assertEquals("-100000000000000000000", CdForm.number(-1e20).toString());
        assertEquals("42", CdForm.number(42).toString());
        assertEquals("0.5", CdForm.number(0.5).toString());
        assertEquals("Infinity", CdForm.number(Double.POSITIVE_INFINITY).toString());
    }

    @Test
    void quotedData_becomesTemplate() {
        assertSame(CdForm.NIL, RequestCompiler.toForm(Parser.parseOne("()"), "w"));
        assertSame(CdForm.NIL, RequestCompiler.toForm(Parser.parseOne("nil"), "w"));

        CdForm frame = RequestCompiler.toForm(Parser.parseOne("(ptrans (actor ?goVar1) (to (store)))"), "w");
        assertEquals(CdForm.Type.FRAME, frame.getType());
        assertEquals("ptrans", frame.header());
        assertEquals(CdForm.variable("goVar1"), frame.filler("actor"));
        assertTrue(frame.containsVariables());

        Optional<Packet> none = new DefinitionLexicon().lookup(null);
        assertFalse(none.isPresent());
    }
}
