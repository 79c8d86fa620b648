package com.expecta.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.BuiltinFunction;
import com.expecta.analyzer.engine.CascadeEngine;
import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.CoreFunctions;
import com.expecta.analyzer.engine.Environment;
import com.expecta.analyzer.engine.Instantiator;
import com.expecta.analyzer.engine.Lexicon;
import com.expecta.analyzer.engine.ResetPolicy;
import com.expecta.analyzer.lexicon.LexiconReader;
import com.expecta.debug.Debug;

/**
 * Expectation-driven conceptual analyzer.
 *
 * - Each word's lexicon packet is pushed on a stack of pending requests
 * - Triggered requests fire first-match-wins, mutate the environment and
 *   push follow-up packets (see {@link CascadeEngine})
 * - After the last word the {@code concept} slot is instantiated into the result
 *
 * One analyzer owns one environment; it is not thread-safe. Between sentences
 * the environment is reset according to {@link #setResetPolicy(ResetPolicy)}.
 */
public class ConceptualAnalyzer {
    private static final String TAG = "Analyzer";

    private final Lexicon lexicon;
    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final Environment env;

    private ResetPolicy resetPolicy = ResetPolicy.RESET;
    private int maxResolutionDepth = Instantiator.DEFAULT_MAX_DEPTH;
    private boolean strictLexicon = false;

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - No handler registered: fatal analysis errors THROW to the caller.
     * - Handler registered: errors are routed to it, suppressed, and the parse
     *   returns a failed ParseResult tagged with the error kind.
     *
     * Unknown words are not fatal unless strict-lexicon mode is on.
     */
    private AnalysisErrorHandler errorHandler = null;
    private boolean reportingError = false;

    public ConceptualAnalyzer(Lexicon lexicon) {
        if (lexicon == null) throw new IllegalArgumentException("lexicon must not be null");
        this.lexicon = lexicon;
        registerCoreBuiltins();
        this.env = new Environment(functions);
    }

    /** Analyzer over the lexicon bundled at {@link LexiconReader#BUNDLED}. */
    public static ConceptualAnalyzer withBundledLexicon() {
        return new ConceptualAnalyzer(LexiconReader.bundled());
    }

    public void setResetPolicy(ResetPolicy policy) { this.resetPolicy = (policy == null) ? ResetPolicy.RESET : policy; }

    public ResetPolicy getResetPolicy() { return resetPolicy; }

    public void setMaxResolutionDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max resolution depth must be >= 1");
        this.maxResolutionDepth = depth;
    }

    public void setStrictLexicon(boolean strict) { this.strictLexicon = strict; }

    public void setErrorHandler(AnalysisErrorHandler handler) { this.errorHandler = handler; }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public ParseResult parse(String sentence) {
        return parseSentence(tokenize(sentence));
    }

    /** Words are lower-cased before lookup, so slot tests always see the lexicon's spelling. */
    public ParseResult parseSentence(List<String> sentence) {
        if (sentence == null) throw new IllegalArgumentException("words must not be null");

        List<String> words = new ArrayList<>(sentence.size());
        for (String w : sentence) {
            if (w == null) throw new IllegalArgumentException("words must not contain null");
            words.add(w.toLowerCase(Locale.ROOT));
        }

        CascadeEngine engine = new CascadeEngine(env, lexicon, new Instantiator(maxResolutionDepth), strictLexicon);
        try {
            CdForm concept = engine.parse(words, resetPolicy);
            return ParseResult.success(words, concept, env.snapshot(), engine.unknownWords(), engine.steps());
        } catch (AnalysisException e) {
            onAnalysisError(e, words);

            // handler set => suppressed
            return ParseResult.failure(words, env.snapshot(), engine.unknownWords(), engine.steps(),
                    e.kind(), e.getMessage());
        }
    }

    /** Split raw text into lower-case words, dropping brackets and punctuation. */
    public static List<String> tokenize(String sentence) {
        if (sentence == null) return Collections.emptyList();
        String cleaned = sentence.toLowerCase(Locale.ROOT).replaceAll("[()\\[\\]{},.!?;:\"]", " ").trim();
        if (cleaned.isEmpty()) return Collections.emptyList();

        List<String> out = new ArrayList<>();
        for (String w : cleaned.split("\\s+")) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    private void onAnalysisError(AnalysisException e, List<String> words) {
        Debug.get().d(TAG, "[" + e.kind().tag() + "] " + e.getMessage() + " in " + words);

        if (errorHandler == null) throw e;

        if (reportingError) {
            Debug.get().e(TAG, "recursive error while reporting: " + e.getMessage());
            return;
        }

        reportingError = true;
        try {
            errorHandler.onError(e, words);
        } catch (RuntimeException handlerFailure) {
            Debug.get().e(TAG, "error handler failed for: " + e.getMessage(), handlerFailure);
        } finally {
            reportingError = false;
        }
    }

    private void registerCoreBuiltins() {
        CoreFunctions.install(functions);
    }
}
