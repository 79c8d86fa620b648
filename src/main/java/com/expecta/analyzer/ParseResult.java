package com.expecta.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.ErrorKind;
import com.expecta.analyzer.engine.WordStep;

/**
 * Outcome of one sentence: the instantiated concept plus what the parse saw on
 * the way. A failed result (only produced when an error handler is installed)
 * carries the error kind and a nil concept.
 */
public class ParseResult {
    private final List<String> words;
    private final CdForm concept;
    private final Map<String, CdForm> env;
    private final List<String> unknownWords;
    private final List<WordStep> steps;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private ParseResult(List<String> words, CdForm concept, Map<String, CdForm> env, List<String> unknownWords,
                        List<WordStep> steps, ErrorKind errorKind, String errorMessage) {
        this.words = Collections.unmodifiableList(new ArrayList<>(words));
        this.concept = (concept == null) ? CdForm.NIL : concept;
        this.env = Collections.unmodifiableMap(env);
        this.unknownWords = Collections.unmodifiableList(new ArrayList<>(unknownWords));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    static ParseResult success(List<String> words, CdForm concept, Map<String, CdForm> env,
                               List<String> unknownWords, List<WordStep> steps) {
        return new ParseResult(words, concept, env, unknownWords, steps, null, null);
    }

    static ParseResult failure(List<String> words, Map<String, CdForm> env, List<String> unknownWords,
                               List<WordStep> steps, ErrorKind kind, String message) {
        return new ParseResult(words, CdForm.NIL, env, unknownWords, steps, kind, message);
    }

    public List<String> words() { return words; }

    public CdForm concept() { return concept; }

    /** A compound concept is a list of independent result trees. */
    public boolean isCompound() { return concept.getType() == CdForm.Type.LIST; }

    /** The result trees: one for a single concept, several for a compound one, none for nil. */
    public List<CdForm> trees() {
        if (concept.isNil()) return Collections.emptyList();
        if (isCompound()) return concept.items();
        return Collections.singletonList(concept);
    }

    /** Slot values at the end of the parse (or at the point of failure). */
    public Map<String, CdForm> env() { return env; }

    public List<String> unknownWords() { return unknownWords; }

    public List<WordStep> steps() { return steps; }

    public boolean ok() { return errorKind == null; }

    public ErrorKind errorKind() { return errorKind; }

    public String errorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return ok() ? concept.toString() : ("failed[" + errorKind.tag() + "]: " + errorMessage);
    }
}
