package com.expecta.analyzer.engine;

/** What processing one word did to the stack. */
public class WordStep {
    private final String word;
    private final boolean known;
    private final int fired;
    private final int stackDepth;

    public WordStep(String word, boolean known, int fired, int stackDepth) {
        this.word = word;
        this.known = known;
        this.fired = fired;
        this.stackDepth = stackDepth;
    }

    public String word() { return word; }

    /** False when the lexicon had no definition for the word. */
    public boolean known() { return known; }

    /** Number of requests fired during this word's cascade. */
    public int fired() { return fired; }

    /** Stack depth after the triggered requests' next packets were pushed. */
    public int stackDepth() { return stackDepth; }

    @Override
    public String toString() {
        return word + (known ? "" : "(unknown)") + " fired=" + fired + " depth=" + stackDepth;
    }
}
