package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.expecta.debug.Debug;
import com.expecta.debug.DebugLevel;

/**
 * Drives one parse: for every word, push the word's packet, then repeatedly
 * fire the first triggered request of the top packet until the top packet has
 * nothing to fire. Firing pops the whole packet (its other requests are gone
 * for good) and applies the request's assignments. When the cascade halts, the
 * next packets of everything that fired are pushed in firing order.
 *
 * Not thread-safe; an engine and its environment belong to a single parse at a time.
 */
public class CascadeEngine {
    private static final String TAG = "Cascade";

    private final Environment env;
    private final Lexicon lexicon;
    private final Instantiator instantiator;
    private final boolean strictLexicon;
    private final PacketStack stack = new PacketStack();

    private final List<WordStep> steps = new ArrayList<>();
    private final List<String> unknownWords = new ArrayList<>();

    public CascadeEngine(Environment env, Lexicon lexicon) {
        this(env, lexicon, new Instantiator(), false);
    }

    public CascadeEngine(Environment env, Lexicon lexicon, Instantiator instantiator, boolean strictLexicon) {
        if (env == null) throw new IllegalArgumentException("env must not be null");
        if (lexicon == null) throw new IllegalArgumentException("lexicon must not be null");
        this.env = env;
        this.lexicon = lexicon;
        this.instantiator = (instantiator == null) ? new Instantiator() : instantiator;
        this.strictLexicon = strictLexicon;
    }

    public Environment environment() { return env; }

    public PacketStack stack() { return stack; }

    public List<WordStep> steps() { return Collections.unmodifiableList(steps); }

    public List<String> unknownWords() { return Collections.unmodifiableList(unknownWords); }

    /** Start a new parse: empty stack, environment reset according to {@code policy}. */
    public void begin(ResetPolicy policy) {
        stack.clear();
        steps.clear();
        unknownWords.clear();
        env.reset(policy == null ? ResetPolicy.RESET : policy);
    }

    /** Run a whole sentence and return the instantiated concept. */
    public CdForm parse(List<String> words, ResetPolicy policy) {
        begin(policy);
        for (int i = 0; i < words.size(); i++) {
            processWord(words.get(i), words.subList(i + 1, words.size()));
        }
        return finish();
    }

    public WordStep processWord(String word, List<String> remaining) {
        env.set(Environment.CURRENT_WORD, CdForm.symbol(word));
        env.set(Environment.REMAINING_WORDS, symbols(remaining));

        boolean known = loadDefinition(word);
        int fired = runStack(word);

        WordStep step = new WordStep(word, known, fired, stack.size());
        steps.add(step);
        return step;
    }

    /** Instantiate the {@code concept} slot against the final bindings. */
    public CdForm finish() {
        CdForm concept = instantiator.instantiate(env.get(Environment.CONCEPT), env);
        Debug.get().d(TAG, "concept = " + concept);
        return concept;
    }

    private boolean loadDefinition(String word) {
        Optional<Packet> packet = lexicon.lookup(word);
        if (packet.isPresent()) {
            stack.push(packet.get());
            return true;
        }

        unknownWords.add(word);
        if (strictLexicon) {
            throw new AnalysisException(ErrorKind.UNKNOWN_WORD, word, "Word not in lexicon: " + word);
        }
        Debug.get().w(TAG, word + " not in lexicon");
        return false;
    }

    private int runStack(String word) {
        List<Request> triggered = new ArrayList<>();

        Request request;
        while ((request = topOfStack()) != null) {
            stack.pop();
            if (Debug.get().enabled(DebugLevel.TRACE)) {
                Debug.get().t(TAG, word + ": firing " + request);
            }
            request.apply(env);
            triggered.add(request);
        }

        for (Request r : triggered) {
            for (Packet p : r.nextPackets()) stack.push(p);
        }
        return triggered.size();
    }

    private Request topOfStack() {
        Packet top = stack.peek();
        return (top == null) ? null : top.firstTriggered(env);
    }

    private static CdForm symbols(List<String> words) {
        List<CdForm> out = new ArrayList<>(words.size());
        for (String w : words) out.add(CdForm.symbol(w));
        return CdForm.list(out);
    }
}
