package com.expecta.analyzer.lexicon;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.Lexicon;
import com.expecta.analyzer.engine.Packet;
import com.expecta.debug.Debug;

/**
 * Lexicon backed by raw definitions. A definition is only compiled the first
 * time its word is looked up, so a malformed definition fails the parse that
 * reaches it and leaves every other word usable.
 */
public class DefinitionLexicon implements Lexicon {
    private static final String TAG = "Lexicon";

    private final Map<String, List<Datum>> definitions = new LinkedHashMap<>();
    private final Map<String, Packet> compiled = new HashMap<>();

    public DefinitionLexicon() {}

    /** (Re)define {@code word}; a redefinition replaces the previous one. */
    public DefinitionLexicon define(String word, List<Datum> requests) {
        String key = normalize(word);
        if (definitions.containsKey(key)) {
            Debug.get().w(TAG, "redefining '" + key + "'");
        }
        definitions.put(key, requests);
        compiled.remove(key);
        return this;
    }

    /**
     * Define {@code word} from the text of its requests, written as they would
     * follow the word in a lexicon file, e.g. {@code ((assign cdForm '(store)))}.
     */
    public DefinitionLexicon define(String word, String requestsSource) {
        List<Datum> requests = Parser.parse(requestsSource);
        for (Datum r : requests) {
            if (!r.isList()) {
                throw AnalysisException.malformed(word,
                        "Definition of '" + word + "' must be a sequence of requests, got " + r);
            }
        }
        return define(word, requests);
    }

    /** Copy every definition of {@code other} into this lexicon. */
    public DefinitionLexicon addAll(DefinitionLexicon other) {
        for (Map.Entry<String, List<Datum>> e : other.definitions.entrySet()) {
            define(e.getKey(), e.getValue());
        }
        return this;
    }

    @Override
    public Optional<Packet> lookup(String word) {
        if (word == null) return Optional.empty();
        String key = normalize(word);

        Packet packet = compiled.get(key);
        if (packet != null) return Optional.of(packet);

        List<Datum> requests = definitions.get(key);
        if (requests == null) return Optional.empty();

        packet = RequestCompiler.compilePacket(requests, key);
        compiled.put(key, packet);
        return Optional.of(packet);
    }

    public boolean contains(String word) {
        return word != null && definitions.containsKey(normalize(word));
    }

    public Set<String> words() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public int size() {
        return definitions.size();
    }

    static String normalize(String word) {
        return word.trim().toLowerCase(Locale.ROOT);
    }
}
