package com.expecta.analyzer.lexicon;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.expecta.analyzer.engine.AnalysisException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads a lexicon from JSON. The document is an object keyed by word; each
 * value is either one string holding all of the word's requests, or an array
 * with one request per element:
 *
 * <pre>
 * {
 *   "store": "((assign partOfSpeech 'noun cdForm '(store)))",
 *   "the":   ["((next-packet ((test (equal partOfSpeech 'noun)) (assign partOfSpeech 'noun-phrase))))"]
 * }
 * </pre>
 */
public final class JsonLexiconLoader {

    private final ObjectMapper om;

    public JsonLexiconLoader() {
        this(new ObjectMapper());
    }

    public JsonLexiconLoader(ObjectMapper om) {
        this.om = om;
    }

    public DefinitionLexicon load(String json) throws IOException {
        return fromTree(om.readTree(json));
    }

    public DefinitionLexicon load(InputStream in) throws IOException {
        return fromTree(om.readTree(in));
    }

    public DefinitionLexicon load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public DefinitionLexicon fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw AnalysisException.malformed("lexicon", "JSON lexicon must be an object keyed by word");
        }

        DefinitionLexicon lexicon = new DefinitionLexicon();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            String word = e.getKey();
            JsonNode def = e.getValue();

            if (def.isTextual()) {
                lexicon.define(word, def.asText());
            } else if (def.isArray()) {
                List<Datum> requests = new ArrayList<>(def.size());
                for (JsonNode r : def) {
                    if (!r.isTextual()) {
                        throw AnalysisException.malformed(word, "Request of '" + word + "' must be a string, got " + r);
                    }
                    requests.add(Parser.parseOne(r.asText()));
                }
                lexicon.define(word, requests);
            } else {
                throw AnalysisException.malformed(word,
                        "Definition of '" + word + "' must be a string or an array of strings, got " + def.getNodeType());
            }
        }
        return lexicon;
    }
}
