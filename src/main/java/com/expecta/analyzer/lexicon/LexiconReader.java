package com.expecta.analyzer.lexicon;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.expecta.analyzer.engine.AnalysisException;

/**
 * Reads lexicon text: a sequence of {@code (word request ...)} forms.
 *
 * <pre>
 * (store ((assign partOfSpeech 'noun cdForm '(store))))
 * </pre>
 *
 * Only the top-level shape is checked here; requests are compiled on lookup.
 */
public final class LexiconReader {
    public static final String BUNDLED = "/lexicon/micro.lex";

    private LexiconReader() {}

    public static DefinitionLexicon read(String source) {
        return readInto(new DefinitionLexicon(), source);
    }

    public static DefinitionLexicon readInto(DefinitionLexicon lexicon, String source) {
        List<Datum> forms = Parser.parse(source);
        for (Datum form : forms) {
            if (!form.isList() || form.items().isEmpty() || !form.items().get(0).isSymbol()) {
                throw AnalysisException.malformed("lexicon",
                        "[line " + form.line + "] Expect (word request ...), got " + form);
            }
            String word = form.items().get(0).name();
            lexicon.define(word, form.items().subList(1, form.items().size()));
        }
        return lexicon;
    }

    public static DefinitionLexicon readFile(Path path) throws IOException {
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Load a lexicon from the classpath, e.g. {@link #BUNDLED}. */
    public static DefinitionLexicon readResource(String resource) {
        try (InputStream in = LexiconReader.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("Lexicon resource not found: " + resource);
            return read(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read lexicon resource " + resource, e);
        }
    }

    public static DefinitionLexicon bundled() {
        return readResource(BUNDLED);
    }
}
