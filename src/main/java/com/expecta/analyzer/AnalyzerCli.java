package com.expecta.analyzer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.ResetPolicy;
import com.expecta.analyzer.lexicon.DefinitionLexicon;
import com.expecta.analyzer.lexicon.JsonLexiconLoader;
import com.expecta.analyzer.lexicon.LexiconReader;
import com.expecta.debug.Debug;
import com.expecta.debug.DebugLevel;
import com.expecta.protocol.CdFormCodec;

/**
 * Reads sentences from stdin, one per line, and prints the concept of each.
 *
 * <pre>
 * AnalyzerCli [--json] [--trace] [--strict] [--carry-over] [lexicon-file]
 * </pre>
 *
 * Without a lexicon file the bundled lexicon is used; files ending in
 * {@code .json} are read with {@link JsonLexiconLoader}.
 */
public final class AnalyzerCli {

    public static void main(String[] args) {
        boolean json = false;
        boolean trace = false;
        boolean strict = false;
        boolean carryOver = false;
        Path lexiconPath = null;

        for (String a : args) {
            switch (a) {
                case "--json": json = true; break;
                case "--trace": trace = true; break;
                case "--strict": strict = true; break;
                case "--carry-over": carryOver = true; break;
                default:
                    if (a.startsWith("--") || lexiconPath != null) {
                        usage();
                        return;
                    }
                    lexiconPath = Path.of(a);
            }
        }

        Debug.useSysOut(trace ? DebugLevel.TRACE : DebugLevel.WARN);

        final DefinitionLexicon lexicon;
        try {
            lexicon = loadLexicon(lexiconPath);
        } catch (IOException | AnalysisException e) {
            System.err.println("Failed to read lexicon: " + lexiconPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        ConceptualAnalyzer analyzer = new ConceptualAnalyzer(lexicon);
        analyzer.setStrictLexicon(strict);
        analyzer.setResetPolicy(carryOver ? ResetPolicy.CARRY_OVER : ResetPolicy.RESET);
        // Report and keep going; failures are counted from the results.
        analyzer.setErrorHandler((e, words) -> System.err.println("[" + e.kind().tag() + "] " + e.getMessage()));

        CdFormCodec codec = new CdFormCodec();
        int failures = 0;

        try (BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = stdin.readLine()) != null) {
                if (line.trim().isEmpty()) continue;

                ParseResult result = analyzer.parse(line);
                if (!result.ok()) failures++;

                if (json) {
                    System.out.println(codec.write(codec.toJson(result), false));
                } else {
                    System.out.println(result.words() + " => " + result);
                    if (!result.unknownWords().isEmpty()) {
                        System.err.println("  not in lexicon: " + result.unknownWords());
                    }
                }
            }
        } catch (IOException e) {
            System.err.println("Failed to read input:");
            e.printStackTrace(System.err);
            System.exit(1);
            return;
        }

        if (failures > 0) System.exit(1);
    }

    private static DefinitionLexicon loadLexicon(Path path) throws IOException {
        if (path == null) return LexiconReader.bundled();
        if (path.getFileName().toString().endsWith(".json")) return new JsonLexiconLoader().load(path);
        return LexiconReader.readFile(path);
    }

    private static void usage() {
        System.err.println("Usage: AnalyzerCli [--json] [--trace] [--strict] [--carry-over] [lexicon-file]");
        System.exit(2);
    }

    private AnalyzerCli() {}
}
