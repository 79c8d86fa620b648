package com.expecta.analyzer.lexicon;

import java.util.ArrayList;
import java.util.List;

import com.expecta.analyzer.engine.AnalysisException;

/** Reads a token stream into a sequence of top-level {@link Datum}s. */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public static List<Datum> parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    /** Exactly one datum, e.g. a single packet written inline. */
    public static Datum parseOne(String source) {
        List<Datum> all = parse(source);
        if (all.size() != 1) {
            throw AnalysisException.malformed("lexicon", "Expect exactly one form, got " + all.size());
        }
        return all.get(0);
    }

    public List<Datum> parse() {
        List<Datum> forms = new ArrayList<>();
        while (!isAtEnd()) {
            forms.add(datum());
        }
        return forms;
    }

    private Datum datum() {
        if (match(TokenType.SYMBOL)) return Datum.symbol(previous().lexeme, previous().line);
        if (match(TokenType.NUMBER)) return Datum.number((Double) previous().literal, previous().line);
        if (match(TokenType.VARIABLE)) return Datum.variable((String) previous().literal, previous().line);

        if (match(TokenType.QUOTE)) {
            int line = previous().line;
            if (isAtEnd()) throw error(peek(), "Expect datum after quote.");
            return Datum.quote(datum(), line);
        }

        if (match(TokenType.LEFT_PAREN)) {
            int line = previous().line;
            List<Datum> items = new ArrayList<>();
            while (!check(TokenType.RIGHT_PAREN)) {
                if (isAtEnd()) throw error(peek(), "Unclosed '(' opened on line " + line + ".");
                items.add(datum());
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')'.");
            return Datum.list(items, line);
        }

        throw error(peek(), "Unexpected '" + peek().lexeme + "'.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private AnalysisException error(Token token, String message) {
        return AnalysisException.malformed("lexicon", "[line " + token.line + "] " + message);
    }
}
