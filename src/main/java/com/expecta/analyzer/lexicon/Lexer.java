package com.expecta.analyzer.lexicon;

import java.util.ArrayList;
import java.util.List;

import com.expecta.analyzer.engine.AnalysisException;

/**
 * Tokenizer for lexicon sources: parentheses, quote, symbols, {@code ?variables}
 * and numbers. {@code ;} starts a comment that runs to the end of the line.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '\'': addToken(TokenType.QUOTE); break;
            case ';':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '?':
                variable();
                break;
            case '"':
                throw error("Strings are not supported in lexicon data");
            default:
                if (isDigit(c) || ((c == '-' || c == '+') && isDigit(peek()))) number();
                else symbol();
        }
    }

    private void variable() {
        while (isSymbolChar(peek())) advance();
        if (current - start == 1) throw error("Expect variable name after '?'");
        String name = source.substring(start + 1, current);
        addToken(TokenType.VARIABLE, name);
    }

    private void symbol() {
        while (isSymbolChar(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.SYMBOL, text);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (isSymbolChar(peek())) {
            // 2nd, 3d-form ... are symbols, not numbers
            symbol();
            return;
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private boolean isSymbolChar(char c) {
        switch (c) {
            case '\0': case '(': case ')': case '\'': case ';': case '"':
            case ' ': case '\r': case '\t': case '\n':
                return false;
            default:
                return true;
        }
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private AnalysisException error(String msg) {
        return AnalysisException.malformed("lexicon", "[line " + line + "] " + msg);
    }
}
