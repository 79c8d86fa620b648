package com.expecta.analyzer.lexicon;

public enum TokenType {
    LEFT_PAREN,
    RIGHT_PAREN,
    QUOTE,
    SYMBOL,
    VARIABLE,
    NUMBER,
    EOF
}
