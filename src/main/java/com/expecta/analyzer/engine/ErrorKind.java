package com.expecta.analyzer.engine;

public enum ErrorKind {
    /** Word missing from the lexicon. Only fatal in strict-lexicon mode. */
    UNKNOWN_WORD("unknown_word"),
    /** An expression or template read a slot that was never declared. */
    UNBOUND_SLOT("unbound_slot"),
    /** Variable resolution re-entered a slot that is still being resolved. */
    CYCLIC_BINDING("cyclic_binding"),
    /** Lexicon data or a request expression does not have the expected shape. */
    MALFORMED_REQUEST("malformed_request");

    private final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
