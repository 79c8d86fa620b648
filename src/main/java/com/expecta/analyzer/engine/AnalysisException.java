package com.expecta.analyzer.engine;

/**
 * Failure raised while analysing a sentence. The kind tag is what hosts and
 * error handlers dispatch on; the message carries the offending slot, word or
 * lexicon fragment.
 */
public class AnalysisException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String subject;

    public AnalysisException(ErrorKind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public AnalysisException(ErrorKind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public static AnalysisException unboundSlot(String slot) {
        return new AnalysisException(ErrorKind.UNBOUND_SLOT, slot, "Unbound slot: " + slot);
    }

    public static AnalysisException malformed(String what, String message) {
        return new AnalysisException(ErrorKind.MALFORMED_REQUEST, what, message);
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Slot, word or function name the failure is about; may be null. */
    public String subject() {
        return subject;
    }
}
