package com.expecta.debug;

/** Severity of a debug message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
