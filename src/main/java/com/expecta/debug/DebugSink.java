package com.expecta.debug;

/** Pluggable debug output target (stdout, test capture, host logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
