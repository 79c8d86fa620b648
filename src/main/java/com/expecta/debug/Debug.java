package com.expecta.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the analyzer.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 * - Messages below the configured threshold never reach the sink
 */
public final class Debug {

    // must be assigned before INSTANCE is constructed
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at or above {@code minLevel} to stdout (errors to stderr). */
    public static void useSysOut(DebugLevel minLevel) {
        INSTANCE.threshold = (minLevel == null) ? DebugLevel.TRACE : minLevel;
        INSTANCE.setSink(printSink(System.out, System.err));
    }

    public static void useSysOut() {
        useSysOut(DebugLevel.TRACE);
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setThreshold(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    public boolean enabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.atLeast(threshold);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        sinkRef.get().log(level, tag, message, error);
    }

    private static DebugSink printSink(PrintStream out, PrintStream err) {
        return (level, tag, message, error) -> {
            PrintStream ps = level.atLeast(DebugLevel.WARN) ? err : out;
            ps.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(ps);
        };
    }
}
