package com.tale.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all TALE components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 *
 * The sandbox never writes here on behalf of a user program; program output
 * only ever lands in the per-run buffer.
 */
public final class Debug {

    // must be initialized before INSTANCE, whose constructor reads it
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

    /** Routes everything at or above INFO to stderr. Used by the CLI and the RPC server. */
    public static void useSysOut() {
        INSTANCE.threshold = DebugLevel.INFO;
        INSTANCE.setSink(new StreamDebugSink(System.err));
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

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < threshold.ordinal()) return;
        DebugSink sink = sinkRef.get();
        if (sink != null) sink.log(level, tag, message, error);
    }
}
