package com.tale.debug;

import java.io.PrintStream;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/** Line-oriented sink: {@code 12:00:01.123 INFO  [tag] message}. */
public final class StreamDebugSink implements DebugSink {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final PrintStream out;

    public StreamDebugSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        synchronized (out) {
            out.println(TIME.format(LocalTime.now()) + " " + String.format("%-5s", level) + " [" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
