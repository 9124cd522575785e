package com.pascals.debug;

import java.io.PrintStream;

/** Pluggable debug output target (stderr, test collector, file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /** Sink printing "[LEVEL] tag: message" lines at or above {@code threshold}. */
    static DebugSink printing(PrintStream out, DebugLevel threshold) {
        return (level, tag, message, error) -> {
            if (level.ordinal() < threshold.ordinal()) return;
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }
}
