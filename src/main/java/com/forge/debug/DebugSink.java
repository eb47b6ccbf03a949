package com.forge.debug;

/** Pluggable debug output target (stderr, a test buffer, the host's logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
