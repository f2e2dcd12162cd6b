package com.aki.debug;

/** Pluggable debug output target (SLF4J, stderr, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
