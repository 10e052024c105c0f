package org.fluxgen.junit.extensions.logging;

/**
 * Levels the log watcher distinguishes. Anything below {@link #INFO} is never captured.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
