package org.replaysafe.junit.extensions.logging;

/**
 * Levels the log watch can assert on. DEBUG and TRACE are never inspected.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
