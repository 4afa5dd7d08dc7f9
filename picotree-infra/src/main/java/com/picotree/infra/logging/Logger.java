package com.picotree.infra.logging;

/**
 * <b>Event Logger Interface.</b>
 * <p>
 * Logs are treated as events: a label and, optionally, a number. Callers on a
 * busy path pass constants and primitives instead of building strings.
 * </p>
 */
public interface Logger {
    void log(CharSequence message);

    void log(long value);

    void log(CharSequence message, long value);
}
