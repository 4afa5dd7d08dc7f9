package com.picotree.infra.logging;

import java.io.PrintStream;

/**
 * Writes events to a console stream. Handy for tools run by hand.
 */
public class ConsoleLogger implements Logger {

    private final PrintStream out;
    private final String prefix;

    public ConsoleLogger(String prefix) {
        this(System.out, prefix);
    }

    public ConsoleLogger(PrintStream out, String prefix) {
        this.out = out;
        this.prefix = prefix;
    }

    @Override
    public void log(CharSequence message) {
        out.println(prefix + ": " + message);
    }

    @Override
    public void log(long value) {
        out.println(prefix + ": " + value);
    }

    @Override
    public void log(CharSequence message, long value) {
        out.println(prefix + ": " + message + " = " + value);
    }
}
