package com.picotree.infra;

import com.picotree.infra.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every event in memory so tests can look at them.
 */
public class RecordingLogger implements Logger {

    public final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void log(CharSequence message) {
        events.add(message.toString());
    }

    @Override
    public void log(long value) {
        events.add(Long.toString(value));
    }

    @Override
    public void log(CharSequence message, long value) {
        events.add(message + "=" + value);
    }

    public boolean contains(String event) {
        return events.contains(event);
    }
}
