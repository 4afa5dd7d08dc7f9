package com.picotree.infra.logging;

import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.ExcerptAppender;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;

/**
 * <b>Chronicle Logger Implementation.</b>
 * <p>
 * Appends events to a memory-mapped Chronicle Queue directory as binary
 * documents, one document per event:
 * </p>
 * <ul>
 * <li>{@code log(text)} writes {@value #MESSAGE}.</li>
 * <li>{@code log(number)} writes {@value #VALUE}.</li>
 * <li>{@code log(label, number)} writes {@value #EVENT} and {@value #VALUE}.</li>
 * </ul>
 * <p>
 * Read them back with any Chronicle tailer.
 * </p>
 */
public class ChronicleLogger implements Logger, AutoCloseable {

    public static final String MESSAGE = "msg";
    public static final String VALUE = "val";
    public static final String EVENT = "evt";

    private final String path;
    private final ChronicleQueue queue;
    private final ExcerptAppender appender;

    public ChronicleLogger(String path) {
        this.path = path;
        this.queue = SingleChronicleQueueBuilder.binary(path).build();
        this.appender = queue.acquireAppender();
    }

    @Override
    public void log(CharSequence message) {
        appender.writeDocument(w -> w.write(MESSAGE).text(message));
    }

    @Override
    public void log(long value) {
        appender.writeDocument(w -> w.write(VALUE).int64(value));
    }

    @Override
    public void log(CharSequence message, long value) {
        appender.writeDocument(w -> w.write(EVENT).text(message)
                .write(VALUE).int64(value));
    }

    public String path() {
        return path;
    }

    @Override
    public void close() {
        queue.close();
    }
}
