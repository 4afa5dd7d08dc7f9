package com.picotree.infra;

import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.picotree.core.LongKeyIndex;
import com.picotree.infra.logging.Logger;

import java.util.concurrent.TimeUnit;

/**
 * <b>The Single-Writer Index Server.</b>
 * <p>
 * The tree has no locks. This class is the <b>Composition Root</b> that lets many
 * threads feed it anyway: every {@code put} is serialized into a Disruptor ring
 * and applied by exactly one consumer thread.
 * </p>
 *
 * <pre>
 * [Producer A]  [Producer B]  ...
 *       \           /
 *     (Input Ring Buffer, MULTI producer)
 *             |
 *             v
 * [IndexCommandHandler] -> LongKeyIndex -> RedBlackTree
 * </pre>
 *
 * <p>
 * Reads of the index from other threads are only safe once
 * {@link #awaitApplied(long, long, TimeUnit)} has returned true, or after
 * {@link #stop()}.
 * </p>
 */
public class IndexServer {

    public static final int DEFAULT_RING_SIZE = 65536;

    private final Disruptor<IndexCommand> disruptor;
    private final RingBuffer<IndexCommand> ringBuffer;
    private final IndexCommandHandler handler;
    private final LongKeyIndex index;
    private final Logger logger;

    public IndexServer(LongKeyIndex index, Logger logger) {
        this(index, DEFAULT_RING_SIZE, logger);
    }

    /**
     * @param ringSize Must be a power of two.
     */
    public IndexServer(LongKeyIndex index, int ringSize, Logger logger) {
        this.index = index;
        this.logger = logger;
        this.handler = new IndexCommandHandler(index, logger);

        this.disruptor = new Disruptor<>(
                IndexCommand.FACTORY,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BusySpinWaitStrategy());
        this.disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();

        logger.log("Index server started, ring size", ringSize);
    }

    /**
     * Queues a {@code put}. Safe from any thread; blocks only while the ring is full.
     */
    public void submit(long key, long value) {
        long sequence = ringBuffer.next();
        try {
            IndexCommand command = ringBuffer.get(sequence);
            command.key = key;
            command.value = value;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Waits until the consumer has handled at least {@code count} commands.
     *
     * @return true if reached, false on timeout or interrupt.
     */
    public boolean awaitApplied(long count, long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (handler.processed() < count) {
            if (System.nanoTime() - deadline > 0) {
                return false;
            }
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            Thread.yield();
        }
        return true;
    }

    public long applied() {
        return handler.processed();
    }

    public long rejected() {
        return handler.rejected();
    }

    /**
     * @return The index (read it only after the writes you care about are applied)
     */
    public LongKeyIndex getIndex() {
        return index;
    }

    /**
     * Drains the ring and stops the consumer thread.
     */
    public void stop() {
        disruptor.shutdown();
        logger.log("Index server stopped, applied", handler.processed());
    }
}
