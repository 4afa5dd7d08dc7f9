package com.picotree.infra;

import com.lmax.disruptor.EventHandler;
import com.picotree.core.LongKeyIndex;
import com.picotree.infra.logging.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The Consumer in the Disruptor pattern.
 * <p>
 * The only thread that ever touches the {@link LongKeyIndex}, which is what makes
 * the unsynchronized tree underneath it safe.
 * </p>
 */
public class IndexCommandHandler implements EventHandler<IndexCommand> {

    private final LongKeyIndex index;
    private final Logger logger;

    // Written by the consumer thread only; volatile reads give producers a
    // happens-before edge on the index contents.
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public IndexCommandHandler(LongKeyIndex index, Logger logger) {
        this.index = index;
        this.logger = logger;
    }

    @Override
    public void onEvent(IndexCommand event, long sequence, boolean endOfBatch) {
        if (!index.containsKey(event.key) && index.remainingCapacity() == 0) {
            // Pool exhausted: the command is dropped, the consumer keeps running.
            rejected.incrementAndGet();
            logger.log("put rejected", event.key);
        } else {
            index.put(event.key, event.value);
        }
        event.reset();
        processed.incrementAndGet();
    }

    public long processed() {
        return processed.get();
    }

    public long rejected() {
        return rejected.get();
    }
}
