package com.picotree.infra;

import com.lmax.disruptor.EventFactory;

/**
 * Event wrapper for a pending {@code put} in the Ring Buffer.
 */
public class IndexCommand {
    public long key;
    public long value;

    public void reset() {
        key = 0;
        value = 0;
    }

    public final static EventFactory<IndexCommand> FACTORY = IndexCommand::new;
}
