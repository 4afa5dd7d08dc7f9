package com.picotree.core;

import com.picotree.api.RbNode;

/**
 * A {@code long -> long} record that is its own tree node.
 */
public class LongEntry extends RbNode {
    public long key;
    public long value;

    public void reset() {
        key = 0;
        value = 0;
        unlink();
    }

    @Override
    public String toString() {
        return "LongEntry{" +
                "key=" + key +
                ", value=" + value +
                '}';
    }
}
