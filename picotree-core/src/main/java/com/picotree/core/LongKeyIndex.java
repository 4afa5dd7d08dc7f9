package com.picotree.core;

import com.picotree.api.NodeVisitor;
import org.agrona.collections.Long2ObjectHashMap;

/**
 * <h1>Long Key Index: Hash for Lookup, Tree for Order</h1>
 *
 * <p>
 * A small host program for {@link RedBlackTree}: it owns the records (through a
 * {@link NodePool}) and indexes them two ways.
 * </p>
 *
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose (Time Complexity)</th>
 * </tr>
 * <tr>
 * <td><b>Lookup</b></td>
 * <td>{@link Long2ObjectHashMap}</td>
 * <td><b>O(1)</b> point access by key, no boxing.</td>
 * </tr>
 * <tr>
 * <td><b>Ordering</b></td>
 * <td>{@link RedBlackTree} (Intrusive)</td>
 * <td><b>O(log N)</b> smallest/largest key and in-order walks.</td>
 * </tr>
 * </table>
 *
 * <p>
 * Keys are never removed: the tree has no deletion. <b>NOT Thread-Safe</b>; feed
 * it from one thread (see {@code IndexServer} for a single-writer pipeline).
 * </p>
 */
public class LongKeyIndex {

    private final Long2ObjectHashMap<LongEntry> entries = new Long2ObjectHashMap<>();
    private final RedBlackTree<LongEntry> tree;
    private final NodePool<LongEntry> pool;

    public LongKeyIndex(int capacity) {
        this(capacity, Boolean.getBoolean(RedBlackTree.CHECK_INVARIANTS_PROPERTY));
    }

    public LongKeyIndex(int capacity, boolean checkInvariants) {
        this.pool = new NodePool<>(capacity, LongEntry::new, LongEntry::reset);
        this.tree = new RedBlackTree<>((a, b) -> Long.compare(a.key, b.key), checkInvariants);
    }

    /**
     * Adds {@code key}, or overwrites its value if already present.
     *
     * @return true if the key was new.
     * @throws IllegalStateException if the key is new and the pool is empty.
     */
    public boolean put(long key, long value) {
        LongEntry entry = entries.get(key);
        if (entry != null) {
            entry.value = value;
            return false;
        }

        entry = pool.borrow();
        entry.key = key;
        entry.value = value;
        // Tree first: if a checked insert fails, the hash never sees the key.
        tree.insert(entry);
        entries.put(key, entry);
        return true;
    }

    public LongEntry get(long key) {
        return entries.get(key);
    }

    public boolean containsKey(long key) {
        return entries.containsKey(key);
    }

    public long valueOr(long key, long missing) {
        LongEntry entry = entries.get(key);
        return entry == null ? missing : entry.value;
    }

    public LongEntry first() {
        return tree.first();
    }

    public LongEntry last() {
        return tree.last();
    }

    public int size() {
        return entries.size();
    }

    public int remainingCapacity() {
        return pool.available();
    }

    /**
     * Walks the entries in ascending key order.
     *
     * @return 0 after a full walk, otherwise the visitor's stop code.
     */
    public <S> int forEachInOrder(NodeVisitor<? super LongEntry, S> visitor, S scratch) {
        return tree.traverse(visitor, scratch);
    }

    /**
     * @return The underlying tree (for testing/inspection only)
     */
    public RedBlackTree<LongEntry> tree() {
        return tree;
    }
}
