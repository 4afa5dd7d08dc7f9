package com.picotree.core;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * <h1>Node Pool: Caller-Side Storage for Tree Records</h1>
 *
 * <p>
 * The tree never allocates. Somebody still has to own the records, and creating
 * a {@code new} one per insert just moves the garbage problem to the caller.
 * This pool does the allocating once, up front.
 * </p>
 *
 * <ul>
 * <li><b>Borrow:</b> take a record off the stack.</li>
 * <li><b>Release:</b> reset it and push it back.</li>
 * </ul>
 *
 * <p>
 * Single-threaded on purpose: the owner of a tree is already its only writer, so
 * a plain array and an index beat any CAS-based queue.
 * </p>
 *
 * @param <T> The record type.
 */
public class NodePool<T> {

    private final T[] slots;
    private final Consumer<T> resetter;
    private int top;

    @SuppressWarnings("unchecked")
    public NodePool(int capacity, Supplier<T> factory, Consumer<T> resetter) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.resetter = resetter;
        this.slots = (T[]) new Object[capacity];

        // Pre-allocate everything
        for (int i = 0; i < capacity; i++) {
            slots[i] = factory.get();
        }
        this.top = capacity;
    }

    /**
     * @throws IllegalStateException if every record is already out.
     */
    public T borrow() {
        if (top == 0) {
            throw new IllegalStateException("Node pool exhausted, capacity " + slots.length);
        }
        T record = slots[--top];
        slots[top] = null;
        return record;
    }

    /**
     * Resets {@code record} and makes it available again. Null is ignored.
     *
     * @throws IllegalStateException if more records come back than went out.
     */
    public void release(T record) {
        if (record == null) {
            return;
        }
        if (top == slots.length) {
            throw new IllegalStateException("Node pool overflow, capacity " + slots.length);
        }
        resetter.accept(record);
        slots[top++] = record;
    }

    public int available() {
        return top;
    }

    public int capacity() {
        return slots.length;
    }
}
