package com.picotree.api;

/**
 * Caller-defined ordering over caller-defined records.
 * <p>
 * Must be a consistent total order for as long as the records stay in a tree:
 * negative if {@code a < b}, zero if equal, positive if {@code a > b}. Only the
 * sign matters. Breaking the contract gives an undefined tree shape, it is not
 * detected.
 * </p>
 *
 * @param <N> The record type stored in the tree.
 */
@FunctionalInterface
public interface NodeComparator<N extends RbNode> {
    int compare(N a, N b);
}
