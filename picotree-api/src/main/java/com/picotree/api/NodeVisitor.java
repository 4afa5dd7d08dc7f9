package com.picotree.api;

/**
 * Callback for an in-order walk.
 * <p>
 * Return {@code 0} to keep walking. Any other value stops the walk and is handed
 * back to whoever started it.
 * </p>
 *
 * @param <N> The record type stored in the tree.
 * @param <S> Caller-supplied scratch state passed to every visit.
 */
@FunctionalInterface
public interface NodeVisitor<N extends RbNode, S> {
    int visit(N node, S scratch);
}
