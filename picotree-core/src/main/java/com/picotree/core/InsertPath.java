package com.picotree.core;

import com.picotree.api.RbNode;

/**
 * <b>The Breadcrumb Trail (Insertion Backtrace)</b>
 * <p>
 * Our nodes have no parent pointer, so on the way down we remember <i>where</i>
 * we went. Each level stores a <b>slot</b>: the node that owns the link plus
 * which side of it (left or right). Reading the slot gives the node sitting
 * there; writing the slot re-hangs a different node in its place, which is all
 * a rotation needs.
 * </p>
 *
 * <pre>
 * level 0   header.left   (the root slot)
 * level 1   root.left     uncle = null
 * level 2   a.right       uncle = root.right
 * ...
 * </pre>
 *
 * <p>
 * Alongside each slot we keep the <b>uncle</b> of the node that ends up there
 * (the sibling of its parent), so the fix-up never has to walk sideways.
 * </p>
 * <p>
 * Capacity is fixed. A red-black tree of height 128 would hold about 2^64
 * nodes, so running out of levels means the tree was already broken.
 * The arrays are allocated once with the tree and reused: insertion itself never
 * allocates.
 * </p>
 */
final class InsertPath {

    static final int MAX_DEPTH = 128;

    private final RbNode[] owners = new RbNode[MAX_DEPTH];
    private final boolean[] leftSide = new boolean[MAX_DEPTH];
    private final RbNode[] uncles = new RbNode[MAX_DEPTH];
    private int length;

    void clear() {
        // Drop references so the path does not keep detached records reachable.
        for (int i = 0; i < length; i++) {
            owners[i] = null;
            uncles[i] = null;
        }
        length = 0;
    }

    /**
     * Records the next slot on the way down.
     *
     * @param owner The node whose child link is the slot.
     * @param left  true for {@code owner.left}, false for {@code owner.right}.
     * @param uncle Sibling of {@code owner}, or null.
     */
    void push(RbNode owner, boolean left, RbNode uncle) {
        if (length == MAX_DEPTH) {
            throw new IllegalStateException(
                    "Insertion path exceeds " + MAX_DEPTH + " levels; tree balance is broken");
        }
        owners[length] = owner;
        leftSide[length] = left;
        uncles[length] = uncle;
        length++;
    }

    /**
     * @return Index of the deepest recorded slot.
     */
    int top() {
        return length - 1;
    }

    int length() {
        return length;
    }

    RbNode nodeAt(int level) {
        RbNode owner = owners[level];
        return leftSide[level] ? owner.left : owner.right;
    }

    RbNode uncleAt(int level) {
        return uncles[level];
    }

    void link(int level, RbNode node) {
        if (leftSide[level]) {
            owners[level].left = node;
        } else {
            owners[level].right = node;
        }
    }

    /**
     * <h3>Left Rotation (at a slot)</h3>
     *
     * <pre>
     *    slot          slot
     *     |             |
     *     P             R
     *    / \           / \
     *   a   R   ==>   P   c
     *      / \       / \
     *     b   c     a   b
     * </pre>
     *
     * Only the slot, {@code P.right} and {@code R.left} change.
     */
    void rotateLeft(int level) {
        RbNode p = nodeAt(level);
        RbNode r = p.right;
        if (r == null) {
            throw new IllegalStateException("Cannot rotate left: node has no right child");
        }
        link(level, r);
        p.right = r.left;
        r.left = p;
    }

    /**
     * <h3>Right Rotation (at a slot)</h3>
     * The mirror image. Pulls the left child up into the slot.
     */
    void rotateRight(int level) {
        RbNode p = nodeAt(level);
        RbNode l = p.left;
        if (l == null) {
            throw new IllegalStateException("Cannot rotate right: node has no left child");
        }
        link(level, l);
        p.left = l.right;
        l.right = p;
    }
}
