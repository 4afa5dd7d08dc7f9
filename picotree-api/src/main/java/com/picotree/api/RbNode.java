package com.picotree.api;

/**
 * <b>The Red-Black Node: An Intrusive Link Record</b>
 * <p>
 * Instead of a tree that wraps your record in its own {@code Node} object, your
 * record <i>is</i> the node. Extend this class, add your key and payload fields,
 * and hand instances straight to the tree.
 * </p>
 *
 * <pre>
 * class Account extends RbNode {
 *     long id;
 *     long balance;
 * }
 * </pre>
 *
 * <h3>No Parent Pointer</h3>
 * <p>
 * Only {@code left}, {@code right} and {@code color}. The tree recovers ancestor
 * context during insertion from the path it records on the way down, so there is
 * no back-reference that a rotation could forget to update.
 * </p>
 * <p>
 * The tree never allocates or frees these records. Their lifetime belongs to the
 * caller.
 * </p>
 */
public class RbNode {
    // Red-Black Tree links (Intrusive)
    public RbNode left;
    public RbNode right;
    public byte color = RbColor.BLACK;

    public boolean isRed() {
        return color == RbColor.RED;
    }

    public boolean isBlack() {
        return color == RbColor.BLACK;
    }

    /**
     * Clears the links so the record can be linked into a tree again.
     */
    public void unlink() {
        left = null;
        right = null;
        color = RbColor.BLACK;
    }
}
