package com.picotree.core;

import com.picotree.api.NodeComparator;
import com.picotree.api.NodeVisitor;
import com.picotree.api.RbColor;
import com.picotree.api.RbNode;

/**
 * <h1>Intrusive Red-Black Tree: Balance Without Back-Pointers</h1>
 *
 * <p>
 * An ordered search structure over <b>your</b> records. You extend
 * {@link RbNode}, we link your objects together. Search and insertion are
 * <b>O(log N)</b>, and neither of them allocates a single object.
 * </p>
 *
 * <h2>The "Intrusive" Concept</h2>
 * <p>
 * A {@code java.util.TreeMap} wraps every entry in an {@code Entry} object.
 * Here the record <i>is</i> the node: it carries its own {@code left},
 * {@code right} and {@code color}. The tree only holds the way in (the root)
 * and the ordering (the {@link NodeComparator}).
 * </p>
 *
 * <h2>No Parent Pointers</h2>
 * <p>
 * The classic fix-up climbs parent links. We never store them. Instead,
 * {@link #insert(RbNode)} writes down the path it took (see {@link InsertPath})
 * and walks that trail back up. Rotations rewrite one slot and two child links,
 * and there is no parent link they could forget to fix.
 * </p>
 *
 * <h2>The Rules of the Red-Black Game</h2>
 * <ol>
 * <li><b>Every node is either RED or BLACK.</b></li>
 * <li><b>The Root is always BLACK.</b></li>
 * <li><b>Empty children count as BLACK.</b></li>
 * <li><b>No two RED nodes can be neighbors.</b></li>
 * <li><b>Every path down to an empty child crosses the same number of BLACK
 * nodes.</b></li>
 * </ol>
 * <p>
 * Together they keep the height under {@code 2 * log2(N + 1)}.
 * </p>
 *
 * <h2>Threading</h2>
 * <p>
 * <b>NOT Thread-Safe.</b> Readers may share an unchanging tree. Any insertion
 * needs the caller's own mutual exclusion (or a single writer thread).
 * </p>
 *
 * @param <N> The caller's record type.
 */
public class RedBlackTree<N extends RbNode> {

    /** System property that switches on invariant checks for new trees. */
    public static final String CHECK_INVARIANTS_PROPERTY = "picotree.checkInvariants";

    // header.left is the root slot, so the root is hung like any other child.
    private final RbNode header = new RbNode();
    private final NodeComparator<N> comparator;
    private final InsertPath path = new InsertPath();
    private final boolean checkInvariants;

    /**
     * Creates an empty tree. Invariant checks follow
     * {@value #CHECK_INVARIANTS_PROPERTY}.
     */
    public RedBlackTree(NodeComparator<N> comparator) {
        this(comparator, Boolean.getBoolean(CHECK_INVARIANTS_PROPERTY));
    }

    /**
     * @param comparator      Ordering for the tree's whole lifetime.
     * @param checkInvariants If true, every insertion verifies the tree before and
     *                        after (debug mode, O(N) per insert).
     */
    public RedBlackTree(NodeComparator<N> comparator, boolean checkInvariants) {
        if (comparator == null) {
            throw new IllegalArgumentException("comparator must not be null");
        }
        this.comparator = comparator;
        this.checkInvariants = checkInvariants;
    }

    /**
     * @return The root (the anchor), or null when empty.
     */
    public N getRoot() {
        return cast(header.left);
    }

    public boolean isEmpty() {
        return header.left == null;
    }

    public boolean isCheckingInvariants() {
        return checkInvariants;
    }

    /**
     * Finds the node that compares equal to {@code key}.
     * <ul>
     * <li>Smaller? Go Left.</li>
     * <li>Larger? Go Right.</li>
     * <li>Equal? Return it.</li>
     * </ul>
     *
     * @param key Any record of the tree's type; it does not have to be in the tree.
     * @return The matching node, or null if none.
     */
    public N search(N key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        RbNode current = header.left;
        while (current != null) {
            int cmp = comparator.compare(key, cast(current));
            if (cmp < 0) {
                current = current.left;
            } else if (cmp > 0) {
                current = current.right;
            } else {
                return cast(current);
            }
        }
        return null;
    }

    /**
     * @return Smallest node, or null when empty.
     */
    public N first() {
        RbNode current = header.left;
        if (current == null)
            return null;
        while (current.left != null) {
            current = current.left;
        }
        return cast(current);
    }

    /**
     * @return Largest node, or null when empty.
     */
    public N last() {
        RbNode current = header.left;
        if (current == null)
            return null;
        while (current.right != null) {
            current = current.right;
        }
        return cast(current);
    }

    /**
     * @return Number of nodes on the longest root-to-leaf path (0 when empty).
     */
    public int height() {
        return height(header.left);
    }

    private static int height(RbNode node) {
        if (node == null)
            return 0;
        return 1 + Math.max(height(node.left), height(node.right));
    }

    /**
     * Links {@code node} into the tree and restores balance.
     * <p>
     * The node must not be a member of any tree. Its links and color are
     * overwritten. Keys that compare equal to an existing node go to its right,
     * so duplicates are kept in insertion order.
     * </p>
     *
     * @param node A caller-owned record.
     */
    public void insert(N node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        if (checkInvariants) {
            RedBlackChecker.verify(this);
        }

        // 1. New nodes are always RED (optimistic).
        node.color = RbColor.RED;
        node.left = null;
        node.right = null;

        // 2. Walk down, writing the trail as we go.
        path.clear();
        path.push(header, true, null);
        RbNode current = header.left;
        RbNode sibling = null;
        while (current != null) {
            RbNode uncle = sibling;
            if (comparator.compare(node, cast(current)) < 0) {
                sibling = current.right;
                path.push(current, true, uncle);
                current = current.left;
            } else {
                sibling = current.left;
                path.push(current, false, uncle);
                current = current.right;
            }
        }

        // 3. Hang it in the empty slot we ended on.
        int level = path.top();
        path.link(level, node);

        // 4. Repair the colors.
        rebalanceAfterInsertion(level);
        path.clear();

        if (checkInvariants) {
            RedBlackChecker.verify(this);
        }
    }

    /**
     * Restores the rules after a RED node landed in slot {@code level}.
     * <p>
     * <b>The Problem:</b> a RED node under a RED parent ("Double Red").
     * <br>
     * <b>The Solutions:</b>
     * <ul>
     * <li><b>Red Uncle:</b> flip colors and move the problem two levels up.</li>
     * <li><b>Black Uncle, Triangle:</b> rotate the zig-zag into a line first.</li>
     * <li><b>Black Uncle, Line:</b> recolor and rotate the grandparent. Done.</li>
     * </ul>
     * </p>
     */
    private void rebalanceAfterInsertion(int level) {
        RbNode node;
        RbNode parent;
        RbNode grandparent;

        while (true) {
            node = path.nodeAt(level);

            // Reached the root: paint it BLACK and we are done.
            if (level == 0) {
                node.color = RbColor.BLACK;
                return;
            }

            parent = path.nodeAt(level - 1);
            if (parent.isBlack()) {
                return;
            }

            // A RED parent is never the root, so a grandparent exists.
            if (level < 2) {
                throw new IllegalStateException("Root is RED; tree was invalid before insertion");
            }
            grandparent = path.nodeAt(level - 2);
            RbNode uncle = path.uncleAt(level);

            if (uncle != null && uncle.isRed()) {
                parent.color = RbColor.BLACK;
                uncle.color = RbColor.BLACK;
                grandparent.color = RbColor.RED;
                level -= 2;
            } else {
                break;
            }
        }

        // Triangle: turn it into a line. The trail below level - 1 is stale after
        // this, but only level - 2 is used from here on.
        if (node == parent.right && parent == grandparent.left) {
            path.rotateLeft(level - 1);
            parent = node;
        } else if (node == parent.left && parent == grandparent.right) {
            path.rotateRight(level - 1);
            parent = node;
        }

        // Line.
        parent.color = RbColor.BLACK;
        grandparent.color = RbColor.RED;
        if (parent == grandparent.right) {
            path.rotateLeft(level - 2);
        } else {
            path.rotateRight(level - 2);
        }
    }

    /**
     * In-order walk (smallest first).
     *
     * @param visitor Called once per node; a non-zero return stops the walk.
     * @param scratch Passed to every call.
     * @return 0 after a full walk, otherwise the visitor's stop code.
     */
    public <S> int traverse(NodeVisitor<? super N, S> visitor, S scratch) {
        if (visitor == null) {
            throw new IllegalArgumentException("visitor must not be null");
        }
        return traverse(header.left, visitor, scratch);
    }

    private <S> int traverse(RbNode node, NodeVisitor<? super N, S> visitor, S scratch) {
        if (node == null)
            return 0;

        int rc = traverse(node.left, visitor, scratch);
        if (rc != 0)
            return rc;

        rc = visitor.visit(cast(node), scratch);
        if (rc != 0)
            return rc;

        return traverse(node.right, visitor, scratch);
    }

    // Every node reachable from the header was inserted as an N.
    @SuppressWarnings("unchecked")
    private N cast(RbNode node) {
        return (N) node;
    }
}
