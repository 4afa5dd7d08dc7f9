package com.picotree.core;

import com.picotree.api.RbColor;
import com.picotree.api.RbNode;

/**
 * <b>The Referee: Red-Black Invariant Checker.</b>
 * <p>
 * Debug scaffolding, not part of the hot path. Every check is a full O(N) walk.
 * Tests call it before and after each insertion; a tree built with checking
 * enabled calls it itself.
 * </p>
 */
public final class RedBlackChecker {

    /** Returned by {@link #blackHeight(RbNode)} when two paths disagree. */
    public static final int VIOLATED = -1;

    public enum Violation {
        NONE,
        INVALID_COLOR,
        RED_ROOT,
        RED_RED,
        BLACK_HEIGHT
    }

    private RedBlackChecker() {
    }

    /**
     * Rule 1: every color tag is RED or BLACK.
     */
    public static boolean checkColors(RbNode node) {
        if (node == null)
            return true;
        return RbColor.isValid(node.color) && checkColors(node.left) && checkColors(node.right);
    }

    /**
     * Rule 4: no RED node has a RED child, anywhere in the subtree.
     */
    public static boolean checkRedNodes(RbNode node) {
        if (node == null)
            return true;
        if (node.color == RbColor.RED && (isRed(node.left) || isRed(node.right)))
            return false;
        return checkRedNodes(node.left) && checkRedNodes(node.right);
    }

    /**
     * Rule 5: counts BLACK nodes on the way down, empty children included.
     *
     * @return The black-height of {@code node} (1 for an empty subtree), or
     *         {@link #VIOLATED} if two paths disagree.
     */
    public static int blackHeight(RbNode node) {
        if (node == null)
            return 1;

        int left = blackHeight(node.left);
        if (left == VIOLATED)
            return VIOLATED;
        int right = blackHeight(node.right);
        if (right == VIOLATED || left != right)
            return VIOLATED;

        return left + (node.color == RbColor.RED ? 0 : 1);
    }

    /**
     * Checks a subtree. The root color rule is not applied, so any subtree of a
     * valid tree passes.
     */
    public static Violation check(RbNode node) {
        if (!checkColors(node))
            return Violation.INVALID_COLOR;
        if (!checkRedNodes(node))
            return Violation.RED_RED;
        if (blackHeight(node) == VIOLATED)
            return Violation.BLACK_HEIGHT;
        return Violation.NONE;
    }

    /**
     * Checks a whole tree, root color included.
     */
    public static Violation check(RedBlackTree<?> tree) {
        RbNode root = tree.getRoot();
        Violation violation = check(root);
        if (violation != Violation.NONE)
            return violation;
        if (isRed(root))
            return Violation.RED_ROOT;
        return Violation.NONE;
    }

    public static boolean isValid(RedBlackTree<?> tree) {
        return check(tree) == Violation.NONE;
    }

    /**
     * Fail-fast form of {@link #check(RedBlackTree)}.
     *
     * @throws IllegalStateException naming the broken rule.
     */
    public static void verify(RedBlackTree<?> tree) {
        Violation violation = check(tree);
        if (violation != Violation.NONE) {
            RbNode root = tree.getRoot();
            throw new IllegalStateException("Red-black invariant violated: " + violation
                    + " (root color " + (root == null ? "none" : RbColor.name(root.color)) + ")");
        }
    }

    private static boolean isRed(RbNode node) {
        return node != null && node.isRed();
    }
}
