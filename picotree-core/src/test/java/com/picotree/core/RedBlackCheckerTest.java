package com.picotree.core;

import com.picotree.api.RbColor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedBlackCheckerTest {

    private static TestNode node(int n, byte color, TestNode left, TestNode right) {
        TestNode node = new TestNode(n);
        node.color = color;
        node.left = left;
        node.right = right;
        return node;
    }

    @Test
    void emptySubtreeIsValidWithBlackHeightOne() {
        assertEquals(1, RedBlackChecker.blackHeight(null));
        assertEquals(RedBlackChecker.Violation.NONE, RedBlackChecker.check((TestNode) null));
    }

    @Test
    void balancedTreeReportsBlackHeight() {
        //    2(B)
        //   /   \
        // 1(R)  3(R)
        TestNode root = node(2, RbColor.BLACK,
                node(1, RbColor.RED, null, null),
                node(3, RbColor.RED, null, null));

        assertEquals(2, RedBlackChecker.blackHeight(root));
        assertTrue(RedBlackChecker.checkRedNodes(root));
        assertTrue(RedBlackChecker.checkColors(root));
        assertEquals(RedBlackChecker.Violation.NONE, RedBlackChecker.check(root));
    }

    @Test
    void detectsInvalidColorTag() {
        TestNode root = node(2, RbColor.BLACK, node(1, (byte) 3, null, null), null);

        assertFalse(RedBlackChecker.checkColors(root));
        assertEquals(RedBlackChecker.Violation.INVALID_COLOR, RedBlackChecker.check(root));
    }

    @Test
    void detectsRedRedDeepInTheTree() {
        // The offending pair sits two levels below the root.
        TestNode deep = node(1, RbColor.RED, node(0, RbColor.RED, null, null), null);
        TestNode root = node(4, RbColor.BLACK,
                node(2, RbColor.BLACK, deep, node(3, RbColor.BLACK, null, null)),
                node(6, RbColor.BLACK, node(5, RbColor.BLACK, null, null), node(7, RbColor.BLACK, null, null)));

        assertFalse(RedBlackChecker.checkRedNodes(root));
        assertEquals(RedBlackChecker.Violation.RED_RED, RedBlackChecker.check(root));
    }

    @Test
    void detectsBlackHeightMismatch() {
        TestNode root = node(2, RbColor.BLACK, node(1, RbColor.BLACK, null, null), null);

        assertEquals(RedBlackChecker.VIOLATED, RedBlackChecker.blackHeight(root));
        assertEquals(RedBlackChecker.Violation.BLACK_HEIGHT, RedBlackChecker.check(root));
    }

    @Test
    void redRootOnlyMattersForWholeTree() {
        RedBlackTree<TestNode> tree = new RedBlackTree<>(TestNode.BY_KEY, false);
        tree.insert(new TestNode(1));
        tree.getRoot().color = RbColor.RED;

        assertEquals(RedBlackChecker.Violation.NONE, RedBlackChecker.check(tree.getRoot()));
        assertEquals(RedBlackChecker.Violation.RED_ROOT, RedBlackChecker.check(tree));
        assertFalse(RedBlackChecker.isValid(tree));
        assertThrows(IllegalStateException.class, () -> RedBlackChecker.verify(tree));
    }
}
