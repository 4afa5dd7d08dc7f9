package com.picotree.api;

/**
 * <b>RbColor: The Tag Every Node Carries.</b>
 * <p>
 * A red-black tree node is either RED or BLACK. Nothing else.
 * </p>
 *
 * <h3>Why Byte Constants?</h3>
 * <p>
 * The tag lives inside the caller's own record, right next to its payload. A
 * {@code byte} costs one byte and can be compared with a single instruction. It
 * also means a corrupted tag is <i>representable</i>, which is exactly what the
 * invariant checker needs to be able to catch (Rule 1: "Every node is either RED
 * or BLACK").
 * </p>
 */
public final class RbColor {
    /** Black node. Absent children count as BLACK too. */
    public static final byte BLACK = 0;

    /** Red node. Freshly inserted nodes start RED. */
    public static final byte RED = 1;

    private RbColor() {
        // Prevent instantiation
    }

    /**
     * @return true if {@code color} is one of the two legal tags.
     */
    public static boolean isValid(byte color) {
        return color == BLACK || color == RED;
    }

    public static String name(byte color) {
        switch (color) {
            case BLACK:
                return "BLACK";
            case RED:
                return "RED";
            default:
                return "INVALID(" + color + ")";
        }
    }
}
