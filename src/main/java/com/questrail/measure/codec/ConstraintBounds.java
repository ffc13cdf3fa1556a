package com.questrail.measure.codec;

/**
 * The four logical integers held by a packed constraints word.
 *
 * <p>This is the unpacked form that callers and the constraint algebra
 * reason about. An unbounded max is represented by {@link #INFINITY}. The
 * record itself performs no validation; {@link ConstraintsCodec#encode}
 * validates when the bounds are packed.</p>
 */
public record ConstraintBounds(
        int minWidth,
        int maxWidth,
        int minHeight,
        int maxHeight
) {
    /**
     * Sentinel for "no upper bound". It sits in the middle of the negative
     * int range so that adding or subtracting from it does not easily roll
     * over into a legal bound.
     */
    public static final int INFINITY = Integer.MIN_VALUE / 2;

    public boolean hasBoundedWidth() {
        return maxWidth != INFINITY;
    }

    public boolean hasBoundedHeight() {
        return maxHeight != INFINITY;
    }

    @Override
    public String toString() {
        return "ConstraintBounds[minWidth=" + minWidth
                + ", maxWidth=" + format(maxWidth)
                + ", minHeight=" + minHeight
                + ", maxHeight=" + format(maxHeight) + "]";
    }

    static String format(int bound) {
        return (bound == INFINITY) ? "Infinity" : Integer.toString(bound);
    }
}
