package com.questrail.measure.core;

import com.questrail.measure.codec.ConstraintBounds;

import java.util.Objects;

import static com.questrail.measure.codec.ConstraintBounds.INFINITY;

/**
 * ConstraintAlgebra
 * -----------------------------------------------------------------------------
 * Pure arithmetic over unpacked {@link ConstraintBounds}.
 *
 * <p>Every range here is closed below and either closed above or open when
 * its max is {@link ConstraintBounds#INFINITY}. Results are not validated or
 * packed; callers feed them back through the codec.</p>
 */
public final class ConstraintAlgebra
{
    private ConstraintAlgebra() {}

    /**
     * Clamps every bound of {@code bounds} into the matching range of
     * {@code other}. The result always lies within {@code other}.
     */
    public static ConstraintBounds enforce(ConstraintBounds bounds, ConstraintBounds other) {
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(other, "other");

        return new ConstraintBounds(
                coerceIn(bounds.minWidth(), other.minWidth(), other.maxWidth()),
                coerceIn(bounds.maxWidth(), other.minWidth(), other.maxWidth()),
                coerceIn(bounds.minHeight(), other.minHeight(), other.maxHeight()),
                coerceIn(bounds.maxHeight(), other.minHeight(), other.maxHeight())
        );
    }

    /**
     * Translates every bound, flooring at zero. Unbounded maxima stay
     * unbounded.
     *
     * <p>Sums beyond the int range saturate at {@link Integer#MAX_VALUE},
     * which the codec then rejects as too large.</p>
     */
    public static ConstraintBounds offset(ConstraintBounds bounds, int horizontal, int vertical) {
        Objects.requireNonNull(bounds, "bounds");

        return new ConstraintBounds(
                shift(bounds.minWidth(), horizontal),
                shift(bounds.maxWidth(), horizontal),
                shift(bounds.minHeight(), vertical),
                shift(bounds.maxHeight(), vertical)
        );
    }

    /**
     * Returns the value closest to {@code value} within {@code [min, max]}.
     *
     * <p>An {@link ConstraintBounds#INFINITY} value is treated as larger than
     * everything, so it maps to {@code max}.</p>
     */
    public static int coerceIn(int value, int min, int max) {
        if (value == INFINITY) {
            return max;
        }
        int coerced = Math.max(value, min);
        if (max != INFINITY) {
            coerced = Math.min(coerced, max);
        }
        return coerced;
    }

    /**
     * Clamps a measured size component into {@code [min, max]}.
     *
     * <p>Unlike {@link #coerceIn(int, int, int)}, {@code value} is an ordinary
     * int here: only {@code max} may be {@link ConstraintBounds#INFINITY}.</p>
     */
    public static int coerceSize(int value, int min, int max) {
        final int coerced = Math.max(value, min);
        return (max == INFINITY) ? coerced : Math.min(coerced, max);
    }

    /**
     * Whether {@code value} lies within {@code [min, max]}.
     */
    public static boolean contains(int value, int min, int max) {
        return value >= min && (max == INFINITY || value <= max);
    }

    private static int shift(int bound, int delta) {
        if (bound == INFINITY) {
            return INFINITY;
        }
        final long shifted = (long) bound + delta;
        if (shifted <= 0) {
            return 0;
        }
        return (int) Math.min(shifted, Integer.MAX_VALUE);
    }
}
