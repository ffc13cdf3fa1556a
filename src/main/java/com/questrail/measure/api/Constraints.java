package com.questrail.measure.api;

import com.questrail.measure.codec.ConstraintBounds;
import com.questrail.measure.codec.ConstraintsCodec;
import com.questrail.measure.codec.InvalidBoundsException;
import com.questrail.measure.codec.MagnitudeOverflowException;
import com.questrail.measure.codec.PackingScheme;
import com.questrail.measure.codec.SchemeUnsatisfiableException;
import com.questrail.measure.core.ConstraintAlgebra;

import java.util.Objects;

/**
 * Constraints
 * -----------------------------------------------------------------------------
 * Immutable min/max bounds on width and height handed from a parent layout to
 * a child being measured. A child picks a size with
 * <pre>
 *   minWidth  &lt;= width  &lt;= maxWidth
 *   minHeight &lt;= height &lt;= maxHeight
 * </pre>
 * where either max may be {@link #INFINITY} to ask the child for its
 * preferred size in that dimension.
 *
 * <h2>Representation</h2>
 * All four bounds live in one {@code long}. Width and height share 31 bits
 * and the split adapts to whichever dimension needs the larger range: up to
 * 18 bits (262142) for one dimension and 13 for the other, or 16/15. Bounds
 * outside every split are rejected at construction time. See
 * {@link PackingScheme} for the layout.
 *
 * <h2>Value Semantics</h2>
 * Instances never change. Every operation that looks like a mutation
 * returns a new instance, possibly packed with a different split. Two
 * instances are equal iff their packed words are identical; since a given
 * set of bounds always packs the same way, this is the same as comparing
 * the four bounds.
 *
 * <h2>Thread Safety</h2>
 * Instances may be shared freely across threads.
 */
public final class Constraints
{
    /**
     * Max bound meaning "no upper limit".
     */
    public static final int INFINITY = ConstraintBounds.INFINITY;

    private static final Constraints UNBOUNDED = of(0, INFINITY, 0, INFINITY);

    private final long value;

    private Constraints(long value) {
        this.value = value;
    }

    /**
     * Creates constraints from four bounds.
     *
     * @param minWidth  minimum width, {@code >= 0}
     * @param maxWidth  maximum width, {@code >= minWidth}, or {@link #INFINITY}
     * @param minHeight minimum height, {@code >= 0}
     * @param maxHeight maximum height, {@code >= minHeight}, or {@link #INFINITY}
     * @throws InvalidBoundsException       if the ordering rules are violated
     * @throws MagnitudeOverflowException   if a bound is larger than any split allows
     * @throws SchemeUnsatisfiableException if width and height cannot both fit
     */
    public static Constraints of(int minWidth, int maxWidth, int minHeight, int maxHeight) {
        return new Constraints(ConstraintsCodec.encode(minWidth, maxWidth, minHeight, maxHeight));
    }

    /**
     * Creates constraints from an unpacked value.
     */
    public static Constraints of(ConstraintBounds bounds) {
        return new Constraints(ConstraintsCodec.encode(bounds));
    }

    /**
     * Constraints that accept any size: {@code [0, Infinity] x [0, Infinity]}.
     */
    public static Constraints unbounded() {
        return UNBOUNDED;
    }

    /**
     * Constraints that accept exactly one size.
     */
    public static Constraints fixed(int width, int height) {
        return of(width, width, height, height);
    }

    /**
     * Constraints for an exact width and any height.
     */
    public static Constraints fixedWidth(int width) {
        return of(width, width, 0, INFINITY);
    }

    /**
     * Constraints for an exact height and any width.
     */
    public static Constraints fixedHeight(int height) {
        return of(0, INFINITY, height, height);
    }

    public int minWidth() {
        return ConstraintsCodec.minWidth(value);
    }

    /**
     * The maximum width: a value {@code >= minWidth()}, or {@link #INFINITY}.
     */
    public int maxWidth() {
        return ConstraintsCodec.maxWidth(value);
    }

    public int minHeight() {
        return ConstraintsCodec.minHeight(value);
    }

    /**
     * The maximum height: a value {@code >= minHeight()}, or {@link #INFINITY}.
     */
    public int maxHeight() {
        return ConstraintsCodec.maxHeight(value);
    }

    /**
     * Whether there is a finite upper bound on width.
     */
    public boolean hasBoundedWidth() {
        return ConstraintsCodec.hasBoundedWidth(value);
    }

    /**
     * Whether there is a finite upper bound on height.
     */
    public boolean hasBoundedHeight() {
        return ConstraintsCodec.hasBoundedHeight(value);
    }

    /**
     * Whether exactly one width satisfies these constraints.
     */
    public boolean hasFixedWidth() {
        return maxWidth() == minWidth();
    }

    /**
     * Whether exactly one height satisfies these constraints.
     */
    public boolean hasFixedHeight() {
        return maxHeight() == minHeight();
    }

    /**
     * Whether any size satisfying these constraints has zero area.
     */
    public boolean isZero() {
        return maxWidth() == 0 || maxHeight() == 0;
    }

    /**
     * The four bounds, unpacked.
     */
    public ConstraintBounds bounds() {
        return ConstraintsCodec.decode(value);
    }

    /**
     * The packed word. Suitable as a primitive map key; not a stable
     * serialization format.
     */
    public long packedValue() {
        return value;
    }

    /**
     * The width/height split this value was packed with.
     */
    public PackingScheme scheme() {
        return ConstraintsCodec.schemeOf(value);
    }

    /**
     * Returns a copy with all four bounds replaced, validated as in
     * {@link #of(int, int, int, int)}.
     */
    public Constraints copy(int minWidth, int maxWidth, int minHeight, int maxHeight) {
        return of(minWidth, maxWidth, minHeight, maxHeight);
    }

    /**
     * Returns a builder seeded with these bounds, for replacing a subset of
     * them.
     */
    public Builder toBuilder() {
        return new Builder(bounds());
    }

    /**
     * Returns these constraints coerced into {@code other}. The result
     * satisfies {@code other} for every size it accepts.
     */
    public Constraints enforce(Constraints other) {
        Objects.requireNonNull(other, "other");
        return of(ConstraintAlgebra.enforce(bounds(), other.bounds()));
    }

    /**
     * Returns the size closest to {@code size} that satisfies these
     * constraints.
     */
    public IntSize constrain(IntSize size) {
        Objects.requireNonNull(size, "size");
        final ConstraintBounds b = bounds();
        return new IntSize(
                ConstraintAlgebra.coerceSize(size.width(), b.minWidth(), b.maxWidth()),
                ConstraintAlgebra.coerceSize(size.height(), b.minHeight(), b.maxHeight())
        );
    }

    /**
     * Whether {@code size} satisfies these constraints.
     */
    public boolean satisfiedBy(IntSize size) {
        Objects.requireNonNull(size, "size");
        final ConstraintBounds b = bounds();
        return ConstraintAlgebra.contains(size.width(), b.minWidth(), b.maxWidth())
                && ConstraintAlgebra.contains(size.height(), b.minHeight(), b.maxHeight());
    }

    /**
     * Returns these constraints translated by the given amounts. Bounds stop
     * at zero and unbounded maxima stay unbounded.
     *
     * @throws MagnitudeOverflowException   if a translated bound becomes too large
     * @throws SchemeUnsatisfiableException if the translated bounds no longer fit together
     */
    public Constraints offset(int horizontal, int vertical) {
        return of(ConstraintAlgebra.offset(bounds(), horizontal, vertical));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraints that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Constraints(minWidth = " + minWidth()
                + ", maxWidth = " + format(maxWidth())
                + ", minHeight = " + minHeight()
                + ", maxHeight = " + format(maxHeight()) + ")";
    }

    private static String format(int bound) {
        return (bound == INFINITY) ? "Infinity" : Integer.toString(bound);
    }

    /**
     * Builder for replacing some of the bounds of an existing
     * {@link Constraints}. Defaults to {@link #unbounded()}.
     */
    public static final class Builder {
        private int minWidth;
        private int maxWidth;
        private int minHeight;
        private int maxHeight;

        public Builder() {
            this(UNBOUNDED.bounds());
        }

        private Builder(ConstraintBounds seed) {
            this.minWidth = seed.minWidth();
            this.maxWidth = seed.maxWidth();
            this.minHeight = seed.minHeight();
            this.maxHeight = seed.maxHeight();
        }

        public Builder minWidth(int minWidth) {
            this.minWidth = minWidth;
            return this;
        }

        public Builder maxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder minHeight(int minHeight) {
            this.minHeight = minHeight;
            return this;
        }

        public Builder maxHeight(int maxHeight) {
            this.maxHeight = maxHeight;
            return this;
        }

        /**
         * @throws InvalidBoundsException       if the ordering rules are violated
         * @throws MagnitudeOverflowException   if a bound is larger than any split allows
         * @throws SchemeUnsatisfiableException if width and height cannot both fit
         */
        public Constraints build() {
            return of(minWidth, maxWidth, minHeight, maxHeight);
        }
    }
}
