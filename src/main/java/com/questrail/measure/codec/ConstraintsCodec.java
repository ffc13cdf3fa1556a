package com.questrail.measure.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.questrail.measure.codec.ConstraintBounds.INFINITY;

/**
 * ConstraintsCodec
 * =============================================================================
 * Packs four logical bounds into a single {@code long} and reads them back.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   (minWidth, maxWidth, minHeight, maxHeight)
 *        → validate
 *        → SchemeSelector.select
 *        → pack per PackingScheme offsets
 *        → long
 * </pre>
 *
 * <h2>Max subfields</h2>
 * Max bounds are stored as {@code value + 1}; a stored {@code 0} means the
 * dimension is unbounded and decodes to {@link ConstraintBounds#INFINITY}.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>{@code decode(encode(a, b, c, d))} returns exactly {@code (a, b, c, d)}</li>
 *   <li>equal inputs always produce bit-identical words</li>
 *   <li>{@link #decode(long)} is total: every word decodes to something</li>
 * </ul>
 *
 * Any failure surfaces as a {@link ConstraintsException} before a word is
 * produced.
 */
public final class ConstraintsCodec
{
    private static final Logger log = LoggerFactory.getLogger(ConstraintsCodec.class);

    private ConstraintsCodec() {}

    /**
     * Validates and packs the given bounds.
     *
     * @param maxWidth  a bound {@code >= minWidth}, or {@link ConstraintBounds#INFINITY}
     * @param maxHeight a bound {@code >= minHeight}, or {@link ConstraintBounds#INFINITY}
     * @throws InvalidBoundsException       if a min is negative or a max is below its min
     * @throws MagnitudeOverflowException   if a bound exceeds the widest tier
     * @throws SchemeUnsatisfiableException if no scheme fits both dimensions
     */
    public static long encode(int minWidth, int maxWidth, int minHeight, int maxHeight) {
        validate(minWidth, maxWidth, minHeight, maxHeight);

        final PackingScheme scheme = SchemeSelector.select(minWidth, maxWidth, minHeight, maxHeight);

        final long maxWidthValue = (maxWidth == INFINITY) ? 0L : maxWidth + 1L;
        final long maxHeightValue = (maxHeight == INFINITY) ? 0L : maxHeight + 1L;

        return scheme.tag()
                | ((long) minWidth << PackingScheme.MIN_WIDTH_OFFSET)
                | (maxWidthValue << PackingScheme.MAX_WIDTH_OFFSET)
                | ((long) minHeight << scheme.minHeightOffset())
                | (maxHeightValue << scheme.maxHeightOffset());
    }

    /**
     * Packs a logical value.
     *
     * @see #encode(int, int, int, int)
     */
    public static long encode(ConstraintBounds bounds) {
        Objects.requireNonNull(bounds, "bounds");
        return encode(bounds.minWidth(), bounds.maxWidth(), bounds.minHeight(), bounds.maxHeight());
    }

    /**
     * Unpacks all four bounds.
     */
    public static ConstraintBounds decode(long packed) {
        return new ConstraintBounds(
                minWidth(packed),
                maxWidth(packed),
                minHeight(packed),
                maxHeight(packed)
        );
    }

    public static PackingScheme schemeOf(long packed) {
        return PackingScheme.of(packed);
    }

    public static int minWidth(long packed) {
        final PackingScheme scheme = PackingScheme.of(packed);
        return field(packed, PackingScheme.MIN_WIDTH_OFFSET, scheme.widthMask());
    }

    public static int maxWidth(long packed) {
        return fromStoredMax(rawMaxWidth(packed));
    }

    public static int minHeight(long packed) {
        final PackingScheme scheme = PackingScheme.of(packed);
        return field(packed, scheme.minHeightOffset(), scheme.heightMask());
    }

    public static int maxHeight(long packed) {
        return fromStoredMax(rawMaxHeight(packed));
    }

    /**
     * Whether the word carries a finite max width.
     */
    public static boolean hasBoundedWidth(long packed) {
        return rawMaxWidth(packed) != 0;
    }

    /**
     * Whether the word carries a finite max height.
     */
    public static boolean hasBoundedHeight(long packed) {
        return rawMaxHeight(packed) != 0;
    }

    /**
     * Checks the ordering rules shared by every construction path.
     *
     * @throws InvalidBoundsException on the first violated rule
     */
    static void validate(int minWidth, int maxWidth, int minHeight, int maxHeight) {
        if (minWidth < 0 || minHeight < 0) {
            throw rejected("minWidth(" + minWidth + ") and minHeight(" + minHeight + ") must be >= 0");
        }
        if (maxWidth < minWidth && maxWidth != INFINITY) {
            throw rejected("maxWidth(" + maxWidth + ") must be >= minWidth(" + minWidth + ")");
        }
        if (maxHeight < minHeight && maxHeight != INFINITY) {
            throw rejected("maxHeight(" + maxHeight + ") must be >= minHeight(" + minHeight + ")");
        }
    }

    private static InvalidBoundsException rejected(String message) {
        log.debug("Rejecting constraints: {}", message);
        return new InvalidBoundsException(message);
    }

    private static int rawMaxWidth(long packed) {
        final PackingScheme scheme = PackingScheme.of(packed);
        return field(packed, PackingScheme.MAX_WIDTH_OFFSET, scheme.widthMask());
    }

    private static int rawMaxHeight(long packed) {
        final PackingScheme scheme = PackingScheme.of(packed);
        return field(packed, scheme.maxHeightOffset(), scheme.heightMask());
    }

    private static int field(long packed, int offset, int mask) {
        return (int) (packed >>> offset) & mask;
    }

    private static int fromStoredMax(int stored) {
        return (stored == 0) ? INFINITY : stored - 1;
    }
}
