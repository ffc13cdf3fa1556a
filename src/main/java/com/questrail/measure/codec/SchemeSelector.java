package com.questrail.measure.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SchemeSelector
 * -----------------------------------------------------------------------------
 * Picks the {@link PackingScheme} for a set of logical bounds, or rejects it.
 *
 * <h2>Policy</h2>
 * <ol>
 *   <li>Each dimension's magnitude is the larger of its min and max, with
 *       an unbounded max contributing nothing.</li>
 *   <li>The width magnitude alone picks the scheme: the smallest tier that
 *       holds it becomes the width allocation, height gets the rest.</li>
 *   <li>The height magnitude is then checked against what is left.</li>
 * </ol>
 *
 * Width wins ties. Because the choice depends only on the logical values,
 * equal bounds always select the same scheme and therefore pack to the same
 * word.
 */
public final class SchemeSelector
{
    private static final Logger log = LoggerFactory.getLogger(SchemeSelector.class);

    /** Largest value, plus one, that each tier can hold. The stored max is value + 1. */
    static final int TIER_13_LIMIT = 0x1FFF;
    static final int TIER_15_LIMIT = 0x7FFF;
    static final int TIER_16_LIMIT = 0xFFFF;
    static final int TIER_18_LIMIT = 0x3FFFF;

    private SchemeSelector() {}

    /**
     * Selects the packing scheme for the given bounds.
     *
     * <p>Bounds are expected to be validated already. An unbounded max is
     * passed as {@link ConstraintBounds#INFINITY}.</p>
     *
     * @throws MagnitudeOverflowException if either magnitude exceeds the widest tier
     * @throws SchemeUnsatisfiableException if no scheme fits both dimensions
     */
    static PackingScheme select(int minWidth, int maxWidth, int minHeight, int maxHeight) {
        final int widthMagnitude = magnitude(minWidth, maxWidth);
        final int heightMagnitude = magnitude(minHeight, maxHeight);

        final int widthBits = bitsFor(widthMagnitude);
        final int heightBits = bitsFor(heightMagnitude);

        if (widthBits + heightBits > PackingScheme.DIMENSION_BITS) {
            log.debug("No scheme fits width={} ({} bits) and height={} ({} bits)",
                    widthMagnitude, widthBits, heightMagnitude, heightBits);
            throw new SchemeUnsatisfiableException(widthMagnitude, heightMagnitude);
        }

        final PackingScheme scheme = PackingScheme.forWidthBits(widthBits);
        if (log.isTraceEnabled()) {
            log.trace("Selected {} for width={} height={}", scheme, widthMagnitude, heightMagnitude);
        }
        return scheme;
    }

    /**
     * Returns the number of bits a dimension of the given magnitude needs:
     * one of 13, 15, 16 or 18.
     *
     * <p>The all-zero pattern of a max subfield means unbounded, so a tier of
     * {@code b} bits holds values strictly below {@code 2^b - 1}.</p>
     *
     * @throws MagnitudeOverflowException if {@code magnitude >= 2^18 - 1}
     */
    static int bitsFor(int magnitude) {
        if (magnitude < TIER_13_LIMIT) {
            return 13;
        }
        if (magnitude < TIER_15_LIMIT) {
            return 15;
        }
        if (magnitude < TIER_16_LIMIT) {
            return 16;
        }
        if (magnitude < TIER_18_LIMIT) {
            return 18;
        }
        log.debug("Bound {} exceeds the widest tier", magnitude);
        throw new MagnitudeOverflowException(magnitude);
    }

    /**
     * The value that drives a dimension's bit requirement.
     */
    static int magnitude(int min, int max) {
        return (max == ConstraintBounds.INFINITY) ? min : Math.max(min, max);
    }
}
