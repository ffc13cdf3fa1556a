package com.questrail.measure.codec;

/**
 * PackingScheme
 * -----------------------------------------------------------------------------
 * One of the four fixed bit allocations between width and height inside a
 * packed constraints word. The two low bits of every word hold the scheme
 * {@link #tag()}.
 *
 * <h2>Menu</h2>
 * <pre>
 *   tag  scheme             width bits  height bits
 *   0    MIN_FOCUS_WIDTH    16          15
 *   1    MAX_FOCUS_WIDTH    18          13
 *   2    MIN_FOCUS_HEIGHT   15          16
 *   3    MAX_FOCUS_HEIGHT   13          18
 * </pre>
 *
 * Width and height always share 31 bits between them, so each min/max pair
 * of subfields fills exactly one 31-bit half of the word after the tag.
 *
 * <h2>Layout</h2>
 * <pre>
 *   [0, 2)            tag
 *   [2, 2+W)          minWidth
 *   [2+W, 33)         minHeight
 *   [33, 33+W)        maxWidth  (value + 1, 0 = unbounded)
 *   [33+W, 64)        maxHeight (value + 1, 0 = unbounded)
 * </pre>
 *
 * The height offsets differ per scheme and are held here as table entries
 * rather than recomputed by each accessor.
 */
public enum PackingScheme
{
    MIN_FOCUS_WIDTH(0, 16),
    MAX_FOCUS_WIDTH(1, 18),
    MIN_FOCUS_HEIGHT(2, 15),
    MAX_FOCUS_HEIGHT(3, 13);

    /**
     * Bits shared by width and height in every scheme.
     */
    public static final int DIMENSION_BITS = 31;

    static final int TAG_BITS = 2;
    static final long TAG_MASK = 0x03L;

    /** minWidth always starts right after the tag. */
    static final int MIN_WIDTH_OFFSET = TAG_BITS;

    /** maxWidth always starts at the upper half. */
    static final int MAX_WIDTH_OFFSET = TAG_BITS + DIMENSION_BITS;

    private static final PackingScheme[] BY_TAG = {
            MIN_FOCUS_WIDTH,
            MAX_FOCUS_WIDTH,
            MIN_FOCUS_HEIGHT,
            MAX_FOCUS_HEIGHT
    };

    private final int tag;
    private final int widthBits;
    private final int heightBits;
    private final int widthMask;
    private final int heightMask;
    private final int minHeightOffset;
    private final int maxHeightOffset;

    PackingScheme(int tag, int widthBits) {
        this.tag = tag;
        this.widthBits = widthBits;
        this.heightBits = DIMENSION_BITS - widthBits;
        this.widthMask = (1 << widthBits) - 1;
        this.heightMask = (1 << heightBits) - 1;
        this.minHeightOffset = MIN_WIDTH_OFFSET + widthBits;
        this.maxHeightOffset = minHeightOffset + DIMENSION_BITS;
    }

    /**
     * Returns the scheme stored in the low bits of a packed word.
     */
    public static PackingScheme of(long packed) {
        return BY_TAG[(int) (packed & TAG_MASK)];
    }

    /**
     * Returns the scheme whose width allocation is exactly {@code widthBits}.
     *
     * @throws IllegalStateException if no scheme allocates that many bits
     */
    static PackingScheme forWidthBits(int widthBits) {
        return switch (widthBits) {
            case 13 -> MAX_FOCUS_HEIGHT;
            case 15 -> MIN_FOCUS_HEIGHT;
            case 16 -> MIN_FOCUS_WIDTH;
            case 18 -> MAX_FOCUS_WIDTH;
            default -> throw new IllegalStateException("No packing scheme with " + widthBits + " width bits");
        };
    }

    public int tag() {
        return tag;
    }

    public int widthBits() {
        return widthBits;
    }

    public int heightBits() {
        return heightBits;
    }

    int widthMask() {
        return widthMask;
    }

    int heightMask() {
        return heightMask;
    }

    int minHeightOffset() {
        return minHeightOffset;
    }

    int maxHeightOffset() {
        return maxHeightOffset;
    }
}
