package com.questrail.measure.api;

/**
 * A candidate width and height in whole pixels.
 *
 * <p>No range is enforced: a measured child may report any size, and
 * {@link Constraints#constrain(IntSize)} brings it back into range.</p>
 */
public record IntSize(int width, int height) {

    public static final IntSize ZERO = new IntSize(0, 0);

    public static IntSize of(int width, int height) {
        return new IntSize(width, height);
    }

    @Override
    public String toString() {
        return width + " x " + height;
    }
}
