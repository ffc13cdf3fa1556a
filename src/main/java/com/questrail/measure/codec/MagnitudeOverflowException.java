package com.questrail.measure.codec;

/**
 * Indicates that a finite bound does not fit in the widest (18 bit) tier.
 */
public final class MagnitudeOverflowException extends ConstraintsException
{
    private final int magnitude;

    public MagnitudeOverflowException(int magnitude) {
        super("Can't represent a size of " + magnitude + " in Constraints");
        this.magnitude = magnitude;
    }

    /**
     * The offending value.
     */
    public int magnitude() {
        return magnitude;
    }
}
