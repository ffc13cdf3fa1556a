package com.questrail.measure.codec;

/**
 * Indicates that a minimum bound is negative, or that a finite maximum bound
 * is smaller than its minimum.
 */
public final class InvalidBoundsException extends ConstraintsException
{
    public InvalidBoundsException(String message) {
        super(message);
    }
}
