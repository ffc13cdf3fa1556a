package com.questrail.measure.codec;

/**
 * Indicates that width and height each fit some tier on their own, but no
 * packing scheme gives both of them enough bits at once.
 */
public final class SchemeUnsatisfiableException extends ConstraintsException
{
    public SchemeUnsatisfiableException(int widthMagnitude, int heightMagnitude) {
        super("Can't represent a width of " + widthMagnitude
                + " and height of " + heightMagnitude + " in Constraints");
    }
}
