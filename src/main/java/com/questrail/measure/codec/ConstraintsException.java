package com.questrail.measure.codec;

/**
 * Base type for every reason a set of bounds cannot become a packed
 * constraints word.
 *
 * <p>All subtypes are construction-time failures caused by caller input.
 * Nothing is retried and no partial value is produced.</p>
 *
 * <ul>
 *   <li>{@link InvalidBoundsException} : a negative min, or a max below its min</li>
 *   <li>{@link MagnitudeOverflowException} : a bound too large for any scheme</li>
 *   <li>{@link SchemeUnsatisfiableException} : both dimensions together need more than 31 bits</li>
 * </ul>
 */
public abstract class ConstraintsException extends IllegalArgumentException
{
    protected ConstraintsException(String message) {
        super(message);
    }
}
