package com.buckinghampi;

/**
 * Thrown when fixed-width rational arithmetic produces a numerator or
 * denominator outside the 64-bit range. Callers that need such values must
 * switch to {@link Fraction}.
 */
public class ArithmeticOverflowException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    public ArithmeticOverflowException(String message) {
        super(message);
    }
}
