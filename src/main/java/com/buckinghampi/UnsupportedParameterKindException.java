package com.buckinghampi;

/**
 * A parameter value is none of: quantity, unit, dimension or plain number.
 */
public class UnsupportedParameterKindException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public UnsupportedParameterKindException(String symbol, Object value) {
        super("Parameter " + symbol + " should be a Quantity, Unit, Dimension or Number, got "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
