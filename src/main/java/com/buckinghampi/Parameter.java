package com.buckinghampi;

import java.util.Objects;
import java.util.SortedMap;

/** A named parameter: symbol plus one of the supported value kinds. */
public final class Parameter {
    private final String symbol;
    private final ParameterValue value;

    public Parameter(String symbol, ParameterValue value) {
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.trim().isEmpty()) throw new IllegalArgumentException("Empty parameter symbol");
        this.symbol = symbol;
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * @throws UnsupportedParameterKindException if {@code value} is not a
     *         quantity, unit, dimension or number
     */
    public static Parameter of(String symbol, Object value) {
        return new Parameter(symbol, ParameterValue.of(symbol, value));
    }

    public String symbol() { return symbol; }
    public ParameterValue value() { return value; }

    /** Dimension oracle for registered parameters. */
    public SortedMap<String, Fraction> dimensions() { return value.dimensions(); }

    public double magnitude() { return value.magnitude(); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Parameter)) return false;
        Parameter o = (Parameter) obj;
        return symbol.equals(o.symbol) && value.value().equals(o.value.value());
    }

    @Override public int hashCode() { return symbol.hashCode() * 31 + value.value().hashCode(); }

    @Override public String toString() { return symbol + " = " + value; }
}
