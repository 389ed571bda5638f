package com.buckinghampi;

import java.util.Objects;

/** One {@code symbol^exponent} term of a pi group. */
public final class Factor {
    private final String symbol;
    private final Fraction exponent;

    public Factor(String symbol, Fraction exponent) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.exponent = Objects.requireNonNull(exponent, "exponent");
    }

    public String symbol() { return symbol; }
    public Fraction exponent() { return exponent; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Factor)) return false;
        Factor o = (Factor) obj;
        return symbol.equals(o.symbol) && exponent.equals(o.exponent);
    }

    @Override public int hashCode() { return symbol.hashCode() * 31 + exponent.hashCode(); }

    @Override public String toString() { return symbol + "^" + exponent; }
}
