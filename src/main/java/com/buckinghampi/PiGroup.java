package com.buckinghampi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A dimensionless monomial: factors with nonzero exponents, in permuted parameter order. */
public final class PiGroup {
    private final List<Factor> factors;

    public PiGroup(List<Factor> factors) {
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
    }

    public List<Factor> factors() { return factors; }

    public int size() { return factors.size(); }

    /** Exponent of {@code symbol}; zero if it does not occur. */
    public Fraction exponentOf(String symbol) {
        for (Factor f : factors) if (f.symbol().equals(symbol)) return f.exponent();
        return Fraction.ZERO;
    }

    /** Symbol to exponent, in factor order. */
    public Map<String, Fraction> exponents() {
        Map<String, Fraction> out = new LinkedHashMap<>();
        for (Factor f : factors) out.put(f.symbol(), f.exponent());
        return out;
    }

    @Override public boolean equals(Object obj) {
        return this == obj || obj instanceof PiGroup && factors.equals(((PiGroup) obj).factors);
    }

    @Override public int hashCode() { return factors.hashCode(); }

    @Override public String toString() { return OutputForm.STRING.render(this); }
}
