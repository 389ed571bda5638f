package com.buckinghampi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluable form of a pi group: a product of {@code symbol ^ exponent}
 * powers, built straight from the group's factors.
 */
public abstract class Expression {

    private Expression() {}

    /**
     * Evaluates with the given symbol values.
     *
     * @throws IllegalArgumentException if a symbol has no binding
     */
    public abstract double evaluate(Map<String, ? extends Number> bindings);

    public double evaluate(ParameterRegistry registry) {
        return evaluate(registry.magnitudes());
    }

    public static Product of(PiGroup group) {
        List<Power> powers = new ArrayList<>(group.size());
        for (Factor f : group.factors()) powers.add(new Power(f.symbol(), f.exponent()));
        return new Product(powers);
    }

    /** {@code symbol ^ (num // den)}. */
    public static final class Power extends Expression {
        private final String symbol;
        private final Fraction exponent;

        public Power(String symbol, Fraction exponent) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.exponent = Objects.requireNonNull(exponent, "exponent");
        }

        public String symbol() { return symbol; }
        public Fraction exponent() { return exponent; }

        @Override public double evaluate(Map<String, ? extends Number> bindings) {
            Number base = bindings.get(symbol);
            if (base == null) throw new IllegalArgumentException("No value bound to " + symbol);
            return Math.pow(base.doubleValue(), exponent.doubleValue());
        }

        @Override public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Power)) return false;
            Power o = (Power) obj;
            return symbol.equals(o.symbol) && exponent.equals(o.exponent);
        }

        @Override public int hashCode() { return symbol.hashCode() * 31 + exponent.hashCode(); }

        @Override public String toString() {
            return symbol + " ^ (" + exponent.numerator() + " // " + exponent.denominator() + ")";
        }
    }

    public static final class Product extends Expression {
        private final List<Power> powers;

        public Product(List<Power> powers) {
            this.powers = Collections.unmodifiableList(new ArrayList<>(powers));
        }

        public List<Power> powers() { return powers; }

        @Override public double evaluate(Map<String, ? extends Number> bindings) {
            double result = 1.0;
            for (Power p : powers) result *= p.evaluate(bindings);
            return result;
        }

        @Override public boolean equals(Object obj) {
            return this == obj || obj instanceof Product && powers.equals(((Product) obj).powers);
        }

        @Override public int hashCode() { return powers.hashCode(); }

        @Override public String toString() {
            if (powers.isEmpty()) return "1";
            StringBuilder sb = new StringBuilder();
            for (Power p : powers) {
                if (sb.length() > 0) sb.append(" * ");
                sb.append(p);
            }
            return sb.toString();
        }
    }
}
