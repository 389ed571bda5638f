package com.buckinghampi;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import javax.measure.Dimension;
import javax.measure.Quantity;
import javax.measure.Unit;

import tech.units.indriya.unit.UnitDimension;

/**
 * The value side of a registered parameter. Exactly four kinds exist:
 * a dimensioned quantity, a unit, a bare dimension and a plain number. Each
 * kind reports its base-dimension exponents; {@link #of(String, Object)}
 * rejects everything else.
 */
public abstract class ParameterValue {

    private ParameterValue() {}

    /**
     * Wraps {@code value} in its kind.
     *
     * @throws UnsupportedParameterKindException if {@code value} is not a
     *         {@link Quantity}, {@link Unit}, {@link Dimension} or {@link Number}
     */
    public static ParameterValue of(String symbol, Object value) {
        if (value instanceof Quantity) return new OfQuantity((Quantity<?>) value);
        if (value instanceof Unit) return new OfUnit((Unit<?>) value);
        if (value instanceof Dimension) return new OfDimension((Dimension) value);
        if (value instanceof Number) return new OfNumber((Number) value);
        throw new UnsupportedParameterKindException(symbol, value);
    }

    /** Base-dimension exponents keyed by dimension name, sorted by name, zeros omitted. */
    public abstract SortedMap<String, Fraction> dimensions();

    /** Numeric value used when an expression is evaluated: 1 for units and dimensions. */
    public abstract double magnitude();

    /** The wrapped object. */
    public abstract Object value();

    @Override public String toString() { return String.valueOf(value()); }

    static SortedMap<String, Fraction> exponentsOf(Dimension dimension) {
        SortedMap<String, Fraction> out = new TreeMap<>();
        if (UnitDimension.NONE.equals(dimension)) return Collections.unmodifiableSortedMap(out);
        Map<? extends Dimension, Integer> base = dimension.getBaseDimensions();
        if (base == null) {
            // a base dimension has no further decomposition
            out.put(dimension.toString(), Fraction.ONE);
        } else {
            for (Map.Entry<? extends Dimension, Integer> e : base.entrySet()) {
                if (e.getValue() != 0) out.put(e.getKey().toString(), Fraction.of(e.getValue()));
            }
        }
        return Collections.unmodifiableSortedMap(out);
    }

    /** A number with a unit, e.g. 9.8 m/s². */
    public static final class OfQuantity extends ParameterValue {
        private final Quantity<?> quantity;

        OfQuantity(Quantity<?> quantity) { this.quantity = quantity; }

        @Override public SortedMap<String, Fraction> dimensions() { return exponentsOf(quantity.getUnit().getDimension()); }
        @Override public double magnitude() { return quantity.getValue().doubleValue(); }
        @Override public Quantity<?> value() { return quantity; }
    }

    public static final class OfUnit extends ParameterValue {
        private final Unit<?> unit;

        OfUnit(Unit<?> unit) { this.unit = unit; }

        @Override public SortedMap<String, Fraction> dimensions() { return exponentsOf(unit.getDimension()); }
        @Override public double magnitude() { return 1.0; }
        @Override public Unit<?> value() { return unit; }
    }

    public static final class OfDimension extends ParameterValue {
        private final Dimension dimension;

        OfDimension(Dimension dimension) { this.dimension = dimension; }

        @Override public SortedMap<String, Fraction> dimensions() { return exponentsOf(dimension); }
        @Override public double magnitude() { return 1.0; }
        @Override public Dimension value() { return dimension; }
    }

    /** A plain number; always dimensionless. */
    public static final class OfNumber extends ParameterValue {
        private final Number number;

        OfNumber(Number number) { this.number = number; }

        @Override public SortedMap<String, Fraction> dimensions() { return Collections.emptySortedMap(); }
        @Override public double magnitude() { return number.doubleValue(); }
        @Override public Number value() { return number; }
    }
}
