package com.buckinghampi;

import org.apache.commons.math3.complex.Complex;

/** The numeric domains the factorizer is instantiated with. */
public final class Domains {

    /** Arbitrary-precision rationals; never overflow. */
    public static final NumericDomain<Fraction> RATIONAL = new ExactDomain<>(Fraction.ZERO, Fraction.ONE);

    /** 64-bit rationals; overflow raises {@link ArithmeticOverflowException}. */
    public static final NumericDomain<LongFraction> FIXED_RATIONAL = new ExactDomain<>(LongFraction.ZERO, LongFraction.ONE);

    public static final NumericDomain<Double> REAL = new RealDomain();

    public static final NumericDomain<Complex> COMPLEX = new ComplexDomain();

    private Domains() {}

    /** Rounding tolerance for pivots of a rows x cols matrix in double precision. */
    static double pivotTolerance(int rows, int cols) {
        return Math.min(rows, cols) * Math.ulp(1.0);
    }

    private static final class ExactDomain<T extends Numeric<T>> implements NumericDomain<T> {
        private final T zero;
        private final T one;

        ExactDomain(T zero, T one) {
            this.zero = zero;
            this.one = one;
        }

        @Override public T zero() { return zero; }
        @Override public T one() { return one; }
        @Override public T add(T a, T b) { return a.add(b); }
        @Override public T subtract(T a, T b) { return a.subtract(b); }
        @Override public T multiply(T a, T b) { return a.multiply(b); }
        @Override public T divide(T a, T b) { return a.divide(b); }
        @Override public T negate(T a) { return a.negate(); }
        @Override public int compareMagnitude(T a, T b) { return a.abs().compareTo(b.abs()); }
        @Override public boolean isEffectivelyZero(T value, int rows, int cols) { return value.isZero(); }
        @Override public boolean isExact() { return true; }
        @Override public boolean approximatelyEqual(T a, T b, double tolerance) { return a.equals(b); }
    }

    private static final class RealDomain implements NumericDomain<Double> {
        @Override public Double zero() { return 0.0; }
        @Override public Double one() { return 1.0; }
        @Override public Double add(Double a, Double b) { return a + b; }
        @Override public Double subtract(Double a, Double b) { return a - b; }
        @Override public Double multiply(Double a, Double b) { return a * b; }
        @Override public Double divide(Double a, Double b) { return a / b; }
        @Override public Double negate(Double a) { return -a; }
        @Override public int compareMagnitude(Double a, Double b) { return Double.compare(Math.abs(a), Math.abs(b)); }

        @Override public boolean isEffectivelyZero(Double value, int rows, int cols) {
            return !(Math.abs(value) > pivotTolerance(rows, cols));
        }

        @Override public boolean isExact() { return false; }

        @Override public boolean approximatelyEqual(Double a, Double b, double tolerance) {
            return Math.abs(a - b) <= tolerance;
        }
    }

    private static final class ComplexDomain implements NumericDomain<Complex> {
        @Override public Complex zero() { return Complex.ZERO; }
        @Override public Complex one() { return Complex.ONE; }
        @Override public Complex add(Complex a, Complex b) { return a.add(b); }
        @Override public Complex subtract(Complex a, Complex b) { return a.subtract(b); }
        @Override public Complex multiply(Complex a, Complex b) { return a.multiply(b); }
        @Override public Complex divide(Complex a, Complex b) { return a.divide(b); }
        @Override public Complex negate(Complex a) { return a.negate(); }
        @Override public int compareMagnitude(Complex a, Complex b) { return Double.compare(a.abs(), b.abs()); }

        @Override public boolean isEffectivelyZero(Complex value, int rows, int cols) {
            return !(value.abs() > pivotTolerance(rows, cols));
        }

        @Override public boolean isExact() { return false; }

        @Override public boolean approximatelyEqual(Complex a, Complex b, double tolerance) {
            return a.subtract(b).abs() <= tolerance;
        }
    }
}
