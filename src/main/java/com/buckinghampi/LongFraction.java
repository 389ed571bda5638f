package com.buckinghampi;

import java.math.BigInteger;

/**
 * Immutable rational with 64-bit numerator and denominator. Every operation is
 * overflow-checked: a result that does not fit raises
 * {@link ArithmeticOverflowException} instead of wrapping.
 */
public final class LongFraction implements Numeric<LongFraction> {
    public static final LongFraction ZERO = new LongFraction(0, 1);
    public static final LongFraction ONE  = new LongFraction(1, 1);

    private final long n;   // numerator
    private final long d;   // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public LongFraction(long num, long den) {
        if (den == 0) throw new ArithmeticException("Zero denominator");
        if (den < 0) { num = negateExact(num); den = negateExact(den); }
        long g = gcd(num, den);
        this.n = num / g;
        this.d = den / g;
    }

    public static LongFraction of(long k) { return new LongFraction(k, 1); }
    public static LongFraction of(long num, long den) { return new LongFraction(num, den); }

    /** Narrows an arbitrary-precision fraction; fails if either part exceeds 64 bits. */
    public static LongFraction of(Fraction f) {
        BigInteger num = f.numerator();
        BigInteger den = f.denominator();
        if (num.bitLength() > 63 || den.bitLength() > 63) {
            throw new ArithmeticOverflowException("Fraction " + f + " does not fit in 64 bits");
        }
        return new LongFraction(num.longValue(), den.longValue());
    }

    public long numerator()   { return n; }
    public long denominator() { return d; }

    // ---- Numeric ----

    @Override public LongFraction add(LongFraction o) {
        long g = gcd(d, o.d);
        long left = d / g;
        long right = o.d / g;
        long num = addExact(multiplyExact(n, right), multiplyExact(o.n, left));
        return new LongFraction(num, multiplyExact(left, o.d));
    }

    @Override public LongFraction subtract(LongFraction o) {
        return add(o.negate());
    }

    @Override public LongFraction multiply(LongFraction o) {
        long g1 = gcd(n, o.d);
        long g2 = gcd(d, o.n);
        long a = n / g1;
        long b = o.n / g2;
        long c = d / g2;
        long e = o.d / g1;
        return new LongFraction(multiplyExact(a, b), multiplyExact(c, e));
    }

    @Override public LongFraction divide(LongFraction o) {
        if (o.n == 0) throw new ArithmeticException("Divide by zero fraction");
        return multiply(o.inverse());
    }

    public LongFraction inverse() {
        if (n == 0) throw new ArithmeticException("Zero has no inverse");
        return new LongFraction(d, n);
    }

    @Override public LongFraction negate() { return n == 0 ? ZERO : new LongFraction(negateExact(n), d); }
    @Override public LongFraction abs()    { return n < 0 ? negate() : this; }
    @Override public int signum()          { return Long.signum(n); }
    @Override public boolean isZero()      { return n == 0; }
    @Override public Fraction toFraction() { return Fraction.of(n, d); }

    // ---- Comparable ----
    @Override public int compareTo(LongFraction o) {
        // cross products may not fit in a long
        BigInteger left = BigInteger.valueOf(n).multiply(BigInteger.valueOf(o.d));
        BigInteger right = BigInteger.valueOf(o.n).multiply(BigInteger.valueOf(d));
        return left.compareTo(right);
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LongFraction)) return false;
        LongFraction o = (LongFraction) obj;
        return n == o.n && d == o.d;
    }

    @Override public int hashCode() { return Long.hashCode(n) * 31 + Long.hashCode(d); }

    @Override public String toString() {
        return d == 1 ? Long.toString(n) : n + "/" + d;
    }

    // ---- checked helpers ----

    private static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        // Math.abs(Long.MIN_VALUE) stays negative
        if (a < 0) throw new ArithmeticOverflowException("gcd overflow");
        return a == 0 ? 1 : a;
    }

    private static long multiplyExact(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("long overflow: " + a + " * " + b);
        }
    }

    private static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("long overflow: " + a + " + " + b);
        }
    }

    private static long negateExact(long a) {
        try {
            return Math.negateExact(a);
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("long overflow: -(" + a + ")");
        }
    }
}
