package com.buckinghampi;

/** Minimal exact-number abstraction for the rational types used by the factorizer. */
public interface Numeric<T extends Numeric<T>> extends Comparable<T> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T divide(T o);
    T negate();
    T abs();
    int signum();
    boolean isZero();

    /** Exact arbitrary-precision view of this value. */
    Fraction toFraction();
}
