package com.buckinghampi;

/**
 * Field operations the factorizer needs from a matrix entry type. Exact
 * domains only treat a true zero as negligible; approximate domains scale a
 * rounding tolerance with the matrix size.
 *
 * @param <T> entry type
 */
public interface NumericDomain<T> {

    T zero();

    T one();

    T add(T a, T b);

    T subtract(T a, T b);

    T multiply(T a, T b);

    T divide(T a, T b);

    T negate(T a);

    /** Compares {@code |a|} with {@code |b|}. */
    int compareMagnitude(T a, T b);

    /**
     * True if {@code value} is too small to serve as a pivot when eliminating a
     * {@code rows x cols} matrix.
     */
    boolean isEffectivelyZero(T value, int rows, int cols);

    /** True if arithmetic in this domain is exact. */
    boolean isExact();

    /** Equality used to check reconstructions; tolerant for approximate domains. */
    boolean approximatelyEqual(T a, T b, double tolerance);
}
