package com.buckinghampi;

import java.util.Objects;

/**
 * Result of {@link FullPivotLu}: {@code L·U == A[p, q]} with {@code L} unit
 * lower triangular ({@code n × n}) and {@code U} upper triangular
 * ({@code n × m}). {@link #rank()} is the number of elimination steps that
 * found a usable pivot. Accessors return copies.
 */
public final class LuFactorization<T> {
    private static final double RECONSTRUCTION_ULPS = 1024;

    private final Matrix<T> l;
    private final Matrix<T> u;
    private final int[] p;
    private final int[] q;
    private final int rank;
    private final NumericDomain<T> domain;

    LuFactorization(Matrix<T> l, Matrix<T> u, int[] p, int[] q, int rank, NumericDomain<T> domain) {
        this.l = Objects.requireNonNull(l);
        this.u = Objects.requireNonNull(u);
        this.p = p.clone();
        this.q = q.clone();
        this.rank = rank;
        this.domain = Objects.requireNonNull(domain);
    }

    public Matrix<T> lower() { return l.copy(); }
    public Matrix<T> upper() { return u.copy(); }

    /** Row permutation: row i of {@code L·U} is row {@code p[i]} of A. */
    public int[] rowPermutation() { return p.clone(); }

    /** Column permutation: column j of {@code L·U} is column {@code q[j]} of A. */
    public int[] columnPermutation() { return q.clone(); }

    public int rank() { return rank; }
    public int rows() { return u.rows(); }
    public int cols() { return u.cols(); }
    public NumericDomain<T> domain() { return domain; }

    /** {@code L·U}, i.e. the permuted input {@code A[p, q]}. */
    public Matrix<T> product() {
        return l.multiply(u, domain);
    }

    /**
     * Checks {@code P·A·Q = L·U} exactly in exact domains and to within a
     * size-scaled rounding tolerance otherwise.
     */
    public boolean reconstructs(Matrix<T> a) {
        double tolerance = domain.isExact() ? 0.0 : RECONSTRUCTION_ULPS * Math.max(1, Math.max(rows(), cols())) * Math.ulp(1.0);
        return reconstructs(a, tolerance);
    }

    /** True if {@code L·U} reproduces {@code A[p, q]} (within {@code tolerance} for approximate domains). */

    public boolean reconstructs(Matrix<T> a, double tolerance) {
        return product().approximatelyEquals(a.permute(p, q), domain, tolerance);
    }

    // package-private views for the null-space solver; no copies
    Matrix<T> upperView() { return u; }
    int[] columnPermutationView() { return q; }
}
