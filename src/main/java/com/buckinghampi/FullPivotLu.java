package com.buckinghampi;

import java.util.Objects;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gaussian elimination with full pivoting over any {@link NumericDomain}.
 *
 * <p>At step k the largest-magnitude entry of the trailing block
 * {@code U[k:, k:]} becomes the pivot. The block is scanned column by column,
 * top to bottom, and a later entry only replaces the candidate when its
 * magnitude is strictly larger, so ties go to the first entry in that order.
 * Elimination stops as soon as the domain reports the pivot as effectively
 * zero; the number of completed steps is the rank. Rectangular and singular
 * inputs are accepted. The input matrix is not modified.
 */
public final class FullPivotLu {
    private static final Logger log = LoggerFactory.getLogger(FullPivotLu.class);

    private FullPivotLu() {}

    public static <T> LuFactorization<T> factorize(Matrix<T> a, NumericDomain<T> domain) {
        Objects.requireNonNull(a, "matrix");
        Objects.requireNonNull(domain, "domain");
        final int n = a.rows();
        final int m = a.cols();

        Matrix<T> u = a.copy();
        Matrix<T> l = Matrix.identity(n, domain);
        int[] p = identityPermutation(n);
        int[] q = identityPermutation(m);

        int rank = 0;
        for (int k = 0; k < Math.min(n, m); k++) {
            // ---- pivot search, column-major ----
            int pi = k, pj = k;
            T best = u.get(k, k);
            for (int j = k; j < m; j++) {
                for (int i = k; i < n; i++) {
                    T v = u.get(i, j);
                    if (domain.compareMagnitude(v, best) > 0) {
                        best = v;
                        pi = i;
                        pj = j;
                    }
                }
            }
            if (domain.isEffectivelyZero(best, n, m)) break;

            // ---- row and column exchanges ----
            if (pi > k) {
                swap(p, k, pi);
                u.swapRows(k, pi);
                for (int c = 0; c < k; c++) {
                    T t = l.get(k, c);
                    l.set(k, c, l.get(pi, c));
                    l.set(pi, c, t);
                }
            }
            if (pj > k) {
                swap(q, k, pj);
                u.swapColumns(k, pj);
            }

            // ---- rank-1 elimination ----
            T pivot = u.get(k, k);
            for (int i = k + 1; i < n; i++) {
                T tau = domain.divide(u.get(i, k), pivot);
                l.set(i, k, tau);
                for (int j = k; j < m; j++) {
                    u.set(i, j, domain.subtract(u.get(i, j), domain.multiply(tau, u.get(k, j))));
                }
            }
            rank++;
        }

        log.debug("factorized {}x{} matrix: rank={}", n, m, rank);
        return new LuFactorization<>(l, u, p, q, rank, domain);
    }

    /** Integer input is promoted to {@code double}; division is not closed over the integers. */
    public static LuFactorization<Double> factorize(long[][] a) {
        return factorize(Matrices.promote(a), Domains.REAL);
    }

    /** Complex integer input (real and imaginary parts) is promoted to complex doubles. */
    public static LuFactorization<Complex> factorizeComplex(long[][] re, long[][] im) {
        return factorize(Matrices.promoteComplex(re, im), Domains.COMPLEX);
    }

    private static int[] identityPermutation(int size) {
        int[] perm = new int[size];
        for (int i = 0; i < size; i++) perm[i] = i;
        return perm;
    }

    private static void swap(int[] a, int i, int j) {
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
    }
}
