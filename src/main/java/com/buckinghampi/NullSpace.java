package com.buckinghampi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kernel basis from a full-pivot factorization. With {@code r} the rank and
 * {@code U₁ = U[0:r, 0:r]}, each free column {@code f ≥ r} yields the vector
 * whose first {@code r} coordinates solve {@code U₁·x = −U[0:r, f]}, with a 1
 * at {@code f} and zeros at the other free coordinates.
 */
public final class NullSpace {
    private static final Logger log = LoggerFactory.getLogger(NullSpace.class);

    private NullSpace() {}

    public static <T> NullSpaceBasis<T> of(Matrix<T> a, NumericDomain<T> domain) {
        return of(FullPivotLu.factorize(a, domain));
    }

    public static <T> NullSpaceBasis<T> of(LuFactorization<T> lu) {
        NumericDomain<T> domain = lu.domain();
        Matrix<T> u = lu.upperView();
        int m = lu.cols();
        int r = lu.rank();

        Matrix<T> basis = new Matrix<>(m, m - r, domain.zero());
        for (int f = r; f < m; f++) {
            int col = f - r;
            // back substitution on the leading r x r block
            for (int i = r - 1; i >= 0; i--) {
                T s = domain.negate(u.get(i, f));
                for (int j = i + 1; j < r; j++) {
                    s = domain.subtract(s, domain.multiply(u.get(i, j), basis.get(j, col)));
                }
                basis.set(i, col, domain.divide(s, u.get(i, i)));
            }
            basis.set(f, col, domain.one());
        }

        log.debug("null space of {}x{} matrix: rank={}, dimension={}", lu.rows(), m, r, m - r);
        return new NullSpaceBasis<>(basis, lu.columnPermutationView(), r);
    }
}
