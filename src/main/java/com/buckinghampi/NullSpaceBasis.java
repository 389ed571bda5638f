package com.buckinghampi;

import java.util.Objects;

/**
 * Columns spanning the kernel of a matrix, expressed in the factorization's
 * permuted column order: coordinate i of every basis vector belongs to
 * original column {@code q[i]}.
 */
public final class NullSpaceBasis<T> {
    private final Matrix<T> basis;
    private final int[] q;
    private final int rank;

    NullSpaceBasis(Matrix<T> basis, int[] q, int rank) {
        this.basis = Objects.requireNonNull(basis);
        this.q = q.clone();
        this.rank = rank;
    }

    /** {@code m × (m − rank)}, permuted order. */
    public Matrix<T> basis() { return basis.copy(); }

    public int[] columnPermutation() { return q.clone(); }

    public int rank() { return rank; }

    /** Number of basis vectors, {@code m − rank}. */
    public int dimension() { return basis.cols(); }

    /** Length of each basis vector, i.e. the column count of the original matrix. */
    public int length() { return basis.rows(); }

    /** The basis with coordinates moved back to the original column order. */
    public Matrix<T> unpermuted() {
        Matrix<T> out = basis.copy();
        for (int i = 0; i < q.length; i++)
            for (int j = 0; j < basis.cols(); j++)
                out.set(q[i], j, basis.get(i, j));
        return out;
    }
}
