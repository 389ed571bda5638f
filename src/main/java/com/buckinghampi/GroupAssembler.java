package com.buckinghampi;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Turns null-space basis vectors back into symbol/exponent factors. The
 * coordinate at permuted position i belongs to the parameter at original
 * position {@code q[i]}; factors keep that permuted order.
 */
public final class GroupAssembler {

    private GroupAssembler() {}

    public static <T> List<PiGroup> assemble(NullSpaceBasis<T> basis, List<String> symbols,
                                             Function<? super T, Fraction> toExact) {
        if (symbols.size() != basis.length()) {
            throw new IllegalArgumentException("Expected " + basis.length() + " symbols, got " + symbols.size());
        }
        Matrix<T> vectors = basis.basis();
        int[] q = basis.columnPermutation();
        List<PiGroup> groups = new ArrayList<>(vectors.cols());
        for (int j = 0; j < vectors.cols(); j++) {
            List<Factor> factors = new ArrayList<>();
            for (int i = 0; i < vectors.rows(); i++) {
                Fraction a = toExact.apply(vectors.get(i, j));
                if (!a.isZero()) factors.add(new Factor(symbols.get(q[i]), a));
            }
            groups.add(new PiGroup(factors));
        }
        return groups;
    }

    public static List<PiGroup> assemble(NullSpaceBasis<Fraction> basis, List<String> symbols) {
        return assemble(basis, symbols, Function.identity());
    }
}
