package com.buckinghampi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dimension-by-parameter matrix of exact exponents. Rows are the distinct
 * dimension names in order of first appearance, columns are the parameters
 * in the order given. Missing dimensions default to zero, so a dimensionless
 * parameter contributes an all-zero column.
 */
public final class ExponentMatrix {
    private final List<String> dimensions;
    private final Matrix<Fraction> matrix;

    private ExponentMatrix(List<String> dimensions, Matrix<Fraction> matrix) {
        this.dimensions = Collections.unmodifiableList(dimensions);
        this.matrix = matrix;
    }

    public static <P> ExponentMatrix build(List<? extends P> parameters, DimensionOracle<? super P> oracle) {
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(oracle, "oracle");

        List<Map<String, Fraction>> columns = new ArrayList<>(parameters.size());
        Map<String, Integer> rowOf = new LinkedHashMap<>();
        for (P p : parameters) {
            Map<String, Fraction> dims = oracle.dimensionsOf(p);
            columns.add(dims);
            for (String name : dims.keySet()) {
                rowOf.putIfAbsent(name, rowOf.size());
            }
        }

        Matrix<Fraction> mat = new Matrix<>(rowOf.size(), parameters.size(), Fraction.ZERO);
        for (int j = 0; j < columns.size(); j++) {
            for (Map.Entry<String, Fraction> e : columns.get(j).entrySet()) {
                mat.set(rowOf.get(e.getKey()), j, e.getValue());
            }
        }
        return new ExponentMatrix(new ArrayList<>(rowOf.keySet()), mat);
    }

    /** Builds from registered parameters using their own dimension decompositions. */
    public static ExponentMatrix of(List<Parameter> parameters) {
        return build(parameters, Parameter::dimensions);
    }

    /** Row labels. */
    public List<String> dimensions() { return dimensions; }

    public Matrix<Fraction> matrix() { return matrix.copy(); }

    public int rows() { return matrix.rows(); }
    public int cols() { return matrix.cols(); }

    /** Exponent of {@code dimension} in parameter column {@code col}; zero if the dimension never occurs. */
    public Fraction exponent(String dimension, int col) {
        int row = dimensions.indexOf(dimension);
        return row < 0 ? Fraction.ZERO : matrix.get(row, col);
    }

    /** The same matrix in 64-bit rationals. */
    public Matrix<LongFraction> toFixedWidth() {
        return Matrices.fixedWidth(matrix);
    }
}
