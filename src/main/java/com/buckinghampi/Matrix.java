package com.buckinghampi;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A simple dense matrix over an arbitrary entry type.  Rows and columns are
 * indexed from zero.  Arithmetic goes through a {@link NumericDomain} so the
 * same matrix class serves exact rationals, doubles and complex numbers.
 */
public final class Matrix<T> {
    private final int rows;
    private final int cols;
    private final Object[][] data;

    /**
     * Constructs a {@code rows × cols} matrix with every entry set to
     * {@code fill}.
     */
    public Matrix(int rows, int cols, T fill) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative dimensions");
        }
        Objects.requireNonNull(fill, "fill");
        this.rows = rows;
        this.cols = cols;
        this.data = new Object[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                data[i][j] = fill;
            }
        }
    }

    /** Copies a rectangular array; every row must have the same length. */
    public static <T> Matrix<T> of(T[][] values) {
        int m = values.length;
        int n = m == 0 ? 0 : values[0].length;
        Matrix<T> mat = new Matrix<>(m, n);
        for (int i = 0; i < m; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("Ragged row " + i + ": expected " + n + " columns");
            }
            for (int j = 0; j < n; j++) {
                mat.data[i][j] = Objects.requireNonNull(values[i][j], "entry");
            }
        }
        return mat;
    }

    /** The {@code n × n} identity of the given domain. */
    public static <T> Matrix<T> identity(int n, NumericDomain<T> domain) {
        Matrix<T> id = new Matrix<>(n, n, domain.zero());
        for (int i = 0; i < n; i++) id.data[i][i] = domain.one();
        return id;
    }

    /**
     * Parses whitespace-separated rows of integers or fractions, one row per
     * non-blank line, e.g. {@code "1 1/2\n0 -3"}.
     */
    public static Matrix<Fraction> parseRational(String text) {
        List<Fraction[]> parsed = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String t = line.trim();
            if (t.isEmpty()) continue;
            String[] tokens = t.split("\\s+");
            Fraction[] row = new Fraction[tokens.length];
            for (int j = 0; j < tokens.length; j++) row[j] = Fraction.parse(tokens[j]);
            parsed.add(row);
        }
        return of(parsed.toArray(new Fraction[0][]));
    }

    private Matrix(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        this.data = new Object[rows][cols];
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    /** Returns the entry at row {@code r}, column {@code c}. */
    @SuppressWarnings("unchecked")
    public T get(int r, int c) {
        return (T) data[r][c];
    }

    /** Sets the entry at row {@code r}, column {@code c}. */
    public void set(int r, int c, T value) {
        data[r][c] = Objects.requireNonNull(value, "entry");
    }

    public Matrix<T> copy() {
        Matrix<T> out = new Matrix<>(rows, cols);
        for (int i = 0; i < rows; i++) System.arraycopy(data[i], 0, out.data[i], 0, cols);
        return out;
    }

    /** Exchanges rows {@code a} and {@code b} in place. */
    public void swapRows(int a, int b) {
        Object[] t = data[a];
        data[a] = data[b];
        data[b] = t;
    }

    /** Exchanges columns {@code a} and {@code b} in place. */
    public void swapColumns(int a, int b) {
        for (int i = 0; i < rows; i++) {
            Object t = data[i][a];
            data[i][a] = data[i][b];
            data[i][b] = t;
        }
    }

    /** Returns {@code A[p, q]}: row i of the result is row p[i] of this matrix, restricted to columns q. */
    public Matrix<T> permute(int[] p, int[] q) {
        if (p.length != rows || q.length != cols) {
            throw new IllegalArgumentException("Permutation sizes " + p.length + "x" + q.length
                    + " do not match " + rows + "x" + cols);
        }
        Matrix<T> out = new Matrix<>(rows, cols);
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                out.data[i][j] = data[p[i]][q[j]];
        return out;
    }

    public Matrix<T> multiply(Matrix<T> other, NumericDomain<T> domain) {
        if (cols != other.rows) {
            throw new IllegalArgumentException("Cannot multiply " + rows + "x" + cols
                    + " by " + other.rows + "x" + other.cols);
        }
        Matrix<T> out = new Matrix<>(rows, other.cols, domain.zero());
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < other.cols; j++) {
                T sum = domain.zero();
                for (int k = 0; k < cols; k++) {
                    sum = domain.add(sum, domain.multiply(get(i, k), other.get(k, j)));
                }
                out.data[i][j] = sum;
            }
        }
        return out;
    }

    public <R> Matrix<R> map(Function<? super T, ? extends R> f) {
        Matrix<R> out = new Matrix<>(rows, cols);
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                out.data[i][j] = Objects.requireNonNull(f.apply(get(i, j)), "entry");
        return out;
    }

    /** Column {@code c} as a list, top to bottom. */
    public List<T> column(int c) {
        List<T> col = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) col.add(get(i, c));
        return col;
    }

    /** Entry-wise comparison; exact in exact domains. */
    public boolean approximatelyEquals(Matrix<T> other, NumericDomain<T> domain, double tolerance) {
        if (rows != other.rows || cols != other.cols) return false;
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                if (!domain.approximatelyEqual(get(i, j), other.get(i, j), tolerance)) return false;
        return true;
    }

    /**
     * Writes this matrix to a writer, one row per line, optionally prefixing
     * each row with a label.
     */
    public void write(Writer out, List<String> rowLabels) throws IOException {
        for (int i = 0; i < rows; i++) {
            StringBuilder sb = new StringBuilder();
            if (rowLabels != null) sb.append(rowLabels.get(i)).append('\t');
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(data[i][j].toString());
            }
            out.write(sb.toString());
            out.write(System.lineSeparator());
        }
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix<?> o = (Matrix<?>) obj;
        if (rows != o.rows || cols != o.cols) return false;
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                if (!data[i][j].equals(o.data[i][j])) return false;
        return true;
    }

    @Override public int hashCode() {
        int h = 31 * rows + cols;
        for (Object[] row : data)
            for (Object v : row) h = 31 * h + v.hashCode();
        return h;
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(rows).append('x').append(cols).append('[');
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append("; ");
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(data[i][j]);
            }
        }
        return sb.append(']').toString();
    }
}
