package com.buckinghampi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class NullSpaceTest {

    private static <T> void assertAnnihilates(Matrix<T> a, NullSpaceBasis<T> kernel, NumericDomain<T> domain, double tol) {
        Matrix<T> product = a.multiply(kernel.unpermuted(), domain);
        Matrix<T> zero = new Matrix<>(a.rows(), kernel.dimension(), domain.zero());
        assertTrue(product.approximatelyEquals(zero, domain, tol), "A·v should vanish, got " + product);
    }

    @Test
    public void wideRationalMatrix() {
        Matrix<Fraction> a = Matrices.rational(new long[][]{
                { 1, 4, 7, 10 },
                { 2, 5, 8, 11 },
                { 3, 6, 9, 12 }
        });
        NullSpaceBasis<Fraction> kernel = NullSpace.of(a, Domains.RATIONAL);

        assertEquals(2, kernel.rank());
        assertEquals(2, kernel.dimension());
        assertEquals(4, kernel.length());
        assertArrayEquals(new int[]{3, 0, 2, 1}, kernel.columnPermutation());
        assertEquals(Arrays.asList(Fraction.of(-2, 3), Fraction.of(-1, 3), Fraction.ONE, Fraction.ZERO),
                kernel.basis().column(0));
        assertEquals(Arrays.asList(Fraction.of(-1, 3), Fraction.of(-2, 3), Fraction.ZERO, Fraction.ONE),
                kernel.basis().column(1));
        assertAnnihilates(a, kernel, Domains.RATIONAL, 0.0);
    }

    @Test
    public void dimensionIsColumnsMinusEliminationRank() {
        Matrix<Fraction> a = Matrix.parseRational("1 2 3\n2 4 6");
        LuFactorization<Fraction> lu = FullPivotLu.factorize(a, Domains.RATIONAL);
        NullSpaceBasis<Fraction> kernel = NullSpace.of(lu);
        assertEquals(lu.rank(), kernel.rank());
        assertEquals(a.cols() - lu.rank(), kernel.dimension());
        assertEquals(2, kernel.dimension());
        assertAnnihilates(a, kernel, Domains.RATIONAL, 0.0);
    }

    @Test
    public void fullColumnRankHasNoBasisVectors() {
        Matrix<Fraction> a = Matrix.parseRational("1 0\n0 1\n1 1");
        NullSpaceBasis<Fraction> kernel = NullSpace.of(a, Domains.RATIONAL);
        assertEquals(0, kernel.dimension());
        assertEquals(2, kernel.length());
    }

    @Test
    public void noColumnsGivesEmptyBasis() {
        NullSpaceBasis<Fraction> kernel = NullSpace.of(new Matrix<>(0, 0, Fraction.ZERO), Domains.RATIONAL);
        assertEquals(0, kernel.dimension());
        assertEquals(0, kernel.length());

        NullSpaceBasis<Fraction> tall = NullSpace.of(new Matrix<>(3, 0, Fraction.ZERO), Domains.RATIONAL);
        assertEquals(0, tall.dimension());
        assertEquals(0, tall.length());
    }

    @Test
    public void zeroMatrixKernelIsEverything() {
        NullSpaceBasis<Fraction> kernel = NullSpace.of(new Matrix<>(2, 3, Fraction.ZERO), Domains.RATIONAL);
        assertEquals(0, kernel.rank());
        assertEquals(Matrix.identity(3, Domains.RATIONAL), kernel.basis());
    }

    @Test
    public void rowsWithoutDimensionsAreIgnored() {
        // parameters but no dimensions: every parameter is its own group
        NullSpaceBasis<Fraction> kernel = NullSpace.of(new Matrix<>(0, 2, Fraction.ZERO), Domains.RATIONAL);
        assertEquals(2, kernel.dimension());
        assertEquals(Matrix.identity(2, Domains.RATIONAL), kernel.basis());
    }

    @Test
    public void pendulumExponentMatrix() {
        // rows L, T, M; columns l, g, m, T, theta
        Matrix<Fraction> a = Matrix.parseRational(
                "1  1 0 0 0\n" +
                "0 -2 0 1 0\n" +
                "0  0 1 0 0");
        NullSpaceBasis<Fraction> kernel = NullSpace.of(a, Domains.RATIONAL);
        assertArrayEquals(new int[]{1, 0, 2, 3, 4}, kernel.columnPermutation());
        assertEquals(Arrays.asList(Fraction.of(1, 2), Fraction.of(-1, 2), Fraction.ZERO, Fraction.ONE, Fraction.ZERO),
                kernel.basis().column(0));
        assertEquals(Arrays.asList(Fraction.ZERO, Fraction.ZERO, Fraction.ZERO, Fraction.ZERO, Fraction.ONE),
                kernel.basis().column(1));
        assertAnnihilates(a, kernel, Domains.RATIONAL, 0.0);
    }

    @Test
    public void fixedWidthKernelMatchesExactKernel() {
        Matrix<Fraction> a = Matrix.parseRational("-3 -1 1 1\n1 1 0 0\n0 -1 -1 0");
        NullSpaceBasis<Fraction> exact = NullSpace.of(a, Domains.RATIONAL);
        NullSpaceBasis<LongFraction> fixed = NullSpace.of(Matrices.fixedWidth(a), Domains.FIXED_RATIONAL);
        assertEquals(exact.basis(), Matrices.exact(fixed.basis()));
        assertEquals(Arrays.asList(Fraction.ONE, Fraction.of(-1), Fraction.ONE, Fraction.ONE),
                exact.basis().column(0));
    }

    @Test
    public void doubleKernelIsApproximatelyZero() {
        Matrix<Double> a = Matrices.promote(new long[][]{
                { 1, 4, 7, 10 },
                { 2, 5, 8, 11 },
                { 3, 6, 9, 12 }
        });
        NullSpaceBasis<Double> kernel = NullSpace.of(a, Domains.REAL);
        assertEquals(2, kernel.dimension());
        assertAnnihilates(a, kernel, Domains.REAL, 1e-12);
    }
}
