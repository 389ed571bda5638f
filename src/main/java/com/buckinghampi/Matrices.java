package com.buckinghampi;

import org.apache.commons.math3.complex.Complex;

/** Conversions between entry types. */
public final class Matrices {

    private Matrices() {}

    public static Matrix<Double> promote(long[][] a) {
        Double[][] out = new Double[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new Double[a[i].length];
            for (int j = 0; j < a[i].length; j++) out[i][j] = (double) a[i][j];
        }
        return Matrix.of(out);
    }

    public static Matrix<Complex> promoteComplex(long[][] re, long[][] im) {
        if (re.length != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts differ in row count");
        }
        Complex[][] out = new Complex[re.length][];
        for (int i = 0; i < re.length; i++) {
            if (re[i].length != im[i].length) {
                throw new IllegalArgumentException("Real and imaginary parts differ in row " + i);
            }
            out[i] = new Complex[re[i].length];
            for (int j = 0; j < re[i].length; j++) out[i][j] = new Complex(re[i][j], im[i][j]);
        }
        return Matrix.of(out);
    }

    public static Matrix<Fraction> rational(long[][] a) {
        Fraction[][] out = new Fraction[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new Fraction[a[i].length];
            for (int j = 0; j < a[i].length; j++) out[i][j] = Fraction.of(a[i][j]);
        }
        return Matrix.of(out);
    }

    /** Narrows to 64-bit rationals; throws {@link ArithmeticOverflowException} if an entry does not fit. */
    public static Matrix<LongFraction> fixedWidth(Matrix<Fraction> a) {
        return a.map(LongFraction::of);
    }

    public static Matrix<Fraction> exact(Matrix<? extends Numeric<?>> a) {
        return a.map(Numeric::toFraction);
    }
}
