package com.buckinghampi;

import java.util.Map;

/**
 * Decomposes a parameter into base-dimension exponents. Absent dimensions
 * have exponent zero; the iteration order of the returned map decides the
 * row order of dimensions first seen in that parameter.
 *
 * @param <P> parameter type
 */
@FunctionalInterface
public interface DimensionOracle<P> {
    Map<String, Fraction> dimensionsOf(P parameter);
}
