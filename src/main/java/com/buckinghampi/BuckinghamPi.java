package com.buckinghampi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the Buckingham-Pi groups of the parameters in a registry:
 * exponent matrix, full-pivot LU, null space, then one group per basis
 * vector. Each call works on a fresh snapshot of the registry.
 */
public final class BuckinghamPi {
    private static final Logger log = LoggerFactory.getLogger(BuckinghamPi.class);

    private BuckinghamPi() {}

    /** Groups in structured form, exact BigInteger arithmetic. */
    public static List<PiGroup> piGroups(ParameterRegistry registry) {
        return piGroups(registry, PiOptions.defaults());
    }

    /**
     * Groups in structured form using the arithmetic selected in
     * {@code options}.
     *
     * @throws ArithmeticOverflowException if {@link PiOptions.Arithmetic#FIXED}
     *         arithmetic overflows
     */
    public static List<PiGroup> piGroups(ParameterRegistry registry, PiOptions options) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(options, "options");
        List<Parameter> params = registry.parameters();
        List<String> symbols = new ArrayList<>(params.size());
        for (Parameter p : params) symbols.add(p.symbol());

        ExponentMatrix exponents = ExponentMatrix.of(params);
        log.debug("exponent matrix {} over dimensions {}", exponents.matrix(), exponents.dimensions());

        List<PiGroup> groups;
        if (options.arithmetic == PiOptions.Arithmetic.FIXED) {
            groups = solve(exponents.toFixedWidth(), Domains.FIXED_RATIONAL, symbols, LongFraction::toFraction);
        } else {
            groups = solve(exponents.matrix(), Domains.RATIONAL, symbols, Function.identity());
        }
        log.debug("{} parameter(s), {} pi group(s)", params.size(), groups.size());
        return groups;
    }

    public static <R> List<R> piGroups(ParameterRegistry registry, OutputForm<R> form) {
        return piGroups(registry, PiOptions.defaults(), form);
    }

    /** Groups computed with the arithmetic in {@code options}, rendered in {@code form}. */
    public static <R> List<R> piGroups(ParameterRegistry registry, PiOptions options, OutputForm<R> form) {
        Objects.requireNonNull(form, "form");
        return render(piGroups(registry, options), form);
    }

    /** Groups computed and rendered as {@code options} select. */
    public static List<?> renderedGroups(ParameterRegistry registry, PiOptions options) {
        return piGroups(registry, options, options.outputForm);
    }

    /**
     * Groups rendered in the named form; the name is resolved before anything
     * is computed.
     *
     * @throws UnknownOutputFormException if {@code form} is not a known form
     */
    public static List<?> piGroups(ParameterRegistry registry, String form) {
        return piGroups(registry, PiOptions.defaults(), form);
    }

    public static List<?> piGroups(ParameterRegistry registry, PiOptions options, String form) {
        return piGroups(registry, options, OutputForm.named(form));
    }

    public static List<String> piGroupStrings(ParameterRegistry registry) {
        return piGroups(registry, OutputForm.STRING);
    }

    public static List<Expression> piGroupExpressions(ParameterRegistry registry) {
        return piGroups(registry, OutputForm.EXPRESSION);
    }

    public static <R> List<R> render(List<PiGroup> groups, OutputForm<R> form) {
        List<R> out = new ArrayList<>(groups.size());
        for (PiGroup g : groups) out.add(form.render(g));
        return out;
    }

    private static <T> List<PiGroup> solve(Matrix<T> a, NumericDomain<T> domain, List<String> symbols,
                                           Function<? super T, Fraction> toExact) {
        LuFactorization<T> lu = FullPivotLu.factorize(a, domain);
        NullSpaceBasis<T> kernel = NullSpace.of(lu);
        return GroupAssembler.assemble(kernel, symbols, toExact);
    }
}
