package com.buckinghampi;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * How pi groups are handed back: as delimited text or as an evaluable
 * {@link Expression}.
 *
 * @param <R> rendered type
 */
public final class OutputForm<R> {

    /** {@code g^(1//2)*ℓ^(-1//2)*τ^(1//1)}; the denominator is always printed. */
    public static final OutputForm<String> STRING = new OutputForm<>("string", OutputForm::text);

    public static final OutputForm<Expression> EXPRESSION = new OutputForm<>("expr", Expression::of);

    private final String name;
    private final Function<PiGroup, R> renderer;

    private OutputForm(String name, Function<PiGroup, R> renderer) {
        this.name = name;
        this.renderer = renderer;
    }

    /**
     * Resolves a form by name, case-insensitively: {@code string}, or
     * {@code expr}/{@code expression}.
     *
     * @throws UnknownOutputFormException for any other name
     */
    public static OutputForm<?> named(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "string": return STRING;
            case "expr":
            case "expression": return EXPRESSION;
            default: throw new UnknownOutputFormException(name);
        }
    }

    public static List<String> names() { return Arrays.asList("string", "expr"); }

    public String name() { return name; }

    public R render(PiGroup group) { return renderer.apply(group); }

    private static String text(PiGroup group) {
        StringBuilder sb = new StringBuilder();
        for (Factor f : group.factors()) {
            if (sb.length() > 0) sb.append('*');
            Fraction a = f.exponent();
            sb.append(f.symbol()).append("^(").append(a.numerator()).append("//").append(a.denominator()).append(')');
        }
        return sb.toString();
    }

    @Override public String toString() { return name; }
}
