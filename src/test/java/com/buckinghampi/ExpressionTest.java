package com.buckinghampi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class ExpressionTest {

    private static final PiGroup PENDULUM = new PiGroup(Arrays.asList(
            new Factor("g", Fraction.of(1, 2)),
            new Factor("ℓ", Fraction.of(-1, 2)),
            new Factor("τ", Fraction.ONE)));

    @Test
    public void textForm() {
        assertEquals("g^(1//2)*ℓ^(-1//2)*τ^(1//1)", OutputForm.STRING.render(PENDULUM));
    }

    @Test
    public void expressionFormPrintsAndEvaluates() {
        Expression e = OutputForm.EXPRESSION.render(PENDULUM);
        assertEquals("g ^ (1 // 2) * ℓ ^ (-1 // 2) * τ ^ (1 // 1)", e.toString());

        Map<String, Double> values = new HashMap<>();
        values.put("g", 9.8);
        values.put("ℓ", 1.0);
        values.put("τ", 1.0);
        assertEquals(Math.sqrt(9.8), e.evaluate(values), 1e-12);

        values.put("ℓ", 4.0);
        values.put("τ", 2.0);
        assertEquals(Math.sqrt(9.8), e.evaluate(values), 1e-12);
    }

    @Test
    public void expressionIsBuiltFromFactors() {
        Expression.Product p = Expression.of(PENDULUM);
        assertEquals(3, p.powers().size());
        assertEquals(new Expression.Power("ℓ", Fraction.of(-1, 2)), p.powers().get(1));
        assertEquals(p, Expression.of(PENDULUM));
    }

    @Test
    public void missingBindingThrows() {
        Map<String, Integer> values = new HashMap<>();
        values.put("g", 4);
        assertThrows(IllegalArgumentException.class, () -> Expression.of(PENDULUM).evaluate(values));
    }

    @Test
    public void formNames() {
        assertSame(OutputForm.STRING, OutputForm.named("string"));
        assertSame(OutputForm.EXPRESSION, OutputForm.named("Expr"));
        assertSame(OutputForm.EXPRESSION, OutputForm.named("expression"));
        assertThrows(UnknownOutputFormException.class, () -> OutputForm.named("latex"));
        assertThrows(UnknownOutputFormException.class, () -> OutputForm.named(null));
    }
}
