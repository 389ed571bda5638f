package com.buckinghampi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class GroupAssemblerTest {

    @Test
    public void factorsFollowPermutedOrderAndSkipZeros() {
        Matrix<Fraction> basis = Matrix.parseRational("1/2\n0\n-1");
        NullSpaceBasis<Fraction> kernel = new NullSpaceBasis<>(basis, new int[]{2, 0, 1}, 2);

        List<PiGroup> groups = GroupAssembler.assemble(kernel, Arrays.asList("a", "b", "c"));
        assertEquals(1, groups.size());
        PiGroup g = groups.get(0);
        assertEquals(Arrays.asList(new Factor("c", Fraction.of(1, 2)), new Factor("b", Fraction.of(-1))), g.factors());
        assertEquals(Fraction.ZERO, g.exponentOf("a"));
        assertEquals("c^(1//2)*b^(-1//1)", g.toString());
    }

    @Test
    public void fixedWidthBasisIsConvertedToExactExponents() {
        Matrix<LongFraction> basis = Matrix.of(new LongFraction[][]{
                { LongFraction.of(3, 4) },
                { LongFraction.ONE }
        });
        NullSpaceBasis<LongFraction> kernel = new NullSpaceBasis<>(basis, new int[]{0, 1}, 1);
        List<PiGroup> groups = GroupAssembler.assemble(kernel, Arrays.asList("x", "y"), LongFraction::toFraction);
        assertEquals("x^(3//4)*y^(1//1)", groups.get(0).toString());
    }

    @Test
    public void symbolCountMustMatch() {
        NullSpaceBasis<Fraction> kernel = new NullSpaceBasis<>(Matrix.parseRational("1\n1"), new int[]{0, 1}, 1);
        assertThrows(IllegalArgumentException.class,
                () -> GroupAssembler.assemble(kernel, Arrays.asList("only")));
    }
}
