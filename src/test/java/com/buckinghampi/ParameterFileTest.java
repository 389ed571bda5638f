package com.buckinghampi;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import tech.units.indriya.unit.UnitDimension;
import tech.units.indriya.unit.Units;

/**
 * Tests reading of parameter files: every value kind, comments, and the
 * error reported for malformed lines.
 */
public class ParameterFileTest {

    private static final String PENDULUM = String.join(System.lineSeparator(),
            "# simple pendulum",
            "l = m",
            "g = [L]/[T]^2",
            "",
            "m = kg",
            "* period",
            "T = [T]",
            "theta = 1",
            "");

    @Test
    public void testReadPendulumFile() throws IOException {
        Path temp = Files.createTempFile("pendulum", ".pi");
        Files.writeString(temp, PENDULUM);
        List<Parameter> params = ParameterFile.read(temp);
        Files.deleteIfExists(temp);

        assertEquals(5, params.size());
        assertEquals(Units.METRE, params.get(0).value().value());
        assertTrue(params.get(1).value() instanceof ParameterValue.OfDimension);
        assertEquals(Units.KILOGRAM, params.get(2).value().value());
        assertEquals(Fraction.ONE, params.get(3).dimensions().get(UnitDimension.TIME.toString()));
        assertEquals(1, params.get(3).dimensions().size());
        assertTrue(params.get(4).value() instanceof ParameterValue.OfNumber);

        assertEquals(Fraction.ONE, params.get(1).dimensions().get(UnitDimension.LENGTH.toString()));
        assertEquals(Fraction.of(-2), params.get(1).dimensions().get(UnitDimension.TIME.toString()));

        ParameterRegistry r = new ParameterRegistry().setParameters(params);
        assertEquals(Arrays.asList("g^(1//2)*l^(-1//2)*T^(1//1)", "theta^(1//1)"), BuckinghamPi.piGroupStrings(r));
    }

    @Test
    public void testQuantitiesAndNumbers() throws IOException {
        List<Parameter> params = ParameterFile.parse("v = 3 m/s\nk = 0.25\nn = -7\nrho = [M]*[L]^-3");
        assertTrue(params.get(0).value() instanceof ParameterValue.OfQuantity);
        assertEquals(3.0, params.get(0).magnitude(), 0.0);
        assertEquals(Fraction.ONE, params.get(0).dimensions().get(UnitDimension.LENGTH.toString()));
        assertEquals(Fraction.of(-1), params.get(0).dimensions().get(UnitDimension.TIME.toString()));
        assertEquals(0.25, params.get(1).magnitude(), 0.0);
        assertEquals(-7L, params.get(2).value().value());
        assertEquals(Fraction.of(-3), params.get(3).dimensions().get(UnitDimension.LENGTH.toString()));
        assertEquals(Fraction.ONE, params.get(3).dimensions().get(UnitDimension.MASS.toString()));
    }

    @Test
    public void testMalformedLinesNameTheLine() {
        IOException noEquals = assertThrows(IOException.class, () -> ParameterFile.parse("l = m\nbogus"));
        assertTrue(noEquals.getMessage().contains("line 2"), noEquals.getMessage());

        IOException badDim = assertThrows(IOException.class, () -> ParameterFile.parse("x = [Q]"));
        assertTrue(badDim.getMessage().contains("line 1"), badDim.getMessage());

        assertThrows(IOException.class, () -> ParameterFile.parse("x = [L][T]"));
        assertThrows(IOException.class, () -> ParameterFile.parse(" = 3"));
        assertThrows(IOException.class, () -> ParameterFile.parse("x = "));
    }
}
