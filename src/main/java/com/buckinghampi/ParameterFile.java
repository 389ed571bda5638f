package com.buckinghampi;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.measure.Dimension;
import javax.measure.Unit;
import javax.measure.format.MeasurementParseException;

import tech.units.indriya.format.SimpleUnitFormat;
import tech.units.indriya.quantity.Quantities;
import tech.units.indriya.unit.UnitDimension;

/**
 * Reads parameter lists, one {@code symbol = value} per line. Blank lines and
 * lines starting with {@code #} or {@code *} are ignored. A value is one of
 * <ul>
 *   <li>a plain number: {@code 2}, {@code 0.5}, {@code 1e-3}</li>
 *   <li>a product of bracketed base dimensions: {@code [T]}, {@code [M]*[L]^-3}</li>
 *   <li>a number followed by a unit: {@code 9.8 m/s^2}</li>
 *   <li>a unit: {@code kg}</li>
 * </ul>
 */
public final class ParameterFile {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(" + NUMBER.pattern() + ")\\s+(.+)$");
    private static final Pattern DIMENSION_TERM =
            Pattern.compile("\\s*([*/·]?)\\s*\\[([^\\]]+)\\]\\s*(?:\\^\\s*\\(?\\s*([-+]?\\d+)\\s*\\)?)?");

    private ParameterFile() {}

    public static List<Parameter> read(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(br);
        }
    }

    public static List<Parameter> parse(String text) throws IOException {
        try (BufferedReader br = new BufferedReader(new StringReader(text))) {
            return read(br);
        }
    }

    public static List<Parameter> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<Parameter> out = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty()) continue;
            if (t.startsWith("#") || t.startsWith("*")) continue; // comment

            int eq = t.indexOf('=');
            if (eq < 0) throw new IOException("Expected 'symbol = value' on line " + lineNo + ", got: " + t);
            String symbol = t.substring(0, eq).trim();
            String value = t.substring(eq + 1).trim();
            if (symbol.isEmpty() || value.isEmpty()) {
                throw new IOException("Missing symbol or value on line " + lineNo + ": " + t);
            }
            try {
                out.add(Parameter.of(symbol, parseValue(value)));
            } catch (MeasurementParseException | IllegalArgumentException e) {
                throw new IOException("Bad value on line " + lineNo + ": " + value + " (" + e.getMessage() + ")", e);
            }
        }
        return out;
    }

    static Object parseValue(String value) {
        if (NUMBER.matcher(value).matches()) return parseNumber(value);
        if (value.startsWith("[")) return parseDimension(value);
        Matcher m = LEADING_NUMBER.matcher(value);
        if (m.matches()) {
            return Quantities.getQuantity(parseNumber(m.group(1)), parseUnit(m.group(m.groupCount())));
        }
        return parseUnit(value);
    }

    static Number parseNumber(String s) {
        if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
            BigInteger big = new BigInteger(s.startsWith("+") ? s.substring(1) : s);
            return big.bitLength() < 64 ? (Number) big.longValue() : big;
        }
        return Double.parseDouble(s);
    }

    static Unit<?> parseUnit(String s) {
        return SimpleUnitFormat.getInstance().parse(s.trim());
    }

    static Dimension parseDimension(String s) {
        Matcher m = DIMENSION_TERM.matcher(s);
        Dimension result = UnitDimension.NONE;
        int pos = 0;
        boolean first = true;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Cannot parse dimension at position " + pos + " of " + s);
            }
            String op = m.group(1);
            if (first != op.isEmpty()) {
                throw new IllegalArgumentException("Misplaced operator at position " + pos + " of " + s);
            }
            Dimension d = baseDimension(m.group(2).trim());
            if (m.group(3) != null) d = d.pow(Integer.parseInt(m.group(3)));
            result = op.equals("/") ? result.divide(d) : result.multiply(d);
            first = false;
            pos = m.end();
        }
        return result;
    }

    private static Dimension baseDimension(String symbol) {
        switch (symbol) {
            case "L": return UnitDimension.LENGTH;
            case "M": return UnitDimension.MASS;
            case "T": return UnitDimension.TIME;
            case "I": return UnitDimension.ELECTRIC_CURRENT;
            case "Θ":
            case "K": return UnitDimension.TEMPERATURE;
            case "N": return UnitDimension.AMOUNT_OF_SUBSTANCE;
            case "J": return UnitDimension.LUMINOUS_INTENSITY;
            default: throw new IllegalArgumentException("Unknown base dimension [" + symbol + "]");
        }
    }
}
