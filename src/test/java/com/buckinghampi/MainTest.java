package com.buckinghampi;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return Main.run(args, new PrintWriter(out), new PrintWriter(err));
    }

    private Path reynolds() throws IOException {
        Path file = dir.resolve("reynolds.pi");
        Files.writeString(file, String.join(System.lineSeparator(),
                "rho = [M]*[L]^-3",
                "mu = [M]/[L]/[T]",
                "u = [L]/[T]",
                "l = m",
                ""));
        return file;
    }

    @Test
    public void printsGroupsAndTotals() throws IOException {
        assertEquals(0, run("-quiet", reynolds().toString()));
        String text = out.toString();
        assertTrue(text.contains("rho^(1//1)*mu^(-1//1)*u^(1//1)*l^(1//1)"), text);
        assertTrue(text.contains("*Totals: parameters=4 dimensions=3 groups=1"), text);
    }

    @Test
    public void expressionFormAndMatrix() throws IOException {
        assertEquals(0, run("-expr", "-matrix", "-fixed", "-quiet", reynolds().toString()));
        String text = out.toString();
        assertTrue(text.contains("rho ^ (1 // 1) * mu ^ (-1 // 1) * u ^ (1 // 1) * l ^ (1 // 1)"), text);
        assertTrue(text.contains("* rho mu u l"), text);
        assertTrue(text.contains("-3 -1 1 1"), text);
    }

    @Test
    public void exitStatuses() throws IOException {
        assertEquals(2, run());
        assertTrue(err.toString().contains("Missing input file"));
        assertEquals(2, run("-form", "latex", "x.pi"));
        assertEquals(1, run(dir.resolve("missing.pi").toString()));
        assertTrue(err.toString().contains("File not found"));

        Path bad = dir.resolve("bad.pi");
        Files.writeString(bad, "x = [Q]\n");
        assertEquals(1, run(bad.toString()));
        assertTrue(err.toString().contains("line 1"));
    }
}
