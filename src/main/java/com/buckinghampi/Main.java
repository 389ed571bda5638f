package com.buckinghampi;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.List;

public class Main {

    private static void usage(PrintWriter err) {
        err.println(
                "Usage: pi-groups [options] <parameter-file>\n" +
                        "Forms:\n" +
                        "  -string        g^(1//2)*l^(-1//2)*T^(1//1)   [default]\n" +
                        "  -expr          g ^ (1 // 2) * l ^ (-1 // 2) * T ^ (1 // 1)\n" +
                        "  -form NAME     string | expr\n" +
                        "Options:\n" +
                        "  -bigint        arbitrary-precision rationals [default]\n" +
                        "  -fixed         64-bit rationals (fails on overflow)\n" +
                        "  -matrix        print the exponent matrix first\n" +
                        "  -quiet         do not log the registered parameters\n" +
                        "Parameter file: one 'symbol = value' per line, value a number,\n" +
                        "a unit (m/s), a quantity (9.8 m/s^2) or dimensions ([L]/[T]^2)\n"
        );
    }

    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(System.out, true);
        PrintWriter err = new PrintWriter(System.err, true);
        int status = run(args, out, err);
        if (status != 0) System.exit(status);
    }

    /** Runs the command line; returns the process exit status. */
    static int run(String[] args, PrintWriter out, PrintWriter err) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            err.flush();
            return 2;
        }

        PiOptions options = parsed.options;
        String filename = parsed.inputPath;
        try {
            ParameterRegistry registry = new ParameterRegistry()
                    .setParameters(ParameterFile.read(Paths.get(filename)));
            if (options.displayRegistry) registry.display();

            if (options.printMatrix) {
                ExponentMatrix exponents = ExponentMatrix.of(registry.parameters());
                out.println("* " + String.join(" ", registry.symbols()));
                exponents.matrix().write(out, exponents.dimensions());
            }

            List<?> groups = BuckinghamPi.renderedGroups(registry, options);
            for (Object rendered : groups) {
                out.println(rendered);
            }
            out.printf("*Totals: parameters=%d dimensions=%d groups=%d%n",
                    registry.size(), ExponentMatrix.of(registry.parameters()).rows(), groups.size());
            out.flush();
            return 0;
        } catch (FileNotFoundException | NoSuchFileException e) {
            err.println("File not found: " + filename);
            err.flush();
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return 1;
        } catch (ArithmeticOverflowException e) {
            err.println("Arithmetic overflow: " + e.getMessage() + " (rerun with -bigint)");
            err.flush();
            return 3;
        }
    }
}
