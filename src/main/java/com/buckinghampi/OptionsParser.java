package com.buckinghampi;

public final class OptionsParser {

    public static final class Parsed {
        public final PiOptions options;
        public final String inputPath;
        private Parsed(PiOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        PiOptions.Builder b = new PiOptions.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-string": b.outputForm(OutputForm.STRING); break;       // default
                case "-expr": b.outputForm(OutputForm.EXPRESSION); break;
                case "-form": b.outputForm(next(args, ++i, a)); break;
                case "-fixed": b.arithmetic(PiOptions.Arithmetic.FIXED); break;
                case "-bigint": b.arithmetic(PiOptions.Arithmetic.ARBITRARY); break;   // default
                case "-quiet": b.displayRegistry(false); break;
                case "-matrix": b.printMatrix(true); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }

    private static String next(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }
}
