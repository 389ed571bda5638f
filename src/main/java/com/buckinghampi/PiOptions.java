package com.buckinghampi;

import java.util.Objects;

/** Settings for one pi-group computation. */
public final class PiOptions {
    public enum Arithmetic { ARBITRARY, FIXED }   // BigInteger / 64-bit rationals

    public final Arithmetic arithmetic;
    public final OutputForm<?> outputForm;
    public final boolean displayRegistry;       // log the registry before computing
    public final boolean printMatrix;           // CLI: echo the exponent matrix

    private PiOptions(Builder b) {
        this.arithmetic = b.arithmetic;
        this.outputForm = b.outputForm;
        this.displayRegistry = b.displayRegistry;
        this.printMatrix = b.printMatrix;
    }

    public static PiOptions defaults() { return new Builder().build(); }

    public static final class Builder {
        private Arithmetic arithmetic = Arithmetic.ARBITRARY;
        private OutputForm<?> outputForm = OutputForm.STRING;
        private boolean displayRegistry = true;
        private boolean printMatrix;

        public Builder arithmetic(Arithmetic a){ this.arithmetic = Objects.requireNonNull(a); return this; }
        public Builder outputForm(OutputForm<?> f){ this.outputForm = Objects.requireNonNull(f); return this; }
        public Builder outputForm(String name){ this.outputForm = OutputForm.named(name); return this; }
        public Builder displayRegistry(boolean v){ this.displayRegistry = v; return this; }
        public Builder printMatrix(boolean v){ this.printMatrix = v; return this; }
        public PiOptions build(){ return new PiOptions(this); }
    }
}
