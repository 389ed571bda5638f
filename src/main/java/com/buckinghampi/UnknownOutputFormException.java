package com.buckinghampi;

/** Requested rendering of the pi groups is not one of {@link OutputForm#names()}. */
public class UnknownOutputFormException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public UnknownOutputFormException(String form) {
        super("Output form " + form + " not implemented. Choose between " + String.join(", ", OutputForm.names()));
    }
}
