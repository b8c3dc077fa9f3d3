package io.admissionpolicy.core.error;

/** Thrown when a label selector cannot be compiled into requirements. */
public final class InvalidSelectorException extends PolicyException {

    private static final long serialVersionUID = 1L;

    public InvalidSelectorException(String message) {
        super(message, null, Phase.VALIDATION);
    }
}
