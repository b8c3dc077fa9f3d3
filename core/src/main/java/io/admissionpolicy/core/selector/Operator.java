package io.admissionpolicy.core.selector;

import java.util.Optional;

/** Set-based label selector operators, with their document spelling. */
public enum Operator {
    IN("In"),
    NOT_IN("NotIn"),
    EXISTS("Exists"),
    DOES_NOT_EXIST("DoesNotExist");

    private final String wireName;

    Operator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether the operator takes a non-empty value list ({@code In}, {@code NotIn}). */
    public boolean requiresValues() {
        return this == IN || this == NOT_IN;
    }

    /** Looks up an operator by its document spelling (case-sensitive). */
    public static Optional<Operator> fromWireName(String name) {
        for (Operator op : values()) {
            if (op.wireName.equals(name)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
