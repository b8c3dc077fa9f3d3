package io.admissionpolicy.core.anchor;

/** Decorations a pattern map key may carry. */
public enum AnchorKind {
    /** Undecorated key. */
    PLAIN(""),
    /** {@code (key)}: the rest of the pattern applies only if this element matches. */
    CONDITION(""),
    /** {@code =(key)}: if the field is present its value must match. */
    EQUALITY("="),
    /** {@code ^(key)}: at least one element of the array must match. Must be bound to an array. */
    EXISTENCE("^"),
    /** {@code +(key)}: add the field only when it is not already present. */
    ADD_IF_NOT_PRESENT("+"),
    /** {@code X(key)}: the field must not be present. */
    NEGATION("X");

    private final String prefix;

    AnchorKind(String prefix) {
        this.prefix = prefix;
    }

    /** Character(s) written before the opening parenthesis; empty for {@link #CONDITION}. */
    public String prefix() {
        return prefix;
    }
}
