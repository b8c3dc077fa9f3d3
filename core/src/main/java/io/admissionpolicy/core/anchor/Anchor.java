package io.admissionpolicy.core.anchor;

import java.util.Objects;

/**
 * Result of classifying a pattern map key.
 *
 * @param kind    the decoration found on the key
 * @param key     the key with the decoration stripped
 * @param literal the key exactly as written in the pattern
 */
public record Anchor(AnchorKind kind, String key, String literal) {

    public Anchor {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(literal, "literal must not be null");
    }

    public boolean isPlain() {
        return kind == AnchorKind.PLAIN;
    }

    public boolean isExistence() {
        return kind == AnchorKind.EXISTENCE;
    }
}
