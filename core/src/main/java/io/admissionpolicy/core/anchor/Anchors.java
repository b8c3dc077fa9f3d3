package io.admissionpolicy.core.anchor;

import java.util.Objects;

/**
 * Classifies pattern map keys by their anchor decoration ({@code ^(name)}, {@code =(name)}, ...).
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class Anchors {

    private Anchors() {}

    /**
     * Classifies a key. A decoration with nothing between the parentheses is not an anchor.
     *
     * @param key the raw map key
     * @return the classification, never null
     */
    public static Anchor classify(String key) {
        Objects.requireNonNull(key, "key must not be null");
        int length = key.length();
        if (length < 3 || key.charAt(length - 1) != ')') {
            return plain(key);
        }
        if (key.charAt(0) == '(') {
            return anchor(AnchorKind.CONDITION, key, 1);
        }
        if (key.charAt(1) != '(') {
            return plain(key);
        }
        return switch (key.charAt(0)) {
            case '^' -> anchor(AnchorKind.EXISTENCE, key, 2);
            case '=' -> anchor(AnchorKind.EQUALITY, key, 2);
            case '+' -> anchor(AnchorKind.ADD_IF_NOT_PRESENT, key, 2);
            case 'X' -> anchor(AnchorKind.NEGATION, key, 2);
            default -> plain(key);
        };
    }

    /** Returns {@code true} if the string is an existence anchor such as {@code ^(name)}. */
    public static boolean isExistenceAnchor(String key) {
        return classify(key).isExistence();
    }

    private static Anchor anchor(AnchorKind kind, String key, int innerStart) {
        String inner = key.substring(innerStart, key.length() - 1);
        if (inner.isEmpty()) {
            return plain(key);
        }
        return new Anchor(kind, inner, key);
    }

    private static Anchor plain(String key) {
        return new Anchor(AnchorKind.PLAIN, key, key);
    }
}
