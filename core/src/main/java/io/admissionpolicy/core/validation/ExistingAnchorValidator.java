package io.admissionpolicy.core.validation;

import io.admissionpolicy.core.anchor.Anchors;
import io.admissionpolicy.core.tree.Value;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that every existence anchor ({@code ^(key)}) in a pattern tree is bound to an array, and
 * that the tree contains no empty arrays.
 *
 * <p>
 * The walk is depth-first, left to right, and stops at the first violation. Paths are built as
 * {@code /} followed by each map key or array index and a trailing {@code /}, e.g.
 * {@code /spec/containers/0/}. Trees nested deeper than {@code maxDepth} are rejected with
 * {@link ViolationKind#PATTERN_TOO_DEEP} instead of being walked.
 *
 * <p>
 * Thread-safe: holds only the immutable depth limit.
 */
public final class ExistingAnchorValidator {

    public static final int DEFAULT_MAX_DEPTH = 64;
    static final String ROOT_PATH = "/";

    private final int maxDepth;

    public ExistingAnchorValidator() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth maximum number of nested maps/arrays accepted below the root
     */
    public ExistingAnchorValidator(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Validates a pattern tree starting at the root path {@code /}. */
    public Optional<Violation> validate(Value pattern) {
        return validate(pattern, ROOT_PATH);
    }

    /**
     * Validates a pattern tree whose root sits at the given path.
     *
     * @param pattern the tree to walk
     * @param path    path of {@code pattern}, ending with {@code /}
     * @return the first violation found, or empty
     */
    public Optional<Violation> validate(Value pattern, String path) {
        return walk(pattern, path, 0);
    }

    private Optional<Violation> walk(Value node, String path, int depth) {
        if (depth > maxDepth) {
            return Optional.of(Violation.at(
                    ViolationKind.PATTERN_TOO_DEEP,
                    path,
                    "pattern at " + path + " exceeds the maximum nesting depth of " + maxDepth));
        }
        return node.match(
                map -> walkMap(map, path, depth),
                array -> walkArray(array, path, depth),
                scalar -> checkScalar(scalar, path));
    }

    private Optional<Violation> walkMap(Value.MapValue map, String path, int depth) {
        for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
            String key = entry.getKey();
            Value value = entry.getValue();
            if (Anchors.isExistenceAnchor(key) && !value.isArray()) {
                return Optional.of(anchorNotOnArray(path, key, value.typeName()));
            }
            Optional<Violation> nested = walk(value, path + key + "/", depth + 1);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    private Optional<Violation> walkArray(Value.ArrayValue array, String path, int depth) {
        if (array.isEmpty()) {
            return Optional.of(
                    Violation.at(ViolationKind.EMPTY_PATTERN_ARRAY, path, "pattern array at " + path + " is empty"));
        }
        List<Value> elements = array.elements();
        for (int i = 0; i < elements.size(); i++) {
            Optional<Violation> nested = walk(elements.get(i), path + i + "/", depth + 1);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    // An anchor is only legal as a map key; as a value it has nothing to bind to.
    private Optional<Violation> checkScalar(Value.ScalarValue scalar, String path) {
        if (scalar.isString() && Anchors.isExistenceAnchor(scalar.asString())) {
            return Optional.of(anchorNotOnArray(path, scalar.asString(), scalar.typeName()));
        }
        return Optional.empty();
    }

    private static Violation anchorNotOnArray(String path, String anchor, String foundType) {
        return Violation.at(
                ViolationKind.ANCHOR_NOT_ON_ARRAY,
                path,
                "existing anchor at " + path + anchor + " must be of type array, found: " + foundType);
    }
}
