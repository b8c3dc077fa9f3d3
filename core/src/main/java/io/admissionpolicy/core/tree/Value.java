package io.admissionpolicy.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A node of a schemaless pattern tree: a map, an array, or a scalar. Sealed so that every
 * traversal written against {@link #match} handles all three variants.
 *
 * <p>
 * Immutable, thread-safe. Produced by {@link Values#fromJson} from a parsed document.
 */
public sealed interface Value permits Value.MapValue, Value.ArrayValue, Value.ScalarValue {

    /**
     * Exhaustive dispatch over the three node variants.
     *
     * @param onMap    applied when this node is a {@link MapValue}
     * @param onArray  applied when this node is an {@link ArrayValue}
     * @param onScalar applied when this node is a {@link ScalarValue}
     * @return the result of whichever function was applied
     */
    <R> R match(
            Function<MapValue, R> onMap, Function<ArrayValue, R> onArray, Function<ScalarValue, R> onScalar);

    /** Short lowercase name of the node kind, used in diagnostics. */
    String typeName();

    default boolean isArray() {
        return this instanceof ArrayValue;
    }

    /** Ordered key to value mapping. Key order is the document order. */
    record MapValue(Map<String, Value> entries) implements Value {

        public MapValue {
            Objects.requireNonNull(entries, "entries must not be null");
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public <R> R match(
                Function<MapValue, R> onMap, Function<ArrayValue, R> onArray, Function<ScalarValue, R> onScalar) {
            return onMap.apply(this);
        }

        @Override
        public String typeName() {
            return "map";
        }

        public Value get(String key) {
            return entries.get(key);
        }

        public int size() {
            return entries.size();
        }
    }

    /** Ordered sequence of values. */
    record ArrayValue(List<Value> elements) implements Value {

        public ArrayValue {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R match(
                Function<MapValue, R> onMap, Function<ArrayValue, R> onArray, Function<ScalarValue, R> onScalar) {
            return onArray.apply(this);
        }

        @Override
        public String typeName() {
            return "array";
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public int size() {
            return elements.size();
        }
    }

    /**
     * A leaf: {@link String}, {@link Number}, {@link Boolean}, or {@code null}. Any other raw type
     * is rejected at construction.
     */
    record ScalarValue(Object raw) implements Value {

        public ScalarValue {
            if (raw != null && !(raw instanceof String) && !(raw instanceof Number) && !(raw instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "Unsupported scalar type: " + raw.getClass().getName());
            }
        }

        @Override
        public <R> R match(
                Function<MapValue, R> onMap, Function<ArrayValue, R> onArray, Function<ScalarValue, R> onScalar) {
            return onScalar.apply(this);
        }

        @Override
        public String typeName() {
            if (raw == null) {
                return "null";
            }
            if (raw instanceof String) {
                return "string";
            }
            if (raw instanceof Boolean) {
                return "boolean";
            }
            return "number";
        }

        public boolean isString() {
            return raw instanceof String;
        }

        public boolean isNull() {
            return raw == null;
        }

        /** The string content, or {@code null} when this scalar is not a string. */
        public String asString() {
            return raw instanceof String s ? s : null;
        }
    }

    static MapValue map(Map<String, Value> entries) {
        return new MapValue(entries);
    }

    static ArrayValue array(List<Value> elements) {
        return new ArrayValue(elements);
    }

    static ArrayValue array(Value... elements) {
        return new ArrayValue(List.of(elements));
    }

    static ScalarValue scalar(Object raw) {
        return new ScalarValue(raw);
    }

    static ScalarValue nullValue() {
        return new ScalarValue(null);
    }
}
