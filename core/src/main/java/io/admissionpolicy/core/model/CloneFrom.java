package io.admissionpolicy.core.model;

/**
 * Source resource of a cloning {@code generate} rule.
 *
 * @param namespace namespace of the source resource
 * @param name      name of the source resource
 */
public record CloneFrom(String namespace, String name) {

    public static CloneFrom empty() {
        return new CloneFrom(null, null);
    }

    public boolean isEmpty() {
        return (namespace == null || namespace.isEmpty()) && (name == null || name.isEmpty());
    }
}
