package io.admissionpolicy.core.model;

import io.admissionpolicy.core.tree.Value;

/**
 * A JSON patch operation inside a mutate block.
 *
 * @param path      target JSON pointer, mandatory
 * @param operation operation name as written ({@code add}, {@code replace}, {@code remove})
 * @param value     value to write, {@code null} when absent
 */
public record Patch(String path, String operation, Value value) {

    public static final String ADD = "add";
    public static final String REPLACE = "replace";
    public static final String REMOVE = "remove";
}
