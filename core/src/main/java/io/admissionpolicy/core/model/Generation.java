package io.admissionpolicy.core.model;

import io.admissionpolicy.core.tree.Value;

/**
 * The {@code generate} block of a rule. Exactly one of {@code data} and {@code clone} is expected.
 * The {@code clone} block is held in {@code cloneFrom}.
 *
 * @param kind      kind of the generated resource
 * @param name      name of the generated resource
 * @param data      inline resource content, {@code null} when absent
 * @param cloneFrom source to copy from; never null, possibly empty
 */
public record Generation(String kind, String name, Value data, CloneFrom cloneFrom) {

    public Generation {
        cloneFrom = cloneFrom != null ? cloneFrom : CloneFrom.empty();
    }

    public static Generation empty() {
        return new Generation(null, null, null, null);
    }

    public boolean hasData() {
        return data != null;
    }

    public boolean hasClone() {
        return !cloneFrom.isEmpty();
    }

    public boolean isSet() {
        return (kind != null && !kind.isEmpty()) || (name != null && !name.isEmpty()) || hasData() || hasClone();
    }
}
