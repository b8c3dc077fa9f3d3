package io.admissionpolicy.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Filter describing which resources a rule matches or excludes.
 *
 * @param kinds      resource kinds, e.g. {@code Pod}; {@code null} when the field is absent, which
 *                   is not the same as an explicit empty list
 * @param name       resource name, optionally with wildcards
 * @param namespaces namespaces the resource must live in
 * @param selector   optional label selector, {@code null} when absent
 */
public record ResourceDescription(Set<String> kinds, String name, List<String> namespaces, LabelSelector selector) {

    public ResourceDescription {
        kinds = kinds != null ? Collections.unmodifiableSet(new LinkedHashSet<>(kinds)) : null;
        namespaces = namespaces != null ? List.copyOf(namespaces) : List.of();
    }

    public static ResourceDescription empty() {
        return new ResourceDescription(null, null, null, null);
    }

    public static ResourceDescription ofKinds(String... kinds) {
        return new ResourceDescription(new LinkedHashSet<>(List.of(kinds)), null, null, null);
    }

    /** Returns {@code true} when at least one kind is listed. */
    public boolean hasKinds() {
        return kinds != null && !kinds.isEmpty();
    }

    /**
     * Returns {@code true} when no field of the description is set. An explicit {@code kinds: []}
     * counts as set.
     */
    public boolean isEmpty() {
        return kinds == null && (name == null || name.isEmpty()) && namespaces.isEmpty() && selector == null;
    }
}
