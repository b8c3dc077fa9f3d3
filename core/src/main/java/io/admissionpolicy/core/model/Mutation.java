package io.admissionpolicy.core.model;

import io.admissionpolicy.core.tree.Value;
import java.util.List;

/**
 * The {@code mutate} block of a rule.
 *
 * @param overlay overlay tree, {@code null} when absent
 * @param patches JSON patches in document order
 */
public record Mutation(Value overlay, List<Patch> patches) {

    public Mutation {
        patches = patches != null ? List.copyOf(patches) : List.of();
    }

    public static Mutation empty() {
        return new Mutation(null, null);
    }

    public static Mutation ofPatches(Patch... patches) {
        return new Mutation(null, List.of(patches));
    }

    public boolean isSet() {
        return overlay != null || !patches.isEmpty();
    }
}
