package io.admissionpolicy.core.model;

/**
 * One admission rule. Exactly one of {@code mutation}, {@code validation} and {@code generation}
 * is expected to be set; that is checked by validation, not here.
 *
 * @param name       rule name, unique within its policy
 * @param match      {@code match.resources}; never null, possibly empty
 * @param exclude    {@code exclude.resources}; never null, possibly empty
 * @param mutation   {@code mutate}; never null, possibly unset
 * @param validation {@code validate}; never null, possibly unset
 * @param generation {@code generate}; never null, possibly unset
 */
public record Rule(
        String name,
        ResourceDescription match,
        ResourceDescription exclude,
        Mutation mutation,
        Validation validation,
        Generation generation) {

    public Rule {
        match = match != null ? match : ResourceDescription.empty();
        exclude = exclude != null ? exclude : ResourceDescription.empty();
        mutation = mutation != null ? mutation : Mutation.empty();
        validation = validation != null ? validation : Validation.empty();
        generation = generation != null ? generation : Generation.empty();
    }

    public boolean hasMutate() {
        return mutation.isSet();
    }

    public boolean hasValidate() {
        return validation.isSet();
    }

    public boolean hasGenerate() {
        return generation.isSet();
    }

    /** Returns a copy of this rule with the given validation block. */
    public Rule withValidation(Validation validation) {
        return new Rule(name, match, exclude, mutation, validation, generation);
    }

    /** Returns a copy of this rule with the given match block. */
    public Rule withMatch(ResourceDescription match) {
        return new Rule(name, match, exclude, mutation, validation, generation);
    }

    /** A validate rule matching the given resource description. */
    public static Rule validate(String name, ResourceDescription match, Validation validation) {
        return new Rule(name, match, null, null, validation, null);
    }

    /** A mutate rule matching the given resource description. */
    public static Rule mutate(String name, ResourceDescription match, Mutation mutation) {
        return new Rule(name, match, null, mutation, null, null);
    }

    /** A generate rule matching the given resource description. */
    public static Rule generate(String name, ResourceDescription match, Generation generation) {
        return new Rule(name, match, null, null, null, generation);
    }
}
