package io.admissionpolicy.core.validation;

/** Category of a structural policy violation. */
public enum ViolationKind {
    DUPLICATE_RULE_NAME,
    NO_RULE_TYPE_DEFINED,
    MULTIPLE_RULE_TYPES_DEFINED,
    MISSING_RESOURCE_KIND,
    INVALID_SELECTOR,
    EMPTY_SELECTOR_REQUIREMENTS,
    MISSING_PATTERN,
    CONFLICTING_PATTERN_FIELDS,
    ANCHOR_NOT_ON_ARRAY,
    EMPTY_PATTERN_ARRAY,
    /**
     * Kept for catalogue completeness. Pattern trees are a closed set of node variants, so the
     * anchor walk never reports it.
     */
    UNKNOWN_TREE_NODE_TYPE,
    /** Pattern tree nested deeper than the configured limit. */
    PATTERN_TOO_DEEP,
    MISSING_PATCH_PATH,
    MISSING_PATCH_VALUE,
    UNSUPPORTED_PATCH_OPERATION,
    CONFLICTING_GENERATION_SOURCE,
    MISSING_GENERATION_SOURCE
}
