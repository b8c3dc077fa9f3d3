package io.admissionpolicy.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A label selector as written in a resource description. The presence of the object is
 * meaningful even when both fields are empty.
 *
 * @param matchLabels      exact label matches
 * @param matchExpressions set-based requirements
 */
public record LabelSelector(Map<String, String> matchLabels, List<LabelSelectorRequirement> matchExpressions) {

    public LabelSelector {
        matchLabels = matchLabels != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(matchLabels))
                : Map.of();
        matchExpressions = matchExpressions != null ? List.copyOf(matchExpressions) : List.of();
    }

    public static LabelSelector matchLabels(Map<String, String> labels) {
        return new LabelSelector(labels, null);
    }
}
