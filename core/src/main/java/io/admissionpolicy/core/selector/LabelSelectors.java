package io.admissionpolicy.core.selector;

import io.admissionpolicy.core.error.InvalidSelectorException;
import io.admissionpolicy.core.model.LabelSelector;
import io.admissionpolicy.core.model.LabelSelectorRequirement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Compiles {@link LabelSelector}s into {@link Requirement} lists, applying the label syntax rules
 * of the cluster API.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class LabelSelectors {

    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_PREFIX_LENGTH = 253;

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9]([-A-Za-z0-9_.]*[A-Za-z0-9])?");
    private static final Pattern DNS_SUBDOMAIN =
            Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

    private LabelSelectors() {}

    /**
     * Compiles a selector. {@code matchLabels} entries become {@code In} requirements with a single
     * value. The result is sorted by key; an empty selector yields an empty list.
     *
     * @param selector the selector, must not be null
     * @return the compiled requirements
     * @throws InvalidSelectorException if a key, value, or operator is invalid
     */
    public static List<Requirement> requirements(LabelSelector selector) {
        Objects.requireNonNull(selector, "selector must not be null");
        List<Requirement> requirements = new ArrayList<>();
        for (Map.Entry<String, String> label : selector.matchLabels().entrySet()) {
            requirements.add(newRequirement(label.getKey(), Operator.IN, List.of(nullToEmpty(label.getValue()))));
        }
        for (LabelSelectorRequirement expression : selector.matchExpressions()) {
            Operator operator = Operator.fromWireName(expression.operator())
                    .orElseThrow(() -> new InvalidSelectorException(
                            "\"" + expression.operator() + "\" is not a valid label selector operator"));
            requirements.add(newRequirement(expression.key(), operator, expression.values()));
        }
        requirements.sort(Comparator.comparing(Requirement::key));
        return requirements;
    }

    private static Requirement newRequirement(String key, Operator operator, List<String> values) {
        validateKey(key);
        if (operator.requiresValues() && values.isEmpty()) {
            throw new InvalidSelectorException(
                    "for 'in', 'notin' operators, values set can't be empty (key '" + key + "')");
        }
        if (!operator.requiresValues() && !values.isEmpty()) {
            throw new InvalidSelectorException(
                    "values set must be empty for exists and does not exist (key '" + key + "')");
        }
        for (String value : values) {
            validateValue(key, value);
        }
        return new Requirement(key, operator, new TreeSet<>(values));
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidSelectorException("label key must not be empty");
        }
        String name = key;
        int slash = key.indexOf('/');
        if (slash >= 0) {
            String prefix = key.substring(0, slash);
            name = key.substring(slash + 1);
            if (prefix.isEmpty() || prefix.length() > MAX_PREFIX_LENGTH || !DNS_SUBDOMAIN.matcher(prefix).matches()) {
                throw new InvalidSelectorException(
                        "invalid label key \"" + key + "\": prefix must be a lowercase DNS subdomain");
            }
        }
        if (!isValidName(name)) {
            throw new InvalidSelectorException("invalid label key \"" + key
                    + "\": name part must be 63 characters or less, begin and end with an alphanumeric"
                    + " character and contain only '-', '_', '.' or alphanumerics");
        }
    }

    private static void validateValue(String key, String value) {
        if (!value.isEmpty() && !isValidName(value)) {
            throw new InvalidSelectorException("invalid label value \"" + value + "\" for key \"" + key
                    + "\": must be 63 characters or less, begin and end with an alphanumeric character"
                    + " and contain only '-', '_', '.' or alphanumerics");
        }
    }

    private static boolean isValidName(String name) {
        return !name.isEmpty() && name.length() <= MAX_NAME_LENGTH && NAME.matcher(name).matches();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
