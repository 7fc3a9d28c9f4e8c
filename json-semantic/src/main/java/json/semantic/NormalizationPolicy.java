package json.semantic;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Immutable configuration for comparison normalization.
///
/// `optionalFields` names the object members an upstream API may include or
/// omit inconsistently because they hold a default value. Such members are
/// dropped wherever they appear, at any depth. `maxDepth` bounds the nesting
/// that parsing, normalization and comparison will descend into.
///
/// A policy is passed explicitly to every comparison, so one engine instance
/// can serve differently shaped documents side by side.
public record NormalizationPolicy(Set<String> optionalFields, int maxDepth) {

    private static final Logger LOG = Logger.getLogger(NormalizationPolicy.class.getName());

    /// Default nesting limit, matching the Jackson streaming parser default.
    public static final int DEFAULT_MAX_DEPTH = 1000;

    /// System property holding a comma-separated list of optional field names.
    public static final String OPTIONAL_FIELDS_PROPERTY = "json.semantic.optionalFields";

    /// System property holding the maximum nesting depth.
    public static final String MAX_DEPTH_PROPERTY = "json.semantic.maxDepth";

    /// Workflow node fields the automation API omits while they hold their default.
    private static final Set<String> WORKFLOW_NODE_DEFAULTS = Set.of(
            "executeOnce",      // false
            "alwaysOutputData", // false
            "retryOnFail",      // false
            "onError",
            "continueOnFail",   // false
            "disabled");        // false

    private static final NormalizationPolicy NONE = new NormalizationPolicy(Set.of(), DEFAULT_MAX_DEPTH);

    public NormalizationPolicy {
        Objects.requireNonNull(optionalFields, "optionalFields must not be null");
        optionalFields = Set.copyOf(optionalFields);
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    /// {@return a policy that strips only nulls and emptied containers}
    public static NormalizationPolicy none() {
        return NONE;
    }

    public static NormalizationPolicy of(String... optionalFields) {
        return of(Arrays.asList(optionalFields));
    }

    public static NormalizationPolicy of(Collection<String> optionalFields) {
        Objects.requireNonNull(optionalFields, "optionalFields must not be null");
        return new NormalizationPolicy(Set.copyOf(optionalFields), DEFAULT_MAX_DEPTH);
    }

    /// {@return the policy for workflow node documents}
    /// The fields are `executeOnce`, `alwaysOutputData`, `retryOnFail`,
    /// `onError`, `continueOnFail` and `disabled`.
    public static NormalizationPolicy workflowNodeDefaults() {
        return new NormalizationPolicy(WORKFLOW_NODE_DEFAULTS, DEFAULT_MAX_DEPTH);
    }

    /// Builds a policy from the `json.semantic.optionalFields` and
    /// `json.semantic.maxDepth` system properties.
    ///
    /// Without `json.semantic.optionalFields` the workflow node defaults apply;
    /// an empty value means no optional fields.
    ///
    /// @throws IllegalArgumentException if the depth is not a positive integer
    public static NormalizationPolicy fromSystemProperties() {
        final String fieldsProp = System.getProperty(OPTIONAL_FIELDS_PROPERTY);
        final String depthProp = System.getProperty(MAX_DEPTH_PROPERTY);

        final Set<String> fields = fieldsProp == null
                ? WORKFLOW_NODE_DEFAULTS
                : Arrays.stream(fieldsProp.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toCollection(HashSet::new));

        int depth = DEFAULT_MAX_DEPTH;
        if (depthProp != null && !depthProp.isBlank()) {
            try {
                depth = Integer.parseInt(depthProp.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                        "Invalid " + MAX_DEPTH_PROPERTY + " value: '" + depthProp + "'", ex);
            }
        }

        final NormalizationPolicy policy = new NormalizationPolicy(fields, depth);
        LOG.config(() -> "Normalization policy from system properties: " + policy);
        return policy;
    }

    /// {@return true if members with this name are dropped during normalization}
    public boolean isOptional(String fieldName) {
        return optionalFields.contains(fieldName);
    }

    public NormalizationPolicy withMaxDepth(int maxDepth) {
        return new NormalizationPolicy(optionalFields, maxDepth);
    }

    public NormalizationPolicy withOptionalField(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        final Set<String> fields = new HashSet<>(optionalFields);
        fields.add(fieldName);
        return new NormalizationPolicy(fields, maxDepth);
    }
}
