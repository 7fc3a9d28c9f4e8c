package json.semantic.plan;

import json.semantic.CanonicalJson;
import json.semantic.NormalizationPolicy;
import json.semantic.SemanticEquality;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Suppresses no-op updates of JSON-valued attributes.
///
/// When the persisted state and the configured value differ only in
/// formatting, member order, nulls, optional default-valued fields or keyed
/// array order, the planned value is replaced with the state text so that no
/// update is proposed. Any substantive difference, including a value that does
/// not parse, leaves the plan untouched.
public final class JsonSemanticPlanModifier {

    private static final Logger LOG = Logger.getLogger(JsonSemanticPlanModifier.class.getName());

    private static final String DESCRIPTION =
            "Compares JSON strings semantically, ignoring whitespace, key ordering, null values, "
                    + "optional default-valued fields and the order of keyed array elements.";

    private static final String MARKDOWN_DESCRIPTION =
            "Compares JSON strings semantically, ignoring whitespace, key ordering, `null` values, "
                    + "optional default-valued fields and the order of array elements that carry a `key` field.";

    private final SemanticEquality equality;

    private JsonSemanticPlanModifier(SemanticEquality equality) {
        this.equality = equality;
    }

    public static JsonSemanticPlanModifier of(NormalizationPolicy policy) {
        return new JsonSemanticPlanModifier(SemanticEquality.of(policy));
    }

    /// {@return a modifier configured from system properties}
    /// @see NormalizationPolicy#fromSystemProperties()
    public static JsonSemanticPlanModifier fromSystemProperties() {
        return of(NormalizationPolicy.fromSystemProperties());
    }

    public String description() {
        return DESCRIPTION;
    }

    public String markdownDescription() {
        return MARKDOWN_DESCRIPTION;
    }

    /// Computes the planned value for one attribute.
    /// @return the state value when state and config are semantically equal, otherwise the request's plan
    public PlanValue modify(PlanRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        final PlanValue state = request.state();
        final PlanValue config = request.config();
        final PlanValue plan = request.plan();

        // create, computed-only and destroy have nothing to compare
        if (!state.isKnown() || !config.isKnown() || !plan.isKnown()) {
            return plan;
        }
        if (state.text().equals(config.text())) {
            return plan;
        }
        if (equality.semanticEqual(state.text(), config.text())) {
            LOG.fine("Configured JSON is semantically equal to state, keeping state value");
            return state;
        }
        LOG.fine("Configured JSON differs from state, keeping planned value");
        return plan;
    }

    /// Checks a set of JSON attributes of one resource for substantive change.
    ///
    /// A missing map value counts as an explicit null. Attributes that are
    /// unknown on either side are skipped, since their value is not decided yet.
    /// @param planned attribute name to planned value
    /// @param state attribute name to persisted value
    /// @return true if an attribute was added, removed, switched between null
    ///         and a value, or is not semantically equal
    public boolean contentChanged(Map<String, PlanValue> planned, Map<String, PlanValue> state) {
        Objects.requireNonNull(planned, "planned must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (!planned.keySet().equals(state.keySet())) {
            return true;
        }
        for (Map.Entry<String, PlanValue> attribute : planned.entrySet()) {
            final String name = attribute.getKey();
            final PlanValue plannedValue = Objects.requireNonNullElse(attribute.getValue(), PlanValue.nullValue());
            final PlanValue stateValue = Objects.requireNonNullElse(state.get(name), PlanValue.nullValue());
            if (attributeChanged(plannedValue, stateValue)) {
                LOG.fine(() -> "Attribute '" + name + "' changed");
                return true;
            }
        }
        return false;
    }

    private boolean attributeChanged(PlanValue planned, PlanValue state) {
        if (planned.state() == PlanValue.State.UNKNOWN || state.state() == PlanValue.State.UNKNOWN) {
            return false;
        }
        if (!planned.isKnown() || !state.isKnown()) {
            return planned.isKnown() != state.isKnown();
        }
        return !equality.semanticEqual(planned.text(), state.text());
    }

    /// {@return the canonical text to persist after a confirmed change}
    /// @throws json.semantic.JsonParseException if `text` is malformed
    public String storedForm(String text) {
        return CanonicalJson.canonicalize(text, equality.policy().maxDepth());
    }
}
