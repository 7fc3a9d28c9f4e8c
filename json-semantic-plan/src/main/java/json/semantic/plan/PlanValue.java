package json.semantic.plan;

import java.util.Objects;

/// A string attribute value as seen while computing a change plan.
///
/// A value is either known (with text), explicitly null, or unknown because it
/// will only be computed when the change is applied.
public record PlanValue(State state, String text) {

    /// Whether the attribute has a value yet.
    public enum State {
        KNOWN,
        NULL,
        UNKNOWN
    }

    private static final PlanValue NULL = new PlanValue(State.NULL, null);
    private static final PlanValue UNKNOWN = new PlanValue(State.UNKNOWN, null);

    public PlanValue {
        Objects.requireNonNull(state, "state must not be null");
        if (state == State.KNOWN) {
            Objects.requireNonNull(text, "text must not be null for a known value");
        } else if (text != null) {
            throw new IllegalArgumentException(state + " value cannot carry text");
        }
    }

    public static PlanValue known(String text) {
        return new PlanValue(State.KNOWN, text);
    }

    public static PlanValue nullValue() {
        return NULL;
    }

    public static PlanValue unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return state == State.KNOWN;
    }
}
