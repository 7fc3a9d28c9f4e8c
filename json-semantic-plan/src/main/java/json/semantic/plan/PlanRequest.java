package json.semantic.plan;

import java.util.Objects;

/// The three views of one attribute during planning: the persisted `state`,
/// the user-supplied `config`, and the `plan` proposed so far.
public record PlanRequest(PlanValue state, PlanValue config, PlanValue plan) {

    public PlanRequest {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
    }
}
