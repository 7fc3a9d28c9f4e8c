package json.semantic;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Decides whether two JSON documents describe the same thing once
/// formatting and API-induced noise are discounted.
///
/// Usage:
/// ```java
/// SemanticEquality eq = SemanticEquality.of(NormalizationPolicy.of("executeOnce"));
/// eq.semanticEqual("{\"id\":\"n1\",\"executeOnce\":false}", "{\"id\":\"n1\"}"); // true
/// eq.semanticEqual("[1,2,3]", "[3,2,1]");                                        // false
/// ```
///
/// Both documents are parsed, normalized with {@link Normalizer} and then
/// compared structurally:
/// - object member order is irrelevant
/// - numbers compare by value, so `42` equals `42.0`
/// - keyed arrays compare as multisets, other arrays by position ({@link KeyedArrays})
/// - an absent value equals only another absent value
///
/// Instances are immutable and safe to share between threads.
public final class SemanticEquality {

    private static final Logger LOG = Logger.getLogger(SemanticEquality.class.getName());

    private final NormalizationPolicy policy;

    private SemanticEquality(NormalizationPolicy policy) {
        this.policy = policy;
    }

    /// {@return an equality engine that normalizes with `policy`}
    public static SemanticEquality of(NormalizationPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        return new SemanticEquality(policy);
    }

    public NormalizationPolicy policy() {
        return policy;
    }

    /// Compares two JSON texts.
    ///
    /// Fails closed: if either side is malformed or nested too deeply the
    /// result is `false`, so a broken value shows up as a pending change
    /// instead of being hidden.
    /// @throws NullPointerException if either text is null
    public boolean semanticEqual(String textA, String textB) {
        Objects.requireNonNull(textA, "textA must not be null");
        Objects.requireNonNull(textB, "textB must not be null");
        final JsonValue a;
        final JsonValue b;
        try {
            a = Json.parse(textA, policy.maxDepth());
            b = Json.parse(textB, policy.maxDepth());
        } catch (JsonParseException ex) {
            LOG.fine(() -> "Treating documents as different, parse failed: " + describe(ex));
            return false;
        }
        try {
            return equal(a, b);
        } catch (JsonDepthExceededException ex) {
            LOG.fine(() -> "Treating documents as different: " + ex.getMessage());
            return false;
        }
    }

    /// Normalizes both values and compares the results.
    /// @throws JsonDepthExceededException if either value nests deeper than the policy allows
    public boolean equal(JsonValue a, JsonValue b) {
        return equalNormalized(Normalizer.normalize(a, policy), Normalizer.normalize(b, policy));
    }

    /// Compares two values that have already been normalized. Empty means absent.
    /// @throws JsonDepthExceededException if either value nests deeper than the policy allows
    public boolean equalNormalized(Optional<JsonValue> a, Optional<JsonValue> b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        final StructureIds structure = new StructureIds(policy.maxDepth());
        return structure.idOf(a.get()) == structure.idOf(b.get());
    }

    /// Convenience for one-off comparisons.
    public static boolean semanticEqual(String textA, String textB, NormalizationPolicy policy) {
        return of(policy).semanticEqual(textA, textB);
    }

    private static String describe(JsonParseException ex) {
        return ex.hasPosition()
                ? ex.getMessage() + " (line " + ex.line() + ", column " + ex.column() + ")"
                : ex.getMessage();
    }

    @Override
    public String toString() {
        return "SemanticEquality[policy=" + policy + "]";
    }
}
