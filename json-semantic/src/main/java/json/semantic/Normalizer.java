package json.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Strips values that carry no comparable information.
///
/// An empty `Optional` is the "absent" result. It is produced by:
/// - `null`
/// - an object member whose name is one of the policy's optional fields
/// - an object or array that is empty once its own contents are stripped
///
/// Absent values are never kept inside a container, so emptiness propagates
/// upward: `{"a":{"b":null}}` normalizes to absent. Scalars come back unchanged.
/// Normalizing an already normalized value returns an equal value.
public final class Normalizer {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    private Normalizer() {
        // Prevent instantiation
    }

    /// Normalizes `value` under `policy`.
    /// @return the comparison-normal value, or empty if nothing comparable remains
    /// @throws JsonDepthExceededException if `value` nests deeper than `policy.maxDepth()`
    public static Optional<JsonValue> normalize(JsonValue value, NormalizationPolicy policy) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        return Optional.ofNullable(normalizeTree(value, policy));
    }

    /// A container whose children are still being normalized.
    private static final class Pending {
        final Iterator<Map.Entry<String, JsonValue>> members;
        final Iterator<JsonValue> elements;
        final Map<String, JsonValue> keptMembers;
        final List<JsonValue> keptElements;
        final int depth;
        String pendingName;

        Pending(JsonValue container, int depth) {
            this.depth = depth;
            if (container instanceof JsonObject obj) {
                this.members = obj.members().entrySet().iterator();
                this.elements = null;
                this.keptMembers = new LinkedHashMap<>();
                this.keptElements = null;
            } else {
                this.members = null;
                this.elements = ((JsonArray) container).elements().iterator();
                this.keptMembers = null;
                this.keptElements = new ArrayList<>();
            }
        }

        boolean hasNext() {
            return members != null ? members.hasNext() : elements.hasNext();
        }

        void keep(JsonValue value) {
            if (keptMembers != null) {
                keptMembers.put(pendingName, value);
            } else {
                keptElements.add(value);
            }
        }

        /// Returns null for absent.
        JsonValue finish() {
            if (keptMembers != null) {
                return keptMembers.isEmpty() ? null : new JsonObject(keptMembers);
            }
            return keptElements.isEmpty() ? null : new JsonArray(keptElements);
        }
    }

    /// Returns null for absent. Walks the tree with an explicit stack.
    private static JsonValue normalizeTree(JsonValue root, NormalizationPolicy policy) {
        if (!isContainer(root)) {
            return root.kind() == JsonValue.Kind.NULL ? null : root;
        }
        checkDepth(0, policy);
        final Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, 0));
        while (true) {
            final Pending top = stack.element();
            if (top.hasNext()) {
                final JsonValue child;
                if (top.members != null) {
                    final Map.Entry<String, JsonValue> member = top.members.next();
                    final String name = member.getKey();
                    if (policy.isOptional(name)) {
                        LOG.finer(() -> "Dropping optional field '" + name + "' at depth " + top.depth);
                        continue;
                    }
                    top.pendingName = name;
                    child = member.getValue();
                } else {
                    child = top.elements.next();
                }
                if (isContainer(child)) {
                    checkDepth(top.depth + 1, policy);
                    stack.push(new Pending(child, top.depth + 1));
                } else if (child.kind() != JsonValue.Kind.NULL) {
                    top.keep(child);
                }
                continue;
            }
            stack.pop();
            final JsonValue finished = top.finish();
            if (stack.isEmpty()) {
                return finished;
            }
            if (finished != null) {
                stack.element().keep(finished);
            }
        }
    }

    private static boolean isContainer(JsonValue value) {
        return value.kind() == JsonValue.Kind.OBJECT || value.kind() == JsonValue.Kind.ARRAY;
    }

    private static void checkDepth(int depth, NormalizationPolicy policy) {
        if (depth >= policy.maxDepth()) {
            throw new JsonDepthExceededException(policy.maxDepth());
        }
    }
}
