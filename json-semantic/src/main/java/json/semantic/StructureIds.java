package json.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Assigns each normalized value an integer id such that two values get the
/// same id exactly when they are semantically equal.
///
/// Scalars are identified by their own value (numbers compare numerically).
/// A container is identified by its kind plus the ids of its children:
/// members sorted by name for objects, {@link KeyedArrays#comparisonOrder}
/// for arrays. Children are always numbered before their parent, so deep
/// equality reduces to comparing two ints and nesting depth costs only heap.
///
/// One instance serves one comparison; ids are meaningless across instances.
final class StructureIds {

    /// Identity of a container once its children have ids.
    private record Shape(JsonValue.Kind kind, List<Object> parts) {
    }

    /// A container whose children are still being numbered.
    private static final class Pending {
        final JsonValue container;
        final List<String> names;
        final List<JsonValue> children;
        final int[] childIds;
        final int depth;
        int next;

        Pending(JsonValue container, int depth) {
            this.container = container;
            this.depth = depth;
            if (container instanceof JsonObject obj) {
                this.names = new ArrayList<>(obj.members().keySet());
                this.names.sort(null);
                this.children = new ArrayList<>(names.size());
                for (String name : names) {
                    children.add(obj.members().get(name));
                }
            } else {
                this.names = null;
                this.children = ((JsonArray) container).elements();
            }
            this.childIds = new int[children.size()];
        }

        Shape shape() {
            if (names != null) {
                final List<Object> parts = new ArrayList<>(names.size() * 2);
                for (int i = 0; i < names.size(); i++) {
                    parts.add(names.get(i));
                    parts.add(childIds[i]);
                }
                return new Shape(JsonValue.Kind.OBJECT, parts);
            }
            return new Shape(JsonValue.Kind.ARRAY,
                    List.copyOf(KeyedArrays.comparisonOrder((JsonArray) container, childIds)));
        }
    }

    private final Map<Object, Integer> ids = new HashMap<>();
    private final int maxDepth;

    StructureIds(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /// {@return the id of `root`}
    /// @throws JsonDepthExceededException if `root` nests deeper than the limit
    int idOf(JsonValue root) {
        if (isLeaf(root)) {
            return intern(root);
        }
        checkDepth(0);
        final Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, 0));
        while (true) {
            final Pending top = stack.element();
            if (top.next < top.children.size()) {
                final JsonValue child = top.children.get(top.next);
                if (isLeaf(child)) {
                    top.childIds[top.next++] = intern(child);
                } else {
                    checkDepth(top.depth + 1);
                    stack.push(new Pending(child, top.depth + 1));
                }
                continue;
            }
            stack.pop();
            final int id = intern(top.shape());
            if (stack.isEmpty()) {
                return id;
            }
            final Pending parent = stack.element();
            parent.childIds[parent.next++] = id;
        }
    }

    private static boolean isLeaf(JsonValue value) {
        return value.kind() != JsonValue.Kind.OBJECT && value.kind() != JsonValue.Kind.ARRAY;
    }

    private int intern(Object key) {
        return ids.computeIfAbsent(key, ignored -> ids.size());
    }

    private void checkDepth(int depth) {
        if (depth >= maxDepth) {
            throw new JsonDepthExceededException(maxDepth);
        }
    }
}
