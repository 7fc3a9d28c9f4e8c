package json.semantic;

import java.util.List;
import java.util.Objects;

/// A JSON array. Element order is preserved exactly as given.
///
/// Record equality is positional. Order-independent comparison of keyed
/// arrays is the job of {@link SemanticEquality}, not of `equals`.
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    public JsonArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements); // rejects null elements
    }

    public static JsonArray of(List<? extends JsonValue> elements) {
        return new JsonArray(List.copyOf(elements));
    }

    public static JsonArray of(JsonValue... elements) {
        return new JsonArray(List.of(elements));
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return Json.render(this);
    }
}
