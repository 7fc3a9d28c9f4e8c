package json.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A JSON object. Member names are unique.
///
/// Members keep the order in which they were supplied so that
/// {@link Json#render(JsonValue)} reproduces the input layout. That order carries
/// no meaning: two objects with the same members in a different order are
/// `equals`.
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        Objects.requireNonNull(members, "members must not be null");
        final LinkedHashMap<String, JsonValue> copy = new LinkedHashMap<>(members.size() * 2);
        members.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    public static JsonObject of(Map<String, ? extends JsonValue> members) {
        return new JsonObject(Collections.unmodifiableMap(members));
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    /// {@return the member with the given name, if present}
    public Optional<JsonValue> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(members.get(name));
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public String toString() {
        return Json.render(this);
    }
}
