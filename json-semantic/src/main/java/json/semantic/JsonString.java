package json.semantic;

import java.util.Objects;

/// A JSON string, held as its decoded Java `String`.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }

    @Override
    public String toString() {
        return Json.render(this);
    }
}
