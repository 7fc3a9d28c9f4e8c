package json.semantic;

/// The interface that represents a parsed JSON value.
///
/// Instances of `JsonValue` are immutable and thread safe. A `JsonValue` is
/// produced by {@link Json#parse(String)} or built directly through the `of`
/// factories on each variant.
///
/// Every variant reports its {@link Kind}, so callers can dispatch with an
/// ordinary `switch` over the six JSON shapes.
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// The six shapes a JSON value can take.
    enum Kind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        ARRAY,
        OBJECT;

        /// {@return true for the leaf kinds that carry a single value}
        public boolean isScalar() {
            return this == BOOLEAN || this == NUMBER || this == STRING;
        }
    }

    /// {@return the shape of this value}
    Kind kind();

    /// {@return the compact JSON text of this value, members in insertion order}
    @Override
    String toString();
}
