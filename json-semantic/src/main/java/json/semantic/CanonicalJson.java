package json.semantic;

import java.util.Comparator;
import java.util.Objects;
import java.util.logging.Logger;

/// Deterministic re-encoding of JSON text for persisted storage.
///
/// The canonical form has object members sorted by the UTF-8 byte order of
/// their names, no insignificant whitespace, arrays in their original order
/// and numbers in their minimal spelling ({@link JsonNumber#canonicalText()}).
/// It is a pure format transform: nulls, optional fields and keyed-array order
/// are left exactly as they are.
///
/// For every well-formed input `x`, `canonicalize(canonicalize(x))` equals
/// `canonicalize(x)`.
public final class CanonicalJson {

    private static final Logger LOG = Logger.getLogger(CanonicalJson.class.getName());

    /// Orders strings by Unicode code point, which is the same as comparing
    /// their UTF-8 encodings byte by byte. `String.compareTo` differs for
    /// characters outside the Basic Multilingual Plane.
    static final Comparator<String> UTF8_BYTE_ORDER = CanonicalJson::compareCodePoints;

    private CanonicalJson() {
        // Prevent instantiation
    }

    /// Parses and re-renders `text` in canonical form with the default nesting limit.
    /// @throws JsonParseException if `text` is malformed
    /// @throws JsonDepthExceededException if nesting exceeds the default limit
    public static String canonicalize(String text) {
        return canonicalize(text, NormalizationPolicy.DEFAULT_MAX_DEPTH);
    }

    /// Parses and re-renders `text` in canonical form.
    /// @param text the JSON document
    /// @param maxDepth the nesting limit
    /// @throws JsonParseException if `text` is malformed
    /// @throws JsonDepthExceededException if nesting exceeds `maxDepth`
    public static String canonicalize(String text, int maxDepth) {
        Objects.requireNonNull(text, "text must not be null");
        final JsonValue parsed = Json.parse(text, maxDepth);
        final String canonical = render(parsed, maxDepth);
        LOG.finer(() -> "Canonicalized " + text.length() + " chars to " + canonical.length());
        return canonical;
    }

    /// {@return the canonical text of an already parsed value}
    public static String render(JsonValue value) {
        return render(value, NormalizationPolicy.DEFAULT_MAX_DEPTH);
    }

    public static String render(JsonValue value, int maxDepth) {
        return Json.write(value, UTF8_BYTE_ORDER, false, maxDepth);
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            final int ca = a.codePointAt(i);
            final int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
