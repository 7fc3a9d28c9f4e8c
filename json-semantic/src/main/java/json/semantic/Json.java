package json.semantic;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Parses JSON text into {@link JsonValue} trees and renders trees back to text.
///
/// Parsing is strict RFC 8259: no comments, no single quotes, no unquoted
/// member names, and nothing but whitespace after the root value. When an
/// object repeats a member name the last occurrence wins.
///
/// ```java
/// JsonValue v = Json.parse("{ \"b\": 2, \"a\": 1 }");
/// Json.render(v);          // {"b":2,"a":1}
/// Json.toDisplayString(v); // indented, for log output
/// ```
///
/// Both directions are backed by the Jackson streaming API and keep open
/// containers on a heap stack, so deep documents never exhaust the call stack.
/// Nesting beyond the limit surfaces as {@link JsonDepthExceededException};
/// Jackson's own nesting constraints are set one level looser so that this
/// check always fires first.
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /// Depth limit meaning "no limit" for rendering.
    static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final JsonFactory DEFAULT_FACTORY = newFactory(NormalizationPolicy.DEFAULT_MAX_DEPTH);
    private static final JsonFactory UNBOUNDED_FACTORY = newFactory(UNBOUNDED);

    private Json() {
        // Prevent instantiation
    }

    /// Parses JSON text with the default nesting limit.
    /// @param text the JSON document
    /// @return the parsed value
    /// @throws NullPointerException if text is null
    /// @throws JsonParseException if the text is not a single well-formed JSON value
    /// @throws JsonDepthExceededException if nesting exceeds the default limit
    public static JsonValue parse(String text) {
        return parse(text, NormalizationPolicy.DEFAULT_MAX_DEPTH);
    }

    /// Parses JSON text, allowing at most `maxDepth` levels of nested arrays and objects.
    /// @param text the JSON document
    /// @param maxDepth the nesting limit, positive
    /// @return the parsed value
    /// @throws JsonParseException if the text is not a single well-formed JSON value
    /// @throws JsonDepthExceededException if nesting exceeds `maxDepth`
    public static JsonValue parse(String text, int maxDepth) {
        Objects.requireNonNull(text, "text must not be null");
        final JsonFactory factory = factoryFor(maxDepth);
        try (JsonParser parser = factory.createParser(text)) {
            final JsonToken first = parser.nextToken();
            if (first == null) {
                throw new JsonParseException("No JSON value in input", 1, 1, 0L, null);
            }
            final JsonValue root = readValue(parser, first, maxDepth);
            final JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw positioned("Unexpected content after root value: " + trailing, parser.currentLocation(), null);
            }
            return root;
        } catch (JsonProcessingException ex) {
            throw positioned(ex.getOriginalMessage(), ex.getLocation(), ex);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new JsonParseException("Unrepresentable number: " + ex.getMessage(), -1, -1, -1L, ex);
        } catch (IOException ex) {
            // reading from a String only fails for malformed content
            throw new JsonParseException(ex.getMessage(), -1, -1, -1L, ex);
        }
    }

    /// {@return compact JSON text for `value`, object members in insertion order}
    /// Never fails on deep trees; this is what `toString()` of every value uses.
    public static String render(JsonValue value) {
        return write(value, null, false, UNBOUNDED);
    }

    /// {@return indented JSON text for `value`, suitable for logs and error messages}
    public static String toDisplayString(JsonValue value) {
        return write(value, null, true, UNBOUNDED);
    }

    /// Renders with object members sorted by `keyOrder` when it is non-null.
    static String write(JsonValue value, Comparator<String> keyOrder, boolean pretty, int maxDepth) {
        Objects.requireNonNull(value, "value must not be null");
        final StringWriter out = new StringWriter();
        try (JsonGenerator gen = factoryFor(maxDepth).createGenerator(out)) {
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            writeValue(gen, value, keyOrder, maxDepth);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toString();
    }

    /// An array or object whose closing token has not been read yet.
    private static final class OpenContainer {
        final Map<String, JsonValue> members;
        final List<JsonValue> elements;
        String pendingName;

        OpenContainer(boolean object) {
            this.members = object ? new LinkedHashMap<>() : null;
            this.elements = object ? null : new ArrayList<>();
        }

        void add(JsonValue value) {
            if (members != null) {
                members.remove(pendingName); // a repeated name moves to its last position
                members.put(pendingName, value);
            } else {
                elements.add(value);
            }
        }

        JsonValue close() {
            return members != null ? new JsonObject(members) : new JsonArray(elements);
        }
    }

    /// Reads one complete value starting at `first`. Open containers are kept
    /// on an explicit stack, so nesting costs heap rather than call stack.
    private static JsonValue readValue(JsonParser parser, JsonToken first, int maxDepth) throws IOException {
        final Deque<OpenContainer> open = new ArrayDeque<>();
        JsonToken token = first;
        while (true) {
            final JsonValue completed;
            switch (token) {
                case START_OBJECT:
                case START_ARRAY:
                    if (open.size() >= maxDepth) {
                        final JsonLocation loc = parser.currentLocation();
                        LOG.fine(() -> "Nesting limit " + maxDepth + " exceeded at line " + loc.getLineNr());
                        throw new JsonDepthExceededException(maxDepth, loc.getLineNr(), loc.getColumnNr(),
                                loc.getCharOffset(), null);
                    }
                    open.push(new OpenContainer(token == JsonToken.START_OBJECT));
                    token = next(parser);
                    continue;
                case FIELD_NAME:
                    open.element().pendingName = parser.currentName();
                    token = next(parser);
                    continue;
                case END_OBJECT:
                case END_ARRAY:
                    completed = open.pop().close();
                    break;
                case VALUE_STRING:
                    completed = JsonString.of(parser.getText());
                    break;
                case VALUE_NUMBER_INT:
                case VALUE_NUMBER_FLOAT:
                    completed = JsonNumber.of(parser.getDecimalValue());
                    break;
                case VALUE_TRUE:
                    completed = JsonBoolean.of(true);
                    break;
                case VALUE_FALSE:
                    completed = JsonBoolean.of(false);
                    break;
                case VALUE_NULL:
                    completed = JsonNull.of();
                    break;
                default:
                    throw positioned("Unexpected token " + token, parser.currentLocation(), null);
            }
            if (open.isEmpty()) {
                return completed;
            }
            open.element().add(completed);
            token = next(parser);
        }
    }

    private static JsonToken next(JsonParser parser) throws IOException {
        final JsonToken token = parser.nextToken();
        if (token == null) {
            throw positioned("Unexpected end of input", parser.currentLocation(), null);
        }
        return token;
    }

    /// One unit of rendering work: write `value` (after `name`, inside an
    /// object), or close the container opened at this position when `value` is null.
    private static final class WriteStep {
        final String name;
        final JsonValue value;
        final boolean closesObject;
        final int depth;

        WriteStep(String name, JsonValue value, boolean closesObject, int depth) {
            this.name = name;
            this.value = value;
            this.closesObject = closesObject;
            this.depth = depth;
        }
    }

    private static void writeValue(JsonGenerator gen, JsonValue root, Comparator<String> keyOrder,
                                   int maxDepth) throws IOException {
        final Deque<WriteStep> steps = new ArrayDeque<>();
        steps.push(new WriteStep(null, root, false, 0));
        while (!steps.isEmpty()) {
            final WriteStep step = steps.pop();
            if (step.value == null) {
                if (step.closesObject) {
                    gen.writeEndObject();
                } else {
                    gen.writeEndArray();
                }
                continue;
            }
            if (step.name != null) {
                gen.writeFieldName(step.name);
            }
            final JsonValue value = step.value;
            switch (value.kind()) {
                case NULL:
                    gen.writeNull();
                    break;
                case BOOLEAN:
                    gen.writeBoolean(((JsonBoolean) value).value());
                    break;
                case NUMBER:
                    gen.writeNumber(((JsonNumber) value).canonicalText());
                    break;
                case STRING:
                    gen.writeString(((JsonString) value).value());
                    break;
                case ARRAY: {
                    checkWriteDepth(step.depth, maxDepth);
                    final List<JsonValue> elements = ((JsonArray) value).elements();
                    gen.writeStartArray();
                    steps.push(new WriteStep(null, null, false, step.depth));
                    for (int i = elements.size() - 1; i >= 0; i--) {
                        steps.push(new WriteStep(null, elements.get(i), false, step.depth + 1));
                    }
                    break;
                }
                case OBJECT: {
                    checkWriteDepth(step.depth, maxDepth);
                    final Map<String, JsonValue> members = ((JsonObject) value).members();
                    final List<String> names = new ArrayList<>(members.keySet());
                    if (keyOrder != null) {
                        names.sort(keyOrder);
                    }
                    gen.writeStartObject();
                    steps.push(new WriteStep(null, null, true, step.depth));
                    for (int i = names.size() - 1; i >= 0; i--) {
                        final String name = names.get(i);
                        steps.push(new WriteStep(name, members.get(name), false, step.depth + 1));
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown JSON kind: " + value.kind());
            }
        }
    }

    private static void checkWriteDepth(int depth, int maxDepth) {
        if (depth >= maxDepth) {
            throw new JsonDepthExceededException(maxDepth);
        }
    }

    private static JsonParseException positioned(String message, JsonLocation loc, Throwable cause) {
        if (loc == null) {
            return new JsonParseException(message, -1, -1, -1L, cause);
        }
        return new JsonParseException(message, loc.getLineNr(), loc.getColumnNr(), loc.getCharOffset(), cause);
    }

    private static JsonFactory factoryFor(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxDepth == NormalizationPolicy.DEFAULT_MAX_DEPTH) {
            return DEFAULT_FACTORY;
        }
        return maxDepth == UNBOUNDED ? UNBOUNDED_FACTORY : newFactory(maxDepth);
    }

    private static JsonFactory newFactory(int maxDepth) {
        final int jacksonDepth = maxDepth == Integer.MAX_VALUE ? maxDepth : maxDepth + 1;
        return new JsonFactoryBuilder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(jacksonDepth).build())
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(jacksonDepth).build())
                .build();
    }
}
