package json.semantic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/// Tests for parsing and rendering of the value model.
class JsonTest extends JsonSemanticTestBase {

    @Test
    void testParseScalars() {
        assertThat(Json.parse("null")).isEqualTo(JsonNull.of());
        assertThat(Json.parse("true")).isEqualTo(JsonBoolean.of(true));
        assertThat(Json.parse(" false ")).isEqualTo(JsonBoolean.of(false));
        assertThat(Json.parse("\"hi\\u0021\"")).isEqualTo(JsonString.of("hi!"));
        assertThat(Json.parse("-12")).isEqualTo(JsonNumber.of(-12));
    }

    @Test
    void testParseNestedStructure() {
        final JsonValue value = Json.parse("""
            {
              "name": "Fetch Orders",
              "position": [460, 300],
              "parameters": {"url": "https://example.com"}
            }
            """);

        assertThat(value.kind()).isEqualTo(JsonValue.Kind.OBJECT);
        final JsonObject obj = (JsonObject) value;
        assertThat(obj.members().keySet()).containsExactly("name", "position", "parameters");
        assertThat(obj.get("position")).contains(JsonArray.of(JsonNumber.of(460), JsonNumber.of(300)));
        assertThat(obj.get("missing")).isEmpty();
    }

    @Test
    void testNumbersCompareByValue() {
        assertThat(Json.parse("42")).isEqualTo(Json.parse("42.0"));
        assertThat(Json.parse("42")).isEqualTo(Json.parse("4.2e1"));
        assertThat(Json.parse("42").hashCode()).isEqualTo(Json.parse("42.000").hashCode());
        assertThat(Json.parse("0")).isEqualTo(Json.parse("-0.0"));
    }

    @Test
    void testLargeIntegersKeepFullPrecision() {
        final JsonValue twoTo53 = Json.parse("9007199254740992");
        final JsonValue twoTo53PlusOne = Json.parse("9007199254740993");

        assertThat(twoTo53).isNotEqualTo(twoTo53PlusOne);
        assertThat(((JsonNumber) twoTo53PlusOne).value()).isEqualTo(new BigDecimal("9007199254740993"));
    }

    @Test
    void testDuplicateNameKeepsLastValue() {
        final JsonObject obj = (JsonObject) Json.parse("{\"a\":1,\"b\":2,\"a\":3}");

        assertThat(obj.members()).containsExactly(
                Map.entry("b", JsonNumber.of(2)),
                Map.entry("a", JsonNumber.of(3)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{bad}",
            "{position:[100,200]}",
            "{'a': 1}",
            "[1, 2,]",
            "{\"a\": 1",
            "[1] [2]",
            "[1] x",
            "// comment\n{}",
            "NaN"
    })
    void testMalformedInputIsRejected(String text) {
        assertThatThrownBy(() -> Json.parse(text))
                .isInstanceOf(JsonParseException.class)
                .isNotInstanceOf(JsonDepthExceededException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t"})
    void testEmptyInputIsRejected(String text) {
        assertThatThrownBy(() -> Json.parse(text))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("No JSON value");
    }

    @Test
    void testParseErrorReportsPosition() {
        final JsonParseException ex = catchThrowableOfType(
                () -> Json.parse("{\n  \"a\": tru\n}"), JsonParseException.class);

        assertThat(ex.hasPosition()).isTrue();
        assertThat(ex.line()).isEqualTo(2);
        assertThat(ex.column()).isPositive();
        assertThat(ex.offset()).isPositive();
    }

    @Test
    void testNestingAtLimitIsAccepted() {
        final String text = "[".repeat(5) + "]".repeat(5);

        assertThat(Json.parse(text, 5)).isInstanceOf(JsonArray.class);
    }

    @Test
    void testNestingBeyondLimitFailsWithDepthError() {
        final String text = "[".repeat(5) + "]".repeat(5);

        assertThatThrownBy(() -> Json.parse(text, 4))
                .isInstanceOf(JsonDepthExceededException.class)
                .satisfies(ex -> assertThat(((JsonDepthExceededException) ex).maxDepth()).isEqualTo(4));
    }

    @Test
    void testDefaultLimitStopsPathologicalNesting() {
        final String ok = "{\"a\":".repeat(999) + "[]" + "}".repeat(999);
        final String tooDeep = "[".repeat(100_000) + "]".repeat(100_000);

        assertThat(Json.parse(ok)).isInstanceOf(JsonObject.class);
        assertThatThrownBy(() -> Json.parse(tooDeep)).isInstanceOf(JsonDepthExceededException.class);
    }

    @Test
    void testToStringOfDeepBuiltValueDoesNotThrow() {
        final int levels = NormalizationPolicy.DEFAULT_MAX_DEPTH * 3;
        JsonValue deep = JsonBoolean.of(true);
        for (int i = 0; i < levels; i++) {
            deep = (i % 2 == 0) ? JsonArray.of(deep) : JsonObject.of(Map.of("k", deep));
        }
        final JsonValue value = deep;

        final String text = value.toString();

        assertThat(text).startsWith("{\"k\":[{\"k\":").contains("true");
        assertThat(Json.parse(text, levels)).isInstanceOf(JsonObject.class);
        assertThatThrownBy(() -> CanonicalJson.render(value)).isInstanceOf(JsonDepthExceededException.class);
    }

    @Test
    void testRenderIsCompactAndKeepsMemberOrder() {
        final JsonValue value = Json.parse("{ \"b\" : [1, 2.50, null], \"a\" : {\"x\": \"y\\n\"} }");

        assertThat(Json.render(value)).isEqualTo("{\"b\":[1,2.5,null],\"a\":{\"x\":\"y\\n\"}}");
        assertThat(value.toString()).isEqualTo(Json.render(value));
    }

    @Test
    void testDisplayStringIsIndentedAndReparsable() {
        final JsonValue value = Json.parse("{\"b\":[1,2],\"a\":{\"x\":true}}");

        final String display = Json.toDisplayString(value);

        assertThat(display).contains("\n");
        assertThat(Json.parse(display)).isEqualTo(value);
    }

    @Test
    void testValuesAreImmutable() {
        final JsonArray array = (JsonArray) Json.parse("[1]");
        final JsonObject obj = (JsonObject) Json.parse("{\"a\":1}");
        final List<JsonValue> elements = array.elements();
        final Map<String, JsonValue> members = obj.members();

        assertThatThrownBy(() -> elements.add(JsonNull.of())).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> members.put("b", JsonNull.of())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testFactoriesRejectNulls() {
        assertThatThrownBy(() -> JsonString.of(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Json.parse(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
