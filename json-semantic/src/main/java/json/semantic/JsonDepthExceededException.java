package json.semantic;

/// Thrown when a document nests arrays and objects deeper than the configured limit.
///
/// Extends {@link JsonParseException} so callers that only care about "bad
/// input" can catch one type, while callers that want to tell pathological
/// nesting apart from malformed text still can.
public class JsonDepthExceededException extends JsonParseException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    public JsonDepthExceededException(int maxDepth) {
        super("JSON nesting too deep: exceeds maximum depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public JsonDepthExceededException(int maxDepth, int line, int column, long offset, Throwable cause) {
        super("JSON nesting too deep: exceeds maximum depth of " + maxDepth, line, column, offset, cause);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
