package json.semantic;

/// Exception thrown when JSON text cannot be parsed into a {@link JsonValue}.
///
/// Carries the position of the failure where the parser could report one:
/// 1-based `line` and `column`, 0-based character `offset`. Unknown positions
/// are `-1`.
public class JsonParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final long offset;

    /// Creates a parse exception with no known position.
    /// @param message the error message
    public JsonParseException(String message) {
        this(message, -1, -1, -1L, null);
    }

    /// Creates a parse exception at the given position.
    /// @param message the error message
    /// @param line 1-based line, or -1
    /// @param column 1-based column, or -1
    /// @param offset 0-based character offset, or -1
    /// @param cause the underlying cause, may be null
    public JsonParseException(String message, int line, int column, long offset, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public long offset() {
        return offset;
    }

    /// {@return true if the parser reported where the failure happened}
    public boolean hasPosition() {
        return line > 0;
    }
}
