package json.semantic;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// A JSON number held at arbitrary precision.
///
/// Equality is numeric rather than textual: `42`, `42.0` and `4.2e1` are the
/// same `JsonNumber`. {@link #canonicalText()} gives the single spelling used
/// for canonical output.
public record JsonNumber(BigDecimal value) implements JsonValue {

    /// Plain notation is used for decimal exponents in `[-6, 21)`.
    private static final int MIN_PLAIN_EXPONENT = -6;
    private static final int MAX_PLAIN_EXPONENT = 21;

    public JsonNumber {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static JsonNumber of(long value) {
        return new JsonNumber(BigDecimal.valueOf(value));
    }

    public static JsonNumber of(BigInteger value) {
        return new JsonNumber(new BigDecimal(value));
    }

    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public static JsonNumber of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
        return new JsonNumber(BigDecimal.valueOf(value));
    }

    public static JsonNumber of(BigDecimal value) {
        return new JsonNumber(value);
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    /// {@return the minimal spelling of this number}
    ///
    /// Trailing zeros are dropped, negative zero becomes `0`, and numbers with
    /// a decimal exponent outside `[-6, 21)` use `d.ddde±x` notation.
    public String canonicalText() {
        if (value.signum() == 0) {
            return "0";
        }
        final BigDecimal stripped = value.stripTrailingZeros();
        final long exponent = (long) stripped.precision() - stripped.scale() - 1;
        if (exponent >= MIN_PLAIN_EXPONENT && exponent < MAX_PLAIN_EXPONENT) {
            return stripped.toPlainString();
        }
        final String digits = stripped.unscaledValue().abs().toString();
        final StringBuilder sb = new StringBuilder(digits.length() + 8);
        if (stripped.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        return sb.toString();
    }

    /// {@return true if `obj` is a `JsonNumber` with the same numeric value}
    @Override
    public boolean equals(Object obj) {
        return obj instanceof JsonNumber other && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return canonicalText();
    }
}
