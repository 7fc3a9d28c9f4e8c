package json.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Order rules for arrays during semantic comparison.
///
/// An array is keyed when every element is an object with a scalar member
/// named `"key"`. Keyed arrays behave as maps serialized in an arbitrary order,
/// so two keyed arrays are equal when they hold the same multiset of elements.
/// Elements sharing a `"key"` value but differing elsewhere are distinct
/// members of the multiset; nothing is merged.
///
/// Every other pair of arrays, including a keyed array against an unkeyed
/// one, is compared position by position. Equal elements are either both
/// keyed-shaped or both not, so a keyed array can never equal an unkeyed one
/// of the same length unless they agree position by position.
public final class KeyedArrays {

    private static final Logger LOG = Logger.getLogger(KeyedArrays.class.getName());

    /// The member name that marks an array element as keyed.
    public static final String KEY_FIELD = "key";

    private KeyedArrays() {
        // Prevent instantiation
    }

    /// {@return true if `array` is non-empty and every element is an object with a scalar `"key"` member}
    public static boolean isKeyed(JsonArray array) {
        if (array.isEmpty()) {
            return false;
        }
        for (JsonValue element : array.elements()) {
            if (keyOf(element).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /// Arranges the equivalence-class ids of `array`'s elements for comparison.
    ///
    /// Two arrays compare equal exactly when their arrangements are equal:
    /// a keyed array yields its ids sorted, which is a multiset fingerprint;
    /// any other array yields them in element order.
    /// @param elementIds one id per element, equal ids for semantically equal elements
    static List<Integer> comparisonOrder(JsonArray array, int[] elementIds) {
        if (elementIds.length != array.size()) {
            throw new IllegalArgumentException("Expected " + array.size() + " element ids, got " + elementIds.length);
        }
        final List<Integer> ids = new ArrayList<>(elementIds.length);
        for (int id : elementIds) {
            ids.add(id);
        }
        if (isKeyed(array)) {
            LOG.finer(() -> "Comparing keyed array of " + array.size() + " elements as a multiset");
            ids.sort(null);
        }
        return ids;
    }

    private static Optional<JsonValue> keyOf(JsonValue element) {
        if (!(element instanceof JsonObject obj)) {
            return Optional.empty();
        }
        return obj.get(KEY_FIELD).filter(key -> key.kind().isScalar());
    }
}
