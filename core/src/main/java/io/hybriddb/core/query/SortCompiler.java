// file: core/src/main/java/io/hybriddb/core/query/SortCompiler.java
package io.hybriddb.core.query;

import io.hybriddb.core.Document;
import io.hybriddb.core.ValidationException;
import io.hybriddb.core.Values;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Compiles a sort specification into a document comparator.
 * <p>
 * Accepted shapes:
 *  - "field"                          single ascending key
 *  - ["a", "b"]                       ascending keys
 *  - [["a", "desc"], ["b", "asc"]]    explicit directions ("asc"/"desc" or 1/-1)
 *  - {"a": 1, "b": -1}                ordered map of directions
 * <p>
 * Values compare with {@link Values#compare}: missing/null lowest, then numbers,
 * strings, maps, arrays, booleans. The comparator is meant for {@code List.sort},
 * which is stable, so ties keep input order.
 */
public final class SortCompiler {

    /** One sort key. */
    public record SortKey(String field, boolean descending) {}

    private SortCompiler() {}

    public static Comparator<Document> compile(Object spec) {
        List<SortKey> keys = keys(spec);
        if (keys.isEmpty()) return (a, b) -> 0;
        return (a, b) -> {
            for (SortKey k : keys) {
                int c = Integer.signum(Values.compare(a.get(k.field()), b.get(k.field())));
                if (c != 0) return k.descending() ? -c : c;
            }
            return 0;
        };
    }

    public static List<SortKey> keys(Object spec) {
        List<SortKey> out = new ArrayList<>();
        if (spec == null) return out;
        if (spec instanceof String field) {
            out.add(new SortKey(field, false));
        } else if (spec instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.add(new SortKey(String.valueOf(e.getKey()), isDescending(e.getValue())));
            }
        } else if (spec instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String field) {
                    out.add(new SortKey(field, false));
                } else if (item instanceof List<?> pair && !pair.isEmpty() && pair.get(0) instanceof String field) {
                    out.add(new SortKey(field, pair.size() > 1 && isDescending(pair.get(1))));
                } else {
                    throw new ValidationException("invalid sort entry: " + item);
                }
            }
        } else {
            throw new ValidationException("invalid sort specification: " + spec);
        }
        return out;
    }

    private static boolean isDescending(Object direction) {
        if (direction instanceof Number n) return n.doubleValue() < 0;
        if (direction instanceof String s) {
            return switch (s.toLowerCase()) {
                case "desc", "descending" -> true;
                case "asc", "ascending" -> false;
                default -> throw new ValidationException("invalid sort direction: " + s);
            };
        }
        if (direction == null) return false;
        throw new ValidationException("invalid sort direction: " + direction);
    }
}
