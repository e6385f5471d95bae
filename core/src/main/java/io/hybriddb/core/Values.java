// file: core/src/main/java/io/hybriddb/core/Values.java
package io.hybriddb.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Value semantics shared by documents, selectors and sorts.
 * <p>
 * Values are the JSON shapes Jackson produces: null, Boolean, Number, String,
 * Map (string keys) and List. Numbers of different Java types compare by
 * numeric value, so 1, 1L and 1.0 are equal everywhere in the engine.
 */
public final class Values {

    private Values() {}

    /** Result of resolving a dotted path; {@code values} fans out over sequences. */
    public record PathValues(boolean exists, List<Object> values) {
        static final PathValues MISSING = new PathValues(false, List.of());
    }

    // ---------- equality ----------

    /** Structural equality with numeric normalization and order-insensitive maps. */
    public static boolean deepEquals(Object a, Object b) {
        a = unwrap(a);
        b = unwrap(b);
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Number x && b instanceof Number y) return compareNumbers(x, y) == 0;
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (x.size() != y.size()) return false;
            for (Map.Entry<?, ?> e : x.entrySet()) {
                if (!y.containsKey(e.getKey())) return false;
                if (!deepEquals(e.getValue(), y.get(e.getKey()))) return false;
            }
            return true;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) return false;
            Iterator<?> i = x.iterator();
            Iterator<?> j = y.iterator();
            while (i.hasNext()) {
                if (!deepEquals(i.next(), j.next())) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /** Hash consistent with {@link #deepEquals(Object, Object)}. */
    public static int deepHash(Object v) {
        v = unwrap(v);
        if (v == null) return 0;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return d == 0.0 ? 0 : Double.hashCode(d);
        }
        if (v instanceof Map<?, ?> m) {
            int h = 0;
            for (Map.Entry<?, ?> e : m.entrySet()) {
                h += Objects.hashCode(e.getKey()) ^ deepHash(e.getValue());
            }
            return h;
        }
        if (v instanceof List<?> l) {
            int h = 1;
            for (Object o : l) h = 31 * h + deepHash(o);
            return h;
        }
        return v.hashCode();
    }

    // ---------- ordering ----------

    /**
     * Cross-type rank used for sorting:
     * missing/null < number < string < map < list < boolean < anything else.
     */
    public static int typeRank(Object v) {
        v = unwrap(v);
        if (v == null) return 0;
        if (v instanceof Number) return 1;
        if (v instanceof CharSequence) return 2;
        if (v instanceof Map<?, ?>) return 3;
        if (v instanceof List<?>) return 4;
        if (v instanceof Boolean) return 5;
        return 6;
    }

    /** Total order over values: type rank first, then within-type comparison. Returns -1, 0 or 1. */
    public static int compare(Object a, Object b) {
        a = unwrap(a);
        b = unwrap(b);
        int ra = typeRank(a);
        int rb = typeRank(b);
        if (ra != rb) return Integer.compare(ra, rb);
        return Integer.signum(switch (ra) {
            case 0 -> 0;
            case 1 -> compareNumbers((Number) a, (Number) b);
            case 2 -> a.toString().compareTo(b.toString());
            case 3 -> compareMaps((Map<?, ?>) a, (Map<?, ?>) b);
            case 4 -> compareLists((List<?>) a, (List<?>) b);
            case 5 -> Boolean.compare((Boolean) a, (Boolean) b);
            default -> a.toString().compareTo(b.toString());
        });
    }

    /**
     * Ordering restricted to a single comparable class (number/number,
     * string/string, boolean/boolean). Returns null when the values are not
     * comparable, which selectors treat as "no match".
     */
    public static Integer compareSameClass(Object a, Object b) {
        a = unwrap(a);
        b = unwrap(b);
        if (a instanceof Number x && b instanceof Number y) return compareNumbers(x, y);
        if (a instanceof CharSequence x && b instanceof CharSequence y) return Integer.signum(x.toString().compareTo(y.toString()));
        if (a instanceof Boolean x && b instanceof Boolean y) return Boolean.compare(x, y);
        return null;
    }

    public static int compareNumbers(Number a, Number b) {
        if (isSpecialFloating(a) || isSpecialFloating(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    // ---------- paths ----------

    /**
     * Resolve a dotted path. Sequences encountered on the way fan out over
     * their elements unless the segment is a numeric index.
     */
    public static PathValues resolve(Object root, String path) {
        if (path == null || path.isEmpty()) return PathValues.MISSING;
        List<Object> out = new ArrayList<>();
        collect(unwrap(root), path.split("\\."), 0, out);
        return out.isEmpty() ? PathValues.MISSING : new PathValues(true, out);
    }

    /** Plain dotted lookup without fan-out; null when any segment is missing. */
    public static Object getPath(Object root, String path) {
        Object cur = unwrap(root);
        for (String seg : path.split("\\.")) {
            if (cur instanceof Map<?, ?> m) {
                cur = m.get(seg);
            } else if (cur instanceof List<?> l && isIndex(seg) && Integer.parseInt(seg) < l.size()) {
                cur = l.get(Integer.parseInt(seg));
            } else {
                return null;
            }
        }
        return cur;
    }

    // ---------- copies ----------

    /** Deep, mutable copy (LinkedHashMap / ArrayList). */
    public static Object deepCopy(Object v) {
        v = unwrap(v);
        if (v instanceof Map<?, ?> m) return copyMap(m);
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(deepCopy(o));
            return out;
        }
        return v;
    }

    /** Deep, unmodifiable copy. Nested documents are flattened to their maps. */
    public static Object freeze(Object v) {
        v = unwrap(v);
        if (v instanceof Map<?, ?> m) return freezeMap(m);
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(freeze(o));
            return Collections.unmodifiableList(out);
        }
        if (v instanceof Object[] arr) {
            return freeze(java.util.Arrays.asList(arr));
        }
        return v;
    }

    /** Deep, mutable copy of a map; keys become strings. */
    public static Map<String, Object> copyMap(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>(m.size() * 2);
        for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
        return out;
    }

    /** Deep, unmodifiable copy of a map; keys become strings. */
    public static Map<String, Object> freezeMap(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>(m.size() * 2);
        for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        return Collections.unmodifiableMap(out);
    }

    // ---------- helpers ----------

    private static Object unwrap(Object v) {
        return v instanceof Document d ? d.asMap() : v;
    }

    private static void collect(Object current, String[] segments, int idx, List<Object> out) {
        if (idx == segments.length) {
            out.add(current);
            return;
        }
        String seg = segments[idx];
        if (current instanceof Map<?, ?> map) {
            if (!map.containsKey(seg)) return;
            collect(map.get(seg), segments, idx + 1, out);
        } else if (current instanceof List<?> list) {
            if (isIndex(seg)) {
                int i = Integer.parseInt(seg);
                if (i < list.size()) collect(list.get(i), segments, idx + 1, out);
                return;
            }
            for (Object item : list) collect(item, segments, idx, out);
        }
    }

    private static boolean isIndex(String seg) {
        if (seg.isEmpty() || seg.length() > 9) return false;
        for (int i = 0; i < seg.length(); i++) {
            if (!Character.isDigit(seg.charAt(i))) return false;
        }
        return true;
    }

    private static int compareMaps(Map<?, ?> a, Map<?, ?> b) {
        TreeSet<String> keys = new TreeSet<>();
        for (Object k : a.keySet()) keys.add(String.valueOf(k));
        for (Object k : b.keySet()) keys.add(String.valueOf(k));
        for (String k : keys) {
            boolean inA = a.containsKey(k);
            boolean inB = b.containsKey(k);
            if (inA != inB) return inA ? 1 : -1;
            int c = compare(a.get(k), b.get(k));
            if (c != 0) return c;
        }
        return 0;
    }

    private static int compareLists(List<?> a, List<?> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static boolean isSpecialFloating(Number n) {
        if (n instanceof Double d) return d.isNaN() || d.isInfinite();
        if (n instanceof Float f) return f.isNaN() || f.isInfinite();
        return false;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return BigDecimal.valueOf(n.longValue());
    }
}
