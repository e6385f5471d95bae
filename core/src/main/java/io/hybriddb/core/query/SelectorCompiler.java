// file: core/src/main/java/io/hybriddb/core/query/SelectorCompiler.java
package io.hybriddb.core.query;

import io.hybriddb.core.Document;
import io.hybriddb.core.MalformedGeometryException;
import io.hybriddb.core.ValidationException;
import io.hybriddb.core.Values;
import io.hybriddb.core.Values.PathValues;
import io.hybriddb.core.geo.GeoJson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles a selector (a JSON-shaped query map) into a predicate over documents.
 * <p>
 * Rules:
 *  - {@code {field: scalar}} is implicit equality; for an array field it also
 *    matches any element,
 *  - {@code {field: {$op: ...}}} is an operator document (every key starts with '$'),
 *    any other map is literal structural equality,
 *  - dotted paths descend into maps and fan out over arrays,
 *  - {@code $and}, {@code $or}, {@code $nor} short-circuit left to right,
 *  - unknown operators never match,
 *  - {@code $near}/{@code $geoIntersects} evaluate to true here and are returned
 *    as {@link GeoClause}s for the query processor.
 * <p>
 * All operand validation happens at compile time, so a compiled predicate
 * never throws for well-formed documents.
 */
public final class SelectorCompiler {

    private static final Predicate<Object> NEVER = root -> false;
    private static final Predicate<PathValues> NEVER_PATH = pv -> false;

    private SelectorCompiler() {}

    public static CompiledSelector compile(Map<String, ?> selector) {
        List<GeoClause> geo = new ArrayList<>();
        Predicate<Object> root = compileDocument(selector == null ? Map.of() : selector, geo);
        return new CompiledSelector(doc -> root.test(doc.asMap()), geo);
    }

    /** Shorthand: compile and test a single document. */
    public static boolean matches(Map<String, ?> selector, Document doc) {
        return compile(selector).test(doc);
    }

    // ---------- documents and combinators ----------

    /**
     * @param geo collector for top-level spatial clauses, or null inside
     *            combinators and $elemMatch where spatial stages do not apply
     */
    private static Predicate<Object> compileDocument(Map<String, ?> selector, List<GeoClause> geo) {
        List<Predicate<Object>> parts = new ArrayList<>(selector.size());
        for (Map.Entry<String, ?> e : selector.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (key.startsWith("$")) {
                parts.add(compileTopLevel(key, value));
            } else {
                parts.add(compileField(key, value, geo));
            }
        }
        return allOf(parts);
    }

    private static Predicate<Object> compileTopLevel(String key, Object operand) {
        if (!(operand instanceof List<?> list)) return NEVER;
        List<Predicate<Object>> branches = new ArrayList<>(list.size());
        for (Object branch : list) {
            if (!(branch instanceof Map<?, ?> m)) return NEVER;
            branches.add(compileDocument(stringKeyed(m), null));
        }
        return switch (key) {
            case "$and" -> allOf(branches);
            case "$or" -> root -> {
                for (Predicate<Object> b : branches) if (b.test(root)) return true;
                return false;
            };
            case "$nor" -> root -> {
                for (Predicate<Object> b : branches) if (b.test(root)) return false;
                return true;
            };
            default -> NEVER;
        };
    }

    private static Predicate<Object> compileField(String path, Object expected, List<GeoClause> geo) {
        Predicate<PathValues> p;
        if (expected instanceof Pattern pattern) {
            p = pv -> matchesRegex(pv, pattern);
        } else if (isOperatorDocument(expected)) {
            p = compileOperators(path, stringKeyed((Map<?, ?>) expected), geo);
        } else {
            p = pv -> matchesEq(pv, expected);
        }
        return root -> p.test(Values.resolve(root, path));
    }

    // ---------- operator documents ----------

    private static Predicate<PathValues> compileOperators(String path, Map<String, Object> ops, List<GeoClause> geo) {
        if (ops.containsKey(Operator.OPTIONS.key()) && !ops.containsKey(Operator.REGEX.key())) {
            throw new ValidationException("$options requires $regex");
        }
        List<Predicate<PathValues>> parts = new ArrayList<>(ops.size());
        for (Map.Entry<String, Object> e : ops.entrySet()) {
            Operator op = Operator.fromKey(e.getKey());
            Object operand = e.getValue();
            if (op.isGeo()) {
                GeoClause clause = compileGeo(path, op, operand);
                if (geo != null) geo.add(clause);
                continue;
            }
            parts.add(switch (op) {
                case EQ -> pv -> matchesEq(pv, operand);
                case NE -> pv -> !matchesEq(pv, operand);
                case GT -> pv -> matchesComparison(pv, operand, c -> c > 0);
                case GTE -> pv -> matchesComparison(pv, operand, c -> c >= 0);
                case LT -> pv -> matchesComparison(pv, operand, c -> c < 0);
                case LTE -> pv -> matchesComparison(pv, operand, c -> c <= 0);
                case IN -> {
                    List<?> values = operandList(op, operand);
                    yield pv -> matchesIn(pv, values);
                }
                case NIN -> {
                    List<?> values = operandList(op, operand);
                    yield pv -> !matchesIn(pv, values);
                }
                case ALL -> {
                    List<?> values = operandList(op, operand);
                    yield pv -> matchesAll(pv, values);
                }
                case ELEM_MATCH -> compileElemMatch(operand);
                case SIZE -> {
                    int size = nonNegativeInt(op, operand);
                    yield pv -> anyValue(pv, v -> v instanceof List<?> l && l.size() == size);
                }
                case EXISTS -> {
                    boolean wanted = truthy(operand);
                    yield pv -> pv.exists() == wanted;
                }
                case TYPE -> {
                    Predicate<Object> type = typePredicate(operand);
                    yield pv -> anyValueOrElement(pv, type);
                }
                case REGEX -> {
                    Pattern pattern = compileRegex(operand, ops.get(Operator.OPTIONS.key()));
                    yield pv -> matchesRegex(pv, pattern);
                }
                case OPTIONS -> pv -> true;
                case NOT -> compileNot(path, operand);
                case MOD -> compileMod(operand);
                default -> NEVER_PATH;
            });
        }
        return pv -> {
            for (Predicate<PathValues> p : parts) if (!p.test(pv)) return false;
            return true;
        };
    }

    private static GeoClause compileGeo(String path, Operator op, Object operand) {
        if (!(operand instanceof Map<?, ?> spec) || !(spec.get("$geometry") instanceof Map<?, ?> rawGeometry)) {
            throw new MalformedGeometryException(op.key() + " requires a $geometry object");
        }
        Map<String, Object> geometry = stringKeyed(rawGeometry);
        GeoJson.toGeometry(geometry);
        if (op == Operator.GEO_INTERSECTS) {
            return new GeoClause.Intersects(path, geometry);
        }
        Object max = spec.get("$maxDistance");
        if (max != null && !(max instanceof Number)) {
            throw new ValidationException("$maxDistance must be a number");
        }
        return new GeoClause.Near(path, geometry, max == null ? null : ((Number) max).doubleValue());
    }

    private static Predicate<PathValues> compileElemMatch(Object operand) {
        if (!(operand instanceof Map<?, ?> raw)) throw new ValidationException("$elemMatch requires an object");
        Map<String, Object> criteria = stringKeyed(raw);
        Predicate<Object> element;
        if (isOperatorDocument(criteria)) {
            Predicate<PathValues> ops = compileOperators("", criteria, null);
            element = v -> ops.test(new PathValues(true, Collections.singletonList(v)));
        } else {
            Predicate<Object> doc = compileDocument(criteria, null);
            element = v -> v instanceof Map<?, ?> && doc.test(v);
        }
        return pv -> anyValue(pv, v -> {
            if (!(v instanceof List<?> list)) return false;
            for (Object item : list) if (element.test(item)) return true;
            return false;
        });
    }

    private static Predicate<PathValues> compileNot(String path, Object operand) {
        if (operand instanceof Map<?, ?> m && isOperatorDocument(m)) {
            Predicate<PathValues> inner = compileOperators(path, stringKeyed(m), null);
            return pv -> !inner.test(pv);
        }
        if (operand instanceof Pattern || operand instanceof String) {
            Pattern pattern = compileRegex(operand, null);
            return pv -> !matchesRegex(pv, pattern);
        }
        throw new ValidationException("$not requires an operator object or a regex");
    }

    private static Predicate<PathValues> compileMod(Object operand) {
        if (!(operand instanceof List<?> l) || l.size() != 2
                || !(l.get(0) instanceof Number d) || !(l.get(1) instanceof Number r)) {
            throw new ValidationException("$mod requires [divisor, remainder]");
        }
        long divisor = d.longValue();
        long remainder = r.longValue();
        if (divisor == 0) throw new ValidationException("$mod divisor must not be zero");
        return pv -> anyValueOrElement(pv, v -> v instanceof Number n && n.longValue() % divisor == remainder);
    }

    // ---------- matching ----------

    private static boolean matchesEq(PathValues pv, Object expected) {
        if (!pv.exists()) return expected == null;
        for (Object actual : pv.values()) {
            if (Values.deepEquals(actual, expected)) return true;
            if (actual instanceof List<?> list && !(expected instanceof List<?>)) {
                for (Object item : list) if (Values.deepEquals(item, expected)) return true;
            }
        }
        return false;
    }

    private static boolean matchesComparison(PathValues pv, Object expected, Predicate<Integer> accept) {
        return anyValueOrElement(pv, v -> {
            Integer c = Values.compareSameClass(v, expected);
            return c != null && accept.test(c);
        });
    }

    private static boolean matchesIn(PathValues pv, List<?> candidates) {
        for (Object c : candidates) {
            if (c instanceof Pattern p) {
                if (matchesRegex(pv, p)) return true;
            } else if (matchesEq(pv, c)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAll(PathValues pv, List<?> required) {
        if (required.isEmpty()) return false;
        return anyValue(pv, v -> {
            if (!(v instanceof List<?> list)) return false;
            for (Object r : required) {
                boolean found = false;
                for (Object item : list) {
                    if (Values.deepEquals(item, r)) {
                        found = true;
                        break;
                    }
                }
                if (!found) return false;
            }
            return true;
        });
    }

    private static boolean matchesRegex(PathValues pv, Pattern pattern) {
        return anyValueOrElement(pv, v -> v instanceof CharSequence s && pattern.matcher(s).find());
    }

    private static boolean anyValue(PathValues pv, Predicate<Object> test) {
        for (Object v : pv.values()) if (test.test(v)) return true;
        return false;
    }

    private static boolean anyValueOrElement(PathValues pv, Predicate<Object> test) {
        for (Object v : pv.values()) {
            if (test.test(v)) return true;
            if (v instanceof List<?> list) {
                for (Object item : list) if (test.test(item)) return true;
            }
        }
        return false;
    }

    // ---------- operand parsing ----------

    private static Predicate<Object> typePredicate(Object operand) {
        if (operand instanceof Number n) {
            return switch (n.intValue()) {
                case 1 -> v -> v instanceof Double || v instanceof Float;
                case 2 -> v -> v instanceof String;
                case 3 -> v -> v instanceof Map<?, ?>;
                case 4 -> v -> v instanceof List<?>;
                case 8 -> v -> v instanceof Boolean;
                case 10 -> v -> v == null;
                case 16 -> v -> v instanceof Integer;
                case 18 -> v -> v instanceof Long;
                default -> throw new ValidationException("unsupported $type code: " + operand);
            };
        }
        if (operand instanceof String alias) {
            return switch (alias.toLowerCase()) {
                case "number" -> v -> v instanceof Number;
                case "double" -> v -> v instanceof Double || v instanceof Float;
                case "int" -> v -> v instanceof Integer;
                case "long" -> v -> v instanceof Long;
                case "string" -> v -> v instanceof String;
                case "object" -> v -> v instanceof Map<?, ?>;
                case "array" -> v -> v instanceof List<?>;
                case "bool", "boolean" -> v -> v instanceof Boolean;
                case "null" -> v -> v == null;
                default -> throw new ValidationException("unsupported $type alias: " + alias);
            };
        }
        throw new ValidationException("$type requires a string alias or numeric code");
    }

    private static Pattern compileRegex(Object raw, Object rawOptions) {
        int flags = 0;
        if (rawOptions != null) {
            if (!(rawOptions instanceof String options)) throw new ValidationException("$options must be a string");
            for (char c : options.toCharArray()) {
                flags |= switch (c) {
                    case 'i' -> Pattern.CASE_INSENSITIVE;
                    case 'm' -> Pattern.MULTILINE;
                    case 's' -> Pattern.DOTALL;
                    case 'x' -> Pattern.COMMENTS;
                    case 'u' -> Pattern.UNICODE_CASE;
                    default -> throw new ValidationException("unsupported regex option: " + c);
                };
            }
        }
        try {
            if (raw instanceof Pattern p) return Pattern.compile(p.pattern(), p.flags() | flags);
            if (raw instanceof String s) return Pattern.compile(s, flags);
        } catch (PatternSyntaxException e) {
            throw new ValidationException("invalid $regex: " + e.getDescription(), e);
        }
        throw new ValidationException("$regex requires a string pattern");
    }

    private static List<?> operandList(Operator op, Object operand) {
        if (!(operand instanceof List<?> l)) throw new ValidationException(op.key() + " requires an array");
        return l;
    }

    private static int nonNegativeInt(Operator op, Object operand) {
        if (!(operand instanceof Number n) || n.doubleValue() < 0 || n.doubleValue() != Math.floor(n.doubleValue())) {
            throw new ValidationException(op.key() + " requires a non-negative integer");
        }
        return n.intValue();
    }

    private static boolean truthy(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0;
        return v != null;
    }

    // ---------- helpers ----------

    private static Predicate<Object> allOf(List<Predicate<Object>> parts) {
        return root -> {
            for (Predicate<Object> p : parts) if (!p.test(root)) return false;
            return true;
        };
    }

    static boolean isOperatorDocument(Object value) {
        if (!(value instanceof Map<?, ?> m) || m.isEmpty()) return false;
        for (Object k : m.keySet()) {
            if (!(k instanceof String s) || !s.startsWith("$")) return false;
        }
        return true;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>(m.size() * 2);
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (!(e.getKey() instanceof String k)) throw new ValidationException("selector keys must be strings");
            out.put(k, e.getValue());
        }
        return out;
    }
}
