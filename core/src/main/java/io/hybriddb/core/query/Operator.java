// file: core/src/main/java/io/hybriddb/core/query/Operator.java
package io.hybriddb.core.query;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of field-level selector operators.
 * <p>
 * Anything that starts with '$' and is not listed here resolves to
 * {@link #UNSUPPORTED}, which compiles to a predicate that never matches.
 */
public enum Operator {
    EQ("$eq"),
    NE("$ne"),
    GT("$gt"),
    GTE("$gte"),
    LT("$lt"),
    LTE("$lte"),
    IN("$in"),
    NIN("$nin"),
    ALL("$all"),
    ELEM_MATCH("$elemMatch"),
    SIZE("$size"),
    EXISTS("$exists"),
    TYPE("$type"),
    REGEX("$regex"),
    OPTIONS("$options"),
    NOT("$not"),
    MOD("$mod"),
    NEAR("$near"),
    GEO_INTERSECTS("$geoIntersects"),
    UNSUPPORTED(null);

    private static final Map<String, Operator> BY_KEY = new HashMap<>();

    static {
        for (Operator op : values()) {
            if (op.key != null) BY_KEY.put(op.key, op);
        }
    }

    private final String key;

    Operator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isGeo() {
        return this == NEAR || this == GEO_INTERSECTS;
    }

    public static Operator fromKey(String key) {
        return BY_KEY.getOrDefault(key, UNSUPPORTED);
    }
}
