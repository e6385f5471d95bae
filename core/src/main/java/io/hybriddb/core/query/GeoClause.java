// file: core/src/main/java/io/hybriddb/core/query/GeoClause.java
package io.hybriddb.core.query;

import java.util.Map;

/**
 * Spatial part of a selector, applied by {@link QueryProcessor} after the
 * boolean predicate because it can reorder results.
 */
public sealed interface GeoClause {

    /** Dotted path of the document field holding the geometry. */
    String field();

    /** GeoJSON geometry given under {@code $geometry}. */
    Map<String, Object> geometry();

    /** {@code {field: {$near: {$geometry: ..., $maxDistance: m}}}}; maxDistance may be null. */
    record Near(String field, Map<String, Object> geometry, Double maxDistance) implements GeoClause {}

    /** {@code {field: {$geoIntersects: {$geometry: ...}}}}. */
    record Intersects(String field, Map<String, Object> geometry) implements GeoClause {}
}
