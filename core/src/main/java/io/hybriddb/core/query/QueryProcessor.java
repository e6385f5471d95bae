// file: core/src/main/java/io/hybriddb/core/query/QueryProcessor.java
package io.hybriddb.core.query;

import io.hybriddb.core.Document;
import io.hybriddb.core.geo.GeoJson;
import io.hybriddb.core.geo.GeoPredicates;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * In-memory query pipeline.
 * <p>
 * Stages, in order:
 *  1) compiled selector predicate,
 *  2) $near: keep Point/LineString fields, order by distance, apply $maxDistance,
 *  3) $geoIntersects against a query Polygon,
 *  4) options.sort (skipped when $near already ordered the results),
 *  5) skip,
 *  6) limit,
 *  7) field projection.
 */
public final class QueryProcessor {

    private QueryProcessor() {}

    public static List<Document> process(Collection<Document> docs, Map<String, ?> selector, FindOptions options) {
        FindOptions opts = FindOptions.orNone(options);
        CompiledSelector compiled = SelectorCompiler.compile(selector);

        List<Document> list = new ArrayList<>();
        for (Document d : docs) {
            if (compiled.test(d)) list.add(d);
        }

        boolean nearSorted = false;
        for (GeoClause clause : compiled.geoClauses()) {
            if (!(clause instanceof GeoClause.Near near)) continue;
            if (!"Point".equals(GeoJson.typeOf(near.geometry()))) break;
            list = applyNear(list, near);
            nearSorted = true;
        }
        for (GeoClause clause : compiled.geoClauses()) {
            if (!(clause instanceof GeoClause.Intersects intersects)) continue;
            if (!"Polygon".equals(GeoJson.typeOf(intersects.geometry()))) break;
            list = applyIntersects(list, intersects);
        }

        if (opts.sort() != null && !nearSorted) {
            list.sort(SortCompiler.compile(opts.sort()));
        }
        if (opts.hasSkip()) {
            list = new ArrayList<>(list.subList(Math.min(opts.skip(), list.size()), list.size()));
        }
        if (opts.hasLimit() && list.size() > opts.limit()) {
            list = new ArrayList<>(list.subList(0, opts.limit()));
        }
        return Projection.apply(list, opts.fields());
    }

    // ---------- geo stages ----------

    private record Ranked(Document doc, double distance) {}

    private static List<Document> applyNear(List<Document> docs, GeoClause.Near near) {
        List<Ranked> ranked = new ArrayList<>(docs.size());
        for (Document d : docs) {
            Object target = d.get(near.field());
            String type = GeoJson.typeOf(target);
            if (!"Point".equals(type) && !"LineString".equals(type)) continue;
            double distance = GeoPredicates.distanceMeters(near.geometry(), target);
            // NaN fails this comparison too
            if (!(distance >= 0)) continue;
            if (near.maxDistance() != null && distance > near.maxDistance()) continue;
            ranked.add(new Ranked(d, distance));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::distance));
        List<Document> out = new ArrayList<>(ranked.size());
        for (Ranked r : ranked) out.add(r.doc());
        return out;
    }

    private static List<Document> applyIntersects(List<Document> docs, GeoClause.Intersects clause) {
        List<Document> out = new ArrayList<>();
        for (Document d : docs) {
            if (GeoPredicates.intersectsPolygon(d.get(clause.field()), clause.geometry())) out.add(d);
        }
        return out;
    }
}
