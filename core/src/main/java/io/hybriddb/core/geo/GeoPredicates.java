// file: core/src/main/java/io/hybriddb/core/geo/GeoPredicates.java
package io.hybriddb.core.geo;

import io.hybriddb.core.UnsupportedGeometryException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Point;

/**
 * Spatial functions consumed by the query processor.
 * <p>
 * Responsibilities:
 *  - great-circle distance from a point to a point or to a line,
 *  - point-in-polygon, polygon intersection and line crossing tests,
 *  - dispatch of "does this stored geometry intersect the query polygon"
 *    on the stored geometry's type.
 * <p>
 * Arguments are GeoJSON maps; they are converted through {@link GeoJson}.
 */
public final class GeoPredicates {
    /** Earth radius used by the haversine formula, in meters. */
    static final double EARTH_RADIUS_M = 6_370_986d;

    private GeoPredicates() {}

    /**
     * Distance in meters from {@code from} (a Point) to {@code to} (a Point or
     * LineString). For a line this is the distance to its nearest point.
     * An empty line yields NaN.
     */
    public static double distanceMeters(Object from, Object to) {
        Geometry origin = GeoJson.toGeometry(from);
        if (!(origin instanceof Point p)) {
            throw new UnsupportedGeometryException("distance origin must be a Point, got " + origin.getGeometryType());
        }
        Geometry target = GeoJson.toGeometry(to);
        if (target instanceof Point q) {
            return haversine(p.getY(), p.getX(), q.getY(), q.getX());
        }
        if (target instanceof LineString line) {
            return distanceToLine(p.getCoordinate(), line);
        }
        throw new UnsupportedGeometryException("cannot measure distance to " + target.getGeometryType());
    }

    /** Boundary points count as inside. */
    public static boolean pointInPolygon(Object point, Object polygon) {
        return GeoJson.toGeometry(polygon).covers(GeoJson.toGeometry(point));
    }

    public static boolean polygonsIntersect(Object a, Object b) {
        return GeoJson.toGeometry(a).intersects(GeoJson.toGeometry(b));
    }

    public static boolean lineCrossesOrWithin(Object line, Object polygon) {
        return crossesOrWithin(GeoJson.toGeometry(line), GeoJson.toGeometry(polygon));
    }

    /**
     * Does the stored geometry {@code target} intersect {@code polygon}?
     * Unknown or absent target types never match.
     */
    public static boolean intersectsPolygon(Object target, Object polygon) {
        String type = GeoJson.typeOf(target);
        if (type == null) return false;
        Geometry area = GeoJson.toGeometry(polygon);
        return switch (type) {
            case "Point" -> area.covers(GeoJson.toGeometry(target));
            case "Polygon", "MultiPolygon" -> area.intersects(GeoJson.toGeometry(target));
            case "LineString" -> {
                Geometry line = GeoJson.toGeometry(target);
                yield !line.isEmpty() && crossesOrWithin(line, area);
            }
            case "MultiLineString" -> {
                MultiLineString lines = (MultiLineString) GeoJson.toGeometry(target);
                for (int i = 0; i < lines.getNumGeometries(); i++) {
                    Geometry part = lines.getGeometryN(i);
                    if (part.isEmpty()) continue;
                    if (crossesOrWithin(part, area)) yield true;
                }
                yield false;
            }
            default -> false;
        };
    }

    // ---------- helpers ----------

    private static boolean crossesOrWithin(Geometry line, Geometry area) {
        return line.crosses(area) || line.within(area);
    }

    static double haversine(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_M * c;
    }

    /**
     * Nearest point on each segment is found in a local equirectangular
     * projection around the origin, then measured with haversine.
     */
    private static double distanceToLine(Coordinate origin, LineString line) {
        Coordinate[] pts = line.getCoordinates();
        if (pts.length == 0) return Double.NaN;
        if (pts.length == 1) return haversine(origin.y, origin.x, pts[0].y, pts[0].x);

        double k = Math.cos(Math.toRadians(origin.y));
        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i + 1 < pts.length; i++) {
            Coordinate a = pts[i];
            Coordinate b = pts[i + 1];
            double ax = a.x * k, ay = a.y, bx = b.x * k, by = b.y;
            double px = origin.x * k, py = origin.y;
            double dx = bx - ax, dy = by - ay;
            double len2 = dx * dx + dy * dy;
            double t = len2 == 0 ? 0 : ((px - ax) * dx + (py - ay) * dy) / len2;
            t = Math.max(0, Math.min(1, t));
            double lat = a.y + t * (b.y - a.y);
            double lng = a.x + t * (b.x - a.x);
            best = Math.min(best, haversine(origin.y, origin.x, lat, lng));
        }
        return best;
    }
}
