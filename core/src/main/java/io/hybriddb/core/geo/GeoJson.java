// file: core/src/main/java/io/hybriddb/core/geo/GeoJson.java
package io.hybriddb.core.geo;

import io.hybriddb.core.MalformedGeometryException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import java.util.List;
import java.util.Map;

/**
 * GeoJSON (as parsed JSON maps) to JTS geometry.
 * <p>
 * Supported types: Point, LineString, Polygon, MultiLineString, MultiPolygon.
 * Coordinates are [longitude, latitude] in degrees. Any structural problem
 * (missing type, non-numeric coordinate, unclosed ring, ...) raises
 * {@link MalformedGeometryException}.
 */
public final class GeoJson {
    static final GeometryFactory FACTORY = new GeometryFactory();

    private GeoJson() {}

    /** @return the GeoJSON "type" of a geometry-shaped value, or null if it has none. */
    public static String typeOf(Object value) {
        if (value instanceof Map<?, ?> m && m.get("type") instanceof String t) return t;
        return null;
    }

    public static Geometry toGeometry(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new MalformedGeometryException("geometry must be an object, got: " + value);
        }
        String type = typeOf(map);
        if (type == null) throw new MalformedGeometryException("geometry is missing its type");
        Object coords = map.get("coordinates");
        try {
            return switch (type) {
                case "Point" -> FACTORY.createPoint(position(coords));
                case "LineString" -> lineString(coords);
                case "Polygon" -> polygon(coords);
                case "MultiLineString" -> {
                    List<?> parts = list(coords, "MultiLineString");
                    LineString[] lines = new LineString[parts.size()];
                    for (int i = 0; i < lines.length; i++) lines[i] = lineString(parts.get(i));
                    yield FACTORY.createMultiLineString(lines);
                }
                case "MultiPolygon" -> {
                    List<?> parts = list(coords, "MultiPolygon");
                    Polygon[] polys = new Polygon[parts.size()];
                    for (int i = 0; i < polys.length; i++) polys[i] = polygon(parts.get(i));
                    yield FACTORY.createMultiPolygon(polys);
                }
                default -> throw new MalformedGeometryException("unknown geometry type: " + type);
            };
        } catch (IllegalArgumentException e) {
            // JTS rejects unclosed rings and one-point lines this way
            throw new MalformedGeometryException("invalid " + type + ": " + e.getMessage(), e);
        }
    }

    // ---------- helpers ----------

    static LineString lineString(Object coords) {
        return FACTORY.createLineString(positions(coords, "LineString"));
    }

    private static Polygon polygon(Object coords) {
        List<?> rings = list(coords, "Polygon");
        if (rings.isEmpty()) throw new MalformedGeometryException("Polygon needs at least one ring");
        LinearRing shell = FACTORY.createLinearRing(positions(rings.get(0), "Polygon ring"));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = FACTORY.createLinearRing(positions(rings.get(i), "Polygon ring"));
        }
        return FACTORY.createPolygon(shell, holes);
    }

    private static Coordinate[] positions(Object coords, String what) {
        List<?> list = list(coords, what);
        Coordinate[] out = new Coordinate[list.size()];
        for (int i = 0; i < out.length; i++) out[i] = position(list.get(i));
        return out;
    }

    private static Coordinate position(Object coords) {
        List<?> pos = list(coords, "position");
        if (pos.size() < 2 || !(pos.get(0) instanceof Number lon) || !(pos.get(1) instanceof Number lat)) {
            throw new MalformedGeometryException("position must be [lon, lat], got: " + coords);
        }
        return new Coordinate(lon.doubleValue(), lat.doubleValue());
    }

    private static List<?> list(Object coords, String what) {
        if (!(coords instanceof List<?> l)) {
            throw new MalformedGeometryException(what + " coordinates must be an array");
        }
        return l;
    }
}
