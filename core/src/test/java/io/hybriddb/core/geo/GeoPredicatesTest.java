// file: core/src/test/java/io/hybriddb/core/geo/GeoPredicatesTest.java
package io.hybriddb.core.geo;

import io.hybriddb.core.MalformedGeometryException;
import io.hybriddb.core.UnsupportedGeometryException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeoPredicatesTest {

    private static Map<String, Object> point(double lng, double lat) {
        return Map.of("type", "Point", "coordinates", List.of(lng, lat));
    }

    private static Map<String, Object> line(List<List<Double>> coords) {
        return Map.of("type", "LineString", "coordinates", coords);
    }

    private static Map<String, Object> square(double minLng, double minLat, double maxLng, double maxLat) {
        return Map.of("type", "Polygon", "coordinates", List.of(List.of(
                List.of(minLng, minLat), List.of(maxLng, minLat), List.of(maxLng, maxLat),
                List.of(minLng, maxLat), List.of(minLng, minLat))));
    }

    @Test
    void one_degree_of_latitude_is_about_111_km() {
        double d = GeoPredicates.distanceMeters(point(0, 0), point(0, 1));
        assertEquals(111_194, d, 50);
    }

    @Test
    void distance_to_same_point_is_zero() {
        assertEquals(0.0, GeoPredicates.distanceMeters(point(10, 59), point(10, 59)), 1e-9);
    }

    @Test
    void distance_to_line_uses_nearest_segment_point() {
        // Line runs along the equator; origin sits one degree north of its middle.
        var l = line(List.of(List.of(-1.0, 0.0), List.of(1.0, 0.0)));
        double d = GeoPredicates.distanceMeters(point(0, 1), l);
        assertEquals(GeoPredicates.distanceMeters(point(0, 1), point(0, 0)), d, 1.0);
    }

    @Test
    void distance_from_a_non_point_is_unsupported() {
        var l = line(List.of(List.of(0.0, 0.0), List.of(1.0, 1.0)));
        assertThrows(UnsupportedGeometryException.class, () -> GeoPredicates.distanceMeters(l, point(0, 0)));
        assertThrows(UnsupportedGeometryException.class,
                () -> GeoPredicates.distanceMeters(point(0, 0), square(0, 0, 1, 1)));
    }

    @Test
    void point_in_polygon_includes_boundary() {
        var sq = square(0, 0, 2, 2);
        assertTrue(GeoPredicates.pointInPolygon(point(1, 1), sq));
        assertTrue(GeoPredicates.pointInPolygon(point(0, 1), sq));
        assertFalse(GeoPredicates.pointInPolygon(point(3, 1), sq));
    }

    @Test
    void polygons_and_lines_against_a_query_polygon() {
        var sq = square(0, 0, 2, 2);
        assertTrue(GeoPredicates.polygonsIntersect(square(1, 1, 3, 3), sq));
        assertFalse(GeoPredicates.polygonsIntersect(square(5, 5, 6, 6), sq));

        assertTrue(GeoPredicates.lineCrossesOrWithin(line(List.of(List.of(-1.0, 1.0), List.of(3.0, 1.0))), sq));
        assertTrue(GeoPredicates.lineCrossesOrWithin(line(List.of(List.of(0.5, 0.5), List.of(1.5, 1.5))), sq));
        assertFalse(GeoPredicates.lineCrossesOrWithin(line(List.of(List.of(5.0, 5.0), List.of(6.0, 6.0))), sq));
    }

    @Test
    void intersects_dispatches_on_stored_type() {
        var sq = square(0, 0, 2, 2);
        var multi = Map.of("type", "MultiLineString", "coordinates", List.of(
                List.of(List.of(5.0, 5.0), List.of(6.0, 6.0)),
                List.of(List.of(-1.0, 1.0), List.of(3.0, 1.0))));

        assertTrue(GeoPredicates.intersectsPolygon(point(1, 1), sq));
        assertTrue(GeoPredicates.intersectsPolygon(multi, sq));
        assertFalse(GeoPredicates.intersectsPolygon(Map.of("type", "Circle"), sq));
        assertFalse(GeoPredicates.intersectsPolygon("not geometry", sq));
        assertFalse(GeoPredicates.intersectsPolygon(null, sq));
    }

    @Test
    void malformed_geometry_is_reported() {
        assertThrows(MalformedGeometryException.class, () -> GeoJson.toGeometry(Map.of("coordinates", List.of(1, 2))));
        assertThrows(MalformedGeometryException.class, () -> GeoJson.toGeometry(Map.of(
                "type", "Polygon", "coordinates", List.of(List.of(List.of(0, 0), List.of(1, 0), List.of(1, 1)))))); // unclosed
        assertThrows(MalformedGeometryException.class, () -> GeoJson.toGeometry(point(0, 0).get("coordinates")));
    }
}
