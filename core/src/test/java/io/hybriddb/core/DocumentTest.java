// file: core/src/test/java/io/hybriddb/core/DocumentTest.java
package io.hybriddb.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void numbers_compare_by_value_and_key_order_is_ignored() {
        Document a = Document.of("_id", "1", "n", 1, "nested", Map.of("x", 2L));
        Document b = Document.of("nested", Map.of("x", 2.0), "n", 1.0, "_id", "1");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void document_is_deeply_immutable() {
        Document d = Document.of("_id", "1", "tags", List.of("a"), "inner", Map.of("k", "v"));

        assertThrows(UnsupportedOperationException.class, () -> d.asMap().put("x", 1));
        @SuppressWarnings("unchecked")
        List<Object> tags = (List<Object>) d.get("tags");
        assertThrows(UnsupportedOperationException.class, () -> tags.add("b"));
    }

    @Test
    void with_returns_a_new_document() {
        Document d = Document.of("_id", "1", "name", "A");
        Document e = d.with("name", "B");

        assertEquals("A", d.get("name"));
        assertEquals("B", e.get("name"));
        assertEquals("1", e.id());
    }

    @Test
    void json_round_trip_keeps_structure() throws Exception {
        Document d = Document.of("_id", "1", "_rev", 3, "loc", Map.of("type", "Point", "coordinates", List.of(1.5, 2.5)));

        String json = Json.MAPPER.writeValueAsString(d);
        Document back = Json.MAPPER.readValue(json, Document.class);

        assertEquals(d, back);
        assertEquals(3, back.rev());
    }

    @Test
    void dotted_get_reads_nested_values_and_array_indexes() {
        Document d = Document.of("a", Map.of("b", List.of(Map.of("c", 7))));

        assertEquals(7, d.get("a.b.0.c"));
        assertNull(d.get("a.x.c"));
    }

    @Test
    void generated_ids_follow_the_uid_layout() {
        Pattern layout = Pattern.compile("[0-9a-f]{12}4[0-9a-f]{3}[89ab][0-9a-f]{15}");
        for (int i = 0; i < 200; i++) {
            String id = Ids.newId();
            assertTrue(layout.matcher(id).matches(), id);
        }
        assertNotEquals(Ids.newId(), Ids.newId());
    }

    @Test
    void values_order_ranks_types_before_values() {
        assertTrue(Values.compare(null, 0) < 0);
        assertTrue(Values.compare(99, "a") < 0);
        assertTrue(Values.compare("z", Map.of()) < 0);
        assertTrue(Values.compare(Map.of(), List.of()) < 0);
        assertTrue(Values.compare(List.of(), false) < 0);
        assertEquals(0, Values.compare(2, 2.0));
        assertNull(Values.compareSameClass(1, "1"));
    }

    @Test
    void comparisons_return_unit_signs() {
        assertEquals(-1, Values.compare("apple", "zebra"));
        assertEquals(1, Values.compare("zebra", "apple"));
        assertEquals(1, Values.compareSameClass("zz", "a"));
        assertEquals(-1, Values.compare(List.of("a"), List.of("q")));
    }
}
