// file: core/src/main/java/io/hybriddb/core/Document.java
package io.hybriddb.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable JSON document.
 * <p>
 * Properties:
 *  - backed by a deeply unmodifiable map (nested maps and lists are frozen on construction),
 *  - identity is the {@code _id} field, revision marker is the optional {@code _rev} field,
 *  - equality is structural: numbers compare by value and key order is ignored.
 * <p>
 * Serializes to and from a plain JSON object via Jackson.
 */
public final class Document {
    public static final String ID = "_id";
    public static final String REV = "_rev";

    private final Map<String, Object> fields;

    private Document(Map<String, ?> fields) {
        this.fields = Values.freezeMap(fields);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Document of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new Document(fields);
    }

    /** Convenience for tests and small literals: of("k1", v1, "k2", v2, ...). */
    public static Document of(Object... keyValues) {
        if (keyValues.length % 2 != 0) throw new IllegalArgumentException("odd number of key/value arguments");
        Map<String, Object> m = new java.util.LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Document(m);
    }

    /** @return the id as a string, or null when the document has none yet. */
    public String id() {
        Object v = fields.get(ID);
        return v == null ? null : v.toString();
    }

    public boolean hasId() {
        Object v = fields.get(ID);
        return v != null && !v.toString().isEmpty();
    }

    /** @return the revision marker, or null when absent. */
    public Object rev() {
        return fields.get(REV);
    }

    /** Dotted-path lookup; null when missing. */
    public Object get(String path) {
        return Values.getPath(fields, path);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Document with(String field, Object value) {
        Map<String, Object> copy = toMutableMap();
        copy.put(field, value);
        return new Document(copy);
    }

    public Document withId(String id) {
        return with(ID, id);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    /** Deep mutable copy of the fields. */
    public Map<String, Object> toMutableMap() {
        return Values.copyMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return Values.deepEquals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Values.deepHash(fields);
    }

    @Override
    public String toString() {
        return Json.write(fields);
    }
}
