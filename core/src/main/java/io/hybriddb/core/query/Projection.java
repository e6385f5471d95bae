// file: core/src/main/java/io/hybriddb/core/query/Projection.java
package io.hybriddb.core.query;

import io.hybriddb.core.Document;
import io.hybriddb.core.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field projection.
 * <p>
 * Inclusion mode (first listed value is 1 or true) copies each listed dotted
 * path plus {@code _id}, rebuilding intermediate objects and skipping paths
 * that are missing or null. Any other value selects exclusion mode: the
 * document is deep-copied and each listed path removed.
 */
public final class Projection {

    private Projection() {}

    public static List<Document> apply(List<Document> docs, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) return docs;
        boolean include = isInclusion(fields.values().iterator().next());
        List<Document> out = new ArrayList<>(docs.size());
        for (Document d : docs) {
            out.add(include ? include(d, fields) : exclude(d, fields));
        }
        return out;
    }

    private static boolean isInclusion(Object first) {
        if (first instanceof Boolean b) return b;
        return first instanceof Number n && n.doubleValue() == 1;
    }

    private static Document include(Document doc, Map<String, Object> fields) {
        List<String> paths = new ArrayList<>(fields.keySet());
        paths.add(Document.ID);

        Map<String, Object> result = new LinkedHashMap<>();
        for (String field : paths) {
            Object value = doc.get(field);
            if (value != null) putPath(result, field.split("\\."), 0, Values.deepCopy(value));
        }
        return Document.of(result);
    }

    private static Document exclude(Document doc, Map<String, Object> fields) {
        Map<String, Object> copy = doc.toMutableMap();
        for (String field : fields.keySet()) removePath(copy, field.split("\\."), 0);
        return Document.of(copy);
    }

    // ---------- helpers ----------

    /** Puts value at the path; a non-map value in the way blocks the put. */
    private static void putPath(Map<String, Object> to, String[] segs, int i, Object value) {
        if (i == segs.length - 1) {
            to.put(segs[i], value);
            return;
        }
        Object next = to.get(segs[i]);
        Map<String, Object> child;
        if (next == null) {
            child = new LinkedHashMap<>();
        } else if (next instanceof Map<?, ?> m) {
            child = Values.copyMap(m);
        } else {
            return;
        }
        putPath(child, segs, i + 1, value);
        to.put(segs[i], child);
    }

    private static void removePath(Map<String, Object> from, String[] segs, int i) {
        if (i == segs.length - 1) {
            from.remove(segs[i]);
            return;
        }
        if (from.get(segs[i]) instanceof Map<?, ?> m) {
            Map<String, Object> child = Values.copyMap(m);
            removePath(child, segs, i + 1);
            from.put(segs[i], child);
        }
    }
}
