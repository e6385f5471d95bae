// file: client/src/main/java/io/hybriddb/client/transport/TransportRequest.java
package io.hybriddb.client.transport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request to the remote endpoint.
 *
 * @param method HTTP method
 * @param path   path relative to the base URL, already percent-encoded ("sites", "sites/find")
 * @param query  query parameters in send order, unencoded
 * @param body   JSON-serializable body, or null
 */
public record TransportRequest(String method, String path, Map<String, String> query, Object body) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        query = query == null ? Map.of() : new LinkedHashMap<>(query);
    }

    public static TransportRequest get(String path, Map<String, String> query) {
        return new TransportRequest("GET", path, query, null);
    }

    public static TransportRequest post(String path, Object body) {
        return new TransportRequest("POST", path, null, body);
    }

    public static TransportRequest patch(String path, Object body) {
        return new TransportRequest("PATCH", path, null, body);
    }

    public static TransportRequest delete(String path) {
        return new TransportRequest("DELETE", path, null, null);
    }
}
