// file: client/src/main/java/io/hybriddb/client/transport/Transport.java
package io.hybriddb.client.transport;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pluggable request/response channel to the remote database.
 * <p>
 * Any HTTP status is a successful exchange; only failures to exchange at all
 * complete the future exceptionally, with a {@link TransportException}.
 */
public interface Transport {

    CompletableFuture<TransportResponse> send(TransportRequest request);

    /** Length of the URL this request would be sent to; used to switch long queries to POST. */
    default int urlLength(TransportRequest request) {
        return request.path().length() + 1 + encodeQuery(request.query()).length();
    }

    static String encodeQuery(Map<String, String> query) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : query.entrySet()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(encode(e.getKey())).append('=').append(encode(e.getValue()));
        }
        return sb.toString();
    }

    /** Percent-encoding with spaces as %20, safe in paths and queries alike. */
    static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
