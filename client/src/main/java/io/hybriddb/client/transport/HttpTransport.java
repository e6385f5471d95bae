// file: client/src/main/java/io/hybriddb/client/transport/HttpTransport.java
package io.hybriddb.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hybriddb.core.Json;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link Transport} over {@link HttpClient}.
 * <p>
 *  - paths resolve against the base URL (which should end with '/'),
 *  - the optional client id is appended to every request as {@code client=<id>},
 *  - bodies are serialized with Jackson as application/json,
 *  - every exchange is logged through {@link RequestLogger}.
 */
public final class HttpTransport implements Transport {

    private final URI baseUri;
    private final String clientId;
    private final Duration timeout;
    private final HttpClient client;

    public HttpTransport(URI baseUri, String clientId, Duration timeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.clientId = clientId;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        URI uri = uriFor(request);
        String method = request.method();
        String path = uri.getPath();

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json");
        if (request.body() != null) {
            byte[] body;
            try {
                body = Json.MAPPER.writeValueAsBytes(request.body());
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(new TransportException("cannot encode request body", e));
            }
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        long start = System.nanoTime();
        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        RequestLogger.logRequest(method, path, -1, totalMs, cause);
                        throw new TransportException("HTTP " + method + " " + path + " failed: " + cause.getMessage(), cause);
                    }
                    RequestLogger.logRequest(method, path, resp.statusCode(), totalMs, null);
                    return new TransportResponse(resp.statusCode(), resp.body());
                });
    }

    @Override
    public int urlLength(TransportRequest request) {
        return uriFor(request).toString().length();
    }

    URI uriFor(TransportRequest request) {
        Map<String, String> query = new LinkedHashMap<>(request.query());
        if (clientId != null && !clientId.isBlank()) query.put("client", clientId);
        String encoded = Transport.encodeQuery(query);
        return baseUri.resolve(request.path() + (encoded.isEmpty() ? "" : "?" + encoded));
    }
}
