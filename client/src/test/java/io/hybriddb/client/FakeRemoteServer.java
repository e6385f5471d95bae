// file: client/src/test/java/io/hybriddb/client/FakeRemoteServer.java
package io.hybriddb.client;

import io.hybriddb.client.transport.TransportResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Serves a {@link FakeRemote} over real HTTP under {@code /v3/}, on an ephemeral port.
 */
public final class FakeRemoteServer implements AutoCloseable {
    private static final String PREFIX = "/v3/";

    private final FakeRemote remote;
    private final Undertow server;
    /** Raw query strings, in arrival order. */
    public final List<String> queryStrings = new CopyOnWriteArrayList<>();

    public FakeRemoteServer(FakeRemote remote) {
        this.remote = remote;
        this.server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(exchange -> {
                    String path = exchange.getRequestPath();
                    String method = exchange.getRequestMethod().toString();
                    queryStrings.add(exchange.getQueryString());
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (!path.startsWith(PREFIX)) {
                        send(exchange, new TransportResponse(404, "{\"error\":\"not found\"}"));
                        return;
                    }
                    Map<String, String> query = new LinkedHashMap<>();
                    for (Map.Entry<String, Deque<String>> e : exchange.getQueryParameters().entrySet()) {
                        query.put(e.getKey(), e.getValue().getFirst());
                    }
                    exchange.getRequestReceiver().receiveFullString((ex, body) ->
                            send(ex, remote.handle(method, path.substring(PREFIX.length()), query, body)));
                }).build();
    }

    public FakeRemoteServer start() {
        server.start();
        return this;
    }

    public URI baseUrl() {
        InetSocketAddress addr = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return URI.create("http://127.0.0.1:" + addr.getPort() + PREFIX);
    }

    public FakeRemote remote() {
        return remote;
    }

    @Override
    public void close() {
        server.stop();
    }

    private static void send(HttpServerExchange ex, TransportResponse resp) {
        ex.setStatusCode(resp.status());
        ex.getResponseSender().send(resp.body());
    }
}
