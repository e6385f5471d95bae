// file: client/src/main/java/io/hybriddb/client/transport/TransportResponse.java
package io.hybriddb.client.transport;

/** Status code and raw body of a completed exchange. */
public record TransportResponse(int status, String body) {

    public boolean isOk() {
        return status == 200;
    }
}
