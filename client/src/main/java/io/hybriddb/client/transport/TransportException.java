// file: client/src/main/java/io/hybriddb/client/transport/TransportException.java
package io.hybriddb.client.transport;

import io.hybriddb.core.HybridDbException;

/** The remote could not be reached, timed out, or answered with an undecodable body. */
public class TransportException extends HybridDbException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
