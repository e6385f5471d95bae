// file: client/src/main/java/io/hybriddb/client/transport/RequestLogger.java
package io.hybriddb.client.transport;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for outgoing calls.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Server errors and failed exchanges are warnings, everything else info.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed (or failed) HTTP exchange.
     *
     * @param method      HTTP method (GET, POST, PATCH, DELETE)
     * @param path        request path
     * @param status      HTTP status code, or -1 when no response arrived
     * @param totalMillis wall-clock latency of the exchange
     * @param error       transport failure, null if a response arrived
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);

        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
