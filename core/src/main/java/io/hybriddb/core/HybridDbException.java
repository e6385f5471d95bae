// file: core/src/main/java/io/hybriddb/core/HybridDbException.java
package io.hybriddb.core;

/**
 * Root of every exception raised by hybriddb itself.
 * <p>
 * Storage adapter I/O failures are deliberately not part of this hierarchy:
 * they surface as the original {@link java.io.IOException}.
 */
public class HybridDbException extends RuntimeException {

    public HybridDbException(String message) {
        super(message);
    }

    public HybridDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
