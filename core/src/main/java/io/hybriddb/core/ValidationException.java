// file: core/src/main/java/io/hybriddb/core/ValidationException.java
package io.hybriddb.core;

/**
 * Malformed input detected before any state is touched: bad selectors,
 * bad geometry, mismatched bases. Raised synchronously and never retried.
 */
public class ValidationException extends HybridDbException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
