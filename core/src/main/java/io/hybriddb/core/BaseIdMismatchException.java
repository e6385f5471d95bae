// file: core/src/main/java/io/hybriddb/core/BaseIdMismatchException.java
package io.hybriddb.core;

/** An upsert base is missing its id or carries a different id than its document. */
public class BaseIdMismatchException extends ValidationException {

    public BaseIdMismatchException(String message) {
        super(message);
    }
}
