// file: core/src/main/java/io/hybriddb/core/MalformedGeometryException.java
package io.hybriddb.core;

public class MalformedGeometryException extends ValidationException {

    public MalformedGeometryException(String message) {
        super(message);
    }

    public MalformedGeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
