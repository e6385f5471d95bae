// file: core/src/main/java/io/hybriddb/core/UnsupportedGeometryException.java
package io.hybriddb.core;

/** A geometry type that the requested spatial function cannot operate on. */
public class UnsupportedGeometryException extends ValidationException {

    public UnsupportedGeometryException(String message) {
        super(message);
    }
}
