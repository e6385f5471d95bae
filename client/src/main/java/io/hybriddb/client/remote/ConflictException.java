// file: client/src/main/java/io/hybriddb/client/remote/ConflictException.java
package io.hybriddb.client.remote;

/** The change conflicts with the server state; uploads keep it pending. */
public class ConflictException extends RemoteException {

    public ConflictException(String message) {
        super(409, message);
    }
}
