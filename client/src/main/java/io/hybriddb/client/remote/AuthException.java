// file: client/src/main/java/io/hybriddb/client/remote/AuthException.java
package io.hybriddb.client.remote;

/** Authentication is missing or was refused. */
public class AuthException extends RemoteException {

    public AuthException(String message) {
        super(401, message);
    }
}
