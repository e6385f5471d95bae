// file: client/src/main/java/io/hybriddb/client/remote/GoneException.java
package io.hybriddb.client.remote;

/** The document no longer exists on the server; uploads abandon the change. */
public class GoneException extends RemoteException {

    public GoneException(String message) {
        super(410, message);
    }
}
