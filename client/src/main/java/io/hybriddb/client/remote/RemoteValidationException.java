// file: client/src/main/java/io/hybriddb/client/remote/RemoteValidationException.java
package io.hybriddb.client.remote;

/** The remote rejected the request as invalid. */
public class RemoteValidationException extends RemoteException {

    public RemoteValidationException(String message) {
        super(400, message);
    }
}
