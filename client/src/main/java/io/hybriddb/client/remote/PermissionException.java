// file: client/src/main/java/io/hybriddb/client/remote/PermissionException.java
package io.hybriddb.client.remote;

/** The client may not perform this change; uploads abandon it. */
public class PermissionException extends RemoteException {

    public PermissionException(String message) {
        super(403, message);
    }
}
