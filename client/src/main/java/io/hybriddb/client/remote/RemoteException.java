// file: client/src/main/java/io/hybriddb/client/remote/RemoteException.java
package io.hybriddb.client.remote;

import io.hybriddb.core.HybridDbException;

/**
 * The remote answered with a non-success status.
 * <p>
 * Use {@link #forStatus(int, String)} to get the most specific subclass.
 */
public class RemoteException extends HybridDbException {
    private final int status;

    public RemoteException(int status, String message) {
        super("HTTP " + status + ": " + message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public static RemoteException forStatus(int status, String message) {
        return switch (status) {
            case 400 -> new RemoteValidationException(message);
            case 401 -> new AuthException(message);
            case 403 -> new PermissionException(message);
            case 409 -> new ConflictException(message);
            case 410 -> new GoneException(message);
            default -> new RemoteException(status, message);
        };
    }
}
