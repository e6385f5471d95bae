// file: client/src/main/java/io/hybriddb/client/UploadFailedException.java
package io.hybriddb.client;

import io.hybriddb.core.HybridDbException;

/**
 * Some items of an upload could not be uploaded and remain pending.
 * <p>
 * The cause is the first error met; {@link #report()} describes what did succeed.
 */
public class UploadFailedException extends HybridDbException {
    private final UploadReport report;

    public UploadFailedException(UploadReport report, Throwable cause) {
        super("upload incomplete: " + cause.getMessage(), cause);
        this.report = report;
    }

    public UploadReport report() {
        return report;
    }
}
