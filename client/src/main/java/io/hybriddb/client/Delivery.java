// file: client/src/main/java/io/hybriddb/client/Delivery.java
package io.hybriddb.client;

/** Phase of a delivered query result. */
public enum Delivery {
    /** Answered from the local store while the remote is still pending. */
    INTERIM,
    /** Final answer after the remote has been consulted (or has failed). */
    CONFIRMED
}
