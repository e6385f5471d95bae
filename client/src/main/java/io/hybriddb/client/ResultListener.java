// file: client/src/main/java/io/hybriddb/client/ResultListener.java
package io.hybriddb.client;

/**
 * Receives query results as they become available.
 * <p>
 * For one query, an INTERIM delivery (if any) always precedes the CONFIRMED one.
 * Callbacks run on pool threads.
 */
@FunctionalInterface
public interface ResultListener<T> {

    void onResult(T result, Delivery delivery);

    static <T> ResultListener<T> ignore() {
        return (result, delivery) -> { };
    }
}
