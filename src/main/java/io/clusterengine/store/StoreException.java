package io.clusterengine.store;

/**
 * Thrown when the backing store cannot complete a read or write.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
