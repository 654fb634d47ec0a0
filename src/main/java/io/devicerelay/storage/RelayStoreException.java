package io.devicerelay.storage;

/**
 * Unchecked wrapper for failures of the backing store.
 */
public class RelayStoreException extends RuntimeException {
    public RelayStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
