package com.liftlog.store;

/**
 * The store could not complete an operation. For an append this means the
 * event was not persisted, so the caller may retry safely.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
