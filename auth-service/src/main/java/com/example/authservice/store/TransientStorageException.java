package com.example.authservice.store;

/**
 * The store could not complete an operation for a reason that may not recur:
 * connection loss, lock or query timeout, transaction timeout.
 * The operation's transaction has been rolled back.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String operation, Throwable cause) {
        super("Storage operation failed: " + operation, cause);
    }
}
