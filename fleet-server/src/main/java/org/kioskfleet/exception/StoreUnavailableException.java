package org.kioskfleet.exception;

/**
 * The authoritative write (state transition plus persistence) did not commit.
 * The device keeps its last committed state and the caller should retry.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
