package org.kioskfleet.exception;

/**
 * Authenticated, but the role does not allow the operation.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
