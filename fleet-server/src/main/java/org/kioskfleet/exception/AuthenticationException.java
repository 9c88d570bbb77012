package org.kioskfleet.exception;

/**
 * Missing, malformed, expired or otherwise unusable credential.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
