package com.ariia.security.revocation;

/**
 * Raised by a {@link RevocationStore} that cannot be reached or answered with an error.
 */
public class RevocationStoreException extends RuntimeException {

    public RevocationStoreException(String message) {
        super(message);
    }

    public RevocationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
