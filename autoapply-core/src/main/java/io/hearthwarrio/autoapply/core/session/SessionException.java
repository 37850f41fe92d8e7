package io.hearthwarrio.autoapply.core.session;

/**
 * Thrown when a browser interaction is rejected after every interaction strategy was tried.
 */
public class SessionException extends RuntimeException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
