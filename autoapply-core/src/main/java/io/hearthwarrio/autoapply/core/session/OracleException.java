package io.hearthwarrio.autoapply.core.session;

/**
 * Oracle transport failure or malformed oracle response.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
