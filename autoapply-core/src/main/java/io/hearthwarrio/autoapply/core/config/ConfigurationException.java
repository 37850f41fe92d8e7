package io.hearthwarrio.autoapply.core.config;

/**
 * Missing or malformed settings, keyword tables or profile data.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
