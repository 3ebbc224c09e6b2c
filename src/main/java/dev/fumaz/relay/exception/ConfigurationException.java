package dev.fumaz.relay.exception;

/**
 * Indicates an invalid registration detected while the container is being built.
 */
public class ConfigurationException extends RelayException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
