package dev.fumaz.relay.exception;

/**
 * Signals that a producer failed while constructing an instance.
 */
public class ProvisionException extends RelayException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
