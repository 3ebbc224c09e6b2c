package dev.fumaz.relay.exception;

/**
 * Signals that a capability could not be resolved for the current call.
 */
public class ResolutionException extends RelayException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
