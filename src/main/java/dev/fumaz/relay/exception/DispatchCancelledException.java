package dev.fumaz.relay.exception;

/**
 * Raised inside a pipeline once its dispatch has been cancelled.
 */
public class DispatchCancelledException extends RelayException {

    public DispatchCancelledException(String message) {
        super(message);
    }
}
