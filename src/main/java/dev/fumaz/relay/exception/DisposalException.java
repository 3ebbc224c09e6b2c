package dev.fumaz.relay.exception;

/**
 * Aggregates the failures raised while releasing owned instances. The first failure is the cause, any further
 * ones are attached as suppressed exceptions.
 */
public class DisposalException extends RelayException {

    public DisposalException(String message, Throwable cause) {
        super(message, cause);
    }
}
