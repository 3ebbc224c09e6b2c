package dev.fumaz.relay.exception;

/**
 * Base unchecked exception for infrastructure failures raised by the container or the mediator.
 * <p>
 * Business failures reported by handlers are {@link HandlerException}s and deliberately sit outside this hierarchy.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public RelayException(Throwable cause) {
        super(cause);
    }
}
