package dev.fumaz.relay.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a request is dispatched for which no handler was registered.
 */
public class HandlerNotFoundException extends ResolutionException {

    private final @NotNull Class<?> requestType;

    public HandlerNotFoundException(@NotNull Class<?> requestType) {
        super("No handler registered for request " + requestType.getName());
        this.requestType = requestType;
    }

    public @NotNull Class<?> getRequestType() {
        return requestType;
    }
}
