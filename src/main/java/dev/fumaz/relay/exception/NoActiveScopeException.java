package dev.fumaz.relay.exception;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a scoped capability is requested outside of a scope, either from the container root or from
 * the dependency graph of a singleton.
 */
public class NoActiveScopeException extends ResolutionException {

    private final @NotNull ServiceKey<?> key;

    public NoActiveScopeException(@NotNull ServiceKey<?> key, @NotNull String message) {
        super(message);
        this.key = key;
    }

    public @NotNull ServiceKey<?> getKey() {
        return key;
    }
}
