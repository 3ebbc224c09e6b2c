package dev.fumaz.relay.exception;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a requested capability, or one of its declared dependencies, has no registration.
 */
public class UnresolvedCapabilityException extends ResolutionException {

    private final @NotNull ServiceKey<?> key;

    public UnresolvedCapabilityException(@NotNull ServiceKey<?> key, @NotNull String message) {
        super(message);
        this.key = key;
    }

    public @NotNull ServiceKey<?> getKey() {
        return key;
    }
}
