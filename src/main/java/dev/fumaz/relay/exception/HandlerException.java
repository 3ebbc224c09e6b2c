package dev.fumaz.relay.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A business failure reported by a handler or by a behavior that rejects a request.
 * <p>
 * Unlike {@link RelayException}s this is meant to be handled by the caller, typically by mapping the
 * {@link #getCode() code} to a response.
 */
public class HandlerException extends RuntimeException {

    private final @Nullable String code;

    public HandlerException(@NotNull String message) {
        this(null, message, null);
    }

    public HandlerException(@Nullable String code, @NotNull String message) {
        this(code, message, null);
    }

    public HandlerException(@Nullable String code, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public @Nullable String getCode() {
        return code;
    }
}
