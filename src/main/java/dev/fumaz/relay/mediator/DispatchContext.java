package dev.fumaz.relay.mediator;

import dev.fumaz.relay.exception.DispatchCancelledException;
import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one dispatch: the message being handled, the scope it runs in and its cancellation flag.
 */
public final class DispatchContext {

    private final @NotNull Object message;
    private final @NotNull Scope scope;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public DispatchContext(@NotNull Object message, @NotNull Scope scope) {
        this.message = Objects.requireNonNull(message, "message");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public @NotNull Object getMessage() {
        return message;
    }

    public @NotNull Class<?> getMessageType() {
        return message.getClass();
    }

    public @NotNull Scope getScope() {
        return scope;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @return {@code true} once the dispatch was cancelled or its thread was interrupted
     */
    public boolean isCancelled() {
        if (!cancelled.get() && Thread.currentThread().isInterrupted()) {
            cancelled.set(true);
        }

        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new DispatchCancelledException("Dispatch of " + message.getClass().getName() + " was cancelled");
        }
    }
}
