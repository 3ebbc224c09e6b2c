package dev.fumaz.relay.mediator;

import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A {@link Mediator} dispatches requests to their handler through the behavior pipeline and publishes notifications.
 * <p>
 * The mediator never opens scopes: the caller owns the scope of each unit of work and passes it in.
 */
public interface Mediator {

    /**
     * Dispatches a request and returns its result. Failures, business or infrastructure, propagate unchanged.
     *
     * @throws dev.fumaz.relay.exception.HandlerException    if the handler or a behavior rejected the request
     * @throws dev.fumaz.relay.exception.ResolutionException if the handler or a behavior could not be resolved
     */
    <R> R send(@NotNull Request<R> request, @NotNull Scope scope);

    /**
     * Like {@link #send(Request, Scope)}, but returns a {@link dev.fumaz.relay.exception.HandlerException} as a failed
     * result. Infrastructure failures are still thrown.
     */
    <R> @NotNull DispatchResult<R> trySend(@NotNull Request<R> request, @NotNull Scope scope);

    /**
     * Dispatches a request on {@code executor}. Cancelling the returned future, or completing it exceptionally (for
     * instance through {@link CompletableFuture#orTimeout}), while the dispatch runs cancels the dispatch and
     * interrupts its thread.
     */
    <R> @NotNull CompletableFuture<R> sendAsync(@NotNull Request<R> request,
                                                @NotNull Scope scope,
                                                @NotNull Executor executor);

    /**
     * Delivers a notification to every handler registered for its type, in registration order. Every handler runs
     * even if an earlier one fails; the first failure is then rethrown with the others suppressed.
     */
    void publish(@NotNull Notification notification, @NotNull Scope scope);

}
