package dev.fumaz.relay.mediator;

import org.jetbrains.annotations.NotNull;

/**
 * Processes one request type. Exactly one handler is registered per request type.
 *
 * @param <Q> the request type
 * @param <R> the result type
 */
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {

    /**
     * @throws dev.fumaz.relay.exception.HandlerException to report a business failure to the caller
     */
    R handle(@NotNull Q request, @NotNull DispatchContext context);

}
