package dev.fumaz.relay.mediator;

/**
 * Marker for a command or query dispatched through the {@link Mediator}. The request type identifies its handler,
 * {@code R} is the type of the result. Requests without a result use {@link Void}.
 *
 * @param <R> the result type
 */
public interface Request<R> {
}
