package dev.fumaz.relay.mediator;

/**
 * The rest of a pipeline, from the next behavior down to the handler.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface Continuation<R> {

    /**
     * Runs the rest of the pipeline. May be called at most once.
     */
    R proceed();

}
