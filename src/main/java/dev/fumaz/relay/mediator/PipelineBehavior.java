package dev.fumaz.relay.mediator;

import org.jetbrains.annotations.NotNull;

/**
 * A cross-cutting step wrapped around handler execution.
 * <p>
 * An implementation either calls {@code next} exactly once, optionally doing work before and after it, or
 * short-circuits by returning a result or throwing without calling it. Work done after {@code next} returns or
 * throws runs strictly after the inner steps have completed.
 */
public interface PipelineBehavior {

    <R> R handle(@NotNull Request<R> request, @NotNull DispatchContext context, @NotNull Continuation<R> next);

}
