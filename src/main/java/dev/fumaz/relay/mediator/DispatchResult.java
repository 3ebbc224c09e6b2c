package dev.fumaz.relay.mediator;

import dev.fumaz.relay.exception.HandlerException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of {@link Mediator#trySend(Request, dev.fumaz.relay.scope.Scope)}: either the handler's value or the
 * {@link HandlerException} it reported.
 *
 * @param <R> the result type
 */
public final class DispatchResult<R> {

    private final @Nullable R value;
    private final @Nullable HandlerException failure;

    private DispatchResult(@Nullable R value, @Nullable HandlerException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <R> @NotNull DispatchResult<R> success(@Nullable R value) {
        return new DispatchResult<>(value, null);
    }

    public static <R> @NotNull DispatchResult<R> failure(@NotNull HandlerException failure) {
        return new DispatchResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public @Nullable R getValue() {
        if (failure != null) {
            throw new NoSuchElementException("Dispatch failed: " + failure.getMessage());
        }

        return value;
    }

    public @NotNull HandlerException getFailure() {
        if (failure == null) {
            throw new NoSuchElementException("Dispatch succeeded");
        }

        return failure;
    }

    public <U> @NotNull DispatchResult<U> map(@NotNull Function<? super R, ? extends U> mapper) {
        if (failure != null) {
            return new DispatchResult<>(null, failure);
        }

        return success(mapper.apply(value));
    }

    public R orElseThrow() {
        if (failure != null) {
            throw failure;
        }

        return value;
    }

    @Override
    public String toString() {
        return failure == null ? "DispatchResult{value=" + value + '}' : "DispatchResult{failure=" + failure + '}';
    }
}
