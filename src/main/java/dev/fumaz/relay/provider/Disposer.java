package dev.fumaz.relay.provider;

/**
 * Releases an instance when the scope or container owning it closes.
 *
 * @param <T> the type of the instance
 */
@FunctionalInterface
public interface Disposer<T> {

    void dispose(T instance) throws Exception;

}
