package dev.fumaz.relay.provider;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link Provider} produces an instance of a capability from its already resolved dependencies.
 *
 * @param <T> the type of the instance
 */
@FunctionalInterface
public interface Provider<T> {

    static <T> @NotNull Provider<T> instance(@NotNull T instance) {
        return dependencies -> instance;
    }

    /**
     * @param dependencies the declared dependencies, resolved and in declaration order
     * @return the new instance, never {@code null}
     */
    T provide(@NotNull Dependencies dependencies);

}
