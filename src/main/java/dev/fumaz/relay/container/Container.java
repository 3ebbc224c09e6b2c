package dev.fumaz.relay.container;

import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.mediator.HandlerCatalog;
import dev.fumaz.relay.mediator.Mediator;
import dev.fumaz.relay.module.Module;
import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * A {@link Container} is the root of the object graph: it owns the sealed registrations and every singleton.
 * <p>
 * Scoped capabilities are only available through a {@link Scope}; resolving one from the container itself fails.
 */
public interface Container extends AutoCloseable {

    static @NotNull Container create(@NotNull List<Module> modules) {
        return builder().install(modules).build();
    }

    static @NotNull Container create(@NotNull Module... modules) {
        return create(Arrays.asList(modules));
    }

    static @NotNull ContainerBuilder builder() {
        return new ContainerBuilder();
    }

    /**
     * Resolves a capability from the container root. Transient instances created this way are released when the
     * container closes.
     */
    <T> @NotNull T resolve(@NotNull ServiceKey<T> key);

    default <T> @NotNull T resolve(@NotNull Class<T> type) {
        return resolve(ServiceKey.of(type));
    }

    @NotNull Scope openScope();

    @NotNull Mediator mediator();

    @NotNull ServiceRegistry getRegistry();

    @NotNull HandlerCatalog getHandlers();

    @NotNull List<Module> getModules();

    boolean isClosed();

    /**
     * Releases every singleton and root-owned transient instance, last created first. Calling it again has no effect.
     *
     * @throws dev.fumaz.relay.exception.DisposalException if one or more releases failed
     */
    @Override
    void close();

}
