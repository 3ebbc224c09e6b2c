package dev.fumaz.relay.scope;

import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.container.Resolver;
import dev.fumaz.relay.provider.InstanceSlot;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * A bounded resolution context, typically one unit of work. It owns every scoped and transient instance it
 * resolves and releases them, last created first, when it is closed.
 * <p>
 * Scopes are opened with {@link dev.fumaz.relay.container.Container#openScope()} and are meant to be used with
 * try-with-resources:
 * <pre>{@code
 * try (Scope scope = container.openScope()) {
 *     return container.mediator().send(new PlaceOrder(...), scope);
 * }
 * }</pre>
 * A scope may be shared by threads fanning out from the same unit of work; first construction of each scoped
 * capability is serialized per capability.
 */
public final class Scope implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Scope.class.getName());
    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final @NotNull Resolver resolver;
    private final @NotNull DisposalLedger ledger;
    private final ConcurrentMap<ServiceKey<?>, InstanceSlot<?>> slots = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @ApiStatus.Internal
    public Scope(@NotNull Resolver resolver) {
        this.id = IDS.incrementAndGet();
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.ledger = new DisposalLedger("scope #" + id);
    }

    public <T> @NotNull T resolve(@NotNull Class<T> type) {
        return resolve(ServiceKey.of(type));
    }

    public <T> @NotNull T resolve(@NotNull ServiceKey<T> key) {
        ensureOpen();
        return resolver.resolve(key, this);
    }

    public long getId() {
        return id;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases every owned instance. Calling it again has no effect.
     *
     * @throws dev.fumaz.relay.exception.DisposalException if releasing one or more instances failed; all of them
     *                                                      have been attempted regardless
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        LOGGER.fine(() -> "Closing scope #" + id + " owning " + ledger.size() + " releasable instance(s)");

        try {
            ledger.release();
        } finally {
            slots.clear();
        }
    }

    @ApiStatus.Internal
    @SuppressWarnings("unchecked")
    public <T> @NotNull InstanceSlot<T> slot(@NotNull ServiceKey<T> key) {
        return (InstanceSlot<T>) slots.computeIfAbsent(key, ignored -> new InstanceSlot<>());
    }

    @ApiStatus.Internal
    public @NotNull DisposalLedger getLedger() {
        return ledger;
    }

    @Override
    public String toString() {
        return "scope #" + id;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Scope #" + id + " is closed");
        }
    }
}
