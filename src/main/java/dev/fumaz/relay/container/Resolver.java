package dev.fumaz.relay.container;

import dev.fumaz.relay.bind.Lifetime;
import dev.fumaz.relay.bind.ServiceDescriptor;
import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.exception.CyclicDependencyException;
import dev.fumaz.relay.exception.NoActiveScopeException;
import dev.fumaz.relay.exception.ProvisionException;
import dev.fumaz.relay.exception.RelayException;
import dev.fumaz.relay.exception.UnresolvedCapabilityException;
import dev.fumaz.relay.provider.Dependencies;
import dev.fumaz.relay.provider.InstanceSlot;
import dev.fumaz.relay.scope.DisposalLedger;
import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Walks a capability through the {@link ServiceRegistry}, resolving its declared dependencies depth first and
 * creating instances according to their {@link Lifetime}.
 * <p>
 * Before anything is constructed the whole dependency graph below the requested key is checked, so a missing
 * registration or a cycle fails the call without running a single producer. Since the registry is sealed, a key
 * that passed the check once is never checked again.
 */
public final class Resolver {

    private static final Logger LOGGER = Logger.getLogger(Resolver.class.getName());

    private final @NotNull ServiceRegistry registry;
    private final @NotNull DisposalLedger rootLedger;
    private final ConcurrentMap<ServiceKey<?>, InstanceSlot<?>> singletons = new ConcurrentHashMap<>();
    private final Set<ServiceKey<?>> verified = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public Resolver(@NotNull ServiceRegistry registry, @NotNull DisposalLedger rootLedger) {
        this.registry = registry;
        this.rootLedger = rootLedger;
    }

    /**
     * Resolves a capability.
     *
     * @param scope the scope owning scoped and transient instances, or {@code null} to resolve from the container root
     * @throws UnresolvedCapabilityException if the key or one of its dependencies is not registered
     * @throws CyclicDependencyException     if the dependency graph of the key contains a cycle
     * @throws NoActiveScopeException        if a scoped capability is reached without a scope
     * @throws ProvisionException            if a producer fails
     * @throws IllegalStateException         if the container was closed
     */
    public <T> @NotNull T resolve(@NotNull ServiceKey<T> key, @Nullable Scope scope) {
        if (closed) {
            throw new IllegalStateException("The container is closed");
        }

        verify(key);
        return instantiate(key, scope, null);
    }

    /**
     * Checks that every key reachable from {@code key} is registered and that no key depends on itself.
     */
    public void verify(@NotNull ServiceKey<?> key) {
        if (verified.contains(key)) {
            return;
        }

        Set<ServiceKey<?>> done = new HashSet<>();
        walk(key, new LinkedHashSet<>(), done);
        verified.addAll(done);
    }

    /**
     * Rejects every later resolution, from the root and from scopes that are still open. Singleton slots are kept so
     * a closed container never builds a second instance of a singleton.
     */
    void close() {
        closed = true;
    }

    private void walk(ServiceKey<?> key, LinkedHashSet<ServiceKey<?>> path, Set<ServiceKey<?>> done) {
        if (done.contains(key) || verified.contains(key)) {
            return;
        }

        if (path.contains(key)) {
            throw new CyclicDependencyException(cycle(path, key));
        }

        ServiceDescriptor<?> descriptor = registry.lookup(key).orElseThrow(() -> unresolved(key, path));
        path.add(key);

        for (ServiceKey<?> dependency : descriptor.getDependencies()) {
            walk(dependency, path, done);
        }

        path.remove(key);
        done.add(key);
    }

    private <T> T instantiate(ServiceKey<T> key, @Nullable Scope scope, @Nullable ServiceKey<?> singletonOwner) {
        ServiceDescriptor<T> descriptor = registry.require(key);

        switch (descriptor.getLifetime()) {
            case SINGLETON:
                return singletonSlot(key).getOrCreate(() -> create(descriptor, null, key, rootLedger));
            case SCOPED:
                if (scope == null) {
                    throw noActiveScope(key, singletonOwner);
                }

                return scope.slot(key).getOrCreate(() -> create(descriptor, scope, null, scope.getLedger()));
            case TRANSIENT:
                DisposalLedger owner = scope == null ? rootLedger : scope.getLedger();
                return create(descriptor, scope, singletonOwner, owner);
            default:
                throw new IllegalStateException("Unknown lifetime " + descriptor.getLifetime());
        }
    }

    @SuppressWarnings("unchecked")
    private <T> InstanceSlot<T> singletonSlot(ServiceKey<T> key) {
        return (InstanceSlot<T>) singletons.computeIfAbsent(key, ignored -> new InstanceSlot<>());
    }

    private <T> T create(ServiceDescriptor<T> descriptor,
                         @Nullable Scope scope,
                         @Nullable ServiceKey<?> singletonOwner,
                         DisposalLedger ledger) {
        ServiceKey<T> key = descriptor.getKey();
        List<ServiceKey<?>> dependencyKeys = descriptor.getDependencies();
        Object[] values = new Object[dependencyKeys.size()];

        for (int i = 0; i < values.length; i++) {
            values[i] = instantiate(dependencyKeys.get(i), scope, singletonOwner);
        }

        T instance;

        try {
            instance = descriptor.getProvider().provide(values.length == 0
                    ? Dependencies.none()
                    : new Dependencies(dependencyKeys, values));
        } catch (RelayException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProvisionException("Failed to construct " + key.describe(), e);
        }

        if (instance == null) {
            throw new ProvisionException("Provider for " + key.describe() + " returned null");
        }

        if (!descriptor.isExternallyOwned()) {
            ledger.record(instance, descriptor.getDisposer());
        }

        LOGGER.fine(() -> "Created " + descriptor.getLifetime() + " " + key.describe()
                + (scope == null ? " at the container root" : " in " + scope));

        return instance;
    }

    private static List<ServiceKey<?>> cycle(LinkedHashSet<ServiceKey<?>> path, ServiceKey<?> repeated) {
        List<ServiceKey<?>> cycle = new ArrayList<>();
        boolean inCycle = false;
        Iterator<ServiceKey<?>> iterator = path.iterator();

        while (iterator.hasNext()) {
            ServiceKey<?> step = iterator.next();
            inCycle = inCycle || step.equals(repeated);

            if (inCycle) {
                cycle.add(step);
            }
        }

        cycle.add(repeated);
        return cycle;
    }

    private static UnresolvedCapabilityException unresolved(ServiceKey<?> key, LinkedHashSet<ServiceKey<?>> path) {
        if (path.isEmpty()) {
            return new UnresolvedCapabilityException(key, "No registration found for " + key.describe());
        }

        StringBuilder builder = new StringBuilder("No registration found for ")
                .append(key.describe())
                .append(", required by:");

        for (ServiceKey<?> step : path) {
            builder.append(System.lineSeparator()).append(" - ").append(step.describe());
        }

        return new UnresolvedCapabilityException(key, builder.toString());
    }

    private static NoActiveScopeException noActiveScope(ServiceKey<?> key, @Nullable ServiceKey<?> singletonOwner) {
        if (singletonOwner != null) {
            return new NoActiveScopeException(key, "Scoped " + key.describe() + " cannot be injected into singleton "
                    + singletonOwner.describe() + "; singletons are built outside of any scope");
        }

        return new NoActiveScopeException(key, "Scoped " + key.describe()
                + " was requested without an active scope; open one with Container.openScope()");
    }
}
