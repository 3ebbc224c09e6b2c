package dev.fumaz.relay.container;

import dev.fumaz.relay.bind.Lifetime;
import dev.fumaz.relay.bind.ServiceDescriptor;
import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.exception.ConfigurationException;
import dev.fumaz.relay.exception.ResolutionException;
import dev.fumaz.relay.mediator.HandlerCatalog;
import dev.fumaz.relay.mediator.Mediator;
import dev.fumaz.relay.mediator.NotificationCatalog;
import dev.fumaz.relay.mediator.PipelineComposer;
import dev.fumaz.relay.module.Module;
import dev.fumaz.relay.scope.DisposalLedger;
import dev.fumaz.relay.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

public class RelayContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(RelayContainer.class.getName());

    private final @NotNull List<Module> modules;
    private final @NotNull ServiceRegistry registry;
    private final @NotNull HandlerCatalog handlers;
    private final @NotNull DisposalLedger rootLedger;
    private final @NotNull Resolver resolver;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RelayContainer(@NotNull List<Module> modules, @NotNull ContainerBlueprint blueprint, boolean strict) {
        this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
        this.registry = blueprint.getRegistry();
        this.handlers = blueprint.getHandlers();
        this.rootLedger = new DisposalLedger("container");
        this.resolver = new Resolver(registry, rootLedger);

        if (!registry.contains(ServiceKey.of(Container.class))) {
            registry.register(ServiceDescriptor.instance(ServiceKey.of(Container.class), this));
        }

        PipelineComposer pipeline = blueprint.getPipeline();
        NotificationCatalog notifications = blueprint.getNotifications();
        List<String> problems = new ArrayList<>();

        handlers.collectProblems(registry, pipeline.targetedRequests(), problems);
        pipeline.collectProblems(registry, problems);
        notifications.collectProblems(registry, problems);

        registry.seal();
        handlers.seal();
        pipeline.seal();
        notifications.seal();

        if (strict) {
            collectGraphProblems(problems);
        }

        if (!problems.isEmpty()) {
            StringBuilder message = new StringBuilder("Invalid container configuration:");

            for (String problem : problems) {
                message.append(System.lineSeparator()).append(" - ").append(problem);
            }

            throw new ConfigurationException(message.toString());
        }

        LOGGER.fine(() -> "Built container with " + registry.all().size() + " service(s) and "
                + handlers.all().size() + " handler(s)");
    }

    @Override
    public <T> @NotNull T resolve(@NotNull ServiceKey<T> key) {
        ensureOpen();
        return resolver.resolve(key, null);
    }

    @Override
    public @NotNull Scope openScope() {
        ensureOpen();

        Scope scope = new Scope(resolver);
        LOGGER.fine(() -> "Opened " + scope);

        return scope;
    }

    @Override
    public @NotNull Mediator mediator() {
        return resolve(Mediator.class);
    }

    @Override
    public @NotNull ServiceRegistry getRegistry() {
        return registry;
    }

    @Override
    public @NotNull HandlerCatalog getHandlers() {
        return handlers;
    }

    @Override
    public @NotNull List<Module> getModules() {
        return modules;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        LOGGER.fine(() -> "Closing container owning " + rootLedger.size() + " releasable instance(s)");

        resolver.close();
        rootLedger.release();
    }

    private void collectGraphProblems(List<String> problems) {
        for (ServiceDescriptor<?> descriptor : registry.all()) {
            try {
                resolver.verify(descriptor.getKey());
            } catch (ResolutionException e) {
                problems.add(e.getMessage());
                continue;
            }

            if (descriptor.getLifetime() == Lifetime.SINGLETON) {
                findCaptive(descriptor, descriptor, new HashSet<>(), problems);
            }
        }
    }

    /**
     * Singletons resolve their dependencies at the root, where scoped capabilities are not available. Transient
     * dependencies are followed since they are built at the root as well.
     */
    private void findCaptive(ServiceDescriptor<?> singleton,
                             ServiceDescriptor<?> current,
                             Set<ServiceKey<?>> visited,
                             List<String> problems) {
        for (ServiceKey<?> dependency : current.getDependencies()) {
            if (!visited.add(dependency)) {
                continue;
            }

            ServiceDescriptor<?> target = registry.require(dependency);

            if (target.getLifetime() == Lifetime.SCOPED) {
                problems.add("Singleton " + singleton.getKey().describe() + " depends on scoped "
                        + dependency.describe());
            } else if (target.getLifetime() == Lifetime.TRANSIENT) {
                findCaptive(singleton, target, visited, problems);
            }
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("The container is closed");
        }
    }
}
