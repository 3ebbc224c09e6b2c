package dev.fumaz.relay.container;

import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.mediator.HandlerCatalog;
import dev.fumaz.relay.mediator.NotificationCatalog;
import dev.fumaz.relay.mediator.PipelineComposer;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The registries a container is assembled from. Module registrations are applied to it one by one before the
 * container validates and seals it.
 */
public final class ContainerBlueprint {

    private final @NotNull ServiceRegistry registry;
    private final @NotNull HandlerCatalog handlers = new HandlerCatalog();
    private final @NotNull PipelineComposer pipeline = new PipelineComposer();
    private final @NotNull NotificationCatalog notifications = new NotificationCatalog();
    private final AtomicLong sequence = new AtomicLong();

    public ContainerBlueprint(boolean allowOverrides) {
        this.registry = new ServiceRegistry(allowOverrides);
    }

    public @NotNull ServiceRegistry getRegistry() {
        return registry;
    }

    public @NotNull HandlerCatalog getHandlers() {
        return handlers;
    }

    public @NotNull PipelineComposer getPipeline() {
        return pipeline;
    }

    public @NotNull NotificationCatalog getNotifications() {
        return notifications;
    }

    /**
     * @return a number increasing with every call, used to keep registration order where it matters
     */
    public long nextSequence() {
        return sequence.incrementAndGet();
    }
}
