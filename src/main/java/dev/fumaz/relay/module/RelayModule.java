package dev.fumaz.relay.module;

import dev.fumaz.relay.bind.DecoratorBuilder;
import dev.fumaz.relay.bind.ServiceBuilder;
import dev.fumaz.relay.bind.ServiceKey;
import dev.fumaz.relay.mediator.BehaviorDescriptor;
import dev.fumaz.relay.mediator.HandlerDescriptor;
import dev.fumaz.relay.mediator.Notification;
import dev.fumaz.relay.mediator.NotificationHandler;
import dev.fumaz.relay.mediator.NotificationHandlerDescriptor;
import dev.fumaz.relay.mediator.PipelineBehavior;
import dev.fumaz.relay.mediator.Request;
import dev.fumaz.relay.mediator.RequestHandler;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Base class for modules. Registrations are applied in the order they are made, which is also the order
 * decorators are stacked in and the tie-breaker between behaviors of equal order.
 * <pre>{@code
 * public class OrderingModule extends RelayModule {
 *     public void configure() {
 *         bind(OrderRepository.class).scoped().to(InMemoryOrderRepository::new);
 *         bind(PlaceOrderHandler.class).scoped().to(OrderRepository.class, PlaceOrderHandler::new);
 *         handle(PlaceOrder.class, PlaceOrderHandler.class);
 *         bind(LoggingBehavior.class).singleton().to(LoggingBehavior::new);
 *         behavior(LoggingBehavior.class, 0);
 *     }
 * }
 * }</pre>
 */
public abstract class RelayModule implements Module {

    private final List<Registration> registrations = new ArrayList<>();
    private final List<Registration> registrationsView = Collections.unmodifiableList(registrations);

    @Override
    public @NotNull List<Registration> getRegistrations() {
        return registrationsView;
    }

    @Override
    public void reset() {
        registrations.clear();
    }

    public <T> @NotNull ServiceBuilder<T> bind(@NotNull Class<T> type) {
        return new ServiceBuilder<>(type, descriptor ->
                registrations.add(blueprint -> blueprint.getRegistry().register(descriptor)));
    }

    /**
     * Wraps the capability registered so far for {@code type}; it must already be registered, by this module or by
     * one applied earlier.
     */
    public <T> @NotNull DecoratorBuilder<T> decorate(@NotNull Class<T> type) {
        return decorate(ServiceKey.of(type));
    }

    public <T> @NotNull DecoratorBuilder<T> decorate(@NotNull ServiceKey<T> key) {
        return new DecoratorBuilder<>(key, decoration ->
                registrations.add(blueprint -> blueprint.getRegistry().decorate(decoration)));
    }

    /**
     * Routes {@code requestType} to the handler registered under {@code handlerType}.
     */
    public <Q extends Request<R>, R> void handle(@NotNull Class<Q> requestType,
                                                 @NotNull Class<? extends RequestHandler<Q, R>> handlerType) {
        handle(requestType, ServiceKey.of(handlerType));
    }

    public <Q extends Request<R>, R> void handle(@NotNull Class<Q> requestType,
                                                 @NotNull ServiceKey<? extends RequestHandler<Q, R>> handlerKey) {
        HandlerDescriptor descriptor = HandlerDescriptor.of(requestType, handlerKey);
        registrations.add(blueprint -> blueprint.getHandlers().register(descriptor));
    }

    /**
     * Declares a request type that must have a handler, so a missing one fails the build.
     */
    public void request(@NotNull Class<? extends Request<?>> requestType) {
        Objects.requireNonNull(requestType, "requestType");
        registrations.add(blueprint -> blueprint.getHandlers().declare(requestType));
    }

    /**
     * Wraps every request with the behavior registered under {@code type}.
     */
    public void behavior(@NotNull Class<? extends PipelineBehavior> type, int order) {
        ServiceKey<? extends PipelineBehavior> key = ServiceKey.of(type);
        registrations.add(blueprint -> blueprint.getPipeline()
                .register(BehaviorDescriptor.forAll(key, order, blueprint.nextSequence())));
    }

    /**
     * Wraps only the listed request types with the behavior registered under {@code type}.
     */
    @SafeVarargs
    public final void behavior(@NotNull Class<? extends PipelineBehavior> type,
                               int order,
                               @NotNull Class<? extends Request<?>>... requestTypes) {
        ServiceKey<? extends PipelineBehavior> key = ServiceKey.of(type);
        Set<Class<?>> targets = new LinkedHashSet<>(Arrays.asList(requestTypes));
        registrations.add(blueprint -> blueprint.getPipeline()
                .register(BehaviorDescriptor.forRequests(key, order, targets, blueprint.nextSequence())));
    }

    public void behavior(@NotNull ServiceKey<? extends PipelineBehavior> key,
                         int order,
                         @NotNull Predicate<Class<?>> appliesTo) {
        registrations.add(blueprint -> blueprint.getPipeline()
                .register(BehaviorDescriptor.matching(key, order, appliesTo, blueprint.nextSequence())));
    }

    public <N extends Notification> void onNotification(@NotNull Class<N> notificationType,
                                                        @NotNull Class<? extends NotificationHandler<N>> handlerType) {
        NotificationHandlerDescriptor descriptor =
                new NotificationHandlerDescriptor(notificationType, ServiceKey.of(handlerType));
        registrations.add(blueprint -> blueprint.getNotifications().register(descriptor));
    }

    protected final void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        if (module == this) {
            throw new IllegalArgumentException("A module cannot install itself");
        }

        module.reset();
        module.configure();

        registrations.addAll(module.getRegistrations());
    }

}
