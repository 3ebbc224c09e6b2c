package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A registered {@link PipelineBehavior}: which capability provides it, where it sits in the chain and which request
 * types it applies to. Lower {@link #getOrder() order} values run first (outermost); equal orders keep registration
 * order.
 */
public final class BehaviorDescriptor {

    private final @NotNull ServiceKey<? extends PipelineBehavior> behaviorKey;
    private final int order;
    private final @NotNull Predicate<Class<?>> appliesTo;
    private final @NotNull Set<Class<?>> targetedRequests;
    private final long sequence;

    private BehaviorDescriptor(@NotNull ServiceKey<? extends PipelineBehavior> behaviorKey,
                               int order,
                               @NotNull Predicate<Class<?>> appliesTo,
                               @NotNull Set<Class<?>> targetedRequests,
                               long sequence) {
        this.behaviorKey = Objects.requireNonNull(behaviorKey, "behaviorKey");
        this.order = order;
        this.appliesTo = Objects.requireNonNull(appliesTo, "appliesTo");
        this.targetedRequests = Collections.unmodifiableSet(targetedRequests);
        this.sequence = sequence;
    }

    public static @NotNull BehaviorDescriptor forAll(@NotNull ServiceKey<? extends PipelineBehavior> behaviorKey,
                                                     int order,
                                                     long sequence) {
        return new BehaviorDescriptor(behaviorKey, order, requestType -> true, Collections.emptySet(), sequence);
    }

    /**
     * Applies only to the listed request types, which must all have a handler.
     */
    public static @NotNull BehaviorDescriptor forRequests(@NotNull ServiceKey<? extends PipelineBehavior> behaviorKey,
                                                          int order,
                                                          @NotNull Set<Class<?>> requestTypes,
                                                          long sequence) {
        Set<Class<?>> targets = new LinkedHashSet<>(requestTypes);

        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one request type is required for " + behaviorKey.describe());
        }

        return new BehaviorDescriptor(behaviorKey, order, targets::contains, targets, sequence);
    }

    public static @NotNull BehaviorDescriptor matching(@NotNull ServiceKey<? extends PipelineBehavior> behaviorKey,
                                                       int order,
                                                       @NotNull Predicate<Class<?>> appliesTo,
                                                       long sequence) {
        return new BehaviorDescriptor(behaviorKey, order, appliesTo, Collections.emptySet(), sequence);
    }

    public @NotNull ServiceKey<? extends PipelineBehavior> getBehaviorKey() {
        return behaviorKey;
    }

    public int getOrder() {
        return order;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * @return the request types this behavior was explicitly registered for, empty when it uses a predicate
     */
    public @NotNull Set<Class<?>> getTargetedRequests() {
        return targetedRequests;
    }

    public boolean appliesTo(@NotNull Class<?> requestType) {
        return appliesTo.test(requestType);
    }

    @Override
    public String toString() {
        return behaviorKey.describe() + "@" + order;
    }
}
