package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orders the behaviors applying to a request type and chains them around the handler.
 */
public final class PipelineComposer {

    private static final Comparator<BehaviorDescriptor> ORDERING = Comparator
            .comparingInt(BehaviorDescriptor::getOrder)
            .thenComparingLong(BehaviorDescriptor::getSequence);

    private final List<BehaviorDescriptor> behaviors = new ArrayList<>();
    private final ConcurrentMap<Class<?>, List<BehaviorDescriptor>> chains = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public synchronized void register(@NotNull BehaviorDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");

        if (sealed) {
            throw new IllegalStateException("The pipeline is sealed once the container has been built");
        }

        behaviors.add(descriptor);
    }

    /**
     * @return the behaviors applying to {@code requestType}, outermost first. The same list is returned on every call.
     */
    public @NotNull List<BehaviorDescriptor> compose(@NotNull Class<?> requestType) {
        return chains.computeIfAbsent(requestType, this::computeChain);
    }

    /**
     * Runs {@code behaviors}, which must be the resolved instances of {@link #compose(Class)} in the same order,
     * around {@code handler}.
     */
    public <R> R execute(@NotNull List<PipelineBehavior> behaviors,
                         @NotNull Request<R> request,
                         @NotNull DispatchContext context,
                         @NotNull Continuation<R> handler) {
        return link(behaviors, 0, request, context, handler).proceed();
    }

    /**
     * @return the request types explicitly targeted by some behavior
     */
    public synchronized @NotNull Set<Class<?>> targetedRequests() {
        Set<Class<?>> targeted = new LinkedHashSet<>();

        for (BehaviorDescriptor behavior : behaviors) {
            targeted.addAll(behavior.getTargetedRequests());
        }

        return targeted;
    }

    public synchronized void collectProblems(@NotNull ServiceRegistry registry, @NotNull List<String> problems) {
        for (BehaviorDescriptor behavior : behaviors) {
            if (!registry.contains(behavior.getBehaviorKey())) {
                problems.add("Behavior " + behavior.getBehaviorKey().describe() + " is not registered as a service");
            }
        }
    }

    public void seal() {
        sealed = true;
    }

    private synchronized List<BehaviorDescriptor> computeChain(Class<?> requestType) {
        List<BehaviorDescriptor> chain = new ArrayList<>();

        for (BehaviorDescriptor behavior : behaviors) {
            if (behavior.appliesTo(requestType)) {
                chain.add(behavior);
            }
        }

        chain.sort(ORDERING);
        return Collections.unmodifiableList(chain);
    }

    private <R> Continuation<R> link(List<PipelineBehavior> behaviors,
                                     int index,
                                     Request<R> request,
                                     DispatchContext context,
                                     Continuation<R> handler) {
        if (index == behaviors.size()) {
            return new OnceContinuation<>(context, "handler", handler);
        }

        PipelineBehavior behavior = behaviors.get(index);
        String description = behavior.getClass().getName();

        return new OnceContinuation<>(context, description,
                () -> behavior.handle(request, context, link(behaviors, index + 1, request, context, handler)));
    }

    private static final class OnceContinuation<R> implements Continuation<R> {

        private final DispatchContext context;
        private final String step;
        private final Continuation<R> body;
        private final AtomicBoolean invoked = new AtomicBoolean(false);

        private OnceContinuation(DispatchContext context, String step, Continuation<R> body) {
            this.context = context;
            this.step = step;
            this.body = body;
        }

        @Override
        public R proceed() {
            if (!invoked.compareAndSet(false, true)) {
                throw new IllegalStateException("Continuation into " + step + " was invoked more than once");
            }

            context.throwIfCancelled();
            return body.proceed();
        }
    }
}
