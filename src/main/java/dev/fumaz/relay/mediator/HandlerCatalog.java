package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceRegistry;
import dev.fumaz.relay.exception.HandlerNotFoundException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps each request type to the single {@link HandlerDescriptor} handling it.
 * <p>
 * Registrations are collected while the container is built and validated in one pass before it is sealed, so an
 * ambiguous or missing handler aborts startup rather than a later dispatch.
 */
public final class HandlerCatalog {

    private final Map<Class<?>, List<HandlerDescriptor>> handlers = new LinkedHashMap<>();
    private final Set<Class<?>> declaredRequests = new LinkedHashSet<>();
    private volatile boolean sealed;

    public synchronized void register(@NotNull HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        ensureOpen();

        handlers.computeIfAbsent(descriptor.getRequestType(), ignored -> new ArrayList<>()).add(descriptor);
    }

    /**
     * Declares a request type that must have a handler once the container is built.
     */
    public synchronized void declare(@NotNull Class<?> requestType) {
        Objects.requireNonNull(requestType, "requestType");
        ensureOpen();

        declaredRequests.add(requestType);
    }

    public @NotNull Optional<HandlerDescriptor> lookup(@NotNull Class<?> requestType) {
        List<HandlerDescriptor> candidates = handlers.get(requestType);

        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(candidates.get(0));
    }

    public @NotNull HandlerDescriptor require(@NotNull Class<?> requestType) {
        return lookup(requestType).orElseThrow(() -> new HandlerNotFoundException(requestType));
    }

    public synchronized @NotNull List<HandlerDescriptor> all() {
        List<HandlerDescriptor> all = new ArrayList<>();
        handlers.values().forEach(all::addAll);
        return all;
    }

    /**
     * Reports request types with more than one handler, handlers whose capability is not registered, and request
     * types that are expected to be handled but are not.
     *
     * @param expected request types referenced elsewhere, for instance by behaviors targeting them
     */
    public synchronized void collectProblems(@NotNull ServiceRegistry registry,
                                             @NotNull Collection<Class<?>> expected,
                                             @NotNull List<String> problems) {
        for (Map.Entry<Class<?>, List<HandlerDescriptor>> entry : handlers.entrySet()) {
            List<HandlerDescriptor> candidates = entry.getValue();

            if (candidates.size() > 1) {
                problems.add("Request " + entry.getKey().getName() + " has " + candidates.size() + " handlers: "
                        + candidates.stream()
                        .map(candidate -> candidate.getHandlerKey().describe())
                        .collect(Collectors.joining(", ")));
            }

            for (HandlerDescriptor candidate : candidates) {
                if (!registry.contains(candidate.getHandlerKey())) {
                    problems.add("Handler " + candidate.getHandlerKey().describe() + " for request "
                            + entry.getKey().getName() + " is not registered as a service");
                }
            }
        }

        Set<Class<?>> required = new LinkedHashSet<>(declaredRequests);
        required.addAll(expected);

        for (Class<?> requestType : required) {
            if (!handlers.containsKey(requestType)) {
                problems.add("Request " + requestType.getName() + " has no handler");
            }
        }
    }

    public void seal() {
        sealed = true;
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("The handler catalog is sealed once the container has been built");
        }
    }
}
