package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps each notification type to its handlers, in registration order. Any number of handlers is allowed,
 * including none.
 */
public final class NotificationCatalog {

    private final Map<Class<?>, List<NotificationHandlerDescriptor>> handlers = new LinkedHashMap<>();
    private volatile boolean sealed;

    public synchronized void register(@NotNull NotificationHandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");

        if (sealed) {
            throw new IllegalStateException("The notification catalog is sealed once the container has been built");
        }

        handlers.computeIfAbsent(descriptor.getNotificationType(), ignored -> new ArrayList<>()).add(descriptor);
    }

    public @NotNull List<NotificationHandlerDescriptor> lookup(@NotNull Class<?> notificationType) {
        List<NotificationHandlerDescriptor> registered = handlers.get(notificationType);

        if (registered == null) {
            return Collections.emptyList();
        }

        return Collections.unmodifiableList(registered);
    }

    public synchronized void collectProblems(@NotNull ServiceRegistry registry, @NotNull List<String> problems) {
        for (List<NotificationHandlerDescriptor> registered : handlers.values()) {
            for (NotificationHandlerDescriptor descriptor : registered) {
                if (!registry.contains(descriptor.getHandlerKey())) {
                    problems.add("Notification handler " + descriptor.getHandlerKey().describe() + " for "
                            + descriptor.getNotificationType().getName() + " is not registered as a service");
                }
            }
        }
    }

    public void seal() {
        sealed = true;
    }
}
