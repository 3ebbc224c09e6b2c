package dev.fumaz.relay.mediator;

import dev.fumaz.relay.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class NotificationHandlerDescriptor {

    private final @NotNull Class<? extends Notification> notificationType;
    private final @NotNull ServiceKey<? extends NotificationHandler<?>> handlerKey;

    public NotificationHandlerDescriptor(@NotNull Class<? extends Notification> notificationType,
                                         @NotNull ServiceKey<? extends NotificationHandler<?>> handlerKey) {
        this.notificationType = Objects.requireNonNull(notificationType, "notificationType");
        this.handlerKey = Objects.requireNonNull(handlerKey, "handlerKey");
    }

    public @NotNull Class<? extends Notification> getNotificationType() {
        return notificationType;
    }

    public @NotNull ServiceKey<? extends NotificationHandler<?>> getHandlerKey() {
        return handlerKey;
    }

    @Override
    public String toString() {
        return notificationType.getName() + " -> " + handlerKey.describe();
    }
}
