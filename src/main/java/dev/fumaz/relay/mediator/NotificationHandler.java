package dev.fumaz.relay.mediator;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface NotificationHandler<N extends Notification> {

    void handle(@NotNull N notification, @NotNull DispatchContext context);

}
