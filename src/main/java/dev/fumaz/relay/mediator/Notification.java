package dev.fumaz.relay.mediator;

/**
 * Marker for a message published to any number of {@link NotificationHandler}s.
 */
public interface Notification {
}
