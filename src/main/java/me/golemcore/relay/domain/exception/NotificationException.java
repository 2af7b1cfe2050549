package me.golemcore.relay.domain.exception;

/**
 * A message could not be delivered to the chat platform.
 */
public class NotificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
