package me.golemcore.relay.domain.exception;

/**
 * The external create call for a confirmed action failed. The action stays
 * pending and may be confirmed again.
 */
public class ActionExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
