package me.golemcore.relay.domain.exception;

/**
 * A confirmation referenced a request id that this instance does not hold,
 * either because the prompt outlived its TTL or because it was created on
 * another instance.
 */
public class ConfirmationExpiredException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String requestId;

    public ConfirmationExpiredException(String requestId) {
        super("Confirmation unknown or expired: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
