package me.golemcore.relay.domain.model;

/**
 * Deterministic identifiers derived from the source Slack message.
 *
 * <p>
 * Nothing here is random: a redelivered event for the same message yields the
 * same action id and the same thread key.
 */
public final class ActionKeys {

    private static final String CONFIRMED_SUFFIX = "_confirmed";

    private ActionKeys() {
    }

    /**
     * {@code {channel}_{messageTs}_{kind}_confirmed}
     */
    public static String actionId(String channel, String messageTs, ActionKind kind) {
        return channel + "_" + messageTs + "_" + kind.getKey() + CONFIRMED_SUFFIX;
    }

    public static String actionId(ConfirmationRequest request) {
        return actionId(request.getChannel(), request.getMessageTs(), request.getKind());
    }

    /**
     * {@code {channel}_{threadTs}}, falling back to the message timestamp for
     * top-level messages.
     */
    public static String threadKey(String channel, String threadTs, String messageTs) {
        String root = threadTs != null && !threadTs.isBlank() ? threadTs : messageTs;
        return channel + "_" + root;
    }

    public static String threadKey(ConfirmationRequest request) {
        return threadKey(request.getChannel(), request.getThreadTs(), request.getMessageTs());
    }
}
