package me.golemcore.relay.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of artifact a confirmed action creates. One thread may hold at most one
 * artifact of each kind.
 */
public enum ActionKind {

    TICKET("ticket", "Jira ticket"),

    DOC("doc", "Confluence doc");

    private final String key;
    private final String displayName;

    ActionKind(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Wire name, also used as the kind segment of action ids.
     */
    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ActionKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "ticket", "jira" -> TICKET;
        case "doc", "confluence" -> DOC;
        default -> throw new IllegalArgumentException("Unknown action kind: " + value);
        };
    }
}
