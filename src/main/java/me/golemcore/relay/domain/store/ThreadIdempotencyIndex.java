package me.golemcore.relay.domain.store;

import me.golemcore.relay.domain.model.ActionKind;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which artifact kinds each conversation thread already has. Flags are only
 * ever set, never cleared.
 */
public class ThreadIdempotencyIndex {

    private final Map<String, Set<ActionKind>> flags = new HashMap<>();

    public boolean hasFlag(String threadKey, ActionKind kind) {
        Set<ActionKind> kinds = flags.get(threadKey);
        return kinds != null && kinds.contains(kind);
    }

    public void setFlag(String threadKey, ActionKind kind) {
        flags.computeIfAbsent(threadKey, key -> EnumSet.noneOf(ActionKind.class)).add(kind);
    }
}
