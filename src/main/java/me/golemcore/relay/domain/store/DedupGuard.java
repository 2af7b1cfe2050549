package me.golemcore.relay.domain.store;

import java.util.HashSet;
import java.util.Set;

/**
 * Process-lifetime record of action ids that ran to completion. Membership is
 * the single source of truth for "already executed"; ids are never removed.
 */
public class DedupGuard {

    private final Set<String> completed = new HashSet<>();

    public boolean has(String actionId) {
        return completed.contains(actionId);
    }

    public void add(String actionId) {
        completed.add(actionId);
    }

    public int size() {
        return completed.size();
    }
}
