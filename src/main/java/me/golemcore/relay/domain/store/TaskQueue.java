package me.golemcore.relay.domain.store;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.QueuedAction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Confirmed actions in arrival order.
 *
 * <p>
 * Admission is controlled by the {@link DedupGuard}: an action that already ran
 * is never queued again, and a redelivered confirmation whose action is still
 * pending does not produce a second entry. Entries are only ever removed by age.
 */
@Slf4j
public class TaskQueue {

    private final Map<String, QueuedAction> actions = new LinkedHashMap<>();
    private final DedupGuard dedupGuard;
    private final Clock clock;
    private final Duration ttl;

    public TaskQueue(DedupGuard dedupGuard, Clock clock, Duration ttl) {
        this.dedupGuard = dedupGuard;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Queues the action unless it was already executed or is already pending.
     * An already pending entry takes over the new payload and keeps its id and
     * creation time.
     *
     * @return {@code true} if a new pending entry was created
     */
    public boolean enqueue(QueuedAction action) {
        if (dedupGuard.has(action.getId())) {
            log.info("[Store] Action was already processed, skipping: {}", action.getId());
            return false;
        }

        QueuedAction existing = actions.get(action.getId());
        if (existing != null && existing.isPending()) {
            existing.refreshPayload(action.getPayload());
            log.info("[Store] Action already in pending queue, payload refreshed: {}", action.getId());
            return false;
        }

        actions.put(action.getId(), action);
        log.info("[Store] Added pending action: {}", action.getId());

        prune(Instant.now(clock));
        return true;
    }

    /**
     * Pending actions, oldest first. Anything the guard knows as executed is
     * filtered out even if its entry was left pending.
     */
    public List<QueuedAction> list() {
        return actions.values().stream()
                .filter(QueuedAction::isPending)
                .filter(action -> !dedupGuard.has(action.getId()))
                .collect(Collectors.toList());
    }

    public Optional<QueuedAction> find(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    /**
     * Marks the action as executed. The id enters the guard even when its entry
     * has already been pruned, so a late redelivery can never run it again.
     */
    public void markProcessed(String actionId) {
        QueuedAction action = actions.get(actionId);
        if (action != null) {
            action.markProcessed();
        } else {
            log.debug("[Store] Marking unknown action as processed: {}", actionId);
        }
        dedupGuard.add(actionId);
        log.info("[Store] Marked action as processed: {}", actionId);
    }

    public int size() {
        return actions.size();
    }

    private void prune(Instant now) {
        actions.entrySet().removeIf(entry -> {
            boolean expired = Duration.between(entry.getValue().getCreatedAt(), now).compareTo(ttl) > 0;
            if (expired) {
                log.debug("[Store] Cleaned up old action: {}", entry.getKey());
            }
            return expired;
        });
    }
}
