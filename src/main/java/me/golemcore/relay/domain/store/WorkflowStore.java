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

import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.QueuedAction;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory coordination state for human-confirmed actions.
 *
 * <p>
 * Owns the four structures of the confirmation workflow:
 * <ul>
 * <li>{@link RequestRegistry} - prompts awaiting confirmation</li>
 * <li>{@link TaskQueue} - confirmed actions, pending or executed</li>
 * <li>{@link DedupGuard} - ids of executed actions</li>
 * <li>{@link ThreadIdempotencyIndex} - artifact kinds each thread already
 * has</li>
 * </ul>
 *
 * <p>
 * One store exists per process and nothing is persisted. A request written on
 * one instance is invisible to every other instance; callers must treat a miss
 * as "unknown or expired" and never recreate the entry. Sharing state across
 * instances would mean moving these maps into an external TTL-capable
 * key-value store behind the same methods.
 *
 * <p>
 * Every method holds the store monitor, so each operation sees and leaves a
 * consistent state. Network calls must happen outside of it.
 *
 * <p>
 * An action being executed is claimed here until it is released. Claimed
 * actions stay in the queue but are not offered to pollers.
 */
public class WorkflowStore {

    private final RequestRegistry requests;
    private final DedupGuard dedupGuard;
    private final TaskQueue queue;
    private final ThreadIdempotencyIndex threads;
    private final Set<String> claimed = new HashSet<>();

    public WorkflowStore(Clock clock, Duration ttl) {
        this.requests = new RequestRegistry(clock, ttl);
        this.dedupGuard = new DedupGuard();
        this.queue = new TaskQueue(dedupGuard, clock, ttl);
        this.threads = new ThreadIdempotencyIndex();
    }

    // ==================== Pending requests ====================

    public synchronized ActionRequest putRequest(String requestId, ConfirmationRequest payload) {
        return requests.put(requestId, payload);
    }

    public synchronized Optional<ActionRequest> getRequest(String requestId) {
        return requests.get(requestId);
    }

    public synchronized void removeRequest(String requestId) {
        requests.remove(requestId);
    }

    public synchronized int pendingRequestCount() {
        return requests.size();
    }

    // ==================== Queue ====================

    public synchronized boolean enqueue(QueuedAction action) {
        return queue.enqueue(action);
    }

    /**
     * Pending actions nobody is executing right now.
     */
    public synchronized List<QueuedAction> listPending() {
        return queue.list().stream()
                .filter(action -> !claimed.contains(action.getId()))
                .collect(Collectors.toList());
    }

    public synchronized Optional<QueuedAction> findAction(String actionId) {
        return queue.find(actionId);
    }

    public synchronized void markProcessed(String actionId) {
        queue.markProcessed(actionId);
    }

    public synchronized boolean isProcessed(String actionId) {
        return dedupGuard.has(actionId);
    }

    // ==================== Execution claims ====================

    /**
     * Claims the action for execution. Only an {@link Claim#ACQUIRED} claim may
     * call the external system, and it must be released afterwards.
     */
    public synchronized Claim claim(String actionId) {
        if (dedupGuard.has(actionId)) {
            return Claim.PROCESSED;
        }
        if (!claimed.add(actionId)) {
            return Claim.IN_FLIGHT;
        }
        return Claim.ACQUIRED;
    }

    public synchronized void release(String actionId) {
        claimed.remove(actionId);
    }

    // ==================== Thread flags ====================

    public synchronized boolean hasThreadFlag(String threadKey, ActionKind kind) {
        return threads.hasFlag(threadKey, kind);
    }

    public synchronized void setThreadFlag(String threadKey, ActionKind kind) {
        threads.setFlag(threadKey, kind);
    }

    public enum Claim {
        ACQUIRED, IN_FLIGHT, PROCESSED
    }
}
