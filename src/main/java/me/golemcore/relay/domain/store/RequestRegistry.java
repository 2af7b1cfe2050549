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
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open confirmation prompts keyed by request id.
 *
 * <p>
 * Entries expire once older than the TTL. Expiry is enforced twice: every
 * {@link #put} sweeps out old entries, and {@link #get} refuses an expired
 * entry even when no write has happened since it aged out.
 */
@Slf4j
public class RequestRegistry {

    private final Map<String, ActionRequest> entries = new LinkedHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public RequestRegistry(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Stores the payload under the id, replacing any previous entry.
     */
    public ActionRequest put(String id, ConfirmationRequest payload) {
        Instant now = Instant.now(clock);
        reap(now);
        ActionRequest request = new ActionRequest(id, payload.getKind(), payload, now);
        ActionRequest previous = entries.put(id, request);
        if (previous != null) {
            log.debug("[Store] Overwrote pending request: {}", id);
        } else {
            log.debug("[Store] Added pending request: {}", id);
        }
        return request;
    }

    public Optional<ActionRequest> get(String id) {
        ActionRequest request = entries.get(id);
        if (request == null) {
            return Optional.empty();
        }
        if (isExpired(request, Instant.now(clock))) {
            entries.remove(id);
            log.debug("[Store] Pending request expired on read: {}", id);
            return Optional.empty();
        }
        return Optional.of(request);
    }

    public void remove(String id) {
        if (entries.remove(id) != null) {
            log.debug("[Store] Removed pending request: {}", id);
        }
    }

    public int size() {
        Instant now = Instant.now(clock);
        int live = 0;
        for (ActionRequest request : entries.values()) {
            if (!isExpired(request, now)) {
                live++;
            }
        }
        return live;
    }

    private void reap(Instant now) {
        Iterator<Map.Entry<String, ActionRequest>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ActionRequest> entry = it.next();
            if (isExpired(entry.getValue(), now)) {
                it.remove();
                log.debug("[Store] Cleaned up expired request: {}", entry.getKey());
            }
        }
    }

    private boolean isExpired(ActionRequest request, Instant now) {
        return Duration.between(request.createdAt(), now).compareTo(ttl) > 0;
    }
}
