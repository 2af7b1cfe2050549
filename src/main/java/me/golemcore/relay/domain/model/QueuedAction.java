package me.golemcore.relay.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A confirmed unit of work, either waiting for execution or already executed.
 *
 * <p>
 * The id is derived from the source message, so a redelivered confirmation maps
 * onto the same queued action. Status only moves forward.
 */
@Getter
@Builder
@ToString
public class QueuedAction {

    private final String id;
    private final ActionKind kind;
    private final String threadKey;
    private final Instant createdAt;
    private volatile ConfirmationRequest payload;

    @Builder.Default
    private Status status = Status.PENDING;

    /**
     * Replaces the payload of a pending action, e.g. after the reviewer
     * resubmitted different values. Executed actions keep theirs.
     */
    public void refreshPayload(ConfirmationRequest newPayload) {
        if (isPending()) {
            this.payload = newPayload;
        }
    }

    public void markProcessed() {
        this.status = Status.PROCESSED;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == Status.PENDING;
    }

    public enum Status {
        PENDING, PROCESSED
    }
}
