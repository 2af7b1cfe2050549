package me.golemcore.relay.domain.service;

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
import me.golemcore.relay.domain.exception.ActionExecutionException;
import me.golemcore.relay.domain.exception.ConfirmationExpiredException;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.model.ActionKeys;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationEdits;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.ConfirmationResult;
import me.golemcore.relay.domain.model.CreatedArtifact;
import me.golemcore.relay.domain.model.FieldOption;
import me.golemcore.relay.domain.model.InitiationResult;
import me.golemcore.relay.domain.model.QueuedAction;
import me.golemcore.relay.domain.store.WorkflowStore;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ActionExecutorPort;
import me.golemcore.relay.port.outbound.FieldOptionsPort;
import me.golemcore.relay.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a human-confirmed action from prompt to created artifact.
 *
 * <p>
 * Lifecycle per action id:
 *
 * <pre>
 * Created   → request stored, prompt posted          (initiate)
 * Confirmed → queued as PENDING, thread flagged      (confirm)
 * Executed  → artifact created, PROCESSED, deduped   (confirm)
 * Expired   → request aged out; late confirmations are rejected
 * </pre>
 *
 * <p>
 * A failed external call leaves the action pending and keeps the stored
 * request, so the reviewer can submit the same confirmation again. Duplicate
 * confirmations of an executed or executing action are absorbed and reported
 * as success.
 *
 * @see WorkflowStore
 */
@Service
@Slf4j
public class ConfirmationWorkflowService {

    private static final String REQUEST_ID_PREFIX = "req_";

    private final WorkflowStore store;
    private final NotificationPort notificationPort;
    private final FieldOptionsPort fieldOptionsPort;
    private final ConfirmationPromptRenderer promptRenderer;
    private final RelayProperties properties;
    private final Clock clock;
    private final Map<ActionKind, ActionExecutorPort> executors = new EnumMap<>(ActionKind.class);

    public ConfirmationWorkflowService(WorkflowStore store, NotificationPort notificationPort,
            FieldOptionsPort fieldOptionsPort, List<ActionExecutorPort> executorPorts,
            ConfirmationPromptRenderer promptRenderer, RelayProperties properties, Clock clock) {
        this.store = store;
        this.notificationPort = notificationPort;
        this.fieldOptionsPort = fieldOptionsPort;
        this.promptRenderer = promptRenderer;
        this.properties = properties;
        this.clock = clock;
        for (ActionExecutorPort executor : executorPorts) {
            executors.put(executor.getKind(), executor);
        }
        log.info("[Workflow] Executors registered for: {}", executors.keySet());
    }

    // ==================== Initiation ====================

    /**
     * Posts a confirmation prompt for the request unless its thread already has
     * an artifact of the same kind.
     *
     * @throws IllegalArgumentException
     *             if kind, channel, message timestamp or title is missing
     */
    public InitiationResult initiate(ConfirmationRequest request) {
        validate(request);
        ActionKind kind = request.getKind();
        String threadKey = ActionKeys.threadKey(request);

        if (store.hasThreadFlag(threadKey, kind)) {
            log.info("[Workflow] Thread {} already has a {}, not prompting", threadKey, kind.getDisplayName());
            return InitiationResult.alreadyExists();
        }

        String requestId = request.getRequestId() != null && !request.getRequestId().isBlank()
                ? request.getRequestId()
                : REQUEST_ID_PREFIX + clock.millis();

        ConfirmationRequest payload = request.toBuilder()
                .requestId(requestId)
                .createdAt(request.getCreatedAt() != null ? request.getCreatedAt() : Instant.now(clock))
                .fieldOptions(resolveFieldOptions(request))
                .build();

        store.putRequest(requestId, payload);
        try {
            notificationPort.postConfirmation(payload.getChannel(), payload.getUser(), payload.getRootTs(),
                    requestId, kind, promptRenderer.render(payload));
        } catch (RuntimeException e) {
            store.removeRequest(requestId);
            log.error("[Workflow] Failed to post confirmation prompt for {}: {}", requestId, e.getMessage());
            throw e;
        }

        log.info("[Workflow] Prompted for {} in thread {} (request {})", kind.getDisplayName(), threadKey, requestId);
        return InitiationResult.prompted(requestId);
    }

    private Map<String, List<FieldOption>> resolveFieldOptions(ConfirmationRequest request) {
        Map<String, List<FieldOption>> supplied = request.getFieldOptions();
        if (supplied != null && !supplied.isEmpty()) {
            return supplied;
        }
        if (request.getKind() != ActionKind.TICKET) {
            return new HashMap<>();
        }
        String projectKey = request.getProjectKey() != null && !request.getProjectKey().isBlank()
                ? request.getProjectKey()
                : properties.getJira().getDefaultProjectKey();
        if (projectKey == null || projectKey.isBlank()) {
            return new HashMap<>();
        }
        try {
            return new HashMap<>(fieldOptionsPort.fetch(projectKey));
        } catch (RuntimeException e) {
            log.warn("[Workflow] Field options unavailable for {}, prompting without them: {}",
                    projectKey, e.getMessage());
            return new HashMap<>();
        }
    }

    // ==================== Confirmation ====================

    /**
     * Looks up an open prompt, e.g. to show the review form.
     */
    public Optional<ActionRequest> lookup(String requestId) {
        return store.getRequest(requestId);
    }

    /**
     * Opens the review form for an open prompt.
     *
     * @throws ConfirmationExpiredException
     *             if the prompt is unknown to this instance or has expired
     */
    public void openReview(String requestId, String triggerId) {
        ActionRequest request = store.getRequest(requestId)
                .orElseThrow(() -> expired(requestId));
        notificationPort.openReviewModal(triggerId, request);
    }

    /**
     * Confirms an open prompt and executes its action once.
     *
     * @param requestId
     *            the id embedded in the prompt
     * @param edits
     *            values changed by the reviewer, may be {@code null}
     * @throws ConfirmationExpiredException
     *             if the prompt is unknown to this instance or has expired
     * @throws ActionExecutionException
     *             if the external call failed; the action stays pending
     */
    public ConfirmationResult confirm(String requestId, ConfirmationEdits edits) {
        ActionRequest pending = store.getRequest(requestId)
                .orElseThrow(() -> expired(requestId));

        ConfirmationRequest confirmed = pending.payload().withEdits(edits);
        ActionKind kind = confirmed.getKind();
        String actionId = ActionKeys.actionId(confirmed);
        String threadKey = ActionKeys.threadKey(confirmed);

        store.enqueue(QueuedAction.builder()
                .id(actionId)
                .kind(kind)
                .threadKey(threadKey)
                .createdAt(Instant.now(clock))
                .payload(confirmed)
                .build());
        store.setThreadFlag(threadKey, kind);

        return execute(requestId, actionId, confirmed);
    }

    private ConfirmationResult execute(String requestId, String actionId, ConfirmationRequest confirmed) {
        WorkflowStore.Claim claim = store.claim(actionId);
        if (claim == WorkflowStore.Claim.PROCESSED) {
            log.info("[Workflow] Action {} already executed, ignoring duplicate confirmation", actionId);
            store.removeRequest(requestId);
            return ConfirmationResult.alreadyProcessed(actionId);
        }
        if (claim == WorkflowStore.Claim.IN_FLIGHT) {
            log.info("[Workflow] Action {} is executing, ignoring duplicate confirmation", actionId);
            return ConfirmationResult.inProgress(actionId);
        }

        try {
            CreatedArtifact artifact = executorFor(confirmed.getKind()).create(confirmed);
            store.markProcessed(actionId);
            store.removeRequest(requestId);
            log.info("[Workflow] Action {} executed: {}", actionId, artifact.externalId());
            replyQuietly(confirmed, successText(confirmed.getKind(), artifact));
            return ConfirmationResult.executed(actionId, artifact);
        } catch (MissingCredentialsException e) {
            log.error("[Workflow] Cannot execute {}: {}", actionId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ActionExecutionException failure = e instanceof ActionExecutionException executionFailure
                    ? executionFailure
                    : new ActionExecutionException(e.getMessage(), e);
            log.error("[Workflow] Action {} failed, left pending for retry: {}", actionId, failure.getMessage());
            replyQuietly(confirmed, failureText(confirmed.getKind(), failure));
            throw failure;
        } finally {
            store.release(actionId);
        }
    }

    private ActionExecutorPort executorFor(ActionKind kind) {
        ActionExecutorPort executor = executors.get(kind);
        if (executor == null) {
            throw new ActionExecutionException("No executor registered for " + kind.getDisplayName());
        }
        return executor;
    }

    // ==================== Poller contract ====================

    /**
     * Confirmed actions still waiting for execution. Actions this instance is
     * executing right now are left out.
     */
    public List<QueuedAction> pendingActions() {
        return store.listPending();
    }

    public void markProcessed(String actionId) {
        store.markProcessed(actionId);
    }

    public int pendingRequestCount() {
        return store.pendingRequestCount();
    }

    // ==================== Notices ====================

    /**
     * Tells the thread that a confirmation arrived for a prompt this instance
     * no longer knows.
     */
    public void notifyExpired(String channel, String threadTs) {
        if (channel == null || channel.isBlank()) {
            return;
        }
        try {
            notificationPort.postMessage(channel, threadTs,
                    ":hourglass: This confirmation has expired. Please ask again to get a new prompt.");
        } catch (RuntimeException e) {
            log.warn("[Workflow] Failed to post expiry notice: {}", e.getMessage());
        }
    }

    /**
     * Posts a free-form reply into a thread on behalf of a caller.
     *
     * @throws IllegalArgumentException
     *             if channel, thread timestamp or text is missing
     */
    public void reply(String channel, String threadTs, String text) {
        require(channel, "channel");
        require(threadTs, "threadTs");
        require(text, "text");
        notificationPort.postMessage(channel, threadTs, text);
        log.info("[Workflow] Replied in thread {}_{}", channel, threadTs);
    }

    private void replyQuietly(ConfirmationRequest request, String text) {
        try {
            notificationPort.postMessage(request.getChannel(), request.getRootTs(), text);
        } catch (RuntimeException e) {
            log.warn("[Workflow] Failed to reply in thread {}: {}", ActionKeys.threadKey(request), e.getMessage());
        }
    }

    private static String successText(ActionKind kind, CreatedArtifact artifact) {
        return ":white_check_mark: " + kind.getDisplayName() + " created: <" + artifact.url() + "|"
                + artifact.externalId() + ">";
    }

    private static String failureText(ActionKind kind, ActionExecutionException failure) {
        return ":x: Failed to create " + kind.getDisplayName() + ": " + failure.getMessage()
                + "\nSubmit the confirmation again to retry.";
    }

    private ConfirmationExpiredException expired(String requestId) {
        log.warn("[Workflow] Confirmation references unknown or expired request: {}", requestId);
        return new ConfirmationExpiredException(requestId);
    }

    private static void validate(ConfirmationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.getKind() == null) {
            throw new IllegalArgumentException("'kind' is required");
        }
        if (request.getChannel() == null || request.getChannel().isBlank()) {
            throw new IllegalArgumentException("'channel' is required");
        }
        if (request.getMessageTs() == null || request.getMessageTs().isBlank()) {
            throw new IllegalArgumentException("'messageTs' is required");
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new IllegalArgumentException("'title' is required");
        }
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + name + "' is required");
        }
    }
}
