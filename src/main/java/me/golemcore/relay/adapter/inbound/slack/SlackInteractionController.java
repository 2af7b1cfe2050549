package me.golemcore.relay.adapter.inbound.slack;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.slack.dto.InteractionStatusResponse;
import me.golemcore.relay.adapter.inbound.slack.dto.ViewSubmissionResponse;
import me.golemcore.relay.adapter.outbound.slack.SlackBlockIds;
import me.golemcore.relay.domain.exception.ActionExecutionException;
import me.golemcore.relay.domain.exception.ConfirmationExpiredException;
import me.golemcore.relay.domain.model.ConfirmationEdits;
import me.golemcore.relay.domain.model.ConfirmationResult;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Slack interactivity endpoint.
 *
 * <p>
 * Button clicks on a prompt ({@code block_actions}) open the review modal;
 * modal submissions ({@code view_submission}) confirm and execute. Slack sends
 * the payload as the {@code payload} form field and signs the raw body, so the
 * body is read as bytes.
 */
@RestController
@RequestMapping("/api/slack/interactions")
@RequiredArgsConstructor
@Slf4j
public class SlackInteractionController {

    static final String EXPIRED_MESSAGE = "This confirmation has expired. Please ask again.";

    private static final String PAYLOAD_FIELD = "payload";
    private static final String BLOCK_ACTIONS = "block_actions";
    private static final String VIEW_SUBMISSION = "view_submission";

    private final SlackSignatureVerifier signatureVerifier;
    private final ConfirmationWorkflowService workflowService;
    private final ObjectMapper objectMapper;

    @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Mono<ResponseEntity<ViewSubmissionResponse>> handleInteraction(
            @RequestBody byte[] body,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!signatureVerifier.verify(headers, body)) {
                throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid Slack signature");
            }

            JsonNode payload = parsePayload(body);
            String type = payload.path("type").asText();
            if (BLOCK_ACTIONS.equals(type)) {
                handleBlockActions(payload);
                return ResponseEntity.ok().<ViewSubmissionResponse>build();
            }
            if (VIEW_SUBMISSION.equals(type)) {
                return ResponseEntity.ok(handleViewSubmission(payload.path("view")));
            }

            log.debug("[Slack] Ignoring interaction type: {}", type);
            return ResponseEntity.ok().<ViewSubmissionResponse>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<InteractionStatusResponse>> status() {
        return Mono.fromCallable(() -> ResponseEntity.ok(InteractionStatusResponse.builder()
                .status("ok")
                .pendingRequests(workflowService.pendingRequestCount())
                .pendingTasks(workflowService.pendingActions().size())
                .build()));
    }

    // ==================== block_actions ====================

    private void handleBlockActions(JsonNode payload) {
        String triggerId = payload.path("trigger_id").asText(null);
        for (JsonNode action : payload.path("actions")) {
            String actionId = action.path("action_id").asText();
            if (!SlackBlockIds.OPEN_TICKET_MODAL_ACTION.equals(actionId)
                    && !SlackBlockIds.OPEN_DOC_MODAL_ACTION.equals(actionId)) {
                log.debug("[Slack] Ignoring block action: {}", actionId);
                continue;
            }

            String requestId = action.path("value").asText();
            try {
                workflowService.openReview(requestId, triggerId);
            } catch (ConfirmationExpiredException e) {
                JsonNode message = payload.path("message");
                String threadTs = message.hasNonNull("thread_ts")
                        ? message.get("thread_ts").asText()
                        : message.path("ts").asText(null);
                workflowService.notifyExpired(payload.path("channel").path("id").asText(null), threadTs);
                throw e;
            }
        }
    }

    // ==================== view_submission ====================

    private ViewSubmissionResponse handleViewSubmission(JsonNode view) {
        String callbackId = view.path("callback_id").asText();
        String requestId = view.path("private_metadata").asText();
        JsonNode values = view.path("state").path("values");

        String errorBlock;
        ConfirmationEdits edits;
        if (SlackBlockIds.TICKET_MODAL_CALLBACK.equals(callbackId)) {
            errorBlock = SlackBlockIds.TICKET_TITLE_BLOCK;
            edits = SlackViewStateParser.ticketEdits(values);
        } else if (SlackBlockIds.DOC_MODAL_CALLBACK.equals(callbackId)) {
            errorBlock = SlackBlockIds.ADDITIONAL_CONTEXT_BLOCK;
            edits = SlackViewStateParser.docEdits(values);
        } else {
            log.warn("[Slack] Unknown view callback: {}", callbackId);
            return ViewSubmissionResponse.clear();
        }

        try {
            ConfirmationResult result = workflowService.confirm(requestId, edits);
            log.info("[Slack] Submission for {} finished: {} ({})", requestId, result.status(), result.actionId());
            return ViewSubmissionResponse.clear();
        } catch (ConfirmationExpiredException e) {
            return ViewSubmissionResponse.errors(errorBlock, EXPIRED_MESSAGE);
        } catch (ActionExecutionException e) {
            return ViewSubmissionResponse.errors(errorBlock, "Creation failed: " + e.getMessage());
        }
    }

    private JsonNode parsePayload(byte[] body) {
        String form = new String(body, StandardCharsets.UTF_8);
        for (String pair : form.split("&")) {
            int separator = pair.indexOf('=');
            if (separator > 0 && PAYLOAD_FIELD.equals(pair.substring(0, separator))) {
                String json = URLDecoder.decode(pair.substring(separator + 1), StandardCharsets.UTF_8);
                try {
                    return objectMapper.readTree(json);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Malformed interaction payload", e);
                }
            }
        }
        throw new IllegalArgumentException("'payload' form field is required");
    }
}
