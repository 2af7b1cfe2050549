package me.golemcore.relay.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.web.ApiTokenAuthenticator;
import me.golemcore.relay.adapter.inbound.web.dto.MarkProcessedRequest;
import me.golemcore.relay.adapter.inbound.web.dto.MarkProcessedResponse;
import me.golemcore.relay.adapter.inbound.web.dto.PendingTasksResponse;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Poller contract: list confirmed actions still pending and acknowledge the
 * ones handled elsewhere.
 */
@RestController
@RequestMapping("/api/slack/pending-tasks")
@RequiredArgsConstructor
@Slf4j
public class PendingTasksController {

    private final ConfirmationWorkflowService workflowService;
    private final ApiTokenAuthenticator authenticator;

    @GetMapping
    public Mono<ResponseEntity<PendingTasksResponse>> listPending(@RequestHeader HttpHeaders headers) {
        return Mono.fromCallable(() -> {
            authenticator.requireAuthenticated(headers);
            return ResponseEntity.ok(PendingTasksResponse.of(workflowService.pendingActions()));
        });
    }

    @PostMapping
    public Mono<ResponseEntity<MarkProcessedResponse>> markProcessed(
            @RequestBody MarkProcessedRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            authenticator.requireAuthenticated(headers);
            if (request.getTaskId() == null || request.getTaskId().isBlank()) {
                throw new IllegalArgumentException("'taskId' is required");
            }
            workflowService.markProcessed(request.getTaskId());
            log.info("[API] Task {} marked processed by poller", request.getTaskId());
            return ResponseEntity.ok(new MarkProcessedResponse(true, request.getTaskId()));
        });
    }
}
