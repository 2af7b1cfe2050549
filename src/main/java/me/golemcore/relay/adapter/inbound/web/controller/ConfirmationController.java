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
import me.golemcore.relay.adapter.inbound.web.dto.ConfirmationResponse;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.InitiationResult;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for whatever detected the intent (a bot, a desktop client): asks
 * the thread to confirm a proposed ticket or doc.
 */
@RestController
@RequestMapping("/api/slack/confirmations")
@RequiredArgsConstructor
@Slf4j
public class ConfirmationController {

    private final ConfirmationWorkflowService workflowService;
    private final ApiTokenAuthenticator authenticator;

    @PostMapping
    public Mono<ResponseEntity<ConfirmationResponse>> requestConfirmation(
            @RequestBody ConfirmationRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            authenticator.requireAuthenticated(headers);
            InitiationResult result = workflowService.initiate(request);
            if (result.status() == InitiationResult.Status.ALREADY_EXISTS) {
                return ResponseEntity.ok(ConfirmationResponse.alreadyExists());
            }
            return ResponseEntity.ok(ConfirmationResponse.prompted(result.requestId()));
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
