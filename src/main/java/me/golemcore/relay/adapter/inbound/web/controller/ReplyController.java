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
import me.golemcore.relay.adapter.inbound.web.ApiTokenAuthenticator;
import me.golemcore.relay.adapter.inbound.web.dto.ReplyRequest;
import me.golemcore.relay.adapter.inbound.web.dto.ReplyResponse;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Posts a reply into a Slack thread with the relay's bot token.
 */
@RestController
@RequiredArgsConstructor
public class ReplyController {

    private final ConfirmationWorkflowService workflowService;
    private final ApiTokenAuthenticator authenticator;

    @PostMapping("/api/slack/reply")
    public Mono<ResponseEntity<ReplyResponse>> reply(
            @RequestBody ReplyRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            authenticator.requireAuthenticated(headers);
            workflowService.reply(request.getChannel(), request.getThreadTs(), request.getText());
            return ResponseEntity.ok(new ReplyResponse(true, "Reply sent successfully"));
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
