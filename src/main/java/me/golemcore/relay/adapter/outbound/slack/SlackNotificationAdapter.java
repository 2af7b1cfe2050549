package me.golemcore.relay.adapter.outbound.slack;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.exception.NotificationException;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Slack Web API implementation of {@link NotificationPort}.
 *
 * <p>
 * Slack answers HTTP 200 with {@code {"ok": false, "error": ...}} for most
 * failures, so every response is checked for {@code ok}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackNotificationAdapter implements NotificationPort {

    private final FeignClientFactory feignClientFactory;
    private final RelayProperties properties;
    private final SlackModalBuilder modalBuilder;

    private SlackApi slackApi;

    @PostConstruct
    public void init() {
        this.slackApi = feignClientFactory.create(SlackApi.class, properties.getSlack().getBaseUrl());
    }

    @Override
    public void postConfirmation(String channel, String user, String threadTs, String requestId,
            ActionKind kind, String renderedPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", channel);
        if (threadTs != null && !threadTs.isBlank()) {
            body.put("thread_ts", threadTs);
        }
        body.put("text", "Ready to create " + kind.getDisplayName());
        body.put("blocks", modalBuilder.promptBlocks(user, requestId, kind, renderedPrompt));

        call("chat.postMessage", () -> slackApi.postMessage(botToken(), body));
        log.info("[Slack] Posted {} confirmation prompt {} to {}", kind.getKey(), requestId, channel);
    }

    @Override
    public void postMessage(String channel, String threadTs, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", channel);
        if (threadTs != null && !threadTs.isBlank()) {
            body.put("thread_ts", threadTs);
        }
        body.put("text", text);

        call("chat.postMessage", () -> slackApi.postMessage(botToken(), body));
        log.debug("[Slack] Posted reply to {} (thread {})", channel, threadTs);
    }

    @Override
    public void openReviewModal(String triggerId, ActionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("trigger_id", triggerId);
        body.put("view", modalBuilder.reviewModal(request));

        call("views.open", () -> slackApi.openView(botToken(), body));
        log.info("[Slack] Opened {} review modal for {}", request.kind().getKey(), request.id());
    }

    private String botToken() {
        String token = properties.getSlack().getBotToken();
        if (token == null || token.isBlank()) {
            throw new MissingCredentialsException("Slack bot token");
        }
        return token;
    }

    private void call(String method, Supplier<SlackResponse> request) {
        SlackResponse response;
        try {
            response = request.get();
        } catch (FeignException e) {
            log.error("[Slack] {} failed with HTTP {}", method, e.status());
            throw new NotificationException("Slack " + method + " failed: HTTP " + e.status(), e);
        }
        if (response == null || !response.isOk()) {
            String error = response != null ? response.getError() : "empty response";
            log.error("[Slack] {} rejected: {}", method, error);
            throw new NotificationException("Slack " + method + " failed: " + error);
        }
    }

    // Feign API interface
    interface SlackApi {
        @RequestLine("POST /chat.postMessage")
        @Headers({ "Content-Type: application/json; charset=utf-8", "Authorization: Bearer {token}" })
        SlackResponse postMessage(@Param("token") String token, Map<String, Object> body);

        @RequestLine("POST /views.open")
        @Headers({ "Content-Type: application/json; charset=utf-8", "Authorization: Bearer {token}" })
        SlackResponse openView(@Param("token") String token, Map<String, Object> body);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SlackResponse {
        private boolean ok;
        private String error;
    }
}
