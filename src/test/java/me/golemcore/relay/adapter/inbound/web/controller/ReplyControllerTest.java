package me.golemcore.relay.adapter.inbound.web.controller;

import me.golemcore.relay.adapter.inbound.web.ApiTokenAuthenticator;
import me.golemcore.relay.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.relay.adapter.inbound.web.dto.ReplyRequest;
import me.golemcore.relay.domain.exception.NotificationException;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReplyControllerTest {

    private ConfirmationWorkflowService workflowService;
    private RelayProperties properties;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        workflowService = mock(ConfirmationWorkflowService.class);
        properties = new RelayProperties();
        ReplyController controller = new ReplyController(workflowService, new ApiTokenAuthenticator(properties));

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldPostReplyInThread() {
        webTestClient.post()
                .uri("/api/slack/reply")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("C1", "100.1", "On it"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Reply sent successfully");

        verify(workflowService).reply("C1", "100.1", "On it");
    }

    @Test
    void shouldReturnBadRequestWhenTextMissing() {
        doThrow(new IllegalArgumentException("'text' is required"))
                .when(workflowService).reply("C1", "100.1", null);

        webTestClient.post()
                .uri("/api/slack/reply")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("C1", "100.1", null))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("'text' is required");
    }

    @Test
    void shouldReturnBadGatewayWhenSlackRejectsReply() {
        doThrow(new NotificationException("Slack chat.postMessage failed: channel_not_found"))
                .when(workflowService).reply(any(), any(), any());

        webTestClient.post()
                .uri("/api/slack/reply")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("C404", "100.1", "hello"))
                .exchange()
                .expectStatus().isEqualTo(502);
    }

    @Test
    void shouldRejectReplyWithoutToken() {
        properties.getApi().setToken("relay-secret");

        webTestClient.post()
                .uri("/api/slack/reply")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("C1", "100.1", "On it"))
                .exchange()
                .expectStatus().isUnauthorized();

        verify(workflowService, never()).reply(any(), any(), any());
    }
}
