package me.golemcore.relay.adapter.inbound.web.controller;

import me.golemcore.relay.adapter.inbound.web.ApiTokenAuthenticator;
import me.golemcore.relay.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.relay.adapter.inbound.web.dto.MarkProcessedRequest;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.QueuedAction;
import me.golemcore.relay.domain.service.ConfirmationWorkflowService;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PendingTasksControllerTest {

    private ConfirmationWorkflowService workflowService;
    private RelayProperties properties;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        workflowService = mock(ConfirmationWorkflowService.class);
        properties = new RelayProperties();
        PendingTasksController controller = new PendingTasksController(workflowService,
                new ApiTokenAuthenticator(properties));

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldListPendingTasks() {
        when(workflowService.pendingActions()).thenReturn(List.of(QueuedAction.builder()
                .id("C1_100.1_ticket_confirmed")
                .kind(ActionKind.TICKET)
                .threadKey("C1_100.1")
                .createdAt(Instant.parse("2026-01-15T10:00:00Z"))
                .build()));

        webTestClient.get()
                .uri("/api/slack/pending-tasks")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.tasks[0].id").isEqualTo("C1_100.1_ticket_confirmed")
                .jsonPath("$.tasks[0].kind").isEqualTo("ticket")
                .jsonPath("$.tasks[0].status").isEqualTo("PENDING");
    }

    @Test
    void shouldMarkTaskProcessed() {
        webTestClient.post()
                .uri("/api/slack/pending-tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new MarkProcessedRequest("C1_100.1_ticket_confirmed"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.taskId").isEqualTo("C1_100.1_ticket_confirmed");

        verify(workflowService).markProcessed("C1_100.1_ticket_confirmed");
    }

    @Test
    void shouldRequireTaskId() {
        webTestClient.post()
                .uri("/api/slack/pending-tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new MarkProcessedRequest(" "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("'taskId' is required");

        verify(workflowService, never()).markProcessed(any());
    }

    @Test
    void shouldRejectPollerWithoutToken() {
        properties.getApi().setToken("relay-secret");

        webTestClient.get()
                .uri("/api/slack/pending-tasks")
                .exchange()
                .expectStatus().isUnauthorized();

        webTestClient.get()
                .uri("/api/slack/pending-tasks")
                .header("X-Relay-Token", "relay-secret")
                .exchange()
                .expectStatus().isOk();
    }
}
