package me.golemcore.relay.adapter.inbound.web;

import me.golemcore.relay.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.relay.domain.exception.ActionExecutionException;
import me.golemcore.relay.domain.exception.ConfirmationExpiredException;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.exception.NotificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid or missing API token");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(401, body.getStatus());
                    assertEquals("Invalid or missing API token", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapMissingFieldToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("'channel' is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("'channel' is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapExpiredConfirmationToNotFound() {
        StepVerifier.create(handler.handleExpired(new ConfirmationExpiredException("req_1")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("This confirmation has expired", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapMissingCredentialsToServerError() {
        StepVerifier.create(handler.handleMissingCredentials(new MissingCredentialsException("Slack bot token")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Slack bot token is not configured", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapDeliveryFailuresToBadGateway() {
        StepVerifier.create(handler.handleNotification(new NotificationException("Slack chat.postMessage failed")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode()))
                .verifyComplete();

        StepVerifier.create(handler.handleExecution(new ActionExecutionException("Jira down")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalStateException() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Resource conflict")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals(409, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE in adapter")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
