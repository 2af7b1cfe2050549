package me.golemcore.relay.adapter.outbound.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.exception.NotificationException;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SlackNotificationAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpMockEngine engine;
    private RelayProperties properties;
    private SlackNotificationAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new RelayProperties();
        properties.getSlack().setBaseUrl("https://slack.test/api");
        properties.getSlack().setBotToken("xoxb-test");

        adapter = new SlackNotificationAdapter(new FeignClientFactory(engine.client(), objectMapper), properties,
                new SlackModalBuilder());
        adapter.init();
    }

    @Test
    void shouldPostPromptWithReviewButtonInThread() throws Exception {
        engine.enqueueJson(200, "{\"ok\":true,\"ts\":\"200.2\"}");

        adapter.postConfirmation("C1", "U1", "100.1", "req_1", ActionKind.TICKET, "Ready to create");

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/chat.postMessage", request.path());
        assertEquals("Bearer xoxb-test", request.header("Authorization"));

        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("C1", body.get("channel").asText());
        assertEquals("100.1", body.get("thread_ts").asText());
        assertEquals("<@U1> Ready to create", body.at("/blocks/0/text/text").asText());
        JsonNode button = body.at("/blocks/1/elements/0");
        assertEquals("open_jira_modal", button.get("action_id").asText());
        assertEquals("req_1", button.get("value").asText());
    }

    @Test
    void shouldUseDocButtonForDocPrompt() throws Exception {
        engine.enqueueJson(200, "{\"ok\":true}");

        adapter.postConfirmation("C1", null, "100.1", "req_2", ActionKind.DOC, "Ready");

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("open_confluence_modal", body.at("/blocks/1/elements/0/action_id").asText());
        assertEquals("Ready", body.at("/blocks/0/text/text").asText());
    }

    @Test
    void shouldFailWhenSlackRejectsMessage() {
        engine.enqueueJson(200, "{\"ok\":false,\"error\":\"channel_not_found\"}");

        NotificationException error = assertThrows(NotificationException.class,
                () -> adapter.postMessage("C404", "1.1", "hello"));

        assertTrue(error.getMessage().contains("channel_not_found"));
    }

    @Test
    void shouldFailOnHttpError() {
        engine.enqueueJson(500, "{}");

        assertThrows(NotificationException.class, () -> adapter.postMessage("C1", null, "hello"));
    }

    @Test
    void shouldOmitThreadForTopLevelReply() throws Exception {
        engine.enqueueJson(200, "{\"ok\":true}");

        adapter.postMessage("C1", null, "hello");

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertFalse(body.has("thread_ts"));
        assertEquals("hello", body.get("text").asText());
    }

    @Test
    void shouldOpenReviewModalWithRequestIdAsMetadata() throws Exception {
        engine.enqueueJson(200, "{\"ok\":true}");
        ConfirmationRequest payload = ConfirmationRequest.builder()
                .kind(ActionKind.TICKET)
                .title("Fix login bug")
                .build();

        adapter.openReviewModal("trigger-1", new ActionRequest("req_1", ActionKind.TICKET, payload, Instant.now()));

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/api/views.open", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("trigger-1", body.get("trigger_id").asText());
        assertEquals("jira_ticket_modal", body.at("/view/callback_id").asText());
        assertEquals("req_1", body.at("/view/private_metadata").asText());
    }

    @Test
    void shouldRequireBotToken() {
        properties.getSlack().setBotToken("");

        assertThrows(MissingCredentialsException.class, () -> adapter.postMessage("C1", null, "hello"));
        assertNull(engine.takeRequest());
    }
}
