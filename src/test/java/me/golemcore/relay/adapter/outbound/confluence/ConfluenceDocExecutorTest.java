package me.golemcore.relay.adapter.outbound.confluence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.exception.ActionExecutionException;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.CreatedArtifact;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfluenceDocExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpMockEngine engine;
    private RelayProperties properties;
    private ConfluenceDocExecutor executor;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new RelayProperties();
        properties.getConfluence().setBaseUrl("https://wiki.example.com/wiki");
        properties.getConfluence().setEmail("bot@example.com");
        properties.getConfluence().setApiToken("secret");
        properties.getConfluence().setSpaceKey("ENG");

        executor = new ConfluenceDocExecutor(new FeignClientFactory(engine.client(), objectMapper), properties);
        executor.init();
    }

    @Test
    void shouldCreatePageInConfiguredSpace() throws Exception {
        engine.enqueueJson(200, """
                {"id": "9001", "title": "Outage notes",
                 "_links": {"base": "https://wiki.example.com/wiki", "webui": "/spaces/ENG/pages/9001"}}
                """);

        CreatedArtifact artifact = executor.create(ConfirmationRequest.builder()
                .kind(ActionKind.DOC)
                .title("Outage notes")
                .description("Login failed for <all> users.\n\nRoot cause: expired cert.")
                .build());

        assertEquals("9001", artifact.externalId());
        assertEquals("https://wiki.example.com/wiki/spaces/ENG/pages/9001", artifact.url());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/wiki/rest/api/content", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("page", body.get("type").asText());
        assertEquals("ENG", body.at("/space/key").asText());
        assertEquals("<p>Login failed for &lt;all&gt; users.</p><p>Root cause: expired cert.</p>",
                body.at("/body/storage/value").asText());
    }

    @Test
    void shouldBuildFallbackLinkWithoutWebUi() {
        engine.enqueueJson(200, "{\"id\":\"9002\"}");

        CreatedArtifact artifact = executor.create(ConfirmationRequest.builder()
                .kind(ActionKind.DOC)
                .title("t")
                .build());

        assertEquals("https://wiki.example.com/wiki/pages/viewpage.action?pageId=9002", artifact.url());
    }

    @Test
    void shouldReportRejectedPage() {
        engine.enqueueJson(400, "{\"message\":\"A page with this title already exists\"}");

        ActionExecutionException error = assertThrows(ActionExecutionException.class,
                () -> executor.create(ConfirmationRequest.builder().kind(ActionKind.DOC).title("t").build()));

        assertTrue(error.getMessage().contains("already exists"));
    }

    @Test
    void shouldRequireSpaceKey() {
        properties.getConfluence().setSpaceKey(" ");

        assertThrows(MissingCredentialsException.class,
                () -> executor.create(ConfirmationRequest.builder().kind(ActionKind.DOC).title("t").build()));
    }

    @Test
    void shouldRenderEmptyBodyForMissingDescription() {
        assertEquals("<p></p>", ConfluenceDocExecutor.toStorageFormat(null));
        assertEquals("<p>a<br/>b</p>", ConfluenceDocExecutor.toStorageFormat("a\nb"));
    }
}
