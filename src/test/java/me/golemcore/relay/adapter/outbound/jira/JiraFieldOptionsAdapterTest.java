package me.golemcore.relay.adapter.outbound.jira;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.FieldOption;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JiraFieldOptionsAdapterTest {

    private OkHttpMockEngine engine;
    private RelayProperties properties;
    private JiraFieldOptionsAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new RelayProperties();
        properties.getJira().setFieldOptionsUrl("https://options.example.com/api/jira-field-options");
        adapter = new JiraFieldOptionsAdapter(properties, engine.client(), new ObjectMapper());
    }

    @Test
    void shouldParseOptionSets() {
        engine.enqueueJson(200, """
                {"success": true,
                 "pillars": [{"id": "1", "value": "Growth"}, {"id": "2", "value": "Core"}],
                 "pods": ["Identity", "Billing"]}
                """);

        Map<String, List<FieldOption>> options = adapter.fetch("PROJ");

        assertEquals(2, options.size());
        assertEquals(new FieldOption("1", "Growth"), options.get("pillars").get(0));
        assertEquals(new FieldOption("Billing", "Billing"), options.get("pods").get(1));

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("{\"projectKey\":\"PROJ\"}", request.body());
    }

    @Test
    void shouldReturnEmptyWhenNotConfigured() {
        properties.getJira().setFieldOptionsUrl("");

        assertTrue(adapter.fetch("PROJ").isEmpty());
        assertNull(engine.takeRequest());
    }

    @Test
    void shouldReturnEmptyOnHttpError() {
        engine.enqueueJson(503, "{}");

        assertTrue(adapter.fetch("PROJ").isEmpty());
    }

    @Test
    void shouldReturnEmptyOnNetworkFailure() {
        engine.enqueueFailure(new IOException("connection reset"));

        assertTrue(adapter.fetch("PROJ").isEmpty());
    }
}
