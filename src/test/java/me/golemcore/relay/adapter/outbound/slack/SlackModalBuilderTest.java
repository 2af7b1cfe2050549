package me.golemcore.relay.adapter.outbound.slack;

import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.FieldOption;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlackModalBuilderTest {

    private final SlackModalBuilder builder = new SlackModalBuilder();

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildTicketModalWithSelectForKnownOptions() {
        ConfirmationRequest payload = ConfirmationRequest.builder()
                .kind(ActionKind.TICKET)
                .title("Fix login bug")
                .priority("High")
                .categoryFields(new LinkedHashMap<>(Map.of("pillar", "Growth")))
                .fieldOptions(Map.of("pillars", List.of(new FieldOption("1", "Growth"), new FieldOption("2", "Core"))))
                .build();

        Map<String, Object> view = builder.ticketModal("req_1", payload);

        assertEquals("jira_ticket_modal", view.get("callback_id"));
        assertEquals("req_1", view.get("private_metadata"));
        List<Map<String, Object>> blocks = (List<Map<String, Object>>) view.get("blocks");
        Map<String, Object> pillar = findBlock(blocks, "pillar");
        Map<String, Object> element = (Map<String, Object>) pillar.get("element");
        assertEquals("static_select", element.get("type"));
        assertEquals("pillar_select", element.get("action_id"));
        assertEquals(2, ((List<?>) element.get("options")).size());
        assertEquals("Growth", ((Map<String, Object>) element.get("initial_option")).get("value"));

        Map<String, Object> priority = (Map<String, Object>) findBlock(blocks, "priority").get("element");
        assertEquals("High", ((Map<String, Object>) priority.get("initial_option")).get("value"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFallBackToTextInputWithoutOptions() {
        ConfirmationRequest payload = ConfirmationRequest.builder()
                .kind(ActionKind.TICKET)
                .title("t")
                .categoryFields(new LinkedHashMap<>(Map.of("pod", "Identity")))
                .build();

        List<Map<String, Object>> blocks = (List<Map<String, Object>>) builder.ticketModal("req_1", payload)
                .get("blocks");

        Map<String, Object> element = (Map<String, Object>) findBlock(blocks, "pod").get("element");
        assertEquals("plain_text_input", element.get("type"));
        assertEquals("pod_input", element.get("action_id"));
        assertEquals("Identity", element.get("initial_value"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDefaultUnknownPriorityToMedium() {
        ConfirmationRequest payload = ConfirmationRequest.builder()
                .kind(ActionKind.TICKET)
                .title("t")
                .priority("P0")
                .build();

        List<Map<String, Object>> blocks = (List<Map<String, Object>>) builder.ticketModal("req_1", payload)
                .get("blocks");

        Map<String, Object> element = (Map<String, Object>) findBlock(blocks, "priority").get("element");
        assertEquals("Medium", ((Map<String, Object>) element.get("initial_option")).get("value"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildDocModalWithContextInput() {
        ConfirmationRequest payload = ConfirmationRequest.builder()
                .kind(ActionKind.DOC)
                .title("Outage notes")
                .build();

        Map<String, Object> view = builder.docModal("req_9", payload);

        assertEquals("confluence_context_modal", view.get("callback_id"));
        List<Map<String, Object>> blocks = (List<Map<String, Object>>) view.get("blocks");
        Map<String, Object> title = (Map<String, Object>) findBlock(blocks, "doc_title").get("element");
        assertEquals("Outage notes", title.get("initial_value"));
        assertNotNull(findBlock(blocks, "additional_context"));
    }

    @Test
    void shouldFindOptionsBySingularOrPluralName() {
        Map<String, List<FieldOption>> options = Map.of(
                "pods", List.of(new FieldOption("1", "Identity")),
                "pillar", List.of(new FieldOption("2", "Growth")));

        assertEquals(1, SlackModalBuilder.optionsFor(options, "pod").size());
        assertEquals(1, SlackModalBuilder.optionsFor(options, "pillar").size());
        assertTrue(SlackModalBuilder.optionsFor(options, "team").isEmpty());
        assertTrue(SlackModalBuilder.optionsFor(null, "pod").isEmpty());
    }

    private static Map<String, Object> findBlock(List<Map<String, Object>> blocks, String blockId) {
        return blocks.stream()
                .filter(block -> blockId.equals(block.get("block_id")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No block " + blockId));
    }
}
