package me.golemcore.relay.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ActionKindTest {

    @ParameterizedTest
    @CsvSource({
            "ticket, TICKET",
            "jira, TICKET",
            "Ticket, TICKET",
            "doc, DOC",
            "confluence, DOC",
            "' DOC ', DOC"
    })
    void shouldParseKnownKeys(String input, ActionKind expected) {
        assertEquals(expected, ActionKind.fromKey(input));
    }

    @Test
    void shouldReturnNullForBlankKey() {
        assertNull(ActionKind.fromKey(null));
        assertNull(ActionKind.fromKey(""));
    }

    @Test
    void shouldRejectUnknownKey() {
        assertThrows(IllegalArgumentException.class, () -> ActionKind.fromKey("email"));
    }
}
