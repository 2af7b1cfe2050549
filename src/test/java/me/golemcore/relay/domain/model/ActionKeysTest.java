package me.golemcore.relay.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionKeysTest {

    @Test
    void shouldDeriveActionIdFromMessageAndKind() {
        assertEquals("C1_100.1_ticket_confirmed", ActionKeys.actionId("C1", "100.1", ActionKind.TICKET));
        assertEquals("C1_100.1_doc_confirmed", ActionKeys.actionId("C1", "100.1", ActionKind.DOC));
    }

    @Test
    void shouldUseThreadTimestampForThreadKey() {
        assertEquals("C1_90.0", ActionKeys.threadKey("C1", "90.0", "100.1"));
    }

    @Test
    void shouldFallBackToMessageTimestampForTopLevelMessage() {
        assertEquals("C1_100.1", ActionKeys.threadKey("C1", null, "100.1"));
        assertEquals("C1_100.1", ActionKeys.threadKey("C1", " ", "100.1"));
    }

    @Test
    void shouldDeriveSameKeysFromRequest() {
        ConfirmationRequest request = ConfirmationRequest.builder()
                .kind(ActionKind.DOC)
                .channel("C7")
                .messageTs("5.5")
                .threadTs("1.1")
                .build();

        assertEquals("C7_5.5_doc_confirmed", ActionKeys.actionId(request));
        assertEquals("C7_1.1", ActionKeys.threadKey(request));
    }
}
