package me.golemcore.relay.domain.store;

import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RequestRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private MutableClock clock;
    private RequestRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new RequestRegistry(clock, Duration.ofHours(1));
    }

    @Test
    void shouldReturnEmptyForIdNeverWritten() {
        assertTrue(registry.get("req_unknown").isEmpty());
    }

    @Test
    void shouldRoundTripPayload() {
        ConfirmationRequest payload = ticket("Fix login bug");
        registry.put("req_1", payload);

        Optional<ActionRequest> stored = registry.get("req_1");

        assertTrue(stored.isPresent());
        assertEquals("req_1", stored.get().id());
        assertEquals(ActionKind.TICKET, stored.get().kind());
        assertEquals("Fix login bug", stored.get().payload().getTitle());
        assertEquals(T0, stored.get().createdAt());
    }

    @Test
    void shouldStillServeEntryBeforeTtl() {
        registry.put("req_1", ticket("a"));
        clock.advance(Duration.ofMinutes(59));

        assertTrue(registry.get("req_1").isPresent());
    }

    @Test
    void shouldServeEntryExactlyAtTtl() {
        registry.put("req_1", ticket("a"));
        clock.advance(Duration.ofHours(1));

        assertTrue(registry.get("req_1").isPresent());
    }

    @Test
    void shouldExpireEntryAfterTtlWithoutAnyWrite() {
        registry.put("req_1", ticket("a"));
        clock.advance(Duration.ofMinutes(61));

        assertTrue(registry.get("req_1").isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldSweepExpiredEntriesOnPut() {
        registry.put("req_old", ticket("old"));
        clock.advance(Duration.ofMinutes(90));
        registry.put("req_new", ticket("new"));

        assertEquals(1, registry.size());
        assertTrue(registry.get("req_old").isEmpty());
        assertTrue(registry.get("req_new").isPresent());
    }

    @Test
    void shouldOverwriteEntryWithSameId() {
        registry.put("req_1", ticket("first"));
        clock.advance(Duration.ofMinutes(30));
        registry.put("req_1", ticket("second"));

        ActionRequest stored = registry.get("req_1").orElseThrow();
        assertEquals("second", stored.payload().getTitle());
        assertEquals(T0.plus(Duration.ofMinutes(30)), stored.createdAt());
    }

    @Test
    void shouldRemoveEntry() {
        registry.put("req_1", ticket("a"));
        registry.remove("req_1");
        registry.remove("req_1");

        assertTrue(registry.get("req_1").isEmpty());
    }

    private static ConfirmationRequest ticket(String title) {
        return ConfirmationRequest.builder()
                .kind(ActionKind.TICKET)
                .title(title)
                .channel("C1")
                .messageTs("100.1")
                .build();
    }
}
