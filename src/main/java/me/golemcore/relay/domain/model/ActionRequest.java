package me.golemcore.relay.domain.model;

import java.time.Instant;

/**
 * Open confirmation prompt awaiting a human decision.
 *
 * @since 1.0
 */
public record ActionRequest(String id,ActionKind kind,ConfirmationRequest payload,Instant createdAt){}
