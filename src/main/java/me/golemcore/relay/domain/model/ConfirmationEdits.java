package me.golemcore.relay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Values changed by the reviewer in the review form. Blank values keep what the
 * initiator proposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmationEdits {

    private String title;
    private String description;
    private String parent;
    private String priority;
    private String assigneeName;
    private String assigneeEmail;

    /** Free text appended to the description under its own heading. */
    private String additionalContext;

    @Builder.Default
    private Map<String, String> categoryFields = new HashMap<>();
}
