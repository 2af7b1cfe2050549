package me.golemcore.relay.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to prompt for, and later perform, one artifact creation.
 *
 * <p>
 * Sent by the initiator when a confirmation prompt should be posted, kept in
 * the request registry while the prompt is open, and copied (with the
 * reviewer's edits applied) into the queued action once confirmed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmationRequest {

    private static final String ADDITIONAL_CONTEXT_SEPARATOR = "\n\n---\n\nAdditional Context:\n";

    private String requestId;
    private ActionKind kind;

    private String title;
    private String description;

    private String assigneeName;
    private String assigneeEmail;
    private String reporterName;
    private String reporterEmail;

    /** Parent issue key, e.g. {@code AMP-12345}. */
    private String parent;
    private String priority;
    private String projectKey;

    /** Category field name (e.g. {@code pillar}) to chosen value. */
    @Builder.Default
    private Map<String, String> categoryFields = new LinkedHashMap<>();

    private String channel;

    @JsonAlias({ "messageTimestamp" })
    private String messageTs;

    @JsonAlias({ "threadTimestamp" })
    private String threadTs;

    private String user;
    private String teamId;
    private Instant createdAt;

    /** Option set name (e.g. {@code pillars}) to selectable values. */
    @Builder.Default
    private Map<String, List<FieldOption>> fieldOptions = new HashMap<>();

    /**
     * Root timestamp of the conversation: the thread timestamp when the message
     * was posted in a thread, otherwise the message itself.
     */
    @JsonIgnore
    public String getRootTs() {
        return threadTs != null && !threadTs.isBlank() ? threadTs : messageTs;
    }

    /**
     * Returns a copy with every non-blank edited value replacing the stored one.
     */
    public ConfirmationRequest withEdits(ConfirmationEdits edits) {
        if (edits == null) {
            return toBuilder().build();
        }
        Map<String, String> mergedCategories = new LinkedHashMap<>(
                categoryFields != null ? categoryFields : Map.of());
        if (edits.getCategoryFields() != null) {
            edits.getCategoryFields().forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    mergedCategories.put(name, value);
                }
            });
        }
        String editedDescription = pick(edits.getDescription(), description);
        String context = edits.getAdditionalContext();
        if (context != null && !context.isBlank()) {
            editedDescription = (editedDescription != null ? editedDescription : "")
                    + ADDITIONAL_CONTEXT_SEPARATOR + context;
        }
        return toBuilder()
                .title(pick(edits.getTitle(), title))
                .description(editedDescription)
                .parent(pick(edits.getParent(), parent))
                .priority(pick(edits.getPriority(), priority))
                .assigneeName(pick(edits.getAssigneeName(), assigneeName))
                .assigneeEmail(pick(edits.getAssigneeEmail(), assigneeEmail))
                .categoryFields(mergedCategories)
                .build();
    }

    private static String pick(String edited, String original) {
        return edited != null && !edited.isBlank() ? edited : original;
    }
}
