package me.golemcore.relay.adapter.inbound.slack;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.relay.adapter.outbound.slack.SlackBlockIds;
import me.golemcore.relay.domain.model.ConfirmationEdits;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads reviewer edits out of a submitted modal's {@code view.state.values}.
 * Missing or empty inputs come back as {@code null} so the proposed values
 * stay in place.
 */
final class SlackViewStateParser {

    private static final Set<String> TICKET_BLOCKS = Set.of(
            SlackBlockIds.TICKET_TITLE_BLOCK,
            SlackBlockIds.TICKET_DESCRIPTION_BLOCK,
            SlackBlockIds.PARENT_BLOCK,
            SlackBlockIds.PRIORITY_BLOCK,
            SlackBlockIds.ASSIGNEE_NAME_BLOCK,
            SlackBlockIds.ASSIGNEE_EMAIL_BLOCK);

    private SlackViewStateParser() {
    }

    static ConfirmationEdits ticketEdits(JsonNode values) {
        Map<String, String> categories = new LinkedHashMap<>();
        Iterator<String> blockIds = values.fieldNames();
        while (blockIds.hasNext()) {
            String blockId = blockIds.next();
            if (TICKET_BLOCKS.contains(blockId)) {
                continue;
            }
            String value = selected(values, blockId, blockId + SlackBlockIds.CATEGORY_SELECT_SUFFIX);
            if (value == null) {
                value = text(values, blockId, blockId + SlackBlockIds.CATEGORY_INPUT_SUFFIX);
            }
            if (value != null) {
                categories.put(blockId, value);
            }
        }

        return ConfirmationEdits.builder()
                .title(text(values, SlackBlockIds.TICKET_TITLE_BLOCK, SlackBlockIds.TITLE_INPUT))
                .description(text(values, SlackBlockIds.TICKET_DESCRIPTION_BLOCK, SlackBlockIds.DESCRIPTION_INPUT))
                .parent(text(values, SlackBlockIds.PARENT_BLOCK, SlackBlockIds.PARENT_INPUT))
                .priority(selected(values, SlackBlockIds.PRIORITY_BLOCK, SlackBlockIds.PRIORITY_SELECT))
                .assigneeName(text(values, SlackBlockIds.ASSIGNEE_NAME_BLOCK, SlackBlockIds.ASSIGNEE_NAME_INPUT))
                .assigneeEmail(text(values, SlackBlockIds.ASSIGNEE_EMAIL_BLOCK, SlackBlockIds.ASSIGNEE_EMAIL_INPUT))
                .categoryFields(categories)
                .build();
    }

    static ConfirmationEdits docEdits(JsonNode values) {
        return ConfirmationEdits.builder()
                .title(text(values, SlackBlockIds.DOC_TITLE_BLOCK, SlackBlockIds.TITLE_INPUT))
                .additionalContext(text(values, SlackBlockIds.ADDITIONAL_CONTEXT_BLOCK, SlackBlockIds.CONTEXT_INPUT))
                .build();
    }

    private static String text(JsonNode values, String blockId, String actionId) {
        return nonBlank(values.path(blockId).path(actionId).path("value"));
    }

    private static String selected(JsonNode values, String blockId, String actionId) {
        return nonBlank(values.path(blockId).path(actionId).path("selected_option").path("value"));
    }

    private static String nonBlank(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
