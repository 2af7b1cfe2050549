package me.golemcore.relay.adapter.outbound.slack;

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

import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionRequest;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.FieldOption;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds Block Kit payloads: the prompt message blocks and the review modals.
 *
 * <p>
 * Modals carry the request id in {@code private_metadata}; submissions are
 * read back by block id and action id (see {@link SlackBlockIds}).
 */
@Component
public class SlackModalBuilder {

    static final List<String> PRIORITIES = List.of("Highest", "High", "Medium", "Low", "Lowest");
    private static final String DEFAULT_PRIORITY = "Medium";
    private static final int MAX_SELECT_OPTIONS = 100;

    public List<Map<String, Object>> promptBlocks(String user, String requestId, ActionKind kind,
            String renderedPrompt) {
        String mention = user != null && !user.isBlank() ? "<@" + user + "> " : "";
        String buttonText = kind == ActionKind.DOC ? ":memo: Review & Create Doc" : ":memo: Review & Create Ticket";

        Map<String, Object> button = new LinkedHashMap<>();
        button.put("type", "button");
        button.put("text", plainText(buttonText));
        button.put("style", "primary");
        button.put("action_id", SlackBlockIds.openModalAction(kind));
        button.put("value", requestId);

        return List.of(
                Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", mention + renderedPrompt)),
                Map.of("type", "actions", "elements", List.of(button)));
    }

    public Map<String, Object> reviewModal(ActionRequest request) {
        return request.kind() == ActionKind.DOC
                ? docModal(request.id(), request.payload())
                : ticketModal(request.id(), request.payload());
    }

    // ==================== Ticket ====================

    Map<String, Object> ticketModal(String requestId, ConfirmationRequest payload) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(textInput(SlackBlockIds.TICKET_TITLE_BLOCK, "Summary", SlackBlockIds.TITLE_INPUT,
                payload.getTitle(), "Enter ticket summary...", false, false));
        blocks.add(textInput(SlackBlockIds.TICKET_DESCRIPTION_BLOCK, "Description", SlackBlockIds.DESCRIPTION_INPUT,
                payload.getDescription(), "Enter ticket description...", true, true));
        blocks.add(textInput(SlackBlockIds.PARENT_BLOCK, "Parent Ticket", SlackBlockIds.PARENT_INPUT,
                payload.getParent(), "e.g., PROJ-123", false, true));
        blocks.add(prioritySelect(payload.getPriority()));
        blocks.add(textInput(SlackBlockIds.ASSIGNEE_NAME_BLOCK, "Assignee Name", SlackBlockIds.ASSIGNEE_NAME_INPUT,
                payload.getAssigneeName(), "e.g., Jane Doe", false, true));
        blocks.add(textInput(SlackBlockIds.ASSIGNEE_EMAIL_BLOCK, "Assignee Email",
                SlackBlockIds.ASSIGNEE_EMAIL_INPUT, payload.getAssigneeEmail(), "e.g., jane@example.com", false,
                true));

        for (String category : categoryNames(payload)) {
            String current = payload.getCategoryFields() != null ? payload.getCategoryFields().get(category) : null;
            List<FieldOption> options = optionsFor(payload.getFieldOptions(), category);
            blocks.add(options.isEmpty()
                    ? textInput(category, label(category), category + SlackBlockIds.CATEGORY_INPUT_SUFFIX, current,
                            "Enter " + category + "...", false, true)
                    : categorySelect(category, options, current));
        }

        return view(SlackBlockIds.TICKET_MODAL_CALLBACK, requestId, "Create Jira Ticket", "Create Jira", blocks);
    }

    private Map<String, Object> prioritySelect(String priority) {
        String initial = priority != null && PRIORITIES.contains(priority) ? priority : DEFAULT_PRIORITY;
        List<Map<String, Object>> options = new ArrayList<>();
        for (String value : PRIORITIES) {
            options.add(option(value));
        }
        Map<String, Object> element = new LinkedHashMap<>();
        element.put("type", "static_select");
        element.put("action_id", SlackBlockIds.PRIORITY_SELECT);
        element.put("initial_option", option(initial));
        element.put("options", options);
        return inputBlock(SlackBlockIds.PRIORITY_BLOCK, "Priority", element, false);
    }

    private Map<String, Object> categorySelect(String category, List<FieldOption> fieldOptions, String current) {
        List<Map<String, Object>> options = new ArrayList<>();
        boolean currentListed = false;
        for (FieldOption fieldOption : fieldOptions) {
            if (options.size() == MAX_SELECT_OPTIONS) {
                break;
            }
            options.add(option(fieldOption.value()));
            currentListed |= fieldOption.value().equals(current);
        }
        Map<String, Object> element = new LinkedHashMap<>();
        element.put("type", "static_select");
        element.put("action_id", category + SlackBlockIds.CATEGORY_SELECT_SUFFIX);
        element.put("placeholder", plainText("Select " + category + "..."));
        if (currentListed) {
            element.put("initial_option", option(current));
        }
        element.put("options", options);
        return inputBlock(category, label(category), element, true);
    }

    // ==================== Doc ====================

    Map<String, Object> docModal(String requestId, ConfirmationRequest payload) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of("type", "section", "text", Map.of("type", "mrkdwn",
                "text", "The conversation so far will be used as the page body. Add anything it is missing.")));
        blocks.add(textInput(SlackBlockIds.DOC_TITLE_BLOCK, "Document Title", SlackBlockIds.TITLE_INPUT,
                payload.getTitle(), "Enter document title...", false, false));
        blocks.add(textInput(SlackBlockIds.ADDITIONAL_CONTEXT_BLOCK, "Additional Context",
                SlackBlockIds.CONTEXT_INPUT, null, "Anything else the document should cover...", true, true));
        return view(SlackBlockIds.DOC_MODAL_CALLBACK, requestId, "Create Confluence Doc", "Create Doc", blocks);
    }

    // ==================== Helpers ====================

    private static Set<String> categoryNames(ConfirmationRequest payload) {
        Set<String> names = new LinkedHashSet<>();
        if (payload.getCategoryFields() != null) {
            names.addAll(payload.getCategoryFields().keySet());
        }
        if (payload.getFieldOptions() != null) {
            for (String setName : payload.getFieldOptions().keySet()) {
                names.add(singular(setName));
            }
        }
        return names;
    }

    /**
     * Option sets may be keyed by the field name ({@code pillar}) or its plural
     * ({@code pillars}).
     */
    static List<FieldOption> optionsFor(Map<String, List<FieldOption>> fieldOptions, String category) {
        if (fieldOptions == null) {
            return List.of();
        }
        List<FieldOption> options = fieldOptions.get(category);
        if (options == null) {
            options = fieldOptions.get(category + "s");
        }
        return options != null ? options : List.of();
    }

    private static String singular(String setName) {
        return setName.length() > 1 && setName.endsWith("s")
                ? setName.substring(0, setName.length() - 1)
                : setName;
    }

    private static Map<String, Object> view(String callbackId, String requestId, String title, String submit,
            List<Map<String, Object>> blocks) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", "modal");
        view.put("callback_id", callbackId);
        view.put("private_metadata", requestId);
        view.put("title", plainText(title));
        view.put("submit", plainText(submit));
        view.put("close", plainText("Cancel"));
        view.put("blocks", blocks);
        return view;
    }

    private static Map<String, Object> textInput(String blockId, String label, String actionId, String initial,
            String placeholder, boolean multiline, boolean optional) {
        Map<String, Object> element = new LinkedHashMap<>();
        element.put("type", "plain_text_input");
        element.put("action_id", actionId);
        if (multiline) {
            element.put("multiline", true);
        }
        if (initial != null && !initial.isBlank()) {
            element.put("initial_value", initial);
        }
        element.put("placeholder", plainText(placeholder));
        return inputBlock(blockId, label, element, optional);
    }

    private static Map<String, Object> inputBlock(String blockId, String label, Map<String, Object> element,
            boolean optional) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "input");
        block.put("block_id", blockId);
        block.put("label", plainText(label));
        block.put("element", element);
        block.put("optional", optional);
        return block;
    }

    private static Map<String, Object> option(String value) {
        return Map.of("text", plainText(value), "value", value);
    }

    private static Map<String, Object> plainText(String text) {
        return Map.of("type", "plain_text", "text", text);
    }

    private static String label(String name) {
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
