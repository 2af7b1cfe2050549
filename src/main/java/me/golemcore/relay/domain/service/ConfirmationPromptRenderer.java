package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders the Slack mrkdwn summary shown in a confirmation prompt.
 */
@Component
public class ConfirmationPromptRenderer {

    private static final int DESCRIPTION_PREVIEW_LENGTH = 300;

    public String render(ConfirmationRequest request) {
        if (request.getKind() == ActionKind.DOC) {
            return renderDoc(request);
        }
        return renderTicket(request);
    }

    private String renderTicket(ConfirmationRequest request) {
        StringBuilder text = new StringBuilder()
                .append(":eyes: Ready to create Jira ticket: *").append(orDefault(request.getTitle(), "Untitled"))
                .append("*\n\n")
                .append("*Parent:* ").append(orDefault(request.getParent(), "None")).append('\n')
                .append("*Priority:* ").append(orDefault(request.getPriority(), "Medium")).append('\n')
                .append("*Assignee:* ").append(assignee(request));

        Map<String, String> categories = request.getCategoryFields();
        if (categories != null && !categories.isEmpty()) {
            StringJoiner line = new StringJoiner(" | ");
            categories.forEach((name, value) -> line.add("*" + capitalize(name) + ":* " + orDefault(value, "-")));
            text.append('\n').append(line);
        }
        return text.toString();
    }

    private String renderDoc(ConfirmationRequest request) {
        StringBuilder text = new StringBuilder()
                .append(":eyes: Ready to create Confluence doc: *").append(orDefault(request.getTitle(), "Untitled"))
                .append('*');
        String description = request.getDescription();
        if (description != null && !description.isBlank()) {
            String preview = description.length() > DESCRIPTION_PREVIEW_LENGTH
                    ? description.substring(0, DESCRIPTION_PREVIEW_LENGTH) + "..."
                    : description;
            text.append("\n\n>").append(preview.replace("\n", "\n>"));
        }
        return text.toString();
    }

    private String assignee(ConfirmationRequest request) {
        if (request.getAssigneeName() != null && !request.getAssigneeName().isBlank()) {
            return request.getAssigneeName();
        }
        return orDefault(request.getAssigneeEmail(), "Unassigned");
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
