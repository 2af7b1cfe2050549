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

/**
 * Identifiers shared between the messages and views we post and the
 * interaction payloads Slack sends back.
 */
public final class SlackBlockIds {

    public static final String OPEN_TICKET_MODAL_ACTION = "open_jira_modal";
    public static final String OPEN_DOC_MODAL_ACTION = "open_confluence_modal";

    public static final String TICKET_MODAL_CALLBACK = "jira_ticket_modal";
    public static final String DOC_MODAL_CALLBACK = "confluence_context_modal";

    public static final String TICKET_TITLE_BLOCK = "ticket_title";
    public static final String TICKET_DESCRIPTION_BLOCK = "ticket_description";
    public static final String PARENT_BLOCK = "parent_ticket";
    public static final String PRIORITY_BLOCK = "priority";
    public static final String ASSIGNEE_NAME_BLOCK = "assignee_name";
    public static final String ASSIGNEE_EMAIL_BLOCK = "assignee_email";

    public static final String DOC_TITLE_BLOCK = "doc_title";
    public static final String ADDITIONAL_CONTEXT_BLOCK = "additional_context";

    public static final String TITLE_INPUT = "title_input";
    public static final String DESCRIPTION_INPUT = "description_input";
    public static final String PARENT_INPUT = "parent_input";
    public static final String PRIORITY_SELECT = "priority_select";
    public static final String ASSIGNEE_NAME_INPUT = "assignee_name_input";
    public static final String ASSIGNEE_EMAIL_INPUT = "assignee_email_input";
    public static final String CONTEXT_INPUT = "context_input";

    /** Category blocks use the field name as block id and these suffixes. */
    public static final String CATEGORY_SELECT_SUFFIX = "_select";
    public static final String CATEGORY_INPUT_SUFFIX = "_input";

    private SlackBlockIds() {
    }

    public static String openModalAction(ActionKind kind) {
        return kind == ActionKind.DOC ? OPEN_DOC_MODAL_ACTION
                : OPEN_TICKET_MODAL_ACTION;
    }
}
