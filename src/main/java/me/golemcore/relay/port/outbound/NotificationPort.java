package me.golemcore.relay.port.outbound;

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

/**
 * Port for talking to the conversation where an action was requested.
 */
public interface NotificationPort {

    /**
     * Post a confirmation prompt into the thread. The prompt carries the request
     * id so the later confirmation can find the stored request.
     *
     * @param channel
     *            the channel of the source message
     * @param user
     *            the user who asked for the action
     * @param threadTs
     *            the thread to reply into
     * @param requestId
     *            the id of the stored request
     * @param kind
     *            what will be created on confirmation
     * @param renderedPrompt
     *            human-readable summary of the proposed action
     * @throws me.golemcore.relay.domain.exception.NotificationException
     *             if the platform rejected the message
     * @throws me.golemcore.relay.domain.exception.MissingCredentialsException
     *             if no bot token is configured
     */
    void postConfirmation(String channel, String user, String threadTs, String requestId,
            ActionKind kind, String renderedPrompt);

    /**
     * Post a plain reply into a thread.
     */
    void postMessage(String channel, String threadTs, String text);

    /**
     * Open the review form for a stored request in response to a user action.
     */
    void openReviewModal(String triggerId, ActionRequest request);
}
