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
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.CreatedArtifact;

/**
 * Port for the external side effect of a confirmed action. One implementation
 * exists per {@link ActionKind}.
 */
public interface ActionExecutorPort {

    ActionKind getKind();

    /**
     * Create the artifact described by the confirmed request.
     *
     * @throws me.golemcore.relay.domain.exception.ActionExecutionException
     *             if the external system did not create it
     * @throws me.golemcore.relay.domain.exception.MissingCredentialsException
     *             if the external system is not configured
     */
    CreatedArtifact create(ConfirmationRequest request);
}
