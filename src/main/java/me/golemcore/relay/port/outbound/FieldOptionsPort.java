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

import me.golemcore.relay.domain.model.FieldOption;

import java.util.List;
import java.util.Map;

/**
 * Port for looking up the selectable values of ticket category fields.
 */
public interface FieldOptionsPort {

    /**
     * Fetch option sets for a project.
     *
     * @param projectKey
     *            the ticketing project key
     * @return option set name (e.g. {@code pillars}) to its values; empty when
     *         the provider is not configured
     */
    Map<String, List<FieldOption>> fetch(String projectKey);
}
