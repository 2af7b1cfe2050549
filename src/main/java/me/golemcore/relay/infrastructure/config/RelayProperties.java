package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link WorkflowProperties} - confirmation store horizon</li>
 * <li>{@link ApiProperties} - bearer token for the relay's own endpoints</li>
 * <li>{@link SlackProperties} - bot token and request signing</li>
 * <li>{@link JiraProperties} - ticket creation</li>
 * <li>{@link ConfluenceProperties} - page creation</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private HttpProperties http = new HttpProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private ApiProperties api = new ApiProperties();
    private SlackProperties slack = new SlackProperties();
    private JiraProperties jira = new JiraProperties();
    private ConfluenceProperties confluence = new ConfluenceProperties();

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
        /** Bound on a whole Slack, Jira or Confluence call. */
        private Duration callTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class WorkflowProperties {
        /** Age after which prompts and queued actions are forgotten. */
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class ApiProperties {
        /** Optional bearer token; blank leaves the endpoints open. */
        private String token = "";
    }

    @Data
    public static class SlackProperties {
        private String baseUrl = "https://slack.com/api";
        private String botToken = "";
        private String signingSecret = "";
        private boolean verifySignatures = true;
        private Duration maxClockSkew = Duration.ofMinutes(5);
    }

    @Data
    public static class JiraProperties {
        private String baseUrl = "";
        private String email = "";
        private String apiToken = "";
        private String defaultProjectKey = "";
        private String issueType = "Task";
        private String fieldOptionsUrl = "";
        /** Category field name (e.g. {@code pillar}) to Jira custom field id. */
        private Map<String, String> categoryFieldIds = new HashMap<>();
    }

    @Data
    public static class ConfluenceProperties {
        private String baseUrl = "";
        private String email = "";
        private String apiToken = "";
        private String spaceKey = "";
    }
}
