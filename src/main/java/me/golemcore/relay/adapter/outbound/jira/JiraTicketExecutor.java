package me.golemcore.relay.adapter.outbound.jira;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.ActionExecutionException;
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ConfirmationRequest;
import me.golemcore.relay.domain.model.CreatedArtifact;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.port.outbound.ActionExecutorPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates Jira issues through the REST API v2.
 *
 * <p>
 * The assignee is resolved from its e-mail address; an unknown address
 * creates the issue unassigned. Category fields are written to the custom
 * fields configured under {@code relay.jira.category-field-ids}; categories
 * without a mapping are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JiraTicketExecutor implements ActionExecutorPort {

    private final FeignClientFactory feignClientFactory;
    private final RelayProperties properties;

    private JiraApi jiraApi;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getJira().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("[Jira] No base URL configured, ticket creation disabled");
            return;
        }
        this.jiraApi = feignClientFactory.create(JiraApi.class, trimSlash(baseUrl));
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.TICKET;
    }

    @Override
    public CreatedArtifact create(ConfirmationRequest request) {
        RelayProperties.JiraProperties jira = properties.getJira();
        if (jiraApi == null || isBlank(jira.getEmail()) || isBlank(jira.getApiToken())) {
            throw new MissingCredentialsException("Jira credentials");
        }
        String projectKey = !isBlank(request.getProjectKey()) ? request.getProjectKey() : jira.getDefaultProjectKey();
        if (isBlank(projectKey)) {
            throw new ActionExecutionException("No Jira project key given and none configured");
        }

        String auth = basicAuth(jira.getEmail(), jira.getApiToken());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project", Map.of("key", projectKey));
        fields.put("summary", request.getTitle());
        fields.put("issuetype", Map.of("name", jira.getIssueType()));
        if (!isBlank(request.getDescription())) {
            fields.put("description", request.getDescription());
        }
        if (!isBlank(request.getPriority())) {
            fields.put("priority", Map.of("name", request.getPriority()));
        }
        if (!isBlank(request.getParent())) {
            fields.put("parent", Map.of("key", request.getParent().trim()));
        }
        findAccountId(auth, request.getAssigneeEmail())
                .ifPresent(accountId -> fields.put("assignee", Map.of("accountId", accountId)));
        findAccountId(auth, request.getReporterEmail())
                .ifPresent(accountId -> fields.put("reporter", Map.of("accountId", accountId)));
        putCategoryFields(fields, request.getCategoryFields(), jira.getCategoryFieldIds());

        CreatedIssue issue;
        try {
            issue = jiraApi.createIssue(auth, Map.of("fields", fields));
        } catch (FeignException e) {
            log.error("[Jira] Issue creation in {} failed with HTTP {}", projectKey, e.status());
            throw new ActionExecutionException("Jira rejected the ticket (HTTP " + e.status() + "): "
                    + e.contentUTF8(), e);
        }
        if (issue == null || isBlank(issue.getKey())) {
            throw new ActionExecutionException("Jira returned no issue key");
        }

        String url = trimSlash(jira.getBaseUrl()) + "/browse/" + issue.getKey();
        log.info("[Jira] Created {} in {}", issue.getKey(), projectKey);
        return new CreatedArtifact(issue.getKey(), url);
    }

    private Optional<String> findAccountId(String auth, String email) {
        if (isBlank(email)) {
            return Optional.empty();
        }
        try {
            List<JiraUser> users = jiraApi.searchUsers(auth, email.trim());
            if (users == null || users.isEmpty()) {
                log.warn("[Jira] No user found for {}", email);
                return Optional.empty();
            }
            return Optional.ofNullable(users.get(0).getAccountId());
        } catch (FeignException e) {
            log.warn("[Jira] User lookup for {} failed with HTTP {}", email, e.status());
            return Optional.empty();
        }
    }

    private static void putCategoryFields(Map<String, Object> fields, Map<String, String> values,
            Map<String, String> fieldIds) {
        if (values == null || fieldIds == null) {
            return;
        }
        values.forEach((name, value) -> {
            String fieldId = fieldIds.get(name);
            if (fieldId == null) {
                log.debug("[Jira] No custom field configured for category '{}', skipping", name);
            } else if (!isBlank(value)) {
                fields.put(fieldId, Map.of("value", value));
            }
        });
    }

    private static String basicAuth(String email, String apiToken) {
        return Base64.getEncoder().encodeToString((email + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Feign API interface
    interface JiraApi {
        @RequestLine("POST /rest/api/2/issue")
        @Headers({ "Content-Type: application/json", "Authorization: Basic {auth}" })
        CreatedIssue createIssue(@Param("auth") String auth, Map<String, Object> body);

        @RequestLine("GET /rest/api/2/user/search?query={query}")
        @Headers("Authorization: Basic {auth}")
        List<JiraUser> searchUsers(@Param("auth") String auth, @Param("query") String query);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CreatedIssue {
        private String id;
        private String key;
        private String self;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JiraUser {
        private String accountId;
        private String emailAddress;
        private String displayName;
    }
}
