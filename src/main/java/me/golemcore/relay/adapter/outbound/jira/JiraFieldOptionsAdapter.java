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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.FieldOption;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.FieldOptionsPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches category option sets (e.g. pillars and pods) for a Jira project.
 *
 * <p>
 * The endpoint answers {@code POST {"projectKey": ...}} with
 * {@code {"pillars": [{"id": ..., "value": ...}], ...}}. Plain string arrays
 * are accepted too. Any failure yields an empty map; the review form then
 * falls back to free-text inputs.
 */
@Component
@Slf4j
public class JiraFieldOptionsAdapter implements FieldOptionsPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final RelayProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JiraFieldOptionsAdapter(RelayProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, List<FieldOption>> fetch(String projectKey) {
        String url = properties.getJira().getFieldOptionsUrl();
        if (url == null || url.isBlank()) {
            return Map.of();
        }

        try {
            String body = objectMapper.writeValueAsString(Map.of("projectKey", projectKey));
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(body, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Jira] Field options for {} failed: HTTP {}", projectKey, response.code());
                    return Map.of();
                }
                Map<String, List<FieldOption>> optionSets = parse(objectMapper.readTree(responseBody.string()));
                log.debug("[Jira] Field options for {}: {}", projectKey, optionSets.keySet());
                return optionSets;
            }
        } catch (IOException e) {
            log.warn("[Jira] Field options for {} unavailable: {}", projectKey, e.getMessage());
            return Map.of();
        }
    }

    private static Map<String, List<FieldOption>> parse(JsonNode root) {
        Map<String, List<FieldOption>> optionSets = new LinkedHashMap<>();
        if (root == null || !root.isObject()) {
            return optionSets;
        }
        Iterator<Map.Entry<String, JsonNode>> sets = root.fields();
        while (sets.hasNext()) {
            Map.Entry<String, JsonNode> set = sets.next();
            if (!set.getValue().isArray()) {
                continue;
            }
            List<FieldOption> options = new ArrayList<>();
            for (JsonNode node : set.getValue()) {
                if (node.isTextual()) {
                    options.add(new FieldOption(node.asText(), node.asText()));
                } else if (node.hasNonNull("value")) {
                    String value = node.get("value").asText();
                    String id = node.hasNonNull("id") ? node.get("id").asText() : value;
                    options.add(new FieldOption(id, value));
                }
            }
            optionSets.put(set.getKey(), options);
        }
        return optionSets;
    }
}
