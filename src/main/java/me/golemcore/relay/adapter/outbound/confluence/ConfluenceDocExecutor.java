package me.golemcore.relay.adapter.outbound.confluence;

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
import com.fasterxml.jackson.annotation.JsonProperty;
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
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Creates Confluence pages through the content REST API. The description is
 * written as storage-format paragraphs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfluenceDocExecutor implements ActionExecutorPort {

    private final FeignClientFactory feignClientFactory;
    private final RelayProperties properties;

    private ConfluenceApi confluenceApi;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getConfluence().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("[Confluence] No base URL configured, doc creation disabled");
            return;
        }
        this.confluenceApi = feignClientFactory.create(ConfluenceApi.class, trimSlash(baseUrl));
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.DOC;
    }

    @Override
    public CreatedArtifact create(ConfirmationRequest request) {
        RelayProperties.ConfluenceProperties confluence = properties.getConfluence();
        if (confluenceApi == null || isBlank(confluence.getEmail()) || isBlank(confluence.getApiToken())) {
            throw new MissingCredentialsException("Confluence credentials");
        }
        if (isBlank(confluence.getSpaceKey())) {
            throw new MissingCredentialsException("Confluence space key");
        }

        Map<String, Object> body = Map.of(
                "type", "page",
                "title", request.getTitle(),
                "space", Map.of("key", confluence.getSpaceKey()),
                "body", Map.of("storage", Map.of(
                        "value", toStorageFormat(request.getDescription()),
                        "representation", "storage")));

        CreatedPage page;
        try {
            page = confluenceApi.createPage(basicAuth(confluence.getEmail(), confluence.getApiToken()), body);
        } catch (FeignException e) {
            log.error("[Confluence] Page creation in {} failed with HTTP {}", confluence.getSpaceKey(), e.status());
            throw new ActionExecutionException("Confluence rejected the page (HTTP " + e.status() + "): "
                    + e.contentUTF8(), e);
        }
        if (page == null || isBlank(page.getId())) {
            throw new ActionExecutionException("Confluence returned no page id");
        }

        String url = pageUrl(page, trimSlash(confluence.getBaseUrl()));
        log.info("[Confluence] Created page {} in {}", page.getId(), confluence.getSpaceKey());
        return new CreatedArtifact(page.getId(), url);
    }

    static String toStorageFormat(String text) {
        if (isBlank(text)) {
            return "<p></p>";
        }
        StringBuilder html = new StringBuilder();
        for (String paragraph : text.trim().split("\\n\\s*\\n")) {
            html.append("<p>")
                    .append(HtmlUtils.htmlEscape(paragraph.trim()).replace("\n", "<br/>"))
                    .append("</p>");
        }
        return html.toString();
    }

    private static String pageUrl(CreatedPage page, String baseUrl) {
        Links links = page.getLinks();
        if (links == null || isBlank(links.getWebui())) {
            return baseUrl + "/pages/viewpage.action?pageId=" + page.getId();
        }
        String base = !isBlank(links.getBase()) ? trimSlash(links.getBase()) : baseUrl;
        return base + links.getWebui();
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
    interface ConfluenceApi {
        @RequestLine("POST /rest/api/content")
        @Headers({ "Content-Type: application/json", "Authorization: Basic {auth}" })
        CreatedPage createPage(@Param("auth") String auth, Map<String, Object> body);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CreatedPage {
        private String id;
        private String title;
        @JsonProperty("_links")
        private Links links;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Links {
        private String webui;
        private String base;
    }
}
