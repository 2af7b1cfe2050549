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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.store.WorkflowStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup diagnostics.
 *
 * <p>
 * Declares the {@link Clock}, the {@link ObjectMapper} and the single
 * {@link WorkflowStore} owned by this process. The store lives in memory only,
 * so every instance of the relay has its own copy.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RelayProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public WorkflowStore workflowStore(Clock clock) {
        return new WorkflowStore(clock, properties.getWorkflow().getTtl());
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting...");
        log.info("Workflow TTL: {}", properties.getWorkflow().getTtl());
        logCredentialStatus("Slack bot token", properties.getSlack().getBotToken());
        logCredentialStatus("Slack signing secret", properties.getSlack().getSigningSecret());
        logCredentialStatus("Jira API token", properties.getJira().getApiToken());
        logCredentialStatus("Confluence API token", properties.getConfluence().getApiToken());
        if (!properties.getSlack().isVerifySignatures()) {
            log.warn("Slack signature verification is DISABLED");
        }
    }

    private void logCredentialStatus(String name, String value) {
        if (value == null || value.isBlank()) {
            log.warn("{} not configured", name);
        } else {
            log.info("{} configured", name);
        }
    }
}
