package me.golemcore.relay.adapter.inbound.web;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-token check for the relay's own JSON endpoints. Open when
 * {@code relay.api.token} is blank.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiTokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String CUSTOM_HEADER = "X-Relay-Token";

    private final RelayProperties properties;

    public boolean authenticate(HttpHeaders headers) {
        String expected = properties.getApi().getToken();
        if (expected == null || expected.isBlank()) {
            return true;
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return constantTimeEquals(expected, authHeader.substring(BEARER_PREFIX.length()));
        }

        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null) {
            return constantTimeEquals(expected, customToken);
        }

        log.debug("[API] No token found in request headers");
        return false;
    }

    /**
     * @throws ResponseStatusException
     *             401 when the token is missing or wrong
     */
    public void requireAuthenticated(HttpHeaders headers) {
        if (!authenticate(headers)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid or missing API token");
        }
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
