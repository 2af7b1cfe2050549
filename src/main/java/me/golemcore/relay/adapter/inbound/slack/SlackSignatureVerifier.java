package me.golemcore.relay.adapter.inbound.slack;

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
import me.golemcore.relay.domain.exception.MissingCredentialsException;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Verifies Slack request signatures.
 *
 * <p>
 * Slack signs {@code v0:{timestamp}:{raw body}} with the app's signing secret
 * and sends {@code v0=<hex hmac-sha256>} in {@code X-Slack-Signature}. Requests
 * whose timestamp is further from now than {@code relay.slack.max-clock-skew}
 * are rejected to stop replays.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackSignatureVerifier {

    static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
    static final String SIGNATURE_HEADER = "X-Slack-Signature";

    private static final String VERSION = "v0";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final RelayProperties properties;
    private final Clock clock;

    /**
     * @throws MissingCredentialsException
     *             if verification is enabled but no signing secret is configured
     */
    public boolean verify(HttpHeaders headers, byte[] body) {
        RelayProperties.SlackProperties slack = properties.getSlack();
        if (!slack.isVerifySignatures()) {
            return true;
        }
        if (slack.getSigningSecret() == null || slack.getSigningSecret().isBlank()) {
            throw new MissingCredentialsException("Slack signing secret");
        }

        String timestamp = headers.getFirst(TIMESTAMP_HEADER);
        String signature = headers.getFirst(SIGNATURE_HEADER);
        if (timestamp == null || signature == null) {
            log.debug("[Slack] Signature headers missing");
            return false;
        }

        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.debug("[Slack] Malformed request timestamp: {}", timestamp);
            return false;
        }
        Duration skew = Duration.between(Instant.ofEpochSecond(epochSeconds), Instant.now(clock)).abs();
        if (skew.compareTo(slack.getMaxClockSkew()) > 0) {
            log.warn("[Slack] Request timestamp outside allowed skew ({}s)", skew.toSeconds());
            return false;
        }

        String expected = sign(slack.getSigningSecret(), timestamp.trim(), body);
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }

    static String sign(String secret, String timestamp, byte[] body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update((VERSION + ":" + timestamp + ":").getBytes(StandardCharsets.UTF_8));
            byte[] hash = mac.doFinal(body);
            return VERSION + "=" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("[Slack] Failed to compute signature: {}", e.getMessage());
            return null;
        }
    }
}
