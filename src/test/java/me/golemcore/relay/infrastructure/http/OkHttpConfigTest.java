package me.golemcore.relay.infrastructure.http;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        RelayProperties properties = new RelayProperties();
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(2));
        properties.getHttp().setReadTimeout(Duration.ofSeconds(7));
        properties.getHttp().setCallTimeout(Duration.ofSeconds(12));

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(2_000, client.connectTimeoutMillis());
        assertEquals(7_000, client.readTimeoutMillis());
        assertEquals(12_000, client.callTimeoutMillis());
    }

    @Test
    void shouldNotReplayRequestsOnConnectionFailure() {
        OkHttpClient client = OkHttpConfig.buildClient(new RelayProperties.HttpProperties());

        assertFalse(client.retryOnConnectionFailure());
        assertEquals(30_000, client.callTimeoutMillis());
    }
}
