package me.golemcore.persona.infrastructure.http;

import me.golemcore.persona.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OkHttpConfigTest {

    @Test
    void shouldApplyHttpPropertiesAndDisableTransparentRetries() {
        // Arrange
        BotProperties properties = new BotProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);
        properties.getHttp().setWriteTimeout(3500);

        // Act
        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        // Assert
        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertEquals(3500, client.writeTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }
}
