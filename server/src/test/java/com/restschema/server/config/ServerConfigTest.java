package com.restschema.server.config;

import com.restschema.errors.ConfigurationException;
import com.restschema.server.security.AuthMode;
import com.restschema.server.security.User;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void testDefaults() {
        ServerConfig config = ServerConfig.fromEnvironment(Map.of());
        assertEquals(8080, config.restPort());
        assertEquals(AuthMode.ANONYMOUS, config.authMode());
        assertTrue(config.apiKeys().isEmpty());
        assertEquals(10, config.defaultPageSize());
        assertEquals(100, config.maxPageSize());
        assertTrue(config.ipWhitelist().isEmpty());
    }

    @Test
    void testFromEnvironment() {
        ServerConfig config = ServerConfig.fromEnvironment(Map.of(
            "REST_PORT", "9000",
            "AUTH_MODE", "api_key",
            "API_KEYS", "k-1=alice, k-2=bob",
            "MAX_PAGE_SIZE", "50",
            "IP_WHITELIST", "10.0.0.0/8, ,::1"));
        assertEquals(9000, config.restPort());
        assertEquals(AuthMode.API_KEY, config.authMode());
        assertEquals(new User("alice", "alice"), config.apiKeys().get("k-1"));
        assertEquals(2, config.apiKeys().size());
        assertEquals(50, config.maxPageSize());
        assertEquals(List.of("10.0.0.0/8", "::1"), config.ipWhitelist());
    }

    @Test
    void testInvalidValues() {
        assertThrows(ConfigurationException.class,
            () -> ServerConfig.fromEnvironment(Map.of("REST_PORT", "http")));
        assertThrows(ConfigurationException.class,
            () -> ServerConfig.fromEnvironment(Map.of("AUTH_MODE", "kerberos")));
        assertThrows(ConfigurationException.class,
            () -> ServerConfig.fromEnvironment(Map.of("API_KEYS", "just-a-key")));
    }

    @Test
    void testToSecureString_HidesKeys() {
        ServerConfig config = ServerConfig.fromEnvironment(Map.of("API_KEYS", "secret-key=alice"));
        String secure = config.toSecureString();
        assertFalse(secure.contains("secret-key"), secure);
        assertTrue(secure.contains("apiKeys=1"), secure);
    }
}
