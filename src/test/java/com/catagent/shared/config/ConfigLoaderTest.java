package com.catagent.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("missing.yaml"), name -> null);
        assertEquals(8080, cfg.serverPort());
        assertEquals(CatAgentConfig.StorageMode.JDBC, cfg.storageMode());
        assertEquals(10, cfg.engine().usage().dailyFreeRequests());
        assertEquals(0.7, cfg.engine().chat().temperature());
        assertEquals(30, cfg.engine().rateLimit().writesPerMinute());
        assertEquals(24, cfg.engine().actions().pendingTtlHours());
        assertEquals("https://openrouter.ai/api/v1", cfg.providers().openRouter().baseUrl());
        assertFalse(cfg.providers().openRouter().hasPlatformKey());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            server:
              port: 9090
            providers:
              openrouter:
                api-key: or-platform
              groq:
                base-url: http://groq.local/v1
                api-key: groq-platform
              timeout: 15
            storage:
              mode: memory
            secrets:
              master-key: s3cret
            usage:
              daily-free-requests: 3
            chat:
              temperature: 0.2
              max-message-length: 500
            rate-limit:
              writes-per-minute: 5
            actions:
              pending-ttl-hours: 2
              entity-service-url: http://entities:4000
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals(9090, cfg.serverPort());
        assertEquals("or-platform", cfg.providers().openRouter().platformKey());
        assertEquals("http://groq.local/v1", cfg.providers().groq().baseUrl());
        assertEquals(15, cfg.providers().timeoutSeconds());
        assertEquals(CatAgentConfig.StorageMode.MEMORY, cfg.storageMode());
        assertEquals("s3cret", cfg.secretsMasterKey());
        assertEquals(3, cfg.engine().usage().dailyFreeRequests());
        assertEquals(0.2, cfg.engine().chat().temperature());
        assertEquals(500, cfg.engine().chat().maxMessageLength());
        assertEquals(5, cfg.engine().rateLimit().writesPerMinute());
        assertEquals(2, cfg.engine().actions().pendingTtlHours());
        assertEquals("http://entities:4000", cfg.engine().actions().entityServiceUrl());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            usage:
              daily-free-requests: 3
            """;
        var cfg = writeAndLoad(yaml, Map.of(
            "CATAGENT_DAILY_FREE_REQUESTS", "20",
            "GROQ_API_KEY", "from-env",
            "CATAGENT_STORAGE_MODE", "memory"));
        assertEquals(20, cfg.engine().usage().dailyFreeRequests());
        assertEquals("from-env", cfg.providers().groq().platformKey());
        assertEquals(CatAgentConfig.StorageMode.MEMORY, cfg.storageMode());
    }

    @Test
    void toStringMasksSecrets() throws IOException {
        var yaml = """
            providers:
              openrouter:
                api-key: sk-or-very-secret
            secrets:
              master-key: master-very-secret
            """;
        var text = writeAndLoad(yaml, Map.of()).toString();
        assertFalse(text.contains("sk-or-very-secret"));
        assertFalse(text.contains("master-very-secret"));
    }

    private CatAgentConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env::get);
    }
}
