package com.catagent.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".catagent", "config.yaml"
    );

    public static CatAgentConfig load() {
        var override = System.getenv("CATAGENT_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static CatAgentConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static CatAgentConfig load(Path path, UnaryOperator<String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var providers = (Map<String, Object>) raw.getOrDefault("providers", Map.of());
        var storage = (Map<String, Object>) raw.getOrDefault("storage", Map.of());
        var secrets = (Map<String, Object>) raw.getOrDefault("secrets", Map.of());

        var defaults = CatAgentConfig.defaults();
        var mode = envOrDefault(env, "CATAGENT_STORAGE_MODE",
            String.valueOf(storage.getOrDefault("mode", defaults.storageMode().name())));

        return new CatAgentConfig(
            Integer.parseInt(envOrDefault(env, "CATAGENT_PORT",
                String.valueOf(server.getOrDefault("port", defaults.serverPort())))),
            parseProviders(providers, env),
            parseEngine(raw, env),
            CatAgentConfig.StorageMode.valueOf(mode.toUpperCase(Locale.ROOT)),
            envOrDefault(env, "CATAGENT_MASTER_KEY",
                String.valueOf(secrets.getOrDefault("master-key", defaults.secretsMasterKey())))
        );
    }

    @SuppressWarnings("unchecked")
    private static ProvidersConfig parseProviders(Map<String, Object> providers, UnaryOperator<String> env) {
        var openRouter = (Map<String, Object>) providers.getOrDefault("openrouter", Map.of());
        var groq = (Map<String, Object>) providers.getOrDefault("groq", Map.of());
        var def = ProvidersConfig.defaults();

        return new ProvidersConfig(
            new ProvidersConfig.Endpoint(
                String.valueOf(openRouter.getOrDefault("base-url", def.openRouter().baseUrl())),
                envOrDefault(env, "OPENROUTER_API_KEY",
                    String.valueOf(openRouter.getOrDefault("api-key", "")))
            ),
            new ProvidersConfig.Endpoint(
                String.valueOf(groq.getOrDefault("base-url", def.groq().baseUrl())),
                envOrDefault(env, "GROQ_API_KEY",
                    String.valueOf(groq.getOrDefault("api-key", "")))
            ),
            Integer.parseInt(String.valueOf(providers.getOrDefault("timeout", def.timeoutSeconds())))
        );
    }

    @SuppressWarnings("unchecked")
    private static EngineConfig parseEngine(Map<String, Object> raw, UnaryOperator<String> env) {
        var usage = (Map<String, Object>) raw.getOrDefault("usage", Map.of());
        var chat = (Map<String, Object>) raw.getOrDefault("chat", Map.of());
        var rateLimit = (Map<String, Object>) raw.getOrDefault("rate-limit", Map.of());
        var actions = (Map<String, Object>) raw.getOrDefault("actions", Map.of());

        var usageDef = EngineConfig.UsageConfig.defaults();
        var chatDef = EngineConfig.ChatConfig.defaults();
        var rateDef = EngineConfig.RateLimitConfig.defaults();
        var actionsDef = EngineConfig.ActionsConfig.defaults();

        return new EngineConfig(
            new EngineConfig.UsageConfig(
                Integer.parseInt(envOrDefault(env, "CATAGENT_DAILY_FREE_REQUESTS",
                    String.valueOf(usage.getOrDefault("daily-free-requests", usageDef.dailyFreeRequests()))))
            ),
            new EngineConfig.ChatConfig(
                Double.parseDouble(String.valueOf(chat.getOrDefault("temperature", chatDef.temperature()))),
                Integer.parseInt(String.valueOf(chat.getOrDefault("max-message-length", chatDef.maxMessageLength())))
            ),
            new EngineConfig.RateLimitConfig(
                Integer.parseInt(envOrDefault(env, "CATAGENT_WRITES_PER_MINUTE",
                    String.valueOf(rateLimit.getOrDefault("writes-per-minute", rateDef.writesPerMinute()))))
            ),
            new EngineConfig.ActionsConfig(
                Integer.parseInt(String.valueOf(actions.getOrDefault("pending-ttl-hours", actionsDef.pendingTtlHours()))),
                envOrDefault(env, "CATAGENT_ENTITY_SERVICE_URL",
                    String.valueOf(actions.getOrDefault("entity-service-url", actionsDef.entityServiceUrl())))
            )
        );
    }

    private static String envOrDefault(UnaryOperator<String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
