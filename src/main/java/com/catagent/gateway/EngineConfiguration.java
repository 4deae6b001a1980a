package com.catagent.gateway;

import com.catagent.actions.ActionCatalog;
import com.catagent.actions.ActionExecutor;
import com.catagent.actions.ActionHandlerRegistry;
import com.catagent.actions.ActionRecordStore;
import com.catagent.actions.EntityActionHandler;
import com.catagent.actions.InMemoryActionRecordStore;
import com.catagent.actions.JdbcActionRecordStore;
import com.catagent.actions.gateway.HttpEntityGateway;
import com.catagent.actions.parse.ResponseActionParser;
import com.catagent.agent.ChatService;
import com.catagent.agent.PromptBuilder;
import com.catagent.auth.InMemorySecretStore;
import com.catagent.auth.JdbcSecretStore;
import com.catagent.auth.SecretStore;
import com.catagent.observability.EngineMetrics;
import com.catagent.permissions.InMemoryPermissionStore;
import com.catagent.permissions.JdbcPermissionStore;
import com.catagent.permissions.PermissionService;
import com.catagent.permissions.PermissionStore;
import com.catagent.providers.AutoRouter;
import com.catagent.providers.CredentialResolver;
import com.catagent.providers.HttpProviderFactory;
import com.catagent.providers.ModelCatalog;
import com.catagent.providers.ModelRouter;
import com.catagent.security.KeyCipher;
import com.catagent.security.UserLocks;
import com.catagent.security.WriteRateLimiter;
import com.catagent.shared.config.CatAgentConfig;
import com.catagent.shared.config.CatAgentConfig.StorageMode;
import com.catagent.shared.config.ConfigLoader;
import com.catagent.usage.InMemoryUsageLedger;
import com.catagent.usage.JdbcUsageLedger;
import com.catagent.usage.UsageLedger;
import com.catagent.usage.UsageService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public CatAgentConfig catAgentConfig() {
        var config = ConfigLoader.load();
        log.info("Loaded config: {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry registry) {
        return new EngineMetrics(registry);
    }

    @Bean
    public UserLocks userLocks() {
        return new UserLocks();
    }

    // Storage

    @Bean
    public KeyCipher keyCipher(CatAgentConfig config) {
        var masterKey = config.secretsMasterKey();
        if (masterKey == null || masterKey.isBlank()) {
            log.warn("secrets.master-key not configured, stored API keys will not survive a restart");
            var random = new byte[32];
            new SecureRandom().nextBytes(random);
            masterKey = Base64.getEncoder().encodeToString(random);
        }
        return new KeyCipher(masterKey);
    }

    @Bean
    public SecretStore secretStore(CatAgentConfig config, ObjectProvider<DataSource> dataSource, KeyCipher cipher) {
        return jdbc(config) ? new JdbcSecretStore(dataSource.getObject(), cipher) : new InMemorySecretStore(cipher);
    }

    @Bean
    public UsageLedger usageLedger(CatAgentConfig config, ObjectProvider<DataSource> dataSource) {
        return jdbc(config) ? new JdbcUsageLedger(dataSource.getObject()) : new InMemoryUsageLedger();
    }

    @Bean
    public PermissionStore permissionStore(CatAgentConfig config, ObjectProvider<DataSource> dataSource) {
        return jdbc(config) ? new JdbcPermissionStore(dataSource.getObject()) : new InMemoryPermissionStore();
    }

    @Bean
    public ActionRecordStore actionRecordStore(CatAgentConfig config, ObjectProvider<DataSource> dataSource) {
        return jdbc(config) ? new JdbcActionRecordStore(dataSource.getObject()) : new InMemoryActionRecordStore();
    }

    // Engine

    @Bean
    public UsageService usageService(UsageLedger ledger, CatAgentConfig config, Clock clock, EngineMetrics metrics) {
        return new UsageService(ledger, config.engine().usage().dailyFreeRequests(), clock, metrics);
    }

    @Bean
    public ActionCatalog actionCatalog() {
        return new ActionCatalog();
    }

    @Bean
    public PermissionService permissionService(PermissionStore store, ActionCatalog catalog, UsageService usage,
                                               UserLocks locks, Clock clock) {
        return new PermissionService(store, catalog, usage, locks, clock);
    }

    @Bean
    public ActionExecutor actionExecutor(ActionCatalog catalog, PermissionService permissions,
                                         ActionRecordStore records, UsageService usage, UserLocks locks,
                                         EngineMetrics metrics, Clock clock, CatAgentConfig config) {
        var actions = config.engine().actions();
        var handlers = new ActionHandlerRegistry(
            new EntityActionHandler(new HttpEntityGateway(actions.entityServiceUrl())));
        return new ActionExecutor(catalog, permissions, records, handlers, usage, locks, metrics, clock,
            Duration.ofHours(actions.pendingTtlHours()));
    }

    @Bean
    public CredentialResolver credentialResolver(SecretStore secrets, CatAgentConfig config) {
        var providers = config.providers();
        if (!providers.openRouter().hasPlatformKey() && !providers.groq().hasPlatformKey()) {
            log.warn("No platform API key configured. Set OPENROUTER_API_KEY or GROQ_API_KEY");
        }
        return new CredentialResolver(secrets, providers);
    }

    @Bean
    public ModelCatalog modelCatalog() {
        return new ModelCatalog();
    }

    @Bean
    public ModelRouter modelRouter(ModelCatalog catalog, EngineMetrics metrics, CatAgentConfig config) {
        return new ModelRouter(catalog, new AutoRouter(), new HttpProviderFactory(config.providers()), metrics,
            config.engine().chat().temperature());
    }

    @Bean
    public ChatService chatService(CredentialResolver credentials, UsageService usage, ModelRouter router,
                                   ActionCatalog catalog, ActionExecutor executor, CatAgentConfig config) {
        return new ChatService(credentials, usage, router, new PromptBuilder(catalog), new ResponseActionParser(),
            executor, config.engine().chat().maxMessageLength());
    }

    // HTTP

    @Bean
    public WriteRateLimiter writeRateLimiter(CatAgentConfig config, Clock clock) {
        return new WriteRateLimiter(config.engine().rateLimit().writesPerMinute(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "chat-stream");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static boolean jdbc(CatAgentConfig config) {
        return config.storageMode() == StorageMode.JDBC;
    }
}
