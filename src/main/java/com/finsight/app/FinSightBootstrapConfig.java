package com.finsight.app;

import com.finsight.app.properties.DbProperties;
import com.finsight.app.properties.PipelineProperties;
import com.finsight.app.properties.StoreProperties;
import com.finsight.config.Config;
import com.finsight.config.PipelineConfigurationException;
import com.finsight.config.PipelineSettings;
import com.finsight.data.MarketDataGateway;
import com.finsight.data.MarketDataGateways;
import com.finsight.db.Database;
import com.finsight.db.MigrationRunner;
import com.finsight.insight.InsightGenerator;
import com.finsight.insight.InsightGenerators;
import com.finsight.model.SymbolSet;
import com.finsight.news.NewsSentimentJob;
import com.finsight.runner.PipelineOrchestrator;
import com.finsight.store.ArtifactStore;
import com.finsight.store.FileArtifactStore;
import com.finsight.store.JsonlRunLedger;
import com.finsight.store.PostgresArtifactStore;
import com.finsight.store.PostgresRunLedger;
import com.finsight.store.RunLedger;
import com.finsight.view.ChatContextAssembler;
import com.finsight.view.HybridReadAccessor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, StoreProperties.class, PipelineProperties.class})
public class FinSightBootstrapConfig {
    @Bean
    public Config finSightConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Clock finSightClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineSettings pipelineSettings(Config config, PipelineProperties pipelineProperties) {
        PipelineSettings settings = PipelineSettings.from(config).toBuilder()
                .symbols(SymbolSet.of(pipelineProperties.getSymbols()))
                .intervalHours(pipelineProperties.getIntervalHours())
                .concurrency(pipelineProperties.getConcurrency())
                .symbolTimeoutSec(pipelineProperties.getSymbolTimeoutSec())
                .historyDays(pipelineProperties.getHistoryDays())
                .insightAwaitForecast(pipelineProperties.getInsight().isAwaitForecast())
                .build();
        settings.validate();
        return settings;
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                firstNonBlank(System.getenv("FINSIGHT_DB_URL"), dbProperties.getUrl()),
                firstNonBlank(System.getenv("FINSIGHT_DB_USER"), dbProperties.getUser()),
                firstNonBlank(System.getenv("FINSIGHT_DB_PASS"), dbProperties.getPass()),
                firstNonBlank(dbProperties.getSchema(), "finsight"),
                dbProperties.getConnectTimeoutSec()
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public ArtifactStore artifactStore(Config config, StoreProperties storeProperties, ObjectProvider<Database> database) {
        if (isPostgres(storeProperties)) {
            return new PostgresArtifactStore(database.getObject());
        }
        return new FileArtifactStore(config.workingDir().resolve(storeProperties.getDir()).normalize());
    }

    @Bean
    @Lazy
    public RunLedger runLedger(Config config, StoreProperties storeProperties, ObjectProvider<Database> database) {
        if (isPostgres(storeProperties)) {
            return new PostgresRunLedger(database.getObject());
        }
        return new JsonlRunLedger(config.getPath("runs.file"));
    }

    @Bean
    @Lazy
    public MarketDataGateway marketDataGateway(Config config) {
        return MarketDataGateways.create(config);
    }

    @Bean
    @Lazy
    public InsightGenerator insightGenerator(Config config, PipelineSettings settings, Clock clock) {
        return InsightGenerators.create(config, settings, clock);
    }

    @Bean
    @Lazy
    public PipelineOrchestrator pipelineOrchestrator(
            PipelineSettings settings,
            MarketDataGateway gateway,
            InsightGenerator insightGenerator,
            ArtifactStore store,
            RunLedger ledger,
            Clock clock
    ) {
        return FinSightRuntime.orchestrator(settings, gateway, insightGenerator, store, ledger, clock);
    }

    @Bean
    @Lazy
    public NewsSentimentJob newsSentimentJob(Config config, ArtifactStore store, Clock clock) {
        return FinSightRuntime.newsJob(config, store, clock);
    }

    @Bean
    @Lazy
    public PipelineScheduler pipelineScheduler(
            PipelineOrchestrator orchestrator,
            ObjectProvider<NewsSentimentJob> newsJob,
            Config config,
            PipelineSettings settings,
            Clock clock
    ) {
        NewsSentimentJob news = config.getBoolean("news.enabled", true) ? newsJob.getObject() : null;
        return new PipelineScheduler(orchestrator, news, settings.symbols, Duration.ofHours(settings.intervalHours), clock, Thread::sleep);
    }

    @Bean
    @Lazy
    public HybridReadAccessor hybridReadAccessor(ArtifactStore store, MarketDataGateway gateway, PipelineSettings settings, Clock clock) {
        return new HybridReadAccessor(store, gateway, settings, clock);
    }

    @Bean
    @Lazy
    public ChatContextAssembler chatContextAssembler(
            Config config,
            PipelineSettings settings,
            ArtifactStore store,
            HybridReadAccessor accessor
    ) {
        return FinSightRuntime.chatContext(config, settings, store, accessor);
    }

    private boolean isPostgres(StoreProperties storeProperties) {
        String type = firstNonBlank(storeProperties.getType(), "file").toLowerCase(Locale.ROOT);
        if (!type.equals("file") && !type.equals("postgres")) {
            throw new PipelineConfigurationException("store.type must be file or postgres, got '" + type + "'");
        }
        return type.equals("postgres");
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
