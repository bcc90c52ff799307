package com.finsight.app;

import com.finsight.config.Config;
import com.finsight.config.PipelineConfigurationException;
import com.finsight.config.PipelineSettings;
import com.finsight.data.MarketDataGateway;
import com.finsight.data.MarketDataGateways;
import com.finsight.data.YahooHeadlineFeed;
import com.finsight.data.http.HttpClientEx;
import com.finsight.db.Database;
import com.finsight.db.MigrationRunner;
import com.finsight.feature.FeatureTransformer;
import com.finsight.forecast.Forecaster;
import com.finsight.insight.InsightGenerator;
import com.finsight.insight.InsightGenerators;
import com.finsight.news.HeadlineSentimentScorer;
import com.finsight.news.NewsSentimentJob;
import com.finsight.runner.PipelineOrchestrator;
import com.finsight.runner.RetryPolicy;
import com.finsight.store.ArtifactStore;
import com.finsight.store.FileArtifactStore;
import com.finsight.store.JsonlRunLedger;
import com.finsight.store.PostgresArtifactStore;
import com.finsight.store.PostgresRunLedger;
import com.finsight.store.RunLedger;
import com.finsight.view.ChatContextAssembler;
import com.finsight.view.HybridReadAccessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Locale;

/**
 * 模块说明：FinSightRuntime（class）。
 * 主要职责：根据 Config 组装存储、行情网关、特征转换、预测、点评、编排器与读取端。
 * 使用建议：命令行与 Spring 启动配置共用这里的工厂方法，保证两条入口的装配一致。
 */
public final class FinSightRuntime {
    private static final Logger LOG = LogManager.getLogger(FinSightRuntime.class);

    public final Config config;
    public final PipelineSettings settings;
    public final Clock clock;
    public final ArtifactStore store;
    public final RunLedger ledger;
    public final MarketDataGateway gateway;
    public final PipelineOrchestrator orchestrator;
    public final HybridReadAccessor accessor;
    public final ChatContextAssembler chatContext;
    /** null when news.enabled=false */
    public final NewsSentimentJob newsJob;

    private FinSightRuntime(
            Config config,
            PipelineSettings settings,
            Clock clock,
            ArtifactStore store,
            RunLedger ledger,
            MarketDataGateway gateway,
            PipelineOrchestrator orchestrator,
            HybridReadAccessor accessor,
            ChatContextAssembler chatContext,
            NewsSentimentJob newsJob
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.store = store;
        this.ledger = ledger;
        this.gateway = gateway;
        this.orchestrator = orchestrator;
        this.accessor = accessor;
        this.chatContext = chatContext;
        this.newsJob = newsJob;
    }

    public static FinSightRuntime create(Config config, Clock clock) {
        PipelineSettings settings = PipelineSettings.from(config);
        String storeType = storeType(config);
        Database database = "postgres".equals(storeType) ? database(config) : null;
        ArtifactStore store = artifactStore(config, database);
        RunLedger ledger = runLedger(config, database);
        MarketDataGateway gateway = MarketDataGateways.create(config);
        InsightGenerator insight = InsightGenerators.create(config, settings, clock);
        PipelineOrchestrator orchestrator = orchestrator(settings, gateway, insight, store, ledger, clock);
        HybridReadAccessor accessor = new HybridReadAccessor(store, gateway, settings, clock);
        ChatContextAssembler chat = chatContext(config, settings, store, accessor);
        NewsSentimentJob news = config.getBoolean("news.enabled", true) ? newsJob(config, store, clock) : null;
        LOG.info("runtime ready store={} provider={} insight={} news={} symbols={}",
                storeType, gateway.providerId(), insight.sourceModelId(), news != null, settings.symbols);
        return new FinSightRuntime(config, settings, clock, store, ledger, gateway, orchestrator, accessor, chat, news);
    }

    public static NewsSentimentJob newsJob(Config config, ArtifactStore store, Clock clock) {
        HttpClientEx http = new HttpClientEx(Math.max(1, config.getInt("news.timeout_sec", 20)));
        return new NewsSentimentJob(
                new YahooHeadlineFeed(config, http),
                new HeadlineSentimentScorer(),
                store,
                config.getInt("news.limit", 5),
                clock
        );
    }

    public static PipelineOrchestrator orchestrator(
            PipelineSettings settings,
            MarketDataGateway gateway,
            InsightGenerator insight,
            ArtifactStore store,
            RunLedger ledger,
            Clock clock
    ) {
        RetryPolicy retry = new RetryPolicy(
                settings.fetchMaxAttempts, settings.fetchBackoffMs, settings.fetchMaxBackoffMs, RetryPolicy.THREAD_SLEEPER);
        Forecaster forecaster = new Forecaster(settings, Forecaster.defaultModel(settings), clock);
        return new PipelineOrchestrator(
                settings,
                gateway,
                new FeatureTransformer(settings.featureSpec),
                forecaster,
                insight,
                store,
                ledger,
                retry,
                clock
        );
    }

    public static ChatContextAssembler chatContext(
            Config config,
            PipelineSettings settings,
            ArtifactStore store,
            HybridReadAccessor accessor
    ) {
        return new ChatContextAssembler(
                store,
                accessor,
                settings.symbols,
                config.getInt("view.chat.support_window", 60),
                config.getInt("view.chat.recent_rows", 5),
                config.getInt("view.chat.news_items", 3)
        );
    }

    public static String storeType(Config config) {
        String type = config.getString("store.type", "file").trim().toLowerCase(Locale.ROOT);
        if (!type.equals("file") && !type.equals("postgres")) {
            throw new PipelineConfigurationException("store.type must be file or postgres, got '" + type + "'");
        }
        return type;
    }

    public static ArtifactStore artifactStore(Config config, Database database) {
        if (database != null) {
            return new PostgresArtifactStore(database);
        }
        return new FileArtifactStore(config.getPath("store.dir"));
    }

    public static RunLedger runLedger(Config config, Database database) {
        if (database != null) {
            return new PostgresRunLedger(database);
        }
        return new JsonlRunLedger(config.getPath("runs.file"));
    }

/**
 * 方法说明：database，负责创建数据库连接并执行迁移。
 * 处理流程：连接信息先读环境变量 FINSIGHT_DB_URL/USER/PASS，再读配置；迁移失败视为配置错误。
 */
    public static Database database(Config config) {
        Database database = new Database(
                config.secret("FINSIGHT_DB_URL", "db.url"),
                config.secret("FINSIGHT_DB_USER", "db.user"),
                config.secret("FINSIGHT_DB_PASS", "db.pass"),
                config.getString("db.schema", "finsight"),
                config.getInt("db.connect_timeout_sec", 5)
        );
        LOG.info("DB url={} schema={}", database.maskedJdbcUrl(), database.schema());
        try {
            new MigrationRunner().run(database);
        } catch (SQLException e) {
            throw new PipelineConfigurationException("database migration failed: " + e.getMessage(), e);
        }
        return database;
    }
}
