package com.finsight.app;

import com.finsight.config.Config;
import com.finsight.config.PipelineConfigurationException;
import com.finsight.model.Symbol;
import com.finsight.model.SymbolSet;
import com.finsight.runner.RunReport;
import com.finsight.runner.RunRequest;
import com.finsight.runner.StageOutcome;
import com.finsight.runner.SymbolOutcome;
import com.finsight.view.MarketView;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;

public final class FinSightApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Clock clock;

    public FinSightApplication() {
        this(Clock.systemUTC());
    }

    FinSightApplication(Clock clock) {
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exit = new FinSightApplication().run(args);
        System.exit(exit);
    }

/**
 * 方法说明：run，负责解析命令行并分派到单次运行、定时调度、面板视图或对话上下文。
 * 处理流程：参数或配置错误返回 2，致命错误返回 1，中断返回 130。
 */
    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("finsight", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("finsight", options);
            return 0;
        }
        int modes = countModes(cmd);
        if (modes != 1) {
            new HelpFormatter().printHelp("finsight", options);
            System.err.println("ERROR: choose exactly one of --run, --schedule, --view, --chat-context");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            return dispatch(cmd, config);
        } catch (PipelineConfigurationException | IllegalArgumentException | DateTimeParseException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    int dispatch(CommandLine cmd, Config config) {
        FinSightRuntime runtime = FinSightRuntime.create(config, clock);
        SymbolSet symbols = cmd.hasOption("symbols")
                ? SymbolSet.of(Arrays.asList(cmd.getOptionValue("symbols").split("[,;]")))
                : runtime.settings.symbols;

        if (cmd.hasOption("view")) {
            printView(runtime.accessor.getView(Symbol.of(cmd.getOptionValue("view"))));
            return 0;
        }
        if (cmd.hasOption("chat-context")) {
            System.out.println(runtime.chatContext.assemble(Symbol.of(cmd.getOptionValue("chat-context"))));
            return 0;
        }
        if (cmd.hasOption("schedule")) {
            PipelineScheduler scheduler = new PipelineScheduler(
                    runtime.orchestrator,
                    runtime.newsJob,
                    symbols,
                    Duration.ofHours(runtime.settings.intervalHours),
                    clock,
                    Thread::sleep
            );
            return scheduler.runLoop(0);
        }

        Instant asOf = cmd.hasOption("as-of")
                ? Instant.parse(cmd.getOptionValue("as-of").trim())
                : AsOfWindow.floor(clock.instant(), Duration.ofHours(runtime.settings.intervalHours));
        RunReport report = runtime.orchestrator.run(new RunRequest(symbols, asOf, cmd.hasOption("force"), "manual"));
        printReport(report);
        if (runtime.newsJob != null && !Thread.currentThread().isInterrupted()) {
            runtime.newsJob.run(symbols, asOf);
        }
        if (Thread.currentThread().isInterrupted()) {
            return 130;
        }
        return "FAILED".equals(report.status()) ? 1 : 0;
    }

    private int countModes(CommandLine cmd) {
        int count = 0;
        for (String mode : new String[]{"run", "schedule", "view", "chat-context"}) {
            if (cmd.hasOption(mode)) {
                count++;
            }
        }
        return count;
    }

    private void printReport(RunReport report) {
        System.out.println("run=" + report.runId + " asOf=" + report.asOf + " status=" + report.status());
        for (SymbolOutcome outcome : report.outcomes) {
            System.out.println(String.format(Locale.US, "  %-8s %-20s cause=%s versions=%s",
                    outcome.symbol.value, outcome.state, outcome.cause, outcome.committedVersions));
            for (StageOutcome stage : outcome.stages) {
                System.out.println(String.format(Locale.US, "      %-11s %-8s attempts=%d elapsed_ms=%d %s",
                        stage.stage, stage.status, stage.attempts, stage.elapsedMs,
                        stage.message == null ? "" : stage.message));
            }
        }
    }

    private void printView(MarketView view) {
        System.out.println("symbol=" + view.symbol.value + " freshness=" + view.freshness + " stale=" + view.stale);
        if (view.price != null) {
            System.out.println(String.format(Locale.US, "price=%.2f at %s", view.price, view.priceTimestamp));
        }
        if (!view.notice.isEmpty()) {
            System.out.println("notice=" + view.notice);
        }
        view.forecast().ifPresent(f -> System.out.println(String.format(Locale.US,
                "forecast=%.2f direction=%s change=%+.2f%% model=%s", f.predictedClose, f.direction,
                f.predictedChangePct, f.modelVersion)));
        view.insight().ifPresent(i -> System.out.println("insight=" + i.commentary));
        view.stalenessSeconds().ifPresent(s -> System.out.println("staleness_seconds=" + s));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (FinSightApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("finsight.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(FinSightApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("run").desc("run the pipeline once for the current window").build());
        options.addOption(Option.builder().longOpt("schedule").desc("run the pipeline every pipeline.interval_hours").build());
        options.addOption(Option.builder().longOpt("view").hasArg().argName("symbol").desc("print the dashboard view of one symbol").build());
        options.addOption(Option.builder().longOpt("chat-context").hasArg().argName("symbol").desc("print the chat context block of one symbol").build());
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("list").desc("comma separated symbols, overrides pipeline.symbols").build());
        options.addOption(Option.builder().longOpt("as-of").hasArg().argName("iso-8601").desc("run as-of instant, e.g. 2024-06-03T12:00:00Z").build());
        options.addOption(Option.builder().longOpt("force").desc("recompute even when stored artifacts are current").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
