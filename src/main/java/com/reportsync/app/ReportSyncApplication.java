package com.reportsync.app;

import com.reportsync.config.Config;
import com.reportsync.core.RunTelemetry;
import com.reportsync.core.async.BlockingBridge;
import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.orchestrator.DownstreamStage;
import com.reportsync.orchestrator.OrchestrationReport;
import com.reportsync.orchestrator.Orchestrator;
import com.reportsync.orchestrator.WorkerAwaitStrategy;
import com.reportsync.session.ReportPortalSession;
import com.reportsync.session.ReportWorkflow;
import com.reportsync.session.SessionSettings;
import com.reportsync.session.SessionWorkflow;
import com.reportsync.session.webdriver.SeleniumSessionDriver;
import com.reportsync.sync.ResourceOutcome;
import com.reportsync.sync.ResourceSyncWorker;
import com.reportsync.sync.SyncSettings;
import com.reportsync.sync.poi.PoiWorkbookDriver;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class ReportSyncApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new ReportSyncApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("reportsync", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("reportsync", options);
            return 0;
        }
        if (cmd.hasOption("sync-only") && cmd.hasOption("session-only")) {
            System.err.println("ERROR: --sync-only and --session-only cannot be combined.");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            ZoneId zone = ZoneId.of(config.getString("app.zone", "Asia/Tokyo"));
            LocalDate reportDate = LocalDate.now(zone);
            if (cmd.hasOption("date")) {
                reportDate = parseDate(cmd.getOptionValue("date"));
                if (reportDate == null) {
                    System.err.println("ERROR: --date must be yyyy-MM-dd.");
                    return 2;
                }
            }

            boolean syncEnabled = !cmd.hasOption("session-only") && config.getBoolean("sync.enabled", true);
            boolean sessionEnabled = !cmd.hasOption("sync-only") && config.getBoolean("session.enabled", true);
            List<Path> files = syncEnabled ? resolveFiles(cmd, config, workingDir) : List.of();
            String mode = syncEnabled && sessionEnabled ? "FULL" : (syncEnabled ? "SYNC_ONLY" : "SESSION_ONLY");

            SyncSettings syncSettings = SyncSettings.fromConfig(config);
            SessionSettings sessionSettings = SessionSettings.fromConfig(config);
            System.out.println("Run mode=" + mode
                    + ", date=" + reportDate
                    + ", files=" + files.size()
                    + ", sync=" + syncSettings);
            if (sessionEnabled && sessionSettings.reporterUrl.isEmpty()) {
                System.err.println("WARN: session.reporter.url / REPORTER_URL is not set; login will fail.");
            }

            RunTelemetry telemetry = new RunTelemetry(mode, "manual", null);
            try (CooperativeScheduler scheduler = new CooperativeScheduler();
                 BlockingBridge bridge = new BlockingBridge(scheduler, Math.max(1, config.getInt("bridge.pool_size", BlockingBridge.DEFAULT_POOL_SIZE)))) {
                ResourceSyncWorker worker = new ResourceSyncWorker(new PoiWorkbookDriver(), syncSettings);
                SessionWorkflow workflow = null;
                if (sessionEnabled) {
                    ReportPortalSession session = new ReportPortalSession(
                            scheduler,
                            bridge,
                            SeleniumSessionDriver.factory(sessionSettings.webDriverUrl, sessionSettings.headless),
                            sessionSettings
                    );
                    workflow = new ReportWorkflow(session, sessionSettings, reportDate);
                }
                Orchestrator orchestrator = new Orchestrator(
                        worker,
                        scheduler,
                        WorkerAwaitStrategy.named(
                                config.getString("orchestrator.await_strategy", "POLL"),
                                config.getLong("orchestrator.poll_interval_ms", 1000L)
                        ),
                        downstreamStage(),
                        telemetry
                );
                Thread hook = new Thread(orchestrator::stop, "reportsync-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                OrchestrationReport report;
                try {
                    report = orchestrator.runAll(files, workflow);
                } finally {
                    removeShutdownHook(hook);
                }
                telemetry.finish();
                System.out.println(telemetry.getSummary());
                for (ResourceOutcome outcome : report.syncReport.outcomes) {
                    System.out.println("resource " + outcome);
                }
                return report.ok() ? 0 : 1;
            }
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private DownstreamStage downstreamStage() {
        return report -> System.out.println("Downstream stage ready. " + report.summary());
    }

    private List<Path> resolveFiles(CommandLine cmd, Config config, Path workingDir) {
        if (!cmd.hasOption("files")) {
            return config.getPathList("sync.files");
        }
        List<Path> out = new ArrayList<>();
        for (String token : cmd.getOptionValue("files", "").split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(workingDir.resolve(trimmed).normalize());
            }
        }
        return out;
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook runs on its own.
            System.err.println("WARN: " + e.getMessage());
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ReportSyncApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path outputsDir = config.getPath("outputs.dir");
                Path logDir = outputsDir.resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("reportsync.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(ReportSyncApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("sync-only").desc("refresh the workbooks only, skip the report portal session").build());
        options.addOption(Option.builder().longOpt("session-only").desc("run the report portal session only, skip workbook refresh").build());
        options.addOption(Option.builder().longOpt("files").hasArg().argName("a,b,c").desc("comma-separated workbook paths, overrides sync.files").build());
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("report date (default: today in app.zone)").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
