package io.batchreview.cli;

import io.batchreview.backend.GerritRestBackend;
import io.batchreview.config.BatchReviewConfig;
import io.batchreview.config.BatchReviewSettings;
import io.batchreview.model.Severity;
import io.batchreview.observability.AuditLogger;
import io.batchreview.runtime.BatchReviewCore;
import io.batchreview.util.Failures;
import io.batchreview.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "batchreview",
        mixinStandardHelpOptions = true,
        description = "Batch code-review orchestration with a loopback automation control plane",
        subcommands = {
                BatchReviewCommand.ServeCommand.class,
                BatchReviewCommand.HealthCommand.class,
                BatchReviewCommand.BatchCommand.class,
                BatchReviewCommand.IncomingCommand.class,
                BatchReviewCommand.BatchAddCommand.class,
                BatchReviewCommand.BatchClearCommand.class
        }
)
public final class BatchReviewCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (settings file, audit log)", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | health | batch | incoming | batch-add | batch-clear");
    }

    BatchReviewConfig config() {
        return BatchReviewConfig.fromRoot(root);
    }

    BatchReviewSettings settings() {
        return BatchReviewSettings.load(config());
    }

    AutomationClient client(Integer portOverride) {
        BatchReviewSettings settings = settings();
        int port = portOverride == null ? settings.automationPort() : portOverride;
        return new AutomationClient(port, Duration.ofMillis(settings.backendTimeoutMs()));
    }

    static int print(AutomationClient.Response response) {
        System.out.println(response.body() == null ? "{}" : Jsons.toJson(response.body()));
        return response.ok() ? 0 : 1;
    }

    @Command(name = "serve", description = "Run the review console against Gerrit with the automation server enabled")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--gerrit-url"}, description = "Gerrit base URL (overrides settings)")
        String gerritUrl;

        @Option(names = {"--user"}, description = "Gerrit HTTP user (overrides settings)")
        String user;

        @Option(names = {"--port"}, description = "Automation server port (overrides settings)")
        Integer port;

        @Option(names = {"--no-server"}, defaultValue = "false", description = "Do not start the automation server")
        boolean noServer;

        @Override
        public Integer call() throws IOException {
            BatchReviewConfig config = parent.config();
            BatchReviewSettings settings = parent.settings().withGerrit(gerritUrl, user);
            if (port != null) {
                settings = settings.withAutomationPort(port);
            }
            if (settings.gerritUrl() == null) {
                System.err.println("No Gerrit URL: pass --gerrit-url or set gerritUrl in " + config.settingsFile());
                return 2;
            }
            GerritRestBackend backend = new GerritRestBackend(
                    settings.gerritUrl(),
                    settings.gerritUser(),
                    System.getenv(settings.gerritPasswordEnv()),
                    Duration.ofMillis(settings.backendTimeoutMs()),
                    settings.approvingLabel(),
                    settings.approvingValue()
            );
            AuditLogger audit = new AuditLogger(config.auditFile());
            PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try (BatchReviewCore core = new BatchReviewCore(settings, backend, audit)) {
                if (!noServer) {
                    out.println("Automation server listening on port " + core.startServer());
                }
                try {
                    Integer count = core.refreshIncoming().get(settings.backendTimeoutMs(), TimeUnit.MILLISECONDS);
                    out.println("Incoming: " + count + " change(s)");
                } catch (ExecutionException | TimeoutException e) {
                    out.println("Initial refresh failed: " + Failures.rootMessage(e));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return 1;
                }
                new ReviewConsole(core, in, out, settings.errorDetailLimit(),
                        Duration.ofMillis(settings.backendTimeoutMs() * 4)).run();
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Check a running automation server")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--port"}, description = "Automation server port (defaults to settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            return print(parent.client(port).health());
        }
    }

    @Command(name = "batch", description = "Show the Batch queue of a running automation server")
    static final class BatchCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--port"}, description = "Automation server port (defaults to settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            return print(parent.client(port).batch());
        }
    }

    @Command(name = "incoming", description = "Show the Incoming queue of a running automation server")
    static final class IncomingCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--port"}, description = "Automation server port (defaults to settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            return print(parent.client(port).incoming());
        }
    }

    @Command(name = "batch-add", description = "Stage changes in the Batch of a running automation server")
    static final class BatchAddCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--port"}, description = "Automation server port (defaults to settings)")
        Integer port;

        @Option(names = {"--score"}, description = "Severity per change: id=CRITICAL|HIGH|MEDIUM|LOW|APPROVED or id=1..10")
        List<String> scores = new ArrayList<>();

        @Parameters(arity = "1..*", paramLabel = "CHANGE", description = "Change ids (project~branch~Change-Id)")
        List<String> ids;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> body = new LinkedHashMap<>();
            for (String raw : scores) {
                Map.Entry<String, Severity> score = ConsoleCommandParser.parseScore(raw);
                body.put(score.getKey(), score.getValue().name());
            }
            return print(parent.client(port).addToBatch(ids, body));
        }
    }

    @Command(name = "batch-clear", description = "Return every staged change to Incoming")
    static final class BatchClearCommand implements Callable<Integer> {
        @ParentCommand
        BatchReviewCommand parent;

        @Option(names = {"--port"}, description = "Automation server port (defaults to settings)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            return print(parent.client(port).clearBatch());
        }
    }
}
