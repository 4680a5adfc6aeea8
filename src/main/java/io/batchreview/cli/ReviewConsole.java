package io.batchreview.cli;

import io.batchreview.automation.ServerLifecycleException;
import io.batchreview.backend.VoteRequest;
import io.batchreview.model.ChainInfo;
import io.batchreview.model.FileInfo;
import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.Severity;
import io.batchreview.runtime.BatchReviewCore;
import io.batchreview.runtime.CoreSnapshot;
import io.batchreview.selection.ListSelection;
import io.batchreview.selection.SelectionAction;
import io.batchreview.selection.SelectionEvent;
import io.batchreview.submission.ArmedConfirmation;
import io.batchreview.submission.SubmissionAction;
import io.batchreview.submission.SubmissionReport;
import io.batchreview.util.Failures;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Line-oriented review console over one {@link BatchReviewCore}. Remote vote and submit actions
 * are armed first, the affected changes are printed, and nothing is sent unless the next line
 * reads {@code confirm}.
 */
public final class ReviewConsole {
    private static final String CONFIRM_WORD = "confirm";

    private final BatchReviewCore core;
    private final BufferedReader in;
    private final PrintWriter out;
    private final int errorDetailLimit;
    private final Duration wait;

    public ReviewConsole(BatchReviewCore core, BufferedReader in, PrintWriter out, int errorDetailLimit, Duration wait) {
        this.core = core;
        this.in = in;
        this.out = out;
        this.errorDetailLimit = errorDetailLimit;
        this.wait = wait;
    }

    /**
     * Reads commands until {@code quit} or end of input.
     */
    public void run() throws IOException {
        out.println("Batch review console. Type 'help' for commands.");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null || !handle(line)) {
                out.flush();
                return;
            }
            out.flush();
        }
    }

    /**
     * Runs one command line.
     *
     * @return false when the console should exit
     */
    boolean handle(String line) throws IOException {
        List<String> tokens = ConsoleCommandParser.parseTokens(line);
        if (tokens.isEmpty()) {
            return true;
        }
        String op = tokens.get(0).toLowerCase(Locale.ROOT);
        List<String> args = tokens.subList(1, tokens.size());
        try {
            Optional<SubmissionAction> confirmed = ConsoleCommandParser.confirmedAction(op);
            if (confirmed.isPresent()) {
                runConfirmed(confirmed.get(), args);
                return true;
            }
            switch (op) {
                case "quit", "exit" -> {
                    return false;
                }
                case "help" -> printHelp();
                case "refresh" -> out.println("Incoming: " + await(core.refreshIncoming()) + " change(s)");
                case "list" -> list(args);
                case "add" -> add(args);
                case "remove" -> remove(args);
                case "clear" -> out.println("Returned " + await(core.clearBatch()).size() + " change(s) to Incoming");
                case "move" -> move(args);
                case "organize" -> out.println(await(core.organize()) ? "Batch reordered" : "Batch already in order");
                case "select" -> select(args);
                case "files" -> files(args);
                case "server" -> server(args);
                default -> out.println("Unknown command: " + op + " (try 'help')");
            }
        } catch (IllegalArgumentException | ServerLifecycleException e) {
            out.println("error: " + e.getMessage());
        } catch (ExecutionException e) {
            out.println("error: " + Failures.rootMessage(e));
        } catch (TimeoutException e) {
            out.println("error: timed out after " + wait.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }

    private void list(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        CoreSnapshot snapshot = await(core.snapshot());
        String which = args.isEmpty() ? "all" : args.get(0).toLowerCase(Locale.ROOT);
        if (!"batch".equals(which)) {
            printQueue("Incoming", snapshot.incoming(), snapshot.selection().incoming(), Map.of());
        }
        if (!"incoming".equals(which) && !"in".equals(which)) {
            printQueue("Batch", snapshot.batch(), snapshot.selection().batch(), snapshot.chains());
        }
        out.println("Automation server: " + snapshot.serverState().name().toLowerCase(Locale.ROOT)
                + (snapshot.serverPort() > 0 ? " on port " + snapshot.serverPort() : ""));
    }

    private void add(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        List<String> targets = new ArrayList<>();
        Map<String, Severity> severities = new LinkedHashMap<>();
        Integer insertAt = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("--score".equals(arg) && i + 1 < args.size()) {
                Map.Entry<String, Severity> score = ConsoleCommandParser.parseScore(args.get(++i));
                severities.put(score.getKey(), score.getValue());
            } else if ("--at".equals(arg) && i + 1 < args.size()) {
                insertAt = parseIndex(args.get(++i));
            } else {
                targets.add(arg);
            }
        }
        CoreSnapshot snapshot = await(core.snapshot());
        List<String> ids = resolve(targets, snapshot.incoming(), QueueKind.INCOMING);
        Map<String, Severity> byRestId = new LinkedHashMap<>();
        for (Map.Entry<String, Severity> entry : severities.entrySet()) {
            byRestId.put(resolveOne(entry.getKey(), snapshot.incoming()), entry.getValue());
        }
        out.println("Added " + await(core.addToBatch(ids, byRestId, insertAt)).added().size() + " change(s) to Batch");
    }

    private void remove(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        List<String> targets = new ArrayList<>();
        Integer insertAt = null;
        for (int i = 0; i < args.size(); i++) {
            if ("--at".equals(args.get(i)) && i + 1 < args.size()) {
                insertAt = parseIndex(args.get(++i));
            } else {
                targets.add(args.get(i));
            }
        }
        CoreSnapshot snapshot = await(core.snapshot());
        List<String> ids = resolve(targets, snapshot.batch(), QueueKind.BATCH);
        out.println("Returned " + await(core.removeFromBatch(ids, insertAt)).size() + " change(s) to Incoming");
    }

    private void move(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        if (args.size() < 3) {
            throw new IllegalArgumentException("usage: move <incoming|batch> <position> <change>...");
        }
        QueueKind queue = QueueKind.fromString(args.get(0));
        int dropIndex = parseIndex(args.get(1));
        CoreSnapshot snapshot = await(core.snapshot());
        List<ReviewItem> items = queue == QueueKind.BATCH ? snapshot.batch() : snapshot.incoming();
        List<String> ids = resolve(args.subList(2, args.size()), items, queue);
        out.println(await(core.reorder(ids, queue, dropIndex)) ? "Moved" : "Order unchanged");
    }

    private void select(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        if (args.size() < 2) {
            throw new IllegalArgumentException("usage: select <incoming|batch> <toggle|range|anchor|chain|all|none> [change]");
        }
        QueueKind queue = QueueKind.fromString(args.get(0));
        String mode = args.get(1).toLowerCase(Locale.ROOT);
        if ("all".equals(mode)) {
            await(core.selectAll(queue));
        } else if ("none".equals(mode)) {
            await(core.selectNone(queue));
        } else {
            if (args.size() < 3) {
                throw new IllegalArgumentException("select " + mode + " needs a change");
            }
            SelectionAction action = SelectionAction.fromString(mode);
            CoreSnapshot snapshot = await(core.snapshot());
            List<ReviewItem> items = queue == QueueKind.BATCH ? snapshot.batch() : snapshot.incoming();
            String restId = resolveOne(args.get(2), items);
            await(core.select(new SelectionEvent(queue, restId, indexOf(items, restId), action)));
        }
        List<String> selected = await(core.selectedIds(queue));
        out.println(selected.size() + " selected in " + queue.name().toLowerCase(Locale.ROOT));
    }

    private void files(List<String> args) throws ExecutionException, TimeoutException, InterruptedException {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("usage: files <change>");
        }
        CoreSnapshot snapshot = await(core.snapshot());
        List<ReviewItem> all = new ArrayList<>(snapshot.incoming());
        all.addAll(snapshot.batch());
        String restId = resolveOne(args.get(0), all);
        List<FileInfo> files = await(core.loadFiles(restId));
        if (files.isEmpty()) {
            out.println("No files");
            return;
        }
        for (FileInfo file : files) {
            out.println(String.format("  %s %s (+%d/-%d)", file.status(), file.path(), file.linesInserted(), file.linesDeleted()));
        }
    }

    private void server(List<String> args) {
        String sub = args.isEmpty() ? "status" : args.get(0).toLowerCase(Locale.ROOT);
        switch (sub) {
            case "start" -> out.println("Automation server listening on port " + core.startServer());
            case "stop" -> {
                core.stopServer();
                out.println("Automation server stopped");
            }
            case "status" -> out.println("Automation server: " + core.serverState().name().toLowerCase(Locale.ROOT)
                    + (core.serverPort() > 0 ? " on port " + core.serverPort() : ""));
            default -> throw new IllegalArgumentException("usage: server start|stop|status");
        }
    }

    private void runConfirmed(SubmissionAction action, List<String> args)
            throws IOException, ExecutionException, TimeoutException, InterruptedException {
        Function<String, CompletableFuture<SubmissionReport>> call = switch (action) {
            case VOTE -> {
                VoteRequest vote = parseVote(args);
                yield token -> core.vote(token, vote);
            }
            case APPROVE -> core::approveAll;
            case SUBMIT -> core::submitAll;
            case APPROVE_AND_SUBMIT -> core::approveAndSubmitAll;
        };
        ArmedConfirmation armed = await(core.arm(action));
        CoreSnapshot snapshot = await(core.snapshot());
        out.println("About to " + describe(action) + " " + armed.restIds().size() + " change(s):");
        for (String restId : armed.restIds()) {
            out.println("  " + describeItem(snapshot.batch(), restId));
        }
        out.print("Type '" + CONFIRM_WORD + "' to proceed, anything else cancels: ");
        out.flush();
        String answer = in.readLine();
        if (answer == null || !CONFIRM_WORD.equals(answer.trim())) {
            core.disarm(armed.token());
            out.println("Cancelled.");
            return;
        }
        out.println("Running " + describe(action) + "...");
        out.flush();
        // Confirmed actions run to completion; every backend call carries its own timeout.
        SubmissionReport report = call.apply(armed.token()).get();
        out.println(report.summary(errorDetailLimit));
    }

    static VoteRequest parseVote(List<String> args) {
        List<String> labelTokens = new ArrayList<>();
        String message = null;
        Boolean resolved = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-m".equals(arg)) {
                message = ConsoleCommandParser.joinTail(args, i + 1);
                break;
            } else if ("--resolved".equals(arg)) {
                resolved = Boolean.TRUE;
            } else if ("--unresolved".equals(arg)) {
                resolved = Boolean.FALSE;
            } else {
                labelTokens.add(arg);
            }
        }
        if (labelTokens.isEmpty()) {
            throw new IllegalArgumentException("usage: vote <Label=Value>... [--resolved|--unresolved] [-m message]");
        }
        return new VoteRequest(ConsoleCommandParser.parseLabelVotes(labelTokens), message, List.of(), List.of(), resolved);
    }

    private List<String> resolve(List<String> targets, List<ReviewItem> items, QueueKind queue)
            throws ExecutionException, TimeoutException, InterruptedException {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("name at least one change, 'selected' or 'all'");
        }
        List<String> out = new ArrayList<>();
        for (String target : targets) {
            if ("selected".equalsIgnoreCase(target)) {
                out.addAll(await(core.selectedIds(queue)));
            } else if ("all".equalsIgnoreCase(target)) {
                for (ReviewItem item : items) {
                    out.add(item.restId());
                }
            } else {
                out.add(resolveOne(target, items));
            }
        }
        return out;
    }

    private static String resolveOne(String target, List<ReviewItem> items) {
        for (ReviewItem item : items) {
            if (item.restId().equals(target)) {
                return item.restId();
            }
        }
        for (ReviewItem item : items) {
            if (target.equals(String.valueOf(item.number())) || target.equals(item.vcsId())) {
                return item.restId();
            }
        }
        throw new IllegalArgumentException("Unknown change: " + target);
    }

    private void printQueue(String title, List<ReviewItem> items, ListSelection selection, Map<String, ChainInfo> chains) {
        out.println(title + " (" + items.size() + "):");
        for (int i = 0; i < items.size(); i++) {
            ReviewItem item = items.get(i);
            String marker = (selection.isSelected(item.restId()) ? "*" : " ")
                    + (item.restId().equals(selection.anchor()) ? ">" : " ");
            StringBuilder line = new StringBuilder();
            line.append(String.format("%s%3d  %-8s %-10s", marker, i, item.label(),
                    item.severity() == null ? "" : item.severity().name()));
            ChainInfo chain = chains.get(item.restId());
            if (chain != null && chain.inChain()) {
                line.append(" [chain ").append(chain.position()).append('/').append(chain.chainLength()).append(']');
            }
            if (item.hasApprovingVote()) {
                line.append(" [approved]");
            }
            if (item.skipReason() != null) {
                line.append(" [").append(item.skipReason()).append(']');
            }
            line.append("  ").append(item.subject() == null ? "" : item.subject());
            out.println(line);
        }
    }

    private static String describeItem(List<ReviewItem> batch, String restId) {
        for (ReviewItem item : batch) {
            if (item.restId().equals(restId)) {
                return item.label() + "  " + (item.subject() == null ? "" : item.subject());
            }
        }
        return restId;
    }

    private static String describe(SubmissionAction action) {
        return switch (action) {
            case VOTE -> "vote on";
            case APPROVE -> "approve";
            case SUBMIT -> "submit";
            case APPROVE_AND_SUBMIT -> "approve and submit";
        };
    }

    private static int indexOf(List<ReviewItem> items, String restId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).restId().equals(restId)) {
                return i;
            }
        }
        return -1;
    }

    private static int parseIndex(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a position: " + raw);
        }
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  refresh                                 fetch incoming changes");
        out.println("  list [incoming|batch]                   show queues");
        out.println("  add <change|selected|all>... [--score change=SEVERITY] [--at N]");
        out.println("  remove <change|selected|all>... [--at N]");
        out.println("  clear                                   return the whole Batch to Incoming");
        out.println("  move <incoming|batch> <N> <change>...   move changes to position N");
        out.println("  organize                                re-sort the Batch");
        out.println("  select <incoming|batch> <toggle|range|anchor|chain> <change>");
        out.println("  select <incoming|batch> <all|none>");
        out.println("  files <change>                          list changed files");
        out.println("  server start|stop|status                automation server");
        out.println("  vote <Label=Value>... [--resolved|--unresolved] [-m message]");
        out.println("  approve | submit | approve-submit       bulk actions on the Batch");
        out.println("  quit");
    }

    private <T> T await(CompletableFuture<T> future) throws ExecutionException, TimeoutException, InterruptedException {
        return future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
    }
}
