package io.batchreview;

import io.batchreview.cli.BatchReviewCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BatchReviewCommand()).execute(args);
        System.exit(code);
    }
}
