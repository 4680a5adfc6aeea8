package io.batchreview.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BatchReviewConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "batchreview-settings.json";
    public static final int DEFAULT_AUTOMATION_PORT = 17345;
    public static final String DEFAULT_INCOMING_QUERY = "is:open reviewer:self -owner:self";
    public static final int DEFAULT_INCOMING_LIMIT = 100;
    public static final String DEFAULT_APPROVING_LABEL = "Code-Review";
    public static final int DEFAULT_APPROVING_VALUE = 2;
    public static final long DEFAULT_MAX_REQUEST_BYTES = 64L * 1024L;
    public static final int DEFAULT_MAX_CHANGE_ID_LENGTH = 512;
    public static final int DEFAULT_MAX_CHANGE_IDS_PER_REQUEST = 500;
    public static final int DEFAULT_ERROR_DETAIL_LIMIT = 5;
    public static final long DEFAULT_CONFIRMATION_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_CHAIN_CACHE_MAX_ENTRIES = 2_048;
    public static final long DEFAULT_BACKEND_TIMEOUT_MS = 30_000L;
    public static final String DEFAULT_PASSWORD_ENV = "GERRIT_HTTP_PASSWORD";

    private final Path rootDir;

    public BatchReviewConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BatchReviewConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BatchReviewConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
