package io.batchreview.config;

import io.batchreview.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Effective settings. Every field of {@code batchreview-settings.json} is optional and falls
 * back to the matching {@link BatchReviewConfig} default.
 */
public record BatchReviewSettings(
        String gerritUrl,
        String gerritUser,
        String gerritPasswordEnv,
        int automationPort,
        String incomingQuery,
        int incomingLimit,
        String approvingLabel,
        int approvingValue,
        long maxRequestBytes,
        int maxChangeIdLength,
        int maxChangeIdsPerRequest,
        int errorDetailLimit,
        long confirmationTimeoutMs,
        int chainCacheMaxEntries,
        long backendTimeoutMs
) {
    public BatchReviewSettings {
        if (automationPort < 0 || automationPort > 65_535) {
            throw new IllegalArgumentException("automationPort must be within 0..65535: " + automationPort);
        }
        requirePositive("incomingLimit", incomingLimit);
        requirePositive("maxRequestBytes", maxRequestBytes);
        requirePositive("maxChangeIdLength", maxChangeIdLength);
        requirePositive("maxChangeIdsPerRequest", maxChangeIdsPerRequest);
        requirePositive("errorDetailLimit", errorDetailLimit);
        requirePositive("confirmationTimeoutMs", confirmationTimeoutMs);
        requirePositive("chainCacheMaxEntries", chainCacheMaxEntries);
        requirePositive("backendTimeoutMs", backendTimeoutMs);
        if (approvingLabel == null || approvingLabel.isBlank()) {
            throw new IllegalArgumentException("approvingLabel must not be blank");
        }
    }

    public static BatchReviewSettings defaults() {
        return new BatchReviewSettings(
                null,
                null,
                BatchReviewConfig.DEFAULT_PASSWORD_ENV,
                BatchReviewConfig.DEFAULT_AUTOMATION_PORT,
                BatchReviewConfig.DEFAULT_INCOMING_QUERY,
                BatchReviewConfig.DEFAULT_INCOMING_LIMIT,
                BatchReviewConfig.DEFAULT_APPROVING_LABEL,
                BatchReviewConfig.DEFAULT_APPROVING_VALUE,
                BatchReviewConfig.DEFAULT_MAX_REQUEST_BYTES,
                BatchReviewConfig.DEFAULT_MAX_CHANGE_ID_LENGTH,
                BatchReviewConfig.DEFAULT_MAX_CHANGE_IDS_PER_REQUEST,
                BatchReviewConfig.DEFAULT_ERROR_DETAIL_LIMIT,
                BatchReviewConfig.DEFAULT_CONFIRMATION_TIMEOUT_MS,
                BatchReviewConfig.DEFAULT_CHAIN_CACHE_MAX_ENTRIES,
                BatchReviewConfig.DEFAULT_BACKEND_TIMEOUT_MS
        );
    }

    public static BatchReviewSettings load(BatchReviewConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    static BatchReviewSettings fromFile(SettingsFile file, BatchReviewSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new BatchReviewSettings(
                pick(file.gerritUrl(), defaults.gerritUrl()),
                pick(file.gerritUser(), defaults.gerritUser()),
                pick(file.gerritPasswordEnv(), defaults.gerritPasswordEnv()),
                file.automationPort() == null ? defaults.automationPort() : file.automationPort(),
                pick(file.incomingQuery(), defaults.incomingQuery()),
                file.incomingLimit() == null ? defaults.incomingLimit() : file.incomingLimit(),
                pick(file.approvingLabel(), defaults.approvingLabel()),
                file.approvingValue() == null ? defaults.approvingValue() : file.approvingValue(),
                file.maxRequestBytes() == null ? defaults.maxRequestBytes() : file.maxRequestBytes(),
                file.maxChangeIdLength() == null ? defaults.maxChangeIdLength() : file.maxChangeIdLength(),
                file.maxChangeIdsPerRequest() == null ? defaults.maxChangeIdsPerRequest() : file.maxChangeIdsPerRequest(),
                file.errorDetailLimit() == null ? defaults.errorDetailLimit() : file.errorDetailLimit(),
                file.confirmationTimeoutMs() == null ? defaults.confirmationTimeoutMs() : file.confirmationTimeoutMs(),
                file.chainCacheMaxEntries() == null ? defaults.chainCacheMaxEntries() : file.chainCacheMaxEntries(),
                file.backendTimeoutMs() == null ? defaults.backendTimeoutMs() : file.backendTimeoutMs()
        );
    }

    public BatchReviewSettings withGerrit(String url, String user) {
        return new BatchReviewSettings(
                url == null || url.isBlank() ? gerritUrl : url.trim(),
                user == null || user.isBlank() ? gerritUser : user.trim(),
                gerritPasswordEnv, automationPort, incomingQuery, incomingLimit, approvingLabel, approvingValue,
                maxRequestBytes, maxChangeIdLength, maxChangeIdsPerRequest, errorDetailLimit,
                confirmationTimeoutMs, chainCacheMaxEntries, backendTimeoutMs
        );
    }

    public BatchReviewSettings withAutomationPort(int port) {
        return new BatchReviewSettings(
                gerritUrl, gerritUser, gerritPasswordEnv, port, incomingQuery, incomingLimit, approvingLabel,
                approvingValue, maxRequestBytes, maxChangeIdLength, maxChangeIdsPerRequest, errorDetailLimit,
                confirmationTimeoutMs, chainCacheMaxEntries, backendTimeoutMs
        );
    }

    public BatchReviewSettings withConfirmationTimeoutMs(long timeoutMs) {
        return new BatchReviewSettings(
                gerritUrl, gerritUser, gerritPasswordEnv, automationPort, incomingQuery, incomingLimit,
                approvingLabel, approvingValue, maxRequestBytes, maxChangeIdLength, maxChangeIdsPerRequest,
                errorDetailLimit, timeoutMs, chainCacheMaxEntries, backendTimeoutMs
        );
    }

    private static String pick(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static void requirePositive(String field, long value) {
        if (value <= 0L) {
            throw new IllegalArgumentException(field + " must be positive: " + value);
        }
    }

    record SettingsFile(
            String gerritUrl,
            String gerritUser,
            String gerritPasswordEnv,
            Integer automationPort,
            String incomingQuery,
            Integer incomingLimit,
            String approvingLabel,
            Integer approvingValue,
            Long maxRequestBytes,
            Integer maxChangeIdLength,
            Integer maxChangeIdsPerRequest,
            Integer errorDetailLimit,
            Long confirmationTimeoutMs,
            Integer chainCacheMaxEntries,
            Long backendTimeoutMs
    ) {
    }
}
