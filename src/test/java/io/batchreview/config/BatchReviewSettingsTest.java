package io.batchreview.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class BatchReviewSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("batchreview-test-settings-defaults-");
        try {
            BatchReviewSettings settings = BatchReviewSettings.load(BatchReviewConfig.fromRoot(root.toString()));

            Assertions.assertEquals(BatchReviewSettings.defaults(), settings);
            Assertions.assertEquals(BatchReviewConfig.DEFAULT_AUTOMATION_PORT, settings.automationPort());
            Assertions.assertEquals("Code-Review", settings.approvingLabel());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesOnlyTheFieldsItNames() throws Exception {
        Path root = Files.createTempDirectory("batchreview-test-settings-file-");
        try {
            Files.writeString(root.resolve(BatchReviewConfig.SETTINGS_FILE), """
                    {
                      "gerritUrl": "https://review.example.org",
                      "automationPort": 18000,
                      "confirmationTimeoutMs": 2500,
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);

            BatchReviewSettings settings = BatchReviewSettings.load(BatchReviewConfig.fromRoot(root.toString()));

            Assertions.assertEquals("https://review.example.org", settings.gerritUrl());
            Assertions.assertEquals(18000, settings.automationPort());
            Assertions.assertEquals(2500L, settings.confirmationTimeoutMs());
            Assertions.assertEquals(BatchReviewConfig.DEFAULT_INCOMING_QUERY, settings.incomingQuery());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidValuesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("batchreview-test-settings-invalid-");
        try {
            Files.writeString(root.resolve(BatchReviewConfig.SETTINGS_FILE), "{\"automationPort\": 70000}", StandardCharsets.UTF_8);

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> BatchReviewSettings.load(BatchReviewConfig.fromRoot(root.toString())));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> BatchReviewSettings.defaults().withConfirmationTimeoutMs(0L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cliOverridesKeepBlankValuesFromSettings() {
        BatchReviewSettings base = BatchReviewSettings.defaults().withGerrit("https://a.example", "ana");

        BatchReviewSettings overridden = base.withGerrit(" ", "bo").withAutomationPort(0);

        Assertions.assertEquals("https://a.example", overridden.gerritUrl());
        Assertions.assertEquals("bo", overridden.gerritUser());
        Assertions.assertEquals(0, overridden.automationPort());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
