package io.batchreview.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.batchreview.util.Hashing;
import io.batchreview.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row stores the hash of the previous row, so a
 * removed or edited row breaks the chain from that point on.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-reads the file and checks that every row's {@code prev_hash} and {@code hash} line up.
     *
     * @return index of the first broken row, or -1 when the chain is intact
     */
    public synchronized int verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int index = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))
                        || hash == null
                        || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return index;
                }
                expectedPrev = hash.toString();
            } catch (IOException e) {
                return index;
            }
            index++;
        }
        return -1;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : details;
        }

        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details);
        }
    }
}
