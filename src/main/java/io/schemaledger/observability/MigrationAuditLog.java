package io.schemaledger.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaledger.security.SensitiveDataMasker;
import io.schemaledger.util.Hashing;
import io.schemaledger.util.Jsons;

import java.io.IOException;
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
 * Append-only JSON-lines audit of runner events. Each row carries the hash of the previous row, so
 * {@link #verify()} detects edited, dropped or reordered lines.
 */
public final class MigrationAuditLog {
    private final Path auditFile;
    private final String actor;
    private String previousHash;

    public MigrationAuditLog(Path auditFile, String actor) {
        this.auditFile = auditFile;
        this.actor = actor == null || actor.isBlank() ? "system" : actor.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("actor", actor);
        row.put("action", event.action());
        row.put("migration", event.migration());
        row.put("batch", event.batch());
        row.put("result", event.result());
        row.put("error", event.error() == null ? null : SensitiveDataMasker.maskText(event.error()));
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized VerifyOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new VerifyOutcome(false, checked, i + 1, "unparseable row");
            }
            if (!(node instanceof ObjectNode obj)) {
                return new VerifyOutcome(false, checked, i + 1, "row is not an object");
            }
            String hash = obj.path("hash").asText("");
            if (!expectedPrev.equals(obj.path("prev_hash").asText(""))) {
                return new VerifyOutcome(false, checked, i + 1, "prev_hash mismatch");
            }
            ObjectNode body = obj.deepCopy();
            body.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(body)))) {
                return new VerifyOutcome(false, checked, i + 1, "hash mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new VerifyOutcome(true, checked, 0, "ok");
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
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    public record AuditEvent(
            String action,
            String migration,
            Integer batch,
            String result,
            String error,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String migration, Integer batch, String result, String error) {
            return new AuditEvent(action, migration, batch, result, error, Map.of());
        }

        public static AuditEvent of(String action, Integer batch, String result, Map<String, Object> details) {
            return new AuditEvent(action, null, batch, result, null, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean valid, int rowsChecked, int brokenAtLine, String reason) {
    }
}
