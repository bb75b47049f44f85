package io.coordhub.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordhub.security.SensitiveDataMasker;
import io.coordhub.util.Hashing;
import io.coordhub.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines event trail. Each row carries the hash of the previous row so truncation or editing of
 * the file is detectable with {@link #verifyChain()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
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

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", SensitiveDataMasker.masked(event.details()));
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

    public Path auditFile() {
        return auditFile;
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    public synchronized IntegrityOutcome verifyChain() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            JsonNode node = parse(line);
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new IntegrityOutcome(false, checked, "prev_hash mismatch at row " + (checked + 1));
            }
            Map<String, Object> row = Jsons.mapper().convertValue(node, Jsons.MAP_TYPE);
            row.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new IntegrityOutcome(false, checked, "hash mismatch at row " + (checked + 1));
            }
            expectedPrev = hash;
            checked++;
        }
        return new IntegrityOutcome(true, checked, "");
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private static JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt audit row: " + line, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(boolean ok, int checkedRows, String error) {
    }
}
