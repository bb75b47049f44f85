package io.coordhub.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordhub.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAndChainSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("coordhub-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "default", MutableClock.atEpochSecond(1_700_000_000L));
            first.log(AuditLogger.AuditEvent.of("instance.register", "dev-1", "instance/dev-1", "ok", Map.of("kind", "developer")));
            first.log(AuditLogger.AuditEvent.of("resource.claim", "dev-1", "resource/branch:main", "conflict", null));
            String head = first.currentHash();

            AuditLogger reopened = new AuditLogger(file, "default", MutableClock.atEpochSecond(1_700_000_100L));
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("instance.unregister", "dev-1", "instance/dev-1", "ok", Map.of()));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals("2023-11-14T22:13:20Z", rows.get(0).path("timestamp").asText());

            AuditLogger.IntegrityOutcome ok = reopened.verifyChain();
            Assertions.assertTrue(ok.ok());
            Assertions.assertEquals(3, ok.checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksChain() throws Exception {
        Path root = Files.createTempDirectory("coordhub-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default", MutableClock.atEpochSecond(1_700_000_000L));
            logger.log(AuditLogger.AuditEvent.of("task.assign", "init-1", "task/tsk_1", "ok", Map.of("assignedTo", "dev-1")));
            logger.log(AuditLogger.AuditEvent.of("task.status", "dev-1", "task/tsk_1", "ok", Map.of("status", "completed")));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"completed\"", "\"failed\""), StandardCharsets.UTF_8);

            AuditLogger.IntegrityOutcome broken = logger.verifyChain();
            Assertions.assertFalse(broken.ok());
            Assertions.assertEquals(1, broken.checkedRows());
            Assertions.assertTrue(broken.error().contains("row 2"));
        } finally {
            deleteRecursively(root);
        }
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
