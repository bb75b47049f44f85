package io.coordhub.task;

import io.coordhub.MutableClock;
import io.coordhub.error.CoordinationException;
import io.coordhub.error.ErrorKind;
import io.coordhub.model.InstanceKind;
import io.coordhub.model.InstanceStatus;
import io.coordhub.model.Priority;
import io.coordhub.model.TaskAssignment;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskStatus;
import io.coordhub.registry.InstanceRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class TaskLedgerTest {

    @Test
    void assignToUnknownInstanceFailsAndLeavesLedgerUnchanged() {
        InstanceRegistry registry = new InstanceRegistry(MutableClock.atEpochSecond(1_000L));
        TaskLedger ledger = new TaskLedger(registry, MutableClock.atEpochSecond(1_000L));

        CoordinationException error = Assertions.assertThrows(CoordinationException.class, () -> ledger.assign(
                new NewTask(TaskKind.REVIEW, "nobody", "init-1", null, 7, Map.of(), null)));

        Assertions.assertEquals(ErrorKind.NOT_FOUND, error.kind());
        Assertions.assertEquals(0, ledger.size());
    }

    @Test
    void assignCreatesPendingTaskAndStatusUpdatesAreUnordered() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        InstanceRegistry registry = new InstanceRegistry(clock);
        registry.register("rev-1", InstanceKind.REVIEWER, InstanceStatus.IDLE, List.of("code-review"), Map.of());
        TaskLedger ledger = new TaskLedger(registry, clock);

        TaskAssignment task = ledger.assign(new NewTask(TaskKind.REVIEW, "rev-1", "init-1", null, 7, Map.of("k", "v"), null));
        Assertions.assertEquals(TaskStatus.PENDING, task.status());
        Assertions.assertEquals(task.createdAt(), task.updatedAt());
        Assertions.assertTrue(task.id().startsWith("tsk_"));

        clock.advance(Duration.ofSeconds(3));
        ledger.updateStatus(task.id(), TaskStatus.COMPLETED, Map.of("result", "approved"));
        TaskAssignment reopened = ledger.updateStatus(task.id(), TaskStatus.PENDING, null);

        Assertions.assertEquals(TaskStatus.PENDING, reopened.status());
        Assertions.assertEquals(clock.instant(), reopened.updatedAt());
        Assertions.assertEquals("v", reopened.metadata().get("k"));
        Assertions.assertEquals("approved", reopened.metadata().get("result"));
    }

    @Test
    void updateStatusOfUnknownTaskFailsWithNotFound() {
        InstanceRegistry registry = new InstanceRegistry(MutableClock.atEpochSecond(1_000L));
        TaskLedger ledger = new TaskLedger(registry, MutableClock.atEpochSecond(1_000L));
        CoordinationException error = Assertions.assertThrows(CoordinationException.class,
                () -> ledger.updateStatus("tsk_missing", TaskStatus.FAILED, null));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, error.kind());
        Assertions.assertTrue(ledger.get("tsk_missing").isEmpty());
    }

    @Test
    void listMatchesAllProvidedFilters() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        InstanceRegistry registry = new InstanceRegistry(clock);
        registry.register("dev-1", InstanceKind.DEVELOPER, InstanceStatus.IDLE, List.of("development"), Map.of());
        registry.register("tst-1", InstanceKind.TESTER, InstanceStatus.IDLE, List.of("testing"), Map.of());
        TaskLedger ledger = new TaskLedger(registry, clock);
        TaskAssignment dev = ledger.assign(new NewTask(TaskKind.DEVELOP, "dev-1", "init-1", 1, null, null, null));
        ledger.assign(new NewTask(TaskKind.TEST, "tst-1", "init-1", 1, null, null, null));
        ledger.assign(new NewTask(TaskKind.DEVELOP, "dev-1", "other", 2, null, null, null));
        ledger.updateStatus(dev.id(), TaskStatus.IN_PROGRESS, null);

        Assertions.assertEquals(3, ledger.list(TaskFilter.all()).size());
        Assertions.assertEquals(2, ledger.list(new TaskFilter("dev-1", null, null, null)).size());
        Assertions.assertEquals(1, ledger.list(new TaskFilter("dev-1", "init-1", null, TaskKind.DEVELOP)).size());
        List<TaskAssignment> running = ledger.list(new TaskFilter(null, null, TaskStatus.IN_PROGRESS, null));
        Assertions.assertEquals(dev.id(), running.get(0).id());
    }

    @Test
    void requestDeveloperWithoutCapacityReturnsEmptyOutcome() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        InstanceRegistry registry = new InstanceRegistry(clock);
        registry.register("dev-busy", InstanceKind.DEVELOPER, InstanceStatus.BUSY, List.of("development"), Map.of());
        TaskLedger ledger = new TaskLedger(registry, clock);

        TaskLedger.DeveloperRequestOutcome out = ledger.requestDeveloper(12, Priority.HIGH, List.of(), "development", 60_000L);

        Assertions.assertEquals("", out.taskId());
        Assertions.assertNull(out.assignedTo());
        Assertions.assertFalse(out.assigned());
        Assertions.assertEquals(0, ledger.size());
    }

    @Test
    void requestDeveloperPicksFirstAvailableAndBuildsSpecification() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        InstanceRegistry registry = new InstanceRegistry(clock);
        registry.register("reviewer", InstanceKind.REVIEWER, InstanceStatus.IDLE, List.of("code-review"), Map.of());
        registry.register("dev-a", InstanceKind.DEVELOPER, InstanceStatus.IDLE, List.of("development"), Map.of());
        registry.register("dev-b", InstanceKind.DEVELOPER, InstanceStatus.IDLE, List.of("development"), Map.of());
        TaskLedger ledger = new TaskLedger(registry, clock);

        TaskLedger.DeveloperRequestOutcome out = ledger.requestDeveloper(
                12, Priority.LOW, List.of("add login"), "development", 60_000L);

        Assertions.assertEquals("dev-a", out.assignedTo());
        Assertions.assertEquals(clock.instant(), out.estimatedStart());
        TaskAssignment task = ledger.get(out.taskId()).orElseThrow();
        Assertions.assertEquals(TaskKind.DEVELOP, task.kind());
        Assertions.assertEquals(TaskLedger.SYSTEM_ASSIGNER, task.assignedBy());
        Assertions.assertEquals(12, task.issueNumber());
        Assertions.assertEquals("Issue #12", task.specification().title());
        Assertions.assertEquals(List.of("add login"), task.specification().requirements());
        Assertions.assertEquals(Priority.LOW, task.specification().priority());
    }
}
