package io.coordhub.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.coordhub.config.CoordHubConfig;
import io.coordhub.config.CoordinationSettings;
import io.coordhub.error.CoordinationException;
import io.coordhub.error.ErrorKind;
import io.coordhub.lease.ResourceLeaseManager;
import io.coordhub.memory.KnowledgeGraphStore;
import io.coordhub.memory.MemoryQuery;
import io.coordhub.model.Instance;
import io.coordhub.model.InstanceKind;
import io.coordhub.model.InstanceStatus;
import io.coordhub.model.MemoryEntity;
import io.coordhub.model.MemoryRelation;
import io.coordhub.model.Priority;
import io.coordhub.model.RelationType;
import io.coordhub.model.ResourceClaim;
import io.coordhub.model.ResourceKind;
import io.coordhub.model.TaskAssignment;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskStatus;
import io.coordhub.observability.AuditLogger;
import io.coordhub.observability.PrometheusFormatter;
import io.coordhub.registry.InstanceRegistry;
import io.coordhub.task.NewTask;
import io.coordhub.task.TaskFilter;
import io.coordhub.task.TaskLedger;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of all coordination state. Every operation runs under one lock, including the background expiry sweep,
 * so no caller observes a half-applied mutation. Audit rows are appended under the same lock, so the hash chain
 * follows the order mutations were applied. A failed audit write surfaces after the mutation has committed;
 * state is not rolled back.
 *
 * <p>The sweep timer only runs after {@link #start()}; embedded and test use never leaks a background thread
 * unless it asks for one.
 */
public final class CoordHubRuntime implements AutoCloseable {
    private static final String SYSTEM_ACTOR = "system";
    private static final String RPC_ACTOR = "rpc";

    private final CoordHubConfig config;
    private final Clock clock;
    private final Object stateLock;
    private final Object lifecycleLock;
    private final InstanceRegistry registry;
    private final ResourceLeaseManager leases;
    private final TaskLedger ledger;
    private final KnowledgeGraphStore graph;
    private final AuditLogger auditLogger;
    private final Instant startedAt;
    private final AtomicLong reRegisterTotal;
    private final AtomicLong claimConflictTotal;
    private final AtomicLong claimsExpiredTotal;
    private final AtomicLong claimsCascadedTotal;
    private final AtomicLong noCapacityTotal;
    private final AtomicLong rejectedTotal;
    private volatile CoordinationSettings settings;
    private ScheduledExecutorService sweeper;
    private long sweeperIntervalMs;
    private boolean started;

    public CoordHubRuntime(CoordHubConfig config) {
        this(config, Clock.systemUTC());
    }

    public CoordHubRuntime(CoordHubConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.stateLock = new Object();
        this.lifecycleLock = new Object();
        this.registry = new InstanceRegistry(clock);
        this.leases = new ResourceLeaseManager(clock);
        this.ledger = new TaskLedger(registry, clock);
        this.graph = new KnowledgeGraphStore(clock);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), clock);
        this.startedAt = clock.instant();
        this.reRegisterTotal = new AtomicLong(0L);
        this.claimConflictTotal = new AtomicLong(0L);
        this.claimsExpiredTotal = new AtomicLong(0L);
        this.claimsCascadedTotal = new AtomicLong(0L);
        this.noCapacityTotal = new AtomicLong(0L);
        this.rejectedTotal = new AtomicLong(0L);
        this.settings = CoordinationSettings.load(config.settingsFile());
    }

    /**
     * Starts the periodic expiry sweep when settings enable it. Calling twice is a no-op.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (started) {
                return;
            }
            started = true;
            scheduleSweep();
        }
    }

    public boolean sweeperRunning() {
        synchronized (lifecycleLock) {
            return sweeper != null;
        }
    }

    /**
     * Period of the running sweep timer, or 0 when no timer runs.
     */
    public long sweeperIntervalMs() {
        synchronized (lifecycleLock) {
            return sweeper == null ? 0L : sweeperIntervalMs;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            started = false;
            stopSweep();
        }
    }

    public CoordinationSettings settings() {
        return settings;
    }

    public CoordHubConfig config() {
        return config;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    /**
     * Re-reads the settings file. A started runtime reschedules its sweep timer when {@code sweepIntervalMs} or
     * {@code sweepEnabled} changed.
     */
    public SettingsReloadOutcome reloadSettings() {
        boolean exists = Files.exists(config.settingsFile());
        CoordinationSettings loaded = CoordinationSettings.load(config.settingsFile());
        List<String> changed;
        synchronized (stateLock) {
            changed = settings.diff(loaded);
            settings = loaded;
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "settings.load",
                    SYSTEM_ACTOR,
                    "settings/" + config.namespace(),
                    changed.isEmpty() ? "unchanged" : "changed",
                    Map.of("changedFields", changed, "configExists", exists)
            ));
        }
        if (changed.contains("sweepIntervalMs") || changed.contains("sweepEnabled")) {
            synchronized (lifecycleLock) {
                if (started) {
                    stopSweep();
                    scheduleSweep();
                }
            }
        }
        return new SettingsReloadOutcome(!changed.isEmpty(), exists, config.settingsFile().toString(), loaded, changed);
    }

    // Instance registry

    public RegisterOutcome register(RegisterRequest request) {
        synchronized (stateLock) {
            InstanceRegistry.RegisterOutcome out = registry.register(
                    request.id(),
                    request.kind(),
                    request.status(),
                    request.capabilities(),
                    request.metadata()
            );
            if (out.reRegistered()) {
                reRegisterTotal.incrementAndGet();
            }
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "instance.register",
                    request.id(),
                    "instance/" + request.id(),
                    out.reRegistered() ? "re_registered" : "ok",
                    Map.of(
                            "kind", request.kind().wireName(),
                            "status", request.status().wireName(),
                            "capabilities", List.copyOf(out.instance().capabilities()),
                            "metadata", out.instance().metadata()
                    )
            ));
            return new RegisterOutcome(true, request.id());
        }
    }

    public HeartbeatOutcome heartbeat(String instanceId, InstanceStatus status, Map<String, Object> metadata) {
        synchronized (stateLock) {
            Instance updated = registry.heartbeat(instanceId, status, metadata);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "instance.heartbeat",
                    instanceId,
                    "instance/" + instanceId,
                    "ok",
                    Map.of("status", updated.status().wireName())
            ));
            return new HeartbeatOutcome(true);
        }
    }

    public UnregisterOutcome unregister(String instanceId) {
        synchronized (stateLock) {
            boolean existed = registry.unregister(instanceId).isPresent();
            int released = 0;
            if (existed) {
                released = leases.releaseAllHeldBy(instanceId);
            }
            claimsCascadedTotal.addAndGet(released);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "instance.unregister",
                    instanceId,
                    "instance/" + instanceId,
                    existed ? "ok" : "absent",
                    Map.of("releasedClaims", released)
            ));
            return new UnregisterOutcome(existed, released);
        }
    }

    public InstancesOutcome listInstances(InstanceKind kind, InstanceStatus status) {
        synchronized (stateLock) {
            return new InstancesOutcome(registry.list(kind, status));
        }
    }

    // Task ledger

    public AssignOutcome assignTask(NewTask task) {
        synchronized (stateLock) {
            TaskAssignment created = ledger.assign(task);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "task.assign",
                    created.assignedBy(),
                    "task/" + created.id(),
                    "ok",
                    Map.of("kind", created.kind().wireName(), "assignedTo", created.assignedTo())
            ));
            return new AssignOutcome(created.id(), true);
        }
    }

    public TaskUpdateOutcome updateTaskStatus(String taskId, TaskStatus status, Map<String, Object> metadata) {
        synchronized (stateLock) {
            TaskAssignment updated = ledger.updateStatus(taskId, status, metadata);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "task.status",
                    updated.assignedTo(),
                    "task/" + taskId,
                    "ok",
                    Map.of("status", status.wireName())
            ));
            return new TaskUpdateOutcome(true);
        }
    }

    public TaskOutcome getTask(String taskId) {
        synchronized (stateLock) {
            return new TaskOutcome(ledger.get(taskId).orElse(null));
        }
    }

    public TasksOutcome listTasks(TaskFilter filter) {
        synchronized (stateLock) {
            return new TasksOutcome(ledger.list(filter));
        }
    }

    public DeveloperRequestOutcome requestDeveloper(int issueNumber, Priority priority, List<String> requirements) {
        CoordinationSettings current = settings;
        synchronized (stateLock) {
            TaskLedger.DeveloperRequestOutcome out = ledger.requestDeveloper(
                    issueNumber,
                    priority == null ? Priority.MEDIUM : priority,
                    requirements == null ? List.of() : requirements,
                    current.requiredCapability(TaskKind.DEVELOP),
                    current.instanceTimeoutMs()
            );
            if (!out.assigned()) {
                noCapacityTotal.incrementAndGet();
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("issueNumber", issueNumber);
            details.put("assignedTo", out.assignedTo());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "task.request_developer",
                    SYSTEM_ACTOR,
                    out.assigned() ? "task/" + out.taskId() : "issue/" + issueNumber,
                    out.assigned() ? "ok" : "no_capacity",
                    details
            ));
            return new DeveloperRequestOutcome(out.taskId(), out.assignedTo(), out.estimatedStart());
        }
    }

    // Resource leases

    public ClaimOutcome claimResource(ResourceKind kind, String resourceId, String instanceId, String operation) {
        long ttlMs = settings.claimTtlMs();
        synchronized (stateLock) {
            ResourceLeaseManager.ClaimOutcome out = leases.claim(kind, resourceId, instanceId, operation, ttlMs);
            String resource = "resource/" + ResourceClaim.resourceKey(kind, resourceId);
            if (!out.claimed()) {
                claimConflictTotal.incrementAndGet();
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "resource.claim",
                        instanceId,
                        resource,
                        "conflict",
                        Map.of("operation", operation, "conflictsWith", out.conflictsWith())
                ));
                return new ClaimOutcome(false, out.conflictsWith(), null, null);
            }
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "resource.claim",
                    instanceId,
                    resource,
                    "ok",
                    Map.of("operation", operation, "expiresAt", out.claim().expiresAt().toString())
            ));
            return new ClaimOutcome(true, null, out.claim().id(), out.claim().expiresAt());
        }
    }

    public ReleaseOutcome releaseResource(ResourceKind kind, String resourceId, String instanceId) {
        synchronized (stateLock) {
            boolean released = leases.release(kind, resourceId, instanceId);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "resource.release",
                    instanceId,
                    "resource/" + ResourceClaim.resourceKey(kind, resourceId),
                    released ? "ok" : "absent",
                    Map.of()
            ));
            return new ReleaseOutcome(released);
        }
    }

    /**
     * Removes every expired claim. Runs on the sweep timer after {@link #start()}; callable directly for
     * diagnostics.
     */
    public int sweepExpiredClaims() {
        synchronized (stateLock) {
            int removed = leases.sweepExpired();
            if (removed > 0) {
                claimsExpiredTotal.addAndGet(removed);
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "resource.sweep",
                        SYSTEM_ACTOR,
                        "resource/*",
                        "ok",
                        Map.of("removed", removed)
                ));
            }
            return removed;
        }
    }

    // Knowledge graph

    public EntityCreatedOutcome createEntity(
            String name,
            String entityType,
            List<String> observations,
            Map<String, Object> metadata
    ) {
        synchronized (stateLock) {
            MemoryEntity entity = graph.createEntity(name, entityType, observations, metadata);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.entity.create",
                    RPC_ACTOR,
                    "entity/" + name,
                    "ok",
                    Map.of("entityType", entityType, "observations", entity.observations().size())
            ));
            return new EntityCreatedOutcome(true, entity);
        }
    }

    public EntityUpdatedOutcome updateEntity(String name, List<String> observations, Map<String, Object> metadata) {
        synchronized (stateLock) {
            MemoryEntity entity = graph.updateEntity(name, observations, metadata);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.entity.update",
                    RPC_ACTOR,
                    "entity/" + name,
                    "ok",
                    Map.of("version", entity.version())
            ));
            return new EntityUpdatedOutcome(true, entity);
        }
    }

    public RelationCreatedOutcome createRelation(
            String from,
            String to,
            RelationType relationType,
            Double strength,
            Map<String, Object> metadata
    ) {
        synchronized (stateLock) {
            MemoryRelation relation = graph.createRelation(from, to, relationType, strength, metadata);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.relation.create",
                    RPC_ACTOR,
                    "relation/" + relation.id(),
                    "ok",
                    Map.of("from", from, "to", to, "relationType", relationType.wireName(), "strength", relation.strength())
            ));
            return new RelationCreatedOutcome(true, relation);
        }
    }

    /**
     * {@code limit} of null falls back to the configured default.
     */
    public KnowledgeGraphStore.SearchOutcome searchEntities(
            String entityName,
            String entityType,
            String observations,
            Integer limit
    ) {
        int effectiveLimit = limit == null ? settings.searchLimitDefault() : limit;
        synchronized (stateLock) {
            return graph.search(new MemoryQuery(entityName, entityType, observations, effectiveLimit));
        }
    }

    public KnowledgeGraphStore.EntityView getEntity(String name) {
        synchronized (stateLock) {
            return graph.getEntity(name);
        }
    }

    public DeleteOutcome deleteEntity(String name) {
        synchronized (stateLock) {
            boolean deleted = graph.deleteEntity(name);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "memory.entity.delete",
                    RPC_ACTOR,
                    "entity/" + name,
                    deleted ? "ok" : "absent",
                    Map.of()
            ));
            return new DeleteOutcome(deleted);
        }
    }

    // Introspection

    public StatsOutcome stats() {
        synchronized (stateLock) {
            Instant now = clock.instant();
            Map<String, Integer> instancesByStatus = new LinkedHashMap<>();
            for (InstanceStatus status : InstanceStatus.values()) {
                instancesByStatus.put(status.wireName(), 0);
            }
            for (Instance instance : registry.snapshot().values()) {
                instancesByStatus.merge(instance.status().wireName(), 1, Integer::sum);
            }
            Map<String, Integer> tasksByStatus = new LinkedHashMap<>();
            for (TaskStatus status : TaskStatus.values()) {
                tasksByStatus.put(status.wireName(), 0);
            }
            for (TaskAssignment task : ledger.snapshot().values()) {
                tasksByStatus.merge(task.status().wireName(), 1, Integer::sum);
            }
            return new StatsOutcome(
                    Math.max(0L, Duration.between(startedAt, now).toMillis()),
                    registry.size(),
                    ledger.size(),
                    leases.size(),
                    graph.entityCount(),
                    graph.relationCount(),
                    startedAt,
                    instancesByStatus,
                    tasksByStatus,
                    reRegisterTotal.get(),
                    claimConflictTotal.get(),
                    claimsExpiredTotal.get(),
                    claimsCascadedTotal.get(),
                    noCapacityTotal.get(),
                    rejectedTotal.get()
            );
        }
    }

    /**
     * Debug dump. Never a basis for control decisions: it is stale as soon as the lock is released.
     */
    public StateSnapshot state() {
        synchronized (stateLock) {
            return new StateSnapshot(
                    registry.snapshot(),
                    ledger.snapshot(),
                    leases.snapshot(),
                    graph.entitySnapshot(),
                    graph.relationSnapshot()
            );
        }
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats(), config.namespace());
    }

    /**
     * Records a call refused before it touched state.
     */
    public void recordRejection(String method, CoordinationException error) {
        rejectedTotal.incrementAndGet();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", error.kind().name());
        details.put("message", error.getMessage());
        synchronized (stateLock) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "rpc." + (method == null || method.isBlank() ? "unknown" : method.trim()),
                    RPC_ACTOR,
                    error.kind() == ErrorKind.UNKNOWN_METHOD ? "method/unknown" : "method/" + method,
                    "rejected",
                    details
            ));
        }
    }

    // Callers hold lifecycleLock.
    private void scheduleSweep() {
        CoordinationSettings current = settings;
        if (!current.sweepEnabled()) {
            return;
        }
        long interval = current.sweepIntervalMs();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "coordhub-claim-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::sweepOnTimer, interval, interval, TimeUnit.MILLISECONDS);
        sweeper = executor;
        sweeperIntervalMs = interval;
    }

    private void stopSweep() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdownNow();
        sweeper = null;
        sweeperIntervalMs = 0L;
    }

    private void sweepOnTimer() {
        try {
            sweepExpiredClaims();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule.
            System.err.println("WARN claim sweep failed: " + e.getMessage());
        }
    }

    public record RegisterRequest(
            String id,
            InstanceKind kind,
            InstanceStatus status,
            List<String> capabilities,
            Map<String, Object> metadata
    ) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            CoordinationSettings settings,
            List<String> changedFields
    ) {
    }

    public record RegisterOutcome(boolean registered, String instanceId) {
    }

    public record HeartbeatOutcome(boolean acknowledged) {
    }

    public record UnregisterOutcome(boolean unregistered, int releasedClaims) {
    }

    public record InstancesOutcome(List<Instance> instances) {
    }

    public record AssignOutcome(String taskId, boolean assigned) {
    }

    public record TaskUpdateOutcome(boolean updated) {
    }

    public record TaskOutcome(TaskAssignment task) {
    }

    public record TasksOutcome(List<TaskAssignment> tasks) {
    }

    public record DeveloperRequestOutcome(
            String taskId,
            String assignedTo,
            @JsonInclude(JsonInclude.Include.NON_NULL) Instant estimatedStart
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClaimOutcome(boolean claimed, List<String> conflictsWith, String claimId, Instant expiresAt) {
    }

    public record ReleaseOutcome(boolean released) {
    }

    public record EntityCreatedOutcome(boolean created, MemoryEntity entity) {
    }

    public record EntityUpdatedOutcome(boolean updated, MemoryEntity entity) {
    }

    public record RelationCreatedOutcome(boolean created, MemoryRelation relation) {
    }

    public record DeleteOutcome(boolean deleted) {
    }

    public record StatsOutcome(
            long uptimeMs,
            int instances,
            int tasks,
            int resources,
            int entities,
            int relations,
            Instant startedAt,
            Map<String, Integer> instancesByStatus,
            Map<String, Integer> tasksByStatus,
            long reRegisterTotal,
            long claimConflictTotal,
            long claimsExpiredTotal,
            long claimsCascadedTotal,
            long noCapacityTotal,
            long rejectedTotal
    ) {
    }

    public record StateSnapshot(
            Map<String, Instance> instances,
            Map<String, TaskAssignment> tasks,
            Map<String, ResourceClaim> resources,
            Map<String, MemoryEntity> entities,
            Map<String, MemoryRelation> relations
    ) {
    }
}
