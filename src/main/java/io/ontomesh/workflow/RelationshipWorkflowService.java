package io.ontomesh.workflow;

import io.ontomesh.config.EngineSettings;
import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaRelationship;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowException;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.observability.AuditLogger;
import io.ontomesh.queue.QueueSettings;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.TaskFailure;
import io.ontomesh.queue.WorkQueue;
import io.ontomesh.queue.WorkflowCancelledException;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.SchemaRepository;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.task.ColumnScanTask;
import io.ontomesh.task.ForeignKeyHeuristics;
import io.ontomesh.task.RelationshipReviewTask;
import io.ontomesh.task.TestJoinTask;
import io.ontomesh.task.ValueMatchTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relationship detection for one datasource. A run walks fixed phases, each a batch on the
 * workflow's queue: column scans, value matching, test joins, then review. Detected
 * candidates only become schema relationships through {@link #saveRelationships(String)}.
 */
public final class RelationshipWorkflowService {
    private static final Logger log = LoggerFactory.getLogger(RelationshipWorkflowService.class);
    static final String ALREADY_RUNNING = "relationship detection already in progress for this datasource";
    static final String ALREADY_OWNED = "workflow already owned by another server";
    static final String COMPLETE = "Relationship detection complete";
    static final String DEFAULT_CARDINALITY = "N:1";

    private final WorkflowStore workflows;
    private final EntityStateStore states;
    private final CandidateStore candidates;
    private final SchemaRepository schema;
    private final DiscovererFactory discoverers;
    private final EntityAnalyzer analyzer;
    private final WorkflowInfra infra;
    private final AuditLogger audit;
    private final EngineSettings settings;
    private final String serverId;
    private final ExecutorService runner;
    private final ConcurrentMap<String, Future<?>> runs = new ConcurrentHashMap<>();

    public RelationshipWorkflowService(
            WorkflowStore workflows,
            EntityStateStore states,
            CandidateStore candidates,
            SchemaRepository schema,
            DiscovererFactory discoverers,
            EntityAnalyzer analyzer,
            WorkflowInfra infra,
            AuditLogger audit,
            EngineSettings settings,
            String serverId
    ) {
        this.workflows = workflows;
        this.states = states;
        this.candidates = candidates;
        this.schema = schema;
        this.discoverers = discoverers;
        this.analyzer = analyzer;
        this.infra = infra;
        this.audit = audit;
        this.settings = settings;
        this.serverId = serverId;
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ontomesh-relationships");
            t.setDaemon(true);
            return t;
        });
    }

    public Workflow startDetection(String projectId, String datasourceId) {
        Optional<Workflow> existing = workflows.getLatestByDatasource(datasourceId, WorkflowPhase.RELATIONSHIPS);
        if (existing.isPresent() && !existing.get().state().isTerminal()) {
            throw new WorkflowException(ALREADY_RUNNING);
        }
        long nowMs = Instant.now().toEpochMilli();
        String workflowId = "wf_" + UUID.randomUUID();
        workflows.create(new Workflow(workflowId, projectId, datasourceId, WorkflowPhase.RELATIONSHIPS,
                WorkflowState.PENDING,
                new WorkflowProgress(WorkflowPhase.INITIALIZING.wire(), 0, 0, "Starting relationship detection..."),
                null, 0L, null, nowMs, nowMs));
        List<EntityState> columns;
        try {
            if (!workflows.claimOwnership(workflowId, serverId, nowMs, settings.leaseTimeoutMs())) {
                throw new WorkflowException(ALREADY_OWNED);
            }
            columns = columnEntities(workflowId, schema.listTablesByDatasource(datasourceId),
                    schema.listColumnsByDatasource(datasourceId), nowMs);
            states.createBatch(projectId, columns);
            workflows.updateState(workflowId, WorkflowState.RUNNING, null);
        } catch (RuntimeException e) {
            // a half-created pending row would block every later start for this datasource
            markWorkflowFailed(workflowId, "start failed: " + e.getMessage());
            throw e;
        }
        log.info("Relationship detection started for datasource {} as workflow {} ({} columns)",
                datasourceId, workflowId, columns.size());
        audit("workflow.start", workflowId, "ok", Map.of(
                "phase", WorkflowPhase.RELATIONSHIPS.wire(),
                "project_id", projectId,
                "datasource_id", datasourceId
        ));

        Workflow running = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        RunContext driver = RunContext.root();
        WorkQueue queue = infra.startDriving(workflowId, serverId, driver, QueueSettings.from(settings));
        runs.values().removeIf(Future::isDone);
        runs.put(workflowId, runner.submit(() -> runWorkflow(running, queue, driver)));
        return running;
    }

    public Optional<Workflow> getStatus(String datasourceId) {
        return workflows.getLatestByDatasource(datasourceId, WorkflowPhase.RELATIONSHIPS);
    }

    public Optional<StatusWithCounts> getStatusWithCounts(String datasourceId) {
        return getStatus(datasourceId).map(w -> {
            CandidateStore.CandidateCounts counts = candidates.countsByWorkflow(w.id());
            boolean canSave = w.state() == WorkflowState.COMPLETED && counts.needsReview() == 0;
            return new StatusWithCounts(w, counts, canSave);
        });
    }

    public CandidatesGrouped getCandidatesGrouped(String datasourceId) {
        Workflow workflow = getStatus(datasourceId)
                .orElseThrow(() -> new WorkflowException("no relationship workflow found for datasource"));
        Map<String, SchemaTable> tablesById = new HashMap<>();
        for (SchemaTable t : schema.listTablesByDatasource(datasourceId)) {
            tablesById.put(t.id(), t);
        }
        Map<String, SchemaColumn> columnsById = new HashMap<>();
        for (SchemaColumn c : schema.listColumnsByDatasource(datasourceId)) {
            columnsById.put(c.id(), c);
        }
        List<CandidateView> confirmed = new ArrayList<>();
        List<CandidateView> needsReview = new ArrayList<>();
        List<CandidateView> rejected = new ArrayList<>();
        for (RelationshipCandidate c : candidates.getByWorkflow(workflow.id())) {
            CandidateView view = view(c, tablesById, columnsById);
            switch (c.status()) {
                case ACCEPTED -> confirmed.add(view);
                case REJECTED -> rejected.add(view);
                default -> needsReview.add(view);
            }
        }
        return new CandidatesGrouped(workflow.id(), confirmed, needsReview, rejected);
    }

    /**
     * Records a human verdict. A candidate of another datasource is reported as missing.
     */
    public RelationshipCandidate updateCandidateDecision(String datasourceId, String candidateId, String decision) {
        RelationshipCandidate candidate = candidates.get(candidateId)
                .filter(c -> c.datasourceId().equals(datasourceId))
                .orElseThrow(() -> new WorkflowException("candidate not found"));
        CandidateStatus status;
        if (CandidateStatus.ACCEPTED.wire().equals(decision)) {
            status = CandidateStatus.ACCEPTED;
        } else if (CandidateStatus.REJECTED.wire().equals(decision)) {
            status = CandidateStatus.REJECTED;
        } else {
            throw new WorkflowException("invalid decision: must be 'accepted' or 'rejected'");
        }
        candidates.updateStatus(candidateId, status, decision);
        audit("candidate.decision", candidate.workflowId(), "ok", Map.of(
                "candidate_id", candidateId,
                "decision", decision
        ));
        return candidates.get(candidateId).orElseThrow(() -> new WorkflowException("candidate not found"));
    }

    /**
     * Stops the run if this process drives it and removes every trace of the workflow.
     */
    public void cancel(String workflowId) {
        Optional<WorkQueue> queue = infra.queue(workflowId);
        queue.ifPresent(WorkQueue::cancel);
        infra.stopDriving(workflowId, false);
        // in-flight tasks must not write candidates after the delete below
        if (queue.isPresent() && !queue.get().awaitTermination(settings.stopWaitMs())) {
            log.warn("Tasks of workflow {} still running after {} ms", workflowId, settings.stopWaitMs());
        }
        awaitCompletion(workflowId, settings.stopWaitMs());
        int deletedCandidates = candidates.deleteByWorkflow(workflowId);
        int deletedStates = states.deleteByWorkflow(workflowId);
        if (!workflows.delete(workflowId)) {
            log.debug("Workflow {} was already gone when cancelled", workflowId);
        }
        log.info("Workflow {} cancelled and deleted ({} candidates, {} entity states)",
                workflowId, deletedCandidates, deletedStates);
        audit("workflow.cancel", workflowId, "ok", Map.of("phase", WorkflowPhase.RELATIONSHIPS.wire()));
    }

    /**
     * Commits accepted candidates as schema relationships. Every check runs before the first
     * write, and the upsert is one transaction, so a failed save writes nothing.
     *
     * @return the number of relationships written
     */
    public int saveRelationships(String workflowId) {
        Workflow workflow = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        int requiredPending = candidates.countRequiredPending(workflowId);
        if (requiredPending > 0) {
            throw new WorkflowException(String.format("cannot save: %d relationships require user review", requiredPending));
        }
        if (!workflow.hasDatasource()) {
            throw new WorkflowException("workflow has no datasource ID");
        }
        Map<String, SchemaColumn> columnsById = new HashMap<>();
        for (SchemaColumn c : schema.listColumnsByDatasource(workflow.datasourceId())) {
            columnsById.put(c.id(), c);
        }

        List<Resolved> resolved = new ArrayList<>();
        for (RelationshipCandidate c : candidates.getByWorkflowAndStatus(workflowId, CandidateStatus.ACCEPTED)) {
            SchemaColumn source = columnsById.get(c.sourceColumnId());
            if (source == null) {
                throw new WorkflowException(String.format("source column %s not found in schema", c.sourceColumnId()));
            }
            SchemaColumn target = columnsById.get(c.targetColumnId());
            if (target == null) {
                throw new WorkflowException(String.format("target column %s not found in schema", c.targetColumnId()));
            }
            resolved.add(new Resolved(c, source, target));
        }
        List<Resolved> survivors = RelationshipDeduplicator.byTablePair(resolved,
                r -> r.source().tableId(), r -> r.target().tableId(), r -> r.candidate().description());

        List<SchemaRelationship> relationships = new ArrayList<>(survivors.size());
        for (Resolved r : survivors) {
            relationships.add(toRelationship(workflow.datasourceId(), r.candidate()));
        }
        schema.upsertRelationships(relationships);
        log.info("Saved {} relationships for workflow {} ({} accepted candidates)",
                relationships.size(), workflowId, resolved.size());
        audit("relationships.save", workflowId, "ok", Map.of(
                "accepted", resolved.size(),
                "saved", relationships.size()
        ));
        return relationships.size();
    }

    public Optional<Workflow> awaitCompletion(String workflowId, long timeoutMs) {
        Future<?> run = runs.get(workflowId);
        if (run != null) {
            try {
                run.get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
                runs.remove(workflowId, run);
            } catch (TimeoutException e) {
                log.debug("Relationship workflow {} still running after {} ms", workflowId, timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.warn("Relationship run for workflow {} ended abnormally: {}", workflowId, e.getCause().getMessage());
            }
        }
        return workflows.get(workflowId);
    }

    public void shutdown() {
        runner.shutdownNow();
    }

    private void runWorkflow(Workflow workflow, WorkQueue queue, RunContext driver) {
        String workflowId = workflow.id();
        String datasourceId = workflow.datasourceId();
        boolean release = true;
        try {
            progress(workflowId, "Scanning columns...", 10);
            enqueueColumnScans(workflow, queue);
            awaitPhase(queue, driver, "column scan");

            progress(workflowId, "Matching column values...", 30);
            queue.enqueue(new ValueMatchTask(states, candidates, workflowId, datasourceId,
                    schema.listTablesByDatasource(datasourceId), schema.listColumnsByDatasource(datasourceId)));
            awaitPhase(queue, driver, "value match");

            progress(workflowId, "Testing SQL joins...", 60);
            enqueueTestJoins(workflow, queue);
            awaitPhase(queue, driver, "test join");

            progress(workflowId, "Analyzing relationships...", 80);
            queue.enqueue(new RelationshipReviewTask(candidates, schema, analyzer, workflowId));
            awaitPhase(queue, driver, "relationship review");

            finalizeWorkflow(workflowId);
            audit("workflow.complete", workflowId, "ok", Map.of("phase", WorkflowPhase.RELATIONSHIPS.wire()));
        } catch (WorkflowCancelledException e) {
            // another server may hold the lease now; leave it alone
            release = !HeartbeatRegistry.LEASE_LOST.equals(driver.reason());
            log.info("Relationship workflow {} stopped: {}", workflowId, driver.reason());
        } catch (RuntimeException e) {
            if (driver.isCancelled()) {
                log.info("Relationship workflow {} stopped ({}): {}", workflowId, driver.reason(), e.getMessage());
                return;
            }
            log.error("Relationship workflow {} failed", workflowId, e);
            markWorkflowFailed(workflowId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            infra.stopDriving(workflowId, release);
        }
    }

    /**
     * One scan task per column whose table is known; orphan columns are skipped.
     *
     * @return the number of tasks enqueued
     */
    int enqueueColumnScans(Workflow workflow, WorkQueue queue) {
        List<SchemaTable> tables = schema.listTablesByDatasource(workflow.datasourceId());
        List<SchemaColumn> columns = schema.listColumnsByDatasource(workflow.datasourceId());
        Map<String, SchemaTable> tablesById = new HashMap<>();
        for (SchemaTable t : tables) {
            tablesById.put(t.id(), t);
        }
        Map<String, EntityState> columnStates = new HashMap<>();
        for (EntityState s : states.listByWorkflow(workflow.id())) {
            if (s.entityType() == EntityType.COLUMN) {
                columnStates.put(s.entityKey(), s);
            }
        }
        ForeignKeyHeuristics heuristics = new ForeignKeyHeuristics(tables, columns);
        int enqueued = 0;
        for (SchemaColumn c : columns) {
            SchemaTable table = tablesById.get(c.tableId());
            if (table == null) {
                continue;
            }
            EntityState state = columnStates.get(EntityType.columnKey(table.tableName(), c.columnName()));
            if (state == null || state.status().isTerminal()) {
                continue;
            }
            queue.enqueue(new ColumnScanTask(states, candidates, discoverers, heuristics, workflow.id(),
                    workflow.datasourceId(), state.id(), table, c, settings.sampleLimit(),
                    settings.overlapSampleSize(), settings.maxRetries()));
            enqueued++;
        }
        log.info("Enqueued {} column scan tasks for workflow {}", enqueued, workflow.id());
        return enqueued;
    }

    /**
     * One test-join entity and task per candidate, keyed by candidate id.
     */
    int enqueueTestJoins(Workflow workflow, WorkQueue queue) {
        long nowMs = Instant.now().toEpochMilli();
        List<EntityState> created = new ArrayList<>();
        List<RelationshipCandidate> all = candidates.getByWorkflow(workflow.id());
        for (RelationshipCandidate c : all) {
            if (states.getByEntity(workflow.id(), EntityType.TEST_JOIN, c.id()).isEmpty()) {
                created.add(pending(workflow.id(), EntityType.TEST_JOIN, c.id(), nowMs));
            }
        }
        states.createBatch(workflow.projectId(), created);
        int enqueued = 0;
        for (RelationshipCandidate c : all) {
            Optional<EntityState> state = states.getByEntity(workflow.id(), EntityType.TEST_JOIN, c.id());
            if (state.isEmpty() || state.get().status().isTerminal()) {
                continue;
            }
            queue.enqueue(new TestJoinTask(states, candidates, schema, discoverers, state.get().id(), c.id(),
                    settings.maxRetries()));
            enqueued++;
        }
        log.info("Enqueued {} test join tasks for workflow {}", enqueued, workflow.id());
        return enqueued;
    }

    private void awaitPhase(WorkQueue queue, RunContext driver, String phase) {
        Optional<TaskFailure> failure = queue.await(driver);
        if (failure.isPresent()) {
            throw new WorkflowException(phase + " failed: " + failure.get().message());
        }
    }

    private void finalizeWorkflow(String workflowId) {
        int requiredPending = candidates.countRequiredPending(workflowId);
        String message = requiredPending > 0
                ? COMPLETE + " (" + requiredPending + " relationships need review)"
                : COMPLETE;
        workflows.updateProgress(workflowId, new WorkflowProgress(WorkflowPhase.COMPLETING.wire(), 100, 100, message));
        workflows.updateState(workflowId, WorkflowState.COMPLETED, null);
        log.info("Relationship workflow {} completed ({} need review)", workflowId, requiredPending);
    }

    private void markWorkflowFailed(String workflowId, String message) {
        try {
            workflows.updateState(workflowId, WorkflowState.FAILED, message);
        } catch (RuntimeException e) {
            log.warn("Failed to mark workflow {} failed: {}", workflowId, e.getMessage());
        }
        audit("workflow.fail", workflowId, "error", Map.of("error", message));
    }

    private void progress(String workflowId, String message, int percent) {
        try {
            workflows.updateProgress(workflowId,
                    new WorkflowProgress(WorkflowPhase.RELATIONSHIPS.wire(), percent, 100, message));
        } catch (RuntimeException e) {
            log.warn("Failed to update progress of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    static SchemaRelationship toRelationship(String datasourceId, RelationshipCandidate c) {
        String type = c.acceptedByUser() ? "review" : "inferred";
        String cardinality = c.cardinality() == null || c.cardinality().isBlank() ? DEFAULT_CARDINALITY : c.cardinality();
        Double matchRate = c.valueMatchRate() != null ? c.valueMatchRate() : c.joinMatchRate();
        return new SchemaRelationship("rel_" + UUID.randomUUID(), datasourceId, c.sourceColumnId(), c.targetColumnId(),
                type, cardinality, c.detectionMethod().inferenceMethod(), c.confidence(), c.description(),
                matchRate, c.matchedRows());
    }

    static List<EntityState> columnEntities(String workflowId, List<SchemaTable> tables, List<SchemaColumn> columns, long nowMs) {
        Map<String, String> namesById = new LinkedHashMap<>();
        for (SchemaTable t : tables) {
            namesById.put(t.id(), t.tableName());
        }
        Map<String, EntityState> byKey = new LinkedHashMap<>();
        for (SchemaColumn c : columns) {
            String tableName = namesById.get(c.tableId());
            if (tableName == null) {
                continue;
            }
            String key = EntityType.columnKey(tableName, c.columnName());
            byKey.putIfAbsent(key, pending(workflowId, EntityType.COLUMN, key, nowMs));
        }
        return new ArrayList<>(byKey.values());
    }

    private static EntityState pending(String workflowId, EntityType type, String key, long nowMs) {
        return new EntityState("ent_" + UUID.randomUUID(), workflowId, type, key, EntityStatus.PENDING, 0, null,
                Map.of(), nowMs, nowMs);
    }

    private static CandidateView view(
            RelationshipCandidate c,
            Map<String, SchemaTable> tablesById,
            Map<String, SchemaColumn> columnsById
    ) {
        SchemaColumn source = columnsById.get(c.sourceColumnId());
        SchemaColumn target = columnsById.get(c.targetColumnId());
        return new CandidateView(
                c,
                source == null ? null : tableName(tablesById, source),
                source == null ? null : source.columnName(),
                target == null ? null : tableName(tablesById, target),
                target == null ? null : target.columnName()
        );
    }

    private static String tableName(Map<String, SchemaTable> tablesById, SchemaColumn column) {
        SchemaTable t = tablesById.get(column.tableId());
        return t == null ? null : t.tableName();
    }

    private void audit(String action, String workflowId, String result, Map<String, Object> details) {
        try {
            audit.log(AuditLogger.AuditEvent.of(action, serverId, "workflow/" + workflowId, result, workflowId, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {} for workflow {}: {}", action, workflowId, e.getMessage());
        }
    }

    private record Resolved(RelationshipCandidate candidate, SchemaColumn source, SchemaColumn target) {
    }

    public record StatusWithCounts(Workflow workflow, CandidateStore.CandidateCounts counts, boolean canSave) {
    }

    public record CandidateView(
            RelationshipCandidate candidate,
            String sourceTable,
            String sourceColumn,
            String targetTable,
            String targetColumn
    ) {
    }

    public record CandidatesGrouped(
            String workflowId,
            List<CandidateView> confirmed,
            List<CandidateView> needsReview,
            List<CandidateView> rejected
    ) {
    }
}
