package io.ontomesh.workflow;

import io.ontomesh.config.EngineSettings;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowException;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.observability.AuditLogger;
import io.ontomesh.queue.QueueSettings;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkQueue;
import io.ontomesh.queue.WorkflowCancelledException;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.SchemaRepository;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.storage.OntologyStore;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.task.TableEntities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
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
 * Entry point for ontology extraction: creates the workflow and its entity states, takes
 * the lease and drives {@link OntologyOrchestrator} on a background thread.
 */
public final class OntologyExtractionService {
    private static final Logger log = LoggerFactory.getLogger(OntologyExtractionService.class);
    static final String ALREADY_RUNNING = "ontology extraction already in progress for this project";
    static final String ALREADY_OWNED = "workflow already owned by another server";
    static final String ANSWERS = "answers";

    private final WorkflowStore workflows;
    private final EntityStateStore states;
    private final SchemaRepository schema;
    private final WorkflowInfra infra;
    private final AuditLogger audit;
    private final EngineSettings settings;
    private final String serverId;
    private final OntologyOrchestrator orchestrator;
    private final ExecutorService runner;
    private final ConcurrentMap<String, Future<?>> runs = new ConcurrentHashMap<>();

    public OntologyExtractionService(
            WorkflowStore workflows,
            EntityStateStore states,
            SchemaRepository schema,
            DiscovererFactory discoverers,
            EntityAnalyzer analyzer,
            OntologyStore ontologies,
            WorkflowInfra infra,
            AuditLogger audit,
            EngineSettings settings,
            String serverId
    ) {
        this.workflows = workflows;
        this.states = states;
        this.schema = schema;
        this.infra = infra;
        this.audit = audit;
        this.settings = settings;
        this.serverId = serverId;
        this.orchestrator = new OntologyOrchestrator(workflows, states, schema, discoverers, analyzer,
                new OntologyFinalizer(workflows, ontologies), settings);
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ontomesh-extraction");
            t.setDaemon(true);
            return t;
        });
    }

    public Workflow startExtraction(String projectId, String datasourceId) {
        Optional<Workflow> existing = workflows.getLatestByProject(projectId, WorkflowPhase.TIER1_BUILDING);
        if (existing.isPresent() && !existing.get().state().isTerminal()) {
            throw new WorkflowException(ALREADY_RUNNING);
        }
        List<SchemaTable> tables = schema.listTablesByDatasource(datasourceId);
        if (tables.isEmpty()) {
            throw new WorkflowException("datasource " + datasourceId + " has no imported schema tables");
        }
        int cleaned = states.deleteByProject(projectId, WorkflowPhase.TIER1_BUILDING);
        if (cleaned > 0) {
            log.debug("Removed {} entity states of earlier extractions for project {}", cleaned, projectId);
        }

        long nowMs = Instant.now().toEpochMilli();
        String workflowId = "wf_" + UUID.randomUUID();
        Workflow workflow = new Workflow(workflowId, projectId, datasourceId, WorkflowPhase.TIER1_BUILDING,
                WorkflowState.PENDING, WorkflowProgress.empty(WorkflowPhase.TIER1_BUILDING), null, 0L, null,
                nowMs, nowMs);
        workflows.create(workflow);
        List<EntityState> entities;
        try {
            if (!workflows.claimOwnership(workflowId, serverId, nowMs, settings.leaseTimeoutMs())) {
                throw new WorkflowException(ALREADY_OWNED);
            }
            entities = initialEntities(workflowId, tables, schema.listColumnsByDatasource(datasourceId), nowMs);
            states.createBatch(projectId, entities);
            workflows.updateState(workflowId, WorkflowState.RUNNING, null);
        } catch (RuntimeException e) {
            // a half-created pending row would block every later start for this project
            markFailed(workflowId, "start failed: " + e.getMessage());
            throw e;
        }
        log.info("Started extraction workflow {} for project {} with {} entities", workflowId, projectId, entities.size());
        audit("workflow.start", workflowId, "ok", Map.of(
                "phase", WorkflowPhase.TIER1_BUILDING.wire(),
                "project_id", projectId,
                "datasource_id", datasourceId,
                "entities", entities.size()
        ));
        Workflow running = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        launch(running);
        return running;
    }

    /**
     * Takes over a non-terminal extraction whose lease has expired and continues it from
     * the persisted entity states.
     */
    public Workflow resume(String workflowId) {
        Workflow workflow = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        if (workflow.state().isTerminal()) {
            throw new WorkflowException("workflow " + workflowId + " already finished: " + workflow.state().wire());
        }
        if (infra.isDriving(workflowId)) {
            return workflow;
        }
        if (!workflows.claimOwnership(workflowId, serverId, Instant.now().toEpochMilli(), settings.leaseTimeoutMs())) {
            throw new WorkflowException(ALREADY_OWNED);
        }
        workflows.updateState(workflowId, WorkflowState.RUNNING, null);
        log.info("Resuming extraction workflow {} as {}", workflowId, serverId);
        audit("workflow.resume", workflowId, "ok", Map.of("owner_id", serverId));
        Workflow running = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        launch(running);
        return running;
    }

    public Optional<ExtractionStatus> getStatus(String projectId) {
        return workflows.getLatestByProject(projectId, WorkflowPhase.TIER1_BUILDING).map(this::status);
    }

    public List<EntityState> entities(String workflowId) {
        return states.listByWorkflow(workflowId);
    }

    /**
     * Records answers for a table parked in needs-input and completes it; the driver loop
     * picks up the change on its next poll.
     */
    public EntityState answerQuestions(String workflowId, String tableName, Map<String, String> answers) {
        Workflow workflow = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        EntityState table = states.getByEntity(workflowId, EntityType.TABLE, EntityType.tableKey(tableName))
                .orElseThrow(() -> new WorkflowException(String.format("table not found: %s", tableName)));
        if (table.status() != EntityStatus.NEEDS_INPUT) {
            throw new WorkflowException("table " + tableName + " is not awaiting input: " + table.status().wire());
        }
        Map<String, Object> data = new LinkedHashMap<>(table.stateData());
        data.put(ANSWERS, new LinkedHashMap<>(answers));
        states.updateStateData(table.id(), EntityStatus.ANALYZING, data);
        TableEntities.completeColumns(states, workflowId, tableName, columnsOf(workflow.datasourceId(), tableName));
        states.updateStatus(table.id(), EntityStatus.COMPLETE, null);
        log.info("Answered {} question(s) for table {} in workflow {}", answers.size(), tableName, workflowId);
        return states.getByEntity(workflowId, EntityType.TABLE, EntityType.tableKey(tableName)).orElse(table);
    }

    /**
     * @return false when the workflow had already reached a terminal state
     */
    public boolean cancel(String workflowId) {
        Workflow workflow = workflows.get(workflowId).orElseThrow(() -> new WorkflowException("workflow not found"));
        if (workflow.state().isTerminal()) {
            return false;
        }
        infra.queue(workflowId).ifPresent(WorkQueue::cancel);
        workflows.updateState(workflowId, WorkflowState.CANCELLED, "cancelled by user");
        infra.stopDriving(workflowId, true);
        log.info("Cancelled extraction workflow {}", workflowId);
        audit("workflow.cancel", workflowId, "ok", Map.of("phase", workflow.phase().wire()));
        return true;
    }

    /**
     * Waits for this process's run of the workflow to end, then returns its stored row.
     */
    public Optional<Workflow> awaitCompletion(String workflowId, long timeoutMs) {
        Future<?> run = runs.get(workflowId);
        if (run != null) {
            try {
                run.get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
                runs.remove(workflowId, run);
            } catch (TimeoutException e) {
                log.debug("Extraction workflow {} still running after {} ms", workflowId, timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.warn("Extraction run for workflow {} ended abnormally: {}", workflowId, e.getCause().getMessage());
            }
        }
        return workflows.get(workflowId);
    }

    public void shutdown() {
        runner.shutdownNow();
    }

    private void launch(Workflow workflow) {
        RunContext driver = RunContext.root();
        WorkQueue queue = infra.startDriving(workflow.id(), serverId, driver, QueueSettings.from(settings));
        runs.values().removeIf(Future::isDone);
        runs.put(workflow.id(), runner.submit(() -> drive(workflow, queue, driver)));
    }

    private void drive(Workflow workflow, WorkQueue queue, RunContext driver) {
        String workflowId = workflow.id();
        boolean release = true;
        try {
            orchestrator.run(workflow, queue, driver);
            audit("workflow.complete", workflowId, "ok", Map.of("phase", workflow.phase().wire()));
        } catch (WorkflowCancelledException e) {
            // another server may hold the lease now; leave it alone
            release = !HeartbeatRegistry.LEASE_LOST.equals(driver.reason());
            log.info("Extraction workflow {} stopped: {}", workflowId, driver.reason());
        } catch (RuntimeException e) {
            if (driver.isCancelled()) {
                log.info("Extraction workflow {} stopped ({}): {}", workflowId, driver.reason(), e.getMessage());
                return;
            }
            log.error("Extraction workflow {} failed", workflowId, e);
            markFailed(workflowId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            infra.stopDriving(workflowId, release);
        }
    }

    private void markFailed(String workflowId, String message) {
        try {
            workflows.updateState(workflowId, WorkflowState.FAILED, message);
        } catch (RuntimeException e) {
            log.warn("Failed to mark workflow {} failed: {}", workflowId, e.getMessage());
        }
        audit("workflow.fail", workflowId, "error", Map.of("error", message));
    }

    private ExtractionStatus status(Workflow workflow) {
        Map<String, Integer> counts = new TreeMap<>();
        for (EntityState s : states.listByWorkflow(workflow.id())) {
            counts.merge(s.status().wire(), 1, Integer::sum);
        }
        return new ExtractionStatus(workflow, counts, infra.isDriving(workflow.id()));
    }

    private List<SchemaColumn> columnsOf(String datasourceId, String tableName) {
        Optional<SchemaTable> table = schema.listTablesByDatasource(datasourceId).stream()
                .filter(t -> t.tableName().equals(tableName))
                .findFirst();
        if (table.isEmpty()) {
            return List.of();
        }
        List<SchemaColumn> out = new ArrayList<>();
        for (SchemaColumn c : schema.listColumnsByDatasource(datasourceId)) {
            if (table.get().id().equals(c.tableId())) {
                out.add(c);
            }
        }
        return out;
    }

    static List<EntityState> initialEntities(String workflowId, List<SchemaTable> tables, List<SchemaColumn> columns, long nowMs) {
        List<EntityState> out = new ArrayList<>();
        out.add(pending(workflowId, EntityType.GLOBAL, EntityType.globalKey(), nowMs));
        Map<String, String> namesById = new LinkedHashMap<>();
        Set<String> tableKeys = new HashSet<>();
        Set<String> columnKeys = new HashSet<>();
        for (SchemaTable t : tables) {
            namesById.put(t.id(), t.tableName());
            if (tableKeys.add(t.tableName())) {
                out.add(pending(workflowId, EntityType.TABLE, EntityType.tableKey(t.tableName()), nowMs));
            }
        }
        for (SchemaColumn c : columns) {
            String tableName = namesById.get(c.tableId());
            if (tableName == null) {
                log.debug("Skipping orphan column {} (table {})", c.columnName(), c.tableId());
                continue;
            }
            String key = EntityType.columnKey(tableName, c.columnName());
            if (columnKeys.add(key)) {
                out.add(pending(workflowId, EntityType.COLUMN, key, nowMs));
            }
        }
        return out;
    }

    private static EntityState pending(String workflowId, EntityType type, String key, long nowMs) {
        return new EntityState("ent_" + UUID.randomUUID(), workflowId, type, key, EntityStatus.PENDING, 0, null,
                Map.of(), nowMs, nowMs);
    }

    private void audit(String action, String workflowId, String result, Map<String, Object> details) {
        try {
            audit.log(AuditLogger.AuditEvent.of(action, serverId, "workflow/" + workflowId, result, workflowId, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {} for workflow {}: {}", action, workflowId, e.getMessage());
        }
    }

    public record ExtractionStatus(Workflow workflow, Map<String, Integer> entityCounts, boolean drivenHere) {
    }
}
