package io.ontomesh.workflow;

import io.ontomesh.config.EngineSettings;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.TaskFailure;
import io.ontomesh.queue.WorkQueue;
import io.ontomesh.queue.WorkTask;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.SchemaRepository;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.task.AnalyzeTableTask;
import io.ontomesh.task.GlobalSynthesisTask;
import io.ontomesh.task.ScanTableTask;
import io.ontomesh.task.TableEntities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Driver loop of an extraction workflow. Every iteration re-reads entity state, so a server
 * taking over a reclaimed workflow continues from exactly what is persisted.
 */
public final class OntologyOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(OntologyOrchestrator.class);
    static final String BUILDING = "Building ontology from entities and relationships...";
    static final String BUILD_COMPLETE = "Ontology build complete";

    private final WorkflowStore workflows;
    private final EntityStateStore states;
    private final SchemaRepository schema;
    private final DiscovererFactory discoverers;
    private final EntityAnalyzer analyzer;
    private final OntologyFinalizer finalizer;
    private final EngineSettings settings;

    public OntologyOrchestrator(
            WorkflowStore workflows,
            EntityStateStore states,
            SchemaRepository schema,
            DiscovererFactory discoverers,
            EntityAnalyzer analyzer,
            OntologyFinalizer finalizer,
            EngineSettings settings
    ) {
        this.workflows = workflows;
        this.states = states;
        this.schema = schema;
        this.discoverers = discoverers;
        this.analyzer = analyzer;
        this.finalizer = finalizer;
        this.settings = settings;
    }

    /**
     * Runs until every entity is terminal and the ontology is written.
     *
     * @throws io.ontomesh.queue.WorkflowCancelledException when {@code context} is cancelled
     */
    public void run(Workflow workflow, WorkQueue queue, RunContext context) {
        String workflowId = workflow.id();
        while (true) {
            context.throwIfCancelled();
            List<EntityState> entities = states.listByWorkflow(workflowId);
            // columns get no tasks of their own; they follow their table
            if (TableEntities.settleColumns(states, entities) > 0) {
                entities = states.listByWorkflow(workflowId);
            }
            Classification work = Classification.of(entities);
            workflows.updateProgress(workflowId, progress(workflow, work));

            List<WorkTask> batch = new ArrayList<>();
            boolean globalTriggered = triggerGlobal(workflowId, work, batch);
            if (!work.pendingTables.isEmpty() || !work.scannedTables.isEmpty()) {
                SchemaIndex index = SchemaIndex.load(schema, workflow.datasourceId());
                for (EntityState table : work.pendingTables) {
                    Optional<SchemaTable> t = index.table(table.entityKey());
                    if (t.isEmpty()) {
                        failMissingTable(workflowId, table, index);
                        continue;
                    }
                    batch.add(new ScanTableTask(states, discoverers, workflowId, workflow.datasourceId(), table.id(),
                            t.get(), index.columns(t.get()), settings.sampleLimit(), settings.maxRetries()));
                }
                for (EntityState table : work.scannedTables) {
                    Optional<SchemaTable> t = index.table(table.entityKey());
                    if (t.isEmpty()) {
                        failMissingTable(workflowId, table, index);
                        continue;
                    }
                    batch.add(new AnalyzeTableTask(states, analyzer, workflowId, table.id(), t.get(),
                            index.columns(t.get()), settings.maxRetries()));
                }
            }

            if (batch.isEmpty() && !globalTriggered) {
                if (work.allTerminal) {
                    finalizer.finalizeWorkflow(workflow, entities);
                    return;
                }
                context.sleep(settings.pollIntervalMs());
                continue;
            }

            for (WorkTask task : batch) {
                queue.enqueue(task);
            }
            Optional<TaskFailure> failure = queue.await(context);
            failure.ifPresent(f -> log.warn("Workflow {} task {} failed: {}", workflowId, f.taskName(), f.message()));
            workflows.updateProgress(workflowId, progress(workflow, Classification.of(states.listByWorkflow(workflowId))));
        }
    }

    /**
     * Fan-in barrier: the global entity only advances once every table is complete. When
     * every table is terminal but some failed, synthesis can never run and the global entity fails.
     */
    private boolean triggerGlobal(String workflowId, Classification work, List<WorkTask> batch) {
        EntityState global = work.global;
        if (global == null || global.status().isTerminal() || global.status() == EntityStatus.NEEDS_INPUT) {
            return false;
        }
        if (work.tables > 0 && work.completeTables == work.tables) {
            if (global.status() == EntityStatus.PENDING) {
                states.updateStatus(global.id(), EntityStatus.SCANNED, null);
            }
            states.updateStatus(global.id(), EntityStatus.ANALYZING, null);
            batch.add(new GlobalSynthesisTask(states, analyzer, workflowId, global.id(), settings.maxRetries()));
            return true;
        }
        if (global.status() == EntityStatus.PENDING && work.terminalTables == work.tables) {
            int failed = work.tables - work.completeTables;
            states.updateStatus(global.id(), EntityStatus.FAILED,
                    "global synthesis skipped: " + failed + " table(s) did not complete");
            return true;
        }
        return false;
    }

    private void failMissingTable(String workflowId, EntityState table, SchemaIndex index) {
        String message = String.format("table not found: %s", table.entityKey());
        log.warn("Workflow {}: {}", workflowId, message);
        states.updateStatus(table.id(), EntityStatus.FAILED, message);
        TableEntities.failColumns(states, workflowId, table.entityKey(), index.orphanColumns(table.entityKey(), states, workflowId), message);
    }

    static WorkflowProgress progress(Workflow workflow, Classification work) {
        String message = work.total > 0 && work.completed == work.total ? BUILD_COMPLETE : BUILDING;
        return new WorkflowProgress(workflow.phase().wire(), work.completed, work.total, message);
    }

    static final class Classification {
        private final List<EntityState> pendingTables = new ArrayList<>();
        private final List<EntityState> scannedTables = new ArrayList<>();
        private EntityState global;
        private int tables;
        private int completeTables;
        private int terminalTables;
        private int completed;
        private int total;
        private boolean allTerminal = true;

        static Classification of(List<EntityState> entities) {
            Classification c = new Classification();
            for (EntityState s : entities) {
                c.total++;
                if (s.status() == EntityStatus.COMPLETE) {
                    c.completed++;
                }
                if (!s.status().isTerminal()) {
                    c.allTerminal = false;
                }
                if (s.entityType() == EntityType.GLOBAL) {
                    c.global = s;
                    continue;
                }
                if (s.entityType() != EntityType.TABLE) {
                    continue;
                }
                c.tables++;
                if (s.status() == EntityStatus.COMPLETE) {
                    c.completeTables++;
                }
                if (s.status().isTerminal()) {
                    c.terminalTables++;
                }
                // scanning and analyzing only survive a crash or lease takeover; redo them
                switch (s.status()) {
                    case PENDING, SCANNING -> c.pendingTables.add(s);
                    case SCANNED, ANALYZING -> c.scannedTables.add(s);
                    default -> {
                    }
                }
            }
            return c;
        }

        int completed() {
            return completed;
        }

        int total() {
            return total;
        }
    }

    /**
     * Schema tables by name with their columns, read fresh per iteration.
     */
    static final class SchemaIndex {
        private final Map<String, SchemaTable> tablesByName = new HashMap<>();
        private final Map<String, List<SchemaColumn>> columnsByTable = new HashMap<>();

        static SchemaIndex load(SchemaRepository schema, String datasourceId) {
            SchemaIndex index = new SchemaIndex();
            for (SchemaTable t : schema.listTablesByDatasource(datasourceId)) {
                index.tablesByName.putIfAbsent(t.tableName(), t);
            }
            for (SchemaColumn c : schema.listColumnsByDatasource(datasourceId)) {
                index.columnsByTable.computeIfAbsent(c.tableId(), k -> new ArrayList<>()).add(c);
            }
            return index;
        }

        Optional<SchemaTable> table(String tableName) {
            return Optional.ofNullable(tablesByName.get(tableName));
        }

        List<SchemaColumn> columns(SchemaTable table) {
            return columnsByTable.getOrDefault(table.id(), List.of());
        }

        /**
         * Column stand-ins rebuilt from entity keys, for a table no longer in the schema.
         */
        List<SchemaColumn> orphanColumns(String tableName, EntityStateStore states, String workflowId) {
            List<SchemaColumn> out = new ArrayList<>();
            String prefix = tableName + ".";
            for (EntityState s : states.listByWorkflow(workflowId)) {
                if (s.entityType() == EntityType.COLUMN && s.entityKey().startsWith(prefix)) {
                    out.add(new SchemaColumn(null, null, s.entityKey().substring(prefix.length()), null, false, null, null, 0));
                }
            }
            return out;
        }
    }
}
