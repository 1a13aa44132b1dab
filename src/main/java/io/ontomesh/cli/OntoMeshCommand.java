package io.ontomesh.cli;

import io.ontomesh.config.OntoMeshConfig;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.Workflow;
import io.ontomesh.observability.AuditLogger;
import io.ontomesh.runtime.OntoMeshRuntime;
import io.ontomesh.storage.DatasourceStore;
import io.ontomesh.storage.OntologyStore;
import io.ontomesh.util.Jsons;
import io.ontomesh.workflow.OntologyExtractionService;
import io.ontomesh.workflow.RelationshipWorkflowService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "ontomesh",
        mixinStandardHelpOptions = true,
        description = "OntoMesh ontology extraction and relationship detection CLI",
        subcommands = {
                OntoMeshCommand.InitCommand.class,
                OntoMeshCommand.DatasourceAddCommand.class,
                OntoMeshCommand.DatasourcesCommand.class,
                OntoMeshCommand.SchemaImportCommand.class,
                OntoMeshCommand.ExtractCommand.class,
                OntoMeshCommand.ResumeCommand.class,
                OntoMeshCommand.ExtractionStatusCommand.class,
                OntoMeshCommand.AnswerCommand.class,
                OntoMeshCommand.CancelExtractionCommand.class,
                OntoMeshCommand.DetectRelationshipsCommand.class,
                OntoMeshCommand.RelationshipStatusCommand.class,
                OntoMeshCommand.CandidatesCommand.class,
                OntoMeshCommand.DecideCommand.class,
                OntoMeshCommand.SaveRelationshipsCommand.class,
                OntoMeshCommand.CancelDetectionCommand.class,
                OntoMeshCommand.WorkflowsCommand.class,
                OntoMeshCommand.OntologyCommand.class,
                OntoMeshCommand.AuditTailCommand.class,
                OntoMeshCommand.AuditVerifyCommand.class
        }
)
public final class OntoMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | datasource-add | datasources | schema-import | extract | resume | extraction-status | answer | cancel-extraction | detect-relationships | relationship-status | candidates | decide | save-relationships | cancel-detection | workflows | ontology | audit-tail | audit-verify");
    }

    OntoMeshRuntime runtime() {
        OntoMeshRuntime runtime = new OntoMeshRuntime(OntoMeshConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    /**
     * Blocks until the workflow this process drives ends or the timeout passes. A shutdown hook
     * stops the driver first, releasing the lease so another server can resume the workflow.
     */
    static Optional<Workflow> drive(OntoMeshRuntime runtime, String workflowId, long timeoutMs,
                                    WorkflowWaiter waiter) {
        Thread hook = new Thread(() -> runtime.shutdown(runtime.settings().stopWaitMs()), "ontomesh-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return waiter.await(workflowId, timeoutMs <= 0 ? Long.MAX_VALUE : timeoutMs);
        } finally {
            runtime.shutdown(runtime.settings().stopWaitMs());
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignored) {
                // JVM is already shutting down; the hook runs anyway.
            }
        }
    }

    @FunctionalInterface
    interface WorkflowWaiter {
        Optional<Workflow> await(String workflowId, long timeoutMs);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Override
        public Integer call() {
            OntoMeshRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.initOutcome()));
            return 0;
        }
    }

    @Command(name = "datasource-add", description = "Register a JDBC datasource for a project")
    static final class DatasourceAddCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--name"}, required = true, description = "Datasource display name")
        String name;

        @Option(names = {"--jdbc-url"}, required = true, description = "JDBC url, e.g. jdbc:sqlite:/path/app.db")
        String jdbcUrl;

        @Override
        public Integer call() {
            DatasourceStore.Datasource ds = parent.runtime().registerDatasource(projectId, name, jdbcUrl);
            System.out.println(Jsons.toJson(ds));
            return 0;
        }
    }

    @Command(name = "datasources", description = "List datasources of a project")
    static final class DatasourcesCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listDatasources(projectId)));
            return 0;
        }
    }

    @Command(name = "schema-import", description = "Import tables and columns from a registered datasource")
    static final class SchemaImportCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().importSchema(datasourceId)));
            return 0;
        }
    }

    @Command(name = "extract", description = "Start ontology extraction for a project and drive it")
    static final class ExtractCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Stop driving after this long; 0 waits until done")
        long timeoutMs;

        @Override
        public Integer call() {
            OntoMeshRuntime runtime = parent.runtime();
            Workflow started = runtime.extraction().startExtraction(projectId, datasourceId);
            System.out.println(Jsons.toJson(started));
            Optional<Workflow> finished = drive(runtime, started.id(), timeoutMs, runtime.extraction()::awaitCompletion);
            finished.ifPresent(w -> System.out.println(Jsons.toJson(w)));
            return exitCode(finished);
        }
    }

    @Command(name = "resume", description = "Take over an extraction workflow whose lease expired and drive it")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Parameters(index = "0", description = "Workflow id")
        String workflowId;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Stop driving after this long; 0 waits until done")
        long timeoutMs;

        @Override
        public Integer call() {
            OntoMeshRuntime runtime = parent.runtime();
            runtime.extraction().resume(workflowId);
            Optional<Workflow> finished = drive(runtime, workflowId, timeoutMs, runtime.extraction()::awaitCompletion);
            finished.ifPresent(w -> System.out.println(Jsons.toJson(w)));
            return exitCode(finished);
        }
    }

    @Command(name = "extraction-status", description = "Show the latest extraction workflow of a project")
    static final class ExtractionStatusCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--entities"}, description = "List every entity state instead of the counts")
        boolean entities;

        @Override
        public Integer call() {
            OntologyExtractionService extraction = parent.runtime().extraction();
            Optional<OntologyExtractionService.ExtractionStatus> status = extraction.getStatus(projectId);
            if (status.isEmpty()) {
                System.out.println("No extraction workflow for project: " + projectId);
                return 1;
            }
            if (entities) {
                System.out.println(Jsons.toJson(extraction.entities(status.get().workflow().id())));
                return 0;
            }
            System.out.println(Jsons.toJson(status.get()));
            return 0;
        }
    }

    @Command(name = "answer", description = "Answer the open questions of a table waiting for input")
    static final class AnswerCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--workflow"}, required = true, description = "Workflow id")
        String workflowId;

        @Option(names = {"--table"}, required = true, description = "Table name")
        String tableName;

        @Option(names = {"--answer"}, description = "question=answer, repeatable")
        Map<String, String> answers = new LinkedHashMap<>();

        @Override
        public Integer call() {
            EntityState state = parent.runtime().extraction().answerQuestions(workflowId, tableName, answers);
            System.out.println(Jsons.toJson(state));
            return 0;
        }
    }

    @Command(name = "cancel-extraction", description = "Cancel an extraction workflow")
    static final class CancelExtractionCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Parameters(index = "0", description = "Workflow id")
        String workflowId;

        @Override
        public Integer call() {
            boolean cancelled = parent.runtime().extraction().cancel(workflowId);
            System.out.println(Jsons.toJson(Map.of("workflowId", workflowId, "cancelled", cancelled)));
            return cancelled ? 0 : 1;
        }
    }

    @Command(name = "detect-relationships", description = "Start relationship detection for a datasource and drive it")
    static final class DetectRelationshipsCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Option(names = {"--timeout-ms"}, defaultValue = "0", description = "Stop driving after this long; 0 waits until done")
        long timeoutMs;

        @Override
        public Integer call() {
            OntoMeshRuntime runtime = parent.runtime();
            Workflow started = runtime.relationships().startDetection(projectId, datasourceId);
            System.out.println(Jsons.toJson(started));
            Optional<Workflow> finished = drive(runtime, started.id(), timeoutMs, runtime.relationships()::awaitCompletion);
            runtime.relationships().getStatusWithCounts(datasourceId)
                    .ifPresent(s -> System.out.println(Jsons.toJson(s)));
            return exitCode(finished);
        }
    }

    @Command(name = "relationship-status", description = "Show the latest relationship workflow of a datasource")
    static final class RelationshipStatusCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Override
        public Integer call() {
            Optional<RelationshipWorkflowService.StatusWithCounts> status =
                    parent.runtime().relationships().getStatusWithCounts(datasourceId);
            if (status.isEmpty()) {
                System.out.println("No relationship workflow for datasource: " + datasourceId);
                return 1;
            }
            System.out.println(Jsons.toJson(status.get()));
            return 0;
        }
    }

    @Command(name = "candidates", description = "List relationship candidates grouped by review bucket")
    static final class CandidatesCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().relationships().getCandidatesGrouped(datasourceId)));
            return 0;
        }
    }

    @Command(name = "decide", description = "Accept or reject a relationship candidate")
    static final class DecideCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--datasource"}, required = true, description = "Datasource id")
        String datasourceId;

        @Option(names = {"--candidate"}, required = true, description = "Candidate id")
        String candidateId;

        @Option(names = {"--decision"}, required = true, description = "accepted|rejected")
        String decision;

        @Override
        public Integer call() {
            RelationshipCandidate candidate =
                    parent.runtime().relationships().updateCandidateDecision(datasourceId, candidateId, decision);
            System.out.println(Jsons.toJson(candidate));
            return 0;
        }
    }

    @Command(name = "save-relationships", description = "Write accepted candidates as schema relationships")
    static final class SaveRelationshipsCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Parameters(index = "0", description = "Workflow id")
        String workflowId;

        @Override
        public Integer call() {
            int saved = parent.runtime().relationships().saveRelationships(workflowId);
            System.out.println(Jsons.toJson(Map.of("workflowId", workflowId, "savedCount", saved)));
            return 0;
        }
    }

    @Command(name = "cancel-detection", description = "Cancel a relationship workflow and delete its candidates")
    static final class CancelDetectionCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Parameters(index = "0", description = "Workflow id")
        String workflowId;

        @Override
        public Integer call() {
            parent.runtime().relationships().cancel(workflowId);
            System.out.println(Jsons.toJson(Map.of("workflowId", workflowId, "cancelled", true)));
            return 0;
        }
    }

    @Command(name = "workflows", description = "List workflows of a project")
    static final class WorkflowsCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Override
        public Integer call() {
            List<Workflow> workflows = parent.runtime().listWorkflows(projectId);
            System.out.println(Jsons.toJson(workflows));
            return 0;
        }
    }

    @Command(name = "ontology", description = "Show or export the latest ontology of a project")
    static final class OntologyCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--export"}, defaultValue = "false", description = "Write it under <root>/ontology/")
        boolean export;

        @Override
        public Integer call() {
            OntoMeshRuntime runtime = parent.runtime();
            if (export) {
                System.out.println(Jsons.toJson(runtime.exportOntology(projectId)));
                return 0;
            }
            Optional<OntologyStore.StoredOntology> ontology = runtime.latestOntology(projectId);
            if (ontology.isEmpty()) {
                System.out.println("No ontology for project: " + projectId);
                return 1;
            }
            System.out.println(Jsons.toJson(Jsons.toMap(ontology.get().content())));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show recent audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().auditTail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        OntoMeshCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = parent.runtime().auditVerify();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    private static int exitCode(Optional<Workflow> workflow) {
        if (workflow.isEmpty()) {
            return 1;
        }
        return switch (workflow.get().state()) {
            case COMPLETED -> 0;
            case RUNNING, PENDING, PAUSED, AWAITING_INPUT -> 2;
            default -> 1;
        };
    }
}
