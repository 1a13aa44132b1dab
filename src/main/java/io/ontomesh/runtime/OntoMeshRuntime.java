package io.ontomesh.runtime;

import io.ontomesh.config.EngineSettings;
import io.ontomesh.config.OntoMeshConfig;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowException;
import io.ontomesh.observability.AuditLogger;
import io.ontomesh.schema.DiscoveredSchema;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.HeuristicEntityAnalyzer;
import io.ontomesh.schema.JdbcDiscovererFactory;
import io.ontomesh.schema.JdbcSchemaDiscoverer;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.Database;
import io.ontomesh.storage.DatasourceStore;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.storage.OntologyStore;
import io.ontomesh.storage.SchemaStore;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.util.Jsons;
import io.ontomesh.workflow.HeartbeatRegistry;
import io.ontomesh.workflow.OntologyExtractionService;
import io.ontomesh.workflow.RelationshipWorkflowService;
import io.ontomesh.workflow.TaskQueueWriterRegistry;
import io.ontomesh.workflow.WorkflowInfra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-level wiring of stores, per-workflow infrastructure and the two workflow services.
 * One instance per server; {@link #serverId()} is the owner id written into workflow leases.
 */
public final class OntoMeshRuntime {
    private static final Logger log = LoggerFactory.getLogger(OntoMeshRuntime.class);

    private final OntoMeshConfig config;
    private final Database database;
    private final EngineSettings settings;
    private final String serverId;
    private final WorkflowStore workflowStore;
    private final EntityStateStore entityStateStore;
    private final CandidateStore candidateStore;
    private final SchemaStore schemaStore;
    private final DatasourceStore datasourceStore;
    private final OntologyStore ontologyStore;
    private final AuditLogger auditLogger;
    private final WorkflowInfra infra;
    private final OntologyExtractionService extraction;
    private final RelationshipWorkflowService relationships;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public OntoMeshRuntime(OntoMeshConfig config) {
        this(config, new HeuristicEntityAnalyzer());
    }

    public OntoMeshRuntime(OntoMeshConfig config, EntityAnalyzer analyzer) {
        this.config = config;
        this.database = new Database(config);
        this.settings = config.loadSettings();
        this.serverId = "srv_" + UUID.randomUUID();
        this.workflowStore = new WorkflowStore(database);
        this.entityStateStore = new EntityStateStore(database);
        this.candidateStore = new CandidateStore(database);
        this.schemaStore = new SchemaStore(database);
        this.datasourceStore = new DatasourceStore(database);
        this.ontologyStore = new OntologyStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), loadOrCreateAuditSigningSecret(config.auditSigningKey()));
        this.infra = new WorkflowInfra(
                workflowStore,
                new HeartbeatRegistry(workflowStore, auditLogger, settings.heartbeatIntervalMs(), settings.stopWaitMs()),
                new TaskQueueWriterRegistry(workflowStore, settings.writerBuffer(), settings.stopWaitMs())
        );
        JdbcDiscovererFactory discoverers = new JdbcDiscovererFactory(datasourceStore);
        this.extraction = new OntologyExtractionService(workflowStore, entityStateStore, schemaStore, discoverers,
                analyzer, ontologyStore, infra, auditLogger, settings, serverId);
        this.relationships = new RelationshipWorkflowService(workflowStore, entityStateStore, candidateStore,
                schemaStore, discoverers, analyzer, infra, auditLogger, settings, serverId);
    }

    public void init() {
        database.init();
        log.info("OntoMesh runtime {} ready at {}", serverId, config.rootDir());
    }

    public OntoMeshConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public String serverId() {
        return serverId;
    }

    public OntologyExtractionService extraction() {
        return extraction;
    }

    public RelationshipWorkflowService relationships() {
        return relationships;
    }

    public WorkflowStore workflows() {
        return workflowStore;
    }

    public InitOutcome initOutcome() {
        List<Database.SchemaMigrationRow> migrations = database.listSchemaMigrations();
        return new InitOutcome(config.rootDir().toString(), config.dbFile().toString(), migrations.size(), serverId);
    }

    public DatasourceStore.Datasource registerDatasource(String projectId, String name, String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbc url must not be blank");
        }
        DatasourceStore.Datasource ds = datasourceStore.register(projectId, name, jdbcUrl);
        audit("datasource.register", ds.id(), "ok", Map.of("projectId", projectId, "name", ds.name()));
        return ds;
    }

    public List<DatasourceStore.Datasource> listDatasources(String projectId) {
        return datasourceStore.listByProject(projectId);
    }

    /**
     * Reads the live catalog of a datasource and replaces its stored schema inventory.
     */
    public SchemaImportOutcome importSchema(String datasourceId) {
        DatasourceStore.Datasource ds = datasourceStore.get(datasourceId)
                .orElseThrow(() -> new WorkflowException("datasource not found: " + datasourceId));
        DiscoveredSchema discovered;
        try (JdbcSchemaDiscoverer discoverer = JdbcSchemaDiscoverer.open(ds.jdbcUrl())) {
            discovered = discoverer.importSchema();
        } catch (Exception e) {
            audit("schema.import", datasourceId, "error", Map.of("error", String.valueOf(e.getMessage())));
            throw new WorkflowException("schema import failed for datasource " + datasourceId + ": " + e.getMessage(), e);
        }
        int tables = schemaStore.replaceSchema(datasourceId, discovered);
        int columns = discovered.tables().stream().mapToInt(t -> t.columns().size()).sum();
        audit("schema.import", datasourceId, "ok", Map.of("tables", tables, "columns", columns));
        log.info("Imported {} tables ({} columns) for datasource {}", tables, columns, datasourceId);
        return new SchemaImportOutcome(datasourceId, tables, columns);
    }

    public List<Workflow> listWorkflows(String projectId) {
        return workflowStore.listByProject(projectId);
    }

    public Optional<OntologyStore.StoredOntology> latestOntology(String projectId) {
        return ontologyStore.latest(projectId);
    }

    /**
     * Writes the latest ontology of a project to {@code <root>/ontology/<projectId>.json}.
     */
    public OntologyExportOutcome exportOntology(String projectId) {
        OntologyStore.StoredOntology ontology = ontologyStore.latest(projectId)
                .orElseThrow(() -> new WorkflowException("no ontology built for project " + projectId));
        Path out = config.ontologyRoot().resolve(projectId + ".json");
        try {
            Files.createDirectories(out.getParent());
            Files.writeString(out, Jsons.toJson(Jsons.toMap(ontology.content())), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to export ontology: " + out, e);
        }
        return new OntologyExportOutcome(ontology.id(), ontology.workflowId(), out.toString());
    }

    public AuditLogger.VerifyOutcome auditVerify() {
        return auditLogger.verify();
    }

    public List<Map<String, Object>> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    /**
     * Stops driving every workflow this process owns. Leases of workflows still running are
     * released, so another server can pick them up straight away.
     */
    public boolean shutdown(long timeoutMs) {
        if (!shutdown.compareAndSet(false, true)) {
            return true;
        }
        boolean clean = infra.shutdown(timeoutMs);
        extraction.shutdown();
        relationships.shutdown();
        if (!clean) {
            log.warn("Runtime {} shut down with workflows still stopping", serverId);
        }
        return clean;
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, "cli", resource, result, null, new LinkedHashMap<>(details)));
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {}: {}", action, e.getMessage());
        }
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record InitOutcome(String root, String dbFile, int migrations, String serverId) {
    }

    public record SchemaImportOutcome(String datasourceId, int tables, int columns) {
    }

    public record OntologyExportOutcome(String ontologyId, String workflowId, String path) {
    }
}
