package io.ontomesh.workflow;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.storage.OntologyStore;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.task.AnalyzeTableTask;
import io.ontomesh.task.GlobalSynthesisTask;
import io.ontomesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes the ontology once every entity is terminal. Entity state rows are kept;
 * they are cleaned up lazily when the project's next extraction starts.
 */
public final class OntologyFinalizer {
    private static final Logger log = LoggerFactory.getLogger(OntologyFinalizer.class);
    static final String FINALIZING = "Finalizing ontology...";
    private static final Set<String> BOOKKEEPING = Set.of("sample_values", "value_fingerprint", "scanned_at");

    private final WorkflowStore workflows;
    private final OntologyStore ontologies;

    public OntologyFinalizer(WorkflowStore workflows, OntologyStore ontologies) {
        this.workflows = workflows;
        this.ontologies = ontologies;
    }

    public String finalizeWorkflow(Workflow workflow, List<EntityState> entities) {
        int count = entities.size();
        workflows.updateProgress(workflow.id(),
                new WorkflowProgress(WorkflowPhase.COMPLETING.wire(), count, count, FINALIZING));
        Map<String, Object> ontology = buildOntology(workflow, entities);
        String ontologyId = ontologies.save(workflow.projectId(), workflow.id(), Jsons.toCompactJson(ontology));
        workflows.updateState(workflow.id(), WorkflowState.COMPLETED, null);
        log.info("Finalized ontology {} for project {} from {} entities", ontologyId, workflow.projectId(), count);
        return ontologyId;
    }

    /**
     * Ontology document without workflow bookkeeping: no statuses, retry counts, errors,
     * samples or fingerprints.
     */
    static Map<String, Object> buildOntology(Workflow workflow, List<EntityState> entities) {
        Map<String, Object> domain = Map.of();
        Map<String, Map<String, Object>> tables = new LinkedHashMap<>();
        List<EntityState> columns = new ArrayList<>();
        for (EntityState s : entities) {
            switch (s.entityType()) {
                case GLOBAL -> domain = asMap(s.stateData().get(GlobalSynthesisTask.DOMAIN));
                case TABLE -> tables.put(s.entityKey(), tableEntry(s));
                case COLUMN -> columns.add(s);
                default -> {
                }
            }
        }
        for (EntityState c : columns) {
            String key = c.entityKey();
            for (Map.Entry<String, Map<String, Object>> t : tables.entrySet()) {
                String prefix = t.getKey() + ".";
                if (key.startsWith(prefix)) {
                    columnsOf(t.getValue()).add(columnEntry(key.substring(prefix.length()), c));
                    break;
                }
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("project_id", workflow.projectId());
        out.put("workflow_id", workflow.id());
        out.put("datasource_id", workflow.datasourceId());
        out.put("generated_at", Instant.now().toString());
        out.put("domain", domain);
        out.put("entities", new ArrayList<>(tables.values()));
        return out;
    }

    private static Map<String, Object> tableEntry(EntityState table) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("table_name", table.entityKey());
        entry.putAll(asMap(table.stateData().get(AnalyzeTableTask.ANALYSIS)));
        Object rows = table.stateData().get("row_count");
        if (rows != null) {
            entry.put("row_count", rows);
        }
        entry.put("columns", new ArrayList<Map<String, Object>>());
        return entry;
    }

    private static Map<String, Object> columnEntry(String columnName, EntityState column) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("column_name", columnName);
        for (Map.Entry<String, Object> e : column.stateData().entrySet()) {
            if (!BOOKKEEPING.contains(e.getKey())) {
                entry.put(e.getKey(), e.getValue());
            }
        }
        return entry;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> columnsOf(Map<String, Object> table) {
        return (List<Map<String, Object>>) table.get("columns");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) value);
        }
        return new LinkedHashMap<>();
    }
}
