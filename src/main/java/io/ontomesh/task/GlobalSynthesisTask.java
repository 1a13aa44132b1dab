package io.ontomesh.task;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.queue.RunContext;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.storage.EntityStateStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fan-in step: summarizes the domain from every completed table analysis. Enqueued only
 * once all table entities are complete, with the global entity already in {@code analyzing}.
 */
public final class GlobalSynthesisTask extends EntityTask {
    public static final String DOMAIN = "domain";

    private final EntityAnalyzer analyzer;
    private final String workflowId;

    public GlobalSynthesisTask(EntityStateStore states, EntityAnalyzer analyzer, String workflowId, String stateId, int maxRetries) {
        super(states, stateId, maxRetries);
        this.analyzer = analyzer;
        this.workflowId = workflowId;
    }

    @Override
    public String name() {
        return "global-synthesis";
    }

    @Override
    public boolean requiresLlm() {
        return true;
    }

    @Override
    protected void run(RunContext context) throws Exception {
        List<EntityAnalyzer.TableAnalysis> tables = new ArrayList<>();
        for (EntityState s : states.listByWorkflow(workflowId)) {
            if (s.entityType() != EntityType.TABLE || s.status() != EntityStatus.COMPLETE) {
                continue;
            }
            tables.add(tableAnalysis(s));
        }
        EntityAnalyzer.DomainSummary summary = analyzer.synthesizeDomain(tables);
        context.throwIfCancelled();

        Map<String, Object> domain = new LinkedHashMap<>();
        domain.put("description", summary.description());
        domain.put("primary_domains", summary.primaryDomains());
        domain.put("entity_count", summary.entityCount());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(DOMAIN, domain);
        states.updateStateData(stateId, EntityStatus.COMPLETE, data);
    }

    private static EntityAnalyzer.TableAnalysis tableAnalysis(EntityState table) {
        Object raw = table.stateData().get(AnalyzeTableTask.ANALYSIS);
        Map<?, ?> analysis = raw instanceof Map ? (Map<?, ?>) raw : Map.of();
        return new EntityAnalyzer.TableAnalysis(
                table.entityKey(),
                text(analysis.get("business_name"), table.entityKey()),
                text(analysis.get("description"), ""),
                text(analysis.get("entity_role"), "core"),
                List.of(),
                false
        );
    }

    private static String text(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }
}
