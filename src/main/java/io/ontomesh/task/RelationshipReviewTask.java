package io.ontomesh.task;

import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkTask;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.SchemaRepository;
import io.ontomesh.storage.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the analyzer to confirm or reject every pending candidate. Only high-confidence
 * verdicts are applied; anything else is left pending and flagged for human review.
 */
public final class RelationshipReviewTask implements WorkTask {
    private static final Logger log = LoggerFactory.getLogger(RelationshipReviewTask.class);

    static final double HIGH_CONFIDENCE = 0.85d;
    static final String CONFIRM = "confirm";
    static final String REJECT = "reject";

    private final CandidateStore candidates;
    private final SchemaRepository schema;
    private final EntityAnalyzer analyzer;
    private final String workflowId;

    public RelationshipReviewTask(CandidateStore candidates, SchemaRepository schema, EntityAnalyzer analyzer, String workflowId) {
        this.candidates = candidates;
        this.schema = schema;
        this.analyzer = analyzer;
        this.workflowId = workflowId;
    }

    @Override
    public String id() {
        return "review:" + workflowId;
    }

    @Override
    public String name() {
        return "relationship-review";
    }

    @Override
    public boolean requiresLlm() {
        return true;
    }

    @Override
    public void execute(RunContext context) throws Exception {
        List<RelationshipCandidate> pending = candidates.getByWorkflowAndStatus(workflowId, CandidateStatus.PENDING);
        if (pending.isEmpty()) {
            return;
        }
        List<EntityAnalyzer.CandidateContext> contexts = new ArrayList<>(pending.size());
        Map<String, RelationshipCandidate> byId = new HashMap<>();
        for (RelationshipCandidate c : pending) {
            byId.put(c.id(), c);
            contexts.add(context(c));
        }
        List<EntityAnalyzer.CandidateDecision> decisions = analyzer.reviewCandidates(contexts);
        context.throwIfCancelled();

        Map<String, EntityAnalyzer.CandidateDecision> decided = new HashMap<>();
        for (EntityAnalyzer.CandidateDecision d : decisions) {
            decided.put(d.candidateId(), d);
        }
        int accepted = 0;
        int rejected = 0;
        int review = 0;
        for (RelationshipCandidate c : pending) {
            RelationshipCandidate updated = apply(c, decided.get(c.id()));
            candidates.update(updated);
            switch (updated.status()) {
                case ACCEPTED -> accepted++;
                case REJECTED -> rejected++;
                default -> review++;
            }
        }
        log.info("Reviewed {} candidates for workflow {}: {} accepted, {} rejected, {} need review",
                pending.size(), workflowId, accepted, rejected, review);
    }

    /**
     * Applies one verdict. A missing verdict leaves the candidate pending and required.
     */
    static RelationshipCandidate apply(RelationshipCandidate c, EntityAnalyzer.CandidateDecision decision) {
        if (decision == null) {
            return c.withReview(c.detectionMethod(), c.confidence(), c.description(), CandidateStatus.PENDING, true);
        }
        DetectionMethod method = c.detectionMethod() == DetectionMethod.VALUE_MATCH
                || c.detectionMethod() == DetectionMethod.NAME_INFERENCE
                ? DetectionMethod.HYBRID
                : c.detectionMethod();
        boolean confident = decision.confidence() >= HIGH_CONFIDENCE;
        if (CONFIRM.equals(decision.action()) && confident) {
            return c.withReview(method, decision.confidence(), decision.reasoning(), CandidateStatus.ACCEPTED, false);
        }
        if (REJECT.equals(decision.action()) && confident) {
            return c.withReview(method, decision.confidence(), decision.reasoning(), CandidateStatus.REJECTED, false);
        }
        return c.withReview(method, decision.confidence(), decision.reasoning(), CandidateStatus.PENDING, true);
    }

    private EntityAnalyzer.CandidateContext context(RelationshipCandidate c) {
        Optional<SchemaColumn> source = schema.getColumn(c.sourceColumnId());
        Optional<SchemaColumn> target = schema.getColumn(c.targetColumnId());
        return new EntityAnalyzer.CandidateContext(
                c.id(),
                source.flatMap(col -> schema.getTable(col.tableId())).map(SchemaTable::tableName).orElse(""),
                source.map(SchemaColumn::columnName).orElse(c.sourceColumnId()),
                target.flatMap(col -> schema.getTable(col.tableId())).map(SchemaTable::tableName).orElse(""),
                target.map(SchemaColumn::columnName).orElse(c.targetColumnId()),
                c.detectionMethod().wire(),
                c.confidence(),
                c.joinMatchRate(),
                c.cardinality()
        );
    }
}
