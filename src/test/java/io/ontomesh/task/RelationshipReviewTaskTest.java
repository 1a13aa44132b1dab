package io.ontomesh.task;

import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.schema.EntityAnalyzer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RelationshipReviewTaskTest {

    private static RelationshipCandidate candidate(DetectionMethod method) {
        return RelationshipCandidate.detected("cand_1", "wf_1", "ds_1", "src", "tgt", method, 0.6d, 0.9d, 0L);
    }

    @Test
    void confidentConfirmAcceptsAndUpgradesHeuristicMethod() {
        RelationshipCandidate out = RelationshipReviewTask.apply(candidate(DetectionMethod.VALUE_MATCH),
                new EntityAnalyzer.CandidateDecision("cand_1", "confirm", 0.9d, "ids line up"));
        Assertions.assertEquals(CandidateStatus.ACCEPTED, out.status());
        Assertions.assertEquals(DetectionMethod.HYBRID, out.detectionMethod());
        Assertions.assertFalse(out.required());
        Assertions.assertEquals("ids line up", out.description());
        Assertions.assertEquals(0.9d, out.confidence(), 1e-9);
    }

    @Test
    void confidentRejectRejects() {
        RelationshipCandidate out = RelationshipReviewTask.apply(candidate(DetectionMethod.METADATA),
                new EntityAnalyzer.CandidateDecision("cand_1", "reject", 0.95d, "coincidental overlap"));
        Assertions.assertEquals(CandidateStatus.REJECTED, out.status());
        Assertions.assertEquals(DetectionMethod.METADATA, out.detectionMethod());
        Assertions.assertFalse(out.required());
    }

    @Test
    void lowConfidenceOrMissingVerdictNeedsHumanReview() {
        RelationshipCandidate unsure = RelationshipReviewTask.apply(candidate(DetectionMethod.NAME_INFERENCE),
                new EntityAnalyzer.CandidateDecision("cand_1", "confirm", 0.5d, "maybe"));
        Assertions.assertEquals(CandidateStatus.PENDING, unsure.status());
        Assertions.assertTrue(unsure.required());

        RelationshipCandidate missing = RelationshipReviewTask.apply(candidate(DetectionMethod.NAME_INFERENCE), null);
        Assertions.assertEquals(CandidateStatus.PENDING, missing.status());
        Assertions.assertTrue(missing.required());
        Assertions.assertEquals(DetectionMethod.NAME_INFERENCE, missing.detectionMethod());
    }
}
