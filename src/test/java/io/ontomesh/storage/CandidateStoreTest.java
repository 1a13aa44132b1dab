package io.ontomesh.storage;

import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.JoinMetrics;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.WorkflowPhase;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class CandidateStoreTest {

    @Test
    void countsFollowReviewBucketsAndDecisionsClearTheGate() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-candidates-");
        try {
            Database db = WorkflowStoreTest.database(root);
            WorkflowStore workflows = new WorkflowStore(db);
            CandidateStore candidates = new CandidateStore(db);
            String wf = WorkflowStoreTest.createWorkflow(workflows, "proj", WorkflowPhase.RELATIONSHIPS, 1L);

            Assertions.assertTrue(candidates.create(candidate("c1", wf, "s1", "t1")));
            Assertions.assertFalse(candidates.create(candidate("c1b", wf, "s1", "t1")), "same column pair is ignored");
            Assertions.assertTrue(candidates.create(candidate("c2", wf, "s2", "t1")));
            Assertions.assertTrue(candidates.create(candidate("c3", wf, "s3", "t1")));
            Assertions.assertTrue(candidates.exists(wf, "s1", "t1"));
            Assertions.assertFalse(candidates.exists(wf, "t1", "s1"));

            RelationshipCandidate c1 = candidates.get("c1").orElseThrow();
            candidates.update(c1.withReview(DetectionMethod.HYBRID, 0.95d, "clear match", CandidateStatus.ACCEPTED, false));
            RelationshipCandidate c2 = candidates.get("c2").orElseThrow()
                    .withJoinMetrics(new JoinMetrics("N:1", 0.7d, 0.3d, 0.5d, 10L, 4L, 7L, 3L));
            candidates.update(c2.withReview(DetectionMethod.HYBRID, 0.6d, "unsure", CandidateStatus.PENDING, true));
            RelationshipCandidate c3 = candidates.get("c3").orElseThrow();
            candidates.update(c3.withReview(DetectionMethod.VALUE_MATCH, 0.9d, "noise", CandidateStatus.REJECTED, false));

            CandidateStore.CandidateCounts counts = candidates.countsByWorkflow(wf);
            Assertions.assertEquals(1, counts.confirmed());
            Assertions.assertEquals(1, counts.needsReview());
            Assertions.assertEquals(1, counts.rejected());
            Assertions.assertEquals(1, candidates.countRequiredPending(wf));

            RelationshipCandidate stored = candidates.get("c2").orElseThrow();
            Assertions.assertEquals("N:1", stored.cardinality());
            Assertions.assertEquals(7L, stored.matchedRows());

            candidates.updateStatus("c2", CandidateStatus.ACCEPTED, CandidateStatus.ACCEPTED.wire());
            Assertions.assertEquals(0, candidates.countRequiredPending(wf));
            Assertions.assertTrue(candidates.get("c2").orElseThrow().acceptedByUser());
            Assertions.assertEquals(2, candidates.getByWorkflowAndStatus(wf, CandidateStatus.ACCEPTED).size());

            Assertions.assertEquals(3, candidates.deleteByWorkflow(wf));
            Assertions.assertTrue(candidates.getByWorkflow(wf).isEmpty());
        } finally {
            WorkflowStoreTest.deleteRecursively(root);
        }
    }

    private static RelationshipCandidate candidate(String id, String wf, String source, String target) {
        return RelationshipCandidate.detected(id, wf, "ds_1", source, target, DetectionMethod.VALUE_MATCH, 0.7d, 0.8d, 1L);
    }
}
