package io.ontomesh.workflow;

import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaRelationship;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowException;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.queue.QueueSettings;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkQueue;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.Database;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.storage.SchemaStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

final class RelationshipWorkflowServiceTest {
    private static final long WAIT_MS = 20_000L;

    @Test
    void detectionFindsForeignKeyAndSavesIt() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Workflow started = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
            Workflow done = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));
            Assertions.assertEquals(100, done.progress().current());

            RelationshipWorkflowService.CandidatesGrouped grouped = service.getCandidatesGrouped(shop.datasource.id());
            Assertions.assertEquals(1, grouped.confirmed().size());
            Assertions.assertTrue(grouped.needsReview().isEmpty());
            RelationshipWorkflowService.CandidateView view = grouped.confirmed().get(0);
            Assertions.assertEquals("orders", view.sourceTable());
            Assertions.assertEquals("user_id", view.sourceColumn());
            Assertions.assertEquals("users", view.targetTable());
            Assertions.assertEquals("id", view.targetColumn());
            Assertions.assertEquals(1.0d, view.candidate().joinMatchRate().doubleValue(), 1e-9);

            RelationshipWorkflowService.StatusWithCounts status = service.getStatusWithCounts(shop.datasource.id()).orElseThrow();
            Assertions.assertTrue(status.canSave());
            Assertions.assertEquals(1, status.counts().confirmed());

            Assertions.assertEquals(1, service.saveRelationships(started.id()));
            List<SchemaRelationship> saved = stores(shop).schema.listRelationships(shop.datasource.id());
            Assertions.assertEquals(1, saved.size());
            Assertions.assertEquals("inferred", saved.get(0).relationshipType());
            Assertions.assertEquals("N:1", saved.get(0).cardinality());
            Assertions.assertEquals(Long.valueOf(6L), saved.get(0).matchedCount());
        }
    }

    @Test
    void decisionsAreValidatedAndRequiredCandidatesBlockSave() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-review")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Workflow started = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
            Workflow done = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));

            Stores stores = stores(shop);
            SchemaColumn email = column(stores.schema, shop.datasource.id(), "users", "email");
            SchemaColumn orderId = column(stores.schema, shop.datasource.id(), "orders", "id");
            RelationshipCandidate unsure = RelationshipCandidate.detected(UUID.randomUUID().toString(), started.id(),
                    shop.datasource.id(), email.id(), orderId.id(), DetectionMethod.VALUE_MATCH, 0.4d, 0.4d, 1L)
                    .withReview(DetectionMethod.VALUE_MATCH, 0.4d, "ambiguous", CandidateStatus.PENDING, true);
            Assertions.assertTrue(stores.candidates.create(unsure));

            Assertions.assertFalse(service.getStatusWithCounts(shop.datasource.id()).orElseThrow().canSave());
            WorkflowException blocked = Assertions.assertThrows(WorkflowException.class,
                    () -> service.saveRelationships(started.id()));
            Assertions.assertEquals("cannot save: 1 relationships require user review", blocked.getMessage());
            Assertions.assertTrue(stores.schema.listRelationships(shop.datasource.id()).isEmpty());

            Assertions.assertThrows(WorkflowException.class,
                    () -> service.updateCandidateDecision(shop.datasource.id(), unsure.id(), "maybe"));
            Assertions.assertThrows(WorkflowException.class,
                    () -> service.updateCandidateDecision("ds_other", unsure.id(), "rejected"));

            RelationshipCandidate rejected = service.updateCandidateDecision(shop.datasource.id(), unsure.id(), "rejected");
            Assertions.assertEquals(CandidateStatus.REJECTED, rejected.status());
            Assertions.assertEquals(1, service.getCandidatesGrouped(shop.datasource.id()).rejected().size());
            Assertions.assertEquals(1, service.saveRelationships(started.id()));
        }
    }

    @Test
    void saveKeepsOneRelationshipPerTablePair() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-dedup")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Workflow done = detect(shop);
            Stores stores = stores(shop);
            SchemaColumn orderId = column(stores.schema, shop.datasource.id(), "orders", "id");
            SchemaColumn userId = column(stores.schema, shop.datasource.id(), "users", "id");
            String longest = "Order numbers double as the account number of the user who placed the first order, "
                    + "kept for compatibility with the legacy billing export";
            Assertions.assertTrue(stores.candidates.create(accepted(done, shop, orderId, userId, longest)));

            Assertions.assertEquals(1, service.saveRelationships(done.id()));
            List<SchemaRelationship> saved = stores.schema.listRelationships(shop.datasource.id());
            Assertions.assertEquals(1, saved.size());
            Assertions.assertEquals(orderId.id(), saved.get(0).sourceColumnId());
            Assertions.assertEquals(longest, saved.get(0).description());
        }
    }

    @Test
    void saveFailsBeforeWritingWhenAcceptedColumnIsGone() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-gone")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Workflow done = detect(shop);
            Stores stores = stores(shop);
            SchemaColumn email = column(stores.schema, shop.datasource.id(), "users", "email");
            SchemaColumn gone = new SchemaColumn("col_gone", email.tableId(), "dropped", "TEXT", false, null, null, 0);
            Assertions.assertTrue(stores.candidates.create(accepted(done, shop, email, gone, "dropped column")));

            WorkflowException e = Assertions.assertThrows(WorkflowException.class,
                    () -> service.saveRelationships(done.id()));
            Assertions.assertEquals("target column col_gone not found in schema", e.getMessage());
            Assertions.assertTrue(stores.schema.listRelationships(shop.datasource.id()).isEmpty());
        }
    }

    @Test
    void saveRejectsWorkflowWithoutDatasource() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-nods")) {
            long now = System.currentTimeMillis();
            String workflowId = "wf_" + UUID.randomUUID();
            shop.runtime.workflows().create(new Workflow(workflowId, ShopFixture.PROJECT, null,
                    WorkflowPhase.RELATIONSHIPS, WorkflowState.COMPLETED,
                    WorkflowProgress.empty(WorkflowPhase.RELATIONSHIPS), null, 0L, null, now, now));

            WorkflowException e = Assertions.assertThrows(WorkflowException.class,
                    () -> shop.runtime.relationships().saveRelationships(workflowId));
            Assertions.assertEquals("workflow has no datasource ID", e.getMessage());
            Assertions.assertTrue(stores(shop).schema.listRelationships(shop.datasource.id()).isEmpty());
        }
    }

    @Test
    void failedStartDoesNotBlockLaterStarts() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-start")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Database db = new Database(shop.runtime.config());
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("""
                        CREATE TRIGGER refuse_entity_states BEFORE INSERT ON workflow_entity_states
                        BEGIN SELECT RAISE(ABORT, 'entity states unavailable'); END
                        """);
            }
            Assertions.assertThrows(RuntimeException.class,
                    () -> service.startDetection(ShopFixture.PROJECT, shop.datasource.id()));
            Workflow failed = service.getStatus(shop.datasource.id()).orElseThrow();
            Assertions.assertEquals(WorkflowState.FAILED, failed.state());
            Assertions.assertTrue(failed.errorMessage().startsWith("start failed:"));

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TRIGGER refuse_entity_states");
            }
            Workflow retried = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
            Assertions.assertEquals(WorkflowState.COMPLETED, service.awaitCompletion(retried.id(), WAIT_MS).orElseThrow().state());
        }
    }

    @Test
    void cancelDeletesWorkflowAndAllowsRestart() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-cancel")) {
            RelationshipWorkflowService service = shop.runtime.relationships();
            Workflow first = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
            WorkflowException duplicate = Assertions.assertThrows(WorkflowException.class,
                    () -> service.startDetection(ShopFixture.PROJECT, shop.datasource.id()));
            Assertions.assertEquals(RelationshipWorkflowService.ALREADY_RUNNING, duplicate.getMessage());

            service.cancel(first.id());
            service.awaitCompletion(first.id(), WAIT_MS);
            Stores stores = stores(shop);
            Assertions.assertTrue(shop.runtime.workflows().get(first.id()).isEmpty());
            Assertions.assertTrue(stores.states.listByWorkflow(first.id()).isEmpty());
            Assertions.assertTrue(stores.candidates.getByWorkflow(first.id()).isEmpty());

            Workflow second = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
            Assertions.assertNotEquals(first.id(), second.id());
            Assertions.assertEquals(WorkflowState.COMPLETED, service.awaitCompletion(second.id(), WAIT_MS).orElseThrow().state());
        }
    }

    @Test
    void columnScansSkipTerminalAndUntrackedColumns() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-rel-scan")) {
            Stores stores = stores(shop);
            long now = System.currentTimeMillis();
            String workflowId = "wf_" + UUID.randomUUID();
            Workflow workflow = new Workflow(workflowId, ShopFixture.PROJECT, shop.datasource.id(),
                    WorkflowPhase.RELATIONSHIPS, WorkflowState.RUNNING, WorkflowProgress.empty(WorkflowPhase.RELATIONSHIPS),
                    null, 0L, null, now, now);
            shop.runtime.workflows().create(workflow);

            List<SchemaTable> tables = stores.schema.listTablesByDatasource(shop.datasource.id());
            List<EntityState> entities = new ArrayList<>(RelationshipWorkflowService.columnEntities(workflowId, tables,
                    stores.schema.listColumnsByDatasource(shop.datasource.id()), now));
            Assertions.assertEquals(5, entities.size());
            entities.removeIf(s -> s.entityKey().endsWith("total"));
            stores.states.createBatch(ShopFixture.PROJECT, entities);
            EntityState done = entities.get(0);
            stores.states.updateStatus(done.id(), EntityStatus.SCANNING, null);
            stores.states.updateStatus(done.id(), EntityStatus.COMPLETE, null);

            WorkQueue queue = new WorkQueue("scan-test", QueueSettings.from(shop.runtime.settings()), RunContext.root(), null);
            try {
                queue.pause();
                Assertions.assertEquals(3, shop.runtime.relationships().enqueueColumnScans(workflow, queue));
                Assertions.assertEquals(3, queue.progress().total());
            } finally {
                queue.close();
            }
        }
    }

    @Test
    void userAcceptedCandidateBecomesReviewRelationship() {
        RelationshipCandidate candidate = new RelationshipCandidate("c1", "wf_1", "ds_1", "col_src", "col_tgt",
                DetectionMethod.VALUE_MATCH, 0.6d, 0.75d, null, 0.95d, 0.05d, 0.8d, 20L, 10L, 19L, 1L,
                "orders reference users", false, CandidateStatus.ACCEPTED, "accepted", 1L, 1L);
        SchemaRelationship rel = RelationshipWorkflowService.toRelationship("ds_1", candidate);
        Assertions.assertEquals("review", rel.relationshipType());
        Assertions.assertEquals("N:1", rel.cardinality());
        Assertions.assertEquals(0.75d, rel.matchRate().doubleValue(), 1e-9);
        Assertions.assertEquals(Long.valueOf(19L), rel.matchedCount());
        Assertions.assertEquals("col_src", rel.sourceColumnId());
    }

    private static Workflow detect(ShopFixture shop) {
        RelationshipWorkflowService service = shop.runtime.relationships();
        Workflow started = service.startDetection(ShopFixture.PROJECT, shop.datasource.id());
        Workflow done = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
        Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));
        return done;
    }

    private static RelationshipCandidate accepted(
            Workflow workflow, ShopFixture shop, SchemaColumn source, SchemaColumn target, String description) {
        return RelationshipCandidate.detected(UUID.randomUUID().toString(), workflow.id(), shop.datasource.id(),
                        source.id(), target.id(), DetectionMethod.VALUE_MATCH, 0.9d, 0.9d, 1L)
                .withReview(DetectionMethod.VALUE_MATCH, 0.9d, description, CandidateStatus.ACCEPTED, false);
    }

    private static SchemaColumn column(SchemaStore schema, String datasourceId, String table, String column) {
        String tableId = schema.listTablesByDatasource(datasourceId).stream()
                .filter(t -> t.tableName().equals(table))
                .findFirst().orElseThrow().id();
        return schema.listColumnsByDatasource(datasourceId).stream()
                .filter(c -> c.tableId().equals(tableId) && c.columnName().equals(column))
                .findFirst().orElseThrow();
    }

    private static Stores stores(ShopFixture shop) {
        Database db = new Database(shop.runtime.config());
        return new Stores(new SchemaStore(db), new CandidateStore(db), new EntityStateStore(db));
    }

    private record Stores(SchemaStore schema, CandidateStore candidates, EntityStateStore states) {
    }
}
