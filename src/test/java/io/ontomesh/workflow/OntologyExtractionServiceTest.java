package io.ontomesh.workflow;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowException;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.runtime.OntoMeshRuntime;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.HeuristicEntityAnalyzer;
import io.ontomesh.storage.Database;
import io.ontomesh.storage.DatasourceStore;
import io.ontomesh.storage.EntityStateStore;
import io.ontomesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class OntologyExtractionServiceTest {
    private static final long WAIT_MS = 20_000L;

    @Test
    void extractionCompletesEveryEntityAndWritesOntology() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-extract")) {
            OntologyExtractionService service = shop.runtime.extraction();
            Workflow started = service.startExtraction(ShopFixture.PROJECT, shop.datasource.id());
            Assertions.assertEquals(WorkflowState.RUNNING, started.state());

            Workflow done = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));

            OntologyExtractionService.ExtractionStatus status = service.getStatus(ShopFixture.PROJECT).orElseThrow();
            // global + users, orders + five columns
            Assertions.assertEquals(Map.of("complete", 8), status.entityCounts());
            Assertions.assertFalse(status.drivenHere());

            Map<String, Object> ontology = Jsons.toMap(shop.runtime.latestOntology(ShopFixture.PROJECT).orElseThrow().content());
            Assertions.assertEquals(started.id(), ontology.get("workflow_id"));
            Assertions.assertEquals(2, ((List<?>) ontology.get("entities")).size());
            Assertions.assertNull(done.ownerId());
        }
    }

    @Test
    void tableAwaitingInputResumesAfterAnswers() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-extract-input", new AskAboutOrders())) {
            OntologyExtractionService service = shop.runtime.extraction();
            Workflow started = service.startExtraction(ShopFixture.PROJECT, shop.datasource.id());

            EntityState orders = awaitStatus(shop.runtime, started.id(), EntityType.TABLE, "orders", EntityStatus.NEEDS_INPUT);
            awaitStatus(shop.runtime, started.id(), EntityType.TABLE, "users", EntityStatus.COMPLETE);
            Assertions.assertEquals(WorkflowState.RUNNING, shop.runtime.workflows().get(started.id()).orElseThrow().state());
            // no synthesis while a table is short of complete
            Thread.sleep(200L);
            Assertions.assertEquals(EntityStatus.PENDING,
                    find(shop.runtime, started.id(), EntityType.GLOBAL, EntityType.globalKey()).orElseThrow().status());
            Assertions.assertThrows(WorkflowException.class,
                    () -> service.answerQuestions(started.id(), "users", Map.of("q", "a")));

            EntityState answered = service.answerQuestions(started.id(), "orders", Map.of("Who places orders?", "customers"));
            Assertions.assertEquals(orders.id(), answered.id());
            Assertions.assertEquals(EntityStatus.COMPLETE, answered.status());

            Workflow done = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));
        }
    }

    @Test
    void columnsLeftBehindByFinishedTablesAreSettled() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-extract-settle")) {
            long now = System.currentTimeMillis();
            String workflowId = "wf_" + UUID.randomUUID();
            shop.runtime.workflows().create(new Workflow(workflowId, ShopFixture.PROJECT, shop.datasource.id(),
                    WorkflowPhase.TIER1_BUILDING, WorkflowState.PENDING,
                    WorkflowProgress.empty(WorkflowPhase.TIER1_BUILDING), null, 0L, null, now, now));
            EntityStateStore states = new EntityStateStore(new Database(shop.runtime.config()));
            states.createBatch(ShopFixture.PROJECT, List.of(
                    seeded(workflowId, EntityType.GLOBAL, EntityType.globalKey(), EntityStatus.PENDING, null),
                    seeded(workflowId, EntityType.TABLE, "users", EntityStatus.FAILED, "scan timed out"),
                    seeded(workflowId, EntityType.COLUMN, "users.id", EntityStatus.SCANNED, null),
                    seeded(workflowId, EntityType.COLUMN, "users.email", EntityStatus.SCANNED, null),
                    seeded(workflowId, EntityType.TABLE, "orders", EntityStatus.COMPLETE, null),
                    seeded(workflowId, EntityType.COLUMN, "orders.id", EntityStatus.COMPLETE, null),
                    seeded(workflowId, EntityType.COLUMN, "orders.user_id", EntityStatus.SCANNED, null),
                    seeded(workflowId, EntityType.COLUMN, "orders.total", EntityStatus.PENDING, null)
            ));

            OntologyExtractionService service = shop.runtime.extraction();
            service.resume(workflowId);
            Workflow done = service.awaitCompletion(workflowId, WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.COMPLETED, done.state(), String.valueOf(done.errorMessage()));

            EntityState usersId = find(shop.runtime, workflowId, EntityType.COLUMN, "users.id").orElseThrow();
            Assertions.assertEquals(EntityStatus.FAILED, usersId.status());
            Assertions.assertEquals("table failed: scan timed out", usersId.lastError());
            Assertions.assertEquals(EntityStatus.COMPLETE,
                    find(shop.runtime, workflowId, EntityType.COLUMN, "orders.user_id").orElseThrow().status());
            Assertions.assertEquals(EntityStatus.COMPLETE,
                    find(shop.runtime, workflowId, EntityType.COLUMN, "orders.total").orElseThrow().status());
            Assertions.assertEquals(EntityStatus.FAILED,
                    find(shop.runtime, workflowId, EntityType.GLOBAL, EntityType.globalKey()).orElseThrow().status());
        }
    }

    @Test
    void secondStartIsRejectedAndCancelStopsTheRun() throws Exception {
        BlockingAnalyzer analyzer = new BlockingAnalyzer();
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-extract-cancel", analyzer)) {
            OntologyExtractionService service = shop.runtime.extraction();
            Workflow started = service.startExtraction(ShopFixture.PROJECT, shop.datasource.id());
            Assertions.assertTrue(analyzer.entered.await(WAIT_MS, TimeUnit.MILLISECONDS));

            WorkflowException duplicate = Assertions.assertThrows(WorkflowException.class,
                    () -> service.startExtraction(ShopFixture.PROJECT, shop.datasource.id()));
            Assertions.assertEquals(OntologyExtractionService.ALREADY_RUNNING, duplicate.getMessage());

            Assertions.assertTrue(service.cancel(started.id()));
            Workflow cancelled = service.awaitCompletion(started.id(), WAIT_MS).orElseThrow();
            Assertions.assertEquals(WorkflowState.CANCELLED, cancelled.state());
            Assertions.assertFalse(service.cancel(started.id()));
        } finally {
            analyzer.release.countDown();
        }
    }

    @Test
    void datasourceWithoutTablesIsRejected() throws Exception {
        try (ShopFixture shop = ShopFixture.create("ontomesh-test-extract-empty")) {
            DatasourceStore.Datasource empty = shop.runtime.registerDatasource(ShopFixture.PROJECT, "empty",
                    "jdbc:sqlite:" + shop.root.resolve("empty.db"));
            WorkflowException e = Assertions.assertThrows(WorkflowException.class,
                    () -> shop.runtime.extraction().startExtraction(ShopFixture.PROJECT, empty.id()));
            Assertions.assertTrue(e.getMessage().contains("no imported schema tables"));
            Assertions.assertTrue(shop.runtime.extraction().getStatus(ShopFixture.PROJECT).isEmpty());
        }
    }

    private static EntityState awaitStatus(
            OntoMeshRuntime runtime, String workflowId, EntityType type, String key, EntityStatus status)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (System.currentTimeMillis() < deadline) {
            Optional<EntityState> state = find(runtime, workflowId, type, key);
            if (state.isPresent() && state.get().status() == status) {
                return state.get();
            }
            Thread.sleep(20L);
        }
        throw new AssertionError(type.wire() + " " + key + " never reached " + status.wire());
    }

    private static Optional<EntityState> find(OntoMeshRuntime runtime, String workflowId, EntityType type, String key) {
        return runtime.extraction().entities(workflowId).stream()
                .filter(s -> s.entityType() == type && s.entityKey().equals(key))
                .findFirst();
    }

    private static EntityState seeded(String workflowId, EntityType type, String key, EntityStatus status, String error) {
        return new EntityState("ent_" + UUID.randomUUID(), workflowId, type, key, status, 0, error, Map.of(), 1L, 1L);
    }

    private static class DelegatingAnalyzer implements EntityAnalyzer {
        private final HeuristicEntityAnalyzer delegate = new HeuristicEntityAnalyzer();

        @Override
        public TableAnalysis analyzeTable(TableProfile table) throws Exception {
            return delegate.analyzeTable(table);
        }

        @Override
        public DomainSummary synthesizeDomain(List<TableAnalysis> tables) {
            return delegate.synthesizeDomain(tables);
        }

        @Override
        public List<CandidateDecision> reviewCandidates(List<CandidateContext> candidates) {
            return delegate.reviewCandidates(candidates);
        }
    }

    private static final class AskAboutOrders extends DelegatingAnalyzer {
        @Override
        public TableAnalysis analyzeTable(TableProfile table) throws Exception {
            TableAnalysis analysis = super.analyzeTable(table);
            if (!"orders".equals(table.tableName())) {
                return analysis;
            }
            return new TableAnalysis(analysis.tableName(), analysis.businessName(), analysis.description(),
                    analysis.entityRole(), List.of("Who places orders?"), true);
        }
    }

    private static final class BlockingAnalyzer extends DelegatingAnalyzer {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public TableAnalysis analyzeTable(TableProfile table) throws Exception {
            entered.countDown();
            release.await();
            return super.analyzeTable(table);
        }
    }
}
