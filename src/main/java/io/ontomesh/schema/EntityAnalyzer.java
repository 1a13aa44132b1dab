package io.ontomesh.schema;

import java.util.List;
import java.util.Map;

/**
 * Natural-language reasoning over scanned schema data. Calls are slow and may fail
 * transiently; callers run them on the queue's LLM permits.
 */
public interface EntityAnalyzer {
    TableAnalysis analyzeTable(TableProfile table) throws Exception;

    DomainSummary synthesizeDomain(List<TableAnalysis> tables) throws Exception;

    List<CandidateDecision> reviewCandidates(List<CandidateContext> candidates) throws Exception;

    record ColumnProfile(String columnName, String dataType, boolean primaryKey, Map<String, Object> gathered) {
    }

    record TableProfile(String tableName, Long rowCount, List<ColumnProfile> columns) {
    }

    /**
     * {@code requiresInput} parks the table in needs-input until a human answers {@code questions}.
     */
    record TableAnalysis(
            String tableName,
            String businessName,
            String description,
            String entityRole,
            List<String> questions,
            boolean requiresInput
    ) {
    }

    record DomainSummary(String description, List<String> primaryDomains, int entityCount) {
    }

    record CandidateContext(
            String candidateId,
            String sourceTable,
            String sourceColumn,
            String targetTable,
            String targetColumn,
            String detectionMethod,
            double confidence,
            Double joinMatchRate,
            String cardinality
    ) {
    }

    /**
     * {@code action} is one of {@code confirm}, {@code reject} or {@code needs_review}.
     */
    record CandidateDecision(String candidateId, String action, double confidence, String reasoning) {
    }
}
