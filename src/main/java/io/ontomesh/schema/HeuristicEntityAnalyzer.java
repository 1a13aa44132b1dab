package io.ontomesh.schema;

import io.ontomesh.util.Inflector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic {@link EntityAnalyzer} that names and classifies tables from their shape and
 * reviews candidates from their test-join metrics. It never asks for human input.
 */
public final class HeuristicEntityAnalyzer implements EntityAnalyzer {
    static final double CONFIRM_JOIN_RATE = 0.90d;
    static final double REJECT_JOIN_RATE = 0.10d;

    @Override
    public TableAnalysis analyzeTable(TableProfile table) {
        String businessName = humanize(Inflector.singularize(table.tableName()));
        String role = classify(table);
        long rows = table.rowCount() == null ? 0L : table.rowCount();
        String description = businessName + " records (" + role + " entity, " + rows + " rows, "
                + table.columns().size() + " columns)";
        return new TableAnalysis(table.tableName(), businessName, description, role, List.of(), false);
    }

    @Override
    public DomainSummary synthesizeDomain(List<TableAnalysis> tables) {
        Map<String, Integer> roles = new LinkedHashMap<>();
        for (TableAnalysis t : tables) {
            roles.merge(t.entityRole(), 1, Integer::sum);
        }
        List<String> domains = new ArrayList<>();
        for (TableAnalysis t : tables) {
            if ("core".equals(t.entityRole())) {
                domains.add(t.businessName());
            }
        }
        StringBuilder description = new StringBuilder("Domain of ").append(tables.size()).append(" entities");
        if (!roles.isEmpty()) {
            description.append(": ");
            List<String> parts = new ArrayList<>();
            roles.forEach((role, count) -> parts.add(count + " " + role));
            description.append(String.join(", ", parts));
        }
        return new DomainSummary(description.toString(), domains, tables.size());
    }

    @Override
    public List<CandidateDecision> reviewCandidates(List<CandidateContext> candidates) {
        List<CandidateDecision> out = new ArrayList<>(candidates.size());
        for (CandidateContext c : candidates) {
            String pair = c.sourceTable() + "." + c.sourceColumn() + " -> " + c.targetTable() + "." + c.targetColumn();
            Double rate = c.joinMatchRate();
            if (rate == null) {
                out.add(new CandidateDecision(c.candidateId(), "needs_review", c.confidence(),
                        pair + ": no join metrics available"));
            } else if (rate >= CONFIRM_JOIN_RATE) {
                out.add(new CandidateDecision(c.candidateId(), "confirm", Math.max(rate, c.confidence()),
                        pair + ": " + percent(rate) + " of source rows join (" + c.cardinality() + ")"));
            } else if (rate < REJECT_JOIN_RATE) {
                out.add(new CandidateDecision(c.candidateId(), "reject", 1.0d - rate,
                        pair + ": only " + percent(rate) + " of source rows join"));
            } else {
                out.add(new CandidateDecision(c.candidateId(), "needs_review", rate,
                        pair + ": partial join, " + percent(rate) + " of source rows match"));
            }
        }
        return out;
    }

    private static String classify(TableProfile table) {
        int foreignKeyLike = 0;
        int other = 0;
        boolean hasTemporal = false;
        for (ColumnProfile col : table.columns()) {
            String name = col.columnName().toLowerCase(Locale.ROOT);
            String type = col.dataType() == null ? "" : col.dataType().toLowerCase(Locale.ROOT);
            if (col.primaryKey()) {
                continue;
            }
            if (name.endsWith("_id")) {
                foreignKeyLike++;
            } else {
                other++;
            }
            if (type.contains("date") || type.contains("time")) {
                hasTemporal = true;
            }
        }
        if (foreignKeyLike >= 2 && other <= 1) {
            return "junction";
        }
        if (foreignKeyLike >= 1 && hasTemporal) {
            return "transaction";
        }
        if (foreignKeyLike == 0 && other <= 2) {
            return "reference";
        }
        return "core";
    }

    private static String humanize(String name) {
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("[_\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    private static String percent(double rate) {
        return Math.round(rate * 100.0d) + "%";
    }
}
