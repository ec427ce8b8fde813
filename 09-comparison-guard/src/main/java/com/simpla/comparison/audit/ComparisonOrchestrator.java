package com.simpla.comparison.audit;

import com.simpla.comparison.engine.ReconciliationEngine;
import com.simpla.comparison.model.ComparisonTree;
import com.simpla.comparison.model.IssueType;
import com.simpla.comparison.model.Law;
import com.simpla.comparison.model.ReconciliationIssue;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.resolver.LawNumberResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits the operations of a dictamen by amended law and reconciles each law that has a tree.
 * Laws are processed one after another in law-number order so the result is deterministic.
 */
public class ComparisonOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ComparisonOrchestrator.class);

    private final ReconciliationEngine engine;

    public ComparisonOrchestrator(ReconciliationEngine engine) {
        this.engine = engine;
    }

    /**
     * Operations grouped by normalized law number, in document order. {@code UNKNOWN} and missing
     * law numbers are left out.
     */
    public static Map<String, List<Operation>> groupByLaw(List<Operation> operations) {
        Map<String, List<Operation>> byLaw = new TreeMap<>();
        for (Operation operation : operations) {
            if (LawNumberResolver.UNKNOWN.equals(operation.getLawNumber())) {
                continue;
            }
            String law = LawNumberResolver.normalize(operation.getLawNumber());
            if (law != null) {
                byLaw.computeIfAbsent(law, k -> new ArrayList<>()).add(operation);
            }
        }
        return byLaw;
    }

    /**
     * @param laws law trees keyed by law number, in any notation ("20.744" or "20744")
     */
    public BatchResult orchestrate(List<Operation> operations, Map<String, Law> laws) {
        Map<String, Law> lawsByNumber = new HashMap<>();
        for (Map.Entry<String, Law> entry : laws.entrySet()) {
            String key = LawNumberResolver.normalize(entry.getKey());
            lawsByNumber.put(key != null ? key : entry.getKey(), entry.getValue());
        }

        BatchResult result = new BatchResult();
        result.setTotalOperations(operations.size());
        Map<String, List<Operation>> byLaw = groupByLaw(operations);
        LOG.info("Dictamen touches {} laws across {} operations", byLaw.size(), operations.size());

        for (Map.Entry<String, List<Operation>> entry : byLaw.entrySet()) {
            String lawNumber = entry.getKey();
            Law law = lawsByNumber.get(lawNumber);
            if (law == null) {
                LOG.warn("Skipping law {}: no law tree available ({} operations)", lawNumber, entry.getValue().size());
                result.getMissingLaws().add(lawNumber);
                for (Operation operation : entry.getValue()) {
                    result.getIssues().add(new ReconciliationIssue(IssueType.LAW_TREE_MISSING,
                            operation.getDictamenArticle(), lawNumber, null, "No law tree for law " + lawNumber));
                }
                continue;
            }
            LOG.info("Processing law {} ({} operations)", lawNumber, entry.getValue().size());
            ComparisonTree tree = engine.reconcile(law, entry.getValue());
            result.getComparisons().put(lawNumber, tree);
        }
        return result;
    }
}
