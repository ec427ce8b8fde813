package com.simpla.comparison.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.comparison.model.ComparisonTree;
import com.simpla.comparison.model.ReconciliationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of reconciling a whole dictamen: one comparison tree per amended law that has a law tree,
 * plus every condition found along the way.
 */
public class BatchResult {

    @JsonProperty("total_operaciones")
    private int totalOperations;

    @JsonProperty("comparaciones")
    private Map<String, ComparisonTree> comparisons = new TreeMap<>();

    @JsonProperty("leyes_sin_arbol")
    private List<String> missingLaws = new ArrayList<>();

    @JsonProperty("incidencias")
    private List<ReconciliationIssue> issues = new ArrayList<>();

    public BatchResult() {}

    // Getters and setters
    public int getTotalOperations() {
        return totalOperations;
    }

    public void setTotalOperations(int totalOperations) {
        this.totalOperations = totalOperations;
    }

    public Map<String, ComparisonTree> getComparisons() {
        return comparisons;
    }

    public void setComparisons(Map<String, ComparisonTree> comparisons) {
        this.comparisons = comparisons;
    }

    public List<String> getMissingLaws() {
        return missingLaws;
    }

    public void setMissingLaws(List<String> missingLaws) {
        this.missingLaws = missingLaws;
    }

    public List<ReconciliationIssue> getIssues() {
        return issues;
    }

    public void setIssues(List<ReconciliationIssue> issues) {
        this.issues = issues;
    }
}
