package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts are taken from the finished tree, so they always agree with the article dispositions.
 */
public class ComparisonMetadata {

    @JsonProperty("ley_numero")
    private String lawNumber;

    @JsonProperty("total_sustituciones")
    private int substitutions;

    @JsonProperty("total_incorporaciones")
    private int incorporations;

    @JsonProperty("total_derogaciones")
    private int derogations;

    @JsonProperty("capitulos_derogados")
    private List<String> derogatedChapters = new ArrayList<>();

    @JsonProperty("derogacion_total")
    private boolean wholeLawDerogated;

    @JsonProperty("derogacion_total_requiere_revision")
    private boolean wholeLawDerogationNeedsReview;

    @JsonProperty("operaciones_aplicadas")
    private int appliedOperations;

    @JsonProperty("operaciones_no_aplicadas")
    private List<String> unappliedOperations = new ArrayList<>();

    @JsonProperty("incidencias")
    private List<ReconciliationIssue> issues = new ArrayList<>();

    public ComparisonMetadata() {}

    public String getLawNumber() { return lawNumber; }
    public void setLawNumber(String lawNumber) { this.lawNumber = lawNumber; }

    public int getSubstitutions() { return substitutions; }
    public void setSubstitutions(int substitutions) { this.substitutions = substitutions; }

    public int getIncorporations() { return incorporations; }
    public void setIncorporations(int incorporations) { this.incorporations = incorporations; }

    public int getDerogations() { return derogations; }
    public void setDerogations(int derogations) { this.derogations = derogations; }

    public List<String> getDerogatedChapters() { return derogatedChapters; }
    public void setDerogatedChapters(List<String> derogatedChapters) { this.derogatedChapters = derogatedChapters; }

    public boolean isWholeLawDerogated() { return wholeLawDerogated; }
    public void setWholeLawDerogated(boolean wholeLawDerogated) { this.wholeLawDerogated = wholeLawDerogated; }

    public boolean isWholeLawDerogationNeedsReview() { return wholeLawDerogationNeedsReview; }
    public void setWholeLawDerogationNeedsReview(boolean value) { this.wholeLawDerogationNeedsReview = value; }

    public int getAppliedOperations() { return appliedOperations; }
    public void setAppliedOperations(int appliedOperations) { this.appliedOperations = appliedOperations; }

    public List<String> getUnappliedOperations() { return unappliedOperations; }
    public void setUnappliedOperations(List<String> unappliedOperations) { this.unappliedOperations = unappliedOperations; }

    public List<ReconciliationIssue> getIssues() { return issues; }
    public void setIssues(List<ReconciliationIssue> issues) { this.issues = issues; }
}
