package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of one reconciliation: the annotated law plus run metadata. Built fresh on every run.
 */
public class ComparisonTree {

    @JsonProperty("ley")
    private ComparedLaw law;

    @JsonProperty("metadatos")
    private ComparisonMetadata metadata;

    public ComparisonTree() {}

    public ComparisonTree(ComparedLaw law, ComparisonMetadata metadata) {
        this.law = law;
        this.metadata = metadata;
    }

    public ComparedLaw getLaw() {
        return law;
    }

    public ComparisonMetadata getMetadata() {
        return metadata;
    }
}
