package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of a normalized law file: {@code {"ley": {...}}}.
 */
public class LawDocument {

    @JsonProperty("ley")
    private Law law;

    public LawDocument() {}

    public LawDocument(Law law) {
        this.law = law;
    }

    public Law getLaw() {
        return law;
    }

    public void setLaw(Law law) {
        this.law = law;
    }
}
