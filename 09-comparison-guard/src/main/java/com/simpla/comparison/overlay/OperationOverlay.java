package com.simpla.comparison.overlay;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual corrections for a parsed dictamen, keyed by the dictamen's own article id.
 * Reviewers keep these next to the dictamen when the automatic law or target detection is wrong.
 */
public class OperationOverlay {

    @JsonProperty("law_replacements")
    private Map<String, String> lawReplacements = new LinkedHashMap<>();

    @JsonProperty("manual_matches")
    private List<ManualMatch> manualMatches = new ArrayList<>();

    @JsonProperty("null_target_overrides")
    private List<String> nullTargetOverrides = new ArrayList<>();

    public OperationOverlay() {}

    public boolean isEmpty() {
        return lawReplacements.isEmpty() && manualMatches.isEmpty() && nullTargetOverrides.isEmpty();
    }

    // Getters and setters
    public Map<String, String> getLawReplacements() {
        return lawReplacements;
    }

    public void setLawReplacements(Map<String, String> lawReplacements) {
        this.lawReplacements = lawReplacements != null ? lawReplacements : new LinkedHashMap<>();
    }

    public List<ManualMatch> getManualMatches() {
        return manualMatches;
    }

    public void setManualMatches(List<ManualMatch> manualMatches) {
        this.manualMatches = manualMatches != null ? manualMatches : new ArrayList<>();
    }

    public List<String> getNullTargetOverrides() {
        return nullTargetOverrides;
    }

    public void setNullTargetOverrides(List<String> nullTargetOverrides) {
        this.nullTargetOverrides = nullTargetOverrides != null ? nullTargetOverrides : new ArrayList<>();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ManualMatch {

        @JsonProperty("dictamen_articulo")
        private String dictamenArticle;

        @JsonProperty("target_ley")
        private String targetLaw;

        @JsonProperty("target_articulo")
        private String targetArticle;

        public ManualMatch() {}

        public ManualMatch(String dictamenArticle, String targetLaw, String targetArticle) {
            this.dictamenArticle = dictamenArticle;
            this.targetLaw = targetLaw;
            this.targetArticle = targetArticle;
        }

        public String getDictamenArticle() { return dictamenArticle; }
        public void setDictamenArticle(String dictamenArticle) { this.dictamenArticle = dictamenArticle; }

        public String getTargetLaw() { return targetLaw; }
        public void setTargetLaw(String targetLaw) { this.targetLaw = targetLaw; }

        public String getTargetArticle() { return targetArticle; }
        public void setTargetArticle(String targetArticle) { this.targetArticle = targetArticle; }
    }
}
