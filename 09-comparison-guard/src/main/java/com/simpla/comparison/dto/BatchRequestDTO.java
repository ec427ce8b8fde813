package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.comparison.model.Law;
import com.simpla.comparison.overlay.OperationOverlay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DTO for a batch request: the dictamen lines, the law trees it may touch and optional
 * manual corrections. Laws not supplied here are looked up in the data directory.
 */
public class BatchRequestDTO {

    @JsonProperty("lineas")
    private List<String> lines = new ArrayList<>();

    @JsonProperty("leyes")
    private Map<String, Law> laws = new LinkedHashMap<>();

    @JsonProperty("overlay")
    private OperationOverlay overlay;

    // Default constructor for Jackson
    public BatchRequestDTO() {
    }

    public List<String> getLines() {
        return lines;
    }

    public void setLines(List<String> lines) {
        this.lines = lines != null ? lines : new ArrayList<>();
    }

    public Map<String, Law> getLaws() {
        return laws;
    }

    public void setLaws(Map<String, Law> laws) {
        this.laws = laws != null ? laws : new LinkedHashMap<>();
    }

    public OperationOverlay getOverlay() {
        return overlay;
    }

    public void setOverlay(OperationOverlay overlay) {
        this.overlay = overlay;
    }
}
