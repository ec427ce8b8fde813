package com.simpla.dictamen.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.dictamen.model.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ParsedDictamen {

    @JsonProperty("operaciones")
    private final List<Operation> operations;

    @JsonIgnore
    private final List<String> normalizedLines;

    public ParsedDictamen(List<String> normalizedLines, List<Operation> operations) {
        this.normalizedLines = Collections.unmodifiableList(new ArrayList<>(normalizedLines));
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public List<String> getNormalizedLines() {
        return normalizedLines;
    }

    /**
     * Operations grouped by the dictamen title they appear under, in document order.
     */
    @JsonProperty("por_titulo")
    public Map<String, List<Operation>> byTitle() {
        Map<String, List<Operation>> grouped = new LinkedHashMap<>();
        for (Operation operation : operations) {
            grouped.computeIfAbsent(operation.getTitleContext(), k -> new ArrayList<>()).add(operation);
        }
        return grouped;
    }
}
