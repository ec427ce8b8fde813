package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.comparison.model.Law;
import com.simpla.dictamen.model.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for a compare request: one law tree and the operations to apply to it.
 */
public class CompareRequestDTO {

    @JsonProperty("ley")
    private Law law;

    @JsonProperty("operaciones")
    private List<Operation> operations = new ArrayList<>();

    // Default constructor for Jackson
    public CompareRequestDTO() {
    }

    public CompareRequestDTO(Law law, List<Operation> operations) {
        this.law = law;
        this.operations = operations != null ? operations : new ArrayList<>();
    }

    public Law getLaw() {
        return law;
    }

    public void setLaw(Law law) {
        this.law = law;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public void setOperations(List<Operation> operations) {
        this.operations = operations != null ? operations : new ArrayList<>();
    }
}
