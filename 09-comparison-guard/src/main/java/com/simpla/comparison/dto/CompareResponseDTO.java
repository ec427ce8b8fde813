package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * DTO for the compare operation response.
 */
public class CompareResponseDTO extends ProcessorResponseDTO {
    private final String comparisonJson;

    public CompareResponseDTO(boolean success, String message, String comparisonJson) {
        this(success, message, comparisonJson, success ? null : ErrorKind.INTERNAL);
    }

    public CompareResponseDTO(boolean success, String message, String comparisonJson, ErrorKind errorKind) {
        super(success, message, errorKind);
        this.comparisonJson = comparisonJson;
    }

    public static CompareResponseDTO failure(String message, ErrorKind errorKind) {
        return new CompareResponseDTO(false, message, null, errorKind);
    }

    @JsonRawValue
    @JsonProperty("comparacion")
    public String getComparisonJson() {
        return comparisonJson;
    }
}
