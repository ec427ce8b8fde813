package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * DTO for the batch run response.
 */
public class BatchResponseDTO extends ProcessorResponseDTO {
    private final String batchJson;

    public BatchResponseDTO(boolean success, String message, String batchJson) {
        this(success, message, batchJson, success ? null : ErrorKind.INTERNAL);
    }

    public BatchResponseDTO(boolean success, String message, String batchJson, ErrorKind errorKind) {
        super(success, message, errorKind);
        this.batchJson = batchJson;
    }

    public static BatchResponseDTO failure(String message, ErrorKind errorKind) {
        return new BatchResponseDTO(false, message, null, errorKind);
    }

    @JsonRawValue
    @JsonProperty("resultado")
    public String getBatchJson() {
        return batchJson;
    }
}
