package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * DTO for the parse operation response.
 */
public class ParseResponseDTO extends ProcessorResponseDTO {
    private final String operationsJson;

    public ParseResponseDTO(boolean success, String message, String operationsJson) {
        this(success, message, operationsJson, success ? null : ErrorKind.INTERNAL);
    }

    public ParseResponseDTO(boolean success, String message, String operationsJson, ErrorKind errorKind) {
        super(success, message, errorKind);
        this.operationsJson = operationsJson;
    }

    public static ParseResponseDTO failure(String message, ErrorKind errorKind) {
        return new ParseResponseDTO(false, message, null, errorKind);
    }

    @JsonRawValue
    @JsonProperty("operaciones")
    public String getOperationsJson() {
        return operationsJson;
    }
}
