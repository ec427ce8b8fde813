package com.simpla.comparison.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Common part of every processor response.
 * Transport-agnostic: the same objects back the REST API and in-process callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ProcessorResponseDTO {
    private final boolean success;
    private final String message;
    private final ErrorKind errorKind;

    protected ProcessorResponseDTO(boolean success, String message, ErrorKind errorKind) {
        this.success = success;
        this.message = message;
        this.errorKind = errorKind;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    @JsonProperty("error")
    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
