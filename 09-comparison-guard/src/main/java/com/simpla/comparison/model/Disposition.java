package com.simpla.comparison.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Disposition {
    UNCHANGED("sin_cambios"),
    SUBSTITUTED("sustituido"),
    DEROGATED("derogado"),
    INCORPORATED("incorporado");

    private final String value;

    Disposition(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Disposition fromValue(String value) {
        for (Disposition d : values()) {
            if (d.value.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown disposition: " + value);
    }
}
