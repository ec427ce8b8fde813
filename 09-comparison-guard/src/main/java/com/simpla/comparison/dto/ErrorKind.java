package com.simpla.comparison.dto;

/**
 * Why a processor call failed. The REST layer maps it to an HTTP status.
 */
public enum ErrorKind {
    INVALID_INPUT,
    NOT_FOUND,
    INTERNAL
}
