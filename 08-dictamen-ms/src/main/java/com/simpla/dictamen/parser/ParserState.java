package com.simpla.dictamen.parser;

public enum ParserState {
    /** No open operation. */
    IDLE,
    /** Operation opened, waiting for the trigger phrase or the start of the statute text. */
    HEADER_CAPTURE,
    /** Capturing replacement or inserted text. */
    BODY_CAPTURE
}
