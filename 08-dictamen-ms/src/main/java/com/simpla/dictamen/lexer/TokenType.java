package com.simpla.dictamen.lexer;

public enum TokenType {
    BLANK,
    /** "TÍTULO IV" at line start; carries the title number. */
    TITLE_HEADING,
    /** Capítulo, Sección or Anexo heading. */
    STRUCTURAL_HEADING,
    /** Dictamen article with an operative verb: opens an operation. */
    OPERATION_HEADER,
    /** "ARTÍCULO N.-" line without operative verb: an article of the target law. */
    ARTICLE_HEADER,
    /** Plain line containing "por el siguiente:" or a variant. */
    TRIGGER,
    PLAIN_TEXT
}
