package com.simpla.comparison.model;

/**
 * Conditions reported instead of raised: every operation that could not be applied leaves one of these.
 */
public enum IssueType {
    UNRESOLVED_TARGET,
    UNKNOWN_LAW,
    LAW_TREE_MISSING,
    MISSING_REPLACEMENT_TEXT,
    INCORPORATION_TARGET_EXISTS,
    CHAPTER_NOT_FOUND,
    EMPTY_CHAPTER_DEROGATED,
    ARTICLE_NOT_FOUND_IN_LAW,
    DUPLICATE_ARTICLE_NUMBER,
    UNSUPPORTED_TARGET,
    NO_INSERTION_POINT
}
