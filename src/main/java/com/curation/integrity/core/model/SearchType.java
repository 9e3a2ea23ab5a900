package com.curation.integrity.core.model;

/**
 * Kind of search that produced a source file.
 */
public enum SearchType {
    DB,
    TOC,
    BACKWARD_SEARCH,
    FORWARD_SEARCH,
    PDFS,
    OTHER
}
