package com.curation.integrity.core.model;

/**
 * A declared search source. Record origins point into it as {@code <filename>/<local id>}.
 */
public record SearchSource(
        String filename,
        SearchType searchType,
        String sourceIdentifier
) {

    public static SearchSource of(String filename, SearchType searchType, String sourceIdentifier) {
        return new SearchSource(filename, searchType, sourceIdentifier);
    }
}
