package com.curation.integrity.core;

/**
 * Thrown when a value at the data-model boundary is not part of a fixed vocabulary
 * (status strings, entry types, defect codes). This signals a vocabulary mismatch
 * between producer and consumer and is not recoverable data noise.
 */
public class UnknownVocabularyException extends IntegrityException {

    private final String vocabulary;
    private final String value;

    public UnknownVocabularyException(String vocabulary, String value) {
        super("Unknown " + vocabulary + ": '" + value + "'");
        this.vocabulary = vocabulary;
        this.value = value;
    }

    public String getVocabulary() {
        return vocabulary;
    }

    public String getValue() {
        return value;
    }
}
