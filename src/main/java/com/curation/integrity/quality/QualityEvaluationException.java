package com.curation.integrity.quality;

import com.curation.integrity.core.IntegrityException;

/**
 * Thrown when a batch evaluation cannot complete.
 */
public class QualityEvaluationException extends IntegrityException {

    public QualityEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
