package com.curation.integrity.check;

import com.curation.integrity.similarity.RecordSimilarityScorer;
import com.curation.integrity.state.RecordStateMachine;

import java.util.Objects;

/**
 * Everything a check needs: the snapshots under test and the collaborators
 * configured on the checker.
 */
public record CheckContext(
        SnapshotPair pair,
        CheckerSettings settings,
        RecordSimilarityScorer similarityScorer,
        RecordStateMachine stateMachine,
        SourceResolver sourceResolver
) {
    public CheckContext {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(settings, "settings are required");
        Objects.requireNonNull(similarityScorer, "similarityScorer is required");
        Objects.requireNonNull(stateMachine, "stateMachine is required");
        Objects.requireNonNull(sourceResolver, "sourceResolver is required");
    }
}
