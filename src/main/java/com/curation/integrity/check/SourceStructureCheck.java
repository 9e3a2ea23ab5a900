package com.curation.integrity.check;

import com.curation.integrity.core.model.SearchSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates the declared search sources: unique non-blank filenames, an identifier,
 * a search type, and resolvability through the configured {@link SourceResolver}.
 */
public class SourceStructureCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "source-structure";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.STRUCTURE;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        List<CheckFailure> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SearchSource source : context.pair().sources()) {
            String filename = source.filename();
            if (filename == null || filename.isBlank()) {
                failures.add(CheckFailure.of(kind(), "Search source without filename: " + source));
                continue;
            }
            if (!seen.add(filename)) {
                failures.add(CheckFailure.of(kind(), "Search source declared twice: " + filename));
            }
            if (source.sourceIdentifier() == null || source.sourceIdentifier().isBlank()) {
                failures.add(CheckFailure.of(kind(), "Search source " + filename + " has no source identifier"));
            }
            if (source.searchType() == null) {
                failures.add(CheckFailure.of(kind(), "Search source " + filename + " has no search type"));
            }
            if (!context.sourceResolver().canResolve(source)) {
                failures.add(CheckFailure.of(kind(), "Search source " + filename + " cannot be resolved"));
            }
        }
        return failures;
    }
}
