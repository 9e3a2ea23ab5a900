package com.curation.integrity.check;

import com.curation.integrity.core.model.SearchSource;

/**
 * Tells whether a declared search source can be resolved, for instance whether its
 * file exists. Supplied by the caller, since the checker does no I/O.
 */
@FunctionalInterface
public interface SourceResolver {

    SourceResolver ALL_RESOLVABLE = source -> true;

    boolean canResolve(SearchSource source);
}
