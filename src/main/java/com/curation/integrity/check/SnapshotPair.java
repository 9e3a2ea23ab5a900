package com.curation.integrity.check;

import com.curation.integrity.core.model.IdRename;
import com.curation.integrity.core.model.SearchSource;
import com.curation.integrity.core.model.Snapshot;
import com.curation.integrity.state.TransitionRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of a checker run: the previously committed snapshot, the snapshot about to
 * be committed, the declared search sources, the logged ID renames and the manual
 * status overrides keyed by record ID.
 */
public final class SnapshotPair {

    private final Snapshot prior;
    private final Snapshot current;
    private final List<SearchSource> sources;
    private final List<IdRename> renames;
    private final Map<String, TransitionRequest.ManualOverride> overrides;

    private SnapshotPair(Builder builder) {
        this.prior = builder.prior;
        this.current = Objects.requireNonNull(builder.current, "current snapshot is required");
        this.sources = Collections.unmodifiableList(new ArrayList<>(builder.sources));
        this.renames = Collections.unmodifiableList(new ArrayList<>(builder.renames));
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.overrides));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Snapshot prior() {
        return prior;
    }

    public Snapshot current() {
        return current;
    }

    public List<SearchSource> sources() {
        return sources;
    }

    public List<IdRename> renames() {
        return renames;
    }

    public Map<String, TransitionRequest.ManualOverride> overrides() {
        return overrides;
    }

    public boolean hasPrior() {
        return !prior.isEmpty();
    }

    public boolean isRenamed(String fromId, String toId) {
        return renames.stream().anyMatch(r -> r.fromId().equals(fromId) && r.toId().equals(toId));
    }

    public boolean hasOverride(String recordId) {
        return overrides.containsKey(recordId);
    }

    public static class Builder {
        private Snapshot prior = Snapshot.empty();
        private Snapshot current;
        private final List<SearchSource> sources = new ArrayList<>();
        private final List<IdRename> renames = new ArrayList<>();
        private final Map<String, TransitionRequest.ManualOverride> overrides = new LinkedHashMap<>();

        public Builder prior(Snapshot prior) {
            this.prior = prior != null ? prior : Snapshot.empty();
            return this;
        }

        public Builder current(Snapshot current) {
            this.current = current;
            return this;
        }

        public Builder source(SearchSource source) {
            this.sources.add(Objects.requireNonNull(source, "source is required"));
            return this;
        }

        public Builder sources(List<SearchSource> sources) {
            sources.forEach(this::source);
            return this;
        }

        public Builder rename(IdRename rename) {
            this.renames.add(Objects.requireNonNull(rename, "rename is required"));
            return this;
        }

        public Builder override(String recordId, TransitionRequest.ManualOverride override) {
            this.overrides.put(Objects.requireNonNull(recordId, "recordId is required"),
                    Objects.requireNonNull(override, "override is required"));
            return this;
        }

        public SnapshotPair build() {
            return new SnapshotPair(this);
        }
    }
}
