package com.curation.integrity.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * A bibliographic record tracked through the curation pipeline.
 *
 * <p>The typed core (ID, entry type, status, origins, provenance) is validated once in
 * {@link Builder#build()}; every other key lives in an ordered field map.</p>
 */
public class Record {

    public static final String ID = "ID";
    public static final String ENTRYTYPE = "ENTRYTYPE";
    public static final String STATUS = "colrev_status";
    public static final String ORIGIN = "colrev_origin";
    public static final String MASTERDATA_PROVENANCE = "colrev_masterdata_provenance";
    public static final String SCREENING_CRITERIA = "screening_criteria";

    public static final String AUTHOR = "author";
    public static final String EDITOR = "editor";
    public static final String TITLE = "title";
    public static final String JOURNAL = "journal";
    public static final String BOOKTITLE = "booktitle";
    public static final String YEAR = "year";
    public static final String VOLUME = "volume";
    public static final String NUMBER = "number";
    public static final String PAGES = "pages";
    public static final String LANGUAGE = "language";
    public static final String PUBLISHER = "publisher";

    public static final String FORTHCOMING = "forthcoming";

    private static final Set<String> INTERNAL_FIELDS = Set.of(SCREENING_CRITERIA, "file");

    private final String id;
    private final EntryType entryType;
    private RecordStatus status;
    private final List<String> origins;
    private final Map<String, ProvenanceAnnotation> masterdataProvenance;
    private final Map<String, String> fields;

    private Record(Builder builder) {
        this.id = builder.id;
        this.entryType = builder.entryType;
        this.status = builder.status != null ? builder.status : RecordStatus.MD_RETRIEVED;
        this.origins = new ArrayList<>(builder.origins);
        this.masterdataProvenance = new TreeMap<>(builder.masterdataProvenance);
        this.fields = new LinkedHashMap<>(builder.fields);
    }

    public String getId() {
        return id;
    }

    public EntryType getEntryType() {
        return entryType;
    }

    public RecordStatus getStatus() {
        return status;
    }

    public void setStatus(RecordStatus status) {
        this.status = Objects.requireNonNull(status, "status is required");
    }

    public List<String> getOrigins() {
        return Collections.unmodifiableList(origins);
    }

    public void addOrigin(String origin) {
        if (!origins.contains(origin)) {
            origins.add(origin);
        }
    }

    /**
     * Returns the value of an optional field, or {@code null} when absent.
     */
    public String getField(String name) {
        return fields.get(name);
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public void setField(String name, String value) {
        Objects.requireNonNull(name, "name is required");
        if (value == null) {
            fields.remove(name);
        } else {
            fields.put(name, value);
        }
    }

    public void removeField(String name) {
        fields.remove(name);
    }

    public Map<String, String> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Names of the present fields that carry bibliographic content and therefore
     * a masterdata provenance entry.
     */
    public List<String> bibliographicFields() {
        List<String> names = new ArrayList<>();
        for (String name : fields.keySet()) {
            if (isBibliographicField(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public static boolean isBibliographicField(String name) {
        return !name.startsWith("colrev_") && !INTERNAL_FIELDS.contains(name)
                && !ID.equals(name) && !ENTRYTYPE.equals(name);
    }

    public Map<String, ProvenanceAnnotation> getMasterdataProvenance() {
        return Collections.unmodifiableMap(masterdataProvenance);
    }

    public Optional<ProvenanceAnnotation> provenance(String field) {
        return Optional.ofNullable(masterdataProvenance.get(field));
    }

    public void putProvenance(String field, ProvenanceAnnotation annotation) {
        masterdataProvenance.put(field, Objects.requireNonNull(annotation, "annotation is required"));
    }

    public void removeProvenance(String field) {
        masterdataProvenance.remove(field);
    }

    /**
     * Returns the note recorded for a field, or {@code null} when the field has no annotation.
     */
    public String note(String field) {
        ProvenanceAnnotation annotation = masterdataProvenance.get(field);
        return annotation != null ? annotation.note() : null;
    }

    /**
     * Returns the journal or, failing that, the booktitle.
     */
    public String containerTitle() {
        String journal = fields.get(JOURNAL);
        return journal != null ? journal : fields.get(BOOKTITLE);
    }

    public boolean isForthcoming() {
        return FORTHCOMING.equals(fields.get(YEAR));
    }

    /**
     * Deep copy; snapshots hold copies so that prior state is never aliased.
     */
    public Record copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record other = (Record) o;
        return Objects.equals(id, other.id)
                && entryType == other.entryType
                && status == other.status
                && Objects.equals(origins, other.origins)
                && Objects.equals(masterdataProvenance, other.masterdataProvenance)
                && Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entryType, status, origins, fields);
    }

    @Override
    public String toString() {
        return "Record{" +
                "id='" + id + '\'' +
                ", entryType=" + entryType +
                ", status=" + status +
                ", origins=" + origins +
                ", fields=" + fields +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Record record) {
        Builder builder = new Builder()
                .id(record.id)
                .entryType(record.entryType)
                .status(record.status)
                .origins(record.origins);
        record.masterdataProvenance.forEach(builder::provenance);
        record.fields.forEach(builder::field);
        return builder;
    }

    public static class Builder {
        private String id;
        private EntryType entryType;
        private RecordStatus status;
        private final List<String> origins = new ArrayList<>();
        private final Map<String, ProvenanceAnnotation> masterdataProvenance = new TreeMap<>();
        private final Map<String, String> fields = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entryType(EntryType entryType) {
            this.entryType = entryType;
            return this;
        }

        public Builder entryType(String entryType) {
            this.entryType = EntryType.fromWire(entryType);
            return this;
        }

        public Builder status(RecordStatus status) {
            this.status = status;
            return this;
        }

        public Builder status(String status) {
            this.status = RecordStatus.fromWire(status);
            return this;
        }

        public Builder origin(String origin) {
            this.origins.add(origin);
            return this;
        }

        public Builder origins(List<String> origins) {
            this.origins.addAll(origins);
            return this;
        }

        public Builder provenance(String field, ProvenanceAnnotation annotation) {
            this.masterdataProvenance.put(field, annotation);
            return this;
        }

        public Builder field(String name, String value) {
            this.fields.put(name, value);
            return this;
        }

        public Record build() {
            Objects.requireNonNull(id, "ID is required");
            if (id.isBlank()) {
                throw new IllegalArgumentException("ID must not be blank");
            }
            Objects.requireNonNull(entryType, "ENTRYTYPE is required");
            return new Record(this);
        }
    }
}
