package com.curation.integrity.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete collection of records as of one point in time.
 *
 * <p>Records are held as copies, so later mutation of the caller's records does not
 * leak into the snapshot. Duplicate IDs are kept so the checker can report them.</p>
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(List.of());

    private final List<Record> records;

    private Snapshot(List<Record> records) {
        this.records = Collections.unmodifiableList(records);
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public static Snapshot of(Collection<Record> records) {
        List<Record> copies = new ArrayList<>(records.size());
        for (Record record : records) {
            copies.add(record.copy());
        }
        return new Snapshot(copies);
    }

    public static Snapshot of(Record... records) {
        return of(List.of(records));
    }

    public List<Record> records() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Index by ID; when IDs collide the first record wins.
     */
    public Map<String, Record> byId() {
        Map<String, Record> index = new LinkedHashMap<>();
        for (Record record : records) {
            index.putIfAbsent(record.getId(), record);
        }
        return index;
    }

    /**
     * Index by origin; when an origin is shared the first record wins.
     */
    public Map<String, Record> byOrigin() {
        Map<String, Record> index = new LinkedHashMap<>();
        for (Record record : records) {
            for (String origin : record.getOrigins()) {
                index.putIfAbsent(origin, record);
            }
        }
        return index;
    }
}
