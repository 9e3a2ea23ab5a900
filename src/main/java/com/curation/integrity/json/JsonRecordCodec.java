package com.curation.integrity.json;

import com.curation.integrity.core.IntegrityException;
import com.curation.integrity.core.model.ProvenanceAnnotation;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.Snapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes records as a JSON array of objects keyed by their wire field names.
 *
 * <pre>
 * [
 *   {
 *     "ID": "Rai2004",
 *     "ENTRYTYPE": "article",
 *     "colrev_status": "md_prepared",
 *     "colrev_origin": ["scopus.bib/0001"],
 *     "colrev_masterdata_provenance": {"title": {"source": "quality_model", "note": ""}},
 *     "title": "..."
 *   }
 * ]
 * </pre>
 *
 * <p>The caller owns the streams; they are not closed.</p>
 */
public class JsonRecordCodec {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordCodec.class);

    private static final String SOURCE = "source";
    private static final String NOTE = "note";

    private final ObjectMapper objectMapper;

    public JsonRecordCodec() {
        this(new ObjectMapper());
    }

    public JsonRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Snapshot read(InputStream input) {
        try {
            return toSnapshot(objectMapper.readTree(input));
        } catch (IOException e) {
            throw new IntegrityException("Failed to read records: " + e.getMessage(), e);
        }
    }

    public Snapshot read(Reader reader) {
        try {
            return toSnapshot(objectMapper.readTree(reader));
        } catch (IOException e) {
            throw new IntegrityException("Failed to read records: " + e.getMessage(), e);
        }
    }

    public Snapshot readString(String json) {
        try {
            return toSnapshot(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IntegrityException("Failed to read records: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Snapshot snapshot, OutputStream output) {
        try {
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(output, toJson(snapshot));
        } catch (IOException e) {
            throw new IntegrityException("Failed to write records: " + e.getMessage(), e);
        }
    }

    public String writeString(Snapshot snapshot) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(toJson(snapshot));
        } catch (JsonProcessingException e) {
            throw new IntegrityException("Failed to write records: " + e.getOriginalMessage(), e);
        }
    }

    private Snapshot toSnapshot(JsonNode root) {
        if (root == null || root.isMissingNode()) {
            return Snapshot.empty();
        }
        if (!root.isArray()) {
            throw new IntegrityException("Expected a JSON array of records, got " + root.getNodeType());
        }
        List<Record> records = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            records.add(toRecord(node, index++));
        }
        log.debug("json.read records={}", records.size());
        return Snapshot.of(records);
    }

    private Record toRecord(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new IntegrityException("Record at index " + index + " is not a JSON object");
        }
        JsonNode id = node.get(Record.ID);
        JsonNode entryType = node.get(Record.ENTRYTYPE);
        if (id == null || !id.isValueNode() || entryType == null || !entryType.isValueNode()) {
            throw new IntegrityException("Record at index " + index + " needs " + Record.ID + " and " + Record.ENTRYTYPE);
        }

        Record.Builder builder = Record.builder()
                .id(id.asText())
                .entryType(entryType.asText());

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            switch (name) {
                case Record.ID, Record.ENTRYTYPE -> {
                    // already read
                }
                case Record.STATUS -> builder.status(value.asText());
                case Record.ORIGIN -> readOrigins(value, builder);
                case Record.MASTERDATA_PROVENANCE -> readProvenance(value, builder, id.asText());
                default -> {
                    if (!value.isNull()) {
                        builder.field(name, value.isValueNode() ? value.asText() : value.toString());
                    }
                }
            }
        }
        return builder.build();
    }

    private static void readOrigins(JsonNode value, Record.Builder builder) {
        if (value.isArray()) {
            for (JsonNode origin : value) {
                builder.origin(origin.asText());
            }
        } else if (value.isTextual()) {
            // Older exports store origins as one semicolon-separated string
            for (String origin : value.asText().split(";")) {
                if (!origin.isBlank()) {
                    builder.origin(origin.trim());
                }
            }
        }
    }

    private static void readProvenance(JsonNode value, Record.Builder builder, String recordId) {
        if (!value.isObject()) {
            throw new IntegrityException("Provenance of record " + recordId + " is not a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode annotation = entry.getValue();
            builder.provenance(entry.getKey(), new ProvenanceAnnotation(
                    annotation.path(SOURCE).asText(""),
                    annotation.path(NOTE).asText("")));
        }
    }

    private ArrayNode toJson(Snapshot snapshot) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Record record : snapshot.records()) {
            ObjectNode node = array.addObject();
            node.put(Record.ID, record.getId());
            node.put(Record.ENTRYTYPE, record.getEntryType().getLabel());
            node.put(Record.STATUS, record.getStatus().getWireValue());
            ArrayNode origins = node.putArray(Record.ORIGIN);
            record.getOrigins().forEach(origins::add);
            ObjectNode provenance = node.putObject(Record.MASTERDATA_PROVENANCE);
            record.getMasterdataProvenance().forEach((field, annotation) -> {
                ObjectNode entry = provenance.putObject(field);
                entry.put(SOURCE, annotation.source());
                entry.put(NOTE, annotation.note());
            });
            record.getFields().forEach(node::put);
        }
        return array;
    }
}
