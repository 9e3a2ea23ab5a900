package com.curation.integrity.quality;

import com.curation.integrity.core.model.ProvenanceAnnotation;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.logging.LogContext;
import com.curation.integrity.metrics.MetricsService;
import com.curation.integrity.metrics.NoOpMetricsService;
import com.curation.integrity.rules.DefaultFieldRules;
import com.curation.integrity.rules.DefectCode;
import com.curation.integrity.rules.EntryTypeRequirements;
import com.curation.integrity.rules.FieldRuleRegistry;
import com.curation.integrity.rules.RuleSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Applies the field rules to a record and writes the results into its masterdata provenance.
 *
 * <p>Evaluation reads bibliographic fields only, never previous notes, so it is idempotent:
 * evaluating an already annotated record yields the same annotations. Notes are sorted,
 * which keeps them stable across runs.</p>
 */
public class QualityModel {
    private static final Logger log = LoggerFactory.getLogger(QualityModel.class);

    private final FieldRuleRegistry registry;
    private final RuleSettings settings;
    private final MetricsService metrics;

    public QualityModel(FieldRuleRegistry registry, RuleSettings settings) {
        this(registry, settings, NoOpMetricsService.INSTANCE);
    }

    public QualityModel(FieldRuleRegistry registry, RuleSettings settings, MetricsService metrics) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Quality model with the built-in rules and default thresholds.
     */
    public static QualityModel defaults() {
        return new QualityModel(DefaultFieldRules.createDefaultRegistry(), RuleSettings.defaults());
    }

    public RuleSettings getSettings() {
        return settings;
    }

    /**
     * Annotates every present or required field of the record and returns the same record.
     */
    public Record evaluate(Record record) {
        try (LogContext ignored = LogContext.forRecord(record.getId())) {
            Set<String> fields = new LinkedHashSet<>(record.bibliographicFields());
            fields.addAll(EntryTypeRequirements.requiredFields(record.getEntryType()));

            for (String field : fields) {
                String note = noteFor(record, field);
                String source = record.provenance(field)
                        .map(ProvenanceAnnotation::source)
                        .orElse(settings.getAnnotationSource());
                record.putProvenance(field, new ProvenanceAnnotation(source, note));
            }

            for (String annotated : new ArrayList<>(record.getMasterdataProvenance().keySet())) {
                if (!fields.contains(annotated)) {
                    log.debug("Dropping stale annotation {}.{}", record.getId(), annotated);
                    record.removeProvenance(annotated);
                }
            }
            metrics.incrementRecordsEvaluated(1);
            return record;
        }
    }

    private String noteFor(Record record, String field) {
        if (!record.hasField(field)) {
            return EntryTypeRequirements.isExcused(record, field)
                    ? ProvenanceAnnotation.NOT_MISSING
                    : ProvenanceAnnotation.MISSING;
        }
        Set<DefectCode> defects = EnumSet.noneOf(DefectCode.class);
        if (EntryTypeRequirements.isInconsistent(record, field)) {
            defects.add(DefectCode.INCONSISTENT_WITH_ENTRYTYPE);
        }
        defects.addAll(registry.check(field, record, settings));
        defects.forEach(metrics::incrementDefect);
        return DefectCode.joinNote(defects);
    }

    /**
     * True iff any field carries a note other than clean or {@code not-missing}.
     */
    public boolean hasQualityDefects(Record record) {
        for (ProvenanceAnnotation annotation : record.getMasterdataProvenance().values()) {
            if (!annotation.isClean() && !annotation.isNotMissing()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parsed defect codes recorded for one field.
     */
    public Set<DefectCode> defects(Record record, String field) {
        Set<DefectCode> codes = EnumSet.noneOf(DefectCode.class);
        record.provenance(field).ifPresent(annotation -> {
            for (String code : annotation.notes()) {
                codes.add(DefectCode.fromWire(code));
            }
        });
        return codes;
    }

    /**
     * Evaluates records concurrently. Records share no state, so there is no ordering
     * requirement between them; the result is keyed by record ID in input order and is
     * returned only after every evaluation has completed.
     */
    public Map<String, Record> evaluateAll(Collection<Record> records, Executor executor) {
        List<CompletableFuture<Record>> futures = new ArrayList<>(records.size());
        for (Record record : records) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(record), executor));
        }
        Map<String, Record> evaluated = new LinkedHashMap<>();
        try {
            for (CompletableFuture<Record> future : futures) {
                Record record = future.join();
                evaluated.put(record.getId(), record);
            }
        } catch (CompletionException e) {
            throw new QualityEvaluationException("Quality evaluation failed", e.getCause());
        }
        log.info("quality.evaluated records={}", evaluated.size());
        return evaluated;
    }
}
