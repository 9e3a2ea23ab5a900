package com.curation.integrity.state;

import com.curation.integrity.audit.AuditService;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.RecordStatus;
import com.curation.integrity.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.curation.integrity.core.model.RecordStatus.*;

/**
 * Legal status transitions of a record and the operations that drive them.
 *
 * <p>The forward pipeline is acyclic. The only back-edges lead from a resolved status
 * to its needs-manual counterpart, so that a curator can re-open a record for manual
 * work. Statuses without outgoing edges are terminal.</p>
 */
public class RecordStateMachine {
    private static final Logger log = LoggerFactory.getLogger(RecordStateMachine.class);

    static final String PIPELINE_ACTOR = "pipeline";

    private static final List<Edge> EDGES = List.of(
            new Edge(MD_RETRIEVED, Operation.LOAD, MD_IMPORTED),
            new Edge(MD_IMPORTED, Operation.PREP, MD_NEEDS_MANUAL_PREPARATION),
            new Edge(MD_IMPORTED, Operation.PREP, MD_PREPARED),
            new Edge(MD_NEEDS_MANUAL_PREPARATION, Operation.PREP, MD_PREPARED),
            new Edge(MD_NEEDS_MANUAL_PREPARATION, Operation.PREP_MAN, MD_PREPARED),
            new Edge(MD_PREPARED, Operation.PREP_MAN, MD_NEEDS_MANUAL_PREPARATION),
            new Edge(MD_PREPARED, Operation.DEDUPE, MD_NEEDS_MANUAL_DEDUPLICATION),
            new Edge(MD_PREPARED, Operation.DEDUPE, MD_PROCESSED),
            new Edge(MD_NEEDS_MANUAL_DEDUPLICATION, Operation.DEDUPE_MAN, MD_PROCESSED),
            new Edge(MD_PROCESSED, Operation.DEDUPE_MAN, MD_NEEDS_MANUAL_DEDUPLICATION),
            new Edge(MD_PROCESSED, Operation.PRESCREEN, REV_PRESCREEN_EXCLUDED),
            new Edge(MD_PROCESSED, Operation.PRESCREEN, REV_PRESCREEN_INCLUDED),
            new Edge(REV_PRESCREEN_INCLUDED, Operation.PDF_GET, PDF_IMPORTED),
            new Edge(REV_PRESCREEN_INCLUDED, Operation.PDF_GET, PDF_NEEDS_MANUAL_RETRIEVAL),
            new Edge(PDF_NEEDS_MANUAL_RETRIEVAL, Operation.PDF_GET_MAN, PDF_IMPORTED),
            new Edge(PDF_NEEDS_MANUAL_RETRIEVAL, Operation.PDF_GET_MAN, PDF_NOT_AVAILABLE),
            new Edge(PDF_IMPORTED, Operation.PDF_GET_MAN, PDF_NEEDS_MANUAL_RETRIEVAL),
            new Edge(PDF_IMPORTED, Operation.PDF_PREP, PDF_NEEDS_MANUAL_PREPARATION),
            new Edge(PDF_IMPORTED, Operation.PDF_PREP, PDF_PREPARED),
            new Edge(PDF_NEEDS_MANUAL_PREPARATION, Operation.PDF_PREP_MAN, PDF_PREPARED),
            new Edge(PDF_PREPARED, Operation.PDF_PREP_MAN, PDF_NEEDS_MANUAL_PREPARATION),
            new Edge(PDF_PREPARED, Operation.SCREEN, REV_EXCLUDED),
            new Edge(PDF_PREPARED, Operation.SCREEN, REV_INCLUDED),
            new Edge(REV_INCLUDED, Operation.DATA, REV_SYNTHESIZED)
    );

    private static final Set<RecordStatus> INITIAL_STATES = Collections.unmodifiableSet(
            EnumSet.of(MD_RETRIEVED, MD_IMPORTED));

    private final Map<RecordStatus, Map<RecordStatus, List<Operation>>> adjacency;
    private final AuditService auditService;

    public RecordStateMachine() {
        this(new AuditService());
    }

    public RecordStateMachine(AuditService auditService) {
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.adjacency = new EnumMap<>(RecordStatus.class);
        for (RecordStatus status : RecordStatus.values()) {
            adjacency.put(status, new LinkedHashMap<>());
        }
        for (Edge edge : EDGES) {
            adjacency.get(edge.from())
                    .computeIfAbsent(edge.to(), k -> new ArrayList<>())
                    .add(edge.operation());
        }
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public boolean isValidTransition(RecordStatus from, RecordStatus to) {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        return adjacency.get(from).containsKey(to);
    }

    /**
     * Statuses reachable in one step, in pipeline order.
     */
    public Set<RecordStatus> allowedNext(RecordStatus from) {
        Objects.requireNonNull(from, "from is required");
        Set<RecordStatus> next = EnumSet.noneOf(RecordStatus.class);
        next.addAll(adjacency.get(from).keySet());
        return Collections.unmodifiableSet(next);
    }

    public boolean isTerminal(RecordStatus status) {
        return allowedNext(status).isEmpty();
    }

    public boolean isExcludedFromPipeline(RecordStatus status) {
        return status.isExcluded();
    }

    public Set<RecordStatus> initialStates() {
        return INITIAL_STATES;
    }

    /**
     * The operation that drives the edge. Where several operations drive the same
     * edge, the automatic one is returned.
     */
    public Optional<Operation> operationFor(RecordStatus from, RecordStatus to) {
        List<Operation> operations = adjacency.get(from).get(to);
        return operations == null ? Optional.empty() : Optional.of(operations.get(0));
    }

    /**
     * Statuses an operation may produce.
     */
    public Set<RecordStatus> statesAfter(Operation operation) {
        Set<RecordStatus> states = EnumSet.noneOf(RecordStatus.class);
        for (Edge edge : EDGES) {
            if (edge.operation() == operation) {
                states.add(edge.to());
            }
        }
        return Collections.unmodifiableSet(states);
    }

    /**
     * Applies a status change to the record.
     *
     * <p>An automatic request must follow a legal edge driven by its operation. A
     * manual override may set any status and is recorded in the audit log. Moving a
     * record to the status it already has is a no-op.</p>
     *
     * @throws StateTransitionException if an automatic request does not follow a legal edge
     */
    public Record transition(Record record, RecordStatus target, TransitionRequest request) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(request, "request is required");

        RecordStatus from = record.getStatus();
        if (from == target) {
            log.debug("transition.noop record={} status={}", record.getId(), from);
            return record;
        }

        try (LogContext ignored = LogContext.forTransition(record.getId(), from.getWireValue(), target.getWireValue())) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (request instanceof TransitionRequest.Automatic automatic) {
                List<Operation> operations = adjacency.get(from).get(target);
                if (operations == null) {
                    throw new StateTransitionException(record.getId(), from, target);
                }
                if (!operations.contains(automatic.operation())) {
                    throw new StateTransitionException(record.getId(), from, target,
                            "edge is not driven by " + automatic.operation());
                }
                details.put("operation", automatic.operation().getLabel());
                record.setStatus(target);
                auditService.recordTransition(record.getId(), PIPELINE_ACTOR, from, target, details);
                log.debug("transition.applied record={} from={} to={} operation={}",
                        record.getId(), from, target, automatic.operation());
            } else if (request instanceof TransitionRequest.ManualOverride override) {
                details.put("reason", override.reason());
                details.put("legal", isValidTransition(from, target));
                record.setStatus(target);
                auditService.recordOverride(record.getId(), override.actor(), from, target, details);
                log.info("transition.override record={} from={} to={} actor={}",
                        record.getId(), from, target, override.actor());
            } else {
                throw new IllegalArgumentException("Unsupported transition request: " + request);
            }
        }
        return record;
    }

    private record Edge(RecordStatus from, Operation operation, RecordStatus to) {
    }
}
