package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered registry of field rules, populated at startup.
 * Rules run in registration order; their results are unioned per field.
 */
public class FieldRuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(FieldRuleRegistry.class);

    private final List<FieldRule> rules = new CopyOnWriteArrayList<>();

    public FieldRuleRegistry() {
    }

    public FieldRuleRegistry(List<? extends FieldRule> rules) {
        registerAll(rules);
    }

    /**
     * Registers a rule. Rule names must be unique.
     */
    public FieldRuleRegistry register(FieldRule rule) {
        for (FieldRule existing : rules) {
            if (existing.getName().equals(rule.getName())) {
                throw new IllegalArgumentException("Rule already registered: " + rule.getName());
            }
        }
        rules.add(rule);
        return this;
    }

    public FieldRuleRegistry registerAll(List<? extends FieldRule> newRules) {
        for (FieldRule rule : newRules) {
            register(rule);
        }
        return this;
    }

    public boolean remove(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<FieldRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Runs every rule applicable to the field and unions the defects.
     * A rule that fails unexpectedly contributes nothing.
     */
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        Set<DefectCode> defects = EnumSet.noneOf(DefectCode.class);
        for (FieldRule rule : rules) {
            if (!rule.appliesTo(field)) {
                continue;
            }
            try {
                Set<DefectCode> found = rule.check(field, record, settings);
                if (!found.isEmpty()) {
                    log.debug("Rule '{}' flagged {}.{}: {}", rule.getName(), record.getId(), field, found);
                    defects.addAll(found);
                }
            } catch (RuntimeException e) {
                log.warn("rule.failed rule={} record={} field={} error={}",
                        rule.getName(), record.getId(), field, e.toString());
            }
        }
        return defects;
    }

    public int size() {
        return rules.size();
    }
}
