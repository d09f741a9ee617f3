package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the lifecycle definition of every record kind. Built once; every
 * definition is checked for well-formedness on construction, so a malformed
 * table fails at startup rather than on first use.
 */
@Slf4j
public final class QmsTransitionRuleTable {

    private final Map<QmsRecordKind, QmsLifecycleDefinition> definitions;

    private QmsTransitionRuleTable() {
        Map<QmsRecordKind, QmsLifecycleDefinition> byKind = new EnumMap<>(QmsRecordKind.class);
        for (QmsRecordKind kind : QmsRecordKind.values()) {
            byKind.put(kind, QmsLifecycleDefinitions.forKind(kind));
        }
        this.definitions = Collections.unmodifiableMap(byKind);
        log.info("Initialized transition rule table for {} record kinds", definitions.size());
    }

    private static final class SingletonHelper {
        private static final QmsTransitionRuleTable INSTANCE = new QmsTransitionRuleTable();
    }

    public static QmsTransitionRuleTable getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public QmsLifecycleDefinition getDefinition(QmsRecordKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Record kind must not be null");
        }
        return definitions.get(kind);
    }
}
