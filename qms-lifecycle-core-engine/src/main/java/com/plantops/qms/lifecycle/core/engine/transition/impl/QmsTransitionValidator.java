package com.plantops.qms.lifecycle.core.engine.transition.impl;

import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsLifecycleDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsTransitionRuleTable;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsTransitionValidator;
import com.plantops.qms.lifecycle.core.engine.transition.QmsTransitionValidation;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
public class QmsTransitionValidator implements IQmsTransitionValidator {

    private final QmsTransitionRuleTable ruleTable;

    public QmsTransitionValidator(QmsTransitionRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @Override
    public QmsTransitionValidation validate(QmsRecordKind kind, QmsStatus currentStatus, QmsStatus requestedStatus) {
        QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);
        if (!definition.isKnownStatus(currentStatus)) {
            return QmsTransitionValidation.invalid(kind, currentStatus, requestedStatus,
                    "current status " + describe(currentStatus) + " is not a " + kind + " status");
        }
        if (!definition.isKnownStatus(requestedStatus)) {
            return QmsTransitionValidation.invalid(kind, currentStatus, requestedStatus,
                    "requested status " + describe(requestedStatus) + " is not a " + kind + " status");
        }
        if (currentStatus == requestedStatus) {
            return QmsTransitionValidation.invalid(kind, currentStatus, requestedStatus,
                    "record is already in status " + currentStatus.getValue());
        }

        Optional<QmsTransitionEdge> edge = definition.findEdge(currentStatus, requestedStatus);
        if (edge.isPresent()) {
            log.debug("{} transition {} -> {} matches edge '{}'",
                    kind, currentStatus.getValue(), requestedStatus.getValue(), edge.get().getLabel());
            return QmsTransitionValidation.valid(edge.get());
        }

        List<QmsTransitionEdge> outgoing = definition.getOutgoingEdges(currentStatus);
        String reason = outgoing.isEmpty()
                ? currentStatus.getValue() + " is a terminal status"
                : "no transition from " + currentStatus.getValue() + " to " + requestedStatus.getValue()
                        + "; allowed targets: " + outgoing.stream()
                                .map(candidate -> candidate.getTo().getValue())
                                .collect(Collectors.joining(", "));
        return QmsTransitionValidation.invalid(kind, currentStatus, requestedStatus, reason);
    }

    @Override
    public List<QmsTransitionEdge> availableTransitions(QmsRecordKind kind, QmsStatus currentStatus) {
        QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);
        if (!definition.isKnownStatus(currentStatus)) {
            throw new IllegalArgumentException("Status " + describe(currentStatus) + " is not part of the " + kind + " vocabulary");
        }
        return definition.getOutgoingEdges(currentStatus);
    }

    private static String describe(QmsStatus status) {
        return status == null ? "null" : status.getKind() + "/" + status.getValue();
    }
}
