package com.plantops.qms.lifecycle.core.engine.transition;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;

import java.util.List;

public interface IQmsTransitionValidator {

    /**
     * Looks up the edge {@code currentStatus -> requestedStatus}. Only explicitly
     * declared edges are valid.
     */
    QmsTransitionValidation validate(QmsRecordKind kind, QmsStatus currentStatus, QmsStatus requestedStatus);

    /**
     * Legal next transitions from {@code currentStatus}; empty for terminal statuses.
     */
    List<QmsTransitionEdge> availableTransitions(QmsRecordKind kind, QmsStatus currentStatus);
}
