package com.plantops.qms.lifecycle.core.engine.milestone;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsMilestoneStage;

import java.util.List;

/**
 * Projects a status onto the kind's milestone stages.
 */
public interface IQmsMilestoneProjector {

    /**
     * @param kind the record kind
     * @param currentStatus a status from the kind's vocabulary
     * @return one stage per canonical stage, in canonical order
     * @throws IllegalArgumentException if the status does not belong to the kind
     */
    List<QmsMilestoneStage> project(QmsRecordKind kind, QmsStatus currentStatus);
}
