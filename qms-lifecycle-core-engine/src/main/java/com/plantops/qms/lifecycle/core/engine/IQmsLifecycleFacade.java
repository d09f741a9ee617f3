package com.plantops.qms.lifecycle.core.engine;

import com.plantops.qms.lifecycle.core.engine.audit.IQmsTransitionAuditService;
import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsLifecycleDefinition;
import com.plantops.qms.lifecycle.core.engine.milestone.IQmsMilestoneProjector;
import com.plantops.qms.lifecycle.core.engine.scar.IQmsSupplierResponseService;
import com.plantops.qms.lifecycle.core.engine.timeline.IQmsTimelineBuilder;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsStatusUpdateOrchestrator;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsTransitionValidator;
import com.plantops.qms.lifecycle.core.engine.transition.QmsStatusTransitionResult;
import com.plantops.qms.lifecycle.core.engine.transition.QmsTransitionValidation;
import com.plantops.qms.lifecycle.integration.contract.IQmsRecordStore;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsMilestoneStage;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsTimelineItem;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Entry point for presentation and integration layers.
 */
public interface IQmsLifecycleFacade {
    QmsLifecycleConfig getConfig();
    IQmsMilestoneProjector getMilestoneProjector();
    IQmsTimelineBuilder getTimelineBuilder();
    IQmsTransitionValidator getTransitionValidator();
    IQmsStatusUpdateOrchestrator getStatusUpdateOrchestrator();
    IQmsSupplierResponseService getSupplierResponseService();
    IQmsRecordStore getRecordStore();
    IQmsTransitionAuditService getAuditService();

    QmsLifecycleDefinition getDefinition(QmsRecordKind kind);

    List<QmsMilestoneStage> project(QmsRecordKind kind, QmsStatus status);

    List<QmsTimelineItem> build(QmsRecordKind kind, QmsQualityRecord record);

    List<QmsTransitionEdge> availableTransitions(QmsRecordKind kind, QmsStatus status);

    QmsTransitionValidation validate(QmsRecordKind kind, QmsStatus currentStatus, QmsStatus requestedStatus);

    Mono<QmsStatusTransitionResult> apply(QmsQualityRecord record, QmsStatus requestedStatus, String comment, QmsActor actor);

    Mono<QmsStatusTransitionResult> applyById(String recordId, QmsStatus requestedStatus, String comment, QmsActor actor);
}
