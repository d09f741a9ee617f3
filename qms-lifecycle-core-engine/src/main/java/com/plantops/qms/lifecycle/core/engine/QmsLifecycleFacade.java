package com.plantops.qms.lifecycle.core.engine;

import com.plantops.qms.lifecycle.core.engine.approval.impl.RoleBasedQmsApprovalGate;
import com.plantops.qms.lifecycle.core.engine.audit.IQmsTransitionAuditService;
import com.plantops.qms.lifecycle.core.engine.audit.QmsAuditTrailEventSink;
import com.plantops.qms.lifecycle.core.engine.audit.impl.InMemoryQmsTransitionAuditService;
import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.core.engine.event.impl.CompositeQmsEventSink;
import com.plantops.qms.lifecycle.core.engine.event.impl.LoggingQmsEventSink;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsLifecycleDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsTransitionRuleTable;
import com.plantops.qms.lifecycle.core.engine.milestone.IQmsMilestoneProjector;
import com.plantops.qms.lifecycle.core.engine.milestone.impl.QmsMilestoneProjector;
import com.plantops.qms.lifecycle.core.engine.scar.IQmsSupplierResponseService;
import com.plantops.qms.lifecycle.core.engine.scar.impl.QmsSupplierResponseService;
import com.plantops.qms.lifecycle.core.engine.store.impl.InMemoryQmsRecordStore;
import com.plantops.qms.lifecycle.core.engine.timeline.IQmsTimelineBuilder;
import com.plantops.qms.lifecycle.core.engine.timeline.QmsTimelineTooltipFormatter;
import com.plantops.qms.lifecycle.core.engine.timeline.impl.QmsTimelineBuilder;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsStatusUpdateOrchestrator;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsTransitionValidator;
import com.plantops.qms.lifecycle.core.engine.transition.QmsStatusTransitionResult;
import com.plantops.qms.lifecycle.core.engine.transition.QmsTransitionValidation;
import com.plantops.qms.lifecycle.core.engine.transition.impl.QmsStatusUpdateOrchestrator;
import com.plantops.qms.lifecycle.core.engine.transition.impl.QmsTransitionValidator;
import com.plantops.qms.lifecycle.integration.contract.IQmsApprovalGate;
import com.plantops.qms.lifecycle.integration.contract.IQmsEventSink;
import com.plantops.qms.lifecycle.integration.contract.IQmsRecordStore;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsMilestoneStage;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsTimelineItem;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Wires the lifecycle engine around injected collaborators.
 *
 * <pre>{@code
 * IQmsLifecycleFacade facade = QmsLifecycleFacade.builder()
 *     .withConfig(QmsLifecycleConfig.defaultConfig())
 *     .withRecordStore(recordStore)
 *     .build();
 *
 * facade.apply(record, NcrStatus.OPEN, null, actor)
 *     .subscribe(result -> ...);
 * }</pre>
 *
 * Collaborators not supplied default to the in-memory record store, the
 * role-based approval gate and an event sink writing to an in-memory audit trail
 * (required) and to the log (best effort).
 */
@Slf4j
public class QmsLifecycleFacade implements IQmsLifecycleFacade {

    private final QmsLifecycleConfig config;
    private final QmsTransitionRuleTable ruleTable;
    private final IQmsMilestoneProjector milestoneProjector;
    private final IQmsTimelineBuilder timelineBuilder;
    private final IQmsTransitionValidator transitionValidator;
    private final IQmsStatusUpdateOrchestrator statusUpdateOrchestrator;
    private final IQmsSupplierResponseService supplierResponseService;
    private final IQmsRecordStore recordStore;
    private final IQmsTransitionAuditService auditService;

    private QmsLifecycleFacade(Builder builder) {
        this.config = builder.config;
        this.config.validate();
        this.ruleTable = QmsTransitionRuleTable.getInstance();
        this.recordStore = builder.recordStore != null ? builder.recordStore : InMemoryQmsRecordStore.create();
        this.auditService = builder.auditService != null ? builder.auditService : new InMemoryQmsTransitionAuditService();
        IQmsApprovalGate approvalGate = builder.approvalGate != null
                ? builder.approvalGate
                : new RoleBasedQmsApprovalGate(config);
        IQmsEventSink eventSink = builder.eventSink != null
                ? builder.eventSink
                : CompositeQmsEventSink.create()
                        .addSink(new QmsAuditTrailEventSink(auditService))
                        .addBestEffortSink(new LoggingQmsEventSink());

        this.milestoneProjector = new QmsMilestoneProjector(ruleTable);
        this.timelineBuilder = new QmsTimelineBuilder(ruleTable, milestoneProjector, new QmsTimelineTooltipFormatter(config));
        this.transitionValidator = new QmsTransitionValidator(ruleTable);
        this.statusUpdateOrchestrator = new QmsStatusUpdateOrchestrator(
                transitionValidator, recordStore, approvalGate, eventSink, config);
        this.supplierResponseService = new QmsSupplierResponseService(statusUpdateOrchestrator);
        log.info("QmsLifecycleFacade initialized with store {}, approval gate {}, event sink {}",
                recordStore.getClass().getSimpleName(),
                approvalGate.getClass().getSimpleName(),
                eventSink.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a fully in-memory engine with the default configuration.
     */
    public static QmsLifecycleFacade create() {
        return builder().build();
    }

    @Override
    public QmsLifecycleConfig getConfig() {
        return config;
    }

    @Override
    public IQmsMilestoneProjector getMilestoneProjector() {
        return milestoneProjector;
    }

    @Override
    public IQmsTimelineBuilder getTimelineBuilder() {
        return timelineBuilder;
    }

    @Override
    public IQmsTransitionValidator getTransitionValidator() {
        return transitionValidator;
    }

    @Override
    public IQmsStatusUpdateOrchestrator getStatusUpdateOrchestrator() {
        return statusUpdateOrchestrator;
    }

    @Override
    public IQmsSupplierResponseService getSupplierResponseService() {
        return supplierResponseService;
    }

    @Override
    public IQmsRecordStore getRecordStore() {
        return recordStore;
    }

    @Override
    public IQmsTransitionAuditService getAuditService() {
        return auditService;
    }

    @Override
    public QmsLifecycleDefinition getDefinition(QmsRecordKind kind) {
        return ruleTable.getDefinition(kind);
    }

    @Override
    public List<QmsMilestoneStage> project(QmsRecordKind kind, QmsStatus status) {
        return milestoneProjector.project(kind, status);
    }

    @Override
    public List<QmsTimelineItem> build(QmsRecordKind kind, QmsQualityRecord record) {
        return timelineBuilder.build(kind, record);
    }

    @Override
    public List<QmsTransitionEdge> availableTransitions(QmsRecordKind kind, QmsStatus status) {
        return transitionValidator.availableTransitions(kind, status);
    }

    @Override
    public QmsTransitionValidation validate(QmsRecordKind kind, QmsStatus currentStatus, QmsStatus requestedStatus) {
        return transitionValidator.validate(kind, currentStatus, requestedStatus);
    }

    @Override
    public Mono<QmsStatusTransitionResult> apply(QmsQualityRecord record,
                                                 QmsStatus requestedStatus,
                                                 String comment,
                                                 QmsActor actor) {
        return statusUpdateOrchestrator.apply(record, requestedStatus, comment, actor);
    }

    @Override
    public Mono<QmsStatusTransitionResult> applyById(String recordId,
                                                     QmsStatus requestedStatus,
                                                     String comment,
                                                     QmsActor actor) {
        return statusUpdateOrchestrator.applyById(recordId, requestedStatus, comment, actor);
    }

    public static final class Builder {

        private QmsLifecycleConfig config = QmsLifecycleConfig.defaultConfig();
        private IQmsRecordStore recordStore;
        private IQmsApprovalGate approvalGate;
        private IQmsEventSink eventSink;
        private IQmsTransitionAuditService auditService;

        private Builder() {
        }

        public Builder withConfig(QmsLifecycleConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRecordStore(IQmsRecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder withApprovalGate(IQmsApprovalGate approvalGate) {
            this.approvalGate = approvalGate;
            return this;
        }

        /**
         * Replaces the default event sink. The audit service is then only written
         * if the given sink does so.
         */
        public Builder withEventSink(IQmsEventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        public Builder withAuditService(IQmsTransitionAuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public QmsLifecycleFacade build() {
            if (config == null) {
                throw new IllegalStateException("config must not be null");
            }
            return new QmsLifecycleFacade(this);
        }
    }
}
