package com.plantops.qms.lifecycle.core.engine.audit;

import com.plantops.qms.lifecycle.integration.contract.IQmsEventSink;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import reactor.core.publisher.Mono;

/**
 * Turns each status-changed event into one audit entry.
 */
public class QmsAuditTrailEventSink implements IQmsEventSink {

    private final IQmsTransitionAuditService auditService;

    public QmsAuditTrailEventSink(IQmsTransitionAuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    public Mono<Void> publish(QmsStatusChangedEvent event) {
        return auditService.logAuditEntry(QmsTransitionAuditEntry.fromEvent(event)).then();
    }
}
