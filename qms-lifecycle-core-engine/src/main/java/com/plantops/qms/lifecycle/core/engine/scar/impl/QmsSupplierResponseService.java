package com.plantops.qms.lifecycle.core.engine.scar.impl;

import com.plantops.qms.lifecycle.core.engine.scar.IQmsSupplierResponseService;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsStatusUpdateOrchestrator;
import com.plantops.qms.lifecycle.core.engine.transition.QmsStatusTransitionResult;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.ScarStatus;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsSupplierResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Slf4j
public class QmsSupplierResponseService implements IQmsSupplierResponseService {

    private final IQmsStatusUpdateOrchestrator orchestrator;

    public QmsSupplierResponseService(IQmsStatusUpdateOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Mono<QmsStatusTransitionResult> recordResponse(QmsQualityRecord scar,
                                                          QmsSupplierResponse response,
                                                          String comment,
                                                          QmsActor actor) {
        if (!isScar(scar)) {
            return Mono.just(notAScar(scar, ScarStatus.SUPPLIER_RESPONSE));
        }
        if (response == null) {
            return Mono.just(QmsStatusTransitionResult.invalidRequest(
                    scar.getId(), ScarStatus.SUPPLIER_RESPONSE, "supplier response must not be null"));
        }
        // a new answer has not been reviewed yet
        QmsSupplierResponse pending = response.toBuilder().accepted(null).rejectionReason(null).build();
        log.debug("Recording supplier response on SCAR {} from {}", scar.getId(), pending.getRespondedBy());
        return orchestrator.apply(scar.toBuilder().supplierResponse(pending).build(),
                ScarStatus.SUPPLIER_RESPONSE, comment, actor);
    }

    @Override
    public Mono<QmsStatusTransitionResult> acceptResponse(QmsQualityRecord scar, String comment, QmsActor actor) {
        if (!isScar(scar)) {
            return Mono.just(notAScar(scar, ScarStatus.REVIEW));
        }
        QmsQualityRecord accepted = scar.getSupplierResponse()
                .map(response -> scar.toBuilder()
                        .supplierResponse(response.toBuilder().accepted(true).rejectionReason(null).build())
                        .build())
                .orElse(scar);
        return orchestrator.apply(accepted, ScarStatus.REVIEW, comment, actor);
    }

    @Override
    public Mono<QmsStatusTransitionResult> rejectResponse(QmsQualityRecord scar, String rejectionReason, QmsActor actor) {
        if (!isScar(scar)) {
            return Mono.just(notAScar(scar, ScarStatus.ISSUED));
        }
        String reason = rejectionReason == null ? null : rejectionReason.trim();
        QmsQualityRecord rejected = scar.getSupplierResponse()
                .map(response -> scar.toBuilder()
                        .supplierResponse(response.toBuilder().accepted(false).rejectionReason(reason).build())
                        .build())
                .orElse(scar);
        return orchestrator.apply(rejected, ScarStatus.ISSUED, reason, actor);
    }

    private static boolean isScar(QmsQualityRecord record) {
        return record != null && record.getKind() == QmsRecordKind.SCAR;
    }

    private static QmsStatusTransitionResult notAScar(QmsQualityRecord record, ScarStatus requested) {
        String recordId = record == null ? null : record.getId();
        String kind = record == null ? "null" : record.getKind().name();
        return QmsStatusTransitionResult.invalidRequest(recordId, requested,
                "supplier responses only apply to SCAR records, got " + kind);
    }
}
