package com.plantops.qms.lifecycle.core.engine.scar;

import com.plantops.qms.lifecycle.core.engine.transition.QmsStatusTransitionResult;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsSupplierResponse;
import reactor.core.publisher.Mono;

/**
 * Supplier response handling on SCAR records. Every operation is an ordinary
 * status transition; the response travels on the record.
 */
public interface IQmsSupplierResponseService {

    /**
     * Records the supplier's answer and moves the SCAR from issued to supplier_response.
     */
    Mono<QmsStatusTransitionResult> recordResponse(QmsQualityRecord scar,
                                                   QmsSupplierResponse response,
                                                   String comment,
                                                   QmsActor actor);

    /**
     * Accepts the response and starts the review.
     */
    Mono<QmsStatusTransitionResult> acceptResponse(QmsQualityRecord scar, String comment, QmsActor actor);

    /**
     * Rejects the response and sends the SCAR back to the supplier. The rejection
     * reason becomes the transition comment, so it must not be blank.
     */
    Mono<QmsStatusTransitionResult> rejectResponse(QmsQualityRecord scar, String rejectionReason, QmsActor actor);
}
