package com.plantops.qms.lifecycle.core.engine.transition;

import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import reactor.core.publisher.Mono;

/**
 * The only component that changes a record's status.
 *
 * <p>The returned {@link Mono} always completes with a result; validation,
 * authorization, conflict and collaborator failures are reported through
 * {@link QmsStatusTransitionResult#getStatus()}.</p>
 */
public interface IQmsStatusUpdateOrchestrator {

    /**
     * Moves the record to {@code requestedStatus}, based on the given snapshot.
     *
     * @param record the snapshot the caller validated against
     * @param requestedStatus the target status
     * @param comment free text; mandatory for edges that require a comment
     * @param actor the user performing the change
     */
    Mono<QmsStatusTransitionResult> apply(QmsQualityRecord record,
                                          QmsStatus requestedStatus,
                                          String comment,
                                          QmsActor actor);

    /**
     * Loads the latest stored record and applies the change to it.
     */
    Mono<QmsStatusTransitionResult> applyById(String recordId,
                                              QmsStatus requestedStatus,
                                              String comment,
                                              QmsActor actor);
}
