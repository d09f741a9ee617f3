package com.plantops.qms.lifecycle.integration.contract;

import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import reactor.core.publisher.Mono;

/**
 * Persistence seam for quality records.
 *
 * <p>Status changes go through {@link #compareAndSwap} so that two writers acting on
 * the same snapshot cannot both succeed.</p>
 */
public interface IQmsRecordStore {

    /**
     * Loads the latest persisted state of a record.
     *
     * @param recordId the record identifier
     * @return the record, or empty if no record has this id
     */
    Mono<QmsQualityRecord> load(String recordId);

    /**
     * Replaces the stored record only if its persisted status still equals
     * {@code expectedStatus}.
     *
     * @param recordId the record identifier
     * @param expectedStatus the status the caller based its change on
     * @param updatedRecord the full replacement record
     * @return true if the record was replaced, false if the stored status differs
     *         or the record no longer exists
     */
    Mono<Boolean> compareAndSwap(String recordId, QmsStatus expectedStatus, QmsQualityRecord updatedRecord);
}
