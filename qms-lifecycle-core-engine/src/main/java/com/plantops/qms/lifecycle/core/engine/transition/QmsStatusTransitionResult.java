package com.plantops.qms.lifecycle.core.engine.transition;

import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of a status update. Every failure is reported through
 * {@link #getStatus()}; none is thrown.
 */
@Getter
@ToString
public final class QmsStatusTransitionResult {

    /**
     * Possible outcomes of a status update.
     */
    public enum Status {
        /**
         * The record was moved and the event published.
         */
        APPLIED,

        /**
         * Record, actor or requested status missing or malformed.
         */
        INVALID_REQUEST,

        /**
         * No record with the given id.
         */
        RECORD_NOT_FOUND,

        /**
         * No edge from the current to the requested status.
         */
        INVALID_TRANSITION,

        /**
         * The edge requires a comment and none was given.
         */
        MISSING_REQUIRED_COMMENT,

        /**
         * The approval gate refused the actor.
         */
        UNAUTHORIZED,

        /**
         * The stored status changed since the snapshot was read. Retry after refetching.
         */
        CONCURRENT_MODIFICATION,

        /**
         * The record store or the event sink failed.
         */
        PERSISTENCE_ERROR
    }

    private final Status status;
    private final String recordId;
    private final QmsStatus fromStatus;
    private final QmsStatus requestedStatus;
    private final QmsTransitionEdge edge;
    private final QmsQualityRecord updatedRecord;
    private final QmsQualityRecord currentRecord;
    private final QmsStatusChangedEvent event;
    private final QmsLifecycleErrorCodes errorCode;
    private final String errorMessage;

    private QmsStatusTransitionResult(Status status,
                                      String recordId,
                                      QmsStatus fromStatus,
                                      QmsStatus requestedStatus,
                                      QmsTransitionEdge edge,
                                      QmsQualityRecord updatedRecord,
                                      QmsQualityRecord currentRecord,
                                      QmsStatusChangedEvent event,
                                      QmsLifecycleErrorCodes errorCode,
                                      String errorMessage) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.recordId = recordId;
        this.fromStatus = fromStatus;
        this.requestedStatus = requestedStatus;
        this.edge = edge;
        this.updatedRecord = updatedRecord;
        this.currentRecord = currentRecord;
        this.event = event;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result.
     */
    public static QmsStatusTransitionResult applied(QmsTransitionEdge edge,
                                                    QmsQualityRecord updatedRecord,
                                                    QmsStatusChangedEvent event) {
        return new QmsStatusTransitionResult(Status.APPLIED, updatedRecord.getId(), edge.getFrom(), edge.getTo(),
                edge, updatedRecord, updatedRecord, event, null, null);
    }

    public static QmsStatusTransitionResult invalidRequest(String recordId, QmsStatus requestedStatus, String message) {
        return failure(Status.INVALID_REQUEST, QmsLifecycleErrorCodes.INVALID_REQUEST,
                recordId, null, requestedStatus, null, null, message);
    }

    public static QmsStatusTransitionResult recordNotFound(String recordId, QmsStatus requestedStatus) {
        return failure(Status.RECORD_NOT_FOUND, QmsLifecycleErrorCodes.RECORD_NOT_FOUND,
                recordId, null, requestedStatus, null, null, "No record with id " + recordId);
    }

    public static QmsStatusTransitionResult invalidTransition(QmsQualityRecord record,
                                                              QmsStatus requestedStatus,
                                                              String reason) {
        return failure(Status.INVALID_TRANSITION, QmsLifecycleErrorCodes.INVALID_TRANSITION,
                record.getId(), record.getStatus(), requestedStatus, null, record, reason);
    }

    public static QmsStatusTransitionResult missingRequiredComment(QmsQualityRecord record, QmsTransitionEdge edge) {
        return failure(Status.MISSING_REQUIRED_COMMENT, QmsLifecycleErrorCodes.MISSING_REQUIRED_COMMENT,
                record.getId(), edge.getFrom(), edge.getTo(), edge, record,
                "Transition '" + edge.getLabel() + "' requires a comment");
    }

    public static QmsStatusTransitionResult unauthorized(QmsQualityRecord record,
                                                         QmsTransitionEdge edge,
                                                         String message) {
        return failure(Status.UNAUTHORIZED, QmsLifecycleErrorCodes.UNAUTHORIZED,
                record.getId(), edge.getFrom(), edge.getTo(), edge, record, message);
    }

    /**
     * Creates a conflict result carrying the latest stored record, if it could be refetched.
     */
    public static QmsStatusTransitionResult concurrentModification(QmsQualityRecord snapshot,
                                                                   QmsTransitionEdge edge,
                                                                   QmsQualityRecord currentRecord) {
        String currentValue = currentRecord == null ? "unknown" : currentRecord.getStatus().getValue();
        return failure(Status.CONCURRENT_MODIFICATION, QmsLifecycleErrorCodes.CONCURRENT_MODIFICATION,
                snapshot.getId(), edge.getFrom(), edge.getTo(), edge, currentRecord,
                "Record " + snapshot.getId() + " is no longer in status " + edge.getFrom().getValue()
                        + " (now " + currentValue + ")");
    }

    public static QmsStatusTransitionResult persistenceError(QmsQualityRecord record,
                                                             QmsStatus requestedStatus,
                                                             QmsTransitionEdge edge,
                                                             String message) {
        return failure(Status.PERSISTENCE_ERROR, QmsLifecycleErrorCodes.PERSISTENCE_ERROR,
                record.getId(), record.getStatus(), requestedStatus, edge, null, message);
    }

    /**
     * The record could not be loaded for reasons other than its absence.
     */
    public static QmsStatusTransitionResult loadFailed(String recordId, QmsStatus requestedStatus, String message) {
        return failure(Status.PERSISTENCE_ERROR, QmsLifecycleErrorCodes.PERSISTENCE_ERROR,
                recordId, null, requestedStatus, null, null, message);
    }

    /**
     * The status was committed but the event could not be published. The updated
     * record is reported so callers know the change took effect.
     */
    public static QmsStatusTransitionResult publishFailed(QmsTransitionEdge edge,
                                                          QmsQualityRecord updatedRecord,
                                                          String message) {
        return new QmsStatusTransitionResult(Status.PERSISTENCE_ERROR, updatedRecord.getId(), edge.getFrom(),
                edge.getTo(), edge, updatedRecord, updatedRecord, null,
                QmsLifecycleErrorCodes.PERSISTENCE_ERROR, message);
    }

    private static QmsStatusTransitionResult failure(Status status,
                                                     QmsLifecycleErrorCodes errorCode,
                                                     String recordId,
                                                     QmsStatus fromStatus,
                                                     QmsStatus requestedStatus,
                                                     QmsTransitionEdge edge,
                                                     QmsQualityRecord currentRecord,
                                                     String message) {
        return new QmsStatusTransitionResult(status, recordId, fromStatus, requestedStatus, edge,
                null, currentRecord, null, errorCode, message);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    /**
     * True when the same request may succeed after refetching the record.
     */
    public boolean isRetryable() {
        return status == Status.CONCURRENT_MODIFICATION;
    }

    public Optional<QmsQualityRecord> getUpdatedRecord() {
        return Optional.ofNullable(updatedRecord);
    }

    public Optional<QmsQualityRecord> getCurrentRecord() {
        return Optional.ofNullable(currentRecord);
    }

    public Optional<QmsStatusChangedEvent> getEvent() {
        return Optional.ofNullable(event);
    }
}
