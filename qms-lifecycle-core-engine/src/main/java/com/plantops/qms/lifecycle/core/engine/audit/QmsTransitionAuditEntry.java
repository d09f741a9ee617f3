package com.plantops.qms.lifecycle.core.engine.audit;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One append-only audit line per accepted transition.
 *
 * <h2>Audit Information Captured</h2>
 * <ul>
 *   <li>Who - actor id</li>
 *   <li>What - record, kind, transition label, from and to status</li>
 *   <li>When - timestamp of the change</li>
 *   <li>Why - the comment entered by the actor</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@With
public class QmsTransitionAuditEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final String entryId = UUID.randomUUID().toString();

    private final String recordId;
    private final String recordNumber;
    private final QmsRecordKind kind;
    private final String fromStatus;
    private final String toStatus;
    private final String transitionLabel;
    private final String actorId;
    private final String comment;

    @Builder.Default
    private final Instant timestamp = Instant.now();

    /**
     * Id of the status-changed event this entry was written for.
     */
    private final String eventId;

    public static QmsTransitionAuditEntry fromEvent(QmsStatusChangedEvent event) {
        return QmsTransitionAuditEntry.builder()
                .recordId(event.getRecordId())
                .recordNumber(event.getRecordNumber())
                .kind(event.getKind())
                .fromStatus(valueOf(event.getFromStatus()))
                .toStatus(valueOf(event.getToStatus()))
                .transitionLabel(event.getTransitionLabel())
                .actorId(event.getActorId())
                .comment(event.getComment().orElse(null))
                .timestamp(event.getTimestamp())
                .eventId(event.getEventId())
                .build();
    }

    private static String valueOf(QmsStatus status) {
        return status == null ? null : status.getValue();
    }
}
