package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Emitted once for every committed status change.
 */
@Getter
@Builder
@ToString
public final class QmsStatusChangedEvent {

    @Builder.Default
    private final String eventId = UUID.randomUUID().toString();

    private final String recordId;
    private final String recordNumber;
    private final QmsRecordKind kind;
    private final QmsStatus fromStatus;
    private final QmsStatus toStatus;
    private final String transitionLabel;
    private final String actorId;
    private final String comment;
    private final Instant timestamp;
    private final long recordVersion;

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }
}
