package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.QmsMilestoneState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

@Getter
@Builder(toBuilder = true)
@ToString
public final class QmsMilestoneStage {

    private final String id;
    private final String label;
    private final QmsMilestoneState state;
    private final Instant timestamp;

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }
}
