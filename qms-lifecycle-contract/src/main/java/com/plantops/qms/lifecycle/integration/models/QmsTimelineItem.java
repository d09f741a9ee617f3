package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.QmsMilestoneState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

/**
 * A milestone stage decorated for display: resolved date and tooltip text.
 */
@Getter
@Builder
@ToString
public final class QmsTimelineItem {

    private final String id;
    private final String label;
    private final QmsMilestoneState state;
    private final Instant date;
    private final String tooltip;

    public Optional<Instant> getDate() {
        return Optional.ofNullable(date);
    }

    public boolean isCompleted() {
        return state == QmsMilestoneState.COMPLETED;
    }

    public boolean isCurrent() {
        return state == QmsMilestoneState.CURRENT;
    }
}
