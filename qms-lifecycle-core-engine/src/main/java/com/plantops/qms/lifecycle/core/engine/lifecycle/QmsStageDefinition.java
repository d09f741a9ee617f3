package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * A milestone stage: a display label over one or more consecutive statuses.
 */
@Getter
@ToString
public final class QmsStageDefinition {

    private final String id;
    private final String label;
    private final List<QmsStatus> members;

    public QmsStageDefinition(String id, String label, List<QmsStatus> members) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.members = List.copyOf(Objects.requireNonNull(members, "members must not be null"));
    }

    public boolean contains(QmsStatus status) {
        return members.contains(status);
    }

    /**
     * Members from the latest to the earliest in canonical order.
     */
    public List<QmsStatus> membersLatestFirst() {
        return members.stream()
                .sorted((left, right) -> Integer.compare(right.ordinal(), left.ordinal()))
                .toList();
    }
}
