package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * A permitted move between two statuses of the same kind, with the gates that
 * apply to it.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode(of = {"from", "to"})
public final class QmsTransitionEdge {

    private final QmsStatus from;
    private final QmsStatus to;
    private final String label;
    private final boolean requiresComment;
    private final boolean requiresApproval;

    /**
     * Suggested reasons offered to the user, used on return edges.
     */
    @Singular
    private final List<String> suggestedReasons;

    private QmsTransitionEdge(QmsStatus from,
                              QmsStatus to,
                              String label,
                              boolean requiresComment,
                              boolean requiresApproval,
                              List<String> suggestedReasons) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        if (from.getKind() != to.getKind()) {
            throw new IllegalArgumentException("Edge " + from.getValue() + " -> " + to.getValue()
                    + " crosses kinds " + from.getKind() + " and " + to.getKind());
        }
        if (from == to) {
            throw new IllegalArgumentException("Self-loop on " + from.getKind() + " status " + from.getValue());
        }
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.requiresComment = requiresComment;
        this.requiresApproval = requiresApproval;
        this.suggestedReasons = suggestedReasons == null ? List.of() : List.copyOf(suggestedReasons);
    }

    public QmsRecordKind getKind() {
        return from.getKind();
    }

    /**
     * True when the edge moves the record back in the canonical order.
     */
    public boolean isReturn() {
        return to.ordinal() < from.ordinal();
    }
}
