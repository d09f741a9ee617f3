package com.plantops.qms.lifecycle.core.engine.transition;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of looking up a requested transition in the rule table: either the
 * matching edge or the reason it was rejected.
 */
@Getter
@ToString
public final class QmsTransitionValidation {

    private final QmsRecordKind kind;
    private final QmsStatus from;
    private final QmsStatus to;
    private final QmsTransitionEdge edge;
    private final String rejectionReason;

    private QmsTransitionValidation(QmsRecordKind kind,
                                    QmsStatus from,
                                    QmsStatus to,
                                    QmsTransitionEdge edge,
                                    String rejectionReason) {
        this.kind = kind;
        this.from = from;
        this.to = to;
        this.edge = edge;
        this.rejectionReason = rejectionReason;
    }

    public static QmsTransitionValidation valid(QmsTransitionEdge edge) {
        return new QmsTransitionValidation(edge.getKind(), edge.getFrom(), edge.getTo(), edge, null);
    }

    public static QmsTransitionValidation invalid(QmsRecordKind kind, QmsStatus from, QmsStatus to, String reason) {
        return new QmsTransitionValidation(kind, from, to, null, reason);
    }

    public boolean isValid() {
        return edge != null;
    }

    public Optional<QmsTransitionEdge> getEdge() {
        return Optional.ofNullable(edge);
    }
}
