package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.CapaStatus;
import com.plantops.qms.lifecycle.integration.enumerations.MrbStatus;
import com.plantops.qms.lifecycle.integration.enumerations.NcrStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QmsTransitionEdge")
class QmsTransitionEdgeTest {

    @Test
    @DisplayName("edge between two kinds is rejected")
    void shouldRejectCrossKindEdge() {
        assertThrows(IllegalArgumentException.class, () -> QmsTransitionEdge.builder()
                .from(NcrStatus.OPEN).to(CapaStatus.IN_PROGRESS).label("Escalate").build());
    }

    @Test
    @DisplayName("self-loop is rejected")
    void shouldRejectSelfLoop() {
        assertThrows(IllegalArgumentException.class, () -> QmsTransitionEdge.builder()
                .from(NcrStatus.OPEN).to(NcrStatus.OPEN).label("Touch").build());
    }

    @Test
    @DisplayName("edge pointing back in canonical order is a return edge")
    void shouldDetectReturnEdge() {
        QmsTransitionEdge back = QmsTransitionEdge.builder()
                .from(MrbStatus.DISPOSITION_PENDING).to(MrbStatus.IN_REVIEW).label("Return to Review")
                .requiresComment(true)
                .suggestedReason("Further analysis required")
                .build();
        QmsTransitionEdge ahead = QmsTransitionEdge.builder()
                .from(MrbStatus.APPROVED).to(MrbStatus.CLOSED).label("Close MRB").build();

        assertTrue(back.isReturn());
        assertFalse(ahead.isReturn());
        assertEquals(QmsRecordKind.MRB, back.getKind());
        assertEquals(1, back.getSuggestedReasons().size());
        assertTrue(ahead.getSuggestedReasons().isEmpty());
    }

    @Test
    @DisplayName("edges are equal when they join the same statuses")
    void shouldCompareByEndpoints() {
        QmsTransitionEdge first = QmsTransitionEdge.builder()
                .from(NcrStatus.DRAFT).to(NcrStatus.OPEN).label("Open NCR").build();
        QmsTransitionEdge second = QmsTransitionEdge.builder()
                .from(NcrStatus.DRAFT).to(NcrStatus.OPEN).label("Submit").requiresComment(true).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
