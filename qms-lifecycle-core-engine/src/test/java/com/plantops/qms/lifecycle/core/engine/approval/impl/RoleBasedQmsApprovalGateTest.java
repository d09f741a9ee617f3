package com.plantops.qms.lifecycle.core.engine.approval.impl;

import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsTransitionRuleTable;
import com.plantops.qms.lifecycle.integration.enumerations.CapaStatus;
import com.plantops.qms.lifecycle.integration.enumerations.MrbStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.plantops.qms.lifecycle.core.engine.QmsTestRecords.ENGINEER;
import static com.plantops.qms.lifecycle.core.engine.QmsTestRecords.MRB_MEMBER;
import static com.plantops.qms.lifecycle.core.engine.QmsTestRecords.QUALITY_MANAGER;
import static org.junit.jupiter.api.Assertions.*;

class RoleBasedQmsApprovalGateTest {

    private final QmsTransitionRuleTable ruleTable = QmsTransitionRuleTable.getInstance();
    private final RoleBasedQmsApprovalGate gate = new RoleBasedQmsApprovalGate(QmsLifecycleConfig.defaultConfig());

    private final QmsTransitionEdge approveMrb = ruleTable.getDefinition(QmsRecordKind.MRB)
            .findEdge(MrbStatus.DISPOSITION_PENDING, MrbStatus.APPROVED).orElseThrow();
    private final QmsTransitionEdge cancelCapa = ruleTable.getDefinition(QmsRecordKind.CAPA)
            .findEdge(CapaStatus.OPEN, CapaStatus.CANCELLED).orElseThrow();

    @Test
    @DisplayName("should authorize a quality manager on every kind")
    void shouldAuthorizeQualityManager() {
        assertTrue(gate.isAuthorized(QUALITY_MANAGER, approveMrb).block());
        assertTrue(gate.isAuthorized(QUALITY_MANAGER, cancelCapa).block());
    }

    @Test
    @DisplayName("should limit MRB members to MRB decisions")
    void shouldLimitMrbMembers() {
        assertTrue(gate.isAuthorized(MRB_MEMBER, approveMrb).block());
        assertFalse(gate.isAuthorized(MRB_MEMBER, cancelCapa).block());
    }

    @Test
    @DisplayName("should refuse an actor without approver roles")
    void shouldRefuseOrdinaryActor() {
        assertFalse(gate.isAuthorized(ENGINEER, approveMrb).block());
        assertFalse(gate.isAuthorized(QmsActor.of("u-nobody"), cancelCapa).block());
    }

    @Test
    @DisplayName("should follow configured approver roles")
    void shouldFollowConfiguredRoles() {
        RoleBasedQmsApprovalGate custom = new RoleBasedQmsApprovalGate(QmsLifecycleConfig.builder()
                .approverRoles(Map.of(QmsRecordKind.CAPA, Set.of("capa_board")))
                .build());

        assertTrue(custom.isAuthorized(QmsActor.of("u-board", "capa_board"), cancelCapa).block());
        assertFalse(custom.isAuthorized(QUALITY_MANAGER, cancelCapa).block());
        assertFalse(custom.isAuthorized(QUALITY_MANAGER, approveMrb).block());
    }
}
