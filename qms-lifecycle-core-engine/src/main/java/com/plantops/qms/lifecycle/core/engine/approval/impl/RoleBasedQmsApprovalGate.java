package com.plantops.qms.lifecycle.core.engine.approval.impl;

import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.integration.contract.IQmsApprovalGate;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Authorizes an actor holding any approver role configured for the edge's record kind.
 */
@Slf4j
public class RoleBasedQmsApprovalGate implements IQmsApprovalGate {

    private final QmsLifecycleConfig config;

    public RoleBasedQmsApprovalGate(QmsLifecycleConfig config) {
        this.config = config;
    }

    @Override
    public Mono<Boolean> isAuthorized(QmsActor actor, QmsTransitionEdge edge) {
        return Mono.fromCallable(() -> {
            Set<String> approverRoles = config.getApproverRoles(edge.getKind());
            boolean authorized = approverRoles.stream().anyMatch(actor::hasRole);
            log.debug("Actor {} with roles {} {} for '{}' on {} (approver roles {})",
                    actor.getId(), actor.getRoles(), authorized ? "authorized" : "not authorized",
                    edge.getLabel(), edge.getKind(), approverRoles);
            return authorized;
        });
    }
}
