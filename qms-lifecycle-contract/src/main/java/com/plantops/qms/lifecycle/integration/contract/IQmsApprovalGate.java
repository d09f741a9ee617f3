package com.plantops.qms.lifecycle.integration.contract;

import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import reactor.core.publisher.Mono;

/**
 * Decides whether an actor may take a transition that requires approval.
 * Only consulted for edges with {@link QmsTransitionEdge#isRequiresApproval()} set.
 */
public interface IQmsApprovalGate {

    Mono<Boolean> isAuthorized(QmsActor actor, QmsTransitionEdge edge);
}
