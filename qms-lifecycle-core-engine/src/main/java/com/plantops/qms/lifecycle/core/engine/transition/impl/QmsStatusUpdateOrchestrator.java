package com.plantops.qms.lifecycle.core.engine.transition.impl;

import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsStatusUpdateOrchestrator;
import com.plantops.qms.lifecycle.core.engine.transition.IQmsTransitionValidator;
import com.plantops.qms.lifecycle.core.engine.transition.QmsStatusTransitionResult;
import com.plantops.qms.lifecycle.core.engine.transition.QmsTransitionValidation;
import com.plantops.qms.lifecycle.core.util.QmsBeanValidation;
import com.plantops.qms.lifecycle.integration.contract.IQmsApprovalGate;
import com.plantops.qms.lifecycle.integration.contract.IQmsEventSink;
import com.plantops.qms.lifecycle.integration.contract.IQmsRecordStore;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsActor;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates, gates, commits and announces status changes.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Check the request itself (record, actor, requested status).</li>
 *   <li>Look up the edge; stop with INVALID_TRANSITION if there is none.</li>
 *   <li>Enforce a non-blank comment on edges that require one.</li>
 *   <li>Ask the approval gate on edges that require approval.</li>
 *   <li>Compare-and-swap the record on its snapshot status.</li>
 *   <li>Publish exactly one {@link QmsStatusChangedEvent}.</li>
 * </ol>
 *
 * Nothing is written before step 5, so every earlier failure leaves the store
 * and the event sink untouched. A lost compare-and-swap is reported as a
 * conflict together with the refetched record; it is never retried here.
 */
@Slf4j
public class QmsStatusUpdateOrchestrator implements IQmsStatusUpdateOrchestrator {

    private final IQmsTransitionValidator transitionValidator;
    private final IQmsRecordStore recordStore;
    private final IQmsApprovalGate approvalGate;
    private final IQmsEventSink eventSink;
    private final QmsLifecycleConfig config;

    public QmsStatusUpdateOrchestrator(IQmsTransitionValidator transitionValidator,
                                       IQmsRecordStore recordStore,
                                       IQmsApprovalGate approvalGate,
                                       IQmsEventSink eventSink,
                                       QmsLifecycleConfig config) {
        this.transitionValidator = transitionValidator;
        this.recordStore = recordStore;
        this.approvalGate = approvalGate;
        this.eventSink = eventSink;
        this.config = config;
    }

    @Override
    public Mono<QmsStatusTransitionResult> apply(QmsQualityRecord record,
                                                 QmsStatus requestedStatus,
                                                 String comment,
                                                 QmsActor actor) {
        return Mono.defer(() -> {
            List<String> requestProblems = checkRequest(record, requestedStatus, actor);
            if (!requestProblems.isEmpty()) {
                String recordId = record == null ? null : record.getId();
                log.warn("Rejected malformed status update for record {}: {}", recordId, requestProblems);
                return Mono.just(QmsStatusTransitionResult.invalidRequest(
                        recordId, requestedStatus, String.join("; ", requestProblems)));
            }

            QmsTransitionValidation validation =
                    transitionValidator.validate(record.getKind(), record.getStatus(), requestedStatus);
            if (!validation.isValid()) {
                log.warn("Rejected {} transition for record {}: {}",
                        record.getKind(), record.getId(), validation.getRejectionReason());
                return Mono.just(QmsStatusTransitionResult.invalidTransition(
                        record, requestedStatus, validation.getRejectionReason()));
            }

            QmsTransitionEdge edge = validation.getEdge().orElseThrow();
            String normalizedComment = normalize(comment);
            if (edge.isRequiresComment() && normalizedComment == null) {
                log.warn("Transition '{}' on record {} requires a comment", edge.getLabel(), record.getId());
                return Mono.just(QmsStatusTransitionResult.missingRequiredComment(record, edge));
            }

            return authorize(edge, actor)
                    .flatMap(denial -> denial
                            .map(reason -> {
                                log.warn("Approval denied for '{}' on record {}: {}",
                                        edge.getLabel(), record.getId(), reason);
                                return Mono.just(QmsStatusTransitionResult.unauthorized(record, edge, reason));
                            })
                            .orElseGet(() -> commit(record, edge, normalizedComment, actor)));
        });
    }

    @Override
    public Mono<QmsStatusTransitionResult> applyById(String recordId,
                                                     QmsStatus requestedStatus,
                                                     String comment,
                                                     QmsActor actor) {
        if (recordId == null || recordId.isBlank()) {
            return Mono.just(QmsStatusTransitionResult.invalidRequest(recordId, requestedStatus, "record id must not be blank"));
        }
        // apply() never signals an error, so only load failures reach onErrorResume
        return recordStore.load(recordId)
                .flatMap(record -> apply(record, requestedStatus, comment, actor))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Status update requested for unknown record {}", recordId);
                    return QmsStatusTransitionResult.recordNotFound(recordId, requestedStatus);
                }))
                .onErrorResume(error -> {
                    log.error("Failed to load record {}", recordId, error);
                    return Mono.just(QmsStatusTransitionResult.loadFailed(
                            recordId, requestedStatus, "Failed to load record: " + error.getMessage()));
                });
    }

    private List<String> checkRequest(QmsQualityRecord record, QmsStatus requestedStatus, QmsActor actor) {
        List<String> problems = new ArrayList<>();
        if (record == null) {
            problems.add("record must not be null");
        } else {
            problems.addAll(QmsBeanValidation.violationsOf(record));
        }
        if (requestedStatus == null) {
            problems.add("requested status must not be null");
        }
        if (actor == null) {
            problems.add("actor must not be null");
        } else {
            QmsBeanValidation.violationsOf(actor).forEach(violation -> problems.add("actor." + violation));
        }
        return problems;
    }

    /**
     * Emits an empty optional when the actor may proceed, otherwise the denial reason.
     */
    private Mono<Optional<String>> authorize(QmsTransitionEdge edge, QmsActor actor) {
        if (!edge.isRequiresApproval()) {
            return Mono.just(Optional.empty());
        }
        return approvalGate.isAuthorized(actor, edge)
                .defaultIfEmpty(Boolean.FALSE)
                .map(authorized -> authorized
                        ? Optional.<String>empty()
                        : Optional.of("Actor " + actor.getId() + " is not authorized to '" + edge.getLabel() + "'"))
                .onErrorResume(error -> {
                    log.error("Approval gate failed for '{}' by actor {}", edge.getLabel(), actor.getId(), error);
                    return Mono.just(Optional.of("Approval could not be verified: " + error.getMessage()));
                });
    }

    private Mono<QmsStatusTransitionResult> commit(QmsQualityRecord record,
                                                   QmsTransitionEdge edge,
                                                   String comment,
                                                   QmsActor actor) {
        Instant now = config.getClock().instant();
        QmsQualityRecord updated = record.withStatusChange(edge.getTo(), now);

        // publish() and conflict() never signal an error, so only store failures reach onErrorResume
        return recordStore.compareAndSwap(record.getId(), record.getStatus(), updated)
                .defaultIfEmpty(Boolean.FALSE)
                .flatMap(swapped -> swapped
                        ? publish(edge, updated, comment, actor, now)
                        : conflict(record, edge))
                .onErrorResume(error -> {
                    log.error("Failed to store status change of record {}", record.getId(), error);
                    return Mono.just(QmsStatusTransitionResult.persistenceError(
                            record, edge.getTo(), edge, "Failed to store record: " + error.getMessage()));
                });
    }

    private Mono<QmsStatusTransitionResult> conflict(QmsQualityRecord snapshot, QmsTransitionEdge edge) {
        return recordStore.load(snapshot.getId())
                .map(current -> {
                    log.warn("Concurrent modification of record {}: expected {}, found {}",
                            snapshot.getId(), snapshot.getStatus().getValue(), current.getStatus().getValue());
                    return QmsStatusTransitionResult.concurrentModification(snapshot, edge, current);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Record {} disappeared while applying '{}'", snapshot.getId(), edge.getLabel());
                    return QmsStatusTransitionResult.concurrentModification(snapshot, edge, null);
                }))
                .onErrorResume(error -> {
                    log.error("Failed to refetch record {} after a lost update", snapshot.getId(), error);
                    return Mono.just(QmsStatusTransitionResult.concurrentModification(snapshot, edge, null));
                });
    }

    private Mono<QmsStatusTransitionResult> publish(QmsTransitionEdge edge,
                                                    QmsQualityRecord updated,
                                                    String comment,
                                                    QmsActor actor,
                                                    Instant timestamp) {
        QmsStatusChangedEvent event = QmsStatusChangedEvent.builder()
                .recordId(updated.getId())
                .recordNumber(updated.getNumber())
                .kind(updated.getKind())
                .fromStatus(edge.getFrom())
                .toStatus(edge.getTo())
                .transitionLabel(edge.getLabel())
                .actorId(actor.getId())
                .comment(comment)
                .timestamp(timestamp)
                .recordVersion(updated.getVersion())
                .build();

        return eventSink.publish(event)
                .timeout(config.getPublishTimeout())
                .then(Mono.fromCallable(() -> {
                    log.info("Applied {} transition '{}' on record {}: {} -> {} by {}",
                            updated.getKind(), edge.getLabel(), updated.getId(),
                            edge.getFrom().getValue(), edge.getTo().getValue(), actor.getId());
                    return QmsStatusTransitionResult.applied(edge, updated, event);
                }))
                .onErrorResume(error -> {
                    log.error("Status of record {} changed to {} but the event could not be published",
                            updated.getId(), edge.getTo().getValue(), error);
                    return Mono.just(QmsStatusTransitionResult.publishFailed(edge, updated,
                            "Status committed but event publication failed: " + error.getMessage()));
                });
    }

    private static String normalize(String comment) {
        if (comment == null || comment.isBlank()) {
            return null;
        }
        return comment.trim();
    }
}
