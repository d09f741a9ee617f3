package com.plantops.qms.lifecycle.core.engine.audit;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only store of accepted transitions.
 */
public interface IQmsTransitionAuditService {

    Mono<QmsTransitionAuditEntry> logAuditEntry(QmsTransitionAuditEntry entry);

    /**
     * Entries of one record, oldest first.
     */
    Flux<QmsTransitionAuditEntry> getAuditTrailForRecord(String recordId);

    Mono<QmsTransitionAuditEntry> getLatestAuditEntry(String recordId);

    Flux<QmsTransitionAuditEntry> getAuditEntriesByActor(String actorId);

    /**
     * Entries with {@code from <= timestamp < to}, oldest first.
     */
    Flux<QmsTransitionAuditEntry> getAuditEntriesBetween(Instant from, Instant to);

    Mono<Long> countAuditEntriesForRecord(String recordId);
}
