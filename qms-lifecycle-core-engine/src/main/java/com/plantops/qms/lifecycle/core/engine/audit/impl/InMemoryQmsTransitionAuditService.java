package com.plantops.qms.lifecycle.core.engine.audit.impl;

import com.plantops.qms.lifecycle.core.engine.audit.IQmsTransitionAuditService;
import com.plantops.qms.lifecycle.core.engine.audit.QmsTransitionAuditEntry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory audit trail. Suitable for development, testing and single-instance
 * deployments; entries are lost on restart.
 */
@Slf4j
public class InMemoryQmsTransitionAuditService implements IQmsTransitionAuditService {

    // Primary storage - entryId -> entry
    private final Map<String, QmsTransitionAuditEntry> entries = new ConcurrentHashMap<>();

    // Indexes for fast lookups
    private final Map<String, List<String>> recordIndex = new ConcurrentHashMap<>();
    private final Map<String, List<String>> actorIndex = new ConcurrentHashMap<>();

    private final AtomicLong totalLogged = new AtomicLong(0);

    public InMemoryQmsTransitionAuditService() {
        log.info("InMemoryQmsTransitionAuditService initialized");
    }

    @Override
    public Mono<QmsTransitionAuditEntry> logAuditEntry(QmsTransitionAuditEntry entry) {
        return Mono.fromCallable(() -> {
            Objects.requireNonNull(entry, "entry must not be null");
            if (entries.putIfAbsent(entry.getEntryId(), entry) != null) {
                throw new IllegalStateException("Audit entry " + entry.getEntryId() + " already logged");
            }
            recordIndex.computeIfAbsent(entry.getRecordId(), k -> new CopyOnWriteArrayList<>()).add(entry.getEntryId());
            if (entry.getActorId() != null) {
                actorIndex.computeIfAbsent(entry.getActorId(), k -> new CopyOnWriteArrayList<>()).add(entry.getEntryId());
            }
            totalLogged.incrementAndGet();

            log.debug("Audit entry logged: recordId={}, {} -> {}, actor={}, timestamp={}",
                    entry.getRecordId(), entry.getFromStatus(), entry.getToStatus(),
                    entry.getActorId(), entry.getTimestamp());
            return entry;
        });
    }

    @Override
    public Flux<QmsTransitionAuditEntry> getAuditTrailForRecord(String recordId) {
        return Mono.fromCallable(() -> resolve(recordIndex.getOrDefault(recordId, Collections.emptyList())))
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<QmsTransitionAuditEntry> getLatestAuditEntry(String recordId) {
        return getAuditTrailForRecord(recordId)
                .collectList()
                .mapNotNull(list -> list.isEmpty() ? null : list.get(list.size() - 1));
    }

    @Override
    public Flux<QmsTransitionAuditEntry> getAuditEntriesByActor(String actorId) {
        return Mono.fromCallable(() -> resolve(actorIndex.getOrDefault(actorId, Collections.emptyList())))
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Flux<QmsTransitionAuditEntry> getAuditEntriesBetween(Instant from, Instant to) {
        return Mono.fromCallable(() ->
                entries.values().stream()
                        .filter(e -> !e.getTimestamp().isBefore(from) && e.getTimestamp().isBefore(to))
                        .sorted(Comparator.comparing(QmsTransitionAuditEntry::getTimestamp))
                        .toList()
        ).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Long> countAuditEntriesForRecord(String recordId) {
        return Mono.fromCallable(() ->
                (long) recordIndex.getOrDefault(recordId, Collections.emptyList()).size());
    }

    public long getTotalLogged() {
        return totalLogged.get();
    }

    /**
     * Clears all entries. Primarily for testing.
     */
    public void reset() {
        entries.clear();
        recordIndex.clear();
        actorIndex.clear();
        totalLogged.set(0);
        log.info("InMemoryQmsTransitionAuditService reset");
    }

    private List<QmsTransitionAuditEntry> resolve(List<String> entryIds) {
        return entryIds.stream()
                .map(entries::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(QmsTransitionAuditEntry::getTimestamp))
                .toList();
    }
}
