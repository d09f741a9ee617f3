package com.plantops.qms.lifecycle.core.engine.store.impl;

import com.plantops.qms.lifecycle.integration.contract.IQmsRecordStore;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory record store for development, tests and single-instance deployments.
 *
 * <p>{@link #compareAndSwap} runs inside {@link ConcurrentHashMap#compute}, so the
 * status check and the replacement are atomic per record. The replacement must
 * also be exactly one version ahead of the stored record, which rejects a stale
 * snapshot even when the status has come back to the same value.</p>
 */
@Slf4j
public class InMemoryQmsRecordStore implements IQmsRecordStore {

    private final Map<String, QmsQualityRecord> records = new ConcurrentHashMap<>();

    public InMemoryQmsRecordStore() {
        log.info("InMemoryQmsRecordStore initialized");
    }

    public static InMemoryQmsRecordStore create() {
        return new InMemoryQmsRecordStore();
    }

    /**
     * Stores a record as-is, replacing any existing one with the same id.
     * Used by creation and import flows.
     */
    public InMemoryQmsRecordStore put(QmsQualityRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        records.put(record.getId(), record);
        log.debug("Stored record {} ({} {})", record.getId(), record.getKind(), record.getStatus().getValue());
        return this;
    }

    @Override
    public Mono<QmsQualityRecord> load(String recordId) {
        Objects.requireNonNull(recordId, "recordId must not be null");
        return Mono.fromCallable(() -> records.get(recordId));
    }

    @Override
    public Mono<Boolean> compareAndSwap(String recordId, QmsStatus expectedStatus, QmsQualityRecord updatedRecord) {
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(expectedStatus, "expectedStatus must not be null");
        Objects.requireNonNull(updatedRecord, "updatedRecord must not be null");

        return Mono.fromCallable(() -> {
            AtomicBoolean swapped = new AtomicBoolean(false);
            records.computeIfPresent(recordId, (id, existing) -> {
                if (existing.getStatus() != expectedStatus) {
                    log.warn("Status mismatch updating record {}: expected {}, found {}",
                            id, expectedStatus.getValue(), existing.getStatus().getValue());
                    return existing;
                }
                if (updatedRecord.getVersion() != existing.getVersion() + 1) {
                    log.warn("Version mismatch updating record {}: stored {}, update carries {}",
                            id, existing.getVersion(), updatedRecord.getVersion());
                    return existing;
                }
                swapped.set(true);
                return updatedRecord;
            });
            if (swapped.get()) {
                log.debug("Record {} moved from {} to {}", recordId, expectedStatus.getValue(),
                        updatedRecord.getStatus().getValue());
            }
            return swapped.get();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Collection<QmsQualityRecord> findAll() {
        return List.copyOf(records.values());
    }

    public int size() {
        return records.size();
    }

    /**
     * Clears all records. Primarily for testing.
     */
    public void reset() {
        records.clear();
        log.info("InMemoryQmsRecordStore reset");
    }
}
