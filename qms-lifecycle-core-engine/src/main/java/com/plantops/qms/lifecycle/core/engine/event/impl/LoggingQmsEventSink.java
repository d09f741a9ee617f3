package com.plantops.qms.lifecycle.core.engine.event.impl;

import com.plantops.qms.lifecycle.integration.contract.IQmsEventSink;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes every status change to the log and keeps a per-record history.
 *
 * <pre>{@code
 * LoggingQmsEventSink sink = new LoggingQmsEventSink();
 * // ... apply transitions ...
 * List<QmsStatusChangedEvent> history = sink.getHistory("ncr-1");
 * }</pre>
 */
@Slf4j
public class LoggingQmsEventSink implements IQmsEventSink {

    // History for testing
    private final Map<String, List<QmsStatusChangedEvent>> historyByRecord = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong totalPublished = new AtomicLong(0);
    private final Map<QmsRecordKind, AtomicLong> byKind = new ConcurrentHashMap<>();

    private volatile boolean storeHistory = true;

    public LoggingQmsEventSink() {
        log.info("LoggingQmsEventSink initialized");
    }

    /**
     * Enables or disables history storage.
     */
    public LoggingQmsEventSink setStoreHistory(boolean store) {
        this.storeHistory = store;
        return this;
    }

    @Override
    public Mono<Void> publish(QmsStatusChangedEvent event) {
        return Mono.fromRunnable(() -> {
            log.info("[{}] {} {}: {} -> {} ('{}') by {} at {}{}",
                    event.getEventId(),
                    event.getKind(),
                    event.getRecordNumber() != null ? event.getRecordNumber() : event.getRecordId(),
                    event.getFromStatus().getValue(),
                    event.getToStatus().getValue(),
                    event.getTransitionLabel(),
                    event.getActorId(),
                    event.getTimestamp(),
                    event.getComment().map(comment -> " - " + comment).orElse(""));

            totalPublished.incrementAndGet();
            byKind.computeIfAbsent(event.getKind(), k -> new AtomicLong(0)).incrementAndGet();
            if (storeHistory) {
                historyByRecord.computeIfAbsent(event.getRecordId(),
                        k -> Collections.synchronizedList(new ArrayList<>())).add(event);
            }
        });
    }

    public List<QmsStatusChangedEvent> getHistory(String recordId) {
        List<QmsStatusChangedEvent> history = historyByRecord.get(recordId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public long getTotalPublished() {
        return totalPublished.get();
    }

    public long getPublishedCount(QmsRecordKind kind) {
        AtomicLong count = byKind.get(kind);
        return count == null ? 0 : count.get();
    }

    /**
     * Clears history and statistics.
     */
    public void clearHistory() {
        historyByRecord.clear();
        totalPublished.set(0);
        byKind.clear();
    }
}
