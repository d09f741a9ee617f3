package com.plantops.qms.lifecycle.core.engine.event.impl;

import com.plantops.qms.lifecycle.integration.contract.IQmsEventSink;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans one event out to several sinks, in registration order.
 *
 * <p>Sinks come in two flavours. A failing <em>required</em> sink (audit trail,
 * outbox) fails the whole publication. A failing <em>best-effort</em> sink
 * (log, chat notification) is logged and ignored.</p>
 *
 * <pre>{@code
 * CompositeQmsEventSink sink = CompositeQmsEventSink.create()
 *     .addSink(new QmsAuditTrailEventSink(auditService))
 *     .addBestEffortSink(new LoggingQmsEventSink());
 * }</pre>
 */
@Slf4j
public class CompositeQmsEventSink implements IQmsEventSink {

    private final List<RegisteredSink> sinks = new CopyOnWriteArrayList<>();

    public CompositeQmsEventSink() {
        log.info("CompositeQmsEventSink initialized");
    }

    public static CompositeQmsEventSink create() {
        return new CompositeQmsEventSink();
    }

    public CompositeQmsEventSink addSink(IQmsEventSink sink) {
        sinks.add(new RegisteredSink(sink, true));
        log.info("Added required event sink: {}", sink.getClass().getSimpleName());
        return this;
    }

    public CompositeQmsEventSink addBestEffortSink(IQmsEventSink sink) {
        sinks.add(new RegisteredSink(sink, false));
        log.info("Added best-effort event sink: {}", sink.getClass().getSimpleName());
        return this;
    }

    public int getSinkCount() {
        return sinks.size();
    }

    @Override
    public Mono<Void> publish(QmsStatusChangedEvent event) {
        return Flux.fromIterable(sinks)
                .concatMap(registered -> publishTo(registered, event))
                .then();
    }

    private Mono<Void> publishTo(RegisteredSink registered, QmsStatusChangedEvent event) {
        Mono<Void> publication = Mono.defer(() -> registered.sink().publish(event));
        if (registered.required()) {
            return publication.doOnError(error -> log.error("Required sink {} failed for event {}: {}",
                    registered.sink().getClass().getSimpleName(), event.getEventId(), error.getMessage()));
        }
        return publication.onErrorResume(error -> {
            log.error("Error publishing event {} via {}: {}",
                    event.getEventId(), registered.sink().getClass().getSimpleName(), error.getMessage());
            return Mono.empty();
        });
    }

    private record RegisteredSink(IQmsEventSink sink, boolean required) {
    }
}
