package com.plantops.qms.lifecycle.integration.contract;

import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import reactor.core.publisher.Mono;

/**
 * Receives one event per committed status change.
 */
public interface IQmsEventSink {

    /**
     * Publishes the event. An error signal means the event was not recorded.
     */
    Mono<Void> publish(QmsStatusChangedEvent event);
}
