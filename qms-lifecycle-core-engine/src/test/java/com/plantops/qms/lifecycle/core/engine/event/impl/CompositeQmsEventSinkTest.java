package com.plantops.qms.lifecycle.core.engine.event.impl;

import com.plantops.qms.lifecycle.integration.enumerations.NcrStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.models.QmsStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.plantops.qms.lifecycle.core.engine.QmsTestRecords.NOW;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CompositeQmsEventSink} and {@link LoggingQmsEventSink}.
 */
class CompositeQmsEventSinkTest {

    private QmsStatusChangedEvent event;

    @BeforeEach
    void setUp() {
        event = QmsStatusChangedEvent.builder()
                .recordId("ncr-1")
                .recordNumber("NCR-2024-001")
                .kind(QmsRecordKind.NCR)
                .fromStatus(NcrStatus.DRAFT)
                .toStatus(NcrStatus.OPEN)
                .transitionLabel("Open NCR")
                .actorId("u-engineer")
                .timestamp(NOW)
                .recordVersion(1)
                .build();
    }

    @Nested
    @DisplayName("Composite Sink")
    class CompositeTests {

        @Test
        @DisplayName("should publish to every sink in registration order")
        void shouldPublishInOrder() {
            List<String> calls = new CopyOnWriteArrayList<>();
            CompositeQmsEventSink sink = CompositeQmsEventSink.create()
                    .addSink(e -> Mono.fromRunnable(() -> calls.add("audit")))
                    .addBestEffortSink(e -> Mono.fromRunnable(() -> calls.add("log")));

            StepVerifier.create(sink.publish(event)).verifyComplete();

            assertEquals(List.of("audit", "log"), calls);
            assertEquals(2, sink.getSinkCount());
        }

        @Test
        @DisplayName("should fail when a required sink fails")
        void shouldFailOnRequiredSinkFailure() {
            List<String> calls = new CopyOnWriteArrayList<>();
            CompositeQmsEventSink sink = CompositeQmsEventSink.create()
                    .addSink(e -> Mono.error(new IllegalStateException("audit store down")))
                    .addBestEffortSink(e -> Mono.fromRunnable(() -> calls.add("log")));

            StepVerifier.create(sink.publish(event))
                    .expectErrorMessage("audit store down")
                    .verify();
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("should continue past a failing best-effort sink")
        void shouldContinuePastBestEffortFailure() {
            List<String> calls = new CopyOnWriteArrayList<>();
            CompositeQmsEventSink sink = CompositeQmsEventSink.create()
                    .addBestEffortSink(e -> Mono.error(new IllegalStateException("webhook down")))
                    .addSink(e -> Mono.fromRunnable(() -> calls.add("audit")));

            StepVerifier.create(sink.publish(event)).verifyComplete();

            assertEquals(List.of("audit"), calls);
        }

        @Test
        @DisplayName("should treat a sink throwing on subscription like a failing sink")
        void shouldContainThrowingSink() {
            CompositeQmsEventSink sink = CompositeQmsEventSink.create()
                    .addBestEffortSink(e -> {
                        throw new IllegalStateException("bad sink");
                    });

            StepVerifier.create(sink.publish(event)).verifyComplete();
        }
    }

    @Nested
    @DisplayName("Logging Sink")
    class LoggingTests {

        @Test
        @DisplayName("should keep history and counts")
        void shouldKeepHistoryAndCounts() {
            LoggingQmsEventSink sink = new LoggingQmsEventSink();

            sink.publish(event).block();

            assertEquals(List.of(event), sink.getHistory("ncr-1"));
            assertEquals(1, sink.getTotalPublished());
            assertEquals(1, sink.getPublishedCount(QmsRecordKind.NCR));
            assertEquals(0, sink.getPublishedCount(QmsRecordKind.MRB));

            sink.clearHistory();

            assertTrue(sink.getHistory("ncr-1").isEmpty());
            assertEquals(0, sink.getTotalPublished());
        }

        @Test
        @DisplayName("should count without history when history is disabled")
        void shouldSkipHistoryWhenDisabled() {
            LoggingQmsEventSink sink = new LoggingQmsEventSink().setStoreHistory(false);

            sink.publish(event).block();

            assertTrue(sink.getHistory("ncr-1").isEmpty());
            assertEquals(1, sink.getTotalPublished());
        }
    }
}
