package com.plantops.qms.lifecycle.core.engine.timeline;

import com.plantops.qms.lifecycle.core.engine.config.QmsLifecycleConfig;
import com.plantops.qms.lifecycle.integration.enumerations.QmsMilestoneState;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

public class QmsTimelineTooltipFormatter {

    private final DateTimeFormatter dateFormatter;

    public QmsTimelineTooltipFormatter(QmsLifecycleConfig config) {
        this.dateFormatter = config.tooltipDateFormatter();
    }

    /**
     * @param terminal whether the record rests in a terminal status of the current stage;
     *                 such a stage is reported as reached rather than in progress
     */
    public String tooltip(String label, QmsMilestoneState state, Instant date, boolean terminal) {
        return switch (state) {
            case CURRENT -> terminal
                    ? (date != null ? label + " on " + dateFormatter.format(date) : label)
                    : label + " in progress";
            case COMPLETED -> date != null
                    ? label + " completed on " + dateFormatter.format(date)
                    : label + " completed";
            case PENDING -> "Awaiting " + label;
            case SKIPPED -> label + " bypassed";
        };
    }
}
