package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Display state of a milestone stage relative to the record's current status.
 */
@Getter
@AllArgsConstructor
public enum QmsMilestoneState {

    /**
     * Still ahead of the current status.
     */
    PENDING("pending"),

    /**
     * Contains the current status.
     */
    CURRENT("current"),

    /**
     * Passed on every route to the current status.
     */
    COMPLETED("completed"),

    /**
     * Neither passed nor reachable any more.
     */
    SKIPPED("skipped");

    private final String value;
}
