package com.plantops.qms.lifecycle.core.engine.timeline;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsTimelineItem;

import java.util.List;

/**
 * Builds the display timeline of a record snapshot.
 */
public interface IQmsTimelineBuilder {

    /**
     * Items come out in canonical stage order regardless of the dates on the record.
     *
     * @throws IllegalArgumentException if the record is not of the given kind
     */
    List<QmsTimelineItem> build(QmsRecordKind kind, QmsQualityRecord record);
}
