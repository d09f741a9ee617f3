package com.plantops.qms.lifecycle.core.engine.timeline.impl;

import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsLifecycleDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsStageDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsTransitionRuleTable;
import com.plantops.qms.lifecycle.core.engine.milestone.IQmsMilestoneProjector;
import com.plantops.qms.lifecycle.core.engine.timeline.IQmsTimelineBuilder;
import com.plantops.qms.lifecycle.core.engine.timeline.QmsTimelineTooltipFormatter;
import com.plantops.qms.lifecycle.integration.enumerations.QmsMilestoneState;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsMilestoneStage;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsTimelineItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decorates the milestone projection with the dates carried by the record.
 *
 * <ul>
 *   <li>A stage's date is the entry date of its latest member that has one.</li>
 *   <li>Only current and completed items carry a date.</li>
 *   <li>A skipped stage whose entry date is on the record is shown as completed.</li>
 *   <li>A completed stage without a date is shown as skipped when the dated statuses
 *   show the record took an alternative branch around it.</li>
 * </ul>
 */
@Slf4j
public class QmsTimelineBuilder implements IQmsTimelineBuilder {

    private final QmsTransitionRuleTable ruleTable;
    private final IQmsMilestoneProjector milestoneProjector;
    private final QmsTimelineTooltipFormatter tooltipFormatter;

    public QmsTimelineBuilder(QmsTransitionRuleTable ruleTable,
                              IQmsMilestoneProjector milestoneProjector,
                              QmsTimelineTooltipFormatter tooltipFormatter) {
        this.ruleTable = ruleTable;
        this.milestoneProjector = milestoneProjector;
        this.tooltipFormatter = tooltipFormatter;
    }

    @Override
    public List<QmsTimelineItem> build(QmsRecordKind kind, QmsQualityRecord record) {
        if (record.getKind() != kind) {
            throw new IllegalArgumentException("Record " + record.getId() + " is a " + record.getKind() + ", not a " + kind);
        }
        QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);
        List<QmsMilestoneStage> stages = milestoneProjector.project(kind, record.getStatus());
        Set<QmsStatus> datedStatuses = datedStatusesOf(definition, record);

        List<QmsTimelineItem> items = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            QmsMilestoneStage stage = stages.get(i);
            QmsStageDefinition stageDefinition = definition.getStages().get(i);
            Optional<Instant> entryDate = entryDateOf(definition, stageDefinition, record);

            QmsMilestoneState state = stage.getState();
            if (state == QmsMilestoneState.SKIPPED && entryDate.isPresent()) {
                log.debug("Stage {} of record {} was entered on {}; showing it as completed",
                        stage.getId(), record.getId(), entryDate.get());
                state = QmsMilestoneState.COMPLETED;
            } else if (state == QmsMilestoneState.COMPLETED && entryDate.isEmpty()
                    && definition.isStageBypassed(stageDefinition, record.getStatus(), datedStatuses)) {
                log.debug("Stage {} of record {} was bypassed on the way to {}; showing it as skipped",
                        stage.getId(), record.getId(), record.getStatus().getValue());
                state = QmsMilestoneState.SKIPPED;
            }
            Instant date = (state == QmsMilestoneState.CURRENT || state == QmsMilestoneState.COMPLETED)
                    ? entryDate.orElse(null)
                    : null;

            items.add(QmsTimelineItem.builder()
                    .id(stage.getId())
                    .label(stage.getLabel())
                    .state(state)
                    .date(date)
                    .tooltip(tooltipFormatter.tooltip(stage.getLabel(), state, date,
                            state == QmsMilestoneState.CURRENT && definition.isTerminal(record.getStatus())))
                    .build());
        }
        return items;
    }

    private Set<QmsStatus> datedStatusesOf(QmsLifecycleDefinition definition, QmsQualityRecord record) {
        Set<QmsStatus> dated = new HashSet<>();
        for (QmsStatus status : definition.getStatuses()) {
            if (status.getEntryDateField().flatMap(record::getDate).isPresent()) {
                dated.add(status);
            }
        }
        return dated;
    }

    private Optional<Instant> entryDateOf(QmsLifecycleDefinition definition,
                                          QmsStageDefinition stage,
                                          QmsQualityRecord record) {
        for (QmsRecordDateField field : definition.getStageDateFields(stage)) {
            Optional<Instant> value = record.getDate(field);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
