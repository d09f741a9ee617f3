package com.plantops.qms.lifecycle.core.engine.milestone.impl;

import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsLifecycleDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsStageDefinition;
import com.plantops.qms.lifecycle.core.engine.lifecycle.QmsTransitionRuleTable;
import com.plantops.qms.lifecycle.core.engine.milestone.IQmsMilestoneProjector;
import com.plantops.qms.lifecycle.integration.enumerations.QmsMilestoneState;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsMilestoneStage;

import java.util.List;

/**
 * Derives milestone states from the progress graph of the rule table.
 *
 * <p>For a current status {@code c}, the stage holding {@code c} is current. Any
 * other stage is completed when {@code c} can be reached from it along forward
 * edges, pending when it can be reached from {@code c}, and skipped otherwise.
 * Because the progress graph is acyclic a stage is never both.</p>
 */
public class QmsMilestoneProjector implements IQmsMilestoneProjector {

    private final QmsTransitionRuleTable ruleTable;

    public QmsMilestoneProjector(QmsTransitionRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @Override
    public List<QmsMilestoneStage> project(QmsRecordKind kind, QmsStatus currentStatus) {
        QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);
        if (!definition.isKnownStatus(currentStatus)) {
            throw new IllegalArgumentException("Status " + currentStatus + " is not part of the " + kind + " vocabulary");
        }
        return definition.getStages().stream()
                .map(stage -> QmsMilestoneStage.builder()
                        .id(stage.getId())
                        .label(stage.getLabel())
                        .state(stateOf(definition, stage, currentStatus))
                        .build())
                .toList();
    }

    private QmsMilestoneState stateOf(QmsLifecycleDefinition definition, QmsStageDefinition stage, QmsStatus current) {
        if (stage.contains(current)) {
            return QmsMilestoneState.CURRENT;
        }
        if (definition.stageLeadsTo(stage, current)) {
            return QmsMilestoneState.COMPLETED;
        }
        if (definition.statusLeadsTo(current, stage)) {
            return QmsMilestoneState.PENDING;
        }
        return QmsMilestoneState.SKIPPED;
    }
}
