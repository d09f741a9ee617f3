package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.core.exception.QmsLifecycleConfigurationException;
import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rule table of one record kind: its milestone stages and its permitted transitions.
 *
 * <p>Both the transition validator and the milestone projector read from this
 * definition, so the two can never disagree about the graph.</p>
 *
 * <h2>Well-formedness</h2>
 * A definition is checked when built. It is rejected when
 * <ul>
 *   <li>a stage, edge or the initial status belongs to another kind</li>
 *   <li>a status belongs to more than one stage, or stages are out of canonical order</li>
 *   <li>the same (from, to) edge is declared twice</li>
 *   <li>a status cannot be reached from the initial status</li>
 *   <li>a status has no route to a terminal status</li>
 * </ul>
 *
 * <h2>Progress graph</h2>
 * Edges that move forward in canonical order form the progress graph, which is
 * acyclic. Milestone states are computed on it; return edges never count as
 * progress.
 */
@Slf4j
@Getter
public final class QmsLifecycleDefinition {

    private final QmsRecordKind kind;
    private final QmsStatus initialStatus;
    private final List<QmsStageDefinition> stages;
    private final List<QmsTransitionEdge> edges;

    @Getter(AccessLevel.NONE)
    private final Map<QmsStatus, List<QmsTransitionEdge>> outgoing;

    @Getter(AccessLevel.NONE)
    private final Map<QmsStatus, Integer> stageIndexByStatus;

    @Getter(AccessLevel.NONE)
    private final Map<QmsStatus, Set<QmsStatus>> progressReach;

    @Getter(AccessLevel.NONE)
    private final QmsLifecycleGraph progressGraph;

    private QmsLifecycleDefinition(Builder builder) {
        this.kind = builder.kind;
        this.initialStatus = builder.initialStatus != null ? builder.initialStatus : builder.kind.getInitialStatus();
        this.stages = List.copyOf(builder.stages);
        this.edges = List.copyOf(builder.edges);

        List<String> violations = checkWellFormed();
        if (!violations.isEmpty()) {
            log.error("Rejected {} lifecycle definition: {}", kind, violations);
            throw new QmsLifecycleConfigurationException(QmsLifecycleErrorCodes.LIFECYCLE_DEFINITION_INVALID, violations);
        }

        Map<QmsStatus, List<QmsTransitionEdge>> outgoingEdges = new LinkedHashMap<>();
        for (QmsTransitionEdge edge : edges) {
            outgoingEdges.computeIfAbsent(edge.getFrom(), key -> new ArrayList<>()).add(edge);
        }
        Map<QmsStatus, List<QmsTransitionEdge>> frozen = new HashMap<>();
        outgoingEdges.forEach((status, list) -> frozen.put(status, List.copyOf(list)));
        this.outgoing = Map.copyOf(frozen);

        Map<QmsStatus, Integer> indexes = new HashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            for (QmsStatus member : stages.get(i).getMembers()) {
                indexes.put(member, i);
            }
        }
        this.stageIndexByStatus = Map.copyOf(indexes);

        this.progressGraph = new QmsLifecycleGraph(edges.stream().filter(edge -> !edge.isReturn()).toList());
        this.progressReach = Map.copyOf(progressGraph.reachabilityOf(kind.getStatuses()));
        log.debug("Built {} lifecycle definition with {} stages and {} edges", kind, stages.size(), edges.size());
    }

    public static Builder builder(QmsRecordKind kind) {
        return new Builder(kind);
    }

    public List<QmsStatus> getStatuses() {
        return kind.getStatuses();
    }

    public boolean isKnownStatus(QmsStatus status) {
        return status != null && status.getKind() == kind;
    }

    /**
     * Edges leaving {@code from}, in declaration order.
     */
    public List<QmsTransitionEdge> getOutgoingEdges(QmsStatus from) {
        return outgoing.getOrDefault(from, List.of());
    }

    public Optional<QmsTransitionEdge> findEdge(QmsStatus from, QmsStatus to) {
        return getOutgoingEdges(from).stream()
                .filter(edge -> edge.getTo() == to)
                .findFirst();
    }

    public boolean isTerminal(QmsStatus status) {
        return getOutgoingEdges(status).isEmpty();
    }

    public Optional<QmsStageDefinition> findStage(QmsStatus status) {
        Integer index = stageIndexByStatus.get(status);
        return index == null ? Optional.empty() : Optional.of(stages.get(index));
    }

    /**
     * True when {@code to} can be reached from {@code from} along one or more forward edges.
     */
    public boolean isProgressReachable(QmsStatus from, QmsStatus to) {
        return progressReach.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * True when some member of the stage has a forward route to {@code status}.
     */
    public boolean stageLeadsTo(QmsStageDefinition stage, QmsStatus status) {
        return stage.getMembers().stream().anyMatch(member -> isProgressReachable(member, status));
    }

    /**
     * True when {@code status} has a forward route into the stage.
     */
    public boolean statusLeadsTo(QmsStatus status, QmsStageDefinition stage) {
        return stage.getMembers().stream().anyMatch(member -> isProgressReachable(status, member));
    }

    /**
     * True when the dated statuses show that the record reached {@code current} around
     * the stage. That holds when some dated status other than {@code current}:
     * <ul>
     *   <li>is reachable from the initial status without entering the stage,</li>
     *   <li>leads forward to {@code current} with no stage member in between.</li>
     * </ul>
     * A dated status that can only be reached through the stage proves the stage was
     * entered, so the stage is not bypassed then.
     */
    public boolean isStageBypassed(QmsStageDefinition stage, QmsStatus current, Set<QmsStatus> datedStatuses) {
        Set<QmsStatus> around = progressGraph.reachableAvoiding(initialStatus, Set.copyOf(stage.getMembers()));
        if (!around.containsAll(datedStatuses)) {
            return false;
        }
        return datedStatuses.stream()
                .filter(via -> via != current && isProgressReachable(via, current))
                .anyMatch(via -> stage.getMembers().stream()
                        .noneMatch(member -> isProgressReachable(via, member) && isProgressReachable(member, current)));
    }

    /**
     * Date fields consulted for a stage, latest member first. The stage holding the
     * initial status falls back to the record's creation timestamp.
     */
    public List<QmsRecordDateField> getStageDateFields(QmsStageDefinition stage) {
        List<QmsRecordDateField> fields = new ArrayList<>();
        for (QmsStatus member : stage.membersLatestFirst()) {
            member.getEntryDateField().ifPresent(fields::add);
            if (member == initialStatus) {
                fields.add(QmsRecordDateField.CREATED_AT);
            }
        }
        return List.copyOf(fields);
    }

    private List<String> checkWellFormed() {
        List<String> violations = new ArrayList<>();
        if (initialStatus.getKind() != kind) {
            violations.add("initial status " + initialStatus.getValue() + " is not a " + kind + " status");
        }

        Set<String> stageIds = new HashSet<>();
        Map<QmsStatus, String> owners = new HashMap<>();
        int previousMaxOrdinal = -1;
        for (QmsStageDefinition stage : stages) {
            if (!stageIds.add(stage.getId())) {
                violations.add("duplicate stage id " + stage.getId());
            }
            if (stage.getMembers().isEmpty()) {
                violations.add("stage " + stage.getId() + " has no statuses");
                continue;
            }
            int minOrdinal = Integer.MAX_VALUE;
            int maxOrdinal = -1;
            for (QmsStatus member : stage.getMembers()) {
                if (member.getKind() != kind) {
                    violations.add("stage " + stage.getId() + " contains foreign status " + member.getValue());
                }
                String previousOwner = owners.putIfAbsent(member, stage.getId());
                if (previousOwner != null) {
                    violations.add("status " + member.getValue() + " belongs to stages "
                            + previousOwner + " and " + stage.getId());
                }
                minOrdinal = Math.min(minOrdinal, member.ordinal());
                maxOrdinal = Math.max(maxOrdinal, member.ordinal());
            }
            if (minOrdinal <= previousMaxOrdinal) {
                violations.add("stage " + stage.getId() + " is out of canonical status order");
            }
            previousMaxOrdinal = Math.max(previousMaxOrdinal, maxOrdinal);
        }
        if (!owners.containsKey(initialStatus)) {
            violations.add("initial status " + initialStatus.getValue() + " belongs to no stage");
        }

        Set<String> edgeKeys = new HashSet<>();
        for (QmsTransitionEdge edge : edges) {
            if (edge.getKind() != kind) {
                violations.add("edge " + edge.getLabel() + " belongs to " + edge.getKind());
            }
            if (!edgeKeys.add(edge.getFrom().getValue() + "->" + edge.getTo().getValue())) {
                violations.add("duplicate edge " + edge.getFrom().getValue() + " -> " + edge.getTo().getValue());
            }
        }
        if (!violations.isEmpty()) {
            return violations;
        }

        QmsLifecycleGraph graph = new QmsLifecycleGraph(edges);
        Set<QmsStatus> reachable = new HashSet<>(graph.reachableFrom(initialStatus));
        reachable.add(initialStatus);
        List<QmsStatus> terminals = kind.getStatuses().stream()
                .filter(status -> graph.successorsOf(status).isEmpty())
                .toList();
        if (terminals.isEmpty()) {
            violations.add("no terminal status");
        }
        for (QmsStatus status : kind.getStatuses()) {
            if (!reachable.contains(status)) {
                violations.add("status " + status.getValue() + " is unreachable from " + initialStatus.getValue());
            } else if (!terminals.contains(status)
                    && graph.reachableFrom(status).stream().noneMatch(terminals::contains)) {
                violations.add("status " + status.getValue() + " has no route to a terminal status");
            }
        }
        return violations;
    }

    /**
     * Fluent builder for a lifecycle definition.
     *
     * <pre>{@code
     * QmsLifecycleDefinition.builder(QmsRecordKind.NCR)
     *     .stage("draft", "Draft", NcrStatus.DRAFT)
     *     .edge(QmsTransitionEdge.builder().from(NcrStatus.DRAFT).to(NcrStatus.OPEN).label("Open NCR").build())
     *     .build();
     * }</pre>
     */
    public static final class Builder {

        private final QmsRecordKind kind;
        private QmsStatus initialStatus;
        private final List<QmsStageDefinition> stages = new ArrayList<>();
        private final List<QmsTransitionEdge> edges = new ArrayList<>();

        private Builder(QmsRecordKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder initialStatus(QmsStatus initialStatus) {
            this.initialStatus = initialStatus;
            return this;
        }

        public Builder stage(String id, String label, QmsStatus... members) {
            stages.add(new QmsStageDefinition(id, label, List.of(members)));
            return this;
        }

        public Builder edge(QmsTransitionEdge edge) {
            edges.add(Objects.requireNonNull(edge, "edge must not be null"));
            return this;
        }

        public QmsLifecycleDefinition build() {
            return new QmsLifecycleDefinition(this);
        }
    }
}
