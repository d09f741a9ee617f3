package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed status graph over a set of edges.
 */
final class QmsLifecycleGraph {

    private final Map<QmsStatus, Set<QmsStatus>> successors = new HashMap<>();

    QmsLifecycleGraph(Collection<QmsTransitionEdge> edges) {
        for (QmsTransitionEdge edge : edges) {
            successors.computeIfAbsent(edge.getFrom(), key -> new LinkedHashSet<>()).add(edge.getTo());
        }
    }

    Set<QmsStatus> successorsOf(QmsStatus status) {
        return successors.getOrDefault(status, Set.of());
    }

    /**
     * Statuses reachable from {@code start} in one or more steps.
     */
    Set<QmsStatus> reachableFrom(QmsStatus start) {
        Set<QmsStatus> visited = new HashSet<>();
        Deque<QmsStatus> queue = new ArrayDeque<>(successorsOf(start));
        while (!queue.isEmpty()) {
            QmsStatus next = queue.poll();
            if (visited.add(next)) {
                queue.addAll(successorsOf(next));
            }
        }
        return visited;
    }

    /**
     * Statuses reachable from {@code start} without entering any of {@code excluded}.
     * The start itself is included unless it is excluded.
     */
    Set<QmsStatus> reachableAvoiding(QmsStatus start, Set<QmsStatus> excluded) {
        Set<QmsStatus> visited = new HashSet<>();
        if (excluded.contains(start)) {
            return visited;
        }
        visited.add(start);
        Deque<QmsStatus> queue = new ArrayDeque<>(successorsOf(start));
        while (!queue.isEmpty()) {
            QmsStatus next = queue.poll();
            if (!excluded.contains(next) && visited.add(next)) {
                queue.addAll(successorsOf(next));
            }
        }
        return visited;
    }

    Map<QmsStatus, Set<QmsStatus>> reachabilityOf(List<QmsStatus> statuses) {
        Map<QmsStatus, Set<QmsStatus>> reach = new HashMap<>();
        for (QmsStatus status : statuses) {
            reach.put(status, Set.copyOf(reachableFrom(status)));
        }
        return reach;
    }
}
