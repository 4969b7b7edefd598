package org.neuralchilli.cellflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.cellflow.domain.DagStatistics;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and analyzes task DAGs using JGraphT.
 * Provides cycle-checked edge insertion, dependency lookup and level
 * analysis.
 */
@ApplicationScoped
public class DagService {

    private static final Logger log = LoggerFactory.getLogger(DagService.class);

    public DirectedAcyclicGraph<TaskNode, DefaultEdge> newDag() {
        return new DirectedAcyclicGraph<>(DefaultEdge.class);
    }

    /**
     * Add a task together with the edges from each of its predecessors.
     *
     * @throws IllegalStateException  if a task with the same name exists or a
     *                                predecessor is not in the graph
     * @throws CycleDetectedException if an edge would create a cycle
     */
    public void addTask(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            TaskNode task,
            Collection<TaskNode> predecessors
    ) {
        if (!dag.addVertex(task)) {
            throw new IllegalStateException("Task '" + task.name() + "' is already in the graph");
        }

        for (TaskNode predecessor : predecessors) {
            addDependency(dag, predecessor, task);
        }
    }

    /**
     * Add an edge between two tasks already in the graph.
     *
     * @throws IllegalStateException  if either task is not in the graph
     * @throws CycleDetectedException if the edge would create a cycle
     */
    public void addDependency(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            TaskNode predecessor,
            TaskNode dependent
    ) {
        if (!dag.containsVertex(predecessor)) {
            throw new IllegalStateException(
                    "Task '" + dependent.name() + "' depends on '" + predecessor.name() +
                            "' which does not exist in the graph"
            );
        }
        if (!dag.containsVertex(dependent)) {
            throw new IllegalStateException("Task '" + dependent.name() + "' is not in the graph");
        }

        try {
            // Edge direction: from dependency to dependent
            dag.addEdge(predecessor, dependent);
            log.trace("Added edge: {} -> {}", predecessor.name(), dependent.name());
        } catch (IllegalArgumentException e) {
            // JGraphT throws this if adding the edge would create a cycle
            throw new CycleDetectedException(
                    "Adding dependency '" + predecessor.name() + "' -> '" + dependent.name() +
                            "' would create a cycle in the graph", e
            );
        }
    }

    /**
     * Immediate predecessors of a task, in edge insertion order.
     */
    public Set<TaskNode> getDependencies(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            TaskNode node
    ) {
        return dag.incomingEdgesOf(node).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<TaskNode> getRootTasks(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag
    ) {
        return dag.vertexSet().stream()
                .filter(node -> dag.incomingEdgesOf(node).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<TaskNode> getLeafTasks(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag
    ) {
        return dag.vertexSet().stream()
                .filter(node -> dag.outgoingEdgesOf(node).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Group tasks into levels; tasks on one level have no dependencies on
     * each other and could run in parallel.
     */
    public List<Set<TaskNode>> getExecutionLevels(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag
    ) {
        List<Set<TaskNode>> levels = new ArrayList<>();
        Set<TaskNode> processed = new HashSet<>();
        Set<TaskNode> remaining = new LinkedHashSet<>(dag.vertexSet());

        while (!remaining.isEmpty()) {
            Set<TaskNode> currentLevel = new LinkedHashSet<>();

            for (TaskNode node : remaining) {
                if (processed.containsAll(getDependencies(dag, node))) {
                    currentLevel.add(node);
                }
            }

            if (currentLevel.isEmpty()) {
                // Should not happen in a valid DAG
                throw new IllegalStateException(
                        "Could not determine execution levels - possible cycle or invalid state"
                );
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }

        log.debug("Graph has {} execution levels", levels.size());
        return levels;
    }

    public DagStatistics getStatistics(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag
    ) {
        List<Set<TaskNode>> levels = getExecutionLevels(dag);

        return new DagStatistics(
                dag.vertexSet().size(),
                getRootTasks(dag).size(),
                getLeafTasks(dag).size(),
                levels.size(),
                levels.stream().mapToInt(Set::size).max().orElse(0)
        );
    }
}
