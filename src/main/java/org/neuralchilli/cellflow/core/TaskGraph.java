package org.neuralchilli.cellflow.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskNode;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The complete task DAG of one run, built before anything is submitted.
 * Holds the JGraphT graph plus an index of each file's branch and the
 * run-level merge task.
 */
public final class TaskGraph {

    private final DirectedAcyclicGraph<TaskNode, DefaultEdge> dag;
    private final Map<String, FileBranch> branches;
    private final TaskNode globalMerge;
    private final DagService dagService;

    TaskGraph(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            List<FileBranch> branches,
            TaskNode globalMerge,
            DagService dagService
    ) {
        this.dag = dag;
        this.dagService = dagService;
        this.branches = new LinkedHashMap<>();
        for (FileBranch branch : branches) {
            this.branches.put(branch.fileId(), branch);
        }
        this.globalMerge = globalMerge;
    }

    /**
     * Branches in file order.
     */
    public List<FileBranch> branches() {
        return List.copyOf(branches.values());
    }

    public FileBranch branch(String fileId) {
        FileBranch branch = branches.get(fileId);
        if (branch == null) {
            throw new IllegalArgumentException("No branch for file: " + fileId);
        }
        return branch;
    }

    public List<String> fileIds() {
        return List.copyOf(branches.keySet());
    }

    /**
     * Run-level merge, absent when the run has no input files.
     */
    public Optional<TaskNode> globalMerge() {
        return Optional.ofNullable(globalMerge);
    }

    public Set<TaskNode> tasks() {
        return dag.vertexSet();
    }

    public int size() {
        return dag.vertexSet().size();
    }

    /**
     * Immediate predecessors of a task, in the order the builder wired them.
     */
    public List<TaskNode> predecessorsOf(TaskNode task) {
        return List.copyOf(dagService.getDependencies(dag, task));
    }

    public List<TaskNode> tasksOfStage(StageName stage) {
        return dag.vertexSet().stream()
                .filter(task -> task.stage() == stage)
                .collect(Collectors.toList());
    }

    public Optional<TaskNode> findTask(String name) {
        return dag.vertexSet().stream()
                .filter(task -> task.name().equals(name))
                .findFirst();
    }

    @Nonnull
    @Override
    public String toString() {
        return "TaskGraph[files=" + branches.size() + ", tasks=" + size() +
                ", edges=" + dag.edgeSet().size() + "]";
    }
}
