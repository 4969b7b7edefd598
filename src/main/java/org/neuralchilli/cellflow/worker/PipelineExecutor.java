package org.neuralchilli.cellflow.worker;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.cellflow.core.BufferedDrainer;
import org.neuralchilli.cellflow.core.FileBranch;
import org.neuralchilli.cellflow.core.StageExecutionException;
import org.neuralchilli.cellflow.core.StageInvocation;
import org.neuralchilli.cellflow.core.TaskGraph;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.FileOutcome;
import org.neuralchilli.cellflow.domain.RunReport;
import org.neuralchilli.cellflow.domain.TaskExecution;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Executes a task graph on a fixed pool of worker threads.
 * <p>
 * A task is submitted as soon as its file is admitted and starts once every
 * predecessor has completed; a failure stops the dependents in that file and
 * nothing else. Files are admitted through the {@link BufferedDrainer}, so at
 * most {@code cellflow.buffer.max-length} files are in flight. The run-level
 * merge runs last, over the files whose merge succeeded.
 */
@ApplicationScoped
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    @Inject
    BufferedDrainer drainer;

    @Inject
    ArtifactCache artifactCache;

    @ConfigProperty(name = "cellflow.executor.worker-threads", defaultValue = "4")
    int defaultWorkerThreads;

    @ConfigProperty(name = "cellflow.buffer.max-length", defaultValue = "6")
    int maxBufferLength;

    @ConfigProperty(name = "cellflow.executor.worker-id", defaultValue = "cellflow")
    String workerId;

    private ExecutorService executorService;
    private volatile boolean running = false;

    /**
     * Start the worker pool with the given thread count.
     */
    public synchronized void start(int threads) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Worker threads must be >= 1, got: " + threads);
        }

        this.executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(workerId));
        this.running = true;

        log.info("Worker pool started: {} threads, worker ID: {}", threads, workerId);
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Stop the worker pool gracefully.
     * Allows in-flight tasks to complete.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool gracefully...");
        running = false;

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Worker pool stopped");
    }

    /**
     * Run every task of {@code graph}.
     *
     * @param force recompute every task even if a cached artifact matches
     * @throws StageExecutionException if the run is interrupted
     */
    public RunReport execute(TaskGraph graph, boolean force) {
        return execute(graph, force, new ConcurrentHashMap<>());
    }

    /**
     * Run every task of {@code graph}, recording statuses into
     * {@code executions}. Entries already present, such as a finished
     * alignment, are kept and end up in the report.
     */
    public RunReport execute(TaskGraph graph, boolean force, Map<String, TaskExecution> executions) {
        if (!running) {
            start(defaultWorkerThreads);
        }

        Instant started = Instant.now();
        for (TaskNode task : graph.tasks()) {
            executions.put(task.name(), TaskExecution.pending(task));
        }

        log.info("Executing {} (force: {}, max files in flight: {})", graph, force, maxBufferLength);

        List<FileOutcome> outcomes = new ArrayList<>();
        List<CompletableFuture<FileOutcome>> buffer = new ArrayList<>();
        try {
            for (FileBranch branch : graph.branches()) {
                buffer.add(submitBranch(graph, branch, force, executions));
                drainer.drain(outcomes, buffer, maxBufferLength, Function.identity());
            }
            drainer.drain(outcomes, buffer, 0, Function.identity());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException(null, "Run interrupted while waiting for file results", e);
        }

        Artifact summary = runGlobalMerge(graph, outcomes, executions);
        Duration duration = Duration.between(started, Instant.now());

        return new RunReport(outcomes, summary, new HashMap<>(executions), duration);
    }

    /**
     * Submit a single task without predecessors; its status is tracked in
     * {@code executions}. The returned handle completes with a
     * {@link StageExecutionException} if the task fails.
     */
    public CompletableFuture<Artifact> submit(TaskNode task, boolean force, Map<String, TaskExecution> executions) {
        if (!running) {
            start(defaultWorkerThreads);
        }
        executions.put(task.name(), TaskExecution.pending(task));
        return CompletableFuture.supplyAsync(() -> runTask(task, List.of(), !force, executions), executorService);
    }

    /**
     * Submit every task of one file and return a handle on the file's
     * outcome. The handle never completes exceptionally.
     */
    private CompletableFuture<FileOutcome> submitBranch(
            TaskGraph graph,
            FileBranch branch,
            boolean force,
            Map<String, TaskExecution> executions
    ) {
        log.debug("Submitting {} tasks for {}", branch.tasks().size(), branch.fileId());

        Map<TaskNode, CompletableFuture<Artifact>> futures = new HashMap<>();
        for (TaskNode task : branch.tasks()) {
            List<CompletableFuture<Artifact>> upstream = graph.predecessorsOf(task).stream()
                    .map(futures::get)
                    .collect(Collectors.toList());
            futures.put(task, submitTask(task, upstream, force, executions));
        }

        return futures.get(branch.merge()).handle((merged, error) -> {
            if (error == null) {
                return FileOutcome.success(branch.fileId(), merged);
            }
            String reason = rootCause(error).getMessage();
            log.error("File {} failed: {}", branch.fileId(), reason);
            return FileOutcome.failure(branch.fileId(), reason);
        });
    }

    private CompletableFuture<Artifact> submitTask(
            TaskNode task,
            List<CompletableFuture<Artifact>> upstream,
            boolean force,
            Map<String, TaskExecution> executions
    ) {
        return CompletableFuture.allOf(upstream.toArray(new CompletableFuture<?>[0]))
                .thenApplyAsync(ignored -> {
                    List<Artifact> inputs = upstream.stream()
                            .map(CompletableFuture::join)
                            .collect(Collectors.toList());
                    return runTask(task, inputs, !force, executions);
                }, executorService)
                .whenComplete((artifact, error) -> {
                    if (error != null) {
                        // Tasks that never started were held back by an upstream failure
                        executions.computeIfPresent(task.name(), (name, execution) ->
                                execution.isFinished()
                                        ? execution
                                        : execution.skip("Upstream failure: " + rootCause(error).getMessage()));
                    }
                });
    }

    /**
     * Run one task on the calling thread.
     */
    Artifact runTask(
            TaskNode task,
            List<Artifact> inputs,
            boolean allowCache,
            Map<String, TaskExecution> executions
    ) {
        String threadName = Thread.currentThread().getName();
        executions.computeIfPresent(task.name(), (name, execution) -> execution.start(threadName));
        Instant start = Instant.now();

        try {
            if (allowCache && artifactCache.isReusable(task)) {
                log.info("[{}] Reusing: {} (key {})", threadName, task.name(), task.cacheKey().shortForm());
                Artifact cached = task.artifact();
                executions.computeIfPresent(task.name(), (name, execution) -> execution.complete(cached, true));
                return cached;
            }

            log.info("[{}] Executing: {}", threadName, task.name());
            artifactCache.invalidate(task);

            StageInvocation invocation = new StageInvocation(task, inputs);
            Artifact artifact = task.isGated()
                    ? task.gate().callWithPermit(() -> task.function().apply(invocation))
                    : task.function().apply(invocation);

            artifactCache.record(task);
            executions.computeIfPresent(task.name(), (name, execution) -> execution.complete(artifact, false));
            log.info("[{}] Completed: {} ({}ms)",
                    threadName, task.name(), Duration.between(start, Instant.now()).toMillis());
            return artifact;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executions.computeIfPresent(task.name(), (name, execution) -> execution.fail("Interrupted"));
            throw new StageExecutionException(task.name(), "Task " + task.name() + " interrupted", e);

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[{}] Failed: {} - {}", threadName, task.name(), message, e);
            executions.computeIfPresent(task.name(), (name, execution) -> execution.fail(message));

            if (e instanceof StageExecutionException stageFailure && task.name().equals(stageFailure.taskName())) {
                throw stageFailure;
            }
            throw new StageExecutionException(task.name(), "Task " + task.name() + " failed: " + message, e);
        }
    }

    private Artifact runGlobalMerge(
            TaskGraph graph,
            List<FileOutcome> outcomes,
            Map<String, TaskExecution> executions
    ) {
        Optional<TaskNode> globalMerge = graph.globalMerge();
        if (globalMerge.isEmpty()) {
            log.info("No input files, nothing to merge");
            return null;
        }
        TaskNode merge = globalMerge.get();

        List<Artifact> merged = outcomes.stream()
                .map(FileOutcome::artifact)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        if (merged.isEmpty()) {
            log.error("No file completed successfully, skipping {}", merge.name());
            executions.computeIfPresent(merge.name(), (name, execution) ->
                    execution.skip("No file completed successfully"));
            return null;
        }
        if (merged.size() < outcomes.size()) {
            log.warn("Merging {} of {} files; missing: {}",
                    merged.size(), outcomes.size(),
                    outcomes.stream()
                            .filter(outcome -> !outcome.isSuccess())
                            .map(FileOutcome::fileId)
                            .collect(Collectors.joining(", ")));
        }

        // The summary depends on which files made it, so it is always rebuilt
        try {
            return runTask(merge, merged, false, executions);
        } catch (StageExecutionException e) {
            log.error("Run-level merge failed: {}", e.getMessage());
            return null;
        }
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String workerId;

        WorkerThreadFactory(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(workerId + "-thread-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
