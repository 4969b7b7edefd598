package org.neuralchilli.cellflow.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.core.BufferedDrainer;
import org.neuralchilli.cellflow.core.ResourceGate;
import org.neuralchilli.cellflow.core.StageExecutionException;
import org.neuralchilli.cellflow.core.StageFunctions;
import org.neuralchilli.cellflow.core.TaskGraphBuilder;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskExecution;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one channel of a channel-level stage over every file as a sub-flow.
 * <p>
 * Each batch gets its own {@link ResourceGate} and loads the channel's model
 * once. Handles are drained every {@code cellflow.buffer.max-length} files.
 */
@ApplicationScoped
public class ChannelBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(ChannelBatchRunner.class);

    @Inject
    TaskGraphBuilder taskGraphBuilder;

    @Inject
    PipelineExecutor pipelineExecutor;

    @Inject
    BufferedDrainer drainer;

    @ConfigProperty(name = "cellflow.buffer.max-length", defaultValue = "6")
    int maxBufferLength;

    @ConfigProperty(name = "cellflow.gate.permits", defaultValue = "1")
    int gatePermits;

    /**
     * Run {@code stage} for {@code channel} on every file.
     *
     * @return one {@code {"<stage>_c<channel>": artifact}} entry per file, in
     * file order
     * @throws StageExecutionException if any file fails
     */
    public List<Map<String, Artifact>> run(
            StageName stage,
            int channel,
            PipelineConfig config,
            List<String> fileIds,
            StageFunctions functions,
            boolean force
    ) {
        String key = stage.id() + "_c" + channel;
        ResourceGate gate = new ResourceGate(key, gatePermits);
        List<TaskNode> tasks = taskGraphBuilder.channelBatch(stage, channel, config, fileIds, functions, gate);

        log.info("Running {} over {} files (gate capacity {})", key, tasks.size(), gate.capacity());

        Map<String, TaskExecution> executions = new ConcurrentHashMap<>();
        List<Map<String, Artifact>> results = new ArrayList<>();
        List<CompletableFuture<Artifact>> buffer = new ArrayList<>();
        try {
            for (TaskNode task : tasks) {
                buffer.add(pipelineExecutor.submit(task, force, executions));
                drainer.drain(results, buffer, maxBufferLength, artifact -> Map.of(key, artifact));
            }
            drainer.drain(results, buffer, 0, artifact -> Map.of(key, artifact));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException(null, "Batch " + key + " interrupted", e);
        }

        log.info("Batch {} finished: {} artifacts ({} reused)", key, results.size(),
                executions.values().stream().filter(TaskExecution::cached).count());
        return results;
    }
}
