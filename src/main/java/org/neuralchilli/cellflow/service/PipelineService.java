package org.neuralchilli.cellflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.cellflow.config.ConfigParser;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.core.ResourceGate;
import org.neuralchilli.cellflow.core.StageExecutionException;
import org.neuralchilli.cellflow.core.StageFunctions;
import org.neuralchilli.cellflow.core.TaskGraph;
import org.neuralchilli.cellflow.core.TaskGraphBuilder;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.FileOutcome;
import org.neuralchilli.cellflow.domain.RunReport;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskExecution;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.neuralchilli.cellflow.domain.TaskStatus;
import org.neuralchilli.cellflow.worker.ChannelBatchRunner;
import org.neuralchilli.cellflow.worker.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the pipeline for one configuration file.
 * <p>
 * File-independent work (run metadata, alignment) happens first; alignment
 * must finish before any file is processed. The input files are then
 * discovered, turned into a task graph and executed. A single channel of a
 * per-channel stage can also be run on its own as a batch.
 */
@ApplicationScoped
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    @Inject
    ConfigParser configParser;

    @Inject
    FileDiscovery fileDiscovery;

    @Inject
    RunMetadataWriter runMetadataWriter;

    @Inject
    TaskGraphBuilder taskGraphBuilder;

    @Inject
    PipelineExecutor pipelineExecutor;

    @Inject
    ChannelBatchRunner channelBatchRunner;

    @Inject
    StageFunctions stageFunctions;

    @ConfigProperty(name = "cellflow.gate.permits", defaultValue = "1")
    int gatePermits;

    /**
     * Run the pipeline.
     *
     * @param force recompute every task even if cached artifacts match
     * @throws IOException             if the configuration or input directory
     *                                 cannot be read
     * @throws StageExecutionException if alignment fails
     */
    public RunReport run(Path configFile, boolean force) throws IOException {
        log.info("Starting run for {} (force: {})", configFile, force);

        PipelineConfig config = configParser.parse(configFile);
        runMetadataWriter.write(config, configFile);

        Map<String, TaskExecution> executions = new ConcurrentHashMap<>();
        if (config.alignmentEnabled()) {
            align(config, force, executions);
        }

        List<String> fileIds = fileDiscovery.discover(config);
        if (fileIds.isEmpty()) {
            log.warn("No files matching '{}' in {}", config.filePattern(), config.inputPath());
        }

        ResourceGate gate = config.acceleratorEnabled()
                ? new ResourceGate("accelerator", gatePermits)
                : null;

        TaskGraph graph = taskGraphBuilder.build(config, fileIds, stageFunctions, gate);
        RunReport report = pipelineExecutor.execute(graph, force, executions);

        logSummary(report);
        return report;
    }

    /**
     * Run one channel of a per-channel stage over every input file, outside
     * the file graph.
     *
     * @return one {@code {"<stage>_c<channel>": artifact}} entry per file
     * @throws IOException             if the configuration or input directory
     *                                 cannot be read
     * @throws StageExecutionException if any file fails
     */
    public List<Map<String, Artifact>> runBatch(Path configFile, StageName stage, int channel, boolean force)
            throws IOException {
        log.info("Starting {} batch for channel {} from {} (force: {})", stage.id(), channel, configFile, force);

        PipelineConfig config = configParser.parse(configFile);
        List<String> fileIds = fileDiscovery.discover(config);
        if (fileIds.isEmpty()) {
            log.warn("No files matching '{}' in {}", config.filePattern(), config.inputPath());
        }

        return channelBatchRunner.run(stage, channel, config, fileIds, stageFunctions, force);
    }

    private void align(PipelineConfig config, boolean force, Map<String, TaskExecution> executions) {
        TaskNode alignment = taskGraphBuilder.alignmentTask(config, stageFunctions);
        log.info("Aligning with {}", config.alignmentPath());
        try {
            pipelineExecutor.submit(alignment, force, executions).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StageExecutionException(
                    alignment.name(), "Alignment failed, no file was processed: " + cause.getMessage(), cause);
        }
    }

    private void logSummary(RunReport report) {
        for (FileOutcome outcome : report.files()) {
            if (outcome.isSuccess()) {
                log.info("  {} ... done", outcome.fileId());
            } else {
                log.error("  {} ... failed: {}", outcome.fileId(), outcome.error().orElse("unknown error"));
            }
        }

        log.info("Run finished in {}ms: {} files succeeded, {} failed, {} tasks completed ({} cached), {} failed, {} skipped",
                report.duration().toMillis(),
                report.succeededFiles().size(),
                report.failedFiles().size(),
                report.countByStatus(TaskStatus.COMPLETED),
                report.cachedTasks(),
                report.countByStatus(TaskStatus.FAILED),
                report.countByStatus(TaskStatus.SKIPPED));

        report.summaryArtifact().ifPresentOrElse(
                summary -> log.info("Summary written to {}", summary.path()),
                () -> log.warn("No summary was written"));
    }
}
