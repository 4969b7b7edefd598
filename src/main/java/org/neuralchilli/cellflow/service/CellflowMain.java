package org.neuralchilli.cellflow.service;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.cellflow.core.StageExecutionException;
import org.neuralchilli.cellflow.core.TaskGraphBuilder;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.RunReport;
import org.neuralchilli.cellflow.domain.StageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point:
 * <pre>
 * cellflow &lt;config.yaml&gt; [--force]
 * cellflow batch &lt;config.yaml&gt; &lt;stage&gt; &lt;channel&gt; [--force]
 * </pre>
 * Exits with 0 when every file succeeded (and, for a full run, the summary
 * was written), 1 on failures and 2 on bad arguments.
 */
@QuarkusMain
public class CellflowMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(CellflowMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    static final String BATCH_COMMAND = "batch";

    @Inject
    PipelineService pipelineService;

    @Override
    public int run(String... args) throws Exception {
        boolean batch = args.length > 0 && BATCH_COMMAND.equals(args[0]);
        List<String> positional = new ArrayList<>();
        boolean force = false;

        for (String arg : batch ? Arrays.copyOfRange(args, 1, args.length) : args) {
            if ("--force".equals(arg)) {
                force = true;
            } else if (!arg.startsWith("--")) {
                positional.add(arg);
            } else {
                log.error("Unexpected argument: {}", arg);
                return usage();
            }
        }

        if (positional.size() != (batch ? 3 : 1)) {
            return usage();
        }
        Path configFile = Path.of(positional.get(0));
        if (!Files.isRegularFile(configFile)) {
            log.error("Configuration file not found: {}", configFile);
            return EXIT_USAGE;
        }

        if (batch) {
            return runBatch(configFile, positional.get(1), positional.get(2), force);
        }

        RunReport report = pipelineService.run(configFile, force);
        boolean clean = report.failedFiles().isEmpty() && report.summaryArtifact().isPresent();
        return clean ? EXIT_OK : EXIT_FAILURES;
    }

    private int runBatch(Path configFile, String stageId, String channelArg, boolean force) throws IOException {
        StageName stage;
        int channel;
        try {
            stage = StageName.fromId(stageId);
            channel = Integer.parseInt(channelArg);
        } catch (IllegalArgumentException e) {
            log.error("Invalid batch arguments: {}", e.getMessage());
            return usage();
        }
        if (!TaskGraphBuilder.runsInChannelBatches(stage)) {
            log.error("Stage '{}' does not run per channel", stage.id());
            return usage();
        }

        try {
            List<Map<String, Artifact>> results = pipelineService.runBatch(configFile, stage, channel, force);
            log.info("Batch wrote {} artifacts", results.size());
            return EXIT_OK;
        } catch (StageExecutionException e) {
            log.error("Batch failed: {}", e.getMessage());
            return EXIT_FAILURES;
        }
    }

    private static int usage() {
        log.error("Usage: cellflow <config.yaml> [--force]");
        log.error("       cellflow batch <config.yaml> <stage> <channel> [--force]");
        return EXIT_USAGE;
    }
}
