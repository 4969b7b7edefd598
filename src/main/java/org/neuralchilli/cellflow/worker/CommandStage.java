package org.neuralchilli.cellflow.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.cellflow.core.ExpressionEvaluator;
import org.neuralchilli.cellflow.core.StageExecutionException;
import org.neuralchilli.cellflow.core.StageFunction;
import org.neuralchilli.cellflow.core.StageInvocation;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.StageArguments;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs a stage as an external command.
 * <p>
 * The command for each stage comes from the pipeline configuration
 * ({@code stage_commands}); {@code ${file}}, {@code ${output}},
 * {@code ${channel}}, {@code ${reference}}, {@code ${transform}},
 * {@code ${stage}}, {@code ${inputDir}}, {@code ${outputDir}} and
 * {@code ${inputs}} are interpolated before launch. Supports trial-run mode
 * for checking a configuration without executing anything.
 */
@ApplicationScoped
public class CommandStage implements StageFunction {

    private static final Logger log = LoggerFactory.getLogger(CommandStage.class);

    @ConfigProperty(name = "cellflow.stage.trial-run", defaultValue = "false")
    boolean trialRun;

    @ConfigProperty(name = "cellflow.stage.timeout-seconds", defaultValue = "3600")
    int timeoutSeconds;

    @Inject
    ExpressionEvaluator expressionEvaluator;

    @Override
    public Artifact apply(StageInvocation invocation) throws IOException, InterruptedException {
        TaskNode task = invocation.task();
        List<String> template = invocation.config().commandFor(task.stage().id());

        if (template.isEmpty() && !trialRun) {
            throw new StageExecutionException(
                    task.name(), "No command configured for stage '" + task.stage().id() + "'");
        }

        List<String> command = expressionEvaluator.evaluateAll(template, variablesOf(invocation));
        Files.createDirectories(invocation.output().toAbsolutePath().getParent());

        if (trialRun) {
            return executeTrialRun(command, invocation);
        }

        return executeCommand(command, invocation);
    }

    /**
     * Trial run mode - log command without executing and leave a placeholder
     * artifact so downstream stages can be exercised.
     */
    private Artifact executeTrialRun(List<String> command, StageInvocation invocation) throws IOException {
        TaskNode task = invocation.task();

        log.info("TRIAL RUN - Would execute:");
        log.info("  Task: {}", task.name());
        log.info("  Command: {}", String.join(" ", command));
        log.info("  Timeout: {}s", timeoutSeconds);
        log.info("  Output: {}", invocation.output());

        if (task.stage().kind() == StageName.ArtifactKind.TABULAR) {
            String row = String.join(",",
                    invocation.fileId() != null ? invocation.fileId() : "",
                    task.stage().id(),
                    channelOf(invocation.arguments()));
            Files.writeString(invocation.output(), "FileID,stage,channel\n" + row + "\n", StandardCharsets.UTF_8);
        } else {
            Files.write(invocation.output(), new byte[0]);
        }

        return task.artifact();
    }

    /**
     * Execute the actual command via ProcessBuilder.
     * Output goes to a scratch file so the timeout holds even while the
     * command is silent.
     */
    private Artifact executeCommand(List<String> command, StageInvocation invocation)
            throws IOException, InterruptedException {
        TaskNode task = invocation.task();
        log.debug("Executing command for {}: {}", task.name(), String.join(" ", command));

        Path outputLog = Files.createTempFile("cellflow-", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);

            // Redirect stderr to stdout for unified logging
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputLog.toFile());

            Process process = pb.start();

            boolean completed;
            try {
                completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!completed) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                throw new StageExecutionException(
                        task.name(), "Command timed out after " + timeoutSeconds + " seconds");
            }

            String output = new String(Files.readAllBytes(outputLog), StandardCharsets.UTF_8);
            output.lines().forEach(line -> log.info("[{}] {}", task.name(), line));

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new StageExecutionException(
                        task.name(), "Command exited with code " + exitCode + "\n" + output);
            }
        } finally {
            Files.deleteIfExists(outputLog);
        }

        if (!Files.exists(invocation.output())) {
            throw new StageExecutionException(
                    task.name(), "Command succeeded but did not write " + invocation.output());
        }

        return task.artifact();
    }

    private Map<String, Object> variablesOf(StageInvocation invocation) {
        StageArguments arguments = invocation.arguments();
        Map<String, Object> variables = new HashMap<>();

        variables.put("stage", invocation.stage().id());
        variables.put("file", invocation.fileId() != null ? invocation.fileId() : "");
        variables.put("output", invocation.output().toString());
        variables.put("inputDir", invocation.config().inputPath().toString());
        variables.put("outputDir", arguments.outputDir().toString());
        variables.put("channel", channelOf(arguments));
        variables.put("inputs", invocation.inputs().stream()
                .map(artifact -> artifact.path().toString())
                .collect(Collectors.joining(" ")));

        if (arguments instanceof StageArguments.Pair pair) {
            variables.put("reference", pair.pair().reference());
            variables.put("transform", pair.pair().transform());
        }
        if (arguments instanceof StageArguments.Alignment alignment) {
            variables.put("alignmentDir", alignment.alignmentPath().toString());
        }

        return variables;
    }

    private static String channelOf(StageArguments arguments) {
        if (arguments instanceof StageArguments.Channel channel) {
            return String.valueOf(channel.channel());
        }
        if (arguments instanceof StageArguments.Pair pair) {
            return pair.pair().label();
        }
        return "";
    }
}
