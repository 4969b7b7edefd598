package org.neuralchilli.cellflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.cellflow.config.ChannelPair;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.config.SegmentationSelection;
import org.neuralchilli.cellflow.domain.LoadedModel;
import org.neuralchilli.cellflow.domain.StageArguments;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the task DAG of a run from the configuration and the file list.
 * <p>
 * Every file gets its own branch rooted at preprocessing; optional stages
 * that are disabled add no tasks. A task always depends on the terminal task
 * of each upstream branch, never on a task inside a multi-step chain. One
 * run-level merge depends on every file's merge.
 */
@ApplicationScoped
public class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    @Inject
    CacheKeyGenerator cacheKeyGenerator;

    @Inject
    DagService dagService;

    /**
     * Build the graph for all files.
     *
     * @param gate gate handed to accelerator-bound tasks; required when the
     *             configuration enables the accelerator, ignored otherwise
     * @throws InvalidTaskException   if a stage function is missing or an
     *                                argument cannot be hashed
     * @throws CycleDetectedException if wiring produced a cycle
     */
    public TaskGraph build(
            PipelineConfig config,
            List<String> fileIds,
            StageFunctions functions,
            ResourceGate gate
    ) {
        if (config == null || fileIds == null || functions == null) {
            throw new IllegalArgumentException("Configuration, file list and stage functions are required");
        }
        if (config.acceleratorEnabled() && gate == null) {
            throw new IllegalArgumentException("Accelerator is enabled but no resource gate was provided");
        }
        Set<String> distinct = new HashSet<>(fileIds);
        if (distinct.size() != fileIds.size()) {
            throw new IllegalArgumentException("File list contains duplicate file ids: " + fileIds);
        }

        log.debug("Building task graph for {} files", fileIds.size());

        DirectedAcyclicGraph<TaskNode, DefaultEdge> dag = dagService.newDag();
        ResourceGate acceleratorGate = config.acceleratorEnabled() ? gate : null;

        // One model per channel, shared by every file
        Map<Integer, LoadedModel> otherModels = config.otherSegmentationEnabled() && !fileIds.isEmpty()
                ? modelsFor(StageName.SEGMENT_OTHER, config.otherSegmentationChannels(), functions)
                : Map.of();
        Map<Integer, LoadedModel> detectModels = !fileIds.isEmpty()
                ? modelsFor(StageName.DETECT, config.detectChannels(), functions)
                : Map.of();

        List<FileBranch> branches = new ArrayList<>();
        for (String fileId : fileIds) {
            branches.add(buildBranch(dag, fileId, config, functions, acceleratorGate, otherModels, detectModels));
        }

        TaskNode globalMerge = null;
        if (!branches.isEmpty()) {
            StageArguments.Summary arguments = new StageArguments.Summary(config.outputPath(), config, fileIds);
            globalMerge = newTask(
                    StageName.MERGE_ALL.id(),
                    StageName.MERGE_ALL,
                    null,
                    arguments,
                    ArtifactLayout.forRun(config.outputPath(), StageName.MERGE_ALL),
                    functions
            );
            dagService.addTask(dag, globalMerge, branches.stream()
                    .map(FileBranch::merge)
                    .collect(Collectors.toList()));
        }

        TaskGraph graph = new TaskGraph(dag, branches, globalMerge, dagService);
        log.info("Task graph built: {} files, {}", fileIds.size(), dagService.getStatistics(dag));
        return graph;
    }

    /**
     * The file-independent alignment task. It is not part of the file graph:
     * it has to finish before any file is processed.
     */
    public TaskNode alignmentTask(PipelineConfig config, StageFunctions functions) {
        if (!config.alignmentEnabled()) {
            throw new IllegalStateException("Alignment is not enabled in this configuration");
        }
        StageArguments.Alignment arguments =
                new StageArguments.Alignment(config.alignmentPath(), config.outputPath(), config);
        return newTask(
                StageName.ALIGN.id(),
                StageName.ALIGN,
                null,
                arguments,
                ArtifactLayout.forRun(config.outputPath(), StageName.ALIGN),
                functions
        );
    }

    /**
     * One task per file for a single channel of a channel-level stage, all
     * sharing {@code gate} and one model. Used for batch runs outside the
     * file graph; the tasks have no predecessors.
     *
     * @param gate gate for the batch; applied only if the stage is
     *             accelerator-bound
     */
    public List<TaskNode> channelBatch(
            StageName stage,
            int channel,
            PipelineConfig config,
            List<String> fileIds,
            StageFunctions functions,
            ResourceGate gate
    ) {
        if (!runsInChannelBatches(stage)) {
            throw new IllegalArgumentException("Stage '" + stage.id() + "' does not run per channel in batches");
        }
        if (stage.isAcceleratorBound() && gate == null) {
            throw new IllegalArgumentException("Stage '" + stage.id() + "' needs a resource gate");
        }

        LoadedModel model = functions.modelFor(stage, channel);
        List<TaskNode> tasks = new ArrayList<>();
        for (String fileId : fileIds) {
            tasks.add(channelTask(stage, fileId, channel, config, gate, model, functions));
        }
        log.debug("Batch of {} {} tasks for channel {}", tasks.size(), stage.id(), channel);
        return tasks;
    }

    /**
     * Whether {@code stage} can run as a per-channel batch.
     */
    public static boolean runsInChannelBatches(StageName stage) {
        return stage == StageName.DETECT || stage == StageName.SEGMENT_OTHER;
    }

    private static Map<Integer, LoadedModel> modelsFor(
            StageName stage,
            List<Integer> channels,
            StageFunctions functions
    ) {
        if (channels.isEmpty()) {
            return Map.of();
        }
        Map<Integer, LoadedModel> models = new LinkedHashMap<>();
        for (int channel : channels) {
            models.put(channel, functions.modelFor(stage, channel));
        }
        return models;
    }

    private FileBranch buildBranch(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            ResourceGate gate,
            Map<Integer, LoadedModel> otherModels,
            Map<Integer, LoadedModel> detectModels
    ) {
        TaskNode preprocess = fileTask(StageName.PREPROCESS, fileId, config, null, functions);
        dagService.addTask(dag, preprocess, List.of());

        List<TaskNode> cells = cellSegmentation(dag, fileId, config, functions, gate, preprocess);
        List<TaskNode> other = otherSegmentation(dag, fileId, config, functions, gate, otherModels, preprocess);
        Map<Integer, TaskNode> detection = detection(dag, fileId, config, functions, gate, detectModels, preprocess);
        Map<Integer, TaskNode> tracking = tracking(dag, fileId, config, functions, detection);
        List<TaskNode> colocalization = colocalization(
                dag, fileId, config, functions, tracking.isEmpty() ? detection : tracking);

        List<TaskNode> spotTerminals = new ArrayList<>(
                tracking.isEmpty() ? detection.values() : tracking.values());

        Set<TaskNode> mergeDependencies = new LinkedHashSet<>();
        mergeDependencies.addAll(spotTerminals);
        mergeDependencies.addAll(colocalization);
        mergeDependencies.add(cells.get(cells.size() - 1));
        mergeDependencies.addAll(other);

        TaskNode merge = fileTask(StageName.MERGE_SINGLE, fileId, config, null, functions);
        dagService.addTask(dag, merge, mergeDependencies);

        log.debug("Branch for {}: {} cell, {} other, {} detect, {} track, {} coloc tasks",
                fileId, cells.size(), other.size(), detection.size(), tracking.size(), colocalization.size());

        return new FileBranch(
                fileId,
                preprocess,
                cells,
                other,
                new ArrayList<>(detection.values()),
                new ArrayList<>(tracking.values()),
                colocalization,
                merge
        );
    }

    private List<TaskNode> cellSegmentation(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            ResourceGate gate,
            TaskNode preprocess
    ) {
        if (!config.dualPassSegmentation()) {
            StageName stage = config.selection() == SegmentationSelection.BOTH
                    ? StageName.SEGMENT_CELLS_BOTH
                    : StageName.SEGMENT_CELLS_SINGLE;
            TaskNode single = fileTask(stage, fileId, config, gate, functions);
            dagService.addTask(dag, single, List.of(preprocess));
            return List.of(single);
        }

        // predict -> merge -> dilate
        TaskNode predict = fileTask(StageName.SEGMENT_CELLS_PREDICT, fileId, config, gate, functions);
        dagService.addTask(dag, predict, List.of(preprocess));

        TaskNode merge = fileTask(StageName.SEGMENT_CELLS_MERGE, fileId, config, gate, functions);
        dagService.addTask(dag, merge, List.of(predict));

        TaskNode dilate = fileTask(StageName.DILATE_CELLS, fileId, config, gate, functions);
        dagService.addTask(dag, dilate, List.of(merge));

        return List.of(predict, merge, dilate);
    }

    private List<TaskNode> otherSegmentation(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            ResourceGate gate,
            Map<Integer, LoadedModel> models,
            TaskNode preprocess
    ) {
        if (!config.otherSegmentationEnabled()) {
            return List.of();
        }

        List<TaskNode> tasks = new ArrayList<>();
        for (int channel : config.otherSegmentationChannels()) {
            TaskNode task = channelTask(StageName.SEGMENT_OTHER, fileId, channel, config, gate,
                    models.get(channel), functions);
            dagService.addTask(dag, task, List.of(preprocess));
            tasks.add(task);
        }
        return tasks;
    }

    private Map<Integer, TaskNode> detection(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            ResourceGate gate,
            Map<Integer, LoadedModel> models,
            TaskNode preprocess
    ) {
        Map<Integer, TaskNode> tasks = new LinkedHashMap<>();
        for (int channel : config.detectChannels()) {
            TaskNode task = channelTask(StageName.DETECT, fileId, channel, config, gate,
                    models.get(channel), functions);
            dagService.addTask(dag, task, List.of(preprocess));
            tasks.put(channel, task);
        }
        return tasks;
    }

    private Map<Integer, TaskNode> tracking(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            Map<Integer, TaskNode> detection
    ) {
        if (!config.trackingEnabled()) {
            return Map.of();
        }

        Map<Integer, TaskNode> tasks = new LinkedHashMap<>();
        for (Map.Entry<Integer, TaskNode> entry : detection.entrySet()) {
            TaskNode task = channelTask(StageName.TRACK, fileId, entry.getKey(), config, null, null, functions);
            dagService.addTask(dag, task, List.of(entry.getValue()));
            tasks.put(entry.getKey(), task);
        }
        return tasks;
    }

    private List<TaskNode> colocalization(
            DirectedAcyclicGraph<TaskNode, DefaultEdge> dag,
            String fileId,
            PipelineConfig config,
            StageFunctions functions,
            Map<Integer, TaskNode> spotsByChannel
    ) {
        if (!config.colocalizationEnabled()) {
            return List.of();
        }

        StageName stage = config.timeSeries() ? StageName.COLOCALIZE_TRACK : StageName.COLOCALIZE_FRAME;
        List<TaskNode> tasks = new ArrayList<>();
        for (ChannelPair pair : config.colocalizationChannels()) {
            StageArguments.Pair arguments = new StageArguments.Pair(fileId, config.outputPath(), config, pair);
            TaskNode task = newTask(
                    stage.id() + "[" + pair.label() + "]:" + fileId,
                    stage,
                    fileId,
                    arguments,
                    ArtifactLayout.forPair(config.outputPath(), stage, pair, fileId),
                    functions
            );

            Set<TaskNode> dependencies = new LinkedHashSet<>();
            dependencies.add(spotsOf(spotsByChannel, pair.reference(), task));
            dependencies.add(spotsOf(spotsByChannel, pair.transform(), task));
            dagService.addTask(dag, task, dependencies);
            tasks.add(task);
        }
        return tasks;
    }

    private TaskNode spotsOf(Map<Integer, TaskNode> spotsByChannel, int channel, TaskNode dependent) {
        TaskNode spots = spotsByChannel.get(channel);
        if (spots == null) {
            throw new InvalidTaskException(
                    "Task '" + dependent.name() + "' needs spots of channel " + channel
                            + " but that channel is not detected"
            );
        }
        return spots;
    }

    private TaskNode fileTask(
            StageName stage,
            String fileId,
            PipelineConfig config,
            ResourceGate gate,
            StageFunctions functions
    ) {
        ResourceGate taskGate = stage.isAcceleratorBound() ? gate : null;
        StageArguments.File arguments = new StageArguments.File(fileId, config.outputPath(), config, taskGate);
        return newTask(
                stage.id() + ":" + fileId,
                stage,
                fileId,
                arguments,
                ArtifactLayout.forFile(config.outputPath(), stage, fileId),
                functions
        );
    }

    private TaskNode channelTask(
            StageName stage,
            String fileId,
            int channel,
            PipelineConfig config,
            ResourceGate gate,
            LoadedModel model,
            StageFunctions functions
    ) {
        ResourceGate taskGate = stage.isAcceleratorBound() ? gate : null;
        StageArguments.Channel arguments = new StageArguments.Channel(
                fileId, config.outputPath(), config, channel, taskGate, model);
        return newTask(
                stage.id() + "[c" + channel + "]:" + fileId,
                stage,
                fileId,
                arguments,
                ArtifactLayout.forChannel(config.outputPath(), stage, channel, fileId),
                functions
        );
    }

    private TaskNode newTask(
            String name,
            StageName stage,
            String fileId,
            StageArguments arguments,
            Path output,
            StageFunctions functions
    ) {
        return new TaskNode(
                name,
                stage,
                fileId,
                arguments,
                cacheKeyGenerator.keyFor(arguments),
                output,
                functions.functionFor(stage)
        );
    }
}
