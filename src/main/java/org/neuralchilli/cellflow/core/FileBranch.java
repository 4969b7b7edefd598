package org.neuralchilli.cellflow.core;

import org.neuralchilli.cellflow.domain.TaskNode;

import java.util.ArrayList;
import java.util.List;

/**
 * All tasks built for one input file, grouped by stage family.
 * Lists are empty for disabled stages.
 */
public record FileBranch(
        String fileId,
        TaskNode preprocess,
        List<TaskNode> cellSegmentation,
        List<TaskNode> otherSegmentation,
        List<TaskNode> detection,
        List<TaskNode> tracking,
        List<TaskNode> colocalization,
        TaskNode merge
) {
    public FileBranch {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("File id cannot be null or empty");
        }
        if (preprocess == null || merge == null) {
            throw new IllegalArgumentException("Branch of " + fileId + " needs preprocess and merge tasks");
        }
        if (cellSegmentation == null || cellSegmentation.isEmpty()) {
            throw new IllegalArgumentException("Branch of " + fileId + " needs a cell segmentation task");
        }
        cellSegmentation = List.copyOf(cellSegmentation);
        otherSegmentation = otherSegmentation != null ? List.copyOf(otherSegmentation) : List.of();
        detection = detection != null ? List.copyOf(detection) : List.of();
        tracking = tracking != null ? List.copyOf(tracking) : List.of();
        colocalization = colocalization != null ? List.copyOf(colocalization) : List.of();
    }

    /**
     * Last task of the cell segmentation chain.
     */
    public TaskNode cellSegmentationTerminal() {
        return cellSegmentation.get(cellSegmentation.size() - 1);
    }

    /**
     * Every task of the file in the order it was added to the graph, which is
     * a valid execution order.
     */
    public List<TaskNode> tasks() {
        List<TaskNode> all = new ArrayList<>();
        all.add(preprocess);
        all.addAll(cellSegmentation);
        all.addAll(otherSegmentation);
        all.addAll(detection);
        all.addAll(tracking);
        all.addAll(colocalization);
        all.add(merge);
        return all;
    }
}
