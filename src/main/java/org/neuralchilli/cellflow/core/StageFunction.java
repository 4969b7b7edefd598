package org.neuralchilli.cellflow.core;

import org.neuralchilli.cellflow.domain.Artifact;

/**
 * An opaque domain operation backing one stage.
 * Implementations write their result to {@link StageInvocation#output()} and
 * return the artifact handle for it.
 */
@FunctionalInterface
public interface StageFunction {

    Artifact apply(StageInvocation invocation) throws Exception;
}
