package org.neuralchilli.cellflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.cellflow.core.ResultAggregator;
import org.neuralchilli.cellflow.core.StageFunctions;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.worker.CommandStage;

/**
 * Wires the stage functions of the command-line pipeline: every stage runs
 * its configured command except the run-level merge, which concatenates the
 * per-file summaries in process.
 */
@ApplicationScoped
public class StageFunctionsProducer {

    @Inject
    CommandStage commandStage;

    @Inject
    ResultAggregator resultAggregator;

    @Produces
    @Singleton
    public StageFunctions stageFunctions() {
        return StageFunctions.builder()
                .allStages(commandStage)
                .stage(StageName.MERGE_ALL, resultAggregator)
                .build();
    }
}
