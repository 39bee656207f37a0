/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.aggregation.KernelParameterAveragingAggregator;
import com.ammann.fedstats.aggregation.LinearMetaAnalysisAggregator;
import com.ammann.fedstats.fit.KernelRegressionFitter;
import com.ammann.fedstats.fit.LinearCovariateFitter;
import com.ammann.fedstats.lifecycle.FederatedTask;
import com.ammann.fedstats.lifecycle.KernelRegressionTask;
import com.ammann.fedstats.lifecycle.LinearCovariateTask;
import com.ammann.fedstats.lifecycle.PriorRoundArtifacts;
import com.ammann.fedstats.lifecycle.SiteDataPreparer;
import com.ammann.fedstats.model.ModelSpecification;
import com.ammann.fedstats.store.ArtifactStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Creates a fresh task instance for one round, selected by the task's model kind.
 */
@ApplicationScoped
public class FederatedTaskFactory {

    @Inject DatasetSource datasetSource;

    @Inject ArtifactStore store;

    @ConfigProperty(name = "federation.privacy.min-sample-size", defaultValue = "30")
    int minSampleSize = 30;

    @ConfigProperty(name = "federation.split.test-fraction", defaultValue = "0.2")
    double testFraction = 0.2;

    @ConfigProperty(name = "federation.split.seed", defaultValue = "42")
    long splitSeed = 42L;

    public FederatedTask<?, ?> create(ModelSpecification specification) {
        SiteDataPreparer preparer = new SiteDataPreparer(datasetSource, minSampleSize, testFraction, splitSeed);
        PriorRoundArtifacts priorRound = new PriorRoundArtifacts(store);
        return switch (specification.modelKind()) {
            case LINEAR_COVARIATE -> new LinearCovariateTask(preparer, priorRound,
                    new LinearCovariateFitter(), new LinearMetaAnalysisAggregator());
            case KERNEL_REGRESSION -> new KernelRegressionTask(preparer, priorRound,
                    new KernelRegressionFitter(), new KernelParameterAveragingAggregator());
        };
    }
}
