/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.aggregation.LinearMetaAnalysisAggregator;
import com.ammann.fedstats.dto.LinearGlobalStatisticsDTO;
import com.ammann.fedstats.dto.LinearLocalStatisticsDTO;
import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.fit.LinearCovariateFitter;
import com.ammann.fedstats.model.TrainTestSplit;
import java.util.Collection;
import org.jboss.logging.Logger;

/**
 * Covariate-adjusted group comparison: local OLS, pooled by inverse-variance meta-analysis.
 * <p>
 * The local payload reports the training-partition size as its sample size.
 */
public final class LinearCovariateTask
        implements FederatedTask<LinearLocalStatisticsDTO, LinearGlobalStatisticsDTO> {

    private static final Logger LOG = Logger.getLogger(LinearCovariateTask.class);

    private final SiteDataPreparer dataPreparer;
    private final PriorRoundArtifacts priorRound;
    private final LinearCovariateFitter fitter;
    private final LinearMetaAnalysisAggregator aggregator;

    private TrainTestSplit split;

    public LinearCovariateTask(SiteDataPreparer dataPreparer, PriorRoundArtifacts priorRound,
            LinearCovariateFitter fitter, LinearMetaAnalysisAggregator aggregator) {
        this.dataPreparer = dataPreparer;
        this.priorRound = priorRound;
        this.fitter = fitter;
        this.aggregator = aggregator;
    }

    @Override
    public ModelKind modelKind() {
        return ModelKind.LINEAR_COVARIATE;
    }

    @Override
    public Class<LinearLocalStatisticsDTO> localPayloadType() {
        return LinearLocalStatisticsDTO.class;
    }

    @Override
    public void prepareData(RoundContext context) {
        split = dataPreparer.prepare(context);
    }

    @Override
    public void validate(RoundContext context) {
        int groupColumns = context.specification().nGroupColumns();
        if (groupColumns > split.train().featureCount()) {
            LOG.warnf("%s: n_group_columns = %d exceeds the %d feature columns, partial eta-squared will be 0",
                    context, groupColumns, split.train().featureCount());
        }
        priorRound.previousGlobal(context);
    }

    @Override
    public LinearLocalStatisticsDTO training(RoundContext context) {
        return fitter.fit(split.train(), context.specification().nGroupColumns());
    }

    @Override
    public LinearGlobalStatisticsDTO aggregate(Collection<LinearLocalStatisticsDTO> payloads) {
        return aggregator.aggregate(payloads);
    }
}
