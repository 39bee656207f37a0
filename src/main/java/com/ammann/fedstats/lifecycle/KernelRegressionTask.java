/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.aggregation.KernelParameterAveragingAggregator;
import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.fit.KernelRegressionFitter;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.TrainTestSplit;
import com.ammann.fedstats.model.WarmStartState;
import com.ammann.fedstats.store.PayloadCodec;
import java.util.Collection;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Kernel regression: local epsilon-SVR, pooled by sample-size-weighted parameter averaging.
 * <p>
 * When the previous round belongs to a kernel task, its global payload becomes the warm-start
 * state of this round's fit.
 */
public final class KernelRegressionTask
        implements FederatedTask<KernelStatisticsDTO, KernelStatisticsDTO> {

    private static final Logger LOG = Logger.getLogger(KernelRegressionTask.class);

    private final SiteDataPreparer dataPreparer;
    private final PriorRoundArtifacts priorRound;
    private final KernelRegressionFitter fitter;
    private final KernelParameterAveragingAggregator aggregator;

    private TrainTestSplit split;
    private WarmStartState warmStart;

    public KernelRegressionTask(SiteDataPreparer dataPreparer, PriorRoundArtifacts priorRound,
            KernelRegressionFitter fitter, KernelParameterAveragingAggregator aggregator) {
        this.dataPreparer = dataPreparer;
        this.priorRound = priorRound;
        this.fitter = fitter;
        this.aggregator = aggregator;
    }

    @Override
    public ModelKind modelKind() {
        return ModelKind.KERNEL_REGRESSION;
    }

    @Override
    public Class<KernelStatisticsDTO> localPayloadType() {
        return KernelStatisticsDTO.class;
    }

    @Override
    public void prepareData(RoundContext context) {
        split = dataPreparer.prepare(context);
    }

    @Override
    public void validate(RoundContext context) {
        Optional<String> previousGlobal = priorRound.previousGlobal(context);
        if (previousGlobal.isEmpty()) {
            return;
        }
        RoundReference previous = context.previousRound().orElseThrow();
        if (context.run().task(previous.sequence()).modelKind() != ModelKind.KERNEL_REGRESSION) {
            LOG.debugf("Previous round %s is not a kernel task, starting cold", previous);
            return;
        }
        warmStart = WarmStartState.from(PayloadCodec.decodeSingle(previousGlobal.get(), KernelStatisticsDTO.class));
        LOG.debugf("Loaded warm-start state from round %s", previous);
    }

    @Override
    public KernelStatisticsDTO training(RoundContext context) {
        return fitter.fit(split, context.specification().kernel(), warmStart);
    }

    @Override
    public KernelStatisticsDTO aggregate(Collection<KernelStatisticsDTO> payloads) {
        return aggregator.aggregate(payloads);
    }

    WarmStartState getWarmStart() {
        return warmStart;
    }
}
