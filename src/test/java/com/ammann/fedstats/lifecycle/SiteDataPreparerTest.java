/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import static org.assertj.core.api.Assertions.*;

import com.ammann.fedstats.enumeration.FailureKind;
import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.Dataset;
import com.ammann.fedstats.model.KernelHyperparameters;
import com.ammann.fedstats.model.ModelSpecification;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.Run;
import com.ammann.fedstats.model.TrainTestSplit;
import com.ammann.fedstats.support.TestStatistics;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SiteDataPreparerTest {

    private static final RoundContext CONTEXT = new RoundContext(
            new Run("run-1", "p", "b", List.of(ModelSpecification.fromConfig(
                    ModelKind.LINEAR_COVARIATE, Map.of(), KernelHyperparameters.defaults())), 1),
            RoundReference.first(), "site-a");

    @Test
    void splitsDataset() {
        SiteDataPreparer preparer = new SiteDataPreparer(
                (runId, participant) -> TestStatistics.linearDataset(50, 1L), 30, 0.2, 42L);

        TrainTestSplit split = preparer.prepare(CONTEXT);

        assertThat(split.train().size()).isEqualTo(40);
        assertThat(split.heldOut().size()).isEqualTo(10);
        assertThat(split.train().featureCount()).isEqualTo(2);
    }

    @Test
    void smallSampleIsOnlyAdvisory() {
        SiteDataPreparer preparer = new SiteDataPreparer(
                (runId, participant) -> TestStatistics.linearDataset(10, 1L), 30, 0.2, 42L);

        assertThat(preparer.prepare(CONTEXT).train().size()).isEqualTo(8);
        assertThat(preparer.getMinSampleSize()).isEqualTo(30);
    }

    @Test
    void emptyDatasetIsUnavailable() {
        SiteDataPreparer preparer = new SiteDataPreparer(
                (runId, participant) -> new Dataset(new double[0][], new double[0]), 30, 0.2, 42L);

        assertThatThrownBy(() -> preparer.prepare(CONTEXT))
                .isInstanceOf(RoundFailureException.class)
                .extracting(e -> ((RoundFailureException) e).getKind())
                .isEqualTo(FailureKind.DATA_UNAVAILABLE);
    }

    @Test
    void singleRowIsUnavailable() {
        SiteDataPreparer preparer = new SiteDataPreparer(
                (runId, participant) -> new Dataset(new double[][] {{1.0}}, new double[] {2.0}), 30, 0.2, 42L);

        assertThatThrownBy(() -> preparer.prepare(CONTEXT))
                .isInstanceOf(RoundFailureException.class)
                .hasMessageContaining("at least 2");
    }
}
