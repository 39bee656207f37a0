/* (C)2026 */
package com.ammann.fedstats.aggregation;

import static com.ammann.fedstats.support.TestStatistics.kernelPayload;
import static org.assertj.core.api.Assertions.*;

import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.enumeration.FailureKind;
import com.ammann.fedstats.exception.RoundFailureException;
import java.util.List;
import org.junit.jupiter.api.Test;

class KernelParameterAveragingAggregatorTest {

    private final KernelParameterAveragingAggregator aggregator = new KernelParameterAveragingAggregator();

    @Test
    void equalSampleSizesGiveArithmeticMean() {
        KernelStatisticsDTO first = kernelPayload(50, new double[] {0.4, -0.2, -0.2}, 1.0);
        KernelStatisticsDTO second = kernelPayload(50, new double[] {-0.6, 0.8, -0.2}, 3.0);

        KernelStatisticsDTO global = aggregator.aggregate(List.of(first, second));

        assertThat(global.dualCoef()).hasDimensions(1, 3);
        assertThat(global.dualCoef()[0][0]).isCloseTo(-0.1, within(1e-12));
        assertThat(global.dualCoef()[0][1]).isCloseTo(0.3, within(1e-12));
        assertThat(global.dualCoef()[0][2]).isCloseTo(-0.2, within(1e-12));
        assertThat(global.intercept()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void parametersAreWeightedBySampleSize() {
        KernelStatisticsDTO small = kernelPayload(10, new double[] {1.0}, 0.0);
        KernelStatisticsDTO large = kernelPayload(30, new double[] {-1.0}, 4.0);

        KernelStatisticsDTO global = aggregator.aggregate(List.of(small, large));

        assertThat(global.dualCoef()[0][0]).isCloseTo(-0.5, within(1e-12));
        assertThat(global.intercept()).isCloseTo(3.0, within(1e-12));
        assertThat(global.totalSampleSize()).isEqualTo(40);
        assertThat(global.sampleSize()).isEqualTo(40);
        assertThat(global.nSites()).isEqualTo(2);
    }

    @Test
    void metricsAreWeightedAverages() {
        KernelStatisticsDTO first = new KernelStatisticsDTO(10, new double[][] {{0.1}}, 0.0,
                1.0, 1.0, 0.8, 0.2, null, null);
        KernelStatisticsDTO second = new KernelStatisticsDTO(30, new double[][] {{0.1}}, 0.0,
                4.0, 2.0, 1.6, 0.6, null, null);

        KernelStatisticsDTO global = aggregator.aggregate(List.of(first, second));

        assertThat(global.metricMse()).isCloseTo(3.25, within(1e-12));
        assertThat(global.metricRmse()).isCloseTo(Math.sqrt(3.25), within(1e-12));
        assertThat(global.metricMae()).isCloseTo(1.4, within(1e-12));
        assertThat(global.metricR2()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void payloadsWithoutDualSolutionAreSkipped() {
        KernelStatisticsDTO empty = new KernelStatisticsDTO(100, new double[][] {{}}, 9.0,
                0.0, 0.0, 0.0, 0.0, null, null);
        KernelStatisticsDTO usable = kernelPayload(20, new double[] {0.5, -0.5}, 1.0);

        KernelStatisticsDTO global = aggregator.aggregate(List.of(empty, usable));

        assertThat(global.nSites()).isEqualTo(1);
        assertThat(global.intercept()).isCloseTo(1.0, within(1e-12));
        assertThat(global.totalSampleSize()).isEqualTo(20);
    }

    @Test
    void noUsablePayloadIsReportedAsMissing() {
        KernelStatisticsDTO empty = new KernelStatisticsDTO(100, new double[0][], 9.0,
                0.0, 0.0, 0.0, 0.0, null, null);

        assertThatThrownBy(() -> aggregator.aggregate(List.of(empty)))
                .isInstanceOf(RoundFailureException.class)
                .extracting(e -> ((RoundFailureException) e).getKind())
                .isEqualTo(FailureKind.AGGREGATION_INPUT_MISSING);
        assertThatThrownBy(() -> aggregator.aggregate(List.of()))
                .isInstanceOf(RoundFailureException.class);
    }

    @Test
    void differentSupportVectorCountsAreRejected() {
        KernelStatisticsDTO first = kernelPayload(50, new double[] {0.4, -0.4}, 1.0);
        KernelStatisticsDTO second = kernelPayload(50, new double[] {0.4, -0.2, -0.2}, 1.0);

        assertThatThrownBy(() -> aggregator.aggregate(List.of(first, second)))
                .isInstanceOf(RoundFailureException.class)
                .hasMessageContaining("dual_coef")
                .extracting(e -> ((RoundFailureException) e).getKind())
                .isEqualTo(FailureKind.AGGREGATION_SHAPE_MISMATCH);
    }

    @Test
    void resultDoesNotDependOnArrivalOrder() {
        KernelStatisticsDTO a = kernelPayload(17, new double[] {0.1, -0.1}, 0.3);
        KernelStatisticsDTO b = kernelPayload(23, new double[] {0.7, -0.7}, -1.1);
        KernelStatisticsDTO c = kernelPayload(41, new double[] {-0.2, 0.2}, 2.9);

        KernelStatisticsDTO forward = aggregator.aggregate(List.of(a, b, c));
        KernelStatisticsDTO backward = aggregator.aggregate(List.of(c, b, a));

        assertThat(backward).usingRecursiveComparison().isEqualTo(forward);
    }
}
