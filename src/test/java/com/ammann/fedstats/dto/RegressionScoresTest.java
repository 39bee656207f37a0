/* (C)2026 */
package com.ammann.fedstats.dto;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RegressionScoresTest {

    @Test
    void scoresPredictions() {
        RegressionScores scores = RegressionScores.of(new double[] {1, 2, 3, 4}, new double[] {1, 2, 3, 6});

        assertThat(scores.mse()).isCloseTo(1.0, within(1e-12));
        assertThat(scores.rmse()).isCloseTo(1.0, within(1e-12));
        assertThat(scores.mae()).isCloseTo(0.5, within(1e-12));
        // SS_tot = 5, SS_res = 4
        assertThat(scores.r2()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void constantObservationsScoreOneOnlyWhenExact() {
        assertThat(RegressionScores.of(new double[] {2, 2}, new double[] {2, 2}).r2()).isEqualTo(1.0);
        assertThat(RegressionScores.of(new double[] {2, 2}, new double[] {2, 3}).r2()).isZero();
    }

    @Test
    void rejectsMismatchedInput() {
        assertThatThrownBy(() -> RegressionScores.of(new double[0], new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RegressionScores.of(new double[] {1}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void weightedPoolsBySampleSize() {
        RegressionScores pooled = RegressionScores.weighted(
                new double[] {1.0, 4.0}, new double[] {1.0, 2.0}, new double[] {0.5, 0.8}, new int[] {1, 3});

        assertThat(pooled.mse()).isCloseTo(3.25, within(1e-12));
        assertThat(pooled.rmse()).isCloseTo(Math.sqrt(3.25), within(1e-12));
        assertThat(pooled.mae()).isCloseTo(1.75, within(1e-12));
        assertThat(pooled.r2()).isCloseTo(0.725, within(1e-12));
    }

    @Test
    void weightedWithoutSamplesIsZero() {
        assertThat(RegressionScores.weighted(new double[0], new double[0], new double[0], new int[0]))
                .isEqualTo(new RegressionScores(0.0, 0.0, 0.0, 0.0));
    }
}
