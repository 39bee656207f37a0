/* (C)2026 */
package com.ammann.fedstats.model;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DatasetTest {

    private static Dataset indexed(int n) {
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = new double[] {i};
            y[i] = i;
        }
        return new Dataset(x, y);
    }

    @ParameterizedTest
    @CsvSource({
        "10, 8, 2",
        "11, 8, 3",
        "2, 1, 1",
        "100, 80, 20",
    })
    void heldOutPartitionIsCeilingOfTwentyPercent(int n, int train, int heldOut) {
        TrainTestSplit split = indexed(n).split(0.2, 42L);

        assertThat(split.train().size()).isEqualTo(train);
        assertThat(split.heldOut().size()).isEqualTo(heldOut);
    }

    @Test
    void splitIsDeterministicAndPartitionsRows() {
        TrainTestSplit first = indexed(25).split(0.2, 42L);
        TrainTestSplit second = indexed(25).split(0.2, 42L);

        assertThat(first.train().outcome()).containsExactly(second.train().outcome());
        assertThat(first.heldOut().outcome()).containsExactly(second.heldOut().outcome());

        List<Double> all = new ArrayList<>();
        for (double value : first.train().outcome()) {
            all.add(value);
        }
        for (double value : first.heldOut().outcome()) {
            all.add(value);
        }
        assertThat(all).hasSize(25).doesNotHaveDuplicates();
    }

    @Test
    void differentSeedsShuffleDifferently() {
        TrainTestSplit first = indexed(50).split(0.2, 42L);
        TrainTestSplit other = indexed(50).split(0.2, 7L);

        assertThat(first.heldOut().outcome()).isNotEqualTo(other.heldOut().outcome());
    }

    @Test
    void singleRowCannotBeSplit() {
        assertThatThrownBy(() -> indexed(1).split(0.2, 42L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsRaggedRowsAndLengthMismatch() {
        assertThatThrownBy(() -> new Dataset(new double[][] {{1, 2}, {3}}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Dataset(new double[][] {{1}}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposesCopies() {
        Dataset dataset = indexed(3);

        dataset.features()[0][0] = 99;
        dataset.outcome()[0] = 99;

        assertThat(dataset.features()[0][0]).isZero();
        assertThat(dataset.outcome()[0]).isZero();
    }
}
