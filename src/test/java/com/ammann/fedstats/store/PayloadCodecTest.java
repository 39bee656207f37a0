/* (C)2026 */
package com.ammann.fedstats.store;

import static org.assertj.core.api.Assertions.*;

import com.ammann.fedstats.dto.KernelStatisticsDTO;
import com.ammann.fedstats.dto.LinearLocalStatisticsDTO;
import com.ammann.fedstats.exception.ArtifactStoreException;
import com.ammann.fedstats.support.TestStatistics;
import org.junit.jupiter.api.Test;

class PayloadCodecTest {

    @Test
    void encodesOneSnakeCaseLine() {
        String blob = PayloadCodec.encode(
                TestStatistics.linearPayload(20, new double[] {1.0, 2.0}, new double[] {0.5, 0.25}));

        assertThat(blob).endsWith("\n");
        assertThat(blob.trim()).doesNotContain("\n");
        assertThat(blob).contains("\"sample_size\":20", "\"coef_\":[1.0,2.0]", "\"std_err\"",
                "\"partial_eta_squared\"", "\"n_group_columns\":1");
        assertThat(blob).doesNotContain("\"finite\"", "sampleSize");
    }

    @Test
    void localKernelPayloadOmitsCoordinatorFields() {
        String blob = PayloadCodec.encode(TestStatistics.kernelPayload(10, new double[] {0.5, -0.5}, 0.1));

        assertThat(blob).contains("\"dual_coef\":[[0.5,-0.5]]")
                .doesNotContain("total_sample_size", "n_sites", "dual_solution");
    }

    @Test
    void decodesEncodedPayload() {
        LinearLocalStatisticsDTO payload =
                TestStatistics.linearPayload(20, new double[] {1.0, 2.0}, new double[] {0.5, 0.25});

        LinearLocalStatisticsDTO decoded =
                PayloadCodec.decodeSingle(PayloadCodec.encode(payload), LinearLocalStatisticsDTO.class);

        assertThat(decoded).usingRecursiveComparison().isEqualTo(payload);
    }

    @Test
    void ignoresUnknownFieldsAndBlankLines() {
        String blob = "\n{\"sample_size\":5,\"dual_coef\":[[1.0]],\"intercept\":0.0,\"metric_mse\":0.0,"
                + "\"metric_rmse\":0.0,\"metric_mae\":0.0,\"metric_r2\":1.0,\"extra\":\"x\"}\n\n";

        KernelStatisticsDTO decoded = PayloadCodec.decodeSingle(blob, KernelStatisticsDTO.class);

        assertThat(decoded.sampleSize()).isEqualTo(5);
        assertThat(decoded.totalSampleSize()).isNull();
    }

    @Test
    void decodeAllReadsEveryLine() {
        String blob = PayloadCodec.encode(TestStatistics.kernelPayload(10, new double[] {1.0}, 0.0))
                + PayloadCodec.encode(TestStatistics.kernelPayload(20, new double[] {1.0}, 0.0));

        assertThat(PayloadCodec.decodeAll(blob, KernelStatisticsDTO.class))
                .extracting(KernelStatisticsDTO::sampleSize)
                .containsExactly(10, 20);
        assertThatThrownBy(() -> PayloadCodec.decodeSingle(blob, KernelStatisticsDTO.class))
                .isInstanceOf(ArtifactStoreException.class)
                .hasMessageContaining("found 2");
    }

    @Test
    void malformedLineRaisesStoreException() {
        assertThatThrownBy(() -> PayloadCodec.decodeAll("{not json", KernelStatisticsDTO.class))
                .isInstanceOf(ArtifactStoreException.class)
                .hasMessageContaining("Malformed KernelStatisticsDTO");
    }
}
