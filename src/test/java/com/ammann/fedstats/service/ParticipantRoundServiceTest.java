/* (C)2026 */
package com.ammann.fedstats.service;

import static org.assertj.core.api.Assertions.*;

import com.ammann.fedstats.dto.RoundOutcomeDTO;
import com.ammann.fedstats.exception.RunNotFoundException;
import com.ammann.fedstats.model.Dataset;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.store.ArtifactKey;
import com.ammann.fedstats.store.FileArtifactStore;
import com.ammann.fedstats.support.TestStatistics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParticipantRoundServiceTest {

    @TempDir
    Path root;

    private final Map<String, Dataset> datasets = new HashMap<>();
    private SimpleMeterRegistry meterRegistry;
    private ParticipantRoundService service;

    @BeforeEach
    void setUp() {
        FileArtifactStore store = new FileArtifactStore(root);
        RunRegistryService registry = new RunRegistryService();
        registry.store = store;
        FederatedTaskFactory factory = new FederatedTaskFactory();
        factory.store = store;
        factory.datasetSource = (runId, participant) -> {
            Dataset dataset = datasets.get(participant);
            return dataset != null ? dataset : new Dataset(new double[0][], new double[0]);
        };
        meterRegistry = new SimpleMeterRegistry();

        service = new ParticipantRoundService();
        service.runRegistry = registry;
        service.taskFactory = factory;
        service.store = store;
        service.meterRegistry = meterRegistry;

        registry.submit(TestStatistics.runDescriptor("run-1", "LINEAR_COVARIATE", 1));
    }

    @Test
    void successfulRoundPublishesAndCounts() {
        datasets.put("site-a", TestStatistics.linearDataset(60, 1L));

        RoundOutcomeDTO outcome = service.runRound("run-1", 1, 0, "site-a");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.stage()).isEqualTo("PUBLISHED");
        assertThat(outcome.participant()).isEqualTo("site-a");
        assertThat(outcome.failure()).isNull();
        assertThat(service.store.read(ArtifactKey.local("run-1", RoundReference.first(), "site-a"))).isPresent();
        assertThat(meterRegistry.get("federation_rounds_published_total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("federation_round_failures_total").counter().count()).isZero();
    }

    @Test
    void failedRoundIsReportedNotThrown() {
        RoundOutcomeDTO outcome = service.runRound("run-1", 1, 0, "site-b");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.stage()).isEqualTo("FAILED");
        assertThat(outcome.failure()).isEqualTo("DATA_UNAVAILABLE");
        assertThat(meterRegistry.get("federation_round_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unknownRunPropagates() {
        assertThatThrownBy(() -> service.runRound("run-9", 1, 0, "site-a"))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void worksWithoutMeterRegistry() {
        service.meterRegistry = null;
        datasets.put("site-a", TestStatistics.linearDataset(60, 1L));

        assertThat(service.runRound("run-1", 1, 0, "site-a").success()).isTrue();
    }
}
