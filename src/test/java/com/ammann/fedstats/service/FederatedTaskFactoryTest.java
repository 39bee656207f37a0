/* (C)2026 */
package com.ammann.fedstats.service;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.ammann.fedstats.enumeration.ModelKind;
import com.ammann.fedstats.lifecycle.KernelRegressionTask;
import com.ammann.fedstats.lifecycle.LinearCovariateTask;
import com.ammann.fedstats.model.KernelHyperparameters;
import com.ammann.fedstats.model.ModelSpecification;
import com.ammann.fedstats.store.ArtifactStore;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FederatedTaskFactoryTest {

    private FederatedTaskFactory factory;

    @BeforeEach
    void setUp() {
        factory = new FederatedTaskFactory();
        factory.datasetSource = mock(DatasetSource.class);
        factory.store = mock(ArtifactStore.class);
    }

    private static ModelSpecification spec(ModelKind kind) {
        return ModelSpecification.fromConfig(kind, Map.of(), KernelHyperparameters.defaults());
    }

    @Test
    void createsTaskMatchingModelKind() {
        assertThat(factory.create(spec(ModelKind.LINEAR_COVARIATE)))
                .isInstanceOf(LinearCovariateTask.class)
                .extracting(task -> task.modelKind())
                .isEqualTo(ModelKind.LINEAR_COVARIATE);
        assertThat(factory.create(spec(ModelKind.KERNEL_REGRESSION)))
                .isInstanceOf(KernelRegressionTask.class);
    }

    @Test
    void createsFreshInstancePerRound() {
        ModelSpecification spec = spec(ModelKind.KERNEL_REGRESSION);

        assertThat(factory.create(spec)).isNotSameAs(factory.create(spec));
    }
}
