/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.Dataset;
import com.ammann.fedstats.model.TrainTestSplit;
import com.ammann.fedstats.service.DatasetSource;
import org.jboss.logging.Logger;

/**
 * Loads a site's dataset and splits it into training and held-out partitions.
 * <p>
 * Small samples only produce an advisory: publishing statistics of fewer than
 * {@code minSampleSize} rows raises re-identification risk but does not stop the round.
 */
public class SiteDataPreparer {

    private static final Logger LOG = Logger.getLogger(SiteDataPreparer.class);

    private final DatasetSource datasetSource;
    private final int minSampleSize;
    private final double testFraction;
    private final long seed;

    public SiteDataPreparer(DatasetSource datasetSource, int minSampleSize, double testFraction, long seed) {
        this.datasetSource = datasetSource;
        this.minSampleSize = minSampleSize;
        this.testFraction = testFraction;
        this.seed = seed;
    }

    /**
     * @throws RoundFailureException DATA_UNAVAILABLE when the dataset is missing, empty or too
     *                               small to split
     */
    public TrainTestSplit prepare(RoundContext context) {
        Dataset dataset = datasetSource.load(context.runId(), context.participant());
        if (dataset.isEmpty()) {
            throw RoundFailureException.dataUnavailable("Dataset for " + context + " is empty");
        }
        if (dataset.size() < 2) {
            throw RoundFailureException.dataUnavailable(String.format(
                    "Dataset for %s has %d row, at least 2 are needed for a held-out split",
                    context, dataset.size()));
        }
        if (dataset.size() < minSampleSize) {
            LOG.warnf("Sample size (%d) is below minimum threshold (%d) for %s. "
                    + "Published statistics may allow re-identification.",
                    dataset.size(), minSampleSize, context);
        }

        TrainTestSplit split = dataset.split(testFraction, seed);
        LOG.debugf("Training data shape: (%d, %d), held-out rows: %d",
                split.train().size(), split.train().featureCount(), split.heldOut().size());
        return split;
    }

    public int getMinSampleSize() {
        return minSampleSize;
    }
}
