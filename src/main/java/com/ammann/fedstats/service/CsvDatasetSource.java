/* (C)2026 */
package com.ammann.fedstats.service;

import com.ammann.fedstats.exception.RoundFailureException;
import com.ammann.fedstats.model.Dataset;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reads site datasets from {@code <dataset-root>/<run_id>/<participant>.csv}.
 *
 * <p>Every row holds the feature columns followed by the outcome in the last column. A
 * leading row that is not fully numeric is treated as a header and skipped; any other
 * non-numeric cell makes the dataset unavailable. Lines starting with {@code #} are comments.
 */
@ApplicationScoped
public class CsvDatasetSource implements DatasetSource {

    private static final Logger LOG = Logger.getLogger(CsvDatasetSource.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setCommentMarker('#')
            .build();

    @ConfigProperty(name = "federation.dataset.root", defaultValue = "data/datasets")
    String datasetRoot;

    @Override
    public Dataset load(String runId, String participant) {
        if (participant == null || !participant.matches("[A-Za-z0-9._-]+")) {
            throw RoundFailureException.dataUnavailable("Invalid participant id: " + participant);
        }
        Path file = Path.of(datasetRoot).resolve(runId).resolve(participant + ".csv");
        LOG.debugf("Loading dataset for run %s participant %s from %s", runId, participant, file);

        List<double[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = FORMAT.parse(reader)) {
            int width = -1;
            for (CSVRecord record : parser) {
                double[] row = parseRow(record);
                if (row == null) {
                    if (record.getRecordNumber() == 1) {
                        LOG.debugf("Skipping header row of %s", file);
                        continue;
                    }
                    throw RoundFailureException.dataUnavailable(String.format(
                            "Non-numeric value in %s at line %d", file, parser.getCurrentLineNumber()));
                }
                if (width == -1) {
                    width = row.length;
                } else if (row.length != width) {
                    throw RoundFailureException.dataUnavailable(String.format(
                            "Row %d of %s has %d columns, expected %d",
                            record.getRecordNumber(), file, row.length, width));
                }
                rows.add(row);
            }
        } catch (NoSuchFileException e) {
            throw RoundFailureException.dataUnavailable("Dataset file not found: " + file, e);
        } catch (IOException | UncheckedIOException e) {
            throw RoundFailureException.dataUnavailable("Cannot read dataset " + file + ": " + e.getMessage(), e);
        }

        if (!rows.isEmpty() && rows.get(0).length < 2) {
            throw RoundFailureException.dataUnavailable(String.format(
                    "Dataset %s needs at least one feature column and one outcome column", file));
        }

        double[][] features = new double[rows.size()][];
        double[] outcome = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            features[i] = new double[row.length - 1];
            System.arraycopy(row, 0, features[i], 0, row.length - 1);
            outcome[i] = row[row.length - 1];
        }
        LOG.infof("Loaded %d rows with %d features for participant %s",
                rows.size(), rows.isEmpty() ? 0 : rows.get(0).length - 1, participant);
        return new Dataset(features, outcome);
    }

    /**
     * Parses every cell as a finite double.
     *
     * @return parsed row, or null if any cell is not a finite number
     */
    private static double[] parseRow(CSVRecord record) {
        double[] row = new double[record.size()];
        for (int i = 0; i < record.size(); i++) {
            try {
                row[i] = Double.parseDouble(record.get(i));
            } catch (NumberFormatException e) {
                return null;
            }
            if (!Double.isFinite(row[i])) {
                return null;
            }
        }
        return row;
    }
}
