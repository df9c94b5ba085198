package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.goenrich.CommandLineProgramTest;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.testutils.ArgumentsBuilder;
import org.broadinstitute.goenrich.utils.FisherExactTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public final class FunctionalEnrichmentIntegrationTest extends CommandLineProgramTest {

    private static final double EPSILON = 1e-9;

    private static final String HEADER = String.join("\t", EnrichmentResultTableWriter.COLUMNS.names());

    private ArgumentsBuilder fiveFeatureArguments(final File output) {
        return new ArgumentsBuilder()
                .add(FunctionalEnrichment.ANNOTATIONS_LONG_NAME, getTestFile("five_features.tsv"))
                .addOutput(output);
    }

    private static List<String[]> readOutput(final File output) throws IOException {
        final List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        Assert.assertFalse(lines.isEmpty(), "the output is empty");
        Assert.assertEquals(lines.get(0), HEADER);
        final List<String[]> rows = new ArrayList<>();
        for (final String line : lines.subList(1, lines.size())) {
            final String[] values = line.split("\t", -1);
            Assert.assertEquals(values.length, EnrichmentResultTableWriter.COLUMNS.columnCount(), line);
            rows.add(values);
        }
        return rows;
    }

    private static void assertRow(final String[] row, final String termId, final String label, final double raw,
                                  final double adjusted, final int inSet, final int annotated) {
        Assert.assertEquals(row[0], termId);
        Assert.assertEquals(row[1], label);
        Assert.assertEquals(Double.parseDouble(row[2]), raw, EPSILON);
        Assert.assertEquals(Double.parseDouble(row[3]), adjusted, EPSILON);
        Assert.assertEquals(Integer.parseInt(row[4]), inSet);
        Assert.assertEquals(Integer.parseInt(row[5]), annotated);
    }

    @Test
    public void testFiveFeatureGenome() throws IOException {
        final File output = createTempFile("five_features.enrichment", ".tsv");
        final ArgumentsBuilder args = fiveFeatureArguments(output)
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "F1")
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "F3")
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "F5");
        Assert.assertEquals(runCommandLine(args), "SUCCESS");

        final List<String[]> rows = readOutput(output);
        Assert.assertEquals(rows.size(), 2);
        assertRow(rows.get(0), "GO:0001", "test process", 0.3, 0.6, 2, 2);
        assertRow(rows.get(1), "GO:9999", "other", 1.0, 1.0, 0, 1);
    }

    @Test
    public void testFeatureIdsFromListFile() throws IOException {
        final File output = createTempFile("five_features.enrichment", ".tsv");
        final ArgumentsBuilder args = fiveFeatureArguments(output)
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, getTestFile("features_of_interest.list"));
        runCommandLine(args);

        final List<String[]> rows = readOutput(output);
        Assert.assertEquals(rows.size(), 2);
        assertRow(rows.get(0), "GO:0001", "test process", 0.3, 0.6, 2, 2);
    }

    @Test
    public void testAlternativeAndCorrection() throws IOException {
        final File output = createTempFile("five_features.enrichment", ".tsv");
        final ArgumentsBuilder args = fiveFeatureArguments(output)
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, getTestFile("features_of_interest.list"))
                .add(FunctionalEnrichment.ALTERNATIVE_LONG_NAME, FisherExactTest.Alternative.LESS)
                .add(FunctionalEnrichment.P_VALUE_CORRECTION_LONG_NAME, PValueCorrection.BONFERRONI)
                .add(FunctionalEnrichment.SUMMARY_TERM_COUNT_LONG_NAME, 0);
        runCommandLine(args);

        final List<String[]> rows = readOutput(output);
        assertRow(rows.get(0), "GO:9999", "other", 0.4, 0.8, 0, 1);
        assertRow(rows.get(1), "GO:0001", "test process", 1.0, 1.0, 2, 2);
    }

    @Test
    public void testUnknownFeaturesOnly() throws IOException {
        final File output = createTempFile("five_features.enrichment", ".tsv");
        final ArgumentsBuilder args = fiveFeatureArguments(output)
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "NOT_ANNOTATED");
        runCommandLine(args);

        for (final String[] row : readOutput(output)) {
            Assert.assertEquals(Double.parseDouble(row[2]), 1.0);
            Assert.assertEquals(Double.parseDouble(row[3]), 1.0);
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingAnnotationFile() {
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .add(FunctionalEnrichment.ANNOTATIONS_LONG_NAME, new File(createTempDir("goenrich"), "missing.tsv"))
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "F1")
                .addOutput(createTempFile("enrichment", ".tsv"));
        runCommandLine(args);
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testFeatureIdIsRequired() {
        runCommandLine(fiveFeatureArguments(createTempFile("enrichment", ".tsv")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testUnknownCorrection() {
        final ArgumentsBuilder args = fiveFeatureArguments(createTempFile("enrichment", ".tsv"))
                .add(FunctionalEnrichment.FEATURE_ID_LONG_NAME, "F1")
                .add(FunctionalEnrichment.P_VALUE_CORRECTION_LONG_NAME, "FDR");
        runCommandLine(args);
    }
}
