package org.broadinstitute.goenrich.tools.enrichment;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.goenrich.GoEnrichBaseTest;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class FeatureAnnotationTableReaderUnitTest extends GoEnrichBaseTest {

    private static final String HEADER = "feature_id\tfunction\tfeature_type\tontology_id\tontology_term\n";

    private static List<FeatureAnnotationRecord> read(final String text) throws IOException {
        try (final FeatureAnnotationTableReader reader = new FeatureAnnotationTableReader("annotations", new StringReader(text))) {
            return reader.toList();
        }
    }

    @Test
    public void testOneRecordPerLine() throws IOException {
        final List<FeatureAnnotationRecord> records = read(HEADER +
                "AT1G01010\tNAC domain protein\tgene\tGO:0003677\tDNA binding\n" +
                "AT1G01010\tNAC domain protein\tgene\tGO:0005634\tnucleus\n" +
                "AT1G01040\t\t\t\t\n");
        Assert.assertEquals(records.size(), 3);
        Assert.assertEquals(records.get(0), new FeatureAnnotationRecord("AT1G01010", "NAC domain protein", "gene",
                ImmutableMap.of("GO:0003677", "DNA binding")));
        Assert.assertEquals(records.get(2), new FeatureAnnotationRecord("AT1G01040", null, null, Collections.emptyMap()));
    }

    @Test
    public void testOptionalColumnsMayBeAbsent() throws IOException {
        final List<FeatureAnnotationRecord> records = read("ontology_id\tfeature_id\tontology_term\nGO:0005634\tF1\tnucleus\n");
        Assert.assertEquals(records, Collections.singletonList(
                new FeatureAnnotationRecord("F1", null, null, ImmutableMap.of("GO:0005634", "nucleus"))));
    }

    @Test
    public void testMergeByFeature() {
        final List<FeatureAnnotationRecord> merged = FeatureAnnotationTableReader.mergeByFeature(Arrays.asList(
                new FeatureAnnotationRecord("F1", "function", "gene", ImmutableMap.of("GO:0001", "one")),
                new FeatureAnnotationRecord("F2", null, null, null),
                new FeatureAnnotationRecord("F1", null, "mRNA", ImmutableMap.of("GO:0002", "two"))));
        Assert.assertEquals(merged.size(), 2);
        Assert.assertEquals(merged.get(0), new FeatureAnnotationRecord("F1", "function", "mRNA",
                ImmutableMap.of("GO:0001", "one", "GO:0002", "two")));
        Assert.assertEquals(merged.get(1).getFeatureId(), "F2");
    }

    @Test
    public void testReadAnnotations() {
        final List<FeatureAnnotationRecord> records = FeatureAnnotationTableReader.readAnnotations(getTestFile("annotations.tsv"));
        Assert.assertEquals(records.size(), 4);
        Assert.assertEquals(records.get(0).getFeatureId(), "AT1G01010");
        Assert.assertEquals(records.get(0).getOntologyTerms().keySet(), ImmutableMap.of("GO:0003677", "", "GO:0005634", "").keySet());
        Assert.assertEquals(records.get(3).getFeatureId(), "AT1G01040");
        Assert.assertTrue(records.get(3).getOntologyTerms().isEmpty());
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        FeatureAnnotationTableReader.readAnnotations(new File(createTempDir("annotations"), "no-such-file.tsv"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingMandatoryColumn() throws IOException {
        read("feature_id\tontology_id\nF1\tGO:0001\n");
    }

    @Test(expectedExceptions = UserException.MissingFeatureIdentifier.class)
    public void testMissingFeatureIdentifier() throws IOException {
        read(HEADER + "\tfunction\tgene\tGO:0001\tlabel\n");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testTermLabelWithoutId() throws IOException {
        read(HEADER + "F1\t\t\t\tlabel\n");
    }

    @Test
    public void testTrailingEmptyColumnsMayBeLeftOut() throws IOException {
        final List<FeatureAnnotationRecord> records = read(HEADER +
                "AT1G01010\tNAC domain protein\tgene\tGO:0003677\tDNA binding\n" +
                "AT1G01010\tNAC domain protein\tgene\tGO:0005634\tnucleus\n" +
                "AT1G01040\tdicer-like 1\tgene\n");
        Assert.assertEquals(records.size(), 3);
        Assert.assertEquals(records.get(2), new FeatureAnnotationRecord("AT1G01040", "dicer-like 1", "gene", Collections.emptyMap()));

        final List<FeatureAnnotationRecord> merged = FeatureAnnotationTableReader.mergeByFeature(records);
        Assert.assertEquals(merged.size(), 2);
        Assert.assertEquals(merged.get(0).getOntologyTerms(), ImmutableMap.of("GO:0003677", "DNA binding", "GO:0005634", "nucleus"));
        Assert.assertTrue(merged.get(1).getOntologyTerms().isEmpty());
    }

    @Test
    public void testOnlyTheFeatureIdentifierGiven() throws IOException {
        Assert.assertEquals(read(HEADER + "F1\n"),
                Collections.singletonList(new FeatureAnnotationRecord("F1", null, null, Collections.emptyMap())));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testTooManyValues() throws IOException {
        read(HEADER + "F1\tfunction\tgene\tGO:0001\tlabel\textra\n");
    }
}
