package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.goenrich.cmdline.CommandLineProgram;
import org.broadinstitute.goenrich.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.goenrich.cmdline.programgroups.FunctionalEnrichmentProgramGroup;
import org.broadinstitute.goenrich.utils.FisherExactTest;
import org.broadinstitute.goenrich.utils.config.ConfigFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Tests a set of genome features for over-representation of Gene Ontology terms.
 * <p>
 *   Each GO term annotated on at least one feature of the genome is tested with a one-sided Fisher's exact test
 *   comparing how often it annotates the features of interest against the rest of the genome. P-values are then
 *   corrected for multiple testing across all tested terms (Benjamini-Hochberg by default).
 * </p>
 * <p>
 *   The annotation table format is described in {@link FeatureAnnotationTableReader}. The output table has one line
 *   per tested term with the columns described in {@link EnrichmentResultTableWriter}, sorted by ascending raw
 *   p-value. The most significant terms are also written to the log.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>
 *   goenrich FunctionalEnrichment \
 *     --annotations genome-annotations.tsv \
 *     --feature-id AT1G01010 --feature-id AT1G01040 \
 *     --output enrichment.tsv
 * </pre>
 * Feature ids can also be given in a file with a {@code .list} extension, one per line:
 * <pre>
 *   goenrich FunctionalEnrichment --annotations genome-annotations.tsv --feature-id features.list --output enrichment.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Tests a set of genome features for over-representation of Gene Ontology terms using Fisher's exact test " +
                "and a multiple-testing correction across all terms.",
        oneLineSummary = "Gene Ontology term enrichment of a set of features.",
        programGroup = FunctionalEnrichmentProgramGroup.class
)
public final class FunctionalEnrichment extends CommandLineProgram {

    public static final String ANNOTATIONS_LONG_NAME = "annotations";
    public static final String FEATURE_ID_LONG_NAME = "feature-id";
    public static final String ALTERNATIVE_LONG_NAME = "alternative";
    public static final String P_VALUE_CORRECTION_LONG_NAME = "p-value-correction";
    public static final String SUMMARY_TERM_COUNT_LONG_NAME = "summary-term-count";

    @Argument(
            doc = "Feature annotation table of the genome",
            fullName = ANNOTATIONS_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME
    )
    protected File annotationsFile;

    @Argument(
            doc = "Identifier of a feature of the set of interest. May be specified multiple times.",
            fullName = FEATURE_ID_LONG_NAME
    )
    protected List<String> featureIds = new ArrayList<>();

    @Argument(
            doc = "Output enrichment table",
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME
    )
    protected File outputFile;

    @Argument(
            doc = "Alternative hypothesis of the exact test",
            fullName = ALTERNATIVE_LONG_NAME,
            optional = true
    )
    protected FisherExactTest.Alternative alternative = ConfigFactory.getInstance().getEnrichmentConfig().fisher_alternative();

    @Argument(
            doc = "Multiple-testing correction applied to the p-values of all tested terms",
            fullName = P_VALUE_CORRECTION_LONG_NAME,
            optional = true
    )
    protected PValueCorrection correction = ConfigFactory.getInstance().getEnrichmentConfig().p_value_correction();

    @Argument(
            doc = "Number of most significant terms written to the log",
            fullName = SUMMARY_TERM_COUNT_LONG_NAME,
            minValue = 0,
            optional = true
    )
    protected int summaryTermCount = ConfigFactory.getInstance().getEnrichmentConfig().summary_term_count();

    @Override
    protected Object doWork() {
        final List<FeatureAnnotationRecord> records = FeatureAnnotationTableReader.readAnnotations(annotationsFile);
        logger.info(String.format("Read annotations of %d features from %s", records.size(), annotationsFile));

        final GoTermEnrichmentEngine engine = new GoTermEnrichmentEngine(alternative, correction);
        final List<EnrichmentResult> results = engine.run(records, featureIds);

        EnrichmentResultTableWriter.writeResults(outputFile, results);
        logger.info(String.format("Wrote %d enrichment results to %s", results.size(), outputFile));

        logTopTerms(results);
        return "SUCCESS";
    }

    private void logTopTerms(final List<EnrichmentResult> results) {
        final int count = Math.min(summaryTermCount, results.size());
        if (count == 0) {
            return;
        }
        logger.info(String.format("Top %d terms:", count));
        logger.info(String.format("%-12s %-12s %-12s %-10s %s", "GO id", "raw p", "adjusted p", "in set", "GO term"));
        for (final EnrichmentResult result : results.subList(0, count)) {
            logger.info(String.format("%-12s %-12.4g %-12.4g %-10s %s",
                    result.getTermId(), result.getRawPValue(), result.getAdjustedPValue(),
                    result.getInSetAnnotatedCount() + "/" + result.getAnnotatedCount(), result.getTermLabel()));
        }
    }
}
