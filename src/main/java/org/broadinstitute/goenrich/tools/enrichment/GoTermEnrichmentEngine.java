package org.broadinstitute.goenrich.tools.enrichment;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.goenrich.utils.FisherExactTest;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.*;

/**
 * Gene Ontology term enrichment of a feature set of interest.
 * <p>
 *     Every term annotated on at least one feature of the genome is tested with Fisher's exact test on its
 *     {@link ContingencyTable}, and the p-values of all tested terms are then corrected together. Any failure
 *     aborts the whole run; there are no partial results.
 * </p>
 */
public final class GoTermEnrichmentEngine {

    private static final Logger logger = LogManager.getLogger(GoTermEnrichmentEngine.class);

    private final FisherExactTest.Alternative alternative;
    private final PValueCorrection correction;

    /**
     * Engine testing for over-representation with a Benjamini-Hochberg correction.
     */
    public GoTermEnrichmentEngine() {
        this(FisherExactTest.Alternative.GREATER, PValueCorrection.BENJAMINI_HOCHBERG);
    }

    public GoTermEnrichmentEngine(final FisherExactTest.Alternative alternative, final PValueCorrection correction) {
        this.alternative = Utils.nonNull(alternative, "the alternative cannot be null");
        this.correction = Utils.nonNull(correction, "the correction cannot be null");
    }

    public FisherExactTest.Alternative getAlternative() {
        return alternative;
    }

    public PValueCorrection getCorrection() {
        return correction;
    }

    /**
     * Indexes the records and runs the enrichment on the result.
     */
    public List<EnrichmentResult> run(final Iterable<FeatureAnnotationRecord> records, final Collection<String> featureSetOfInterest) {
        return run(AnnotationIndexBuilder.buildIndex(records), featureSetOfInterest);
    }

    /**
     * @param index annotations of the genome.
     * @param featureSetOfInterest feature ids to test; ids outside the universe are ignored.
     * @return one result per annotated term, sorted by {@link EnrichmentResult#CANONICAL_ORDER};
     *         empty if no term is annotated.
     */
    public List<EnrichmentResult> run(final AnnotationIndex index, final Collection<String> featureSetOfInterest) {
        Utils.nonNull(index, "the index cannot be null");
        Utils.containsNoNull(featureSetOfInterest, "the feature set of interest cannot be null or contain null ids");

        final Set<String> featureSet = ContingencyTableBuilder.restrictToUniverse(index, featureSetOfInterest);
        final int setSize = featureSet.size();
        final SortedMap<String, ContingencyTable> tables = ContingencyTableBuilder.buildTables(index, featureSet);
        logger.info(String.format("Testing %d GO terms on a universe of %d features with %d features of interest",
                tables.size(), index.getUniverseSize(), setSize));

        if (tables.isEmpty()) {
            logger.warn("No feature is annotated with a GO term; there is nothing to test");
            return Collections.emptyList();
        }
        if (setSize == 0) {
            Utils.warnUser(logger, "None of the features of interest is part of the annotated genome; every p-value will be 1");
        }

        final Map<String, Double> rawPValues = new LinkedHashMap<>(tables.size());
        int underflowCount = 0;
        for (final Map.Entry<String, ContingencyTable> entry : tables.entrySet()) {
            final double pValue = FisherExactTest.pValue(entry.getValue().toMatrix(), alternative);
            if (pValue == 0.0) {
                underflowCount++;
            }
            rawPValues.put(entry.getKey(), pValue);
        }
        if (underflowCount > 0) {
            logger.warn(String.format("%d p-value(s) fell below double precision and are reported as 0", underflowCount));
        }

        final Map<String, Double> adjustedPValues = correction.adjust(rawPValues);
        final List<EnrichmentResult> results = EnrichmentResultAssembler.assemble(index.getTermLabels(), tables, rawPValues, adjustedPValues);
        logger.debug(String.format("Computed %d enrichment results (%s alternative, %s correction)", results.size(), alternative, correction));
        return results;
    }
}
