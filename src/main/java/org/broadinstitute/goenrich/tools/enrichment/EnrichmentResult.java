package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.goenrich.utils.Utils;

import java.util.Comparator;
import java.util.Objects;

/**
 * Outcome of the enrichment test of one Gene Ontology term.
 */
public final class EnrichmentResult {

    /**
     * Ascending raw p-value, ties broken by term id.
     */
    public static final Comparator<EnrichmentResult> CANONICAL_ORDER =
            Comparator.comparingDouble(EnrichmentResult::getRawPValue).thenComparing(EnrichmentResult::getTermId);

    private final String termId;
    private final String termLabel;
    private final double rawPValue;
    private final double adjustedPValue;
    private final ContingencyTable table;

    public EnrichmentResult(final String termId, final String termLabel, final double rawPValue,
                            final double adjustedPValue, final ContingencyTable table) {
        this.termId = Utils.nonNull(termId, "the term id cannot be null");
        this.termLabel = Utils.nonNull(termLabel, "the term label cannot be null");
        this.table = Utils.nonNull(table, "the contingency table cannot be null");
        this.rawPValue = rawPValue;
        this.adjustedPValue = adjustedPValue;
    }

    public String getTermId() {
        return termId;
    }

    public String getTermLabel() {
        return termLabel;
    }

    public double getRawPValue() {
        return rawPValue;
    }

    public double getAdjustedPValue() {
        return adjustedPValue;
    }

    public ContingencyTable getTable() {
        return table;
    }

    /**
     * @return number of features of the set of interest annotated with this term.
     */
    public int getInSetAnnotatedCount() {
        return table.getA();
    }

    /**
     * @return number of features of the genome annotated with this term.
     */
    public int getAnnotatedCount() {
        return table.getAnnotatedCount();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final EnrichmentResult that = (EnrichmentResult) o;
        return Double.compare(that.rawPValue, rawPValue) == 0 &&
                Double.compare(that.adjustedPValue, adjustedPValue) == 0 &&
                termId.equals(that.termId) &&
                termLabel.equals(that.termLabel) &&
                table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(termId, termLabel, rawPValue, adjustedPValue, table);
    }

    @Override
    public String toString() {
        return "EnrichmentResult{" +
                "termId='" + termId + '\'' +
                ", termLabel='" + termLabel + '\'' +
                ", rawPValue=" + rawPValue +
                ", adjustedPValue=" + adjustedPValue +
                ", table=" + table +
                '}';
    }
}
