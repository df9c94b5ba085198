package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.goenrich.exceptions.GoEnrichException;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Joins the per-term labels, tables and p-values of a run into {@link EnrichmentResult}s.
 */
public final class EnrichmentResultAssembler {

    private EnrichmentResultAssembler() {}

    /**
     * @param termLabels label of each term; one result is produced per entry.
     * @param tables contingency table of each term.
     * @param rawPValues raw p-value of each term.
     * @param adjustedPValues adjusted p-value of each term.
     * @return results sorted by {@link EnrichmentResult#CANONICAL_ORDER}.
     * @throws GoEnrichException if a term of {@code termLabels} is missing from any other map.
     */
    public static List<EnrichmentResult> assemble(final Map<String, String> termLabels,
                                                  final Map<String, ContingencyTable> tables,
                                                  final Map<String, Double> rawPValues,
                                                  final Map<String, Double> adjustedPValues) {
        Utils.nonNull(termLabels, "the term labels cannot be null");
        Utils.nonNull(tables, "the tables cannot be null");
        Utils.nonNull(rawPValues, "the raw p-values cannot be null");
        Utils.nonNull(adjustedPValues, "the adjusted p-values cannot be null");

        final List<EnrichmentResult> results = new ArrayList<>(termLabels.size());
        for (final Map.Entry<String, String> term : termLabels.entrySet()) {
            final String termId = term.getKey();
            final ContingencyTable table = tables.get(termId);
            final Double raw = rawPValues.get(termId);
            final Double adjusted = adjustedPValues.get(termId);
            if (table == null || raw == null || adjusted == null) {
                throw new GoEnrichException(String.format("incomplete results for term %s: table=%s, raw p-value=%s, adjusted p-value=%s",
                        termId, table, raw, adjusted));
            }
            results.add(new EnrichmentResult(termId, term.getValue(), raw, adjusted, table));
        }
        results.sort(EnrichmentResult.CANONICAL_ORDER);
        return results;
    }
}
