package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.Utils;
import org.broadinstitute.goenrich.utils.tsv.DataLine;
import org.broadinstitute.goenrich.utils.tsv.TableColumnCollection;
import org.broadinstitute.goenrich.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes {@link EnrichmentResult}s as a tab-separated table, one line per term.
 */
public final class EnrichmentResultTableWriter extends TableWriter<EnrichmentResult> {

    public static final String GO_ID_COLUMN = "go_id";
    public static final String GO_TERM_COLUMN = "go_term";
    public static final String RAW_P_VALUE_COLUMN = "raw_p_value";
    public static final String ADJUSTED_P_VALUE_COLUMN = "adjusted_p_value";
    public static final String IN_SET_ANNOTATED_COLUMN = "in_set_annotated";
    public static final String ANNOTATED_COLUMN = "annotated";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            GO_ID_COLUMN, GO_TERM_COLUMN, RAW_P_VALUE_COLUMN, ADJUSTED_P_VALUE_COLUMN, IN_SET_ANNOTATED_COLUMN, ANNOTATED_COLUMN);

    public EnrichmentResultTableWriter(final File file) throws IOException {
        super(file, COLUMNS);
    }

    public EnrichmentResultTableWriter(final Writer writer) {
        super(writer, COLUMNS);
    }

    @Override
    protected void composeLine(final EnrichmentResult result, final DataLine dataLine) {
        dataLine.set(GO_ID_COLUMN, result.getTermId())
                .set(GO_TERM_COLUMN, result.getTermLabel())
                .set(RAW_P_VALUE_COLUMN, result.getRawPValue())
                .set(ADJUSTED_P_VALUE_COLUMN, result.getAdjustedPValue())
                .set(IN_SET_ANNOTATED_COLUMN, result.getInSetAnnotatedCount())
                .set(ANNOTATED_COLUMN, result.getAnnotatedCount());
    }

    /**
     * Writes the results in the given order, header included.
     *
     * @throws UserException.CouldNotCreateOutputFile if the file cannot be written.
     */
    public static void writeResults(final File file, final List<EnrichmentResult> results) {
        Utils.nonNull(file, "the output file cannot be null");
        Utils.nonNull(results, "the results cannot be null");
        try (final EnrichmentResultTableWriter writer = new EnrichmentResultTableWriter(file)) {
            writer.writeAllRecords(results);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(file, "could not write the enrichment results", e);
        }
    }
}
