package org.broadinstitute.goenrich.tools.enrichment;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.Utils;
import org.broadinstitute.goenrich.utils.tsv.DataLine;
import org.broadinstitute.goenrich.utils.tsv.TableColumnCollection;
import org.broadinstitute.goenrich.utils.tsv.TableReader;
import org.broadinstitute.goenrich.utils.tsv.TableUtils;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Reads a genome's feature annotation table.
 * <p>
 *     The table has one line per (feature, ontology term) pair:
 * </p>
 * <pre>
 *     feature_id	function	feature_type	ontology_id	ontology_term
 *     AT1G01010	NAC domain protein	gene	GO:0003677	DNA binding
 *     AT1G01010	NAC domain protein	gene	GO:0005634	nucleus
 *     AT1G01040	dicer-like 1	gene
 * </pre>
 * <p>
 *     A feature without any term has empty ontology columns, which may be left out together with their separators
 *     as in the last line above. The {@code function} and {@code feature_type}
 *     columns are optional. Each line is read as its own record; {@link #readAnnotations(File)} merges the lines of
 *     a feature into a single record.
 * </p>
 */
public final class FeatureAnnotationTableReader extends TableReader<FeatureAnnotationRecord> {

    public static final String FEATURE_ID_COLUMN = "feature_id";
    public static final String FUNCTION_COLUMN = "function";
    public static final String FEATURE_TYPE_COLUMN = "feature_type";
    public static final String ONTOLOGY_ID_COLUMN = "ontology_id";
    public static final String ONTOLOGY_TERM_COLUMN = "ontology_term";

    public static final TableColumnCollection MANDATORY_COLUMNS =
            new TableColumnCollection(FEATURE_ID_COLUMN, ONTOLOGY_ID_COLUMN, ONTOLOGY_TERM_COLUMN);

    public FeatureAnnotationTableReader(final File file) throws IOException {
        super(file);
    }

    public FeatureAnnotationTableReader(final String sourceName, final Reader reader) throws IOException {
        super(sourceName, reader);
    }

    @Override
    protected void processColumns(final TableColumnCollection columns) {
        TableUtils.checkMandatoryColumns(columns, MANDATORY_COLUMNS, this::formatException);
    }

    /**
     * Trailing empty values may be left out, as for a feature without terms written as {@code AT1G01040\tdicer-like 1\tgene}.
     */
    @Override
    protected String[] completeShortLine(final String[] line) {
        final String[] values = Arrays.copyOf(line, columns().columnCount());
        Arrays.fill(values, line.length, values.length, "");
        return values;
    }

    @Override
    protected FeatureAnnotationRecord createRecord(final DataLine dataLine) {
        final String featureId = dataLine.get(FEATURE_ID_COLUMN);
        if (StringUtils.isBlank(featureId)) {
            throw new UserException.MissingFeatureIdentifier(String.format("at line %d of '%s'", dataLine.getLineNumber(), getSource()));
        }
        final String ontologyId = dataLine.get(ONTOLOGY_ID_COLUMN);
        final String ontologyTerm = dataLine.get(ONTOLOGY_TERM_COLUMN);
        final Map<String, String> ontologyTerms;
        if (ontologyId.isEmpty()) {
            if (!ontologyTerm.isEmpty()) {
                throw formatException("ontology term '" + ontologyTerm + "' given without an ontology id");
            }
            ontologyTerms = Collections.emptyMap();
        } else {
            ontologyTerms = Collections.singletonMap(ontologyId, ontologyTerm);
        }
        return new FeatureAnnotationRecord(featureId,
                StringUtils.defaultIfEmpty(dataLine.get(FUNCTION_COLUMN, null), null),
                StringUtils.defaultIfEmpty(dataLine.get(FEATURE_TYPE_COLUMN, null), null),
                ontologyTerms);
    }

    /**
     * Merges records that share a feature id: terms are pooled and the last non-null function and feature type win.
     *
     * @return one record per feature id, in order of first appearance.
     */
    public static List<FeatureAnnotationRecord> mergeByFeature(final Iterable<FeatureAnnotationRecord> records) {
        Utils.nonNull(records, "the records cannot be null");
        final Map<String, FeatureAnnotationRecord> merged = new LinkedHashMap<>();
        for (final FeatureAnnotationRecord record : records) {
            final FeatureAnnotationRecord previous = merged.get(record.getFeatureId());
            if (previous == null) {
                merged.put(record.getFeatureId(), record);
            } else {
                final Map<String, String> terms = new LinkedHashMap<>(previous.getOntologyTerms());
                terms.putAll(record.getOntologyTerms());
                merged.put(record.getFeatureId(), new FeatureAnnotationRecord(record.getFeatureId(),
                        record.getFunction() != null ? record.getFunction() : previous.getFunction(),
                        record.getFeatureType() != null ? record.getFeatureType() : previous.getFeatureType(),
                        terms));
            }
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Reads a whole annotation table, one record per feature.
     *
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     * @throws UserException.BadInput if the table is malformed.
     */
    public static List<FeatureAnnotationRecord> readAnnotations(final File file) {
        Utils.nonNull(file, "the annotation file cannot be null");
        try (final FeatureAnnotationTableReader reader = new FeatureAnnotationTableReader(file)) {
            return mergeByFeature(reader.toList());
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(file, "could not read the feature annotation table", e);
        }
    }
}
