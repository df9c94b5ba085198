package org.broadinstitute.goenrich.utils.tsv;

import com.google.common.collect.Sets;
import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Common constants and utility methods for tab-separated tables.
 */
public final class TableUtils {

    /**
     * Column separator {@value}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Column separator as an string.
     */
    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Comment line prefix string {@value}.
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character {@value}.
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character {@value}.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    private TableUtils() {
        throw new UnsupportedOperationException();
    }

    /**
     * Checks that a column collection contains all the mandatory columns.
     *
     * @param columns the column collection found in the table.
     * @param mandatoryColumns columns that must be present.
     * @param formatExceptionFactory creates the exception to throw when some mandatory column is missing.
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatoryColumns,
                                             final Function<String, RuntimeException> formatExceptionFactory) {
        Utils.nonNull(columns);
        Utils.nonNull(mandatoryColumns);
        Utils.nonNull(formatExceptionFactory);
        if (!columns.containsAll(mandatoryColumns.names())) {
            final Set<String> missingColumns = Sets.difference(new LinkedHashSet<>(mandatoryColumns.names()), new LinkedHashSet<>(columns.names()));
            throw formatExceptionFactory.apply("Bad header in file.  Not all mandatory columns are present.  Missing: " + StringUtils.join(missingColumns, ", "));
        }
    }
}
