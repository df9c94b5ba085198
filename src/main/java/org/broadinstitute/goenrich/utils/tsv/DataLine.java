package org.broadinstitute.goenrich.utils.tsv;

import org.broadinstitute.goenrich.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Readers hand instances to {@link TableReader#createRecord} to parse records, and writers hand empty ones to
 * {@link TableWriter#composeLine} to be filled in. Type conversion failures are reported through the
 * format error factory given at construction so that they carry the reader's location information.
 * </p>
 */
public final class DataLine {

    /**
     * Line number of this data-line within its table, or -1 if unknown.
     */
    private final long lineNumber;

    private final String[] values;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance that wraps an existing value array.
     * <p>
     * The value array is not copied.
     * </p>
     *
     * @throws IllegalArgumentException if any argument is {@code null} or the number of values does not match the
     *                                  number of columns.
     */
    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns,
             final Function<String, RuntimeException> formatErrorFactory) {
        this.lineNumber = lineNumber;
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new data-line instance with all values undefined.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    public DataLine set(final String name, final String value) {
        return set(columnIndex(name), value);
    }

    public DataLine set(final String name, final int value) {
        return set(name, Integer.toString(value));
    }

    public DataLine set(final String name, final double value) {
        return set(name, Double.toString(value));
    }

    /**
     * Sets the string value of a column given its index.
     *
     * @throws IllegalArgumentException if {@code index} is not a valid column index or the value of the first
     *                                  column would start with the comment prefix.
     */
    public DataLine set(final int index, final String value) {
        Utils.validIndex(index, values.length);
        if (index == 0 && value != null && value.startsWith(TableUtils.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableUtils.COMMENT_PREFIX);
        }
        values[index] = value;
        return this;
    }

    /**
     * Returns the string value in a column by its name.
     *
     * @throws IllegalArgumentException if {@code columnName} is {@code null} or an unknown column name.
     * @throws IllegalStateException    if that column value is undefined.
     */
    public String get(final String columnName) {
        final int index = columnIndex(columnName);
        if (values[index] == null) {
            throw new IllegalStateException(String.format("the value for column '%s' is undefined", columnName));
        }
        return values[index];
    }

    /**
     * Returns the string value in a column by its name, or {@code defaultValue} if there is no such column.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        return index < 0 ? defaultValue : values[index];
    }

    public int getInt(final String columnName) {
        final String value = get(columnName);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columnName, value));
        }
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }

    /**
     * Returns a copy of the current values, possibly containing {@code null}s.
     */
    public String[] toArray() {
        return values.clone();
    }
}
