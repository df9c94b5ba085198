package org.broadinstitute.goenrich.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reader class for tab-separated table files.
 * <p>
 * The first non-comment line is the header: the column names separated by tabs.
 * Comment lines start with {@link TableUtils#COMMENT_PREFIX} and may appear anywhere.
 * Every other line must have as many values as there are columns.
 * </p>
 * <p>
 * Sub-classes turn each line into a record by implementing {@link #createRecord(DataLine)}. They may validate
 * the header by overriding {@link #processColumns(TableColumnCollection)}. A {@code null} record is skipped.
 * </p>
 * <pre>
 *     public class PersonReader extends TableReader&lt;Person&gt; {
 *
 *         protected void processColumns(final TableColumnCollection columns) {
 *             if (!columns.matchesExactly("name", "age"))
 *                 throw formatException("Bad header");
 *         }
 *
 *         protected Person createRecord(final DataLine dataLine) {
 *             return new Person(dataLine.get("name"), dataLine.getInt("age"));
 *         }
 *     }
 * </pre>
 *
 * @param <R> the record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the source, used in error messages; {@code null} if unknown.
     */
    private final String source;

    private final LineNumberReader reader;

    private final CSVReader csvReader;

    private TableColumnCollection columns;

    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Opens a reader on a file.
     *
     * @throws IllegalArgumentException if {@code file} is {@code null}.
     * @throws IOException if the file could not be opened or the header is malformed.
     */
    public TableReader(final File file) throws IOException {
        this(Utils.nonNull(file, "the input file cannot be null").getPath(),
                Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8));
    }

    /**
     * Creates a reader on a character stream.
     *
     * @param sourceName name used in error messages; {@code null} if unknown.
     * @param sourceReader the source of lines.
     */
    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line)) {
                processCommentLine(line, reader.getLineNumber());
            } else {
                TableColumnCollection.checkNames(line, this::formatException);
                columns = new TableColumnCollection(line);
                processColumns(columns);
                return;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    /**
     * Composes a format exception that points to the current position in the source.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d", reader.getLineNumber()) + explanation);
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d", source, reader.getLineNumber()) + explanation);
        }
    }

    /**
     * Process the header line's column names.
     * <p>
     * Sub-classes throw {@link #formatException} when a required column is missing.
     * </p>
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Returns the next record, or {@code null} at the end of the table.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line)) {
                processCommentLine(line, reader.getLineNumber());
            } else {
                final String[] values = line.length < columns.columnCount() ? completeShortLine(line) : line;
                if (values.length != columns.columnCount()) {
                    throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
                }
                final R result = createRecord(new DataLine(reader.getLineNumber(), values, columns, this::formatException));
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }

    /**
     * Called with a data line that has fewer values than there are columns.
     * <p>
     * The default returns the line unchanged, so that it is rejected. Sub-classes whose trailing columns may be
     * left out return a line with as many values as columns.
     * </p>
     */
    protected String[] completeShortLine(final String[] line) {
        return line;
    }

    private void processCommentLine(final String[] line, final long lineNumber) {
        final String commentText = String.join(TableUtils.COLUMN_SEPARATOR_STRING, line).substring(TableUtils.COMMENT_PREFIX.length());
        processCommentLine(commentText, lineNumber);
    }

    /**
     * Called with the text of every comment line, without the comment prefix.
     */
    protected void processCommentLine(@SuppressWarnings("unused") final String commentText, @SuppressWarnings("unused") final long lineNumber) {
        // nothing by default.
    }

    /**
     * Transforms a data-line into a record.
     *
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                fetchIfNeeded();
                return nextRecord != null;
            }

            @Override
            public R next() {
                fetchIfNeeded();
                if (nextRecord == null) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }

            private void fetchIfNeeded() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
            }
        };
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    /**
     * Reads all remaining records into a list.
     */
    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }

    public String getSource() {
        return source;
    }
}
