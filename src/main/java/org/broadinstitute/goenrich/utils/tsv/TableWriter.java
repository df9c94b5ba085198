package org.broadinstitute.goenrich.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.goenrich.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Class to write tab separated value files.
 * <p>
 * The header line is written before the first record, or on {@link #close} for a table with no records.
 * Sub-classes fill in each line by implementing {@link #composeLine(Object, DataLine)}.
 * </p>
 *
 * @param <R> the record type.
 */
public abstract class TableWriter<R> implements Closeable {

    /**
     * Number of lines written so far, comment and header included.
     */
    private long lineNumber;

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the file and column names.
     *
     * @throws IllegalArgumentException if either {@code file} or {@code tableColumns} are {@code null}.
     * @throws IOException if one was raised when opening the output file.
     */
    public TableWriter(final File file, final TableColumnCollection tableColumns) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(file, "The file cannot be null.").toPath(), StandardCharsets.UTF_8), tableColumns);
    }

    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    /**
     * Writes a comment line; the comment prefix is added.
     */
    public final void writeComment(final String comment) throws IOException {
        Utils.nonNull(comment, "The comment cannot be null.");
        writer.writeNext(new String[]{TableUtils.COMMENT_PREFIX + comment}, false);
        lineNumber++;
    }

    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(lineNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        lineNumber++;
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Writes the header if it has not been written already.
     */
    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
            lineNumber++;
        }
        headerWritten = true;
    }

    /**
     * Fills in the values of {@code dataLine} from {@code record}; every column must be set.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
