package org.broadinstitute.goenrich.utils.tsv;

import org.broadinstitute.goenrich.utils.Utils;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Represents a list of table columns.
 * <p>
 * Column names are unique and the first one cannot start with the {@link TableUtils#COMMENT_PREFIX comment prefix}.
 * </p>
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    public TableColumnCollection(final Iterable<String> names) {
        this(Utils.stream(Utils.nonNull(names, "the names cannot be null")).toArray(String[]::new));
    }

    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, an unmodifiable list.
     */
    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * @return -1 if there is no such a column.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final Iterable<String> names) {
        for (final String name : Utils.nonNull(names, "names cannot be null")) {
            if (!contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the given names are exactly these columns in the same order.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "names cannot be null");
        return Arrays.asList(names).equals(this.names);
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a column name array is valid: non-empty, no {@code null}s, no repeats and a first name that
     * does not start with the comment prefix.
     *
     * @param columnNames the column names to check.
     * @param exceptionFactory creates the exception thrown when the names are not valid.
     * @return the same array as the input.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");
        if (columnNames.length == 0) {
            throw exceptionFactory.apply("there must be at least one column");
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw exceptionFactory.apply("more than one column have the same name: " + columnName);
            }
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw exceptionFactory.apply("the first column name cannot start with the comment prefix");
        }
        return columnNames;
    }
}
