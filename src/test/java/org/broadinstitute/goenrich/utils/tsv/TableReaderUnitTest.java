package org.broadinstitute.goenrich.utils.tsv;

import org.broadinstitute.goenrich.GoEnrichBaseTest;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

public final class TableReaderUnitTest extends GoEnrichBaseTest {

    private static final class NameAndCount {
        final String name;
        final int count;

        NameAndCount(final String name, final int count) {
            this.name = name;
            this.count = count;
        }
    }

    private static final class NameAndCountReader extends TableReader<NameAndCount> {

        // filled while the super constructor looks for the header, so no initializer here
        private List<String> comments;

        NameAndCountReader(final String text) throws IOException {
            super("test-table", new StringReader(text));
        }

        NameAndCountReader(final File file) throws IOException {
            super(file);
        }

        @Override
        protected void processColumns(final TableColumnCollection columns) {
            TableUtils.checkMandatoryColumns(columns, new TableColumnCollection("name", "count"), this::formatException);
        }

        @Override
        protected void processCommentLine(final String commentText, final long lineNumber) {
            if (comments == null) {
                comments = new ArrayList<>();
            }
            comments.add(commentText);
        }

        @Override
        protected NameAndCount createRecord(final DataLine dataLine) {
            return new NameAndCount(dataLine.get("name"), dataLine.getInt("count"));
        }
    }

    @Test
    public void testReadRecords() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader(
                "#first comment\nname\tcount\nalpha\t1\n#second comment\nbeta\t2\n")) {
            Assert.assertTrue(reader.columns().matchesExactly("name", "count"));
            final List<NameAndCount> records = reader.toList();
            Assert.assertEquals(records.size(), 2);
            Assert.assertEquals(records.get(0).name, "alpha");
            Assert.assertEquals(records.get(0).count, 1);
            Assert.assertEquals(records.get(1).name, "beta");
            Assert.assertEquals(records.get(1).count, 2);
            Assert.assertEquals(reader.comments, Arrays.asList("first comment", "second comment"));
        }
    }

    @Test
    public void testReadRecordOneByOne() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\textra\nalpha\t1\tx\n")) {
            Assert.assertEquals(reader.readRecord().name, "alpha");
            Assert.assertNull(reader.readRecord());
        }
    }

    @Test
    public void testIterator() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\nalpha\t1\nbeta\t2\n")) {
            final Iterator<NameAndCount> it = reader.iterator();
            Assert.assertTrue(it.hasNext());
            Assert.assertTrue(it.hasNext());
            Assert.assertEquals(it.next().name, "alpha");
            Assert.assertEquals(it.next().name, "beta");
            Assert.assertFalse(it.hasNext());
        }
    }

    @Test
    public void testReadFromFile() throws IOException {
        final File file = createTempFile("table-reader", ".tsv");
        Files.write(file.toPath(), Arrays.asList("name\tcount", "gamma\t3"), StandardCharsets.UTF_8);
        try (final NameAndCountReader reader = new NameAndCountReader(file)) {
            Assert.assertEquals(reader.getSource(), file.getPath());
            final List<NameAndCount> records = reader.toList();
            Assert.assertEquals(records.size(), 1);
            Assert.assertEquals(records.get(0).count, 3);
        }
    }

    @Test
    public void testEmptyTable() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\n")) {
            Assert.assertTrue(reader.toList().isEmpty());
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingHeader() throws IOException {
        new NameAndCountReader("#only a comment\n").close();
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingMandatoryColumn() throws IOException {
        new NameAndCountReader("name\tsize\nalpha\t1\n").close();
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testDuplicatedColumn() throws IOException {
        new NameAndCountReader("name\tcount\tname\n").close();
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testShortLineRejectedByDefault() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\nalpha\n")) {
            reader.toList();
        }
    }

    @Test
    public void testWrongNumberOfValues() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\nalpha\t1\t2\n")) {
            reader.toList();
            Assert.fail("expected a format error");
        } catch (final UserException.BadInput ex) {
            assertContains(ex.getMessage(), "test-table");
            assertContains(ex.getMessage(), "number of columns");
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testBadIntegerValue() throws IOException {
        try (final NameAndCountReader reader = new NameAndCountReader("name\tcount\nalpha\tone\n")) {
            reader.toList();
        }
    }
}
