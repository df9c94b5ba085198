package org.broadinstitute.goenrich.utils;

import org.broadinstitute.goenrich.GoEnrichBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class UtilsUnitTest extends GoEnrichBaseTest {

    @Test
    public void testDupChar() {
        Assert.assertEquals(Utils.dupChar('a', 0), "");
        Assert.assertEquals(Utils.dupChar('a', 1), "a");
        Assert.assertEquals(Utils.dupChar('a', 2), "aa");
        Assert.assertEquals(Utils.dupChar('b', 10), "bbbbbbbbbb");
    }

    @Test
    public void testWarnUserLines() {
        final List<String> lines = Utils.warnUserLines("first\nsecond");
        Assert.assertEquals(lines.size(), 6);
        Assert.assertEquals(lines.get(0), Utils.dupChar('*', 80));
        Assert.assertEquals(lines.get(3), "* first");
        Assert.assertEquals(lines.get(4), "* second");
        Assert.assertEquals(lines.get(5), Utils.dupChar('*', 80));
    }

    @Test
    public void testNonNull() {
        final Object o = new Object();
        Assert.assertSame(Utils.nonNull(o), o);
        Assert.assertSame(Utils.nonNull(o, "message"), o);
        Assert.assertSame(Utils.nonNull(o, () -> "message"), o);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "the thing cannot be null")
    public void testNonNullThrows() {
        Utils.nonNull(null, "the thing cannot be null");
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "supplied")
    public void testNonNullWithSupplierThrows() {
        Utils.nonNull(null, () -> "supplied");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonEmptyCollectionThrows() {
        Utils.nonEmpty(Collections.emptyList(), "empty");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonEmptyStringThrows() {
        Utils.nonEmpty("", "empty");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testContainsNoNullThrows() {
        Utils.containsNoNull(Arrays.asList("a", null), "has null");
    }

    @Test
    public void testValidIndex() {
        Assert.assertEquals(Utils.validIndex(0, 1), 0);
        Assert.assertEquals(Utils.validIndex(4, 5), 4);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValidIndexNegative() {
        Utils.validIndex(-1, 5);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValidIndexPastTheEnd() {
        Utils.validIndex(5, 5);
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "not thrown");
        Utils.validateArg(true, () -> "not thrown");
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "bad arg")
    public void testValidateArgThrows() {
        Utils.validateArg(false, () -> "bad arg");
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = "bad state")
    public void testValidateThrows() {
        Utils.validate(false, "bad state");
    }

    @Test
    public void testStream() {
        final List<Integer> values = Arrays.asList(3, 1, 2);
        Assert.assertEquals(Utils.stream(values).collect(Collectors.toList()), values);
    }
}
