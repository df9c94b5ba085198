package org.broadinstitute.goenrich.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.broadinstitute.goenrich.GoEnrichBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends GoEnrichBaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.ERROR, Level.ERROR},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.DEBUG, Level.DEBUG},
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelConversion(final Log.LogLevel htsjdkLevel, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(htsjdkLevel), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), htsjdkLevel);
    }

    @Test
    public void testEveryVerbosityIsMapped() {
        for (final Log.LogLevel level : Log.LogLevel.values()) {
            Assert.assertNotNull(LoggingUtils.levelToLog4jLevel(level), level.name());
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSetNullLoggingLevel() {
        LoggingUtils.setLoggingLevel(null);
    }
}
