package org.broadinstitute.goenrich.utils.config;

import org.broadinstitute.goenrich.GoEnrichBaseTest;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.tools.enrichment.PValueCorrection;
import org.broadinstitute.goenrich.utils.FisherExactTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

public final class ConfigFactoryUnitTest extends GoEnrichBaseTest {

    @AfterMethod
    public void resetConfigPathProperty() {
        // do not leak a test configuration file into the tools run by other tests
        org.aeonbits.owner.ConfigFactory.setProperty(EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }

    @DataProvider
    public Object[][] configFileArgs() {
        final String option = "--goenrich-config-file";
        return new Object[][]{
                {new String[]{"FunctionalEnrichment", option, "my.properties"}, option, "my.properties"},
                {new String[]{option, "my.properties", "--verbosity", "ERROR"}, option, "my.properties"},
                {new String[]{"FunctionalEnrichment", "--verbosity", "ERROR"}, option, null},
                {new String[]{}, option, null},
        };
    }

    @Test(dataProvider = "configFileArgs")
    public void testGetConfigFilenameFromArgs(final String[] args, final String option, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, option), expected);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testGetConfigFilenameFromArgsWithoutValue() {
        ConfigFactory.getConfigFilenameFromArgs(new String[]{"FunctionalEnrichment", "--goenrich-config-file"}, "--goenrich-config-file");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testGetConfigFilenameFromArgsFollowedByOption() {
        ConfigFactory.getConfigFilenameFromArgs(new String[]{"--goenrich-config-file", "--verbosity", "ERROR"}, "--goenrich-config-file");
    }

    @Test
    public void testGetSourcesAnnotationPathVariables() {
        final List<String> variables = ConfigFactory.getInstance().getSourcesAnnotationPathVariables(EnrichmentConfig.class);
        Assert.assertEquals(variables, Arrays.asList(EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME, EnrichmentConfig.CONFIG_FILE_VARIABLE_CLASS_PATH));
    }

    @Test
    public void testDefaultValues() {
        final EnrichmentConfig config = ConfigFactory.getInstance().create(EnrichmentConfig.class);
        Assert.assertFalse(config.goenrich_stacktrace_on_user_exception());
        Assert.assertEquals(config.fisher_alternative(), FisherExactTest.Alternative.GREATER);
        Assert.assertEquals(config.p_value_correction(), PValueCorrection.BENJAMINI_HOCHBERG);
        Assert.assertEquals(config.summary_term_count(), 20);
    }

    @Test
    public void testCreateConfigFromFileMergesWithDefaults() throws IOException {
        final File configFile = createTempFile("goenrich.config", ".properties");
        Files.write(configFile.toPath(), Arrays.asList(
                "fisher_alternative = LESS",
                "summary_term_count = 5"), StandardCharsets.UTF_8);

        final EnrichmentConfig config = ConfigFactory.getInstance().createConfigFromFile(configFile.getAbsolutePath(), EnrichmentConfig.class);
        Assert.assertEquals(config.fisher_alternative(), FisherExactTest.Alternative.LESS);
        Assert.assertEquals(config.summary_term_count(), 5);
        // not in the file, so taken from the packaged properties
        Assert.assertEquals(config.p_value_correction(), PValueCorrection.BENJAMINI_HOCHBERG);
    }

    @Test
    public void testCustomBooleanConverterTrims() throws IOException {
        final File configFile = createTempFile("goenrich.config", ".properties");
        Files.write(configFile.toPath(), Collections.singletonList("goenrich_stacktrace_on_user_exception = true   "), StandardCharsets.UTF_8);

        final EnrichmentConfig config = ConfigFactory.getInstance().createConfigFromFile(configFile.getAbsolutePath(), EnrichmentConfig.class);
        Assert.assertTrue(config.goenrich_stacktrace_on_user_exception());
    }

    @Test
    public void testGetConfigMap() {
        final EnrichmentConfig config = ConfigFactory.getInstance().create(EnrichmentConfig.class);

        final Map<String, Object> all = ConfigFactory.getConfigMap(config, false);
        Assert.assertEquals(all.keySet(), new HashSet<>(Arrays.asList(
                "goenrich_stacktrace_on_user_exception", "fisher_alternative", "p_value_correction", "summary_term_count")));
        Assert.assertEquals(all.get("summary_term_count"), 20);

        final Map<String, Object> systemProperties = ConfigFactory.getConfigMap(config, true);
        Assert.assertEquals(systemProperties.keySet(), Collections.singleton("goenrich_stacktrace_on_user_exception"));
    }

    @Test
    public void testInjectToSystemPropertiesDoesNotOverride() {
        final String newProperty = "goenrich.test.ConfigFactoryUnitTest.new";
        final String existingProperty = "goenrich.test.ConfigFactoryUnitTest.existing";
        System.setProperty(existingProperty, "original");
        try {
            final Map<String, String> properties = new LinkedHashMap<>();
            properties.put(newProperty, "injected");
            properties.put(existingProperty, "injected");
            ConfigFactory.getInstance().injectToSystemProperties(properties);

            Assert.assertEquals(System.getProperty(newProperty), "injected");
            Assert.assertEquals(System.getProperty(existingProperty), "original");
        } finally {
            System.clearProperty(newProperty);
            System.clearProperty(existingProperty);
        }
    }

    @Test
    public void testUndefinedPathVariableIsSetToNoPath() {
        final String property = "goenrich.test.ConfigFactoryUnitTest.undefinedPath";
        ConfigFactory.getInstance().checkFileNamePropertyExistenceAndSetConfigFactoryProperties(Collections.singletonList(property));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(property), ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }
}
