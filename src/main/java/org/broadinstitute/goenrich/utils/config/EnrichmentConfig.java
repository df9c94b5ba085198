package org.broadinstitute.goenrich.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.broadinstitute.goenrich.tools.enrichment.PValueCorrection;
import org.broadinstitute.goenrich.utils.FisherExactTest;

/**
 * Configuration file for enrichment options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + EnrichmentConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:EnrichmentConfig.properties",
 *        4)   "classpath:org/broadinstitute/goenrich/utils/config/EnrichmentConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 *
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                    // Variable for file loading
        "classpath:${" + EnrichmentConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",              // Variable for class path loading
        "file:EnrichmentConfig.properties",                                                   // Default path
        "classpath:org/broadinstitute/goenrich/utils/config/EnrichmentConfig.properties"      // Class path
})
public interface EnrichmentConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link EnrichmentConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "EnrichmentConfig.pathToConfig";

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link EnrichmentConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "EnrichmentConfig.classPathToConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @SystemProperty
    @Key("goenrich_stacktrace_on_user_exception")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("false")
    Boolean goenrich_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // FunctionalEnrichment defaults:
    // ----------------------------------------------------------

    @Key("fisher_alternative")
    @DefaultValue("GREATER")
    FisherExactTest.Alternative fisher_alternative();

    @Key("p_value_correction")
    @DefaultValue("BENJAMINI_HOCHBERG")
    PValueCorrection p_value_correction();

    /**
     * How many of the most significant terms are echoed to the log once the results are written.
     */
    @Key("summary_term_count")
    @DefaultValue("20")
    int summary_term_count();
}
