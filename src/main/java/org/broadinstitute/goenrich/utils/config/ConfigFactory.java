package org.broadinstitute.goenrich.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.goenrich.exceptions.GoEnrichException;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.LoggingUtils;
import org.broadinstitute.goenrich.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Path variables declared in the {@link org.aeonbits.owner.Config.Sources} annotation of a configuration
 * interface are resolved before the configuration is created, so that a missing variable falls through
 * to the next source instead of being read as a literal path.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Sets each of the given {@code filenameProperties} that is not defined in the environment, the system properties
     * or the {@link org.aeonbits.owner.ConfigFactory} properties to an empty path.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property));
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property));
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property));
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     * @param configClass A configuration class from which to extract variable names in its {@link org.aeonbits.owner.Config.Sources}.
     * @return A list of variables in the {@link org.aeonbits.owner.Config.Sources} of the given {@code configClass}
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();

        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    /**
     * Injects the given properties to the System Properties.
     * This will NOT override properties that already exist in the system.
     */
    @VisibleForTesting
    void injectToSystemProperties(final Map<String, String> properties) {
        final Properties systemProperties = System.getProperties();

        for ( final Map.Entry<String, String> entry : properties.entrySet() ) {
            if ( systemProperties.containsKey(entry.getKey()) ) {
                logger.debug("System property already exists.  Not overriding: " + entry.getKey());
                continue;
            }

            System.setProperty(entry.getKey(), entry.getValue());

            final String propertyValueThatWasSet = System.getProperty(entry.getKey());
            if ( !entry.getValue().equals(propertyValueThatWasSet) ) {
                throw new GoEnrichException("Unable to set System Property (" + entry.getKey() + "=" + entry.getValue() + ")!");
            }
        }
    }

    /**
     * Quick way to get the enrichment configuration.
     */
    public EnrichmentConfig getEnrichmentConfig() {
        return getOrCreate( EnrichmentConfig.class );
    }

    /**
     * Wrapper around {@link org.aeonbits.owner.ConfigFactory#create(Class, Map[])} which resolves the path
     * variables of {@code clazz} first.  The result is never cached.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which resolves the path
     * variables of {@code clazz} first.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create the {@link EnrichmentConfig} for it.
     * Also sets system-level properties from the loaded configuration.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);

        final String configFileName = getConfigFilenameFromArgs( argList, configFileOption );
        if ( configFileName != null ) {
            org.aeonbits.owner.ConfigFactory.setProperty( EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
            // a cached instance may have been built before the file was known
            ConfigCache.remove(EnrichmentConfig.class);
        }

        final EnrichmentConfig configuration = getOrCreate(EnrichmentConfig.class);

        injectSystemPropertiesFromConfig( configuration );
    }

    @VisibleForTesting
    synchronized <T extends Config> T createConfigFromFile(final String configFileName, final Class<? extends T> configClass) {
        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( EnrichmentConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }
        return create(configClass);
    }

    /**
     * Injects system properties from the given configuration.
     * System properties are specified by the presence of the {@link SystemProperty} annotation.
     * This will NOT override properties that already exist in the system.
     */
    public synchronized <T extends Config> void injectSystemPropertiesFromConfig(final T config) {
        Utils.nonNull(config);

        final Map<String, String> properties = new LinkedHashMap<>();
        for ( final Map.Entry<String, Object> entry : getConfigMap(config, true).entrySet() ) {
            properties.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        injectToSystemProperties(properties);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Level#DEBUG}
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Log.LogLevel}
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config, false).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    /**
     * Reads every option of {@code config} through its getter, keyed by its {@link Config.Key} when present.
     * @param onlySystemProperties restrict the result to options annotated with {@link SystemProperty}
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config, final boolean onlySystemProperties ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // The owner proxy implements the requested interface, so only look at our own Config sub-interfaces.
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {
                if ( onlySystemProperties && !propertyMethod.isAnnotationPresent(SystemProperty.class) ) {
                    continue;
                }

                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                final String propertyName = key != null ? key.value() : propertyMethod.getName();

                try {
                    configMap.put(propertyName, propertyMethod.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException ex) {
                    throw new GoEnrichException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }

        return configMap;
    }
}
