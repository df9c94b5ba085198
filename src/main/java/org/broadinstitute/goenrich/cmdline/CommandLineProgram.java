package org.broadinstitute.goenrich.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.*;
import org.broadinstitute.goenrich.utils.LoggingUtils;
import org.broadinstitute.goenrich.utils.Utils;
import org.broadinstitute.goenrich.utils.config.ConfigFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Abstract class to facilitate writing command-line programs.
 *
 * To use:
 *
 * 1. Extend this class with a concrete class that has data members annotated with @Argument and/or @ArgumentCollection.
 *
 * 2. If there is any custom command-line validation, override customCommandLineValidation().  When this method is
 * called, the command line has been parsed and set into the data members of the concrete class.
 *
 * 3. Implement a method doWork().  This is called after successful command-line processing.
 * The doWork() method may return null or a result object (they are not interpreted by the toolkit and passed onto the caller).
 * doWork() may throw unchecked exceptions, which are NOT caught and passed onto the VM.
 *
 */
public abstract class CommandLineProgram {

    // Logger is a protected instance variable here to output the correct class name
    // with concrete sub-classes of CommandLineProgram.  Since CommandLineProgram is
    // abstract, this is fine (as long as no logging has to happen statically in this class).
    protected final Logger logger = LogManager.getLogger(this.getClass());

    private static final String DEFAULT_TOOLKIT_NAME = "goenrich";

    @ArgumentCollection(doc="Special Arguments that have meaning to the argument parsing system.  " +
            "It is unlikely these will ever need to be accessed by the command line program")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME, doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress job-summary info on System.err.", common=true)
    public Boolean QUIET = false;

    // This option is here for documentation completeness.
    // This is actually parsed out in Main to initialize configuration files because
    // we need to have the configuration completely set up before we create our CommandLinePrograms.
    // (Some of the CommandLinePrograms have default values set to config values.)
    @Argument(fullName = StandardArgumentDefinitions.CONFIG_FILE_OPTION,
              doc = "A configuration file to use with goenrich.",
              common = true,
              optional = true)
    public String CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    private String commandLine;

    /**
     * Perform initialization/setup after command-line argument parsing but before doWork() is invoked.
     * Default implementation does nothing.
     * Subclasses can override to perform initialization.
     */
    protected void onStartup() {}

    /**
     * Do the work after command line has been parsed. RuntimeException may be
     * thrown by this method, and are reported appropriately.
     * @return the return value or null is there is none.
     */
    protected abstract Object doWork();

    /**
     * Perform cleanup after doWork() is finished. Always executes even if an exception is thrown during the run.
     * Default implementation does nothing.
     * Subclasses can override to perform cleanup.
     */
    protected void onShutdown() {}

    /**
     * Template method that runs the startup hook, doWork and then the shutdown hook.
     */
    public final Object runTool(){
        try {
            logger.info("Initializing engine");
            onStartup();
            logger.info("Done initializing engine");
            return doWork();
        } finally {
            logger.info("Shutting down engine");
            onShutdown();
        }
    }

    public Object instanceMainPostParseArgs() {
        final ZonedDateTime startDateTime = ZonedDateTime.now();

        LoggingUtils.setLoggingLevel(VERBOSITY);  // propagate the VERBOSITY level to logging frameworks

        if (!QUIET) {
            printStartupMessage(startDateTime);
        }

        try {
            return runTool();
        } finally {
            // Emit the time even if program throws
            if (!QUIET) {
                final ZonedDateTime endDateTime = ZonedDateTime.now();
                final double elapsedMinutes = (Duration.between(startDateTime, endDateTime).toMillis()) / (1000d * 60d);
                final String elapsedString  = new DecimalFormat("#,##0.00").format(elapsedMinutes);
                System.err.println("[" + Utils.getDateTimeForDisplay(endDateTime) + "] " +
                        getClass().getName() + " done. Elapsed time: " + elapsedString + " minutes.");
            }
        }
    }

    /**
     * Parses the arguments and runs the tool.
     * @return 0 if an information only argument like help or version was given, otherwise the result of doWork().
     */
    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            //an information only argument like help or version was specified, just exit
            return 0;
        }
        return instanceMainPostParseArgs();
    }

    /**
     * Put any custom command-line validation in an override of this method.
     * clp is initialized at this point and can be used to print usage and access argv.
     * Any arguments set by command-line parser can be validated.
     * @return null if command line is valid.  If command line is invalid, returns an array of error message
     *         to be written to the appropriate place.
     * @throws CommandLineException if command line is invalid and handling as exception is preferred.
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parse arguments and initialize any values annotated with {@link Argument}
     * @return true if program should be executed, false if an information only argument like {@link SpecialArgumentsCollection#HELP_FULLNAME} was specified
     * @throws CommandLineException if command line validation fails
     */
    protected final boolean parseArgs(final String[] argv) {
        final boolean ret = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!ret) {
            return false;
        }

        final String[] customErrorMessages = customCommandLineValidation();
        if (customErrorMessages != null) {
            throw new CommandLineException("Command Line Validation failed:" + Arrays.stream(customErrorMessages).collect(
                    Collectors.joining(", ")));
        }
        return true;
    }

    /**
     * Prints a user-friendly message on startup with some information about who we are and the
     * runtime environment.
     */
    protected void printStartupMessage(final ZonedDateTime startDateTime) {
        logger.info(Utils.dupChar('-', 60));
        logger.info(String.format("%s v%s", getToolkitName(), getVersion()));
        logger.info(String.format("Executing as %s@%s on %s v%s %s",
                System.getProperty("user.name"), getHostName(),
                System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch")));
        logger.info(String.format("Java runtime: %s v%s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(startDateTime));
        logger.info(Utils.dupChar('-', 60));

        // Log the configuration options:
        ConfigFactory.logConfigFields(ConfigFactory.getInstance().getEnrichmentConfig(), Log.LogLevel.DEBUG);
    }

    private String getHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            logger.debug("Could not resolve the local host name", e);
            return "unknown";
        }
    }

    protected String getToolkitName() {
        final String title = getClass().getPackage().getImplementationTitle();
        return title != null ? title : DEFAULT_TOOLKIT_NAME;
    }

    /**
     * @return the version of this tool, as recorded in the jar manifest, or "Unavailable" when run from classes.
     */
    public String getVersion() {
        final String versionString = getClass().getPackage().getImplementationVersion();
        return versionString != null ? versionString : "Unavailable";
    }

    /**
     * @return the commandline used to run this program, will be null if arguments have not yet been parsed
     */
    public final String getCommandLine() {
        return commandLine;
    }

    /**
     * @return get usage and help information for this command line program if it is available
     *
     */
    public final String getUsage(){
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    /**
     * @return this programs CommandLineParser.  If one is not initialized yet this will initialize it.
     */
    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if( commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
