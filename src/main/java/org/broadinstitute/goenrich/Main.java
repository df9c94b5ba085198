package org.broadinstitute.goenrich;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.*;
import org.broadinstitute.goenrich.cmdline.CommandLineProgram;
import org.broadinstitute.goenrich.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.tools.enrichment.FunctionalEnrichment;
import org.broadinstitute.goenrich.utils.Utils;
import org.broadinstitute.goenrich.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * This is the main class of goenrich and is the way of executing individual command line programs.
 *
 * CommandLinePrograms are listed in a single command line interface based on the java package specified to instanceMain.
 *
 * If you want your own single command line program, extend this class and give instanceMain a new list of java packages in which to
 * search for classes that extend CommandLineProgram.
 *
 */
public class Main {

    static {
        // Force numbers to be displayed in US format, whatever the default locale.
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     * This value may not be used when running Main.main
     */
    private static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * exit value when an unrecoverable {@link UserException} occurs
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    private static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "GOENRICH_STACKTRACE_ON_USER_EXCEPTION";

    private static final String KNRM = "\u001B[0m"; // reset
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";
    private static final String BOLDRED = "\u001B[1m\u001B[31m";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The packages we wish to include in our command line.
     */
    protected List<String> getPackageList() {
        return Collections.singletonList("org.broadinstitute.goenrich");
    }

    /**
     * The single classes we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(FunctionalEnrichment.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "goenrich";
    }

    /**
     * Parse the config file path from the arguments and initialize the configuration.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);
    }

    /**
     * The main method.
     * <p/>
     * Give a list of java packages in which to search for classes that extend CommandLineProgram and a list of single CommandLineProgram classes.
     * Those will be included on the command line.
     */
    public Object instanceMain(final String[] args, final List<String> packageList, final List<Class<? extends CommandLineProgram>> classList, final String commandLineName) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args, packageList, classList, commandLineName);
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs thes are the raw arguments from the command line, the first will be stripped off
     * @return the result of running {code program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        // we can lop off the first two arguments but it requires an array copy or alternatively we could update CLP to remove them
        // in the constructor do the former in this implementation.
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * Set up the configuration file store and create the {@link CommandLineProgram} to run.
     */
    protected CommandLineProgram setupConfigAndExtractProgram(final String[] args,
                                                              final List<String> packageList,
                                                              final List<Class<? extends CommandLineProgram>> classList,
                                                              final String commandLineName ){
        // The configuration must be in place before the tool is instantiated since some defaults come from it.
        parseArgsForConfigSetup(args);
        return extractCommandLineProgram(args, packageList, classList, commandLineName);
    }

    /**
     * The entry point to goenrich from commandline.  It calls {@link #instanceMain(String[])} with the
     * packages, classes and command line name of this class.
     */
    public Object instanceMain(final String[] args) {
        return instanceMain(args, getPackageList(), getClassList(), getCommandLineName());
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception (if non-user exception, through {@link #handleNonUserException(Exception)})
     * and exit with the concrete error exit value.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args, getPackageList(), getClassList(), getCommandLineName());
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     */
    protected void handleUserException(Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point to the toolkit from commandline. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getEnrichmentConfig().goenrich_stacktrace_on_user_exception();
    }

    /**
     * Returns the command line program specified, or prints the usage and exits with exit code 1 *
     */
    private CommandLineProgram extractCommandLineProgram( final String[] args,
                                                          final List<String> packageList,
                                                          final List<Class<? extends CommandLineProgram>> classList,
                                                          final String commandLineName ) {
        /** Get the set of classes that are our command line programs **/
        final ClassFinder classFinder = new ClassFinder();
        for (final String pkg : packageList) {
            classFinder.find(pkg, CommandLineProgram.class);
        }
        String missingAnnotationClasses = "";
        final Set<Class<?>> toCheck = new LinkedHashSet<>(classFinder.getClasses());
        toCheck.addAll(classList);
        final Map<String, Class<?>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<?> clazz : toCheck) {
            // No interfaces, synthetic, primitive, local, or abstract classes.
            if (canMakeInstances(clazz)) {
                final CommandLineProgramProperties property = getProgramProperty(clazz);
                // Check for missing annotations
                if (null == property) {
                    if (missingAnnotationClasses.isEmpty()) missingAnnotationClasses += clazz.getSimpleName();
                    else missingAnnotationClasses += ", " + clazz.getSimpleName();
                } else {
                    if (simpleNameToClass.containsKey(clazz.getSimpleName())) {
                        throw new RuntimeException("Simple class name collision: " + clazz.getName());
                    }
                    simpleNameToClass.put(clazz.getSimpleName(), clazz);
                }
            }
        }
        if (!missingAnnotationClasses.isEmpty()) {
            throw new RuntimeException("The following classes are missing the required CommandLineProgramProperties annotation: " + missingAnnotationClasses);
        }

        final Set<Class<?>> classes = new LinkedHashSet<>(simpleNameToClass.values());

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, classes, commandLineName);
        } else {
            if (simpleNameToClass.containsKey(args[0])) {
                final Class<?> clazz = simpleNameToClass.get(args[0]);
                try {
                    return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new RuntimeException(e);
                }
            }
            printUsage(System.err, classes, commandLineName);
            throw new UserException(getSuggestedAlternateCommand(classes, args[0]));
        }
        return null;
    }

    private static boolean canMakeInstances(final Class<?> clazz) {
        return clazz != null &&
                !clazz.isPrimitive() &&
                !clazz.isSynthetic() &&
                !clazz.isInterface() &&
                !clazz.isLocalClass() &&
                !Modifier.isAbstract(clazz.getModifiers());
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    /**
     * Lists the programs that are not omitted from the command line, by name, with their one-line summary.
     */
    private void printUsage(final PrintStream destinationStream, final Set<Class<?>> classes, final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append(BOLDRED + "USAGE: " + commandLineName + " " + GREEN + "<program name>" + BOLDRED + " [-h]\n\n" + KNRM)
                .append(BOLDRED + "Available Programs:\n" + KNRM);
        classes.stream()
                .filter(clazz -> !getProgramProperty(clazz).omitFromCommandLine())
                .sorted(Comparator.comparing(Class::getSimpleName))
                .forEach(clazz -> builder.append(String.format("%s    %-45s %s%s%s\n",
                        GREEN, clazz.getSimpleName(), CYAN, getProgramProperty(clazz).oneLineSummary(), KNRM)));
        destinationStream.println(builder);
    }

    /** similarity floor for matching in printUsage **/
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT
     * @return returns an error message including the closes match if relevant.
     */
    public String getSuggestedAlternateCommand(final Set<Class<?>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        // Score against all classes
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(clazz, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == classes.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        // Output similar matches
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final Class<?> clazz : classes) {
                if (bestDistance == distances.get(clazz)) {
                    message.append(String.format("        %s", clazz.getSimpleName()));
                }
            }
        }
        return message.toString();
    }
}
