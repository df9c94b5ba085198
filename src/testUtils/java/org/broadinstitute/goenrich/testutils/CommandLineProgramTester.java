package org.broadinstitute.goenrich.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.goenrich.Main;
import org.broadinstitute.goenrich.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility interface for CommandLine Program testing. API users that have their own Main implementation
 * should override {@link #runCommandLine(List)} to run the tool through it.
 */
public interface CommandLineProgramTester {

    /**
     * Returns the name for the tested tool.
     */
    public String getTestedToolName();

    /**
     * For testing support.  Given a name of a Main CommandLineProgram and it's arguments, builds the arguments appropriate for calling the
     * program through Main
     *
     * @param args List<String> of command line arguments
     * @return String[] of command line arguments
     */
    default String[] makeCommandLineArgs(final List<String> args) {
        return makeCommandLineArgs(args, getTestedToolName());
    }

    default String[] makeCommandLineArgs(final List<String> args, final String toolname) {
        List<String> curatedArgs = injectDefaultVerbosity(args);
        final String[] commandLineArgs = new String[curatedArgs.size() + 1];
        commandLineArgs[0] = toolname;
        int i = 1;
        for (final String arg : curatedArgs) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    /**
     * Look for --verbosity argument; if not found, supply a default value that minimizes the amount of logging output.
     */
    default List<String> injectDefaultVerbosity(final List<String> args) {
        for (String arg : args) {
            if (arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME) || arg.equalsIgnoreCase("-" + StandardArgumentDefinitions.VERBOSITY_NAME)) {
                return args;
            }
        }
        List<String> argsWithVerbosity = new ArrayList<>(args);
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
        argsWithVerbosity.add(Log.LogLevel.ERROR.name());
        return argsWithVerbosity;
    }

    /**
     * Runs the command line implemented by this test.
     */
    default Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args));
    }

    default Object runCommandLine(final String[] args) {
        return runCommandLine(Arrays.asList(args));
    }

    default Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }
}
