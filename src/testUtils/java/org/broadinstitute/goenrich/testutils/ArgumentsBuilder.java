package org.broadinstitute.goenrich.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.goenrich.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.goenrich.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists
 * Use only in tests.
 */
public final class ArgumentsBuilder {
    private final List<String> args= new ArrayList<>();

    public ArgumentsBuilder(){}

    /**
     * Add a string to the arguments list
     * Strings are processed specially, they are reformatted to match the new unix style arguments
     * @param arg A string representing one or more arguments
     * @return the ArgumentsBuilder
     */
    public ArgumentsBuilder addRaw(String arg){
        List<String> chunks = Arrays.asList(StringUtils.split(arg.trim()));
        args.addAll(chunks);
        return this;
    }

    // ARGUMENT/VALUE METHODS

    /**
     * Add an argument with a given value to this builder. The value is kept as a single argument even if it
     * contains spaces.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file){
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value){
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Enum<?> enummerationValue){
        Utils.nonNull(enummerationValue);
        return add(argumentName, enummerationValue.name());
    }

    // OUTPUT

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    //FLAG

    /**
     * add an argument with no value (the boolean is set to true by Barclay)
     */
    public ArgumentsBuilder addFlag(final String argumentName) {
        Utils.nonNull(argumentName);
        return addRaw("--" + argumentName);
    }

    /**
     * @return the arguments as a List<String>
     */
    public List<String> getArgsList(){
        return args;
    }

    /**
     * @return the arguments as a String[]
     */
    public String[] getArgsArray(){
        return args.toArray(new String[this.args.size()]);
    }

    /**
     * @return the arguments as a single String
     */
    @Override
    public String toString(){
        return String.join(" ", args);
    }
}
