/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.rangemetrics.runner;

import static com.amazon.rangemetrics.CommonUtils.checkArgument;
import static com.amazon.rangemetrics.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.rangemetrics.config.OverlapCardinality;
import com.amazon.rangemetrics.config.PositionalBias;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/rangemetrics-core-1.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final List<String> positionalArguments;
    private boolean helpRequested;
    private final StringArgument metricMode;
    private final DoubleArgument beta;
    private final DoubleArgument alphaRecall;
    private final StringArgument gamma;
    private final StringArgument deltaPrecision;
    private final StringArgument deltaRecall;
    private final SwitchArgument verbose;
    private final StringArgument outputFormat;

    /**
     * Create a new ArgumentParser.The runner class and runner description will be
     * used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();
        positionalArguments = new ArrayList<>();

        metricMode = new StringArgument("-m", "--metric-mode",
                "How labels become ranges: classical (unit-size ranges on both sides), time-series (intervals on "
                        + "both sides) or numenta (intervals for real, unit-size for predicted).",
                MetricMode.TIME_SERIES.getOptionName(), MetricMode::fromOptionName);

        addArgument(metricMode);

        beta = new DoubleArgument("-b", "--beta",
                "F-Score parameter (relative importance of Recall vs. Precision), positive real number.", 1.0,
                x -> checkArgument(x > 0, "beta should be greater than 0"));

        addArgument(beta);

        alphaRecall = new DoubleArgument("-a", "--alpha-recall",
                "Relative weight of existence reward for Recall, real number in [0 .. 1].", 0.0,
                x -> checkArgument(x >= 0 && x <= 1.0, "alpha-recall should be between 0 and 1"));

        addArgument(alphaRecall);

        gamma = new StringArgument("-g", "--gamma",
                "Overlap cardinality function for Precision & Recall: one, reciprocal or udf_gamma.", "one",
                OptionNames::toOverlapCardinality);

        addArgument(gamma);

        deltaPrecision = new StringArgument("-p", "--delta-precision",
                "Positional bias function for Precision: flat, front, middle, back or udf_delta.", "flat",
                OptionNames::toPositionalBias);

        addArgument(deltaPrecision);

        deltaRecall = new StringArgument("-r", "--delta-recall",
                "Positional bias function for Recall: flat, front, middle, back or udf_delta.", "flat",
                OptionNames::toPositionalBias);

        addArgument(deltaRecall);

        verbose = new SwitchArgument("-v", "--verbose", "List the real and predicted anomaly ranges.");

        addArgument(verbose);

        outputFormat = new StringArgument("-o", "--output-format", "Output format of the metrics: text or json.",
                "text", x -> checkArgument("text".equals(x) || "json".equals(x),
                        "output format should be text or json"));

        addArgument(outputFormat);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments. Arguments that do not start
     * with a dash are collected as positional arguments.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException if a flag is unknown, a value is missing or
     *                                  a value is invalid.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            Argument<?> argument = shortFlags.containsKey(flag) ? shortFlags.get(flag) : longFlags.get(flag);
            if (argument != null) {
                if (argument.takesValue()) {
                    checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
                    argument.parse(arguments[++i]);
                } else {
                    argument.parse(Boolean.TRUE.toString());
                }
            } else if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
            } else if (flag.startsWith("-")) {
                throw new IllegalArgumentException("Unknown argument: " + flag);
            } else {
                positionalArguments.add(flag);
            }

            i++;
        }
    }

    /**
     * Print a usage message.
     *
     * @param out where the message is written
     */
    public void printUsage(PrintStream out) {
        out.println(String.format("Usage: java -cp %s %s [options] <real_data_file> <predicted_data_file>",
                ARCHIVE_NAME, runnerClass));
        out.println();
        out.println(runnerDescription);
        out.println();
        out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted().forEach(msg -> out.println("\t" + msg));

        out.println();
        out.println("\t--help, -h: Print this help message and exit.");
        out.println();
        out.println("Option values may also be given as 'x' to use the default.");
    }

    public void printUsage() {
        printUsage(System.out);
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage(System.err);
        System.exit(1);
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    /**
     * @return the arguments that were not flags or flag values, in order
     */
    public List<String> getPositionalArguments() {
        return Collections.unmodifiableList(positionalArguments);
    }

    /**
     * @return the user-specified metric mode
     */
    public MetricMode getMetricMode() {
        return MetricMode.fromOptionName(metricMode.getValue());
    }

    /**
     * @return the user-specified value of the beta parameter
     */
    public double getBeta() {
        return beta.getValue();
    }

    /**
     * @return the user-specified value of the alpha-recall parameter
     */
    public double getAlphaRecall() {
        return alphaRecall.getValue();
    }

    public OverlapCardinality getGamma() {
        return OptionNames.toOverlapCardinality(gamma.getValue());
    }

    public PositionalBias getDeltaPrecision() {
        return OptionNames.toPositionalBias(deltaPrecision.getValue());
    }

    public PositionalBias getDeltaRecall() {
        return OptionNames.toPositionalBias(deltaRecall.getValue());
    }

    public boolean getVerbose() {
        return verbose.getValue();
    }

    public boolean isJsonOutput() {
        return "json".equals(outputFormat.getValue());
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        /**
         * @return false if the argument is a switch that is given without a value
         */
        public boolean takesValue() {
            return true;
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class SwitchArgument extends Argument<Boolean> {
        public SwitchArgument(String shortFlag, String longFlag, String description) {
            super(shortFlag, longFlag, description, false, Boolean::parseBoolean);
        }

        @Override
        public boolean takesValue() {
            return false;
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, ArgumentParser::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, ArgumentParser::parseDouble);
        }

        @Override
        public void parse(String string) {
            if (!OptionNames.DEFAULT_VALUE.equals(string)) {
                super.parse(string);
            }
        }
    }

    private static Double parseDouble(String string) {
        try {
            return Double.parseDouble(string);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + string, e);
        }
    }
}
