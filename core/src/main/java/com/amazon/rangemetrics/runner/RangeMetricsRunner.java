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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import com.amazon.rangemetrics.RangeEvaluator;
import com.amazon.rangemetrics.TimeRange;
import com.amazon.rangemetrics.config.EvaluatorConfig;
import com.amazon.rangemetrics.interval.LabelReader;
import com.amazon.rangemetrics.interval.LabeledSeries;
import com.amazon.rangemetrics.returntypes.EvaluationResult;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a file of real anomaly labels and a file of predicted anomaly labels,
 * one 0/1 label per line, and prints range based precision, recall and
 * F-score.
 */
public class RangeMetricsRunner {

    protected final ArgumentParser argumentParser;
    protected final ObjectMapper objectMapper;

    public RangeMetricsRunner() {
        this(new ArgumentParser(RangeMetricsRunner.class.getName(),
                "Compute range based Precision, Recall and F-Score of predicted anomalies against real anomalies."));
    }

    public RangeMetricsRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
        this.objectMapper = new ObjectMapper();
    }

    public static void main(String... args) throws IOException {
        RangeMetricsRunner runner = new RangeMetricsRunner();
        ArgumentParser parser = runner.argumentParser;
        try {
            runner.parse(args);
        } catch (IllegalArgumentException e) {
            parser.printUsageAndExit("%s", e.getMessage());
        }

        if (parser.isHelpRequested()) {
            parser.printUsage();
            return;
        }

        List<String> files = parser.getPositionalArguments();
        if (files.size() != 2) {
            parser.printUsageAndExit("expected <real_data_file> and <predicted_data_file>, got %d file arguments",
                    files.size());
        }

        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        try (BufferedReader real = Files.newBufferedReader(Paths.get(files.get(0)), StandardCharsets.UTF_8);
                BufferedReader predicted = Files.newBufferedReader(Paths.get(files.get(1)),
                        StandardCharsets.UTF_8)) {
            runner.run(real, predicted, out);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error: Could not read file: " + e.getMessage());
            System.exit(1);
        }
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Reads both label sequences, evaluates them with the parsed options and
     * writes the result.
     *
     * @param realIn      labels of the real anomalies
     * @param predictedIn labels of the predicted anomalies
     * @param out         where the output is written
     * @return the computed metrics
     * @throws IOException              if reading or writing fails
     * @throws IllegalArgumentException if a label is invalid, the two sequences
     *                                  differ in length, they are empty or an
     *                                  option value is invalid
     */
    public EvaluationResult run(BufferedReader realIn, BufferedReader predictedIn, PrintWriter out)
            throws IOException {
        MetricMode mode = argumentParser.getMetricMode();
        LabeledSeries real = new LabelReader(mode.getRealExtraction()).read(realIn);
        LabeledSeries predicted = new LabelReader(mode.getPredictedExtraction()).read(predictedIn);

        checkArgument(real.getLabelCount() == predicted.getLabelCount(), "Number of data items are different!");
        checkArgument(real.getLabelCount() > 0, "No data items!");

        RangeEvaluator evaluator = new RangeEvaluator(real.getRanges(), predicted.getRanges(), buildConfig());

        if (argumentParser.getVerbose()) {
            writeRanges("Real Anomalies:", evaluator.getRealRanges(), out);
            writeRanges("Predicted Anomalies:", evaluator.getPredictedRanges(), out);
        }

        evaluator.update();
        EvaluationResult result = new EvaluationResult(evaluator.getPrecision(), evaluator.getRecall(),
                evaluator.getFscore());
        writeResult(result, out);
        out.flush();
        return result;
    }

    protected EvaluatorConfig buildConfig() {
        return EvaluatorConfig.builder().beta(argumentParser.getBeta()).alphaRecall(argumentParser.getAlphaRecall())
                .gamma(argumentParser.getGamma()).deltaPrecision(argumentParser.getDeltaPrecision())
                .deltaRecall(argumentParser.getDeltaRecall()).build();
    }

    protected void writeRanges(String title, List<TimeRange> ranges, PrintWriter out) {
        out.println(title);
        ranges.forEach(range -> out.println(range.toString()));
    }

    protected void writeResult(EvaluationResult result, PrintWriter out) throws IOException {
        if (argumentParser.isJsonOutput()) {
            out.println(objectMapper.writeValueAsString(result));
        } else {
            out.println("Precision = " + result.getPrecision());
            out.println("Recall = " + result.getRecall());
            out.println("F-Score = " + result.getFscore());
        }
    }
}
