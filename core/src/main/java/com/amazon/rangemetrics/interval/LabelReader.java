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

package com.amazon.rangemetrics.interval;

import static com.amazon.rangemetrics.CommonUtils.checkArgument;
import static com.amazon.rangemetrics.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.amazon.rangemetrics.TimeRange;

/**
 * Reads a sequence of anomaly labels, one per line, and extracts the anomalous
 * ranges. The integer at the start of a line is the label, which must be 0
 * (normal) or 1 (anomaly); anything following it on the line is ignored. Blank
 * lines are skipped and do not count as labels.
 */
public class LabelReader {

    public static final int NORMAL = 0;

    public static final int ANOMALY = 1;

    private static final Pattern LEADING_INTEGER = Pattern.compile("^[+-]?\\d+");

    private final ExtractionMode mode;

    public LabelReader(ExtractionMode mode) {
        this.mode = checkNotNull(mode, "mode must not be null");
    }

    public ExtractionMode getMode() {
        return mode;
    }

    /**
     * @param in a reader over the label lines
     * @return the extracted ranges and the number of labels read
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if a label is not 0 or 1
     */
    public LabeledSeries read(BufferedReader in) throws IOException {
        checkNotNull(in, "in must not be null");
        RangeCollector collector = new RangeCollector(mode);
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            collector.add(parseLabel(trimmed, lineNumber));
        }
        return collector.finish();
    }

    /**
     * Extracts ranges from labels already held in memory.
     *
     * @param labels a sequence of 0/1 labels
     * @return the extracted ranges and {@code labels.length}
     */
    public LabeledSeries extract(int... labels) {
        checkNotNull(labels, "labels must not be null");
        RangeCollector collector = new RangeCollector(mode);
        for (int i = 0; i < labels.length; i++) {
            checkArgument(labels[i] == NORMAL || labels[i] == ANOMALY,
                    String.format("Invalid anomaly label %d at position %d", labels[i], i));
            collector.add(labels[i]);
        }
        return collector.finish();
    }

    private static int parseLabel(String line, int lineNumber) {
        Matcher matcher = LEADING_INTEGER.matcher(line);
        checkArgument(matcher.find(), String.format("Invalid anomaly label '%s' on line %d", line, lineNumber));
        int label;
        try {
            label = Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid anomaly label '%s' on line %d", matcher.group(), lineNumber), e);
        }
        checkArgument(label == NORMAL || label == ANOMALY,
                String.format("Invalid anomaly label %d on line %d", label, lineNumber));
        return label;
    }

    private static class RangeCollector {

        private final ExtractionMode mode;
        private final List<TimeRange> ranges = new ArrayList<>();
        private int position = 0;
        private int runStart = -1;

        RangeCollector(ExtractionMode mode) {
            this.mode = mode;
        }

        void add(int label) {
            if (label == ANOMALY) {
                if (mode == ExtractionMode.UNIT_SIZE) {
                    ranges.add(new TimeRange(position, position));
                } else if (runStart < 0) {
                    runStart = position;
                }
            } else if (runStart >= 0) {
                ranges.add(new TimeRange(runStart, position - 1));
                runStart = -1;
            }
            position++;
        }

        LabeledSeries finish() {
            // a run still open at the end of input closes on the last label
            if (runStart >= 0) {
                ranges.add(new TimeRange(runStart, position - 1));
                runStart = -1;
            }
            return new LabeledSeries(ranges, position);
        }
    }
}
