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

import com.amazon.rangemetrics.interval.ExtractionMode;

/**
 * The kinds of metrics the runner computes, expressed as the way real and
 * predicted labels are turned into ranges.
 */
public enum MetricMode {

    /**
     * point-wise metrics: every anomaly label is its own range on both sides
     */
    CLASSICAL("classical", ExtractionMode.UNIT_SIZE, ExtractionMode.UNIT_SIZE),
    /**
     * range metrics: runs of anomaly labels are ranges on both sides
     */
    TIME_SERIES("time-series", ExtractionMode.INTERVAL, ExtractionMode.INTERVAL),
    /**
     * real anomalies are ranges, predictions are single points
     */
    NUMENTA("numenta", ExtractionMode.INTERVAL, ExtractionMode.UNIT_SIZE);

    private final String optionName;
    private final ExtractionMode realExtraction;
    private final ExtractionMode predictedExtraction;

    MetricMode(String optionName, ExtractionMode realExtraction, ExtractionMode predictedExtraction) {
        this.optionName = optionName;
        this.realExtraction = realExtraction;
        this.predictedExtraction = predictedExtraction;
    }

    public String getOptionName() {
        return optionName;
    }

    public ExtractionMode getRealExtraction() {
        return realExtraction;
    }

    public ExtractionMode getPredictedExtraction() {
        return predictedExtraction;
    }

    /**
     * @param name an option value such as {@code time-series}
     * @return the matching mode
     * @throws IllegalArgumentException if no mode has the given name
     */
    public static MetricMode fromOptionName(String name) {
        if (OptionNames.DEFAULT_VALUE.equals(name)) {
            return TIME_SERIES;
        }
        for (MetricMode mode : values()) {
            if (mode.optionName.equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid metric mode: " + name);
    }
}
