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

package com.amazon.rangemetrics.weighting;

import static com.amazon.rangemetrics.CommonUtils.checkNotNull;
import static com.amazon.rangemetrics.CommonUtils.validateInternalState;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.rangemetrics.config.Metric;
import com.amazon.rangemetrics.config.PositionalBias;

/**
 * The delta function. Assigns a weight to every position of a range, with the
 * choice of bias made separately for precision and recall.
 */
@Getter
public class PositionalBiasFunction {

    private static final Logger LOGGER = LoggerFactory.getLogger(PositionalBiasFunction.class);

    public static final PositionalBias DEFAULT_POSITIONAL_BIAS = PositionalBias.FLAT;

    private final PositionalBias precisionBias;

    private final PositionalBias recallBias;

    private final IPositionalBias udfDelta;

    public PositionalBiasFunction(PositionalBias precisionBias, PositionalBias recallBias, IPositionalBias udfDelta) {
        this.precisionBias = resolve(precisionBias, Metric.PRECISION);
        this.recallBias = resolve(recallBias, Metric.RECALL);
        this.udfDelta = checkNotNull(udfDelta, "udfDelta must not be null");
    }

    public PositionalBiasFunction(PositionalBias precisionBias, PositionalBias recallBias) {
        this(precisionBias, recallBias, IPositionalBias.CONSTANT);
    }

    private static PositionalBias resolve(PositionalBias bias, Metric metric) {
        if (bias == null) {
            LOGGER.warn("Invalid positional bias for {}, using default value {} instead", metric,
                    DEFAULT_POSITIONAL_BIAS);
            return DEFAULT_POSITIONAL_BIAS;
        }
        return bias;
    }

    public PositionalBias getBias(Metric metric) {
        checkNotNull(metric, "metric must not be null");
        return (metric == Metric.PRECISION) ? precisionBias : recallBias;
    }

    /**
     * @param position    1-indexed position inside the range
     * @param rangeLength length of the range
     * @param metric      the side being computed
     * @return the weight of the position, always strictly positive
     */
    public double apply(int position, int rangeLength, Metric metric) {
        return select(getBias(metric), position, rangeLength, metric);
    }

    protected double select(PositionalBias bias, int position, int rangeLength, Metric metric) {
        switch (bias) {
        case FLAT:
            return 1.0;
        case FRONT:
            return frontBias(position, rangeLength);
        case MIDDLE:
            return middleBias(position, rangeLength);
        case BACK:
            return backBias(position);
        case UDF_DELTA:
            return userDefined(position, rangeLength, metric);
        default:
            LOGGER.warn("Invalid positional bias for {} = {}, using default value {} instead", metric, bias,
                    DEFAULT_POSITIONAL_BIAS);
            return 1.0;
        }
    }

    private double userDefined(int position, int rangeLength, Metric metric) {
        double value = udfDelta.apply(position, rangeLength, metric);
        validateInternalState(value > 0,
                String.format("user defined positional bias must be positive, got %s for %s at position %d of %d",
                        value, metric, position, rangeLength));
        return value;
    }

    public static double frontBias(int position, int rangeLength) {
        return rangeLength - position + 1;
    }

    public static double middleBias(int position, int rangeLength) {
        return (position <= rangeLength / 2) ? position : rangeLength - position + 1;
    }

    public static double backBias(int position) {
        return position;
    }
}
