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
import com.amazon.rangemetrics.config.OverlapCardinality;

/**
 * The gamma function. Produces a multiplier in (0, 1] for a range that overlaps
 * {@code overlapCount} ranges on the other side. The same choice applies to
 * precision and recall.
 */
@Getter
public class OverlapCardinalityFunction {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapCardinalityFunction.class);

    public static final OverlapCardinality DEFAULT_OVERLAP_CARDINALITY = OverlapCardinality.ONE;

    private final OverlapCardinality cardinality;

    private final IOverlapCardinality udfGamma;

    public OverlapCardinalityFunction(OverlapCardinality cardinality, IOverlapCardinality udfGamma) {
        if (cardinality == null) {
            LOGGER.warn("Invalid overlap cardinality function, using default value {} instead",
                    DEFAULT_OVERLAP_CARDINALITY);
            this.cardinality = DEFAULT_OVERLAP_CARDINALITY;
        } else {
            this.cardinality = cardinality;
        }
        this.udfGamma = checkNotNull(udfGamma, "udfGamma must not be null");
    }

    public OverlapCardinalityFunction(OverlapCardinality cardinality) {
        this(cardinality, IOverlapCardinality.CONSTANT);
    }

    /**
     * @param overlapCount number of overlapping ranges on the other side
     * @param metric       the side being computed
     * @return the multiplier applied to the summed overlap reward
     */
    public double apply(int overlapCount, Metric metric) {
        checkNotNull(metric, "metric must not be null");
        switch (cardinality) {
        case ONE:
            return 1.0;
        case RECIPROCAL:
            return (overlapCount > 1) ? 1.0 / overlapCount : 1.0;
        case UDF_GAMMA:
            return (overlapCount > 1) ? 1.0 / userDefined(overlapCount, metric) : 1.0;
        default:
            LOGGER.warn("Invalid overlap cardinality function for {} = {}, using default value {} instead", metric,
                    cardinality, DEFAULT_OVERLAP_CARDINALITY);
            return 1.0;
        }
    }

    private double userDefined(int overlapCount, Metric metric) {
        double value = udfGamma.apply(overlapCount, metric);
        validateInternalState(value >= 1.0,
                String.format("user defined overlap cardinality must be at least 1, got %s for %s with %d overlaps",
                        value, metric, overlapCount));
        return value;
    }
}
