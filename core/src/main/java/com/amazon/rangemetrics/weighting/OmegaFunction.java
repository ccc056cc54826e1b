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

import com.amazon.rangemetrics.TimeRange;
import com.amazon.rangemetrics.config.Metric;

/**
 * The omega (overlap reward) function. Measures the fraction of the positional
 * bias mass of a range that lies inside its overlap with another range.
 */
public class OmegaFunction {

    private final PositionalBiasFunction delta;

    public OmegaFunction(PositionalBiasFunction delta) {
        this.delta = checkNotNull(delta, "delta must not be null");
    }

    /**
     * @param range   the range being scored
     * @param overlap the part of {@code range} covered by a range on the other
     *                side
     * @param metric  the side being computed
     * @return the captured bias divided by the total bias of {@code range}, a
     *         value in [0, 1]
     */
    public double apply(TimeRange range, TimeRange overlap, Metric metric) {
        int rangeLength = range.length();
        double capturedBias = 0;
        double maxBias = 0;

        for (int i = 1; i <= rangeLength; i++) {
            double bias = delta.apply(i, rangeLength, metric);
            maxBias += bias;
            if (overlap.contains(range.getStart() + i - 1)) {
                capturedBias += bias;
            }
        }

        return (maxBias > 0) ? capturedBias / maxBias : 0;
    }

    /**
     * Computes the omega reward of {@code range} against {@code other}.
     *
     * @param range  the range being scored
     * @param other  a range on the other side
     * @param metric the side being computed
     * @return 0 if the ranges do not overlap, the omega reward of the overlap
     *         otherwise
     */
    public double reward(TimeRange range, TimeRange other, Metric metric) {
        return range.overlap(other).map(overlap -> apply(range, overlap, metric)).orElse(0.0);
    }
}
