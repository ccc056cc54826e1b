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

import com.amazon.rangemetrics.config.Metric;

/**
 * A user defined positional bias, used when
 * {@link com.amazon.rangemetrics.config.PositionalBias#UDF_DELTA} is selected.
 * Typically the value grows or shrinks monotonically with the distance of the
 * position from a reference point of the range (start, end, midpoint).
 */
@FunctionalInterface
public interface IPositionalBias {

    /**
     * The default user defined bias, which weighs every position equally.
     */
    IPositionalBias CONSTANT = (position, rangeLength, metric) -> 1.0;

    /**
     * @param position    the 1-indexed position inside the range, between 1 and
     *                    {@code rangeLength}
     * @param rangeLength the number of positions in the range
     * @param metric      the side being computed
     * @return a strictly positive weight
     */
    double apply(int position, int rangeLength, Metric metric);
}
