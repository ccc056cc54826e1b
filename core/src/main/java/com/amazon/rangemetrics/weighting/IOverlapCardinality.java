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
 * A user defined overlap cardinality, used when
 * {@link com.amazon.rangemetrics.config.OverlapCardinality#UDF_GAMMA} is
 * selected. The multiplier applied to the overlap reward is the reciprocal of
 * the returned value.
 */
@FunctionalInterface
public interface IOverlapCardinality {

    /**
     * The default user defined cardinality, which applies no penalty.
     */
    IOverlapCardinality CONSTANT = (overlapCount, metric) -> 1.0;

    /**
     * @param overlapCount the number of ranges on the other side that overlap the
     *                     range being scored, always greater than 1 when called
     * @param metric       the side being computed
     * @return a value no smaller than 1
     */
    double apply(int overlapCount, Metric metric);
}
