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

package com.amazon.rangemetrics.config;

/**
 * Options for the positional bias (delta) function, which weighs each position
 * inside a range. Positions are 1-indexed within the range.
 */
public enum PositionalBias {

    /**
     * every position has weight 1
     */
    FLAT,
    /**
     * weight decreases linearly from the start of the range
     */
    FRONT,
    /**
     * weight peaks at the midpoint and decreases towards both ends
     */
    MIDDLE,
    /**
     * weight increases linearly towards the end of the range
     */
    BACK,
    /**
     * user defined weight, which must be strictly positive
     */
    UDF_DELTA;
}
