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
 * Options for the overlap cardinality (gamma) function, which penalizes a range
 * that overlaps more than one range on the other side.
 */
public enum OverlapCardinality {

    /**
     * no penalty for fragmentation
     */
    ONE,
    /**
     * a range overlapping n ranges is scaled by 1/n
     */
    RECIPROCAL,
    /**
     * a range overlapping n ranges is scaled by 1/udf(n), where the user defined
     * function must return at least 1
     */
    UDF_GAMMA;
}
