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

package com.amazon.rangemetrics.state;

import static com.amazon.rangemetrics.state.Version.V1_0;

import lombok.Data;

/**
 * A class that encapsulates the data used by a RangeEvaluator such that the
 * evaluator can be serialized and deserialized. User defined weighting
 * functions are code and are not part of the state.
 */
@Data
public class RangeEvaluatorState {

    private String version = V1_0;

    private double beta;

    private double alphaRecall;

    private String gamma;

    private String deltaPrecision;

    private String deltaRecall;

    /**
     * {@code [start, end]} pairs of the real ranges, in order
     */
    private int[][] realRanges;

    /**
     * {@code [start, end]} pairs of the predicted ranges, in order
     */
    private int[][] predictedRanges;
}
