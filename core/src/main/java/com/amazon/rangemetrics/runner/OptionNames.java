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

import java.util.Locale;

import com.amazon.rangemetrics.config.EvaluatorConfig;
import com.amazon.rangemetrics.config.OverlapCardinality;
import com.amazon.rangemetrics.config.PositionalBias;

/**
 * Translation of command line option values into selector values. Names are
 * the lower case selector names; {@code x} stands for the default.
 */
public class OptionNames {

    public static final String DEFAULT_VALUE = "x";

    private OptionNames() {
    }

    /**
     * @param name one of {@code one}, {@code reciprocal}, {@code udf_gamma} or
     *             {@code x}
     * @return the overlap cardinality selector
     * @throws IllegalArgumentException for any other name
     */
    public static OverlapCardinality toOverlapCardinality(String name) {
        if (DEFAULT_VALUE.equals(name)) {
            return EvaluatorConfig.DEFAULT_GAMMA;
        }
        for (OverlapCardinality cardinality : OverlapCardinality.values()) {
            if (toName(cardinality).equals(name)) {
                return cardinality;
            }
        }
        throw new IllegalArgumentException("Invalid overlap cardinality value: " + name);
    }

    /**
     * @param name one of {@code flat}, {@code front}, {@code middle},
     *             {@code back}, {@code udf_delta} or {@code x}
     * @return the positional bias selector
     * @throws IllegalArgumentException for any other name
     */
    public static PositionalBias toPositionalBias(String name) {
        if (DEFAULT_VALUE.equals(name)) {
            return EvaluatorConfig.DEFAULT_DELTA;
        }
        for (PositionalBias bias : PositionalBias.values()) {
            if (toName(bias).equals(name)) {
                return bias;
            }
        }
        throw new IllegalArgumentException("Invalid positional bias value: " + name);
    }

    public static String toName(Enum<?> selector) {
        return selector.name().toLowerCase(Locale.ROOT);
    }
}
