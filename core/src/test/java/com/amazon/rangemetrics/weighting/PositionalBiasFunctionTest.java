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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.rangemetrics.config.Metric;
import com.amazon.rangemetrics.config.PositionalBias;

public class PositionalBiasFunctionTest {

    @Test
    public void testFlat() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.FLAT, PositionalBias.FLAT);
        for (int i = 1; i <= 5; i++) {
            assertEquals(1.0, delta.apply(i, 5, Metric.PRECISION));
            assertEquals(1.0, delta.apply(i, 5, Metric.RECALL));
        }
    }

    @Test
    public void testFrontAndBack() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.FRONT, PositionalBias.BACK);
        double[] front = new double[] { 5, 4, 3, 2, 1 };
        for (int i = 1; i <= 5; i++) {
            assertEquals(front[i - 1], delta.apply(i, 5, Metric.PRECISION));
            assertEquals(i, delta.apply(i, 5, Metric.RECALL));
        }
    }

    @Test
    public void testMiddle() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.MIDDLE, PositionalBias.MIDDLE);
        double[] odd = new double[] { 1, 2, 3, 2, 1 };
        for (int i = 1; i <= 5; i++) {
            assertEquals(odd[i - 1], delta.apply(i, 5, Metric.RECALL));
        }
        double[] even = new double[] { 1, 2, 3, 3, 2, 1 };
        for (int i = 1; i <= 6; i++) {
            assertEquals(even[i - 1], delta.apply(i, 6, Metric.RECALL));
        }
        assertEquals(1.0, delta.apply(1, 1, Metric.PRECISION));
    }

    @Test
    public void testSidesAreIndependent() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.FLAT, PositionalBias.FRONT);
        assertEquals(PositionalBias.FLAT, delta.getBias(Metric.PRECISION));
        assertEquals(PositionalBias.FRONT, delta.getBias(Metric.RECALL));
        assertEquals(1.0, delta.apply(1, 4, Metric.PRECISION));
        assertEquals(4.0, delta.apply(1, 4, Metric.RECALL));
    }

    @Test
    public void testUserDefined() {
        IPositionalBias squared = (position, rangeLength, metric) -> (metric == Metric.RECALL) ? position * position
                : 1.0;
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.UDF_DELTA, PositionalBias.UDF_DELTA,
                squared);
        assertEquals(9.0, delta.apply(3, 4, Metric.RECALL));
        assertEquals(1.0, delta.apply(3, 4, Metric.PRECISION));
    }

    @Test
    public void testDefaultUserDefinedIsFlat() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.UDF_DELTA, PositionalBias.UDF_DELTA);
        assertEquals(1.0, delta.apply(2, 4, Metric.PRECISION));
    }

    @Test
    public void testUserDefinedMustBePositive() {
        PositionalBiasFunction delta = new PositionalBiasFunction(PositionalBias.FLAT, PositionalBias.UDF_DELTA,
                (position, rangeLength, metric) -> position - 2);
        assertEquals(1.0, delta.apply(3, 4, Metric.RECALL));
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> delta.apply(2, 4, Metric.RECALL));
        assertTrue(exception.getMessage().contains("positional bias"));
        assertTrue(exception.getMessage().contains("RECALL"));
        assertThrows(IllegalStateException.class, () -> new PositionalBiasFunction(PositionalBias.UDF_DELTA,
                PositionalBias.FLAT, (position, rangeLength, metric) -> Double.NaN).apply(1, 1, Metric.PRECISION));
    }

    @Test
    public void testMissingBiasFallsBackToFlat() {
        PositionalBiasFunction delta = new PositionalBiasFunction(null, PositionalBias.BACK);
        assertEquals(PositionalBias.FLAT, delta.getPrecisionBias());
        assertEquals(1.0, delta.apply(3, 4, Metric.PRECISION));
        assertEquals(3.0, delta.apply(3, 4, Metric.RECALL));
    }

    @ParameterizedTest
    @EnumSource(PositionalBias.class)
    public void testWeightsArePositive(PositionalBias bias) {
        PositionalBiasFunction delta = new PositionalBiasFunction(bias, bias);
        for (int length = 1; length <= 12; length++) {
            for (int i = 1; i <= length; i++) {
                assertTrue(delta.apply(i, length, Metric.PRECISION) > 0);
            }
        }
    }
}
