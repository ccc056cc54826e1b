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

package com.amazon.rangemetrics;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.rangemetrics.config.EvaluatorConfig;
import com.amazon.rangemetrics.config.OverlapCardinality;
import com.amazon.rangemetrics.config.PositionalBias;
import com.amazon.rangemetrics.interval.ExtractionMode;
import com.amazon.rangemetrics.interval.LabelReader;
import com.amazon.rangemetrics.returntypes.EvaluationResult;
import com.amazon.rangemetrics.testutils.AnomalyLabelTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class RangeEvaluatorBenchmark {

    public final static int SEED = 17;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "10000", "100000" })
        int seriesLength;

        @Param({ "INTERVAL", "UNIT_SIZE" })
        ExtractionMode extractionMode;

        @Param({ "FLAT", "MIDDLE" })
        PositionalBias positionalBias;

        RangeEvaluator evaluator;

        @Setup(Level.Trial)
        public void setUpData() {
            AnomalyLabelTestData generator = new AnomalyLabelTestData();
            int[] real = generator.generateLabels(seriesLength, SEED);
            int[] predicted = AnomalyLabelTestData.simulateDetector(real, 2, 0.2, 0.01, SEED + 1);

            LabelReader reader = new LabelReader(extractionMode);
            EvaluatorConfig config = EvaluatorConfig.builder().gamma(OverlapCardinality.RECIPROCAL)
                    .deltaPrecision(positionalBias).deltaRecall(positionalBias).build();
            evaluator = new RangeEvaluator(reader.extract(real).getRanges(), reader.extract(predicted).getRanges(),
                    config);
        }
    }

    @Benchmark
    public double precision(BenchmarkState state) {
        return state.evaluator.computePrecision();
    }

    @Benchmark
    public double recall(BenchmarkState state) {
        return state.evaluator.computeRecall();
    }

    @Benchmark
    public void evaluate(BenchmarkState state, Blackhole blackhole) {
        EvaluationResult result = state.evaluator.evaluate();
        blackhole.consume(result);
    }
}
