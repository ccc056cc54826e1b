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

package com.amazon.rangemetrics.testutils;

import java.util.Random;

/**
 * This class generates 0/1 anomaly label sequences. Labels follow a two state
 * Markov chain: a normal state that switches to the anomalous state with a
 * fixed probability, and an anomalous state that switches back with another
 * probability, so anomalies arrive as contiguous runs. It also simulates a
 * detector that reports a noisy, shifted copy of a label sequence.
 */
public class AnomalyLabelTestData {

    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public AnomalyLabelTestData(double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public AnomalyLabelTestData() {
        this(0.01, 0.1);
    }

    public int[] generateLabels(int length) {
        return generateLabels(length, 0);
    }

    public int[] generateLabels(int length, long seed) {
        Random random = (seed != 0) ? new Random(seed) : new Random();
        int[] labels = new int[length];
        boolean anomaly = false;
        for (int i = 0; i < length; i++) {
            labels[i] = anomaly ? 1 : 0;
            if (!anomaly) {
                if (random.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else if (random.nextDouble() < transitionToBaseProbability) {
                anomaly = false;
            }
        }
        return labels;
    }

    /**
     * Simulates a detector looking at a series labeled with {@code real}.
     *
     * @param real                   the true labels
     * @param shift                  number of positions the detector lags (positive)
     *                               or leads (negative) the true labels
     * @param missProbability        probability of dropping an anomaly label
     * @param falseAlarmProbability  probability of flagging a normal label
     * @param seed                   random seed, 0 for an unseeded generator
     * @return the predicted labels, of the same length as {@code real}
     */
    public static int[] simulateDetector(int[] real, int shift, double missProbability, double falseAlarmProbability,
            long seed) {
        Random random = (seed != 0) ? new Random(seed) : new Random();
        int[] predicted = new int[real.length];
        for (int i = 0; i < real.length; i++) {
            int source = i - shift;
            boolean anomaly = source >= 0 && source < real.length && real[source] == 1;
            if (anomaly) {
                predicted[i] = (random.nextDouble() < missProbability) ? 0 : 1;
            } else {
                predicted[i] = (random.nextDouble() < falseAlarmProbability) ? 1 : 0;
            }
        }
        return predicted;
    }
}
