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

import static com.amazon.rangemetrics.CommonUtils.checkArgument;
import static com.amazon.rangemetrics.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.rangemetrics.config.EvaluatorConfig;
import com.amazon.rangemetrics.config.Metric;
import com.amazon.rangemetrics.returntypes.EvaluationResult;
import com.amazon.rangemetrics.weighting.OmegaFunction;
import com.amazon.rangemetrics.weighting.OverlapCardinalityFunction;
import com.amazon.rangemetrics.weighting.PositionalBiasFunction;

/**
 * Range based precision, recall and F-score for time series anomaly detection.
 * Anomalies are contiguous ranges of label positions, and a predicted range
 * that covers only part of a real range is rewarded in proportion to the
 * positional bias mass it captures.
 * <p>
 * An evaluator is built once from the real ranges, the predicted ranges and an
 * {@link EvaluatorConfig}. The {@code compute*} methods are pure. The
 * {@code update*} methods store the computed value, which is then returned by
 * the corresponding getter; cached values are never invalidated implicitly.
 * <p>
 * Instances share no state, so independent evaluators may be used from
 * different threads. The cached values of a single instance are not
 * synchronized.
 */
public class RangeEvaluator {

    /**
     * The configuration used by this evaluator.
     */
    @Getter
    private final EvaluatorConfig config;

    /**
     * Ground truth anomalies, in input order.
     */
    @Getter
    private final List<TimeRange> realRanges;

    /**
     * Ranges reported by the detector, in input order.
     */
    @Getter
    private final List<TimeRange> predictedRanges;

    private final OmegaFunction omegaFunction;

    private final OverlapCardinalityFunction gammaFunction;

    @Getter
    private double precision;

    @Getter
    private double recall;

    @Getter
    private double fscore;

    public RangeEvaluator(List<TimeRange> realRanges, List<TimeRange> predictedRanges, EvaluatorConfig config) {
        checkNotNull(realRanges, "realRanges must not be null");
        checkNotNull(predictedRanges, "predictedRanges must not be null");
        this.config = checkNotNull(config, "config must not be null");
        checkArgument(!realRanges.contains(null), "realRanges must not contain null");
        checkArgument(!predictedRanges.contains(null), "predictedRanges must not contain null");

        this.realRanges = Collections.unmodifiableList(new ArrayList<>(realRanges));
        this.predictedRanges = Collections.unmodifiableList(new ArrayList<>(predictedRanges));
        this.omegaFunction = new OmegaFunction(
                new PositionalBiasFunction(config.getDeltaPrecision(), config.getDeltaRecall(), config.getUdfDelta()));
        this.gammaFunction = new OverlapCardinalityFunction(config.getGamma(), config.getUdfGamma());
    }

    public RangeEvaluator(List<TimeRange> realRanges, List<TimeRange> predictedRanges) {
        this(realRanges, predictedRanges, EvaluatorConfig.defaultConfig());
    }

    public RangeEvaluator(Builder<?> builder) {
        this(builder.realRanges, builder.predictedRanges, builder.config);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public double getBeta() {
        return config.getBeta();
    }

    public double getAlphaPrecision() {
        return config.getAlphaPrecision();
    }

    public double getAlphaRecall() {
        return config.getAlphaRecall();
    }

    public void updatePrecision() {
        precision = computePrecision();
    }

    public void updateRecall() {
        recall = computeRecall();
    }

    /**
     * Stores the F-score of the cached precision and recall. Call
     * {@link #updatePrecision()} and {@link #updateRecall()} first.
     */
    public void updateFscore() {
        fscore = computeFscore();
    }

    /**
     * Refreshes precision, recall and F-score, in that order.
     */
    public void update() {
        updatePrecision();
        updateRecall();
        updateFscore();
    }

    /**
     * @return the mean reward of the predicted ranges, scored against the real
     *         ranges
     */
    public double computePrecision() {
        return score(predictedRanges, realRanges, Metric.PRECISION);
    }

    /**
     * @return the mean reward of the real ranges, scored against the predicted
     *         ranges
     */
    public double computeRecall() {
        return score(realRanges, predictedRanges, Metric.RECALL);
    }

    /**
     * @return the F-score of the cached precision and recall
     */
    public double computeFscore() {
        return fscore(precision, recall, config.getBeta());
    }

    /**
     * Computes all three metrics without touching the cached values.
     *
     * @return precision, recall and the F-score of the two
     */
    public EvaluationResult evaluate() {
        double p = computePrecision();
        double r = computeRecall();
        return new EvaluationResult(p, r, fscore(p, r, config.getBeta()));
    }

    /**
     * The weighted harmonic mean of precision and recall. When both are 0 the
     * F-score is 0.
     *
     * @param precision a precision value
     * @param recall    a recall value
     * @param beta      relative importance of recall
     * @return the F-score
     */
    public static double fscore(double precision, double recall, double beta) {
        double betaSquared = beta * beta;
        double denominator = betaSquared * precision + recall;
        if (denominator == 0) {
            return 0;
        }
        return (1 + betaSquared) * precision * recall / denominator;
    }

    /**
     * Scores every range of {@code own} against all of {@code other}.
     *
     * @param own    the ranges whose rewards are averaged
     * @param other  the ranges on the other side
     * @param metric the side being computed
     * @return the mean reward, 0 if {@code own} is empty
     */
    protected double score(List<TimeRange> own, List<TimeRange> other, Metric metric) {
        if (own.isEmpty()) {
            return 0.0;
        }

        double alpha = config.getAlpha(metric);
        double total = 0.0;
        for (TimeRange range : own) {
            int overlapCount = 0;
            double omegaReward = 0;
            for (TimeRange candidate : other) {
                if (range.overlaps(candidate)) {
                    overlapCount++;
                    omegaReward += omegaFunction.reward(range, candidate, metric);
                }
            }

            double overlapReward = gammaFunction.apply(overlapCount, metric) * omegaReward;
            double existenceReward = (overlapCount > 0) ? 1 : 0;
            total += alpha * existenceReward + (1.0 - alpha) * overlapReward;
        }

        return total / own.size();
    }

    public static class Builder<T extends Builder<T>> {

        private List<TimeRange> realRanges = Collections.emptyList();
        private List<TimeRange> predictedRanges = Collections.emptyList();
        private EvaluatorConfig config = EvaluatorConfig.defaultConfig();

        public T realRanges(List<TimeRange> realRanges) {
            this.realRanges = realRanges;
            return (T) this;
        }

        public T predictedRanges(List<TimeRange> predictedRanges) {
            this.predictedRanges = predictedRanges;
            return (T) this;
        }

        public T config(EvaluatorConfig config) {
            this.config = config;
            return (T) this;
        }

        public RangeEvaluator build() {
            return new RangeEvaluator(this);
        }
    }
}
