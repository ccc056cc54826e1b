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

import static com.amazon.rangemetrics.CommonUtils.checkArgument;
import static com.amazon.rangemetrics.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.rangemetrics.weighting.IOverlapCardinality;
import com.amazon.rangemetrics.weighting.IPositionalBias;

/**
 * The parameters of a range based evaluation. A configuration is immutable and
 * is validated when built; an out of range value fails with an
 * {@link IllegalArgumentException} before any metric is computed.
 */
@Getter
public class EvaluatorConfig {

    public static final double DEFAULT_BETA = 1.0;

    public static final double DEFAULT_ALPHA_RECALL = 0.0;

    /**
     * Precision has no existence reward.
     */
    public static final double ALPHA_PRECISION = 0.0;

    public static final OverlapCardinality DEFAULT_GAMMA = OverlapCardinality.ONE;

    public static final PositionalBias DEFAULT_DELTA = PositionalBias.FLAT;

    /**
     * Relative importance of recall versus precision in the F-score.
     */
    private final double beta;

    /**
     * Weight of the existence reward for recall, between 0 and 1.
     */
    private final double alphaRecall;

    /**
     * Overlap cardinality function, shared by precision and recall.
     */
    private final OverlapCardinality gamma;

    private final PositionalBias deltaPrecision;

    private final PositionalBias deltaRecall;

    private final IOverlapCardinality udfGamma;

    private final IPositionalBias udfDelta;

    protected EvaluatorConfig(Builder<?> builder) {
        checkArgument(!Double.isNaN(builder.beta) && !Double.isInfinite(builder.beta),
                "beta must be a finite number");
        checkArgument(builder.beta > 0, "beta must be greater than 0");
        checkArgument(builder.alphaRecall >= 0 && builder.alphaRecall <= 1.0, "alphaRecall must be between 0 and 1");
        checkArgument(builder.alphaPrecision == ALPHA_PRECISION, "alphaPrecision must be 0");
        checkArgument(builder.gammaPrecision != null && builder.gammaRecall != null, "gamma must not be null");
        checkArgument(builder.gammaPrecision == builder.gammaRecall,
                "gamma must be the same for precision and recall");
        checkArgument(builder.deltaPrecision != null, "deltaPrecision must not be null");
        checkArgument(builder.deltaRecall != null, "deltaRecall must not be null");

        beta = builder.beta;
        alphaRecall = builder.alphaRecall;
        gamma = builder.gammaPrecision;
        deltaPrecision = builder.deltaPrecision;
        deltaRecall = builder.deltaRecall;
        udfGamma = checkNotNull(builder.udfGamma, "udfGamma must not be null");
        udfDelta = checkNotNull(builder.udfDelta, "udfDelta must not be null");
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a configuration with every parameter at its default value
     */
    public static EvaluatorConfig defaultConfig() {
        return builder().build();
    }

    public double getAlphaPrecision() {
        return ALPHA_PRECISION;
    }

    public double getAlpha(Metric metric) {
        return (metric == Metric.PRECISION) ? ALPHA_PRECISION : alphaRecall;
    }

    public PositionalBias getDelta(Metric metric) {
        return (metric == Metric.PRECISION) ? deltaPrecision : deltaRecall;
    }

    public static class Builder<T extends Builder<T>> {

        private double beta = DEFAULT_BETA;
        private double alphaRecall = DEFAULT_ALPHA_RECALL;
        private double alphaPrecision = ALPHA_PRECISION;
        private OverlapCardinality gammaPrecision = DEFAULT_GAMMA;
        private OverlapCardinality gammaRecall = DEFAULT_GAMMA;
        private PositionalBias deltaPrecision = DEFAULT_DELTA;
        private PositionalBias deltaRecall = DEFAULT_DELTA;
        private IOverlapCardinality udfGamma = IOverlapCardinality.CONSTANT;
        private IPositionalBias udfDelta = IPositionalBias.CONSTANT;

        public T beta(double beta) {
            this.beta = beta;
            return (T) this;
        }

        public T alphaRecall(double alphaRecall) {
            this.alphaRecall = alphaRecall;
            return (T) this;
        }

        /**
         * Only 0 is accepted when the configuration is built.
         */
        public T alphaPrecision(double alphaPrecision) {
            this.alphaPrecision = alphaPrecision;
            return (T) this;
        }

        public T gamma(OverlapCardinality gamma) {
            this.gammaPrecision = gamma;
            this.gammaRecall = gamma;
            return (T) this;
        }

        public T gammaPrecision(OverlapCardinality gammaPrecision) {
            this.gammaPrecision = gammaPrecision;
            return (T) this;
        }

        public T gammaRecall(OverlapCardinality gammaRecall) {
            this.gammaRecall = gammaRecall;
            return (T) this;
        }

        public T deltaPrecision(PositionalBias deltaPrecision) {
            this.deltaPrecision = deltaPrecision;
            return (T) this;
        }

        public T deltaRecall(PositionalBias deltaRecall) {
            this.deltaRecall = deltaRecall;
            return (T) this;
        }

        public T udfGamma(IOverlapCardinality udfGamma) {
            this.udfGamma = udfGamma;
            return (T) this;
        }

        public T udfDelta(IPositionalBias udfDelta) {
            this.udfDelta = udfDelta;
            return (T) this;
        }

        public EvaluatorConfig build() {
            return new EvaluatorConfig(this);
        }
    }
}
