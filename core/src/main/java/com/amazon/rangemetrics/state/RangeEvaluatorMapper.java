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

import static com.amazon.rangemetrics.CommonUtils.checkArgument;
import static com.amazon.rangemetrics.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.rangemetrics.RangeEvaluator;
import com.amazon.rangemetrics.TimeRange;
import com.amazon.rangemetrics.config.EvaluatorConfig;
import com.amazon.rangemetrics.config.OverlapCardinality;
import com.amazon.rangemetrics.config.PositionalBias;
import com.amazon.rangemetrics.weighting.IOverlapCardinality;
import com.amazon.rangemetrics.weighting.IPositionalBias;

/**
 * A utility class for creating a {@link RangeEvaluatorState} instance from a
 * {@link RangeEvaluator} instance and vice versa. Cached metric values are not
 * saved; call the update methods on the restored evaluator.
 */
@Getter
@Setter
public class RangeEvaluatorMapper implements IStateMapper<RangeEvaluator, RangeEvaluatorState> {

    /**
     * The overlap cardinality given to restored evaluators that use
     * {@link OverlapCardinality#UDF_GAMMA}.
     */
    private IOverlapCardinality udfGamma = IOverlapCardinality.CONSTANT;

    /**
     * The positional bias given to restored evaluators that use
     * {@link PositionalBias#UDF_DELTA}.
     */
    private IPositionalBias udfDelta = IPositionalBias.CONSTANT;

    @Override
    public RangeEvaluatorState toState(RangeEvaluator model) {
        checkNotNull(model, "model must not be null");
        EvaluatorConfig config = model.getConfig();

        RangeEvaluatorState state = new RangeEvaluatorState();
        state.setBeta(config.getBeta());
        state.setAlphaRecall(config.getAlphaRecall());
        state.setGamma(config.getGamma().name());
        state.setDeltaPrecision(config.getDeltaPrecision().name());
        state.setDeltaRecall(config.getDeltaRecall().name());
        state.setRealRanges(toPairs(model.getRealRanges()));
        state.setPredictedRanges(toPairs(model.getPredictedRanges()));
        return state;
    }

    /**
     * @throws IllegalArgumentException if the state holds an unknown selector name
     *                                  or an invalid parameter value
     */
    @Override
    public RangeEvaluator toModel(RangeEvaluatorState state) {
        checkNotNull(state, "state must not be null");

        EvaluatorConfig config = EvaluatorConfig.builder().beta(state.getBeta()).alphaRecall(state.getAlphaRecall())
                .gamma(OverlapCardinality.valueOf(checkNotNull(state.getGamma(), "gamma must not be null")))
                .deltaPrecision(PositionalBias
                        .valueOf(checkNotNull(state.getDeltaPrecision(), "deltaPrecision must not be null")))
                .deltaRecall(
                        PositionalBias.valueOf(checkNotNull(state.getDeltaRecall(), "deltaRecall must not be null")))
                .udfGamma(udfGamma).udfDelta(udfDelta).build();

        return RangeEvaluator.builder().realRanges(fromPairs(state.getRealRanges()))
                .predictedRanges(fromPairs(state.getPredictedRanges())).config(config).build();
    }

    static int[][] toPairs(List<TimeRange> ranges) {
        int[][] pairs = new int[ranges.size()][];
        for (int i = 0; i < ranges.size(); i++) {
            pairs[i] = new int[] { ranges.get(i).getStart(), ranges.get(i).getEnd() };
        }
        return pairs;
    }

    static List<TimeRange> fromPairs(int[][] pairs) {
        List<TimeRange> ranges = new ArrayList<>();
        if (pairs == null) {
            return ranges;
        }
        for (int[] pair : pairs) {
            checkArgument(pair != null && pair.length == 2, "a range must be a [start, end] pair");
            ranges.add(new TimeRange(pair[0], pair[1]));
        }
        return ranges;
    }
}
