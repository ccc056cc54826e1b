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

import java.util.Optional;

import lombok.Getter;

/**
 * A closed interval {@code [start, end]} of label positions, describing one
 * contiguous anomalous span. Position 0 is the first label of a series.
 */
@Getter
public final class TimeRange {

    private final int start;

    private final int end;

    public TimeRange(int start, int end) {
        checkArgument(start >= 0, "start must be non-negative");
        checkArgument(start <= end, "start must not be greater than end");
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(int start, int end) {
        return new TimeRange(start, end);
    }

    /**
     * @return the number of positions in this range
     */
    public int length() {
        return end - start + 1;
    }

    public boolean contains(int position) {
        return position >= start && position <= end;
    }

    /**
     * @param other another range
     * @return true if the two ranges share at least one position
     */
    public boolean overlaps(TimeRange other) {
        return !(end < other.start || start > other.end);
    }

    /**
     * Computes the intersection of this range with another.
     *
     * @param other another range
     * @return the range {@code [max(start), min(end)]} if the ranges overlap,
     *         empty otherwise
     */
    public Optional<TimeRange> overlap(TimeRange other) {
        if (!overlaps(other)) {
            return Optional.empty();
        }
        return Optional.of(new TimeRange(Math.max(start, other.start), Math.min(end, other.end)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeRange)) {
            return false;
        }
        TimeRange that = (TimeRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
