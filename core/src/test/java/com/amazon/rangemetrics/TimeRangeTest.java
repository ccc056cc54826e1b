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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class TimeRangeTest {

    @Test
    public void testNew() {
        TimeRange range = new TimeRange(3, 7);
        assertEquals(3, range.getStart());
        assertEquals(7, range.getEnd());
        assertEquals(5, range.length());
        assertEquals(1, TimeRange.of(4, 4).length());
    }

    @Test
    public void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(5, 4));
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(-1, 4));
    }

    @Test
    public void testContains() {
        TimeRange range = TimeRange.of(3, 7);
        assertFalse(range.contains(2));
        assertTrue(range.contains(3));
        assertTrue(range.contains(7));
        assertFalse(range.contains(8));
    }

    @Test
    public void testOverlap() {
        TimeRange range = TimeRange.of(3, 7);

        assertEquals(Optional.of(TimeRange.of(5, 7)), range.overlap(TimeRange.of(5, 12)));
        assertEquals(Optional.of(TimeRange.of(3, 4)), range.overlap(TimeRange.of(0, 4)));
        assertEquals(Optional.of(TimeRange.of(4, 5)), range.overlap(TimeRange.of(4, 5)));
        assertEquals(Optional.of(TimeRange.of(3, 7)), range.overlap(TimeRange.of(0, 10)));
        assertEquals(Optional.of(TimeRange.of(7, 7)), range.overlap(TimeRange.of(7, 9)));
        assertTrue(range.overlaps(TimeRange.of(7, 9)));
    }

    @Test
    public void testNoOverlap() {
        TimeRange range = TimeRange.of(3, 7);
        assertEquals(Optional.empty(), range.overlap(TimeRange.of(8, 10)));
        assertEquals(Optional.empty(), range.overlap(TimeRange.of(0, 2)));
        assertFalse(range.overlaps(TimeRange.of(8, 10)));
        assertFalse(TimeRange.of(0, 2).overlaps(TimeRange.of(10, 12)));
    }

    @Test
    public void testEqualsAndToString() {
        assertEquals(TimeRange.of(1, 2), new TimeRange(1, 2));
        assertEquals(TimeRange.of(1, 2).hashCode(), new TimeRange(1, 2).hashCode());
        assertNotEquals(TimeRange.of(1, 2), TimeRange.of(1, 3));
        assertEquals("[0, 4]", TimeRange.of(0, 4).toString());
    }
}
