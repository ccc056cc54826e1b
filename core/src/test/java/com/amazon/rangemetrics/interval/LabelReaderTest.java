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

package com.amazon.rangemetrics.interval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.rangemetrics.TimeRange;

public class LabelReaderTest {

    private static BufferedReader reader(String content) {
        return new BufferedReader(new StringReader(content));
    }

    @Test
    public void testIntervalExtraction() {
        LabeledSeries series = new LabelReader(ExtractionMode.INTERVAL).extract(0, 1, 1, 0, 1, 0, 0, 1, 1);
        assertEquals(Arrays.asList(TimeRange.of(1, 2), TimeRange.of(4, 4), TimeRange.of(7, 8)), series.getRanges());
        assertEquals(9, series.getLabelCount());
    }

    @Test
    public void testUnitSizeExtraction() {
        LabeledSeries series = new LabelReader(ExtractionMode.UNIT_SIZE).extract(1, 1, 0, 1);
        assertEquals(Arrays.asList(TimeRange.of(0, 0), TimeRange.of(1, 1), TimeRange.of(3, 3)), series.getRanges());
        assertEquals(4, series.getLabelCount());
    }

    @Test
    public void testNoAnomalies() {
        LabeledSeries series = new LabelReader(ExtractionMode.INTERVAL).extract(0, 0, 0);
        assertTrue(series.getRanges().isEmpty());
        assertEquals(3, series.getLabelCount());

        series = new LabelReader(ExtractionMode.INTERVAL).extract();
        assertTrue(series.getRanges().isEmpty());
        assertEquals(0, series.getLabelCount());
    }

    @Test
    public void testRead() throws IOException {
        LabeledSeries series = new LabelReader(ExtractionMode.INTERVAL).read(reader("0\n1\n1\n\n  1 \n0\n"));
        assertEquals(Arrays.asList(TimeRange.of(1, 3)), series.getRanges());
        assertEquals(5, series.getLabelCount());
    }

    @Test
    public void testReadIgnoresTrailingContent() throws IOException {
        LabeledSeries series = new LabelReader(ExtractionMode.UNIT_SIZE).read(reader("0,foo\n1 extra\r\n+1\n"));
        assertEquals(Arrays.asList(TimeRange.of(1, 1), TimeRange.of(2, 2)), series.getRanges());
        assertEquals(3, series.getLabelCount());
    }

    @Test
    public void testOpenRunAtEndOfInput() throws IOException {
        LabeledSeries series = new LabelReader(ExtractionMode.INTERVAL).read(reader("0\n0\n1\n1"));
        assertEquals(Arrays.asList(TimeRange.of(2, 3)), series.getRanges());
    }

    @Test
    public void testInvalidLabels() {
        LabelReader labelReader = new LabelReader(ExtractionMode.INTERVAL);
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> labelReader.read(reader("0\n2\n")));
        assertTrue(exception.getMessage().contains("line 2"));

        assertThrows(IllegalArgumentException.class, () -> labelReader.read(reader("0\nabc\n")));
        assertThrows(IllegalArgumentException.class, () -> labelReader.read(reader("-1\n")));
        assertThrows(IllegalArgumentException.class, () -> labelReader.read(reader("99999999999\n")));
        assertThrows(IllegalArgumentException.class, () -> labelReader.extract(0, 1, 3));
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> new LabelReader(null));
        LabelReader labelReader = new LabelReader(ExtractionMode.UNIT_SIZE);
        assertEquals(ExtractionMode.UNIT_SIZE, labelReader.getMode());
        assertThrows(NullPointerException.class, () -> labelReader.read(null));
        assertThrows(NullPointerException.class, () -> labelReader.extract((int[]) null));
    }
}
