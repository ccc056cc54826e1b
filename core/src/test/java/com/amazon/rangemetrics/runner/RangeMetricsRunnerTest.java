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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rangemetrics.returntypes.EvaluationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RangeMetricsRunnerTest {

    private static final double EPSILON = 1e-10;

    private static final String REAL = "0\n1\n1\n1\n1\n0\n0\n0\n";
    private static final String PREDICTED = "0\n0\n0\n1\n1\n1\n0\n0\n";

    private RangeMetricsRunner runner;
    private BufferedReader realIn;
    private BufferedReader predictedIn;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new RangeMetricsRunner();
        realIn = mock(BufferedReader.class);
        predictedIn = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    private static BufferedReader reader(String content) {
        return new BufferedReader(new StringReader(content));
    }

    @Test
    public void testRun() throws IOException {
        when(realIn.readLine()).thenReturn("0").thenReturn("1").thenReturn("1").thenReturn("0").thenReturn(null);
        when(predictedIn.readLine()).thenReturn("0").thenReturn("1").thenReturn("1").thenReturn("0")
                .thenReturn(null);

        runner.run(realIn, predictedIn, out);
        verify(out).println("Precision = 1.0");
        verify(out).println("Recall = 1.0");
        verify(out).println("F-Score = 1.0");
        verify(out, never()).println("Real Anomalies:");
        verify(out).flush();
    }

    @Test
    public void testTimeSeriesMode() throws IOException {
        runner.parse("--metric-mode", "time-series");
        EvaluationResult result = runner.run(reader(REAL), reader(PREDICTED), out);

        assertEquals(2.0 / 3.0, result.getPrecision(), EPSILON);
        assertEquals(0.5, result.getRecall(), EPSILON);
        assertEquals(4.0 / 7.0, result.getFscore(), EPSILON);
    }

    @Test
    public void testClassicalMode() throws IOException {
        runner.parse("-m", "classical");
        EvaluationResult result = runner.run(reader(REAL), reader(PREDICTED), out);

        // 2 true positives, 1 false positive, 2 false negatives
        assertEquals(2.0 / 3.0, result.getPrecision(), EPSILON);
        assertEquals(0.5, result.getRecall(), EPSILON);
    }

    @Test
    public void testNumentaMode() throws IOException {
        runner.parse("-m", "numenta", "-g", "reciprocal");
        EvaluationResult result = runner.run(reader(REAL), reader(PREDICTED), out);

        assertEquals(2.0 / 3.0, result.getPrecision(), EPSILON);
        assertEquals(0.25, result.getRecall(), EPSILON);
    }

    @Test
    public void testExistenceAndBeta() throws IOException {
        runner.parse("-a", "1", "-b", "2");
        EvaluationResult result = runner.run(reader(REAL), reader(PREDICTED), out);

        assertEquals(1.0, result.getRecall(), EPSILON);
        double precision = 2.0 / 3.0;
        assertEquals(5 * precision / (4 * precision + 1), result.getFscore(), EPSILON);
    }

    @Test
    public void testDefaultPlaceholders() throws IOException {
        runner.parse("-b", "x", "-a", "x", "-g", "x", "-p", "x", "-r", "x", "-m", "x");
        EvaluationResult result = runner.run(reader(REAL), reader(PREDICTED), out);
        assertEquals(4.0 / 7.0, result.getFscore(), EPSILON);
    }

    @Test
    public void testVerbose() throws IOException {
        runner.parse("--verbose");
        StringWriter buffer = new StringWriter();
        runner.run(reader(REAL), reader(PREDICTED), new PrintWriter(buffer));

        String[] lines = buffer.toString().split("\\R");
        assertEquals("Real Anomalies:", lines[0]);
        assertEquals("[1, 4]", lines[1]);
        assertEquals("Predicted Anomalies:", lines[2]);
        assertEquals("[3, 5]", lines[3]);
        assertTrue(lines[4].startsWith("Precision = 0.66"));
        assertEquals("Recall = 0.5", lines[5]);
        assertTrue(lines[6].startsWith("F-Score = 0.57"));
    }

    @Test
    public void testJsonOutput() throws IOException {
        runner.parse("-o", "json");
        StringWriter buffer = new StringWriter();
        runner.run(reader("1\n1\n0\n"), reader("1\n1\n0\n"), new PrintWriter(buffer));

        JsonNode node = new ObjectMapper().readTree(buffer.toString());
        assertEquals(1.0, node.get("precision").asDouble());
        assertEquals(1.0, node.get("recall").asDouble());
        assertEquals(1.0, node.get("fscore").asDouble());
    }

    @Test
    public void testNoAnomalies() throws IOException {
        EvaluationResult result = runner.run(reader("0\n0\n"), reader("0\n0\n"), out);
        assertEquals(0.0, result.getPrecision());
        assertEquals(0.0, result.getRecall());
        verify(out).println("F-Score = 0.0");
    }

    @Test
    public void testInvalidInput() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> runner.run(reader("0\n1\n1\n"), reader("0\n1\n"), out));
        assertEquals("Number of data items are different!", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> runner.run(reader(""), reader("\n"), out));
        assertEquals("No data items!", exception.getMessage());

        assertThrows(IllegalArgumentException.class, () -> runner.run(reader("0\n5\n"), reader("0\n1\n"), out));
    }

    @Test
    public void testReadFailure() throws IOException {
        when(realIn.readLine()).thenThrow(new IOException("disk error"));
        assertThrows(IOException.class, () -> runner.run(realIn, predictedIn, out));
    }
}
