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

package com.amazon.oddstream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.returntypes.OutlierReport;
import com.amazon.oddstream.streaming.StreamingEvaluator;
import com.amazon.oddstream.testutils.MultiSeriesDataWithKey;
import com.amazon.oddstream.testutils.NormalStreamTestData;

@Tag("functional")
public class OddStreamDetectorFunctionalTest {

    private final NormalStreamTestData generator = new NormalStreamTestData(10, 3);

    @Test
    public void testScaledSeriesAreReported() {
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(250, 50, 101));
        MultiSeriesDataWithKey stream = generator.generateTestDataWithKey(250, 100, 5, 2.0, 0, 250, 202);

        OddStreamDetector detector = OddStreamDetector.builder().randomSeed(42).build();
        DetectionResult result = detector.detect(training, new TimeSeriesCollection(stream.data));

        assertEquals(1, result.getNumberOfWindows());
        OutlierReport report = result.getReports().get(0);
        assertFalse(report.isUnreliable());
        for (int series : stream.changedSeries) {
            assertThat(report.getOutlierSeriesIndices(), hasItem(series));
        }
    }

    @Test
    public void testParallelExecutionGivesTheSameReport() {
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(200, 40, 7));
        MultiSeriesDataWithKey stream = generator.generateTestDataWithKey(400, 60, 3, 2.0, 200, 400, 8);

        OddStreamDetector.Builder<?> builder = OddStreamDetector.builder().randomSeed(3).trials(200);
        DetectionResult sequential = builder.build().detect(training, new TimeSeriesCollection(stream.data));
        DetectionResult parallel = builder.parallelExecutionEnabled(true).threadPoolSize(3).build().detect(training,
                new TimeSeriesCollection(stream.data));

        assertEquals(sequential.getReports(), parallel.getReports());
        assertEquals(sequential.getFinalModelState().getThreshold(), parallel.getFinalModelState().getThreshold(),
                0.0);
    }

    @Test
    public void testCleanWindowsHaveNoOutliers() {
        int windows = 0;
        int windowsWithOutliers = 0;
        for (int run = 0; run < 10; run++) {
            TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(250, 50, 1000 + run));
            TimeSeriesCollection stream = new TimeSeriesCollection(generator.generateTestData(1000, 50, 2000 + run));
            DetectionResult result = OddStreamDetector.builder().randomSeed(run).build().detect(training, stream);
            for (OutlierReport report : result.getReports()) {
                assertFalse(report.isUnreliable());
                windows++;
                if (report.hasOutliers()) {
                    windowsWithOutliers++;
                }
            }
        }
        assertEquals(40, windows);
        // a window is clean with probability at least 1 - falsePositiveRate
        assertThat(windowsWithOutliers, lessThanOrEqualTo(1));
    }

    @Test
    public void testInfiniteReadingDoesNotStopStream() {
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(100, 30, 31));
        double[][] stream = generator.generateTestData(300, 30, 32);
        stream[150][4] = Double.POSITIVE_INFINITY;

        DetectionResult result = OddStreamDetector.builder().trials(100).randomSeed(2).build().detect(training,
                new TimeSeriesCollection(stream));
        assertEquals(3, result.getNumberOfWindows());
        // the reading is treated as missing, so its window is evaluated as usual
        OutlierReport affected = result.getReports().get(1);
        assertEquals(100, affected.getWindowStart());
        for (OutlierReport report : result.getReports()) {
            assertFalse(report.isUnreliable());
        }
    }

    @Test
    public void testPartialWindowIsDropped() {
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(100, 30, 11));
        TimeSeriesCollection stream = new TimeSeriesCollection(generator.generateTestData(370, 30, 12));
        DetectionResult result = OddStreamDetector.builder().windowLength(100).windowSkip(50).trials(100)
                .randomSeed(1).build().detect(training, stream);
        assertEquals(6, result.getNumberOfWindows());
        assertEquals(350, result.getReports().get(5).getWindowEnd());
    }

    @Test
    public void testConceptDriftIsAdaptedTo() {
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(150, 50, 21));
        MultiSeriesDataWithKey drifting = generator.generateDriftingData(600, 50, 150, 20, 3, 22);

        OddStreamDetector.Builder<?> builder = OddStreamDetector.builder().randomSeed(5).trials(200);
        DetectionResult adapted = builder.conceptDrift(true).build().detect(training,
                new TimeSeriesCollection(drifting.data));
        DetectionResult fixed = builder.conceptDrift(false).build().detect(training,
                new TimeSeriesCollection(drifting.data));

        assertEquals(4, adapted.getNumberOfWindows());
        List<OutlierReport> reports = adapted.getReports();
        // the first shifted window is anomalous as a whole and becomes the new
        // reference
        assertThat(reports.get(1).getOutlierSeriesIndices().size(), greaterThanOrEqualTo(40));
        assertNotNull(adapted.getDriftDiagnostics().get(1));
        assertThat(adapted.getNumberOfAdaptations(), greaterThanOrEqualTo(1L));
        assertThat(reports.get(2).getOutlierSeriesIndices().size(), lessThanOrEqualTo(5));
        assertThat(adapted.getFinalModelState().getGeneration(), greaterThanOrEqualTo(1));

        // without adaptation every shifted window stays anomalous
        assertEquals(0, fixed.getNumberOfAdaptations());
        assertNull(fixed.getDriftDiagnostics().get(2));
        assertThat(fixed.getReports().get(3).getOutlierSeriesIndices().size(), greaterThanOrEqualTo(40));
    }

    @Test
    public void testMissingSeriesIsNeverReported() {
        double[][] trainingData = NormalStreamTestData.removeSeries(generator.generateTestData(150, 40, 31), 3);
        double[][] streamData = NormalStreamTestData.removeSeries(generator.generateTestData(150, 40, 32), 7);
        StreamingEvaluator evaluator = OddStreamDetector.builder().randomSeed(2).trials(100).build()
                .initialize(new TimeSeriesCollection(trainingData));
        assertEquals(39, evaluator.getModelState().getProjectionModel().getReferenceSize());

        DetectionResult result = evaluator.evaluate(new TimeSeriesCollection(streamData));
        assertFalse(result.getReports().get(0).getOutlierSeriesIndices().contains(7));
        assertEquals(150, result.getReports().get(0).getWindowEnd());
    }
}
