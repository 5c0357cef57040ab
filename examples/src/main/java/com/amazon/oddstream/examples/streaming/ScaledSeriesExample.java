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


package com.amazon.oddstream.examples.streaming;

import java.util.Arrays;

import com.amazon.oddstream.OddStreamDetector;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.examples.Example;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.returntypes.OutlierReport;
import com.amazon.oddstream.testutils.MultiSeriesDataWithKey;
import com.amazon.oddstream.testutils.NormalStreamTestData;

/**
 * Train on a clean collection, then stream a wider collection in which a few
 * series are scaled up halfway through, and print the series reported in each
 * window.
 */
public class ScaledSeriesExample implements Example {

    public static void main(String[] args) throws Exception {
        new ScaledSeriesExample().run();
    }

    @Override
    public String command() {
        return "scaled_series";
    }

    @Override
    public String description() {
        return "report series whose level is multiplied partway through the stream";
    }

    @Override
    public void run() throws Exception {
        int trainingLength = 150;
        int numberOfSeries = 80;
        int numberOfChanged = 4;

        NormalStreamTestData generator = new NormalStreamTestData(10, 3);
        TimeSeriesCollection training = new TimeSeriesCollection(
                generator.generateTestData(trainingLength, numberOfSeries, 17));
        MultiSeriesDataWithKey stream = generator.generateTestDataWithKey(900, numberOfSeries, numberOfChanged, 2.0,
                450, 900, 18);

        OddStreamDetector detector = OddStreamDetector.builder().windowSkip(75).randomSeed(42).build();
        DetectionResult result = detector.detect(training, new TimeSeriesCollection(stream.data));

        System.out.printf("series = %d, window length = %d, skip = %d%n", numberOfSeries, trainingLength, 75);
        System.out.printf("scaled series %s from t = %d%n", Arrays.toString(stream.changedSeries), stream.changeStart);
        System.out.printf("threshold = %.4f%n", result.getFinalModelState().getThreshold());

        int missed = 0;
        for (OutlierReport report : result.getReports()) {
            System.out.printf("[%4d, %4d) %s%s%n", report.getWindowStart(), report.getWindowEnd(),
                    report.getOutlierSeriesIndices(), report.isUnreliable() ? " (unreliable)" : "");
            if (report.getWindowStart() >= stream.changeStart) {
                for (int series : stream.changedSeries) {
                    if (!report.getOutlierSeriesIndices().contains(series)) {
                        missed++;
                    }
                }
            }
        }
        System.out.printf("missed detections after the change: %d%n", missed);
    }
}
