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

import java.util.List;

import com.amazon.oddstream.OddStreamDetector;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.examples.Example;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.returntypes.DriftDiagnostic;
import com.amazon.oddstream.returntypes.OutlierReport;
import com.amazon.oddstream.testutils.MultiSeriesDataWithKey;
import com.amazon.oddstream.testutils.NormalStreamTestData;

/**
 * Compare a fixed model with an adapting one on a stream whose whole
 * population shifts level. Without adaptation every series stays an outlier
 * after the shift.
 */
public class ConceptDriftExample implements Example {

    public static void main(String[] args) throws Exception {
        new ConceptDriftExample().run();
    }

    @Override
    public String command() {
        return "concept_drift";
    }

    @Override
    public String description() {
        return "replace the reference model when the typical behavior of the collection shifts";
    }

    @Override
    public void run() throws Exception {
        NormalStreamTestData generator = new NormalStreamTestData(10, 3);
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(150, 50, 21));
        MultiSeriesDataWithKey drifting = generator.generateDriftingData(750, 50, 300, 20, 3, 22);
        TimeSeriesCollection stream = new TimeSeriesCollection(drifting.data);

        OddStreamDetector.Builder<?> builder = OddStreamDetector.builder().randomSeed(5).trials(200);
        DetectionResult fixed = builder.conceptDrift(false).build().detect(training, stream);
        DetectionResult adapted = builder.conceptDrift(true).build().detect(training, stream);

        System.out.printf("population shifts from N(10, 3) to N(20, 3) at t = %d%n", drifting.changeStart);
        System.out.println("window          fixed  adapted  drift");
        List<OutlierReport> fixedReports = fixed.getReports();
        List<OutlierReport> adaptedReports = adapted.getReports();
        for (int i = 0; i < adaptedReports.size(); i++) {
            OutlierReport report = adaptedReports.get(i);
            DriftDiagnostic diagnostic = adapted.getDriftDiagnostics().get(i);
            String drift = diagnostic == null ? "-"
                    : String.format("p = %.3f, new threshold = %.4f", diagnostic.getDriftPValue(),
                            diagnostic.getUpdatedThreshold());
            System.out.printf("[%4d, %4d) %6d %8d  %s%n", report.getWindowStart(), report.getWindowEnd(),
                    fixedReports.get(i).getOutlierSeriesIndices().size(), report.getOutlierSeriesIndices().size(),
                    drift);
        }
        System.out.printf("model generations: fixed = %d, adapted = %d%n",
                fixed.getFinalModelState().getGeneration(), adapted.getFinalModelState().getGeneration());
    }
}
