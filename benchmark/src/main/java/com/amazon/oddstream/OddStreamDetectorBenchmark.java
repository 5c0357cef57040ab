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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.density.ScvBandwidthSelector;
import com.amazon.oddstream.executor.IIndexedTaskExecutor;
import com.amazon.oddstream.executor.ParallelTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;
import com.amazon.oddstream.features.TimeSeriesFeatureExtractor;
import com.amazon.oddstream.projection.PrincipalComponentProjector;
import com.amazon.oddstream.projection.ProjectionModel;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.testutils.MultiSeriesDataWithKey;
import com.amazon.oddstream.testutils.NormalStreamTestData;
import com.amazon.oddstream.threshold.ThresholdCalibrator;
import com.amazon.oddstream.threshold.ThresholdModel;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class OddStreamDetectorBenchmark {

    public final static int TRAINING_LENGTH = 150;

    public final static int STREAM_LENGTH = 1500;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "50", "200" })
        int numberOfSeries;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        TimeSeriesCollection training;
        TimeSeriesCollection stream;
        double[][] reference;
        IIndexedTaskExecutor executor;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalStreamTestData testData = new NormalStreamTestData();
            training = new TimeSeriesCollection(testData.generateTestData(TRAINING_LENGTH, numberOfSeries, 17));
            MultiSeriesDataWithKey withKey = testData.generateTestDataWithKey(STREAM_LENGTH, numberOfSeries,
                    numberOfSeries / 20, 2.0, STREAM_LENGTH / 2, STREAM_LENGTH, 18);
            stream = new TimeSeriesCollection(withKey.data);

            PrincipalComponentProjector projector = new PrincipalComponentProjector();
            ProjectionModel model = projector.fit(new TimeSeriesFeatureExtractor().extract(training));
            reference = model.getReferenceCoordinates();
            executor = parallelExecutionEnabled ? new ParallelTaskExecutor() : new SequentialTaskExecutor();
        }
    }

    @Benchmark
    public DetectionResult detect(BenchmarkState state) {
        OddStreamDetector detector = OddStreamDetector.builder()
                .parallelExecutionEnabled(state.parallelExecutionEnabled).randomSeed(99).build();
        return detector.detect(state.training, state.stream);
    }

    @Benchmark
    public DetectionResult detectWithConceptDrift(BenchmarkState state) {
        OddStreamDetector detector = OddStreamDetector.builder()
                .parallelExecutionEnabled(state.parallelExecutionEnabled).conceptDrift(true).randomSeed(99).build();
        return detector.detect(state.training, state.stream);
    }

    @Benchmark
    public void calibrate(BenchmarkState state, Blackhole blackhole) {
        ThresholdCalibrator calibrator = new ThresholdCalibrator(ThresholdCalibrator.DEFAULT_FALSE_POSITIVE_RATE,
                ThresholdCalibrator.DEFAULT_TRIALS, 99, state.executor, new ScvBandwidthSelector());
        ThresholdModel model = calibrator.calibrate(state.reference);
        blackhole.consume(model.getThreshold());
    }
}
