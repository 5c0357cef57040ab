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

package com.amazon.oddstream.threshold;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.oddstream.NumericInstabilityException;
import com.amazon.oddstream.density.ScvBandwidthSelector;
import com.amazon.oddstream.executor.IIndexedTaskExecutor;
import com.amazon.oddstream.executor.ParallelTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;

public class ThresholdCalibratorTest {

    private static final int TRIALS = 50;

    static double[][] reference(int n, long seed) {
        Random random = new Random(seed);
        double[][] points = new double[n][2];
        for (int i = 0; i < n; i++) {
            points[i][0] = random.nextGaussian();
            points[i][1] = 0.5 * random.nextGaussian();
        }
        return points;
    }

    static Stream<Arguments> executors() {
        return Stream.of(Arguments.of(new SequentialTaskExecutor()), Arguments.of(new ParallelTaskExecutor(3)));
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testCalibration(IIndexedTaskExecutor executor) {
        ThresholdCalibrator calibrator = new ThresholdCalibrator(0.001, TRIALS, 42, executor,
                new ScvBandwidthSelector());
        ThresholdModel model = calibrator.calibrate(reference(100, 1));

        assertThat(model.getThreshold(), greaterThan(0.0));
        assertThat(model.getExtremeFraction(), greaterThan(0.0));
        assertEquals(TRIALS, model.getTrials());
        assertEquals(42, model.getRandomSeed());
        assertEquals(0.001, model.getFalsePositiveRate());
        assertFalse(model.isOutlier(new double[] { 0, 0 }));
        assertTrue(model.isOutlier(new double[] { 25, -25 }));
    }

    @Test
    public void testSequentialAndParallelAgree() {
        double[][] points = reference(80, 2);
        ThresholdModel sequential = new ThresholdCalibrator(0.001, TRIALS, 7, new SequentialTaskExecutor(),
                new ScvBandwidthSelector()).calibrate(points);
        ThresholdModel parallel = new ThresholdCalibrator(0.001, TRIALS, 7, new ParallelTaskExecutor(4),
                new ScvBandwidthSelector()).calibrate(points);
        assertEquals(sequential.getThreshold(), parallel.getThreshold(), 0.0);
        assertEquals(sequential.getExtremeFraction(), parallel.getExtremeFraction(), 0.0);
    }

    @Test
    public void testMinimaAreSeededPerTrial() {
        double[][] points = reference(60, 3);
        ThresholdCalibrator calibrator = new ThresholdCalibrator(0.001, TRIALS, 11);
        ThresholdModel model = calibrator.calibrate(points);
        double[] first = calibrator.simulateMinima(model.getDensityEstimate());
        double[] second = new ThresholdCalibrator(0.001, TRIALS, 11, new ParallelTaskExecutor(2),
                new ScvBandwidthSelector()).simulateMinima(model.getDensityEstimate());
        assertArrayEquals(first, second, 0.0);
        double single = ThresholdCalibrator.batchMinimum(model.getDensityEstimate().getPoints(),
                model.getDensityEstimate().getKernel(), model.getDensityEstimate(), 11 + 5);
        assertEquals(first[5], single, 0.0);
    }

    @Test
    public void testThresholdGrowsWithFalsePositiveRate() {
        double[][] points = reference(80, 4);
        double strict = new ThresholdCalibrator(0.0001, TRIALS, 5).calibrate(points).getThreshold();
        double loose = new ThresholdCalibrator(0.01, TRIALS, 5).calibrate(points).getThreshold();
        assertThat(strict, lessThan(loose));
    }

    @Test
    public void testTooFewReferencePoints() {
        ThresholdCalibrator calibrator = new ThresholdCalibrator(0.001, TRIALS, 0);
        assertThrows(NumericInstabilityException.class,
                () -> calibrator.calibrate(new double[][] { { 1, 2 }, { 2, 3 } }));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdCalibrator(0.0, TRIALS, 0));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdCalibrator(1.0, TRIALS, 0));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdCalibrator(0.001, 0, 0));
    }
}
