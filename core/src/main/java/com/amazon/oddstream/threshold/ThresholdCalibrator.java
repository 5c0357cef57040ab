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

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;
import static com.amazon.oddstream.CommonUtils.checkNumeric;
import static com.amazon.oddstream.CommonUtils.checkRectangular;

import java.util.Random;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.oddstream.NumericInstabilityException;
import com.amazon.oddstream.density.GaussianKernel;
import com.amazon.oddstream.density.KernelDensityEstimator;
import com.amazon.oddstream.density.ScvBandwidthSelector;
import com.amazon.oddstream.executor.IIndexedTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;

/**
 * Calibrates a density threshold from reference coordinates.
 * <ol>
 * <li>a Gaussian kernel density estimate is fitted with a bandwidth chosen by
 * smoothed cross validation;</li>
 * <li>each Monte-Carlo trial bootstraps m reference points, perturbs each with
 * a normal draw whose covariance is the bandwidth matrix, evaluates the
 * density at the m perturbed points and keeps the minimum;</li>
 * <li>the minima are mapped through {@link ExtremeValueCalibration#psi} and
 * the fraction p of extreme ones is counted;</li>
 * <li>the Gumbel quantile {@code 1 - rate * p} is mapped back to a density with
 * the Fisher-Tippett constants for m.</li>
 * </ol>
 * Trial t draws from {@code new Random(seed + t)}, so the result is the same
 * whichever executor runs the trials.
 */
public class ThresholdCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdCalibrator.class);

    public static final double DEFAULT_FALSE_POSITIVE_RATE = 0.001;

    public static final int DEFAULT_TRIALS = 500;

    @Getter
    private final double falsePositiveRate;

    @Getter
    private final int trials;

    @Getter
    private final long randomSeed;

    private final IIndexedTaskExecutor executor;

    private final ScvBandwidthSelector bandwidthSelector;

    public ThresholdCalibrator(double falsePositiveRate, int trials, long randomSeed) {
        this(falsePositiveRate, trials, randomSeed, new SequentialTaskExecutor(), new ScvBandwidthSelector());
    }

    public ThresholdCalibrator(double falsePositiveRate, int trials, long randomSeed, IIndexedTaskExecutor executor,
            ScvBandwidthSelector bandwidthSelector) {
        checkArgument(falsePositiveRate > 0 && falsePositiveRate < 1, "false positive rate must be in (0, 1)");
        checkArgument(trials > 0, "trials must be positive");
        this.falsePositiveRate = falsePositiveRate;
        this.trials = trials;
        this.randomSeed = randomSeed;
        this.executor = checkNotNull(executor, "executor cannot be null");
        this.bandwidthSelector = checkNotNull(bandwidthSelector, "bandwidth selector cannot be null");
    }

    /**
     * @param reference m x k reference coordinates
     * @return the calibrated threshold and its density surface
     * @throws NumericInstabilityException if the bandwidth is singular, a density
     *                                     is not finite or the calibration is
     *                                     degenerate
     */
    public ThresholdModel calibrate(double[][] reference) {
        checkNotNull(reference, "reference cannot be null");
        checkArgument(reference.length > 0, "reference cannot be empty");
        int k = reference[0].length;
        checkRectangular(reference, k, "reference must be rectangular");
        int m = reference.length;
        checkNumeric(m > k, "calibration needs more than " + k + " reference points, found " + m);

        double[][] bandwidth = bandwidthSelector.select(reference);
        KernelDensityEstimator estimate = new KernelDensityEstimator(reference, bandwidth);
        double[] minima = simulateMinima(estimate);
        double extremeFraction = ExtremeValueCalibration.extremeFraction(minima);
        double threshold = ExtremeValueCalibration.threshold(m, falsePositiveRate, extremeFraction);
        LOG.debug("calibrated threshold {} from {} reference points, extreme fraction {}", threshold, m,
                extremeFraction);
        return new ThresholdModel(estimate, threshold, extremeFraction, falsePositiveRate, trials, randomSeed);
    }

    /**
     * @param estimate the fitted density
     * @return one batch minimum per trial, in trial order
     */
    double[] simulateMinima(KernelDensityEstimator estimate) {
        double[][] points = estimate.getPoints();
        GaussianKernel noise = estimate.getKernel();
        return executor.mapToDouble(trials, trial -> batchMinimum(points, noise, estimate, randomSeed + trial));
    }

    static double batchMinimum(double[][] points, GaussianKernel noise, KernelDensityEstimator estimate, long seed) {
        Random random = new Random(seed);
        int m = points.length;
        int k = noise.getDimensions();
        double[][] perturbed = new double[m][];
        double[] standard = new double[k];
        for (int i = 0; i < m; i++) {
            double[] point = points[random.nextInt(m)];
            for (int j = 0; j < k; j++) {
                standard[j] = random.nextGaussian();
            }
            perturbed[i] = noise.sample(point, standard);
        }
        return estimate.minimumDensity(perturbed);
    }
}
