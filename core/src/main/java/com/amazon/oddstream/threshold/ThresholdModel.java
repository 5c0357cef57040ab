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

import lombok.Getter;

import com.amazon.oddstream.density.KernelDensityEstimator;

/**
 * A density cutoff for the evaluation space: a point whose estimated density
 * under the reference surface falls below the threshold is an outlier.
 */
@Getter
public class ThresholdModel {

    private final KernelDensityEstimator densityEstimate;

    private final double threshold;

    // fraction of Monte-Carlo batch minima that were genuinely extreme
    private final double extremeFraction;

    private final double falsePositiveRate;

    private final int trials;

    private final long randomSeed;

    public ThresholdModel(KernelDensityEstimator densityEstimate, double threshold, double extremeFraction,
            double falsePositiveRate, int trials, long randomSeed) {
        checkNotNull(densityEstimate, "density estimate cannot be null");
        checkArgument(threshold > 0 && Double.isFinite(threshold), "threshold must be positive");
        checkArgument(extremeFraction > 0 && extremeFraction <= 1, "extreme fraction must be in (0, 1]");
        checkArgument(falsePositiveRate > 0 && falsePositiveRate < 1, "false positive rate must be in (0, 1)");
        checkArgument(trials > 0, "trials must be positive");
        this.densityEstimate = densityEstimate;
        this.threshold = threshold;
        this.extremeFraction = extremeFraction;
        this.falsePositiveRate = falsePositiveRate;
        this.trials = trials;
        this.randomSeed = randomSeed;
    }

    public double[][] getBandwidth() {
        return densityEstimate.getBandwidth();
    }

    public double density(double[] point) {
        return densityEstimate.density(point);
    }

    public boolean isOutlier(double[] point) {
        return density(point) < threshold;
    }
}
