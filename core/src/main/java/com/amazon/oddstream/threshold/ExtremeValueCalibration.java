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
import static com.amazon.oddstream.CommonUtils.checkNumeric;

/**
 * Extreme value arithmetic for density minima, after Clifton, Hugueny and
 * Tarassenko (2011). Densities are mapped to a scale on which the minimum of m
 * draws is in the Gumbel domain of attraction, and a Gumbel quantile is mapped
 * back to a density.
 */
public class ExtremeValueCalibration {

    public static final double LOG_TWO_PI = Math.log(2 * Math.PI);

    private ExtremeValueCalibration() {
    }

    /**
     * {@code psi(x) = sqrt(-2 ln x - 2 ln 2 pi)} for {@code x < 1 / (2 pi)}, else
     * 0
     */
    public static double psi(double density) {
        if (density < 1.0 / (2 * Math.PI)) {
            return Math.sqrt(-2 * Math.log(density) - 2 * LOG_TWO_PI);
        }
        return 0;
    }

    /**
     * @param minima batch minima of the density
     * @return the fraction of minima with a non zero psi
     */
    public static double extremeFraction(double[] minima) {
        checkArgument(minima.length > 0, "no minima");
        int count = 0;
        for (double minimum : minima) {
            if (psi(minimum) != 0) {
                count++;
            }
        }
        return count / (double) minima.length;
    }

    /**
     * the reduced Gumbel variate {@code y = -ln(-ln(q))}
     */
    public static double reducedGumbelVariate(double quantile) {
        checkNumeric(quantile > 0 && quantile < 1, "quantile " + quantile + " is not in (0, 1)");
        return -Math.log(-Math.log(quantile));
    }

    /**
     * the Fisher-Tippett centering constant for m draws
     */
    public static double centering(int m) {
        checkArgument(m > 1, "at least two draws are required");
        double root = Math.sqrt(2 * Math.log(m));
        return root - (Math.log(Math.log(m)) + Math.log(4 * Math.PI)) / (2 * root);
    }

    /**
     * the Fisher-Tippett scaling constant for m draws
     */
    public static double scaling(int m) {
        checkArgument(m > 1, "at least two draws are required");
        return 1 / Math.sqrt(2 * Math.log(m));
    }

    /**
     * {@code exp(-(t^2 + 2 ln 2 pi) / 2)}
     */
    public static double toDensity(double t) {
        return Math.exp(-(t * t + 2 * LOG_TWO_PI) / 2);
    }

    /**
     * @param m                 number of reference points
     * @param falsePositiveRate target rate, in (0, 1)
     * @param extremeFraction   fraction of extreme batch minima, in (0, 1]
     * @return the density threshold
     */
    public static double threshold(int m, double falsePositiveRate, double extremeFraction) {
        checkNumeric(extremeFraction > 0, "every simulated minimum collapsed to zero, calibration is degenerate");
        double y = reducedGumbelVariate(1 - falsePositiveRate * extremeFraction);
        double t = centering(m) + y * scaling(m);
        double answer = toDensity(t);
        checkNumeric(answer > 0 && Double.isFinite(answer), "threshold " + answer + " is not a positive density");
        return answer;
    }
}
