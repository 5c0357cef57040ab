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

package com.amazon.oddstream.projection;

import static com.amazon.oddstream.CommonUtils.checkNumeric;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Outlier resistant location, spread and principal directions.
 */
public class RobustStatistics {

    // makes the median absolute deviation consistent for the normal distribution
    public static final double MAD_CONSISTENCY_FACTOR = 1.4826;

    private RobustStatistics() {
    }

    public static double median(double[] values) {
        return StatUtils.percentile(values, 50);
    }

    /**
     * @param values a sample
     * @return the normalized median absolute deviation
     */
    public static double mad(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return MAD_CONSISTENCY_FACTOR * median(deviations);
    }

    /**
     * Projection pursuit principal components in the manner of Croux and
     * Ruiz-Gazen: every (deflated) observation defines a candidate direction,
     * the candidate with the largest median absolute deviation of the scores is
     * kept, and the data is deflated along it before the next component is
     * sought.
     *
     * @param data       m x D standardized observations
     * @param components number of directions
     * @return D x components matrix of orthonormal directions
     */
    public static double[][] projectionPursuit(double[][] data, int components) {
        int m = data.length;
        int d = data[0].length;
        double[][] current = new double[m][];
        for (int i = 0; i < m; i++) {
            current[i] = Arrays.copyOf(data[i], d);
        }
        double[][] directions = new double[d][components];
        double[] scores = new double[m];
        for (int c = 0; c < components; c++) {
            double bestSpread = 0;
            double[] best = null;
            for (int candidate = 0; candidate < m; candidate++) {
                double norm = Math.sqrt(dot(current[candidate], current[candidate]));
                if (norm < 1e-12) {
                    continue;
                }
                double[] direction = new double[d];
                for (int j = 0; j < d; j++) {
                    direction[j] = current[candidate][j] / norm;
                }
                for (int i = 0; i < m; i++) {
                    scores[i] = dot(current[i], direction);
                }
                double spread = mad(scores);
                if (spread > bestSpread) {
                    bestSpread = spread;
                    best = direction;
                }
            }
            checkNumeric(best != null && bestSpread > 1e-12,
                    "no direction with positive spread remains for component " + (c + 1));
            for (int j = 0; j < d; j++) {
                directions[j][c] = best[j];
            }
            for (int i = 0; i < m; i++) {
                double score = dot(current[i], best);
                for (int j = 0; j < d; j++) {
                    current[i][j] -= score * best[j];
                }
            }
        }
        return directions;
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
