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

package com.amazon.oddstream.density;

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;
import static com.amazon.oddstream.CommonUtils.checkNumeric;
import static com.amazon.oddstream.CommonUtils.checkRectangular;
import static com.amazon.oddstream.CommonUtils.copyOf;

/**
 * A Gaussian kernel density estimate over a fixed set of points with a full
 * bandwidth matrix H, {@code f(x) = (1/m) sum_i phi_H(x - X_i)}. This is the
 * reference density surface of a threshold model.
 */
public class KernelDensityEstimator {

    private final double[][] points;

    private final GaussianKernel kernel;

    public KernelDensityEstimator(double[][] points, double[][] bandwidth) {
        checkNotNull(points, "points cannot be null");
        checkNotNull(bandwidth, "bandwidth cannot be null");
        checkArgument(points.length > 0, "at least one point is required");
        checkRectangular(points, bandwidth.length, "points must have one coordinate per bandwidth row");
        this.points = copyOf(points);
        this.kernel = new GaussianKernel(bandwidth);
    }

    public int getDimensions() {
        return kernel.getDimensions();
    }

    public int getSize() {
        return points.length;
    }

    public double[][] getPoints() {
        return copyOf(points);
    }

    public double[][] getBandwidth() {
        return kernel.getCovariance();
    }

    public GaussianKernel getKernel() {
        return kernel;
    }

    /**
     * @param x a point of the evaluation space
     * @return the estimated density at x
     */
    public double density(double[] x) {
        checkArgument(x.length == kernel.getDimensions(), "incorrect dimension");
        double sum = 0;
        for (double[] point : points) {
            sum += kernel.density(x, point);
        }
        double answer = sum / points.length;
        checkNumeric(Double.isFinite(answer), "density estimate is not finite");
        return answer;
    }

    /**
     * @param xs points of the evaluation space
     * @return the estimated densities, in order
     */
    public double[] density(double[][] xs) {
        double[] answer = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
            answer[i] = density(xs[i]);
        }
        return answer;
    }

    /**
     * @param xs points of the evaluation space
     * @return the smallest density among the points
     */
    public double minimumDensity(double[][] xs) {
        double answer = Double.MAX_VALUE;
        for (double[] x : xs) {
            answer = Math.min(answer, density(x));
        }
        return answer;
    }
}
