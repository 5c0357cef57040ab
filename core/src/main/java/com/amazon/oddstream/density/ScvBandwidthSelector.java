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

import lombok.Getter;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.oddstream.NumericInstabilityException;

/**
 * Selects an unconstrained bandwidth matrix by smoothed cross validation
 * (Duong and Hazelton). The criterion
 *
 * <pre>
 * SCV(H) = n^-1 (4 pi)^(-d/2) |H|^(-1/2)
 *        + n^-2 sum_i sum_j [phi_(2H+2G) - 2 phi_(H+2G) + phi_(2G)](X_i - X_j)
 * </pre>
 *
 * is minimized over positive definite H with a normal scale pilot G. H is
 * written as {@code S^(1/2) A A' S^(1/2)'} with S the sample covariance and A
 * lower triangular, so the search runs in sphered units and always stays
 * positive definite. Both the starting point (the normal reference bandwidth)
 * and the pilot shrink with the sample size.
 */
public class ScvBandwidthSelector {

    private static final Logger LOG = LoggerFactory.getLogger(ScvBandwidthSelector.class);

    public static final int DEFAULT_MAX_EVALUATIONS = 1000;

    public static final double DEFAULT_INITIAL_STEP = 0.2;

    @Getter
    private final int maxEvaluations;

    public ScvBandwidthSelector() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public ScvBandwidthSelector(int maxEvaluations) {
        checkArgument(maxEvaluations > 0, "maxEvaluations must be positive");
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * the factor c of the normal reference bandwidth {@code c S}
     */
    public static double normalReferenceFactor(int n, int d) {
        return Math.pow(4.0 / ((d + 2.0) * n), 2.0 / (d + 4.0));
    }

    /**
     * the factor c of the normal scale pilot {@code G = c S}
     */
    public static double pilotFactor(int n, int d) {
        return Math.pow(4.0 / ((d + 4.0) * n), 2.0 / (d + 6.0));
    }

    /**
     * @param points n x d sample
     * @return the selected d x d bandwidth matrix
     * @throws NumericInstabilityException if the sample covariance is singular
     */
    public double[][] select(double[][] points) {
        checkNotNull(points, "points cannot be null");
        int n = points.length;
        checkArgument(n > 1, "at least two points are required");
        int d = points[0].length;
        checkNumeric(n > d, "bandwidth selection needs more than " + d + " points, found " + n);

        double[][] covariance = new Covariance(new Array2DRowRealMatrix(points, false)).getCovarianceMatrix()
                .getData();
        double[][] root = new GaussianKernel(covariance).getCholeskyFactor();

        double[][] differences = new double[n * (n - 1) / 2][];
        int count = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double[] difference = new double[d];
                for (int l = 0; l < d; l++) {
                    difference[l] = points[i][l] - points[j][l];
                }
                differences[count++] = difference;
            }
        }

        double[][] pilot = new Array2DRowRealMatrix(covariance, false).scalarMultiply(2 * pilotFactor(n, d))
                .getData();
        GaussianKernel pilotKernel = new GaussianKernel(pilot);
        double pilotSum = n * pilotKernel.density(new double[d]);
        for (double[] difference : differences) {
            pilotSum += 2 * pilotKernel.density(difference);
        }
        final double pilotTerm = pilotSum;

        double[] start = new double[d * (d + 1) / 2];
        double diagonal = Math.log(Math.sqrt(normalReferenceFactor(n, d)));
        int position = 0;
        for (int i = 0; i < d; i++) {
            for (int j = 0; j <= i; j++) {
                start[position++] = (i == j) ? diagonal : 0;
            }
        }

        ObjectiveFunction objective = new ObjectiveFunction(parameters -> {
            try {
                double[][] h = toBandwidth(parameters, root, d);
                double value = criterion(h, pilot, differences, n, pilotTerm);
                return Double.isFinite(value) ? value : Double.MAX_VALUE;
            } catch (NumericInstabilityException e) {
                return Double.MAX_VALUE;
            }
        });

        double[] best = start;
        try {
            SimplexOptimizer optimizer = new SimplexOptimizer(1e-8, 1e-12);
            PointValuePair result = optimizer.optimize(new MaxEval(maxEvaluations), objective, GoalType.MINIMIZE,
                    new InitialGuess(start), new NelderMeadSimplex(start.length, DEFAULT_INITIAL_STEP));
            best = result.getPoint();
        } catch (TooManyEvaluationsException e) {
            LOG.warn("smoothed cross validation did not converge in {} evaluations, using the normal reference bandwidth",
                    maxEvaluations);
        }
        double[][] answer = toBandwidth(best, root, d);
        // validates positive definiteness
        new GaussianKernel(answer);
        return answer;
    }

    static double criterion(double[][] h, double[][] pilot, double[][] differences, int n, double pilotTerm) {
        int d = h.length;
        RealMatrix bandwidth = new Array2DRowRealMatrix(h, false);
        RealMatrix pilotMatrix = new Array2DRowRealMatrix(pilot, false);
        GaussianKernel first = new GaussianKernel(bandwidth.scalarMultiply(2).add(pilotMatrix).getData());
        GaussianKernel second = new GaussianKernel(bandwidth.add(pilotMatrix).getData());
        double[] zero = new double[d];
        double sum = n * (first.density(zero) - 2 * second.density(zero));
        for (double[] difference : differences) {
            sum += 2 * (first.density(difference) - 2 * second.density(difference));
        }
        sum += pilotTerm;
        double determinant = new LUDecomposition(bandwidth).getDeterminant();
        checkNumeric(determinant > 0, "bandwidth is singular");
        return Math.pow(4 * Math.PI, -d / 2.0) / (n * Math.sqrt(determinant)) + sum / ((double) n * n);
    }

    static double[][] toBandwidth(double[] parameters, double[][] root, int d) {
        double[][] a = new double[d][d];
        int position = 0;
        for (int i = 0; i < d; i++) {
            for (int j = 0; j <= i; j++) {
                a[i][j] = (i == j) ? Math.exp(parameters[position]) : parameters[position];
                position++;
            }
        }
        // B = root * A, H = B B'
        RealMatrix b = new Array2DRowRealMatrix(root, false).multiply(new Array2DRowRealMatrix(a, false));
        return b.multiply(b.transpose()).getData();
    }
}
