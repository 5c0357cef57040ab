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
import static com.amazon.oddstream.CommonUtils.checkNumeric;
import static com.amazon.oddstream.CommonUtils.copyOf;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import com.amazon.oddstream.NumericInstabilityException;

/**
 * The density of a zero mean multivariate normal distribution with a given
 * covariance, {@code phi_S(u) = (2 pi)^(-d/2) |S|^(-1/2) exp(-u' S^-1 u / 2)}.
 */
public class GaussianKernel {

    private final int dimensions;

    private final double[][] covariance;

    private final double[][] inverse;

    // lower triangular, covariance = L L'
    private final double[][] cholesky;

    private final double normalizer;

    /**
     * @param covariance a symmetric positive definite matrix
     * @throws NumericInstabilityException if the matrix is singular or not
     *                                     positive definite
     */
    public GaussianKernel(double[][] covariance) {
        checkArgument(covariance.length > 0 && covariance.length == covariance[0].length,
                "covariance must be square");
        this.dimensions = covariance.length;
        this.covariance = copyOf(covariance);
        RealMatrix matrix = new Array2DRowRealMatrix(covariance, true);
        CholeskyDecomposition decomposition;
        try {
            decomposition = new CholeskyDecomposition(matrix, 1e-10, 1e-14);
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new NumericInstabilityException("covariance matrix is not positive definite", e);
        }
        double determinant = decomposition.getDeterminant();
        checkNumeric(determinant > 0 && Double.isFinite(determinant), "covariance matrix is singular");
        this.inverse = decomposition.getSolver().getInverse().getData();
        this.cholesky = decomposition.getL().getData();
        this.normalizer = Math.pow(2 * Math.PI, -dimensions / 2.0) / Math.sqrt(determinant);
        checkNumeric(Double.isFinite(normalizer), "kernel normalization is not finite");
    }

    public int getDimensions() {
        return dimensions;
    }

    public double[][] getCovariance() {
        return copyOf(covariance);
    }

    /**
     * @return the lower triangular Cholesky factor of the covariance
     */
    public double[][] getCholeskyFactor() {
        return copyOf(cholesky);
    }

    /**
     * @param u a displacement
     * @return the density at u
     */
    public double density(double[] u) {
        return normalizer * Math.exp(-0.5 * quadraticForm(u));
    }

    /**
     * @return the density at {@code x - y}, without allocating the difference
     */
    public double density(double[] x, double[] y) {
        double sum = 0;
        for (int i = 0; i < dimensions; i++) {
            double row = 0;
            for (int j = 0; j < dimensions; j++) {
                row += inverse[i][j] * (x[j] - y[j]);
            }
            sum += (x[i] - y[i]) * row;
        }
        return normalizer * Math.exp(-0.5 * sum);
    }

    double quadraticForm(double[] u) {
        double sum = 0;
        for (int i = 0; i < dimensions; i++) {
            double row = 0;
            for (int j = 0; j < dimensions; j++) {
                row += inverse[i][j] * u[j];
            }
            sum += u[i] * row;
        }
        return sum;
    }

    /**
     * @param mean     center of the sample
     * @param standard a vector of independent standard normal values
     * @return {@code mean + L standard}, a draw from N(mean, covariance)
     */
    public double[] sample(double[] mean, double[] standard) {
        double[] answer = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            double sum = mean[i];
            for (int j = 0; j <= i; j++) {
                sum += cholesky[i][j] * standard[j];
            }
            answer[i] = sum;
        }
        return answer;
    }
}
