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

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkInput;
import static com.amazon.oddstream.CommonUtils.checkNotNull;
import static com.amazon.oddstream.CommonUtils.checkNumeric;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import lombok.Getter;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;

import com.amazon.oddstream.config.ProjectionMethod;
import com.amazon.oddstream.data.FeatureMatrix;

/**
 * Estimates a {@link ProjectionModel} from training features and applies an
 * existing model to new features. Applying a model never re-estimates any of
 * its parameters, so every window is compared in the same coordinate frame.
 */
public class PrincipalComponentProjector {

    public static final int DEFAULT_DIMENSIONS = 2;

    // eigenvalues below this fraction of the largest one make the covariance
    // singular
    public static final double SINGULARITY_TOLERANCE = 1e-10;

    @Getter
    private final int dimensions;

    @Getter
    private final ProjectionMethod method;

    public PrincipalComponentProjector(int dimensions, ProjectionMethod method) {
        checkArgument(dimensions >= 2, "at least two dimensions are required");
        this.dimensions = dimensions;
        this.method = checkNotNull(method, "method cannot be null");
    }

    public PrincipalComponentProjector() {
        this(DEFAULT_DIMENSIONS, ProjectionMethod.ROBUST);
    }

    /**
     * @param features training features; excluded series are ignored
     * @return the model, whose reference coordinates are the projected training
     *         features
     */
    public ProjectionModel fit(FeatureMatrix features) {
        checkNotNull(features, "features cannot be null");
        int d = features.getDimensions();
        checkArgument(dimensions <= d, "cannot project " + d + " features into " + dimensions + " dimensions");
        double[][] rows = features.getIncludedRows();
        int m = rows.length;
        checkInput(m > 0, "every training series is excluded");
        checkInput(m > d, "covariance estimation needs more than " + d + " usable training series, found " + m);

        double[] center = new double[d];
        double[] scale = new double[d];
        for (int j = 0; j < d; j++) {
            double[] column = column(rows, j);
            if (method == ProjectionMethod.ROBUST) {
                center[j] = RobustStatistics.median(column);
                scale[j] = RobustStatistics.mad(column);
            } else {
                center[j] = StatUtils.mean(column);
                scale[j] = Math.sqrt(StatUtils.variance(column));
            }
            checkNumeric(scale[j] > 0 && Double.isFinite(scale[j]),
                    "feature " + features.getFeatureNames().get(j) + " has no spread");
        }

        double[][] standardized = new double[m][d];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < d; j++) {
                standardized[i][j] = (rows[i][j] - center[j]) / scale[j];
            }
        }

        double[][] rotation;
        if (method == ProjectionMethod.ROBUST) {
            checkNonSingular(standardized);
            rotation = RobustStatistics.projectionPursuit(standardized, dimensions);
        } else {
            rotation = principalDirections(standardized);
        }
        normalizeSigns(rotation);

        ProjectionModel partial = new ProjectionModel(center, scale, rotation, new double[0][dimensions], method);
        double[][] reference = new double[m][];
        for (int i = 0; i < m; i++) {
            reference[i] = partial.project(rows[i]);
        }
        return partial.withReferenceCoordinates(reference);
    }

    /**
     * @param features new features, for instance of a window of the stream
     * @param model    an existing model
     * @return the coordinates of the usable series
     */
    public ProjectedFeatures project(FeatureMatrix features, ProjectionModel model) {
        checkNotNull(features, "features cannot be null");
        checkNotNull(model, "model cannot be null");
        checkInput(features.getDimensions() == model.getFeatureDimensions(),
                "features have " + features.getDimensions() + " columns, the model expects "
                        + model.getFeatureDimensions());
        int[] indices = features.getIncludedIndices();
        double[][] coordinates = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            coordinates[i] = model.project(features.getRow(indices[i]));
        }
        return new ProjectedFeatures(indices, coordinates, features.getNumberOfSeries());
    }

    double[][] principalDirections(double[][] standardized) {
        EigenDecomposition decomposition = decompose(standardized);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        Integer[] order = IntStream.range(0, eigenvalues.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> -eigenvalues[i]));
        int d = standardized[0].length;
        double[][] rotation = new double[d][dimensions];
        for (int c = 0; c < dimensions; c++) {
            double[] vector = decomposition.getEigenvector(order[c]).toArray();
            for (int j = 0; j < d; j++) {
                rotation[j][c] = vector[j];
            }
        }
        return rotation;
    }

    void checkNonSingular(double[][] standardized) {
        decompose(standardized);
    }

    private EigenDecomposition decompose(double[][] standardized) {
        RealMatrix covariance = new Covariance(new Array2DRowRealMatrix(standardized, false)).getCovarianceMatrix();
        EigenDecomposition decomposition = new EigenDecomposition(covariance);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        double largest = Arrays.stream(eigenvalues).max().orElse(0);
        double smallest = Arrays.stream(eigenvalues).min().orElse(0);
        checkNumeric(largest > 0 && smallest > SINGULARITY_TOLERANCE * largest,
                "covariance of the standardized features is singular");
        return decomposition;
    }

    // the largest loading of each direction is made positive, so that repeated
    // fits agree on orientation
    static void normalizeSigns(double[][] rotation) {
        int d = rotation.length;
        for (int c = 0; c < rotation[0].length; c++) {
            int largest = 0;
            for (int j = 1; j < d; j++) {
                if (Math.abs(rotation[j][c]) > Math.abs(rotation[largest][c])) {
                    largest = j;
                }
            }
            if (rotation[largest][c] < 0) {
                for (int j = 0; j < d; j++) {
                    rotation[j][c] = -rotation[j][c];
                }
            }
        }
    }

    static double[] column(double[][] rows, int j) {
        double[] answer = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            answer[i] = rows[i][j];
        }
        return answer;
    }
}
