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
import static com.amazon.oddstream.CommonUtils.checkNotNull;
import static com.amazon.oddstream.CommonUtils.checkRectangular;
import static com.amazon.oddstream.CommonUtils.copyOf;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.oddstream.config.ProjectionMethod;

/**
 * A fixed linear transform from feature space (D dimensions) to the evaluation
 * space (k dimensions), together with the reference points that define typical
 * behavior in that space. The transform is only ever estimated from training
 * data; a model adapted to drift keeps the transform and replaces the
 * reference points.
 */
public class ProjectionModel {

    private final double[] center;

    private final double[] scale;

    // D x k
    private final double[][] rotation;

    // m x k
    private final double[][] referenceCoordinates;

    @Getter
    private final ProjectionMethod method;

    public ProjectionModel(double[] center, double[] scale, double[][] rotation, double[][] referenceCoordinates,
            ProjectionMethod method) {
        checkNotNull(center, "center cannot be null");
        checkNotNull(scale, "scale cannot be null");
        checkNotNull(rotation, "rotation cannot be null");
        checkNotNull(referenceCoordinates, "reference coordinates cannot be null");
        checkArgument(center.length > 0 && center.length == scale.length, "center and scale must match");
        checkArgument(rotation.length == center.length, "rotation must have one row per feature");
        checkArgument(rotation[0].length > 0, "rotation must have at least one column");
        checkRectangular(rotation, rotation[0].length, "rotation must be rectangular");
        checkRectangular(referenceCoordinates, rotation[0].length,
                "reference coordinates must have one column per rotation column");
        for (double s : scale) {
            checkArgument(s > 0, "scale must be positive");
        }
        this.center = Arrays.copyOf(center, center.length);
        this.scale = Arrays.copyOf(scale, scale.length);
        this.rotation = copyOf(rotation);
        this.referenceCoordinates = copyOf(referenceCoordinates);
        this.method = checkNotNull(method, "method cannot be null");
    }

    /**
     * @return k, the number of dimensions of the evaluation space
     */
    public int getDimensions() {
        return rotation[0].length;
    }

    /**
     * @return D, the number of features
     */
    public int getFeatureDimensions() {
        return center.length;
    }

    public int getReferenceSize() {
        return referenceCoordinates.length;
    }

    public double[] getCenter() {
        return Arrays.copyOf(center, center.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }

    public double[][] getRotation() {
        return copyOf(rotation);
    }

    public double[][] getReferenceCoordinates() {
        return copyOf(referenceCoordinates);
    }

    /**
     * {@code ((features - center) / scale) * rotation}
     *
     * @param features a feature vector of length D
     * @return the coordinates, of length k
     */
    public double[] project(double[] features) {
        checkArgument(features.length == center.length, "incorrect number of features");
        int k = getDimensions();
        double[] answer = new double[k];
        for (int i = 0; i < center.length; i++) {
            double standardized = (features[i] - center[i]) / scale[i];
            for (int j = 0; j < k; j++) {
                answer[j] += standardized * rotation[i][j];
            }
        }
        return answer;
    }

    /**
     * @param referenceCoordinates the new reference points, m x k
     * @return a model with the same transform and the new reference points
     */
    public ProjectionModel withReferenceCoordinates(double[][] referenceCoordinates) {
        return new ProjectionModel(center, scale, rotation, referenceCoordinates, method);
    }
}
