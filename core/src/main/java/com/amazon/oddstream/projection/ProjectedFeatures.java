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

import static com.amazon.oddstream.CommonUtils.copyOf;

import java.util.Arrays;

import lombok.Getter;

/**
 * The coordinates of the usable series of a feature matrix; row i of the
 * coordinates belongs to series {@code getSeriesIndices()[i]}.
 */
public class ProjectedFeatures {

    private final int[] seriesIndices;

    private final double[][] coordinates;

    @Getter
    private final int numberOfSeries;

    public ProjectedFeatures(int[] seriesIndices, double[][] coordinates, int numberOfSeries) {
        this.seriesIndices = Arrays.copyOf(seriesIndices, seriesIndices.length);
        this.coordinates = copyOf(coordinates);
        this.numberOfSeries = numberOfSeries;
    }

    public int size() {
        return seriesIndices.length;
    }

    public int[] getSeriesIndices() {
        return Arrays.copyOf(seriesIndices, seriesIndices.length);
    }

    public double[][] getCoordinates() {
        return copyOf(coordinates);
    }
}
