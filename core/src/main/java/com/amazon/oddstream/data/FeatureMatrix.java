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

package com.amazon.oddstream.data;

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.oddstream.CommonUtils;

/**
 * One feature vector per series, aligned by series index. Series that cannot
 * be described (all observations missing, or a feature that is not finite) are
 * kept in place and listed in an explicit excluded set rather than dropped.
 */
public class FeatureMatrix {

    private final double[][] values;

    private final BitSet excluded;

    @Getter
    private final List<String> featureNames;

    /**
     * @param values       N x D feature values; rows of excluded series may hold
     *                     anything, including null
     * @param excluded     indices of excluded series
     * @param featureNames names of the D columns
     */
    public FeatureMatrix(double[][] values, BitSet excluded, List<String> featureNames) {
        checkNotNull(values, "values cannot be null");
        checkNotNull(featureNames, "feature names cannot be null");
        checkArgument(values.length > 0, "at least one series is required");
        int dimensions = featureNames.size();
        checkArgument(dimensions > 0, "at least one feature is required");
        this.values = new double[values.length][];
        this.excluded = (excluded == null) ? new BitSet(values.length) : (BitSet) excluded.clone();
        checkArgument(this.excluded.length() <= values.length, "excluded index out of range");
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null || values[i].length != dimensions || !CommonUtils.isFinite(values[i])) {
                this.excluded.set(i);
            }
            if (this.excluded.get(i)) {
                double[] filler = new double[dimensions];
                Arrays.fill(filler, Double.NaN);
                this.values[i] = filler;
            } else {
                this.values[i] = Arrays.copyOf(values[i], dimensions);
            }
        }
        this.featureNames = Collections.unmodifiableList(featureNames);
    }

    /**
     * a matrix without exclusions, rows that are not finite are still excluded
     *
     * @param values       N x D feature values
     * @param featureNames names of the D columns
     */
    public FeatureMatrix(double[][] values, List<String> featureNames) {
        this(values, null, featureNames);
    }

    public int getNumberOfSeries() {
        return values.length;
    }

    public int getDimensions() {
        return featureNames.size();
    }

    public boolean isExcluded(int series) {
        return excluded.get(series);
    }

    public BitSet getExcluded() {
        return (BitSet) excluded.clone();
    }

    public int getNumberOfIncluded() {
        return values.length - excluded.cardinality();
    }

    /**
     * @return indices of the usable series in increasing order
     */
    public int[] getIncludedIndices() {
        int[] answer = new int[getNumberOfIncluded()];
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (!excluded.get(i)) {
                answer[count++] = i;
            }
        }
        return answer;
    }

    /**
     * @return copies of the usable rows, in the order of
     *         {@link #getIncludedIndices()}
     */
    public double[][] getIncludedRows() {
        int[] indices = getIncludedIndices();
        double[][] answer = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            answer[i] = Arrays.copyOf(values[indices[i]], getDimensions());
        }
        return answer;
    }

    public double[] getRow(int series) {
        return Arrays.copyOf(values[series], getDimensions());
    }
}
