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

package com.amazon.oddstream.features;

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.oddstream.data.FeatureMatrix;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.executor.IIndexedTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;

/**
 * The default feature set: fourteen statistics describing level, spread,
 * structural change, trend shape and tail behavior of a series. Series are
 * described independently of each other, so the work is handed to an executor
 * as a map over series indices.
 */
public class TimeSeriesFeatureExtractor implements IFeatureExtractor {

    public static final int DEFAULT_WIDTH = 10;

    public static final List<String> FEATURE_NAMES = Collections.unmodifiableList(Arrays.asList("mean", "variance",
            "lumpiness", "levelShift", "varianceChange", "linearity", "curvature", "spikiness", "burstiness",
            "minimum", "maximum", "meanRatio", "moment3", "highLowMu"));

    @Getter
    private final int width;

    private final IIndexedTaskExecutor executor;

    public TimeSeriesFeatureExtractor() {
        this(DEFAULT_WIDTH);
    }

    public TimeSeriesFeatureExtractor(int width) {
        this(width, new SequentialTaskExecutor());
    }

    /**
     * @param width    the block size used by lumpiness, level shift and variance
     *                 change
     * @param executor runs the per series computations
     */
    public TimeSeriesFeatureExtractor(int width, IIndexedTaskExecutor executor) {
        checkArgument(width > 1, "width must be at least 2");
        this.width = width;
        this.executor = checkNotNull(executor, "executor cannot be null");
    }

    @Override
    public FeatureMatrix extract(TimeSeriesCollection collection) {
        checkNotNull(collection, "collection cannot be null");
        int numberOfSeries = collection.getNumberOfSeries();
        BitSet excluded = new BitSet(numberOfSeries);
        for (int j = 0; j < numberOfSeries; j++) {
            if (collection.isAllMissing(j)) {
                excluded.set(j);
            }
        }
        double[][] values = executor.mapToArray(numberOfSeries,
                j -> excluded.get(j) ? null : describe(collection.getSeries(j)));
        return new FeatureMatrix(values, excluded, FEATURE_NAMES);
    }

    /**
     * @param x a series with missing values as NaN
     * @return the features in the order of {@link #FEATURE_NAMES}
     */
    public double[] describe(double[] x) {
        double[] trend = SeriesStatistics.trendFeatures(x);
        return new double[] { SeriesStatistics.mean(x), SeriesStatistics.variance(x),
                SeriesStatistics.lumpiness(x, width), SeriesStatistics.levelShift(x, width),
                SeriesStatistics.varianceChange(x, width), trend[0], trend[1], trend[2],
                SeriesStatistics.burstiness(x), SeriesStatistics.minimum(x), SeriesStatistics.maximum(x),
                SeriesStatistics.meanRatio(x), SeriesStatistics.moment3(x), SeriesStatistics.highLowMu(x) };
    }
}
