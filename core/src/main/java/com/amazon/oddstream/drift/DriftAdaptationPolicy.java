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

package com.amazon.oddstream.drift;

import static com.amazon.oddstream.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * Decides which points of a window take part in a drift test and, when drift
 * is confirmed, become the new reference. If the window has some outliers, but
 * fewer than a fraction of its usable series, the outliers are set aside so
 * that they do not bias the test. Without outliers, or when outliers are the
 * majority (which suggests the reference is stale rather than the window
 * anomalous), the full window is used. The fraction is a heuristic and can be
 * tuned.
 */
public class DriftAdaptationPolicy {

    public static final double DEFAULT_MAJORITY_OUTLIER_FRACTION = 0.5;

    @Getter
    private final double majorityOutlierFraction;

    public DriftAdaptationPolicy() {
        this(DEFAULT_MAJORITY_OUTLIER_FRACTION);
    }

    public DriftAdaptationPolicy(double majorityOutlierFraction) {
        checkArgument(majorityOutlierFraction > 0 && majorityOutlierFraction <= 1,
                "majority outlier fraction must be in (0, 1]");
        this.majorityOutlierFraction = majorityOutlierFraction;
    }

    /**
     * @param outliers number of outliers in the window
     * @param usable   number of usable series in the window
     * @return true if the outliers should be set aside
     */
    public boolean excludeOutliers(int outliers, int usable) {
        return outliers > 0 && outliers < majorityOutlierFraction * usable;
    }

    /**
     * @param coordinates   projected coordinates of the usable series
     * @param seriesIndices series index of each row of coordinates
     * @param outliers      the series flagged in the window
     * @return the rows that take part in the drift test
     */
    public double[][] select(double[][] coordinates, int[] seriesIndices, Set<Integer> outliers) {
        checkArgument(coordinates.length == seriesIndices.length, "one series index per row is required");
        if (!excludeOutliers(outliers.size(), coordinates.length)) {
            return coordinates;
        }
        List<double[]> answer = new ArrayList<>();
        for (int i = 0; i < coordinates.length; i++) {
            if (!outliers.contains(seriesIndices[i])) {
                answer.add(coordinates[i]);
            }
        }
        return answer.toArray(new double[0][]);
    }
}
