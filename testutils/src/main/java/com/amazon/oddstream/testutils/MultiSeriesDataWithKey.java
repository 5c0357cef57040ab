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

package com.amazon.oddstream.testutils;

import java.util.Arrays;

/**
 * A T x N collection of series together with the series that were made
 * anomalous, and the time range of the change.
 */
public class MultiSeriesDataWithKey {

    public double[][] data;
    public int[] changedSeries;
    public int changeStart;
    public int changeEnd;

    public MultiSeriesDataWithKey(double[][] data, int[] changedSeries, int changeStart, int changeEnd) {
        this.data = data;
        this.changedSeries = changedSeries;
        this.changeStart = changeStart;
        this.changeEnd = changeEnd;
    }

    public boolean isChanged(int series) {
        return Arrays.stream(changedSeries).anyMatch(j -> j == series);
    }
}
