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

import lombok.Getter;

/**
 * An immutable collection of series observed over the same time steps, stored
 * as {@code values[time][series]}. Entries equal to the missing value marker,
 * and non-finite entries, are treated as missing.
 */
public class TimeSeriesCollection {

    public static final double DEFAULT_MISSING_VALUE = Double.NaN;

    private final double[][] values;

    @Getter
    private final int length;

    @Getter
    private final int numberOfSeries;

    @Getter
    private final double missingValue;

    public TimeSeriesCollection(double[][] values) {
        this(values, DEFAULT_MISSING_VALUE);
    }

    /**
     * @param values       a T x N matrix, one row per time step
     * @param missingValue the marker for a missing observation
     */
    public TimeSeriesCollection(double[][] values, double missingValue) {
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length > 0, "a collection needs at least one time step");
        checkArgument(values[0] != null && values[0].length > 0, "a collection needs at least one series");
        this.length = values.length;
        this.numberOfSeries = values[0].length;
        this.missingValue = missingValue;
        this.values = new double[length][];
        for (int i = 0; i < length; i++) {
            checkArgument(values[i] != null && values[i].length == numberOfSeries,
                    "every time step must have " + numberOfSeries + " values");
            this.values[i] = Arrays.copyOf(values[i], numberOfSeries);
        }
    }

    // rows are already private copies
    private TimeSeriesCollection(double[][] rows, int numberOfSeries, double missingValue) {
        this.values = rows;
        this.length = rows.length;
        this.numberOfSeries = numberOfSeries;
        this.missingValue = missingValue;
    }

    public double get(int time, int series) {
        return values[time][series];
    }

    public boolean isMissing(int time, int series) {
        double value = values[time][series];
        return !Double.isFinite(value) || value == missingValue;
    }

    /**
     * @param series index of the series
     * @return a copy of the series, with missing entries replaced by NaN
     */
    public double[] getSeries(int series) {
        checkArgument(series >= 0 && series < numberOfSeries, "incorrect series index");
        double[] answer = new double[length];
        for (int i = 0; i < length; i++) {
            answer[i] = isMissing(i, series) ? Double.NaN : values[i][series];
        }
        return answer;
    }

    /**
     * @param series index of the series
     * @return true if no value of the series is observed
     */
    public boolean isAllMissing(int series) {
        for (int i = 0; i < length; i++) {
            if (!isMissing(i, series)) {
                return false;
            }
        }
        return true;
    }

    /**
     * the rows in {@code [start, end)}; the rows are shared since neither
     * collection can modify them
     *
     * @param start first time step, inclusive
     * @param end   last time step, exclusive
     * @return a collection over the same series
     */
    public TimeSeriesCollection slice(int start, int end) {
        checkArgument(start >= 0 && start < end && end <= length, "incorrect range [" + start + ", " + end + ")");
        return new TimeSeriesCollection(Arrays.copyOfRange(values, start, end), numberOfSeries, missingValue);
    }

    public TimeSeriesCollection slice(Window window) {
        return slice(window.getStart(), window.getEnd());
    }

    /**
     * @return a copy of the underlying matrix
     */
    public double[][] toArray() {
        double[][] answer = new double[length][];
        for (int i = 0; i < length; i++) {
            answer[i] = Arrays.copyOf(values[i], numberOfSeries);
        }
        return answer;
    }
}
