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

package com.amazon.oddstream.returntypes;

import static com.amazon.oddstream.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.oddstream.data.Window;

/**
 * The outcome of evaluating one full window of the stream: the window range
 * and the (possibly empty) set of outlying series, in increasing order of
 * series index. A report is unreliable when a numeric failure prevented a
 * complete evaluation; its outlier set is then empty or best effort.
 */
@Getter
@ToString
@EqualsAndHashCode
public class OutlierReport {

    private final int windowStart;

    private final int windowEnd;

    private final List<Integer> outlierSeriesIndices;

    private final boolean unreliable;

    private final String failureReason;

    public OutlierReport(int windowStart, int windowEnd, Collection<Integer> outlierSeriesIndices,
            boolean unreliable, String failureReason) {
        checkNotNull(outlierSeriesIndices, "outlier indices cannot be null");
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        List<Integer> sorted = new ArrayList<>(outlierSeriesIndices);
        Collections.sort(sorted);
        this.outlierSeriesIndices = Collections.unmodifiableList(sorted);
        this.unreliable = unreliable;
        this.failureReason = failureReason;
    }

    public OutlierReport(Window window, Collection<Integer> outlierSeriesIndices) {
        this(window.getStart(), window.getEnd(), outlierSeriesIndices, false, null);
    }

    public static OutlierReport unreliable(Window window, String failureReason) {
        return new OutlierReport(window.getStart(), window.getEnd(), Collections.emptyList(), true, failureReason);
    }

    /**
     * @param failureReason what went wrong
     * @return the same outliers, flagged as unreliable
     */
    public OutlierReport markUnreliable(String failureReason) {
        return new OutlierReport(windowStart, windowEnd, outlierSeriesIndices, true, failureReason);
    }

    public boolean hasOutliers() {
        return !outlierSeriesIndices.isEmpty();
    }
}
