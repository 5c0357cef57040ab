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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.oddstream.streaming.ModelState;

/**
 * Everything a run over a stream produced: one report per evaluated window, a
 * parallel list of drift diagnostics (null where the model was not replaced),
 * the model in force at the end, and whether the run stopped early because it
 * was cancelled.
 */
@Getter
public class DetectionResult {

    private final List<OutlierReport> reports;

    private final List<DriftDiagnostic> driftDiagnostics;

    private final ModelState finalModelState;

    private final boolean cancelled;

    public DetectionResult(List<OutlierReport> reports, List<DriftDiagnostic> driftDiagnostics,
            ModelState finalModelState, boolean cancelled) {
        this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        this.driftDiagnostics = Collections.unmodifiableList(new ArrayList<>(driftDiagnostics));
        this.finalModelState = finalModelState;
        this.cancelled = cancelled;
    }

    public int getNumberOfWindows() {
        return reports.size();
    }

    public long getNumberOfAdaptations() {
        return driftDiagnostics.stream().filter(d -> d != null).count();
    }
}
