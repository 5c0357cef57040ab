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

package com.amazon.oddstream.streaming;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.oddstream.returntypes.DriftDiagnostic;
import com.amazon.oddstream.returntypes.OutlierReport;

/**
 * The result of one step of the evaluation loop: the state for the next
 * window, the report for this window, and a drift diagnostic when the state
 * was replaced (null otherwise).
 */
@Getter
@AllArgsConstructor
public class WindowOutcome {

    private final ModelState nextState;

    private final OutlierReport report;

    private final DriftDiagnostic driftDiagnostic;

    public boolean isAdapted() {
        return driftDiagnostic != null;
    }
}
