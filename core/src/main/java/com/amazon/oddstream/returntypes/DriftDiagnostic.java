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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Recorded for a window after which the model was replaced because of concept
 * drift.
 */
@Getter
@ToString
@AllArgsConstructor
public class DriftDiagnostic {

    private final double driftPValue;

    private final double driftStatistic;

    private final double updatedThreshold;

    // number of window points that became the new reference
    private final int referenceSize;
}
