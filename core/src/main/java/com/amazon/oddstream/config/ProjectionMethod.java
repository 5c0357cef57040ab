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

package com.amazon.oddstream.config;

/**
 * Options for estimating the coordinate frame that features are projected
 * into. Training data is meant to be typical, but can contain a few
 * contaminated series; the robust option keeps those from steering the frame.
 */
public enum ProjectionMethod {

    /**
     * column means and standard deviations, followed by an eigen decomposition
     * of the correlation matrix
     */
    CLASSICAL,
    /**
     * column medians and median absolute deviations, followed by projection
     * pursuit of the directions with the largest median absolute deviation
     */
    ROBUST;
}
