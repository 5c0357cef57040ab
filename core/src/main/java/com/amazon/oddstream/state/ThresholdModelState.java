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

package com.amazon.oddstream.state;

import static com.amazon.oddstream.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * The reference points and the bandwidth are enough to rebuild the density
 * surface; the threshold is stored rather than recalibrated.
 */
@Data
public class ThresholdModelState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private double[][] points;
    private double[][] bandwidth;
    private double threshold;
    private double extremeFraction;
    private double falsePositiveRate;
    private int trials;
    private long randomSeed;
}
