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

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.oddstream.projection.ProjectionModel;
import com.amazon.oddstream.threshold.ThresholdModel;

/**
 * The pair of models a window is evaluated against. Instances are immutable;
 * adapting to drift produces a new instance, so a window always reads one
 * consistent pair.
 */
@Getter
public class ModelState {

    private final ProjectionModel projectionModel;

    private final ThresholdModel thresholdModel;

    // 0 for the model built from training data, incremented on every replacement
    private final int generation;

    public ModelState(ProjectionModel projectionModel, ThresholdModel thresholdModel, int generation) {
        this.projectionModel = checkNotNull(projectionModel, "projection model cannot be null");
        this.thresholdModel = checkNotNull(thresholdModel, "threshold model cannot be null");
        checkArgument(projectionModel.getDimensions() == thresholdModel.getDensityEstimate().getDimensions(),
                "projection and threshold models disagree on dimensions");
        checkArgument(generation >= 0, "generation cannot be negative");
        this.generation = generation;
    }

    public ModelState(ProjectionModel projectionModel, ThresholdModel thresholdModel) {
        this(projectionModel, thresholdModel, 0);
    }

    /**
     * @return the next generation of the state, built from the given models
     */
    public ModelState replace(ProjectionModel projectionModel, ThresholdModel thresholdModel) {
        return new ModelState(projectionModel, thresholdModel, generation + 1);
    }

    public double getThreshold() {
        return thresholdModel.getThreshold();
    }
}
