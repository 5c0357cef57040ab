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

import static com.amazon.oddstream.CommonUtils.checkNotNull;

import lombok.Getter;
import lombok.Setter;

import com.amazon.oddstream.streaming.ModelState;

/**
 * Converts the model pair a stream is evaluated against to a snapshot, for
 * persistence or for visualizing the reference points and the threshold.
 */
@Getter
@Setter
public class ModelStateMapper implements IStateMapper<ModelState, ModelSnapshot> {

    private ProjectionModelMapper projectionModelMapper = new ProjectionModelMapper();

    private ThresholdModelMapper thresholdModelMapper = new ThresholdModelMapper();

    @Override
    public ModelState toModel(ModelSnapshot snapshot, long seed) {
        checkNotNull(snapshot, "snapshot cannot be null");
        return new ModelState(projectionModelMapper.toModel(snapshot.getProjectionModelState(), seed),
                thresholdModelMapper.toModel(snapshot.getThresholdModelState(), seed), snapshot.getGeneration());
    }

    @Override
    public ModelSnapshot toState(ModelState model) {
        ModelSnapshot snapshot = new ModelSnapshot();
        snapshot.setGeneration(model.getGeneration());
        snapshot.setProjectionModelState(projectionModelMapper.toState(model.getProjectionModel()));
        snapshot.setThresholdModelState(thresholdModelMapper.toState(model.getThresholdModel()));
        return snapshot;
    }
}
