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

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;

import com.amazon.oddstream.config.ProjectionMethod;
import com.amazon.oddstream.projection.ProjectionModel;

public class ProjectionModelMapper implements IStateMapper<ProjectionModel, ProjectionModelState> {

    @Override
    public ProjectionModel toModel(ProjectionModelState state, long seed) {
        checkNotNull(state, "state cannot be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        return new ProjectionModel(state.getCenter(), state.getScale(), state.getRotation(),
                state.getReferenceCoordinates(), ProjectionMethod.valueOf(state.getMethod()));
    }

    @Override
    public ProjectionModelState toState(ProjectionModel model) {
        ProjectionModelState state = new ProjectionModelState();
        state.setMethod(model.getMethod().name());
        state.setCenter(model.getCenter());
        state.setScale(model.getScale());
        state.setRotation(model.getRotation());
        state.setReferenceCoordinates(model.getReferenceCoordinates());
        return state;
    }
}
