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

import com.amazon.oddstream.density.KernelDensityEstimator;
import com.amazon.oddstream.threshold.ThresholdModel;

/**
 * The seed argument of {@link #toModel} is ignored; the seed used for the
 * calibration is part of the state.
 */
public class ThresholdModelMapper implements IStateMapper<ThresholdModel, ThresholdModelState> {

    @Override
    public ThresholdModel toModel(ThresholdModelState state, long seed) {
        checkNotNull(state, "state cannot be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        KernelDensityEstimator estimate = new KernelDensityEstimator(state.getPoints(), state.getBandwidth());
        return new ThresholdModel(estimate, state.getThreshold(), state.getExtremeFraction(),
                state.getFalsePositiveRate(), state.getTrials(), state.getRandomSeed());
    }

    @Override
    public ThresholdModelState toState(ThresholdModel model) {
        ThresholdModelState state = new ThresholdModelState();
        state.setPoints(model.getDensityEstimate().getPoints());
        state.setBandwidth(model.getBandwidth());
        state.setThreshold(model.getThreshold());
        state.setExtremeFraction(model.getExtremeFraction());
        state.setFalsePositiveRate(model.getFalsePositiveRate());
        state.setTrials(model.getTrials());
        state.setRandomSeed(model.getRandomSeed());
        return state;
    }
}
