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

package com.amazon.oddstream.features;

import com.amazon.oddstream.data.FeatureMatrix;
import com.amazon.oddstream.data.TimeSeriesCollection;

/**
 * Compresses every series of a collection into a fixed length vector of
 * descriptive statistics. Implementations must be deterministic, must produce
 * the same number of features for every collection, and must mark series that
 * cannot be described as excluded instead of failing.
 */
public interface IFeatureExtractor {

    /**
     * @param collection a T x N collection
     * @return an N x D feature matrix
     */
    FeatureMatrix extract(TimeSeriesCollection collection);
}
