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

package com.amazon.oddstream.executor;

import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;

/**
 * Maps a function over the indices {@code 0 .. count - 1}. Implementations may
 * evaluate indices concurrently, but results are always returned in index
 * order, so a task that derives its randomness from its index produces the
 * same output under every implementation.
 */
public interface IIndexedTaskExecutor {

    /**
     * @param count    number of tasks
     * @param function the task for one index
     * @return the results, position i holds the result of task i
     */
    double[] mapToDouble(int count, IntToDoubleFunction function);

    /**
     * @param count    number of tasks
     * @param function the task for one index
     * @return the results, position i holds the result of task i
     */
    double[][] mapToArray(int count, IntFunction<double[]> function);
}
