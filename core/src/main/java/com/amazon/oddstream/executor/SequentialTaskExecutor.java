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

import static com.amazon.oddstream.CommonUtils.checkArgument;

import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;

/**
 * Runs the tasks one after another on the calling thread.
 */
public class SequentialTaskExecutor implements IIndexedTaskExecutor {

    @Override
    public double[] mapToDouble(int count, IntToDoubleFunction function) {
        checkArgument(count >= 0, "count cannot be negative");
        double[] answer = new double[count];
        for (int i = 0; i < count; i++) {
            answer[i] = function.applyAsDouble(i);
        }
        return answer;
    }

    @Override
    public double[][] mapToArray(int count, IntFunction<double[]> function) {
        checkArgument(count >= 0, "count cannot be negative");
        double[][] answer = new double[count][];
        for (int i = 0; i < count; i++) {
            answer[i] = function.apply(i);
        }
        return answer;
    }
}
