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

import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;
import java.util.stream.IntStream;

import lombok.Getter;

/**
 * An implementation that uses a private thread pool to evaluate the tasks in
 * parallel. The pool is created lazily, so an executor that is never used does
 * not hold threads.
 */
public class ParallelTaskExecutor implements IIndexedTaskExecutor {

    private ForkJoinPool forkJoinPool;

    @Getter
    private final int threadPoolSize;

    public ParallelTaskExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    public ParallelTaskExecutor() {
        this(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
    }

    @Override
    public double[] mapToDouble(int count, IntToDoubleFunction function) {
        checkArgument(count >= 0, "count cannot be negative");
        return submitAndJoin(() -> IntStream.range(0, count).parallel().mapToDouble(function).toArray());
    }

    @Override
    public double[][] mapToArray(int count, IntFunction<double[]> function) {
        checkArgument(count >= 0, "count cannot be negative");
        return submitAndJoin(() -> IntStream.range(0, count).parallel().mapToObj(function).toArray(double[][]::new));
    }

    private synchronized ForkJoinPool getPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return getPool().submit(callable).join();
    }
}
