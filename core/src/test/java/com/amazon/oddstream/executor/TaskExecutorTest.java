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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

public class TaskExecutorTest {

    private static final int threadPoolSize = 3;

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) throws Exception {
            return Stream.of(new SequentialTaskExecutor(), new ParallelTaskExecutor(threadPoolSize))
                    .map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testMapToDoubleKeepsIndexOrder(IIndexedTaskExecutor executor) {
        double[] answer = executor.mapToDouble(1000, i -> i * 0.5);
        assertEquals(1000, answer.length);
        for (int i = 0; i < 1000; i++) {
            assertEquals(i * 0.5, answer[i], 0.0);
        }
        assertEquals(0, executor.mapToDouble(0, i -> i).length);
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testMapToArrayKeepsIndexOrder(IIndexedTaskExecutor executor) {
        double[][] answer = executor.mapToArray(100, i -> (i % 2 == 0) ? new double[] { i, -i } : null);
        for (int i = 0; i < 100; i++) {
            if (i % 2 == 0) {
                assertArrayEquals(new double[] { i, -i }, answer[i]);
            } else {
                assertNull(answer[i]);
            }
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testExceptionsPropagate(IIndexedTaskExecutor executor) {
        assertThrows(IllegalStateException.class, () -> executor.mapToDouble(10, i -> {
            if (i == 7) {
                throw new IllegalStateException("task failed");
            }
            return i;
        }));
        assertThrows(IllegalArgumentException.class, () -> executor.mapToDouble(-1, i -> i));
    }

    @Test
    public void testThreadPoolSize() {
        assertEquals(threadPoolSize, new ParallelTaskExecutor(threadPoolSize).getThreadPoolSize());
        assertThrows(IllegalArgumentException.class, () -> new ParallelTaskExecutor(0));
    }
}
