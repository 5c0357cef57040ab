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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.oddstream.config.ProjectionMethod;
import com.amazon.oddstream.projection.ProjectionModel;
import com.amazon.oddstream.threshold.ThresholdModel;

public class ModelStateTest {

    private static final double[][] IDENTITY = { { 1, 0 }, { 0, 1 } };

    private static final double[][] REFERENCE = { { 0, 0 }, { 1, 0 }, { 0, 1 } };

    @Test
    public void testReplaceIncrementsGeneration() {
        ProjectionModel projection = new ProjectionModel(new double[] { 0, 0 }, new double[] { 1, 1 }, IDENTITY,
                REFERENCE, ProjectionMethod.CLASSICAL);
        ThresholdModel threshold = StreamingEvaluatorTest.thresholdModel(REFERENCE, 0.01);
        ModelState state = new ModelState(projection, threshold);
        assertEquals(0, state.getGeneration());
        assertEquals(0.01, state.getThreshold());

        ThresholdModel updated = StreamingEvaluatorTest.thresholdModel(REFERENCE, 0.02);
        ModelState next = state.replace(projection, updated);
        assertEquals(1, next.getGeneration());
        assertSame(updated, next.getThresholdModel());
        // the original is unchanged
        assertEquals(0.01, state.getThreshold());
        assertEquals(2, next.replace(projection, threshold).getGeneration());
    }

    @Test
    public void testDimensionsMustAgree() {
        double[][] rotation = { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };
        ProjectionModel projection = new ProjectionModel(new double[] { 0, 0, 0 }, new double[] { 1, 1, 1 },
                rotation, new double[][] { { 0, 0, 0 } }, ProjectionMethod.ROBUST);
        ThresholdModel threshold = StreamingEvaluatorTest.thresholdModel(REFERENCE, 0.01);
        assertThrows(IllegalArgumentException.class, () -> new ModelState(projection, threshold));
        assertThrows(NullPointerException.class, () -> new ModelState(null, threshold));
    }
}
