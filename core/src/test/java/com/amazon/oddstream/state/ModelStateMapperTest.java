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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.oddstream.config.ProjectionMethod;
import com.amazon.oddstream.projection.ProjectionModel;
import com.amazon.oddstream.streaming.ModelState;
import com.amazon.oddstream.threshold.ThresholdCalibrator;
import com.amazon.oddstream.threshold.ThresholdModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ModelStateMapperTest {

    private ModelState state;

    private ModelStateMapper mapper;

    @BeforeEach
    public void setUp() {
        Random random = new Random(0);
        double[][] reference = new double[40][2];
        for (int i = 0; i < reference.length; i++) {
            reference[i][0] = random.nextGaussian();
            reference[i][1] = random.nextGaussian();
        }
        double[][] rotation = { { 0.6, 0.8 }, { 0.8, -0.6 }, { 0, 0 } };
        ProjectionModel projection = new ProjectionModel(new double[] { 1, 2, 3 }, new double[] { 0.5, 1, 2 },
                rotation, reference, ProjectionMethod.ROBUST);
        ThresholdModel threshold = new ThresholdCalibrator(0.001, 20, 5).calibrate(reference);
        state = new ModelState(projection, threshold).replace(projection, threshold);
        mapper = new ModelStateMapper();
    }

    private void assertStateEquals(ModelState expected, ModelState actual) {
        assertEquals(expected.getGeneration(), actual.getGeneration());
        ProjectionModel first = expected.getProjectionModel();
        ProjectionModel second = actual.getProjectionModel();
        assertEquals(first.getMethod(), second.getMethod());
        assertArrayEquals(first.getCenter(), second.getCenter());
        assertArrayEquals(first.getScale(), second.getScale());
        for (int i = 0; i < first.getFeatureDimensions(); i++) {
            assertArrayEquals(first.getRotation()[i], second.getRotation()[i]);
        }
        for (int i = 0; i < first.getReferenceSize(); i++) {
            assertArrayEquals(first.getReferenceCoordinates()[i], second.getReferenceCoordinates()[i]);
        }
        ThresholdModel one = expected.getThresholdModel();
        ThresholdModel two = actual.getThresholdModel();
        assertEquals(one.getThreshold(), two.getThreshold());
        assertEquals(one.getExtremeFraction(), two.getExtremeFraction());
        assertEquals(one.getTrials(), two.getTrials());
        assertEquals(one.getRandomSeed(), two.getRandomSeed());
        assertArrayEquals(one.getBandwidth()[0], two.getBandwidth()[0]);
        double[] point = { 0.3, -0.7 };
        assertEquals(one.density(point), two.density(point), 1e-15);
    }

    @Test
    public void testRoundTrip() {
        ModelSnapshot snapshot = mapper.toState(state);
        assertEquals(Version.V1_0, snapshot.getVersion());
        assertEquals(1, snapshot.getGeneration());
        assertEquals("ROBUST", snapshot.getProjectionModelState().getMethod());
        assertStateEquals(state, mapper.toModel(snapshot));
    }

    @Test
    public void testJsonRoundTrip() throws JsonProcessingException {
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(state));
        ModelSnapshot snapshot = jsonMapper.readValue(json, ModelSnapshot.class);
        assertStateEquals(state, mapper.toModel(snapshot));
    }

    @Test
    public void testUnsupportedVersion() {
        ModelSnapshot snapshot = mapper.toState(state);
        snapshot.getProjectionModelState().setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(snapshot));
    }
}
