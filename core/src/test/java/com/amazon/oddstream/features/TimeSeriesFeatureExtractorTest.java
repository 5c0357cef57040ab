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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.oddstream.data.FeatureMatrix;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.executor.ParallelTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;
import com.amazon.oddstream.testutils.NormalStreamTestData;

public class TimeSeriesFeatureExtractorTest {

    @Test
    public void testAllMissingSeriesIsExcluded() {
        double[][] data = new NormalStreamTestData().generateTestData(100, 6, 17);
        data = NormalStreamTestData.removeSeries(data, 2);
        FeatureMatrix features = new TimeSeriesFeatureExtractor().extract(new TimeSeriesCollection(data));

        assertEquals(6, features.getNumberOfSeries());
        assertEquals(14, features.getDimensions());
        assertEquals(TimeSeriesFeatureExtractor.FEATURE_NAMES, features.getFeatureNames());
        assertTrue(features.isExcluded(2));
        assertEquals(5, features.getNumberOfIncluded());
    }

    @Test
    public void testConstantSeriesIsExcluded() {
        double[][] data = new NormalStreamTestData().generateTestData(50, 3, 5);
        for (double[] row : data) {
            row[0] = 4.0;
        }
        FeatureMatrix features = new TimeSeriesFeatureExtractor().extract(new TimeSeriesCollection(data));
        assertTrue(features.isExcluded(0));
        assertFalse(features.isExcluded(1));
    }

    @Test
    public void testScatteredMissingValuesAreTolerated() {
        double[][] data = NormalStreamTestData.removeValues(new NormalStreamTestData().generateTestData(150, 8, 3),
                0.05, 4);
        FeatureMatrix features = new TimeSeriesFeatureExtractor().extract(new TimeSeriesCollection(data));
        assertEquals(8, features.getNumberOfIncluded());
    }

    @Test
    public void testInfiniteValuesAreTolerated() {
        double[][] data = new NormalStreamTestData().generateTestData(120, 5, 9);
        data[60][4] = Double.POSITIVE_INFINITY;
        data[10][1] = Double.NEGATIVE_INFINITY;
        FeatureMatrix features = new TimeSeriesFeatureExtractor().extract(new TimeSeriesCollection(data));
        assertEquals(5, features.getNumberOfIncluded());
        for (int j = 0; j < 5; j++) {
            assertTrue(Arrays.stream(features.getRow(j)).allMatch(Double::isFinite));
        }
    }

    @Test
    public void testSequentialAndParallelAgree() {
        double[][] data = new NormalStreamTestData().generateTestData(120, 40, 11);
        TimeSeriesCollection collection = new TimeSeriesCollection(data);
        FeatureMatrix sequential = new TimeSeriesFeatureExtractor(10, new SequentialTaskExecutor())
                .extract(collection);
        FeatureMatrix parallel = new TimeSeriesFeatureExtractor(10, new ParallelTaskExecutor(3)).extract(collection);
        for (int j = 0; j < 40; j++) {
            assertArrayEquals(sequential.getRow(j), parallel.getRow(j));
        }
    }

    @Test
    public void testDescribeMean() {
        double[] x = new double[30];
        for (int i = 0; i < x.length; i++) {
            x[i] = (i % 3) + 1;
        }
        double[] features = new TimeSeriesFeatureExtractor().describe(x);
        assertEquals(14, features.length);
        assertEquals(2.0, features[TimeSeriesFeatureExtractor.FEATURE_NAMES.indexOf("mean")], 1e-9);
        assertEquals(1.0, features[TimeSeriesFeatureExtractor.FEATURE_NAMES.indexOf("minimum")], 1e-9);
        assertEquals(3.0, features[TimeSeriesFeatureExtractor.FEATURE_NAMES.indexOf("maximum")], 1e-9);
    }

    @Test
    public void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> new TimeSeriesFeatureExtractor(1));
    }
}
