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

package com.amazon.oddstream.density;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.oddstream.NumericInstabilityException;

public class KernelDensityEstimatorTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testStandardKernel() {
        GaussianKernel kernel = new GaussianKernel(new double[][] { { 1, 0 }, { 0, 1 } });
        assertEquals(2, kernel.getDimensions());
        assertEquals(1 / (2 * Math.PI), kernel.density(new double[] { 0, 0 }), EPSILON);
        assertEquals(Math.exp(-0.5) / (2 * Math.PI), kernel.density(new double[] { 1, 0 }), EPSILON);
        assertEquals(kernel.density(new double[] { 0.5, -1.5 }),
                kernel.density(new double[] { 1.5, 0.5 }, new double[] { 1, 2 }), EPSILON);
    }

    @Test
    public void testScaledKernel() {
        GaussianKernel kernel = new GaussianKernel(new double[][] { { 4, 0 }, { 0, 9 } });
        assertEquals(1 / (2 * Math.PI * 6), kernel.density(new double[] { 0, 0 }), EPSILON);
        assertEquals(Math.exp(-1) / (2 * Math.PI * 6), kernel.density(new double[] { 2, 3 }), EPSILON);
        assertArrayEquals(new double[] { 3, 1 }, kernel.sample(new double[] { 1, -2 }, new double[] { 1, 1 }),
                EPSILON);
        assertArrayEquals(new double[] { 2, 0 }, kernel.getCholeskyFactor()[0], EPSILON);
    }

    @Test
    public void testSingularCovariance() {
        assertThrows(NumericInstabilityException.class,
                () -> new GaussianKernel(new double[][] { { 1, 1 }, { 1, 1 } }));
        assertThrows(NumericInstabilityException.class,
                () -> new GaussianKernel(new double[][] { { 1, 0.5 }, { 0, 1 } }));
        assertThrows(IllegalArgumentException.class, () -> new GaussianKernel(new double[][] { { 1, 0 } }));
    }

    @Test
    public void testDensityIsAverageOfKernels() {
        double[][] points = { { 0, 0 }, { 2, 0 } };
        KernelDensityEstimator estimate = new KernelDensityEstimator(points, new double[][] { { 1, 0 }, { 0, 1 } });
        assertEquals(2, estimate.getSize());
        assertEquals(2, estimate.getDimensions());
        double expected = (1 + Math.exp(-2)) / (4 * Math.PI);
        assertEquals(expected, estimate.density(new double[] { 0, 0 }), EPSILON);
        assertEquals(Math.exp(-0.5) / (2 * Math.PI), estimate.density(new double[] { 1, 0 }), EPSILON);

        double[][] queries = { { 0, 0 }, { 1, 0 }, { 10, 10 } };
        double[] densities = estimate.density(queries);
        assertEquals(densities[2], estimate.minimumDensity(queries), 0.0);
    }

    @Test
    public void testPointsAreCopied() {
        double[][] points = { { 0, 0 }, { 2, 0 } };
        KernelDensityEstimator estimate = new KernelDensityEstimator(points, new double[][] { { 1, 0 }, { 0, 1 } });
        points[0][0] = 100;
        assertEquals(0, estimate.getPoints()[0][0]);
        assertThrows(IllegalArgumentException.class,
                () -> new KernelDensityEstimator(new double[][] { { 1, 2, 3 } }, new double[][] { { 1, 0 }, { 0, 1 } }));
    }
}
