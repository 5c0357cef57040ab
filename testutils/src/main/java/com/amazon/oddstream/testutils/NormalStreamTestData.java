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

package com.amazon.oddstream.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates collections of independent normal series laid out as
 * {@code double[time][series]}, optionally with a subset of series scaled by a
 * multiplier over a time range (the anomalous series), with a level change for
 * every series (concept drift), or with missing values.
 */
public class NormalStreamTestData {

    private final double mu;
    private final double sigma;

    public NormalStreamTestData(double mu, double sigma) {
        this.mu = mu;
        this.sigma = sigma;
    }

    public NormalStreamTestData() {
        this(10.0, 3.0);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfSeries, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] result = new double[numberOfRows][numberOfSeries];
        for (int i = 0; i < numberOfRows; i++) {
            fillRow(result[i], dist, mu, sigma);
        }
        return result;
    }

    /**
     * Multiplies {@code numberOfChanged} randomly chosen series by
     * {@code multiplier} over {@code [changeStart, changeEnd)}.
     */
    public MultiSeriesDataWithKey generateTestDataWithKey(int numberOfRows, int numberOfSeries, int numberOfChanged,
            double multiplier, int changeStart, int changeEnd, long seed) {
        double[][] data = generateTestData(numberOfRows, numberOfSeries, seed);
        Random random = new Random(seed + 1);
        int[] order = new int[numberOfSeries];
        for (int j = 0; j < numberOfSeries; j++) {
            order[j] = j;
        }
        for (int j = numberOfSeries - 1; j > 0; j--) {
            int other = random.nextInt(j + 1);
            int tmp = order[j];
            order[j] = order[other];
            order[other] = tmp;
        }
        int[] changed = Arrays.copyOf(order, numberOfChanged);
        Arrays.sort(changed);
        for (int i = changeStart; i < changeEnd; i++) {
            for (int j : changed) {
                data[i][j] *= multiplier;
            }
        }
        return new MultiSeriesDataWithKey(data, changed, changeStart, changeEnd);
    }

    /**
     * Every series switches to {@code N(newMu, newSigma)} from
     * {@code changeTime} on.
     */
    public MultiSeriesDataWithKey generateDriftingData(int numberOfRows, int numberOfSeries, int changeTime,
            double newMu, double newSigma, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] result = new double[numberOfRows][numberOfSeries];
        for (int i = 0; i < numberOfRows; i++) {
            if (i < changeTime) {
                fillRow(result[i], dist, mu, sigma);
            } else {
                fillRow(result[i], dist, newMu, newSigma);
            }
        }
        int[] all = new int[numberOfSeries];
        for (int j = 0; j < numberOfSeries; j++) {
            all[j] = j;
        }
        return new MultiSeriesDataWithKey(result, all, changeTime, numberOfRows);
    }

    /**
     * Replaces each value by NaN with the given probability.
     */
    public static double[][] removeValues(double[][] data, double probability, long seed) {
        Random random = new Random(seed);
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = Arrays.copyOf(data[i], data[i].length);
            for (int j = 0; j < result[i].length; j++) {
                if (random.nextDouble() < probability) {
                    result[i][j] = Double.NaN;
                }
            }
        }
        return result;
    }

    /**
     * Marks every value of a series as missing.
     */
    public static double[][] removeSeries(double[][] data, int series) {
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = Arrays.copyOf(data[i], data[i].length);
            result[i][series] = Double.NaN;
        }
        return result;
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller; u is kept away from 0
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
