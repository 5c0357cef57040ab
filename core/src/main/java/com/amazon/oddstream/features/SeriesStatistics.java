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

import static com.amazon.oddstream.CommonUtils.checkArgument;

import java.util.Arrays;

import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Descriptive statistics of a single series. Missing observations are NaN and
 * are ignored; a statistic that cannot be computed from what remains is NaN.
 */
public class SeriesStatistics {

    public static final double DEFAULT_TREND_BANDWIDTH = 0.75;

    // below these many contiguous observations no trend is fitted
    public static final int MINIMUM_TREND_LENGTH = 4;

    private SeriesStatistics() {
    }

    /**
     * @param x a series
     * @return the observed values, in order
     */
    public static double[] observed(double[] x) {
        return Arrays.stream(x).filter(Double::isFinite).toArray();
    }

    public static double mean(double[] x) {
        double[] values = observed(x);
        return (values.length == 0) ? Double.NaN : StatUtils.mean(values);
    }

    /**
     * @param x a series
     * @return the sample variance (denominator n - 1)
     */
    public static double variance(double[] x) {
        double[] values = observed(x);
        return (values.length < 2) ? Double.NaN : StatUtils.variance(values);
    }

    public static double minimum(double[] x) {
        double[] values = observed(x);
        return (values.length == 0) ? Double.NaN : StatUtils.min(values);
    }

    public static double maximum(double[] x) {
        double[] values = observed(x);
        return (values.length == 0) ? Double.NaN : StatUtils.max(values);
    }

    public static double median(double[] x) {
        double[] values = observed(x);
        return (values.length == 0) ? Double.NaN : StatUtils.percentile(values, 50);
    }

    /**
     * The variance of the variances of consecutive non overlapping blocks of
     * {@code width} observations; a trailing partial block is ignored.
     */
    public static double lumpiness(double[] x, int width) {
        checkArgument(width > 1, "width must be at least 2");
        int blocks = x.length / width;
        double[] variances = new double[blocks];
        for (int i = 0; i < blocks; i++) {
            variances[i] = variance(Arrays.copyOfRange(x, i * width, (i + 1) * width));
        }
        return variance(variances);
    }

    /**
     * rolling means over {@code width} consecutive positions, ignoring missing
     * values inside each window
     */
    public static double[] rollingMean(double[] x, int width) {
        int count = x.length - width + 1;
        double[] answer = new double[Math.max(count, 0)];
        for (int i = 0; i < count; i++) {
            answer[i] = mean(Arrays.copyOfRange(x, i, i + width));
        }
        return answer;
    }

    public static double[] rollingVariance(double[] x, int width) {
        int count = x.length - width + 1;
        double[] answer = new double[Math.max(count, 0)];
        for (int i = 0; i < count; i++) {
            answer[i] = variance(Arrays.copyOfRange(x, i, i + width));
        }
        return answer;
    }

    /**
     * the largest absolute difference between rolling means that are
     * {@code width} positions apart
     */
    public static double levelShift(double[] x, int width) {
        checkArgument(width > 1, "width must be at least 2");
        return maxAbsoluteLaggedDifference(rollingMean(x, width), width);
    }

    /**
     * the largest absolute difference between rolling variances that are
     * {@code width} positions apart
     */
    public static double varianceChange(double[] x, int width) {
        checkArgument(width > 1, "width must be at least 2");
        return maxAbsoluteLaggedDifference(rollingVariance(x, width), width);
    }

    static double maxAbsoluteLaggedDifference(double[] x, int lag) {
        double answer = Double.NaN;
        for (int i = 0; i + lag < x.length; i++) {
            double difference = Math.abs(x[i + lag] - x[i]);
            if (!Double.isNaN(difference) && (Double.isNaN(answer) || difference > answer)) {
                answer = difference;
            }
        }
        return answer;
    }

    /**
     * Fano factor, variance over mean.
     */
    public static double burstiness(double[] x) {
        return variance(x) / mean(x);
    }

    /**
     * ratio of the fully trimmed mean (the median) to the arithmetic mean; values
     * close to zero suggest outlying observations
     */
    public static double meanRatio(double[] x) {
        return median(x) / mean(x);
    }

    /**
     * the raw third moment scaled by the standard deviation
     */
    public static double moment3(double[] x) {
        double[] values = observed(x);
        if (values.length < 2) {
            return Double.NaN;
        }
        double sum = 0;
        for (double value : values) {
            sum += value * value * value;
        }
        return (sum / values.length) / Math.sqrt(StatUtils.variance(values));
    }

    /**
     * compares the mean of the values above the overall mean to the mean of the
     * values below it
     */
    public static double highLowMu(double[] x) {
        double mu = mean(x);
        double[] values = observed(x);
        double[] high = Arrays.stream(values).filter(v -> v > mu).toArray();
        double[] low = Arrays.stream(values).filter(v -> v < mu).toArray();
        if (high.length == 0 || low.length == 0) {
            return Double.NaN;
        }
        return StatUtils.mean(high) - mu / (mu - StatUtils.mean(low));
    }

    /**
     * @param x a series
     * @return the longest run of consecutive observed values
     */
    public static double[] longestContiguous(double[] x) {
        int bestStart = 0;
        int bestLength = 0;
        int start = 0;
        for (int i = 0; i <= x.length; i++) {
            if (i == x.length || !Double.isFinite(x[i])) {
                if (i - start > bestLength) {
                    bestStart = start;
                    bestLength = i - start;
                }
                start = i + 1;
            }
        }
        return Arrays.copyOfRange(x, bestStart, bestStart + bestLength);
    }

    /**
     * Strength of linearity, curvature and spikiness, computed from a LOESS trend
     * of the longest contiguous stretch of observations. Linearity and curvature
     * are the coefficients of the trend on orthonormal polynomials of degree one
     * and two; spikiness is the variance of the leave one out variances of the
     * remainder.
     *
     * @param x a series
     * @return {linearity, curvature, spikiness}
     */
    public static double[] trendFeatures(double[] x) {
        double[] y = longestContiguous(x);
        int n = y.length;
        if (n < MINIMUM_TREND_LENGTH) {
            return new double[] { Double.NaN, Double.NaN, Double.NaN };
        }
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i + 1;
        }
        double bandwidth = Math.max(DEFAULT_TREND_BANDWIDTH, 2.0 / n);
        double[] trend = new LoessInterpolator(bandwidth, 0).smooth(t, y);

        double[] remainder = new double[n];
        for (int i = 0; i < n; i++) {
            remainder[i] = y[i] - trend[i];
        }
        double v = StatUtils.variance(remainder);
        double m = StatUtils.mean(remainder);
        double[] leaveOneOut = new double[n];
        for (int i = 0; i < n; i++) {
            double d = (remainder[i] - m) * (remainder[i] - m);
            leaveOneOut[i] = (v * (n - 1) - d) / (n - 2);
        }
        double spikiness = StatUtils.variance(leaveOneOut);

        double[][] basis = orthonormalPolynomials(n);
        double linearity = dot(basis[0], trend);
        double curvature = dot(basis[1], trend);
        return new double[] { linearity, curvature, spikiness };
    }

    /**
     * orthonormal polynomials of degree one and two over 1..n, each orthogonal to
     * the constant
     */
    static double[][] orthonormalPolynomials(int n) {
        double center = (n + 1) / 2.0;
        double[] first = new double[n];
        double[] second = new double[n];
        for (int i = 0; i < n; i++) {
            first[i] = (i + 1) - center;
            second[i] = first[i] * first[i];
        }
        normalize(first);
        double secondMean = StatUtils.mean(second);
        for (int i = 0; i < n; i++) {
            second[i] -= secondMean;
        }
        double projection = dot(second, first);
        for (int i = 0; i < n; i++) {
            second[i] -= projection * first[i];
        }
        normalize(second);
        return new double[][] { first, second };
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static void normalize(double[] a) {
        double norm = Math.sqrt(dot(a, a));
        if (norm > 0) {
            for (int i = 0; i < a.length; i++) {
                a[i] /= norm;
            }
        }
    }
}
