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

package com.amazon.oddstream;

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.oddstream.config.ProjectionMethod;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.density.ScvBandwidthSelector;
import com.amazon.oddstream.drift.DriftAdaptationPolicy;
import com.amazon.oddstream.drift.KernelTwoSampleTest;
import com.amazon.oddstream.executor.IIndexedTaskExecutor;
import com.amazon.oddstream.executor.ParallelTaskExecutor;
import com.amazon.oddstream.executor.SequentialTaskExecutor;
import com.amazon.oddstream.features.IFeatureExtractor;
import com.amazon.oddstream.features.TimeSeriesFeatureExtractor;
import com.amazon.oddstream.projection.PrincipalComponentProjector;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.streaming.StreamingEvaluator;
import com.amazon.oddstream.threshold.ThresholdCalibrator;

/**
 * Entry point of the library. A detector holds a validated configuration and
 * creates a fresh {@link StreamingEvaluator} for every training set, so one
 * detector can serve any number of independent streams.
 *
 * <pre>
 * OddStreamDetector detector = OddStreamDetector.builder().windowLength(150).conceptDrift(true).randomSeed(42)
 *         .build();
 * DetectionResult result = detector.detect(training, stream);
 * </pre>
 */
@Getter
public class OddStreamDetector {

    public static final double DEFAULT_FALSE_POSITIVE_RATE = ThresholdCalibrator.DEFAULT_FALSE_POSITIVE_RATE;

    public static final int DEFAULT_TRIALS = ThresholdCalibrator.DEFAULT_TRIALS;

    public static final boolean DEFAULT_CONCEPT_DRIFT = false;

    public static final double DEFAULT_DRIFT_SIGNIFICANCE = StreamingEvaluator.DEFAULT_DRIFT_SIGNIFICANCE;

    public static final boolean DEFAULT_ROBUST = true;

    public static final int DEFAULT_DIMENSIONS = PrincipalComponentProjector.DEFAULT_DIMENSIONS;

    public static final long DEFAULT_RANDOM_SEED = 0L;

    public static final int DEFAULT_FEATURE_WIDTH = TimeSeriesFeatureExtractor.DEFAULT_WIDTH;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    public static final int DEFAULT_PERMUTATIONS = KernelTwoSampleTest.DEFAULT_PERMUTATIONS;

    public static final double DEFAULT_MAJORITY_OUTLIER_FRACTION = DriftAdaptationPolicy.DEFAULT_MAJORITY_OUTLIER_FRACTION;

    private final double falsePositiveRate;

    private final int trials;

    private final Optional<Integer> windowLength;

    private final Optional<Integer> windowSkip;

    private final boolean conceptDrift;

    private final double driftSignificance;

    private final boolean robust;

    private final int dimensions;

    private final long randomSeed;

    private final int featureWidth;

    private final Optional<IFeatureExtractor> featureExtractor;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final int permutations;

    private final double majorityOutlierFraction;

    protected OddStreamDetector(Builder<?> builder) {
        checkArgument(builder.falsePositiveRate > 0 && builder.falsePositiveRate < 1,
                "falsePositiveRate must be in (0, 1)");
        checkArgument(builder.trials > 0, "trials must be greater than 0");
        builder.windowLength.ifPresent(n -> checkArgument(n > 0, "windowLength must be greater than 0"));
        builder.windowSkip.ifPresent(n -> checkArgument(n > 0, "windowSkip must be greater than 0"));
        checkArgument(builder.driftSignificance > 0 && builder.driftSignificance < 1,
                "driftSignificance must be in (0, 1)");
        checkArgument(builder.dimensions >= 2, "dimensions must be at least 2");
        checkArgument(builder.featureWidth > 1, "featureWidth must be at least 2");
        checkArgument(builder.permutations > 0, "permutations must be greater than 0");
        checkArgument(builder.majorityOutlierFraction > 0 && builder.majorityOutlierFraction <= 1,
                "majorityOutlierFraction must be in (0, 1]");
        builder.threadPoolSize.ifPresent(n -> {
            checkArgument(builder.parallelExecutionEnabled,
                    "threadPoolSize can only be set when parallel execution is enabled");
            checkArgument(n > 0, "threadPoolSize must be greater than 0");
        });

        falsePositiveRate = builder.falsePositiveRate;
        trials = builder.trials;
        windowLength = builder.windowLength;
        windowSkip = builder.windowSkip;
        conceptDrift = builder.conceptDrift;
        driftSignificance = builder.driftSignificance;
        robust = builder.robust;
        dimensions = builder.dimensions;
        randomSeed = builder.randomSeed;
        featureWidth = builder.featureWidth;
        featureExtractor = builder.featureExtractor;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize
                .orElse(defaultThreadPoolSize(Runtime.getRuntime().availableProcessors()));
        permutations = builder.permutations;
        majorityOutlierFraction = builder.majorityOutlierFraction;
    }

    /**
     * @return a new builder.
     */
    // one core is left to the caller
    static int defaultThreadPoolSize(int processors) {
        return Math.max(1, processors - 1);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public ProjectionMethod getProjectionMethod() {
        return robust ? ProjectionMethod.ROBUST : ProjectionMethod.CLASSICAL;
    }

    /**
     * Creates an evaluator with its own executor and builds its reference model
     * from the training data.
     *
     * @param training the T x N training collection, assumed free of anomalies
     * @return an evaluator ready for streaming
     */
    public StreamingEvaluator initialize(TimeSeriesCollection training) {
        checkNotNull(training, "training data cannot be null");
        StreamingEvaluator evaluator = newEvaluator();
        evaluator.initialize(training);
        return evaluator;
    }

    /**
     * Initializes on the training data and evaluates every full window of the
     * stream.
     */
    public DetectionResult detect(TimeSeriesCollection training, TimeSeriesCollection stream) {
        return initialize(training).evaluate(stream);
    }

    StreamingEvaluator newEvaluator() {
        IIndexedTaskExecutor executor = parallelExecutionEnabled ? new ParallelTaskExecutor(threadPoolSize)
                : new SequentialTaskExecutor();
        IFeatureExtractor extractor = featureExtractor
                .orElseGet(() -> new TimeSeriesFeatureExtractor(featureWidth, executor));
        PrincipalComponentProjector projector = new PrincipalComponentProjector(dimensions, getProjectionMethod());
        ThresholdCalibrator calibrator = new ThresholdCalibrator(falsePositiveRate, trials, randomSeed, executor,
                new ScvBandwidthSelector());
        KernelTwoSampleTest driftTest = new KernelTwoSampleTest(permutations, randomSeed + 1);
        DriftAdaptationPolicy policy = new DriftAdaptationPolicy(majorityOutlierFraction);
        return new StreamingEvaluator(extractor, projector, calibrator, driftTest, policy, conceptDrift,
                driftSignificance, windowLength, windowSkip);
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when the default
        // depends on the data.

        private double falsePositiveRate = DEFAULT_FALSE_POSITIVE_RATE;
        private int trials = DEFAULT_TRIALS;
        private Optional<Integer> windowLength = Optional.empty();
        private Optional<Integer> windowSkip = Optional.empty();
        private boolean conceptDrift = DEFAULT_CONCEPT_DRIFT;
        private double driftSignificance = DEFAULT_DRIFT_SIGNIFICANCE;
        private boolean robust = DEFAULT_ROBUST;
        private int dimensions = DEFAULT_DIMENSIONS;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private int featureWidth = DEFAULT_FEATURE_WIDTH;
        private Optional<IFeatureExtractor> featureExtractor = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private int permutations = DEFAULT_PERMUTATIONS;
        private double majorityOutlierFraction = DEFAULT_MAJORITY_OUTLIER_FRACTION;

        public T falsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
            return (T) this;
        }

        public T trials(int trials) {
            this.trials = trials;
            return (T) this;
        }

        public T windowLength(int windowLength) {
            this.windowLength = Optional.of(windowLength);
            return (T) this;
        }

        public T windowSkip(int windowSkip) {
            this.windowSkip = Optional.of(windowSkip);
            return (T) this;
        }

        public T conceptDrift(boolean conceptDrift) {
            this.conceptDrift = conceptDrift;
            return (T) this;
        }

        public T driftSignificance(double driftSignificance) {
            this.driftSignificance = driftSignificance;
            return (T) this;
        }

        public T robust(boolean robust) {
            this.robust = robust;
            return (T) this;
        }

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T featureWidth(int featureWidth) {
            this.featureWidth = featureWidth;
            return (T) this;
        }

        public T featureExtractor(IFeatureExtractor featureExtractor) {
            this.featureExtractor = Optional.of(featureExtractor);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T permutations(int permutations) {
            this.permutations = permutations;
            return (T) this;
        }

        public T majorityOutlierFraction(double majorityOutlierFraction) {
            this.majorityOutlierFraction = majorityOutlierFraction;
            return (T) this;
        }

        public OddStreamDetector build() {
            return new OddStreamDetector(this);
        }
    }
}
