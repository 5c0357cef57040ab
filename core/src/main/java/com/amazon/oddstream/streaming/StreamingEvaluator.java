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

import static com.amazon.oddstream.CommonUtils.checkArgument;
import static com.amazon.oddstream.CommonUtils.checkInput;
import static com.amazon.oddstream.CommonUtils.checkNotNull;
import static com.amazon.oddstream.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.oddstream.DriftTestException;
import com.amazon.oddstream.InputException;
import com.amazon.oddstream.NumericInstabilityException;
import com.amazon.oddstream.OddStreamException;
import com.amazon.oddstream.config.EvaluatorState;
import com.amazon.oddstream.data.FeatureMatrix;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.data.Window;
import com.amazon.oddstream.data.WindowSequence;
import com.amazon.oddstream.drift.DriftAdaptationPolicy;
import com.amazon.oddstream.drift.DriftTestResult;
import com.amazon.oddstream.drift.IDriftTest;
import com.amazon.oddstream.features.IFeatureExtractor;
import com.amazon.oddstream.projection.PrincipalComponentProjector;
import com.amazon.oddstream.projection.ProjectedFeatures;
import com.amazon.oddstream.projection.ProjectionModel;
import com.amazon.oddstream.returntypes.DetectionResult;
import com.amazon.oddstream.returntypes.DriftDiagnostic;
import com.amazon.oddstream.returntypes.OutlierReport;
import com.amazon.oddstream.threshold.ThresholdCalibrator;
import com.amazon.oddstream.threshold.ThresholdModel;

/**
 * Builds the reference model from training data, then walks a stream window
 * by window and reports the series whose projected features fall in a low
 * density region of the reference. With concept drift enabled, a window whose
 * distribution differs significantly from the reference becomes the new
 * reference.
 *
 * <p>
 * The per window transition is {@link #step}, a function of the current
 * {@link ModelState} and the window only. {@link #evaluate} folds it over the
 * windows of a stream and keeps the resulting state for the next stream. An
 * instance evaluates one stream at a time; independent streams should use
 * independent instances.
 */
public class StreamingEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingEvaluator.class);

    public static final double DEFAULT_DRIFT_SIGNIFICANCE = 0.05;

    private final IFeatureExtractor featureExtractor;

    private final PrincipalComponentProjector projector;

    private final ThresholdCalibrator calibrator;

    private final IDriftTest driftTest;

    private final DriftAdaptationPolicy adaptationPolicy;

    @Getter
    private final boolean conceptDrift;

    @Getter
    private final double driftSignificance;

    // both default to values derived from the training data
    private final Optional<Integer> windowLength;
    private final Optional<Integer> windowSkip;

    @Getter
    private volatile EvaluatorState state = EvaluatorState.INITIALIZING;

    @Getter
    private volatile ModelState modelState;

    private int trainingLength;

    public StreamingEvaluator(IFeatureExtractor featureExtractor, PrincipalComponentProjector projector,
            ThresholdCalibrator calibrator, IDriftTest driftTest, DriftAdaptationPolicy adaptationPolicy,
            boolean conceptDrift, double driftSignificance, Optional<Integer> windowLength,
            Optional<Integer> windowSkip) {
        this.featureExtractor = checkNotNull(featureExtractor, "feature extractor cannot be null");
        this.projector = checkNotNull(projector, "projector cannot be null");
        this.calibrator = checkNotNull(calibrator, "calibrator cannot be null");
        this.driftTest = checkNotNull(driftTest, "drift test cannot be null");
        this.adaptationPolicy = checkNotNull(adaptationPolicy, "adaptation policy cannot be null");
        checkArgument(driftSignificance > 0 && driftSignificance < 1, "drift significance must be in (0, 1)");
        checkNotNull(windowLength, "window length cannot be null, use Optional.empty()");
        checkNotNull(windowSkip, "window skip cannot be null, use Optional.empty()");
        windowLength.ifPresent(length -> checkArgument(length > 0, "window length must be positive"));
        windowSkip.ifPresent(skip -> checkArgument(skip > 0, "window skip must be positive"));
        this.conceptDrift = conceptDrift;
        this.driftSignificance = driftSignificance;
        this.windowLength = windowLength;
        this.windowSkip = windowSkip;
    }

    /**
     * Extracts the training features, fits the projection and calibrates the
     * threshold. Every failure here is fatal.
     *
     * @param training the T x N training collection
     * @return the initial model state
     * @throws InputException             if no training series is usable, there
     *                                     are too few of them or their features
     *                                     cannot be extracted
     * @throws NumericInstabilityException if the projection or the threshold
     *                                     cannot be computed
     */
    public synchronized ModelState initialize(TimeSeriesCollection training) {
        checkNotNull(training, "training data cannot be null");
        checkState(state == EvaluatorState.INITIALIZING, "evaluator is already initialized");
        FeatureMatrix features;
        try {
            features = featureExtractor.extract(training);
        } catch (OddStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InputException("training features could not be extracted: " + e.getMessage(), e);
        }
        checkInput(features.getNumberOfIncluded() > 0, "every training series is missing or has undefined features");
        ProjectionModel projectionModel = projector.fit(features);
        ThresholdModel thresholdModel = calibrator.calibrate(projectionModel.getReferenceCoordinates());
        LOG.info("initialized from {} of {} training series, threshold {}", features.getNumberOfIncluded(),
                training.getNumberOfSeries(), thresholdModel.getThreshold());
        modelState = new ModelState(projectionModel, thresholdModel);
        trainingLength = training.getLength();
        state = EvaluatorState.STREAMING;
        return modelState;
    }

    public DetectionResult evaluate(TimeSeriesCollection stream) {
        return evaluate(stream, () -> false, report -> {
        });
    }

    /**
     * Evaluates every full window of the stream in order. The trailing partial
     * window, if any, is dropped. The model state at the end of the run is kept,
     * so a later call continues from it.
     *
     * @param stream    the T x N stream; N need not match the training collection
     * @param cancelled checked before every window; the run stops when it returns
     *                  true
     * @param sink      receives each report as soon as it is produced
     * @return the reports of the windows evaluated
     */
    public synchronized DetectionResult evaluate(TimeSeriesCollection stream, BooleanSupplier cancelled,
            Consumer<OutlierReport> sink) {
        checkNotNull(stream, "stream cannot be null");
        checkNotNull(cancelled, "cancellation check cannot be null");
        checkNotNull(sink, "sink cannot be null");
        checkState(state != EvaluatorState.INITIALIZING, "evaluator must be initialized first");
        int length = getWindowLength();
        checkInput(length <= stream.getLength(),
                "window length " + length + " exceeds stream length " + stream.getLength());

        state = EvaluatorState.STREAMING;
        WindowSequence windows = new WindowSequence(stream.getLength(), length, getWindowSkip());
        List<OutlierReport> reports = new ArrayList<>(windows.size());
        List<DriftDiagnostic> diagnostics = new ArrayList<>(windows.size());
        boolean stopped = false;
        for (Window window : windows) {
            if (cancelled.getAsBoolean()) {
                LOG.info("cancelled after {} of {} windows", reports.size(), windows.size());
                stopped = true;
                break;
            }
            Detection detection = detect(modelState, stream.slice(window), window);
            WindowOutcome outcome;
            if (conceptDrift && detection.projected != null) {
                state = EvaluatorState.ADAPTING;
                outcome = adapt(modelState, detection.projected, detection.report, window);
                state = EvaluatorState.STREAMING;
            } else {
                outcome = new WindowOutcome(modelState, detection.report, null);
            }
            modelState = outcome.getNextState();
            reports.add(outcome.getReport());
            diagnostics.add(outcome.getDriftDiagnostic());
            sink.accept(outcome.getReport());
        }
        state = EvaluatorState.DONE;
        return new DetectionResult(reports, diagnostics, modelState, stopped);
    }

    /**
     * Evaluates one window against a model state. Numeric failures do not
     * escape: the window gets an unreliable report and the state is kept.
     *
     * @param current    the state to evaluate against
     * @param windowData the observations of the window
     * @param window     the position of the window in the stream
     * @return the report and the state for the next window
     */
    public WindowOutcome step(ModelState current, TimeSeriesCollection windowData, Window window) {
        Detection detection = detect(current, windowData, window);
        if (!conceptDrift || detection.projected == null) {
            return new WindowOutcome(current, detection.report, null);
        }
        return adapt(current, detection.projected, detection.report, window);
    }

    Detection detect(ModelState current, TimeSeriesCollection windowData, Window window) {
        checkNotNull(current, "model state cannot be null");
        checkNotNull(windowData, "window data cannot be null");
        checkNotNull(window, "window cannot be null");

        FeatureMatrix features;
        try {
            features = featureExtractor.extract(windowData);
        } catch (InputException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("features of window {} could not be extracted: {}", window, e.getMessage());
            return new Detection(OutlierReport.unreliable(window, "feature extraction failed: " + e.getMessage()),
                    null);
        }
        try {
            ProjectedFeatures projected = projector.project(features, current.getProjectionModel());
            if (projected.size() == 0) {
                LOG.warn("no usable series in window {}", window);
                return new Detection(OutlierReport.unreliable(window, "no usable series in window"), null);
            }
            OutlierReport report = new OutlierReport(window, findOutliers(current.getThresholdModel(), projected));
            LOG.debug("window {}: {} outliers among {} series", window, report.getOutlierSeriesIndices().size(),
                    projected.size());
            return new Detection(report, projected);
        } catch (NumericInstabilityException e) {
            LOG.warn("window {} could not be evaluated: {}", window, e.getMessage());
            return new Detection(OutlierReport.unreliable(window, e.getMessage()), null);
        }
    }

    List<Integer> findOutliers(ThresholdModel thresholdModel, ProjectedFeatures projected) {
        double[][] coordinates = projected.getCoordinates();
        int[] seriesIndices = projected.getSeriesIndices();
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < coordinates.length; i++) {
            if (thresholdModel.isOutlier(coordinates[i])) {
                outliers.add(seriesIndices[i]);
            }
        }
        return outliers;
    }

    WindowOutcome adapt(ModelState current, ProjectedFeatures projected, OutlierReport report, Window window) {
        double[][] candidate = adaptationPolicy.select(projected.getCoordinates(), projected.getSeriesIndices(),
                new HashSet<>(report.getOutlierSeriesIndices()));
        DriftTestResult result;
        try {
            result = driftTest.test(current.getProjectionModel().getReferenceCoordinates(), candidate);
        } catch (DriftTestException e) {
            LOG.warn("drift test skipped for window {}: {}", window, e.getMessage());
            return new WindowOutcome(current, report, null);
        }
        if (!result.isRejected(driftSignificance)) {
            LOG.debug("no drift in window {}, p-value {}", window, result.getPValue());
            return new WindowOutcome(current, report, null);
        }

        try {
            ProjectionModel projectionModel = current.getProjectionModel().withReferenceCoordinates(candidate);
            ThresholdModel thresholdModel = calibrator.calibrate(candidate);
            ModelState next = current.replace(projectionModel, thresholdModel);
            LOG.info("drift in window {}, p-value {}: reference replaced by {} points, threshold {}", window,
                    result.getPValue(), candidate.length, thresholdModel.getThreshold());
            return new WindowOutcome(next, report, new DriftDiagnostic(result.getPValue(), result.getStatistic(),
                    thresholdModel.getThreshold(), candidate.length));
        } catch (NumericInstabilityException e) {
            LOG.warn("drift in window {} but recalibration failed, keeping the current model: {}", window,
                    e.getMessage());
            return new WindowOutcome(current, report.markUnreliable("recalibration failed: " + e.getMessage()),
                    null);
        }
    }

    public int getWindowLength() {
        checkState(state != EvaluatorState.INITIALIZING, "window length is known after initialization");
        return windowLength.orElse(trainingLength);
    }

    public int getWindowSkip() {
        return windowSkip.orElse(getWindowLength());
    }

    // the report of a window, with the projected points when they were usable
    static class Detection {
        final OutlierReport report;
        final ProjectedFeatures projected;

        Detection(OutlierReport report, ProjectedFeatures projected) {
            this.report = report;
            this.projected = projected;
        }
    }
}
