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


package com.amazon.oddstream.examples.serialization;

import com.amazon.oddstream.OddStreamDetector;
import com.amazon.oddstream.data.TimeSeriesCollection;
import com.amazon.oddstream.data.Window;
import com.amazon.oddstream.examples.Example;
import com.amazon.oddstream.returntypes.OutlierReport;
import com.amazon.oddstream.state.ModelSnapshot;
import com.amazon.oddstream.state.ModelStateMapper;
import com.amazon.oddstream.streaming.ModelState;
import com.amazon.oddstream.streaming.StreamingEvaluator;
import com.amazon.oddstream.streaming.WindowOutcome;
import com.amazon.oddstream.testutils.MultiSeriesDataWithKey;
import com.amazon.oddstream.testutils.NormalStreamTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize a trained model to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>, restore it, and
 * check that both copies report the same outliers.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a trained reference model as a JSON string";
    }

    @Override
    public void run() throws Exception {
        NormalStreamTestData generator = new NormalStreamTestData();
        TimeSeriesCollection training = new TimeSeriesCollection(generator.generateTestData(200, 60, 3));
        MultiSeriesDataWithKey stream = generator.generateTestDataWithKey(200, 60, 3, 2.5, 0, 200, 4);

        StreamingEvaluator evaluator = OddStreamDetector.builder().randomSeed(9).build().initialize(training);
        ModelState model = evaluator.getModelState();

        ModelStateMapper mapper = new ModelStateMapper();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(model));
        System.out.printf("reference points = %d, threshold = %.4f%n",
                model.getThresholdModel().getDensityEstimate().getSize(), model.getThreshold());
        System.out.printf("JSON size = %d bytes%n", json.getBytes().length);

        ModelState restored = mapper.toModel(jsonMapper.readValue(json, ModelSnapshot.class));

        TimeSeriesCollection data = new TimeSeriesCollection(stream.data);
        Window window = new Window(0, data.getLength());
        WindowOutcome first = evaluator.step(model, data, window);
        WindowOutcome second = evaluator.step(restored, data, window);
        OutlierReport report = first.getReport();

        if (!report.equals(second.getReport())) {
            throw new IllegalStateException("restored model does not agree with the original model");
        }
        System.out.printf("outliers %s%n", report.getOutlierSeriesIndices());
        System.out.println("Looks good!");
    }
}
