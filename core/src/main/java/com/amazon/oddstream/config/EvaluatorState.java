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

package com.amazon.oddstream.config;

/**
 * The lifecycle of a streaming evaluator.
 */
public enum EvaluatorState {

    /**
     * consuming the training collection and building the first model
     */
    INITIALIZING,
    /**
     * evaluating windows of the stream against the current model
     */
    STREAMING,
    /**
     * testing a window for concept drift and possibly replacing the model
     */
    ADAPTING,
    /**
     * no full window remains, or the run was cancelled
     */
    DONE;
}
