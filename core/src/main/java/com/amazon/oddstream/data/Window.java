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

package com.amazon.oddstream.data;

import static com.amazon.oddstream.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A contiguous range {@code [start, end)} of time steps of a stream.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Window {

    private final int start;

    private final int end;

    public Window(int start, int end) {
        checkArgument(start >= 0, "start cannot be negative");
        checkArgument(end > start, "a window cannot be empty");
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }
}
