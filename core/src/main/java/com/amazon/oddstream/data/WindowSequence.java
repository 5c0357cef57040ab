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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The full windows of a stream of a given length: starts at {@code 0, skip,
 * 2 * skip, ...} as long as the whole window fits. A trailing partial window is
 * not produced.
 */
public class WindowSequence implements Iterable<Window> {

    private final int streamLength;

    private final int windowLength;

    private final int windowSkip;

    public WindowSequence(int streamLength, int windowLength, int windowSkip) {
        checkArgument(streamLength > 0, "stream length must be positive");
        checkArgument(windowLength > 0, "window length must be positive");
        checkArgument(windowSkip > 0, "window skip must be positive");
        this.streamLength = streamLength;
        this.windowLength = windowLength;
        this.windowSkip = windowSkip;
    }

    /**
     * @return the number of full windows, floor((T - L) / S) + 1 when T >= L
     */
    public int size() {
        if (windowLength > streamLength) {
            return 0;
        }
        return (streamLength - windowLength) / windowSkip + 1;
    }

    public Window get(int index) {
        checkArgument(index >= 0 && index < size(), "no such window");
        int start = index * windowSkip;
        return new Window(start, start + windowLength);
    }

    public List<Window> toList() {
        List<Window> answer = new ArrayList<>(size());
        forEach(answer::add);
        return Collections.unmodifiableList(answer);
    }

    @Override
    public Iterator<Window> iterator() {
        return new Iterator<Window>() {
            int next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public Window next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }
}
