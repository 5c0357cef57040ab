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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class WindowSequenceTest {

    @ParameterizedTest
    @CsvSource({ "1000, 150, 150, 6", "1000, 150, 50, 18", "300, 150, 150, 2", "150, 150, 150, 1",
            "149, 150, 150, 0", "10, 3, 1, 8" })
    public void testSize(int streamLength, int windowLength, int windowSkip, int expected) {
        WindowSequence windows = new WindowSequence(streamLength, windowLength, windowSkip);
        assertEquals(expected, windows.size());
        assertEquals(expected, windows.toList().size());
    }

    @Test
    public void testWindowsCoverStreamInOrder() {
        List<Window> windows = new WindowSequence(1000, 150, 150).toList();
        int expectedStart = 0;
        for (Window window : windows) {
            assertEquals(expectedStart, window.getStart());
            assertEquals(150, window.length());
            expectedStart += 150;
        }
        // the trailing 100 steps do not make a full window
        assertEquals(750, windows.get(windows.size() - 1).getStart());
        assertEquals(900, windows.get(windows.size() - 1).getEnd());
    }

    @Test
    public void testOverlappingWindows() {
        WindowSequence windows = new WindowSequence(20, 10, 5);
        assertEquals(new Window(0, 10), windows.get(0));
        assertEquals(new Window(5, 15), windows.get(1));
        assertEquals(new Window(10, 20), windows.get(2));
        assertThrows(IllegalArgumentException.class, () -> windows.get(3));
    }

    @Test
    public void testIteratorExhaustion() {
        Iterator<Window> iterator = new WindowSequence(5, 5, 1).iterator();
        assertTrue(iterator.hasNext());
        iterator.next();
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new WindowSequence(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new WindowSequence(10, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new WindowSequence(10, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Window(5, 5));
    }
}
