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

import java.util.Arrays;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Throws an {@link InputException} with the specified message if the
     * specified input is false. Used for fatal problems with the data handed to
     * the detector, as opposed to problems with its configuration.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws InputException if {@code condition} is false.
     */
    public static void checkInput(boolean condition, String message) {
        if (!condition) {
            throw new InputException(message);
        }
    }

    /**
     * Throws a {@link NumericInstabilityException} with the specified message if
     * the specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message.
     * @throws NumericInstabilityException if {@code condition} is false.
     */
    public static void checkNumeric(boolean condition, String message) {
        if (!condition) {
            throw new NumericInstabilityException(message);
        }
    }

    /**
     * @param values an array
     * @return true if every entry is finite
     */
    public static boolean isFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * a deep copy of a rectangular matrix
     *
     * @param matrix input, can be null
     * @return a copy that shares no rows with the input
     */
    public static double[][] copyOf(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        double[][] answer = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            answer[i] = Arrays.copyOf(matrix[i], matrix[i].length);
        }
        return answer;
    }

    /**
     * checks that all rows have the same length
     *
     * @param matrix  input
     * @param columns expected number of columns
     * @param message the error message
     */
    public static void checkRectangular(double[][] matrix, int columns, String message) {
        for (double[] row : matrix) {
            checkArgument(row != null && row.length == columns, message);
        }
    }
}
