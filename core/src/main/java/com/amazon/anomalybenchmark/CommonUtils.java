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

package com.amazon.anomalybenchmark;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * Records beyond this count never extend the probationary period.
     */
    public static final int MAX_PROBATIONARY_RECORDS = 5000;

    /**
     * Relative positions beyond this value are scored as the asymptote -1.0.
     */
    public static final double SIGMOID_CUTOFF = 3.0;

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
     * Standard logistic function 1 / (1 + e^-x).
     *
     * @param x input value
     * @return the sigmoid of x
     */
    public static double sigmoid(double x) {
        return 1 / (1 + Math.exp(-x));
    }

    /**
     * Return a scaled sigmoid given a relative position within a labeled window.
     * A relative position of -1.0 is the far left edge of the anomaly window and
     * corresponds to 2 * sigmoid(5) - 1.0 = 0.98661, the earliest detection that
     * counts as a true positive. A position of 0.0 is the right edge of the window
     * and scores 0.0. Positive positions are false positives increasingly far past
     * the right edge; 1.0 scores 2 * sigmoid(-5) - 1.0 = -0.98661.
     *
     * @param relativePositionInWindow relative position of a detection
     * @return the scaled sigmoid score in (-1, 1), or exactly -1.0 for positions
     *         beyond {@link #SIGMOID_CUTOFF}
     */
    public static double scaledSigmoid(double relativePositionInWindow) {
        if (relativePositionInWindow > SIGMOID_CUTOFF) {
            // false positive well behind the window
            return -1.0;
        }
        return 2 * sigmoid(-5 * relativePositionInWindow) - 1.0;
    }

    /**
     * Return the probationary period index given the probation percentage and the
     * length of the data. Data sets longer than {@link #MAX_PROBATIONARY_RECORDS}
     * are treated as if they had exactly that many records.
     *
     * @param probationaryPercent the fraction of records that will not be scored
     * @param fileLength          the number of records
     * @return floor(probationaryPercent * min(fileLength, 5000))
     */
    public static int getProbationPeriod(double probationaryPercent, int fileLength) {
        checkArgument(fileLength >= 0, "fileLength must be non-negative");
        return (int) Math.floor(probationaryPercent * Math.min(fileLength, MAX_PROBATIONARY_RECORDS));
    }
}
