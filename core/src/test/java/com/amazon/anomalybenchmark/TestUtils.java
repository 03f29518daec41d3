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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.amazon.anomalybenchmark.config.CostMatrix;
import com.amazon.anomalybenchmark.returntypes.ClassificationCounts;

public class TestUtils {
    public static final double EPSILON = 1e-6;

    public static final CostMatrix UNIT_COSTS = new CostMatrix(1.0, 1.0, 1.0, 1.0);

    /**
     * @return len timestamps starting at startTime, increment apart
     */
    public static List<LocalDateTime> generateTimestamps(LocalDateTime startTime, Duration increment, int len) {
        List<LocalDateTime> timestamps = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            timestamps.add(startTime.plus(increment.multipliedBy(i)));
        }
        return timestamps;
    }

    /**
     * Returns numWindows windows roughly evenly spaced through the timestamps.
     * Each window covers windowSize records.
     */
    public static List<WindowLimit> generateWindows(List<LocalDateTime> timestamps, int numWindows, int windowSize) {
        LocalDateTime startTime = timestamps.get(0);
        Duration delta = Duration.between(timestamps.get(0), timestamps.get(1));
        int diff = (int) Math.rint((timestamps.size() - numWindows * windowSize) / (double) (numWindows + 1));
        List<WindowLimit> windows = new ArrayList<>(numWindows);
        for (int i = 1; i <= numWindows; i++) {
            LocalDateTime t1 = startTime.plus(delta.multipliedBy((long) diff * i))
                    .plus(delta.multipliedBy((long) windowSize * (i - 1)));
            LocalDateTime t2 = t1.plus(delta.multipliedBy(windowSize - 1));
            if (!timestamps.contains(t1) || !timestamps.contains(t2)) {
                throw new IllegalStateException("You got the wrong times from the window generator");
            }
            windows.add(new WindowLimit(t1, t2));
        }
        return windows;
    }

    /**
     * @return 1 for every timestamp inside one of the windows, 0 otherwise
     */
    public static int[] generateLabels(List<LocalDateTime> timestamps, List<WindowLimit> windows) {
        int[] labels = new int[timestamps.size()];
        for (WindowLimit window : windows) {
            for (int i = 0; i < timestamps.size(); i++) {
                if (window.contains(timestamps.get(i))) {
                    labels[i] = 1;
                }
            }
        }
        return labels;
    }

    /**
     * @return the 1-based index of the timestamp
     */
    public static int indexOf(List<LocalDateTime> timestamps, LocalDateTime timestamp) {
        return timestamps.indexOf(timestamp) + 1;
    }

    public static Scorer newScorer(List<LocalDateTime> timestamps, int[] predictions, int[] labels,
            List<WindowLimit> windows, CostMatrix costMatrix) {
        return Scorer.builder().timestamps(timestamps).predictions(predictions).labels(labels).windowLimits(windows)
                .costMatrix(costMatrix).probationaryPeriod(0).build();
    }

    /** Ensure the metric counts are correct. */
    public static void checkCounts(ClassificationCounts counts, int tn, int tp, int fp, int fn) {
        assertEquals(tn, counts.getTrueNegatives());
        assertEquals(tp, counts.getTruePositives());
        assertEquals(fp, counts.getFalsePositives());
        assertEquals(fn, counts.getFalseNegatives());
    }
}
