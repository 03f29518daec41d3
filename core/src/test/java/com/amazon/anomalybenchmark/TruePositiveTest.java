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

import static com.amazon.anomalybenchmark.TestUtils.UNIT_COSTS;
import static com.amazon.anomalybenchmark.TestUtils.checkCounts;
import static com.amazon.anomalybenchmark.TestUtils.generateLabels;
import static com.amazon.anomalybenchmark.TestUtils.generateTimestamps;
import static com.amazon.anomalybenchmark.TestUtils.generateWindows;
import static com.amazon.anomalybenchmark.TestUtils.indexOf;
import static com.amazon.anomalybenchmark.TestUtils.newScorer;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Scoring of detections that fall inside an anomaly window.
 */
public class TruePositiveTest {

    private static final LocalDateTime START_TIME = LocalDateTime.of(2020, 6, 1, 0, 0);
    private static final Duration INCREMENT = Duration.ofMinutes(5);

    /**
     * The first record within a window scores approximately tpWeight.
     */
    @Test
    public void testFirstTruePositiveWithinWindow() {
        int len = 10;
        int windowSize = 2;
        List<LocalDateTime> timestamps = generateTimestamps(START_TIME, INCREMENT, len);
        List<WindowLimit> windows = generateWindows(timestamps, 1, windowSize);
        int[] labels = generateLabels(timestamps, windows);
        int[] predictions = new int[len];

        predictions[indexOf(timestamps, windows.get(0).getStart()) - 1] = 1;
        Scorer scorer = newScorer(timestamps, predictions, labels, windows, UNIT_COSTS);
        double score = scorer.getScore().getScore();

        assertThat(score, closeTo(UNIT_COSTS.getTpWeight(), 1e-4));
        checkCounts(scorer.getCounts(), len - windowSize, 1, 0, windowSize - 1);
    }

    /**
     * Of two detectors that both hit a window, the earlier one scores higher.
     */
    @Test
    public void testEarlierTruePositiveIsBetter() {
        int len = 10;
        int windowSize = 2;
        List<LocalDateTime> timestamps = generateTimestamps(START_TIME, INCREMENT, len);
        List<WindowLimit> windows = generateWindows(timestamps, 1, windowSize);
        int[] labels = generateLabels(timestamps, windows);

        int[] predictions1 = new int[len];
        predictions1[indexOf(timestamps, windows.get(0).getStart()) - 1] = 1;
        Scorer scorer1 = newScorer(timestamps, predictions1, labels, windows, UNIT_COSTS);
        double score1 = scorer1.getScore().getScore();

        int[] predictions2 = new int[len];
        predictions2[indexOf(timestamps, windows.get(0).getEnd()) - 1] = 1;
        Scorer scorer2 = newScorer(timestamps, predictions2, labels, windows, UNIT_COSTS);
        double score2 = scorer2.getScore().getScore();

        assertTrue(score1 > score2);
        checkCounts(scorer1.getCounts(), len - windowSize, 1, 0, windowSize - 1);
        checkCounts(scorer2.getCounts(), len - windowSize, 1, 0, windowSize - 1);
    }

    @Test
    public void testOnlyScoreFirstTruePositiveWithinWindow() {
        int len = 10;
        int windowSize = 2;
        List<LocalDateTime> timestamps = generateTimestamps(START_TIME, INCREMENT, len);
        List<WindowLimit> windows = generateWindows(timestamps, 1, windowSize);
        int[] labels = generateLabels(timestamps, windows);
        int[] predictions = new int[len];

        predictions[indexOf(timestamps, windows.get(0).getStart()) - 1] = 1;
        Scorer scorer1 = newScorer(timestamps, predictions, labels, windows, UNIT_COSTS);
        double score1 = scorer1.getScore().getScore();

        predictions[indexOf(timestamps, windows.get(0).getEnd()) - 1] = 1;
        Scorer scorer2 = newScorer(timestamps, predictions, labels, windows, UNIT_COSTS);
        double score2 = scorer2.getScore().getScore();

        assertEquals(score1, score2);
        checkCounts(scorer1.getCounts(), len - windowSize, 1, 0, windowSize - 1);
        checkCounts(scorer2.getCounts(), len - windowSize, 2, 0, windowSize - 2);
    }

    /**
     * A detection at the left edge of a window scores the same regardless of the
     * window width.
     */
    @Test
    public void testTruePositivesWithDifferentWindowSizes() {
        int len = 10;
        List<LocalDateTime> timestamps = generateTimestamps(START_TIME, INCREMENT, len);

        int windowSize1 = 2;
        List<WindowLimit> windows1 = generateWindows(timestamps, 1, windowSize1);
        int[] labels1 = generateLabels(timestamps, windows1);
        int[] predictions1 = new int[len];
        predictions1[indexOf(timestamps, windows1.get(0).getStart()) - 1] = 1;

        int windowSize2 = 3;
        List<WindowLimit> windows2 = generateWindows(timestamps, 1, windowSize2);
        int[] labels2 = generateLabels(timestamps, windows2);
        int[] predictions2 = new int[len];
        predictions2[indexOf(timestamps, windows2.get(0).getStart()) - 1] = 1;

        Scorer scorer1 = newScorer(timestamps, predictions1, labels1, windows1, UNIT_COSTS);
        Scorer scorer2 = newScorer(timestamps, predictions2, labels2, windows2, UNIT_COSTS);

        assertEquals(scorer1.getScore().getScore(), scorer2.getScore().getScore());
        checkCounts(scorer1.getCounts(), len - windowSize1, 1, 0, windowSize1 - 1);
        checkCounts(scorer2.getCounts(), len - windowSize2, 1, 0, windowSize2 - 1);
    }

    /**
     * The scaled sigmoid crosses zero between the last record of a window and the
     * record right after it, so a detection at the right edge scores about as much
     * as a false positive just past the window costs.
     */
    @Test
    public void testTruePositiveAtRightEdgeOfWindow() {
        int len = 1000;
        int windowSize = 100;
        List<LocalDateTime> timestamps = generateTimestamps(START_TIME, INCREMENT, len);
        List<WindowLimit> windows = generateWindows(timestamps, 1, windowSize);
        int[] labels = generateLabels(timestamps, windows);
        int[] predictions = new int[len];

        int index = indexOf(timestamps, windows.get(0).getEnd());
        predictions[index - 1] = 1;
        Scorer scorer1 = newScorer(timestamps, predictions, labels, windows, UNIT_COSTS);
        double score1 = scorer1.getScore().getScore();

        predictions[index - 1] = 0;
        predictions[index] = 1;
        Scorer scorer2 = newScorer(timestamps, predictions, labels, windows, UNIT_COSTS);
        double score2 = scorer2.getScore().getScore();

        // the 1 accounts for the missed window in the second run
        assertThat(score1 + score2 + 1, closeTo(0.0, 1e-3));
        checkCounts(scorer1.getCounts(), len - windowSize, 1, 0, windowSize - 1);
        checkCounts(scorer2.getCounts(), len - windowSize - 1, 0, 1, windowSize);
    }
}
