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

package com.amazon.anomalybenchmark.util;

import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import com.amazon.anomalybenchmark.WindowLimit;

/**
 * Conversions between detector output, detections and labeled windows.
 */
public class DetectionUtils {

    private DetectionUtils() {
    }

    /**
     * Convert anomaly scores to binary detections given a threshold. A score
     * greater than or equal to the threshold is a detection.
     *
     * @param anomalyScores the anomaly score of every record
     * @param threshold     the detection threshold
     * @return 1 for every detection and 0 otherwise
     */
    public static int[] convertAnomalyScoresToDetections(double[] anomalyScores, double threshold) {
        checkNotNull(anomalyScores, "anomalyScores must not be null");
        int[] detections = new int[anomalyScores.length];
        for (int i = 0; i < anomalyScores.length; i++) {
            detections[i] = anomalyScores[i] >= threshold ? 1 : 0;
        }
        return detections;
    }

    /**
     * Expand anomalous windows into every minute they cover, both ends included.
     * Windows are expanded in the order given and the results concatenated.
     *
     * @param anomalousWindows start and end time of every anomalous window
     * @return all anomalous timestamps, one minute apart within a window
     */
    public static List<LocalDateTime> convertAnomalousWindowsToTimestamps(List<WindowLimit> anomalousWindows) {
        checkNotNull(anomalousWindows, "anomalousWindows must not be null");
        List<LocalDateTime> trueAnomalies = new ArrayList<>();
        for (WindowLimit window : anomalousWindows) {
            LocalDateTime time = window.getStart();
            while (!time.isAfter(window.getEnd())) {
                trueAnomalies.add(time);
                time = time.plus(1, ChronoUnit.MINUTES);
            }
        }
        return trueAnomalies;
    }
}
