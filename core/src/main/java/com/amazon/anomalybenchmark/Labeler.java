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

import static com.amazon.anomalybenchmark.CommonUtils.checkArgument;
import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;
import static com.amazon.anomalybenchmark.CommonUtils.checkState;
import static com.amazon.anomalybenchmark.CommonUtils.getProbationPeriod;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives the anomaly windows of a data set from the timestamps of its true
 * anomalies. The labeler is used in stages: {@link #setData(List)}, then
 * {@link #setLabels(Collection)}, then {@link #getWindows()}, which places a
 * window around every anomaly, drops a first window that reaches into the
 * probationary period and merges overlapping windows.
 *
 * Record indices are 1-based throughout.
 */
@Slf4j
@Getter
public class Labeler {

    /**
     * Estimated size of an anomaly window, as a ratio to the data set length.
     */
    private final double windowSize;

    /**
     * The ratio of probationary period to the data set length.
     */
    private final double probationaryPercent;

    private List<LocalDateTime> timestamps;

    private int[] labels = new int[0];

    private List<Integer> labelIndices = Collections.emptyList();

    private List<WindowLimit> windows = new ArrayList<>();

    public Labeler(double windowSize, double probationaryPercent) {
        checkArgument(windowSize >= 0 && windowSize <= 1, "windowSize must be in [0, 1]");
        checkArgument(probationaryPercent >= 0 && probationaryPercent <= 1, "probationaryPercent must be in [0, 1]");
        this.windowSize = windowSize;
        this.probationaryPercent = probationaryPercent;
    }

    /**
     * Sets the data set. Any labels and windows derived from earlier data are
     * discarded.
     *
     * @param timestamps the timestamp of every record, in order
     */
    public void setData(List<LocalDateTime> timestamps) {
        checkNotNull(timestamps, "timestamps must not be null");
        checkArgument(timestamps.stream().allMatch(t -> t != null), "data is missing a timestamp value");
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.labels = new int[0];
        this.labelIndices = Collections.emptyList();
        this.windows = new ArrayList<>();
    }

    /**
     * Labels every record whose timestamp is one of the true anomalies with 1, and
     * every other record with 0.
     *
     * @param trueAnomalies timestamps of the ground truth anomalies
     */
    public void setLabels(Collection<LocalDateTime> trueAnomalies) {
        checkState(timestamps != null, "data must be set before labels");
        checkNotNull(trueAnomalies, "trueAnomalies must not be null");
        Set<LocalDateTime> anomalies = new HashSet<>(trueAnomalies);
        int[] newLabels = new int[timestamps.size()];
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < timestamps.size(); i++) {
            if (anomalies.contains(timestamps.get(i))) {
                newLabels[i] = 1;
                indices.add(i + 1);
            }
        }
        this.labels = newLabels;
        this.labelIndices = Collections.unmodifiableList(indices);
    }

    /**
     * Applies the standard windows and then checks them against the probationary
     * period and against each other.
     *
     * @return the final window limits, in chronological order
     */
    public List<WindowLimit> getWindows() {
        applyWindows();
        checkWindows();
        return Collections.unmodifiableList(new ArrayList<>(windows));
    }

    /**
     * Places a window of standard length centered on every true anomaly. The
     * window length is the windowSize ratio of the data set, shared evenly among
     * the anomalies.
     */
    public void applyWindows() {
        checkState(timestamps != null, "data must be set before windows are applied");
        int length = timestamps.size();
        int count = labelIndices.size();
        int windowLength;
        if (count > 0) {
            windowLength = (int) Math.rint(windowSize * length / count);
        } else {
            windowLength = (int) Math.rint(windowSize * length);
        }

        List<WindowLimit> newWindows = new ArrayList<>(count);
        for (int anomaly : labelIndices) {
            int front = (int) Math.rint(Math.max(anomaly - windowLength / 2.0, 1));
            int back = (int) Math.rint(Math.min(anomaly + windowLength / 2.0, length));
            newWindows.add(new WindowLimit(timestamps.get(front - 1), timestamps.get(back - 1)));
        }
        log.debug("applied {} windows of length {} to {} records", newWindows.size(), windowLength, length);
        this.windows = newWindows;
    }

    /**
     * Deletes the first window if it starts inside the probationary period, then
     * merges every window that starts at or before the end of its predecessor.
     * Merging also happens when there is no probationary period.
     */
    public void checkWindows() {
        checkState(timestamps != null, "data must be set before windows are checked");
        if (windows.isEmpty()) {
            return;
        }

        int probationIndex = getProbationPeriod(probationaryPercent, timestamps.size());
        if (probationIndex > 0) {
            LocalDateTime probationTimestamp = timestamps.get(probationIndex - 1);
            if (windows.get(0).getStart().isBefore(probationTimestamp)) {
                windows.remove(0);
                log.info("The first window overlaps with the probationary period, so we're deleting it.");
            }
        }

        int i = 0;
        while (i < windows.size() - 1) {
            WindowLimit current = windows.get(i);
            WindowLimit next = windows.get(i + 1);
            if (current.overlaps(next)) {
                windows.set(i, current.merge(next));
                windows.remove(i + 1);
            } else {
                i++;
            }
        }
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps == null ? Collections.emptyList() : timestamps;
    }

    public int[] getLabels() {
        return labels.clone();
    }
}
