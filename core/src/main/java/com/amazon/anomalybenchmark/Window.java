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

import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;
import static com.amazon.anomalybenchmark.CommonUtils.checkState;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

import com.amazon.anomalybenchmark.returntypes.AlertType;

/**
 * A range of records centered around a ground truth anomaly. A window is created
 * once from its limits and the classified records of a data set and never
 * changes afterwards.
 */
@Getter
public class Window {

    private final int id;
    private final LocalDateTime start;
    private final LocalDateTime end;
    private final List<Record> records;
    private final int[] indices;

    /**
     * @param id      identifier of the window, its 1-based position in the list
     *                of limits
     * @param limit   start and end time of the window
     * @param data    all records of the data set, in index order
     */
    public Window(int id, WindowLimit limit, List<Record> data) {
        checkNotNull(limit, "limit must not be null");
        checkNotNull(data, "data must not be null");
        this.id = id;
        this.start = limit.getStart();
        this.end = limit.getEnd();
        this.records = Collections.unmodifiableList(
                data.stream().filter(r -> limit.contains(r.getTimestamp())).collect(Collectors.toList()));
        this.indices = records.stream().mapToInt(Record::getIndex).toArray();
    }

    public int[] getIndices() {
        return indices.clone();
    }

    /**
     * @return the number of records in the window
     */
    public int getLength() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    public int getFirstIndex() {
        checkState(!isEmpty(), "window " + id + " contains no records");
        return indices[0];
    }

    public int getLastIndex() {
        checkState(!isEmpty(), "window " + id + " contains no records");
        return indices[indices.length - 1];
    }

    /**
     * @return the index of the earliest true positive within the window, -1 if
     *         there are none
     */
    public int getFirstTruePositive() {
        for (Record record : records) {
            if (record.getAlertType() == AlertType.TRUE_POSITIVE) {
                return record.getIndex();
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "WINDOW id=" + id + ", limits: [" + start + ", " + end + "], length: " + getLength();
    }
}
