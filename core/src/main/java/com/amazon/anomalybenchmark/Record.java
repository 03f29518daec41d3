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

import java.time.LocalDateTime;

import lombok.Getter;
import lombok.ToString;

import com.amazon.anomalybenchmark.returntypes.AlertType;

/**
 * A single classified row of a scored data set. Indices are dense and start at
 * 1.
 */
@Getter
@ToString
public class Record {

    private final int index;
    private final LocalDateTime timestamp;
    private final int label;
    private final AlertType alertType;

    public Record(int index, LocalDateTime timestamp, int label, AlertType alertType) {
        this.index = index;
        this.timestamp = timestamp;
        this.label = label;
        this.alertType = alertType;
    }
}
