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

import java.time.LocalDateTime;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The start and end time of an anomaly window, both inclusive.
 */
@Getter
@EqualsAndHashCode
public class WindowLimit {

    private final LocalDateTime start;
    private final LocalDateTime end;

    public WindowLimit(LocalDateTime start, LocalDateTime end) {
        checkNotNull(start, "start must not be null");
        checkNotNull(end, "end must not be null");
        checkArgument(!start.isAfter(end), String.format("window start %s is after its end %s", start, end));
        this.start = start;
        this.end = end;
    }

    /**
     * @param timestamp a record time
     * @return true if the timestamp lies within [start, end]
     */
    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    /**
     * @param next a window that starts no earlier than this one
     * @return true if next starts at or before the end of this window
     */
    public boolean overlaps(WindowLimit next) {
        return !next.start.isAfter(end);
    }

    /**
     * @param next a window that overlaps this one
     * @return a single window spanning both
     */
    public WindowLimit merge(WindowLimit next) {
        LocalDateTime mergedEnd = next.end.isAfter(end) ? next.end : end;
        return new WindowLimit(start, mergedEnd);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
