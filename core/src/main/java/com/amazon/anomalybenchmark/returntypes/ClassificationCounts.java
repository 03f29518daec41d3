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

package com.amazon.anomalybenchmark.returntypes;

import static com.amazon.anomalybenchmark.CommonUtils.checkArgument;

import lombok.Data;

/**
 * The number of true positives, false positives, true negatives and false
 * negatives among the records after the probationary period.
 */
@Data
public class ClassificationCounts {

    private final int truePositives;
    private final int falsePositives;
    private final int trueNegatives;
    private final int falseNegatives;

    public ClassificationCounts(int truePositives, int falsePositives, int trueNegatives, int falseNegatives) {
        checkArgument(truePositives >= 0 && falsePositives >= 0 && trueNegatives >= 0 && falseNegatives >= 0,
                "counts must be non-negative");
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.trueNegatives = trueNegatives;
        this.falseNegatives = falseNegatives;
    }

    /**
     * @param alertType one of the four scored outcomes
     * @return the count of that outcome
     */
    public int getCount(AlertType alertType) {
        switch (alertType) {
        case TRUE_POSITIVE:
            return truePositives;
        case FALSE_POSITIVE:
            return falsePositives;
        case TRUE_NEGATIVE:
            return trueNegatives;
        case FALSE_NEGATIVE:
            return falseNegatives;
        default:
            throw new IllegalArgumentException("probationary records are not counted");
        }
    }

    /**
     * @return the number of records that were classified
     */
    public int getTotal() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }
}
