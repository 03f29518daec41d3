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

import lombok.Getter;
import lombok.ToString;

import com.amazon.anomalybenchmark.Scorer;

/**
 * The outcome of scoring one detector on one data set.
 */
@Getter
@ToString(exclude = "scorer")
public class DataSetScore {

    /**
     * the scorer, which holds the per record scores and can normalize the score
     */
    private final Scorer scorer;

    private final String detectorName;

    /**
     * name of the cost profile, "customized" when the caller supplied the weights
     */
    private final String profileName;

    private final double score;

    // only records after the probationary period are counted
    private final ClassificationCounts counts;

    public DataSetScore(Scorer scorer, String detectorName, String profileName, double score,
            ClassificationCounts counts) {
        this.scorer = scorer;
        this.detectorName = detectorName;
        this.profileName = profileName;
        this.score = score;
        this.counts = counts;
    }
}
