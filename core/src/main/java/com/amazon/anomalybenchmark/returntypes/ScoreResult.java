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

import java.util.Arrays;

import lombok.Getter;

/**
 * The score contribution of every record, together with their sum.
 */
@Getter
public class ScoreResult {

    // non-zero only at the first record of each window and at false positives
    private final double[] scores;

    private final double score;

    public ScoreResult(double[] scores, double score) {
        this.scores = Arrays.copyOf(scores, scores.length);
        this.score = score;
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }
}
