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

/**
 * The classification of a single record. Records inside the probationary period
 * are not classified into any of the four outcomes.
 */
@Getter
public enum AlertType {

    TRUE_POSITIVE("tp"), FALSE_POSITIVE("fp"), TRUE_NEGATIVE("tn"), FALSE_NEGATIVE("fn"),
    PROBATIONARY("probationaryPeriod");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    /**
     * Classifies a scored record. The first letter tells whether the prediction
     * agrees with the label, the second whether the detector fired.
     *
     * @param prediction the detector output, 0 or 1
     * @param label      the ground truth, 0 or 1
     * @return the matching outcome
     */
    public static AlertType of(int prediction, int label) {
        boolean agrees = prediction == label;
        if (prediction != 0) {
            return agrees ? TRUE_POSITIVE : FALSE_POSITIVE;
        }
        return agrees ? TRUE_NEGATIVE : FALSE_NEGATIVE;
    }
}
