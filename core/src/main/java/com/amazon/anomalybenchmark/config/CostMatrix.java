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

package com.amazon.anomalybenchmark.config;

import static com.amazon.anomalybenchmark.CommonUtils.checkArgument;
import static com.amazon.anomalybenchmark.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The weights applied to each outcome when scoring a detector.
 * <ul>
 * <li>tpWeight: detects the anomaly when the anomaly is present</li>
 * <li>fpWeight: detects the anomaly when the anomaly is absent</li>
 * <li>fnWeight: does not detect the anomaly when the anomaly is present</li>
 * <li>tnWeight: does not detect the anomaly when the anomaly is absent; carried
 * along with the profile but never contributes to a score</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public class CostMatrix {

    public static final String TP_WEIGHT = "tpWeight";
    public static final String FP_WEIGHT = "fpWeight";
    public static final String FN_WEIGHT = "fnWeight";
    public static final String TN_WEIGHT = "tnWeight";

    public static final List<String> REQUIRED_KEYS = Arrays.asList(FN_WEIGHT, FP_WEIGHT, TP_WEIGHT);

    private final double tpWeight;
    private final double fpWeight;
    private final double fnWeight;
    private final double tnWeight;

    public CostMatrix(double tpWeight, double fpWeight, double fnWeight, double tnWeight) {
        checkArgument(Double.isFinite(tpWeight) && Double.isFinite(fpWeight) && Double.isFinite(fnWeight)
                && Double.isFinite(tnWeight), "weights must be finite");
        this.tpWeight = tpWeight;
        this.fpWeight = fpWeight;
        this.fnWeight = fnWeight;
        this.tnWeight = tnWeight;
    }

    public CostMatrix(double tpWeight, double fpWeight, double fnWeight) {
        this(tpWeight, fpWeight, fnWeight, 0.0);
    }

    /**
     * Creates a cost matrix from its map form, the shape used by profile files and
     * by callers who customize the weights.
     *
     * @param weights a map that must contain tpWeight, fpWeight and fnWeight, and
     *                may contain tnWeight
     * @return the corresponding cost matrix
     * @throws IllegalArgumentException if a required weight is missing
     */
    public static CostMatrix fromMap(Map<String, ? extends Number> weights) {
        checkNotNull(weights, "weights must not be null");
        List<String> missing = REQUIRED_KEYS.stream().filter(key -> weights.get(key) == null)
                .collect(Collectors.toList());
        checkArgument(missing.isEmpty(), String.format(
                "Please provide %s in your costMatrix. Otherwise, provide the profileName to obtain a costMatrix.",
                String.join(", ", missing)));
        Number tnWeight = weights.get(TN_WEIGHT);
        return new CostMatrix(weights.get(TP_WEIGHT).doubleValue(), weights.get(FP_WEIGHT).doubleValue(),
                weights.get(FN_WEIGHT).doubleValue(), tnWeight == null ? 0.0 : tnWeight.doubleValue());
    }

    /**
     * @return the map form of this cost matrix, including tnWeight
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(TP_WEIGHT, tpWeight);
        map.put(FP_WEIGHT, fpWeight);
        map.put(FN_WEIGHT, fnWeight);
        map.put(TN_WEIGHT, tnWeight);
        return map;
    }

    /**
     * @return a copy of this matrix with the false positive weight replaced
     */
    public CostMatrix withFpWeight(double fpWeight) {
        return new CostMatrix(tpWeight, fpWeight, fnWeight, tnWeight);
    }

    /**
     * @return a copy of this matrix with the false negative weight replaced
     */
    public CostMatrix withFnWeight(double fnWeight) {
        return new CostMatrix(tpWeight, fpWeight, fnWeight, tnWeight);
    }
}
