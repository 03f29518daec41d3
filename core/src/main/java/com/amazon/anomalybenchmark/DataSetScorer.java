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
import static com.amazon.anomalybenchmark.CommonUtils.getProbationPeriod;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalybenchmark.config.CostMatrix;
import com.amazon.anomalybenchmark.config.ScoringMode;
import com.amazon.anomalybenchmark.profile.IProfileLookup;
import com.amazon.anomalybenchmark.returntypes.DataSetScore;
import com.amazon.anomalybenchmark.util.DetectionUtils;

/**
 * Computes the benchmark score of a detector on a data set given its true
 * anomalies: the labeler derives the windows, the cost matrix is resolved from
 * a profile or taken from the caller, and a {@link Scorer} does the rest.
 */
@Slf4j
@Getter
public class DataSetScorer {

    public static final String DEFAULT_PROFILE_NAME = "standard";

    public static final String CUSTOMIZED_PROFILE_NAME = "customized";

    private final IProfileLookup profiles;

    private final ScoringMode scoringMode;

    public DataSetScorer(IProfileLookup profiles) {
        this(profiles, ScoringMode.SCALED_SIGMOID);
    }

    public DataSetScorer(IProfileLookup profiles, ScoringMode scoringMode) {
        this.profiles = checkNotNull(profiles, "profiles must not be null");
        this.scoringMode = checkNotNull(scoringMode, "scoringMode must not be null");
    }

    /**
     * Score a detector with the cost matrix of a named profile.
     *
     * @see #scoreDataSet(Labeler, List, List, int[], String, String, Map)
     */
    public DataSetScore scoreDataSet(Labeler labeler, List<LocalDateTime> timestamps,
            List<LocalDateTime> trueAnomalies, int[] predictions, String detectorName, String profileName) {
        return scoreDataSet(labeler, timestamps, trueAnomalies, predictions, detectorName, profileName, null);
    }

    /**
     * Score a detector with a caller supplied cost matrix.
     *
     * @see #scoreDataSet(Labeler, List, List, int[], String, String, Map)
     */
    public DataSetScore scoreDataSet(Labeler labeler, List<LocalDateTime> timestamps,
            List<LocalDateTime> trueAnomalies, int[] predictions, String detectorName,
            Map<String, Double> costMatrix) {
        return scoreDataSet(labeler, timestamps, trueAnomalies, predictions, detectorName, DEFAULT_PROFILE_NAME,
                costMatrix);
    }

    /**
     * Score a detector that emits continuous anomaly scores. A score greater than
     * or equal to the threshold counts as a detection.
     *
     * @see #scoreDataSet(Labeler, List, List, int[], String, String, Map)
     */
    public DataSetScore scoreDataSet(Labeler labeler, List<LocalDateTime> timestamps,
            List<LocalDateTime> trueAnomalies, double[] anomalyScores, double threshold, String detectorName,
            String profileName, Map<String, Double> costMatrix) {
        return scoreDataSet(labeler, timestamps, trueAnomalies,
                DetectionUtils.convertAnomalyScoresToDetections(anomalyScores, threshold), detectorName,
                profileName, costMatrix);
    }

    /**
     * Compute the score of a detector given its predictions, the true anomalies
     * and a cost matrix.
     *
     * @param labeler       derives the anomaly windows; it is fed the data and
     *                      the true anomalies
     * @param timestamps    the timestamp of every record
     * @param trueAnomalies timestamps of the ground truth anomalies
     * @param predictions   1 where the detector flagged a record, 0 otherwise;
     *                      predictions in the probationary period are ignored
     * @param detectorName  the name of the detector
     * @param profileName   the scoring profile supplying the cost matrix when
     *                      none is given
     * @param costMatrix    weights that replace the profile; null or empty to use
     *                      the profile
     * @return the scorer, names, score and counts of the run
     * @throws IllegalArgumentException if the profile does not exist or the cost
     *                                  matrix misses a required weight
     */
    public DataSetScore scoreDataSet(Labeler labeler, List<LocalDateTime> timestamps,
            List<LocalDateTime> trueAnomalies, int[] predictions, String detectorName, String profileName,
            Map<String, Double> costMatrix) {
        checkNotNull(labeler, "labeler must not be null");
        checkNotNull(predictions, "predictions must not be null");

        CostMatrix resolved;
        String resolvedName;
        if (costMatrix == null || costMatrix.isEmpty()) {
            resolved = profiles.lookup(profileName).orElseThrow(() -> new IllegalArgumentException(
                    String.format("profileName %s does not exist in the profile table", profileName)));
            resolvedName = profileName;
        } else {
            resolved = CostMatrix.fromMap(costMatrix);
            resolvedName = CUSTOMIZED_PROFILE_NAME;
        }

        labeler.setData(timestamps);
        labeler.setLabels(trueAnomalies);
        List<WindowLimit> windows = labeler.getWindows();
        int probationaryPeriod = getProbationPeriod(labeler.getProbationaryPercent(), timestamps.size());

        Scorer scorer = Scorer.builder().timestamps(timestamps).predictions(predictions)
                .labels(labeler.getLabels()).windowLimits(windows).costMatrix(resolved)
                .probationaryPeriod(probationaryPeriod).scoringMode(scoringMode).build();
        double score = scorer.getScore().getScore();
        log.debug("detector {} scored {} with profile {} over {} windows", detectorName, score, resolvedName,
                windows.size());
        return new DataSetScore(scorer, detectorName, resolvedName, score, scorer.getCounts());
    }
}
