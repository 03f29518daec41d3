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
import static com.amazon.anomalybenchmark.CommonUtils.scaledSigmoid;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalybenchmark.config.CostMatrix;
import com.amazon.anomalybenchmark.config.ScoringMode;
import com.amazon.anomalybenchmark.returntypes.AlertType;
import com.amazon.anomalybenchmark.returntypes.ClassificationCounts;
import com.amazon.anomalybenchmark.returntypes.ScoreResult;

/**
 * Scores the predictions of a detector against the anomaly windows of a data
 * set.
 *
 * Every record from the probationary period onwards is classified as a true or
 * false positive or negative. Each window then contributes once: a true positive
 * weighted by how early the first detection falls inside the window, or a false
 * negative penalty. Each false positive contributes a penalty that grows with
 * its distance past the closest preceding window. True negatives contribute
 * nothing.
 *
 * A scorer is created through {@link #builder()}; records are classified and
 * windows built before the constructor returns.
 */
@Slf4j
@Getter
public class Scorer {

    private final List<LocalDateTime> timestamps;
    private final int[] predictions;
    private final int[] labels;
    private final List<WindowLimit> windowLimits;
    private final CostMatrix costMatrix;
    private final ScoringMode scoringMode;

    /**
     * Record index (1-based) below which predictions are not scored.
     */
    private final int probationaryPeriod;

    private final List<Record> records;
    private final List<Window> windows;
    private final ClassificationCounts counts;

    private ScoreResult scoreResult;
    private Double normalizedScore;

    protected Scorer(Builder builder) {
        checkNotNull(builder.timestamps, "timestamps must not be null");
        checkNotNull(builder.predictions, "predictions must not be null");
        checkNotNull(builder.labels, "labels must not be null");
        checkNotNull(builder.windowLimits, "windowLimits must not be null");
        checkNotNull(builder.costMatrix, "costMatrix must not be null");
        checkNotNull(builder.scoringMode, "scoringMode must not be null");
        checkArgument(builder.timestamps.size() == builder.predictions.length,
                String.format("expected %d predictions but found %d", builder.timestamps.size(),
                        builder.predictions.length));
        checkArgument(builder.timestamps.size() == builder.labels.length, String
                .format("expected %d labels but found %d", builder.timestamps.size(), builder.labels.length));
        checkArgument(builder.probationaryPeriod >= 0, "probationaryPeriod must be non-negative");
        checkBinary(builder.predictions, "predictions");
        checkBinary(builder.labels, "labels");

        timestamps = Collections.unmodifiableList(new ArrayList<>(builder.timestamps));
        predictions = builder.predictions.clone();
        labels = builder.labels.clone();
        windowLimits = Collections.unmodifiableList(new ArrayList<>(builder.windowLimits));
        costMatrix = builder.costMatrix;
        scoringMode = builder.scoringMode;
        probationaryPeriod = builder.probationaryPeriod;

        // windows look up alert types, so records are classified first
        Map<AlertType, Integer> tally = new EnumMap<>(AlertType.class);
        records = Collections.unmodifiableList(getAlertTypes(tally));
        counts = new ClassificationCounts(tally.getOrDefault(AlertType.TRUE_POSITIVE, 0),
                tally.getOrDefault(AlertType.FALSE_POSITIVE, 0), tally.getOrDefault(AlertType.TRUE_NEGATIVE, 0),
                tally.getOrDefault(AlertType.FALSE_NEGATIVE, 0));
        windows = Collections.unmodifiableList(createWindows(windowLimits));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void checkBinary(int[] values, String name) {
        for (int value : values) {
            checkArgument(value == 0 || value == 1, name + " must be 0 or 1");
        }
    }

    /**
     * For each record, decide whether it is a tp, fp, tn or fn, and count the
     * records in each category. Records before the probationary period are
     * marked as such and not counted.
     */
    private List<Record> getAlertTypes(Map<AlertType, Integer> tally) {
        List<Record> result = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            int index = i + 1;
            AlertType type;
            if (index < probationaryPeriod) {
                type = AlertType.PROBATIONARY;
            } else {
                type = AlertType.of(predictions[i], labels[i]);
                tally.merge(type, 1, Integer::sum);
            }
            result.add(new Record(index, timestamps.get(i), labels[i], type));
        }
        return result;
    }

    /**
     * Create the windows of the data set, numbered from 1 in the order of their
     * limits.
     */
    private List<Window> createWindows(List<WindowLimit> limits) {
        List<Window> result = new ArrayList<>(limits.size());
        for (int i = 0; i < limits.size(); i++) {
            Window window = new Window(i + 1, limits.get(i), records);
            checkArgument(!window.isEmpty(), String.format("window %s contains no records", limits.get(i)));
            result.add(window);
        }
        return result;
    }

    /**
     * Score the entire data set. The position of a detection within a window is
     * its distance from the end of the window, normalized to [-1, 0], so that
     * -1.0 and 0.0 are the very front and back of the window.
     *
     * @return the score of every record and the total score
     */
    public ScoreResult getScore() {
        double[] scores = new double[records.size()];

        // each window holds either one or more true positives or a single false
        // negative, marked once at the start of the window
        double tpScore = 0;
        double fnScore = 0;
        double maxTP = scaledSigmoid(-1.0);
        for (Window window : windows) {
            int tpIndex = window.getFirstTruePositive();
            if (tpIndex == -1) {
                double thisFN = -costMatrix.getFnWeight();
                scores[window.getFirstIndex() - 1] = thisFN;
                fnScore += thisFN;
            } else {
                double thisTP;
                if (scoringMode == ScoringMode.FLAT) {
                    thisTP = costMatrix.getTpWeight();
                } else {
                    double position = -(window.getLastIndex() - tpIndex + 1) / (double) window.getLength();
                    thisTP = scaledSigmoid(position) * costMatrix.getTpWeight() / maxTP;
                }
                scores[window.getFirstIndex() - 1] = thisTP;
                tpScore += thisTP;
            }
        }

        // each false positive is penalized by its distance from the previous window
        double fpScore = 0;
        for (Record record : records) {
            if (record.getAlertType() != AlertType.FALSE_POSITIVE) {
                continue;
            }
            int index = record.getIndex();
            int windowId = getClosestPrecedingWindow(index);
            double thisFP;
            if (windowId == -1 || scoringMode == ScoringMode.FLAT) {
                thisFP = -costMatrix.getFpWeight();
            } else {
                Window window = windows.get(windowId - 1);
                // a single record window puts every later record at infinity
                double position = Math.abs(window.getLastIndex() - index) / (double) (window.getLength() - 1);
                thisFP = scaledSigmoid(position) * costMatrix.getFpWeight();
            }
            scores[index - 1] = thisFP;
            fpScore += thisFP;
        }

        scoreResult = new ScoreResult(scores, tpScore + fpScore + fnScore);
        return scoreResult;
    }

    /**
     * @return the total score of the last {@link #getScore()} call
     */
    public double getTotalScore() {
        checkState(scoreResult != null, "getScore must be called first");
        return scoreResult.getScore();
    }

    /**
     * Given a record index, find the closest preceding window.
     *
     * @param index a 1-based record index
     * @return the id of the window with the latest end strictly before the index,
     *         -1 if no window precedes it
     */
    public int getClosestPrecedingWindow(int index) {
        int minDistance = Integer.MAX_VALUE;
        int windowId = -1;
        for (Window window : windows) {
            int last = window.getLastIndex();
            if (last < index && index - last < minDistance) {
                minDistance = index - last;
                windowId = window.getId();
            }
        }
        return windowId;
    }

    /**
     * Normalize the score against the null detector, which never detects
     * anything, so that the null detector maps to 0.0 and a perfect detector to
     * 100.0. The perfect score is the count of possible true positives times
     * tpWeight.
     *
     * @return the normalized score, or empty when the perfect and the baseline
     *         scores coincide, as they do when there is nothing to detect
     */
    public OptionalDouble normalizeScore() {
        checkState(scoreResult != null, "getScore must be called before normalizeScore");
        log.info("Running score normalization step");

        Scorer baseline = Scorer.builder().timestamps(timestamps).predictions(new int[predictions.length])
                .labels(labels).windowLimits(windowLimits).costMatrix(costMatrix)
                .probationaryPeriod(probationaryPeriod).scoringMode(scoringMode).build();
        double baselineScore = baseline.getScore().getScore();

        double tpCount = counts.getTruePositives() + counts.getFalseNegatives();
        double perfect = tpCount * costMatrix.getTpWeight();
        if (perfect == baselineScore) {
            log.warn("perfect score equals the baseline score {}, the normalized score is undefined", baselineScore);
            normalizedScore = null;
            return OptionalDouble.empty();
        }
        normalizedScore = 100 * (scoreResult.getScore() - baselineScore) / (perfect - baselineScore);
        return OptionalDouble.of(normalizedScore);
    }

    /**
     * @return the result of the last successful {@link #normalizeScore()} call
     */
    public OptionalDouble getNormalizedScore() {
        return normalizedScore == null ? OptionalDouble.empty() : OptionalDouble.of(normalizedScore);
    }

    public int[] getPredictions() {
        return predictions.clone();
    }

    public int[] getLabels() {
        return labels.clone();
    }

    /**
     * @return the number of records
     */
    public int getLength() {
        return records.size();
    }

    public static class Builder {

        private List<LocalDateTime> timestamps;
        private int[] predictions;
        private int[] labels;
        private List<WindowLimit> windowLimits = Collections.emptyList();
        private CostMatrix costMatrix;
        private int probationaryPeriod = 0;
        private ScoringMode scoringMode = ScoringMode.SCALED_SIGMOID;

        public Builder timestamps(List<LocalDateTime> timestamps) {
            this.timestamps = timestamps;
            return this;
        }

        public Builder predictions(int[] predictions) {
            this.predictions = predictions;
            return this;
        }

        public Builder labels(int[] labels) {
            this.labels = labels;
            return this;
        }

        public Builder windowLimits(List<WindowLimit> windowLimits) {
            this.windowLimits = windowLimits;
            return this;
        }

        public Builder costMatrix(CostMatrix costMatrix) {
            this.costMatrix = costMatrix;
            return this;
        }

        public Builder probationaryPeriod(int probationaryPeriod) {
            this.probationaryPeriod = probationaryPeriod;
            return this;
        }

        public Builder scoringMode(ScoringMode scoringMode) {
            this.scoringMode = scoringMode;
            return this;
        }

        public Scorer build() {
            return new Scorer(this);
        }
    }
}
